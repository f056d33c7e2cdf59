/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.mcpauth.client.auth;

import java.util.concurrent.CompletableFuture;

import io.mcpauth.auth.OAuthClientInformation;
import io.mcpauth.auth.OAuthToken;

/**
 * Interface for token storage implementations.
 */
public interface TokenStorage {

	/**
	 * Get stored tokens.
	 * @return A CompletableFuture that resolves to the stored tokens, or null if none
	 * exist.
	 */
	CompletableFuture<OAuthToken> getTokens();

	/**
	 * Store tokens.
	 * @param tokens The tokens to store.
	 * @return A CompletableFuture that completes when the tokens are stored.
	 */
	CompletableFuture<Void> setTokens(OAuthToken tokens);

	CompletableFuture<OAuthClientInformation> getClientInfo();

	CompletableFuture<Void> setClientInfo(OAuthClientInformation clientInfo);

}
