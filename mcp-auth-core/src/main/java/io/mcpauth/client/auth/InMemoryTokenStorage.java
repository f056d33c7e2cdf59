/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.mcpauth.client.auth;

import java.util.concurrent.CompletableFuture;

import io.mcpauth.auth.OAuthClientInformation;
import io.mcpauth.auth.OAuthToken;

/**
 * In-memory implementation of TokenStorage. Contents are lost when the process exits.
 */
public class InMemoryTokenStorage implements TokenStorage {

	private volatile OAuthToken tokens;

	private volatile OAuthClientInformation clientInfo;

	@Override
	public CompletableFuture<OAuthToken> getTokens() {
		return CompletableFuture.completedFuture(tokens);
	}

	@Override
	public CompletableFuture<Void> setTokens(OAuthToken tokens) {
		this.tokens = tokens;
		return CompletableFuture.completedFuture(null);
	}

	@Override
	public CompletableFuture<OAuthClientInformation> getClientInfo() {
		return CompletableFuture.completedFuture(clientInfo);
	}

	@Override
	public CompletableFuture<Void> setClientInfo(OAuthClientInformation clientInfo) {
		this.clientInfo = clientInfo;
		return CompletableFuture.completedFuture(null);
	}

}
