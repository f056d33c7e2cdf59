/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.mcpauth.server.auth.verifier;

import java.util.concurrent.CompletableFuture;

import io.mcpauth.auth.AccessToken;

/**
 * Verifies bearer tokens presented to a protected resource.
 * <p>
 * Implementations either complete with a fully verified {@link AccessToken} or fail with
 * an {@link io.mcpauth.auth.exception.AuthException} whose outcome is
 * {@link io.mcpauth.auth.exception.AuthError.Outcome#UNAUTHORIZED}. There is no partially
 * trusted result.
 */
@FunctionalInterface
public interface TokenVerifier {

	/**
	 * Verify a bearer token.
	 * @param token the raw token, without the {@code Bearer} prefix
	 * @return a future completing with the verified token
	 */
	CompletableFuture<AccessToken> verify(String token);

}
