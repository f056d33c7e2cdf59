/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.mcpauth.server.auth.middleware;

import java.time.Clock;
import java.util.concurrent.CompletableFuture;

import io.mcpauth.auth.exception.AuthError;
import io.mcpauth.auth.exception.AuthException;
import io.mcpauth.server.auth.verifier.TokenVerifier;
import io.mcpauth.util.Assert;

/**
 * Authenticator for OAuth bearer tokens: extracts the token from the Authorization
 * header, verifies it and enforces the required scopes.
 */
public class BearerAuthenticator {

	private static final String BEARER_PREFIX = "Bearer ";

	private final TokenVerifier verifier;

	private final ScopeEnforcer scopeEnforcer;

	private final Clock clock;

	public BearerAuthenticator(TokenVerifier verifier, ScopeEnforcer scopeEnforcer) {
		this(verifier, scopeEnforcer, Clock.systemUTC());
	}

	public BearerAuthenticator(TokenVerifier verifier, ScopeEnforcer scopeEnforcer, Clock clock) {
		Assert.notNull(verifier, "verifier must not be null");
		Assert.notNull(scopeEnforcer, "scopeEnforcer must not be null");
		Assert.notNull(clock, "clock must not be null");
		this.verifier = verifier;
		this.scopeEnforcer = scopeEnforcer;
		this.clock = clock;
	}

	/**
	 * Authenticate a request using a bearer token.
	 * @param authHeader The Authorization header value, may be {@code null}
	 * @return A CompletableFuture that resolves to the authenticated context, or fails
	 * with an {@link AuthException}
	 */
	public CompletableFuture<AuthContext> authenticate(String authHeader) {
		String token;
		try {
			token = extractToken(authHeader);
		}
		catch (AuthException e) {
			return CompletableFuture.failedFuture(e);
		}

		return verifier.verify(token).thenApply(accessToken -> {
			// Introspection results carry exp too; re-check against our own clock
			if (accessToken.getExpiresAt() != null
					&& accessToken.getExpiresAt() <= clock.instant().getEpochSecond()) {
				throw new AuthException(AuthError.EXPIRED_TOKEN, "Access token has expired");
			}
			scopeEnforcer.enforce(accessToken);
			return new AuthContext(accessToken);
		});
	}

	/**
	 * Extract the token from an {@code Authorization: Bearer} header value. The scheme is
	 * matched case-insensitively.
	 * @param authHeader the header value, may be {@code null}
	 * @return the token
	 * @throws AuthException with {@link AuthError#MISSING_CREDENTIALS} if the header is
	 * absent, uses another scheme or carries no token
	 */
	public static String extractToken(String authHeader) {
		if (authHeader == null || !authHeader.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
			throw new AuthException(AuthError.MISSING_CREDENTIALS, "Missing or invalid Authorization header");
		}
		String token = authHeader.substring(BEARER_PREFIX.length()).trim();
		if (token.isEmpty()) {
			throw new AuthException(AuthError.MISSING_CREDENTIALS, "Empty bearer token");
		}
		return token;
	}

}
