/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.mcpauth.server.auth.verifier;

import java.util.concurrent.CompletableFuture;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.mcpauth.auth.AccessToken;
import io.mcpauth.auth.exception.AuthError;
import io.mcpauth.auth.exception.AuthException;
import io.mcpauth.server.auth.introspection.IntrospectionClient;
import io.mcpauth.util.Assert;

/**
 * Verifies tokens by asking the identity provider whether they are active.
 * <p>
 * Fails closed: an inactive token, a non-200 response and a transport failure all
 * complete with {@link AuthError#NOT_VERIFIED}, so callers always get a definite
 * allow/deny decision and cannot tell the cases apart.
 */
public class IntrospectionTokenVerifier implements TokenVerifier {

	private static final Logger logger = LoggerFactory.getLogger(IntrospectionTokenVerifier.class);

	private final IntrospectionClient introspectionClient;

	public IntrospectionTokenVerifier(IntrospectionClient introspectionClient) {
		Assert.notNull(introspectionClient, "introspectionClient must not be null");
		this.introspectionClient = introspectionClient;
	}

	@Override
	public CompletableFuture<AccessToken> verify(String token) {
		CompletableFuture<AccessToken> verified;
		try {
			verified = introspectionClient.introspect(token).thenApply(result -> {
				if (!result.active()) {
					throw notVerified();
				}
				logger.info("Token verified for user: {}, client: {}", result.subject(), result.clientId());
				logger.debug("Token scopes: {}", result.scopes());
				return result.toAccessToken(token);
			});
		}
		catch (RuntimeException e) {
			verified = CompletableFuture.failedFuture(e);
		}

		return verified.exceptionally(ex -> {
			AuthException authException = AuthException.unwrap(ex);
			if (authException == null || authException.getError() != AuthError.NOT_VERIFIED) {
				logger.warn("Error verifying token: {}", ex.getMessage());
			}
			else {
				logger.debug("Token not verified: {}", authException.getMessage());
			}
			throw notVerified();
		});
	}

	private static AuthException notVerified() {
		return new AuthException(AuthError.NOT_VERIFIED, "Token could not be verified");
	}

}
