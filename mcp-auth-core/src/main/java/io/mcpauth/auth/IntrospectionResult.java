/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.mcpauth.auth;

import java.util.List;

/**
 * Response of an RFC 7662 token introspection call.
 *
 * @param active whether the identity provider considers the token active
 * @param scopes granted scopes
 * @param clientId the client the token was issued to, {@code unknown} if not reported
 * @param expiresAt the {@code exp} value in epoch seconds, {@code null} if absent
 * @param subject the {@code username}, falling back to {@code sub}
 */
public record IntrospectionResult(boolean active, List<String> scopes, String clientId, Long expiresAt,
		String subject) {

	public IntrospectionResult {
		scopes = scopes != null ? List.copyOf(scopes) : List.of();
	}

	public AccessToken toAccessToken(String token) {
		return new AccessToken(token, clientId, scopes, expiresAt, subject);
	}

}
