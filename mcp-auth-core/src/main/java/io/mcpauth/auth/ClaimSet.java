/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.mcpauth.auth;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Claims of a JWT access token whose signature, issuer, audience and expiry were
 * verified locally.
 *
 * @param issuer the {@code iss} claim
 * @param audience the {@code aud} claim
 * @param subject the {@code sub} claim
 * @param expiresAt the {@code exp} claim, {@code null} if absent
 * @param scopes scopes from {@code scp} or {@code scope}
 * @param clientId the client the token was issued to ({@code cid}, {@code client_id} or
 * {@code azp})
 * @param keyId the {@code kid} of the key that signed the token
 * @param claims the complete payload
 */
public record ClaimSet(String issuer, List<String> audience, String subject, Instant expiresAt, List<String> scopes,
		String clientId, String keyId, Map<String, Object> claims) {

	public ClaimSet {
		audience = audience != null ? List.copyOf(audience) : List.of();
		scopes = scopes != null ? List.copyOf(scopes) : List.of();
		claims = claims != null ? Collections.unmodifiableMap(new LinkedHashMap<>(claims)) : Map.of();
	}

	public AccessToken toAccessToken(String token) {
		return new AccessToken(token, clientId, scopes, expiresAt != null ? expiresAt.getEpochSecond() : null,
				subject);
	}

}
