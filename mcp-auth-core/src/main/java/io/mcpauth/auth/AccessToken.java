/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.mcpauth.auth;

import java.util.List;

/**
 * A verified OAuth access token, normalized from either a locally verified
 * {@link ClaimSet} or an {@link IntrospectionResult}. Instances are immutable and belong
 * to the request that produced them.
 */
public class AccessToken {

	private final String token;

	private final String clientId;

	private final List<String> scopes;

	private final Long expiresAt;

	private final String subject;

	public AccessToken(String token, String clientId, List<String> scopes, Long expiresAt) {
		this(token, clientId, scopes, expiresAt, null);
	}

	public AccessToken(String token, String clientId, List<String> scopes, Long expiresAt, String subject) {
		this.token = token;
		this.clientId = clientId;
		this.scopes = scopes != null ? List.copyOf(scopes) : List.of();
		this.expiresAt = expiresAt;
		this.subject = subject;
	}

	public String getToken() {
		return token;
	}

	public String getClientId() {
		return clientId;
	}

	public List<String> getScopes() {
		return scopes;
	}

	/**
	 * Expiry as seconds since the epoch, or {@code null} if the token does not expire.
	 * @return the expiry time
	 */
	public Long getExpiresAt() {
		return expiresAt;
	}

	public String getSubject() {
		return subject;
	}

	@Override
	public String toString() {
		return "AccessToken[clientId=" + clientId + ", subject=" + subject + ", scopes=" + scopes + ", expiresAt="
				+ expiresAt + "]";
	}

}
