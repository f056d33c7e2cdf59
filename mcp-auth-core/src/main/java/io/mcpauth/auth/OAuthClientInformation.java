/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.mcpauth.auth;

/**
 * Credentials and registration details of a confidential OAuth client that was
 * provisioned ahead of time at the identity provider.
 */
public class OAuthClientInformation {

	private final String clientId;

	private final String clientSecret;

	private final String scope;

	public OAuthClientInformation(String clientId, String clientSecret, String scope) {
		this.clientId = clientId;
		this.clientSecret = clientSecret;
		this.scope = scope;
	}

	/**
	 * Client information derived from the configured settings.
	 * @param settings the settings
	 * @return the client information
	 */
	public static OAuthClientInformation from(AuthSettings settings) {
		return new OAuthClientInformation(settings.getClientId(), settings.getClientSecret(), settings.getLoginScope());
	}

	public String getClientId() {
		return clientId;
	}

	public String getClientSecret() {
		return clientSecret;
	}

	public String getScope() {
		return scope;
	}

}
