/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.mcpauth.server.auth.middleware;

import io.mcpauth.auth.AccessToken;

/**
 * Holds authentication context for a request.
 */
public class AuthContext {

	/**
	 * Request attribute under which the servlet layer stores the context.
	 */
	public static final String REQUEST_ATTRIBUTE = AuthContext.class.getName();

	private final AccessToken accessToken;

	public AuthContext(AccessToken accessToken) {
		this.accessToken = accessToken;
	}

	public AccessToken getAccessToken() {
		return accessToken;
	}

	public String getClientId() {
		return accessToken != null ? accessToken.getClientId() : null;
	}

	public String getSubject() {
		return accessToken != null ? accessToken.getSubject() : null;
	}

	/**
	 * Checks if the caller's token carries the specified scope.
	 * @param scope The scope to check.
	 * @return True if the token has the scope, false otherwise.
	 */
	public boolean hasScope(String scope) {
		return accessToken != null && ScopeEnforcer.hasRequiredScope(accessToken.getScopes(), scope);
	}

}
