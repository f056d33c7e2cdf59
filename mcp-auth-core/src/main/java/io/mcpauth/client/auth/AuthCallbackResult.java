/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.mcpauth.client.auth;

/**
 * Result of an OAuth authorization callback.
 */
public class AuthCallbackResult {

	private final String code;

	private final String state;

	/**
	 * Creates a new AuthCallbackResult.
	 * @param code The authorization code.
	 * @param state The state parameter, may be {@code null} if the server omitted it.
	 */
	public AuthCallbackResult(String code, String state) {
		this.code = code;
		this.state = state;
	}

	public String getCode() {
		return code;
	}

	public String getState() {
		return state;
	}

}
