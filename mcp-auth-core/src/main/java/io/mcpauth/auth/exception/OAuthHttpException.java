/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.mcpauth.auth.exception;

/**
 * Raised when the identity provider's token endpoint rejects a code exchange or a token
 * exchange. Carries the HTTP status and response body for diagnosis.
 */
public class OAuthHttpException extends AuthException {

	private final int statusCode;

	private final String responseBody;

	public OAuthHttpException(AuthError error, int statusCode, String responseBody) {
		super(error, describe(error) + ": HTTP " + statusCode + " " + responseBody);
		this.statusCode = statusCode;
		this.responseBody = responseBody;
	}

	private static String describe(AuthError error) {
		return error == AuthError.CODE_EXCHANGE_FAILED ? "Authorization code exchange failed"
				: "Token exchange failed";
	}

	public int getStatusCode() {
		return statusCode;
	}

	public String getResponseBody() {
		return responseBody;
	}

}
