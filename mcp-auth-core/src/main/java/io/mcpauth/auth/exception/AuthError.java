/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.mcpauth.auth.exception;

/**
 * Failure reasons raised by token verification, scope enforcement, token exchange and
 * the authorization code flow.
 */
public enum AuthError {

	EXPIRED_TOKEN("invalid_token", Outcome.UNAUTHORIZED),

	INVALID_TOKEN("invalid_token", Outcome.UNAUTHORIZED),

	KEY_NOT_FOUND("invalid_token", Outcome.UNAUTHORIZED),

	/**
	 * Introspection reported the token inactive, or could not be performed at all. The
	 * two cases are deliberately indistinguishable to the caller.
	 */
	NOT_VERIFIED("invalid_token", Outcome.UNAUTHORIZED),

	/**
	 * No usable {@code Authorization: Bearer} header was presented.
	 */
	MISSING_CREDENTIALS("invalid_request", Outcome.UNAUTHORIZED),

	INSUFFICIENT_SCOPE("insufficient_scope", Outcome.FORBIDDEN),

	MISSING_NONCE("invalid_dpop_proof", Outcome.FAILED),

	TOKEN_EXCHANGE_FAILED("token_exchange_failed", Outcome.FAILED),

	CODE_EXCHANGE_FAILED("code_exchange_failed", Outcome.FAILED),

	CALLBACK_TIMEOUT("callback_timeout", Outcome.FAILED),

	CSRF_MISMATCH("invalid_state", Outcome.FAILED);

	private final String errorCode;

	private final Outcome outcome;

	AuthError(String errorCode, Outcome outcome) {
		this.errorCode = errorCode;
		this.outcome = outcome;
	}

	/**
	 * The OAuth error code reported to callers, e.g. in a {@code WWW-Authenticate}
	 * header.
	 * @return the error code
	 */
	public String getErrorCode() {
		return errorCode;
	}

	public Outcome getOutcome() {
		return outcome;
	}

	/**
	 * Outward classification of an {@link AuthError}.
	 */
	public enum Outcome {

		/** Authentication failed; the caller should obtain a new token. */
		UNAUTHORIZED(401),

		/** The token is valid but lacks a required scope. */
		FORBIDDEN(403),

		/** An upstream call or the local flow failed; usually a configuration issue. */
		FAILED(502);

		private final int httpStatus;

		Outcome(int httpStatus) {
			this.httpStatus = httpStatus;
		}

		public int getHttpStatus() {
			return httpStatus;
		}

	}

}
