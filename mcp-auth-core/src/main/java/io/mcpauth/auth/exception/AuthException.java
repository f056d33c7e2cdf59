/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.mcpauth.auth.exception;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Exception raised for every authentication, authorization and token acquisition
 * failure. The {@link AuthError} tells callers how to react.
 */
public class AuthException extends RuntimeException {

	private final AuthError error;

	public AuthException(AuthError error, String message) {
		super(message);
		this.error = error;
	}

	public AuthException(AuthError error, String message, Throwable cause) {
		super(message, cause);
		this.error = error;
	}

	public AuthError getError() {
		return error;
	}

	public AuthError.Outcome getOutcome() {
		return error.getOutcome();
	}

	/**
	 * Find the {@link AuthException} behind a failure delivered by a
	 * {@link java.util.concurrent.CompletableFuture}.
	 * @param throwable the failure, possibly wrapped in {@link CompletionException} or
	 * {@link ExecutionException}
	 * @return the unwrapped exception, or {@code null} if the failure is not an
	 * {@link AuthException}
	 */
	public static AuthException unwrap(Throwable throwable) {
		Throwable current = unwrapFailure(throwable);
		return current instanceof AuthException ? (AuthException) current : null;
	}

	/**
	 * Strip {@link CompletionException} and {@link ExecutionException} wrappers.
	 * @param throwable the failure
	 * @return the innermost non-wrapper throwable
	 */
	public static Throwable unwrapFailure(Throwable throwable) {
		Throwable current = throwable;
		while ((current instanceof CompletionException || current instanceof ExecutionException)
				&& current.getCause() != null) {
			current = current.getCause();
		}
		return current;
	}

}
