/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.mcpauth.util;

/**
 * Renders secrets (access tokens, authorization codes, code verifiers) in a form that is
 * safe to write to logs.
 */
public final class Redaction {

	private static final int VISIBLE_PREFIX = 4;

	private Redaction() {
	}

	/**
	 * Redact a secret value, keeping a short prefix and the length so that log lines can
	 * still be correlated.
	 * @param secret the secret, may be {@code null}
	 * @return the redacted representation, e.g. {@code eyJr…(812 chars)}
	 */
	public static String token(String secret) {
		if (secret == null) {
			return "<none>";
		}
		if (secret.length() <= VISIBLE_PREFIX * 2) {
			return "…(" + secret.length() + " chars)";
		}
		return secret.substring(0, VISIBLE_PREFIX) + "…(" + secret.length() + " chars)";
	}

}
