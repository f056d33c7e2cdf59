/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.mcpauth.client.auth;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.Base64;

/**
 * Utility class for PKCE (Proof Key for Code Exchange, RFC 7636) and anti-CSRF state
 * values.
 */
public final class PkceUtils {

	private static final SecureRandom secureRandom = new SecureRandom();

	private static final String ALLOWED_CHARS = "ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz0123456789-._~";

	private static final int VERIFIER_LENGTH = 128;

	private PkceUtils() {
	}

	/**
	 * Generates a cryptographically random code verifier.
	 * @return A random code verifier string of 128 unreserved characters.
	 */
	public static String generateCodeVerifier() {
		StringBuilder codeVerifier = new StringBuilder(VERIFIER_LENGTH);
		for (int i = 0; i < VERIFIER_LENGTH; i++) {
			codeVerifier.append(ALLOWED_CHARS.charAt(secureRandom.nextInt(ALLOWED_CHARS.length())));
		}
		return codeVerifier.toString();
	}

	/**
	 * Derives the S256 code challenge: base64url without padding of the SHA-256 digest.
	 * @param codeVerifier The code verifier to hash.
	 * @return The code challenge string.
	 */
	public static String generateCodeChallenge(String codeVerifier) {
		try {
			MessageDigest digest = MessageDigest.getInstance("SHA-256");
			byte[] hash = digest.digest(codeVerifier.getBytes(StandardCharsets.US_ASCII));
			return Base64.getUrlEncoder().withoutPadding().encodeToString(hash);
		}
		catch (NoSuchAlgorithmException e) {
			throw new IllegalStateException("SHA-256 algorithm not available", e);
		}
	}

	/**
	 * Generates a random state value for CSRF protection.
	 * @return 32 random bytes, base64url-encoded without padding.
	 */
	public static String generateState() {
		byte[] stateBytes = new byte[32];
		secureRandom.nextBytes(stateBytes);
		return Base64.getUrlEncoder().withoutPadding().encodeToString(stateBytes);
	}

}
