/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.mcpauth;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;

import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.JWSHeader;
import com.nimbusds.jose.crypto.RSASSASigner;
import com.nimbusds.jose.jwk.JWK;
import com.nimbusds.jose.jwk.JWKSet;
import com.nimbusds.jose.jwk.RSAKey;
import com.nimbusds.jose.jwk.gen.RSAKeyGenerator;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;

/**
 * RSA keys and signed JWTs for tests.
 */
public final class TestTokens {

	public static final String AUDIENCE = "api://default";

	private TestTokens() {
	}

	public static RSAKey generateKey(String keyId) {
		try {
			return new RSAKeyGenerator(2048).keyID(keyId).generate();
		}
		catch (JOSEException e) {
			throw new IllegalStateException(e);
		}
	}

	public static String jwks(RSAKey... keys) {
		List<JWK> publicKeys = new ArrayList<>();
		for (RSAKey key : keys) {
			publicKeys.add(key.toPublicJWK());
		}
		return new JWKSet(publicKeys).toString();
	}

	/**
	 * Claims for a token valid for an hour from {@code now}.
	 */
	public static JWTClaimsSet.Builder claims(String issuer, Instant now) {
		return new JWTClaimsSet.Builder().issuer(issuer)
			.audience(AUDIENCE)
			.subject("alice@example.com")
			.issueTime(Date.from(now))
			.expirationTime(Date.from(now.plusSeconds(3600)))
			.claim("cid", "client-123")
			.claim("scp", List.of("openid", "mcp:access"));
	}

	public static String sign(JWTClaimsSet claims, RSAKey key) {
		SignedJWT jwt = new SignedJWT(new JWSHeader.Builder(JWSAlgorithm.RS256).keyID(key.getKeyID()).build(),
				claims);
		try {
			jwt.sign(new RSASSASigner(key));
		}
		catch (JOSEException e) {
			throw new IllegalStateException(e);
		}
		return jwt.serialize();
	}

}
