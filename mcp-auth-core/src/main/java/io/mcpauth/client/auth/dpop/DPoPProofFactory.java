/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.mcpauth.client.auth.dpop;

import java.net.URI;
import java.time.Clock;
import java.util.Date;
import java.util.UUID;

import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JOSEObjectType;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.JWSHeader;
import com.nimbusds.jose.crypto.RSASSASigner;
import com.nimbusds.jose.jwk.RSAKey;
import com.nimbusds.jose.jwk.gen.RSAKeyGenerator;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;

import io.mcpauth.util.Assert;

/**
 * Creates DPoP proofs (RFC 9449) signed with an ephemeral RSA key.
 * <p>
 * Every proof carries a fresh {@code jti}; the key is supplied by the caller so that
 * proofs regenerated for a nonce retry are bound to the same key.
 */
public class DPoPProofFactory {

	public static final JOSEObjectType DPOP_TYPE = new JOSEObjectType("dpop+jwt");

	private static final int KEY_SIZE = 2048;

	private final Clock clock;

	public DPoPProofFactory() {
		this(Clock.systemUTC());
	}

	public DPoPProofFactory(Clock clock) {
		Assert.notNull(clock, "clock must not be null");
		this.clock = clock;
	}

	/**
	 * Generate a new ephemeral key pair. Never persisted.
	 */
	public RSAKey generateKey() {
		try {
			return new RSAKeyGenerator(KEY_SIZE).keyID(UUID.randomUUID().toString()).generate();
		}
		catch (JOSEException e) {
			throw new IllegalStateException("Failed to generate DPoP key", e);
		}
	}

	/**
	 * Create a signed proof for one HTTP request.
	 * @param method the HTTP method, e.g. {@code POST}
	 * @param url the target URL, without query or fragment
	 * @param key the ephemeral key pair; only its public part is embedded
	 * @param nonce a server-issued nonce, or {@code null}
	 * @return the compact serialized proof
	 */
	public String createProof(String method, URI url, RSAKey key, String nonce) {
		Assert.hasText(method, "method must not be empty");
		Assert.notNull(url, "url must not be null");
		Assert.notNull(key, "key must not be null");

		JWSHeader header = new JWSHeader.Builder(JWSAlgorithm.RS256).type(DPOP_TYPE)
			.jwk(key.toPublicJWK())
			.build();

		JWTClaimsSet.Builder claims = new JWTClaimsSet.Builder().jwtID(UUID.randomUUID().toString())
			.claim("htm", method)
			.claim("htu", url.toString())
			.issueTime(Date.from(clock.instant()));
		if (nonce != null) {
			claims.claim("nonce", nonce);
		}

		SignedJWT proof = new SignedJWT(header, claims.build());
		try {
			proof.sign(new RSASSASigner(key));
		}
		catch (JOSEException e) {
			throw new IllegalStateException("Failed to sign DPoP proof", e);
		}
		return proof.serialize();
	}

}
