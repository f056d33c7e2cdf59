/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.mcpauth.server.auth.verifier;

import java.text.ParseException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.JWSVerifier;
import com.nimbusds.jose.crypto.RSASSAVerifier;
import com.nimbusds.jose.jwk.JWK;
import com.nimbusds.jose.jwk.RSAKey;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.mcpauth.auth.AccessToken;
import io.mcpauth.auth.ClaimSet;
import io.mcpauth.auth.exception.AuthError;
import io.mcpauth.auth.exception.AuthException;
import io.mcpauth.server.auth.keys.JwksKeyProvider;
import io.mcpauth.server.auth.middleware.ScopeEnforcer;
import io.mcpauth.util.Assert;

/**
 * Verifies JWT access tokens locally: the RS256 signature against the identity
 * provider's published key, then expiry, issuer and audience.
 * <p>
 * An expired token always fails with {@link AuthError#EXPIRED_TOKEN}; every other claim
 * or signature problem fails with {@link AuthError#INVALID_TOKEN}, and an unknown key id
 * with {@link AuthError#KEY_NOT_FOUND}.
 */
public class JwtTokenVerifier implements TokenVerifier {

	private static final Logger logger = LoggerFactory.getLogger(JwtTokenVerifier.class);

	private final JwksKeyProvider keyProvider;

	private final String issuer;

	private final String audience;

	private final Clock clock;

	public JwtTokenVerifier(JwksKeyProvider keyProvider, String issuer, String audience) {
		this(keyProvider, issuer, audience, Clock.systemUTC());
	}

	public JwtTokenVerifier(JwksKeyProvider keyProvider, String issuer, String audience, Clock clock) {
		Assert.notNull(keyProvider, "keyProvider must not be null");
		Assert.hasText(issuer, "issuer must not be empty");
		Assert.hasText(audience, "audience must not be empty");
		Assert.notNull(clock, "clock must not be null");
		this.keyProvider = keyProvider;
		this.issuer = issuer;
		this.audience = audience;
		this.clock = clock;
	}

	@Override
	public CompletableFuture<AccessToken> verify(String token) {
		return verifyClaims(token).thenApply(claims -> claims.toAccessToken(token));
	}

	/**
	 * Verify a token and return its full claim set.
	 * @param token the raw JWT
	 * @return a future completing with the verified claims
	 */
	public CompletableFuture<ClaimSet> verifyClaims(String token) {
		SignedJWT jwt;
		try {
			jwt = SignedJWT.parse(token);
		}
		catch (ParseException e) {
			return CompletableFuture.failedFuture(invalid(e.getMessage()));
		}

		// The header is read before the signature is checked; only the key id is used.
		String keyId = jwt.getHeader().getKeyID();
		if (keyId == null) {
			return CompletableFuture.failedFuture(invalid("token header has no key id"));
		}
		if (!JWSAlgorithm.RS256.equals(jwt.getHeader().getAlgorithm())) {
			return CompletableFuture
				.failedFuture(invalid("unsupported algorithm " + jwt.getHeader().getAlgorithm()));
		}

		return keyProvider.getKey(keyId).thenApply(key -> validate(jwt, key));
	}

	private ClaimSet validate(SignedJWT jwt, JWK key) {
		try {
			if (!(key instanceof RSAKey)) {
				throw invalid("signing key " + key.getKeyID() + " is not an RSA key");
			}
			JWSVerifier verifier = new RSASSAVerifier((RSAKey) key);
			if (!jwt.verify(verifier)) {
				throw invalid("Signature verification failed");
			}

			JWTClaimsSet claims = jwt.getJWTClaimsSet();
			Instant now = clock.instant();

			Date expiration = claims.getExpirationTime();
			if (expiration != null && !now.isBefore(expiration.toInstant())) {
				throw new AuthException(AuthError.EXPIRED_TOKEN, "Token has expired");
			}
			Date notBefore = claims.getNotBeforeTime();
			if (notBefore != null && now.isBefore(notBefore.toInstant())) {
				throw invalid("The token is not yet valid (nbf)");
			}
			if (!issuer.equals(claims.getIssuer())) {
				throw invalid("Invalid issuer");
			}
			if (claims.getAudience() == null || !claims.getAudience().contains(audience)) {
				throw invalid("Invalid audience");
			}

			ClaimSet claimSet = new ClaimSet(claims.getIssuer(), claims.getAudience(), claims.getSubject(),
					expiration != null ? expiration.toInstant() : null, scopesOf(claims), clientIdOf(claims),
					key.getKeyID(), claims.toJSONObject());
			logger.debug("JWT verified for subject {} with key {}", claimSet.subject(), claimSet.keyId());
			return claimSet;
		}
		catch (JOSEException | ParseException e) {
			throw invalid(e.getMessage());
		}
	}

	private static List<String> scopesOf(JWTClaimsSet claims) {
		Object scopes = claims.getClaim("scp");
		if (scopes == null) {
			scopes = claims.getClaim("scope");
		}
		return new ArrayList<>(ScopeEnforcer.normalize(scopes));
	}

	private static String clientIdOf(JWTClaimsSet claims) {
		for (String name : List.of("cid", "client_id", "azp")) {
			Object value = claims.getClaim(name);
			if (value != null) {
				return value.toString();
			}
		}
		return null;
	}

	private static AuthException invalid(String reason) {
		return new AuthException(AuthError.INVALID_TOKEN, "Invalid token: " + reason);
	}

}
