/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.mcpauth.server.auth.verifier;

import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Date;
import java.util.concurrent.CompletableFuture;

import com.nimbusds.jose.jwk.RSAKey;
import com.nimbusds.jwt.JWTClaimsSet;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.mcpauth.FakeIdentityProvider;
import io.mcpauth.FakeIdentityProvider.Response;
import io.mcpauth.TestTokens;
import io.mcpauth.auth.AccessToken;
import io.mcpauth.auth.ClaimSet;
import io.mcpauth.auth.exception.AuthError;
import io.mcpauth.auth.exception.AuthException;
import io.mcpauth.server.auth.keys.JwksKeyProvider;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

/**
 * Tests for {@link JwtTokenVerifier} against a fake identity provider's key set.
 */
class JwtTokenVerifierTests {

	private static final Instant NOW = Instant.parse("2025-06-01T12:00:00Z");

	private static RSAKey signingKey;

	private static RSAKey otherKey;

	private FakeIdentityProvider idp;

	private JwtTokenVerifier verifier;

	@BeforeAll
	static void generateKeys() {
		signingKey = TestTokens.generateKey("key-1");
		otherKey = TestTokens.generateKey("key-1");
	}

	@BeforeEach
	void setUp() throws Exception {
		idp = FakeIdentityProvider.start();
		idp.respond(FakeIdentityProvider.KEYS, Response.json(200, TestTokens.jwks(signingKey)));
		JwksKeyProvider keyProvider = new JwksKeyProvider(idp.uri(FakeIdentityProvider.KEYS),
				HttpClient.newHttpClient(), Duration.ofSeconds(5));
		verifier = new JwtTokenVerifier(keyProvider, idp.issuer(), TestTokens.AUDIENCE,
				Clock.fixed(NOW, ZoneOffset.UTC));
	}

	@AfterEach
	void tearDown() {
		idp.close();
	}

	@Test
	void validTokenYieldsItsClaims() {
		JWTClaimsSet claims = TestTokens.claims(idp.issuer(), NOW).build();

		ClaimSet result = verifier.verifyClaims(TestTokens.sign(claims, signingKey)).join();

		assertThat(result.issuer()).isEqualTo(idp.issuer());
		assertThat(result.audience()).containsExactly(TestTokens.AUDIENCE);
		assertThat(result.subject()).isEqualTo("alice@example.com");
		assertThat(result.scopes()).containsExactly("openid", "mcp:access");
		assertThat(result.clientId()).isEqualTo("client-123");
		assertThat(result.keyId()).isEqualTo("key-1");
		assertThat(result.expiresAt()).isEqualTo(NOW.plusSeconds(3600));
		assertThat(result.claims()).isEqualTo(claims.toJSONObject());
	}

	@Test
	void verifyMapsClaimsToAccessToken() {
		String token = TestTokens.sign(TestTokens.claims(idp.issuer(), NOW).build(), signingKey);

		AccessToken accessToken = verifier.verify(token).join();

		assertThat(accessToken.getToken()).isEqualTo(token);
		assertThat(accessToken.getClientId()).isEqualTo("client-123");
		assertThat(accessToken.getScopes()).containsExactly("openid", "mcp:access");
		assertThat(accessToken.getExpiresAt()).isEqualTo(NOW.plusSeconds(3600).getEpochSecond());
	}

	@Test
	void spaceDelimitedScopeClaimIsNormalized() {
		JWTClaimsSet claims = TestTokens.claims(idp.issuer(), NOW)
			.claim("scp", null)
			.claim("scope", "openid  mcp:access")
			.build();

		ClaimSet result = verifier.verifyClaims(TestTokens.sign(claims, signingKey)).join();

		assertThat(result.scopes()).containsExactly("openid", "mcp:access");
	}

	@Test
	void expiredTokenFailsAsExpiredEvenWithOtherProblems() {
		JWTClaimsSet claims = TestTokens.claims("https://wrong.example.com", NOW.minusSeconds(7200)).build();

		AuthException failure = failure(verifier.verify(TestTokens.sign(claims, signingKey)));

		assertThat(failure.getError()).isEqualTo(AuthError.EXPIRED_TOKEN);
		assertThat(failure.getMessage()).isEqualTo("Token has expired");
		assertThat(failure.getOutcome()).isEqualTo(AuthError.Outcome.UNAUTHORIZED);
	}

	@Test
	void wrongIssuerIsInvalid() {
		JWTClaimsSet claims = TestTokens.claims("https://wrong.example.com/oauth2/default", NOW).build();

		AuthException failure = failure(verifier.verify(TestTokens.sign(claims, signingKey)));

		assertThat(failure.getError()).isEqualTo(AuthError.INVALID_TOKEN);
		assertThat(failure.getMessage()).contains("issuer");
	}

	@Test
	void wrongAudienceIsInvalid() {
		JWTClaimsSet claims = TestTokens.claims(idp.issuer(), NOW).audience("api://other").build();

		AuthException failure = failure(verifier.verify(TestTokens.sign(claims, signingKey)));

		assertThat(failure.getError()).isEqualTo(AuthError.INVALID_TOKEN);
		assertThat(failure.getMessage()).contains("audience");
	}

	@Test
	void tokenNotYetValidIsInvalid() {
		JWTClaimsSet claims = TestTokens.claims(idp.issuer(), NOW)
			.notBeforeTime(Date.from(NOW.plusSeconds(600)))
			.build();

		AuthException failure = failure(verifier.verify(TestTokens.sign(claims, signingKey)));

		assertThat(failure.getError()).isEqualTo(AuthError.INVALID_TOKEN);
	}

	@Test
	void signatureFromAnotherKeyIsInvalid() {
		String forged = TestTokens.sign(TestTokens.claims(idp.issuer(), NOW).build(), otherKey);

		AuthException failure = failure(verifier.verify(forged));

		assertThat(failure.getError()).isEqualTo(AuthError.INVALID_TOKEN);
		assertThat(failure.getMessage()).startsWith("Invalid token:");
	}

	@Test
	void malformedTokenIsInvalidWithoutFetchingKeys() {
		AuthException failure = failure(verifier.verify("not-a-jwt"));

		assertThat(failure.getError()).isEqualTo(AuthError.INVALID_TOKEN);
		assertThat(idp.requests(FakeIdentityProvider.KEYS)).isEmpty();
	}

	@Test
	void unknownKeyIdTriggersExactlyOneRefetch() {
		verifier.verify(TestTokens.sign(TestTokens.claims(idp.issuer(), NOW).build(), signingKey)).join();
		assertThat(idp.requests(FakeIdentityProvider.KEYS)).hasSize(1);

		RSAKey unknown = TestTokens.generateKey("key-unknown");
		AuthException failure = failure(
				verifier.verify(TestTokens.sign(TestTokens.claims(idp.issuer(), NOW).build(), unknown)));

		assertThat(failure.getError()).isEqualTo(AuthError.KEY_NOT_FOUND);
		assertThat(failure.getOutcome()).isEqualTo(AuthError.Outcome.UNAUTHORIZED);
		assertThat(idp.requests(FakeIdentityProvider.KEYS)).hasSize(2);
	}

	@Test
	void cachedKeyIsNotRefetched() {
		String token = TestTokens.sign(TestTokens.claims(idp.issuer(), NOW).build(), signingKey);

		verifier.verify(token).join();
		verifier.verify(token).join();

		assertThat(idp.requests(FakeIdentityProvider.KEYS)).hasSize(1);
	}

	@Test
	void rotatedKeyIsPickedUpOnMiss() {
		verifier.verify(TestTokens.sign(TestTokens.claims(idp.issuer(), NOW).build(), signingKey)).join();

		RSAKey rotated = TestTokens.generateKey("key-2");
		idp.respond(FakeIdentityProvider.KEYS, Response.json(200, TestTokens.jwks(signingKey, rotated)));

		ClaimSet result = verifier
			.verifyClaims(TestTokens.sign(TestTokens.claims(idp.issuer(), NOW).build(), rotated))
			.join();

		assertThat(result.keyId()).isEqualTo("key-2");
	}

	private static AuthException failure(CompletableFuture<?> future) {
		Throwable thrown = catchThrowable(future::join);
		AuthException authException = AuthException.unwrap(thrown);
		assertThat(authException).as("failure of %s", thrown).isNotNull();
		return authException;
	}

}
