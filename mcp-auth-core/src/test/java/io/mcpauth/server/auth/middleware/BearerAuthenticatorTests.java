/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.mcpauth.server.auth.middleware;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import io.mcpauth.auth.AccessToken;
import io.mcpauth.auth.exception.AuthError;
import io.mcpauth.auth.exception.AuthException;
import io.mcpauth.server.auth.verifier.TokenVerifier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class BearerAuthenticatorTests {

	private static final Instant NOW = Instant.parse("2025-06-01T12:00:00Z");

	@Mock
	private TokenVerifier verifier;

	private BearerAuthenticator authenticator;

	@BeforeEach
	void setUp() {
		authenticator = new BearerAuthenticator(verifier, new ScopeEnforcer(List.of("mcp:access")),
				Clock.fixed(NOW, ZoneOffset.UTC));
	}

	@Test
	void authenticatesBearerToken() {
		AccessToken token = new AccessToken("tok", "client-123", List.of("openid", "mcp:access"),
				NOW.plusSeconds(60).getEpochSecond(), "alice");
		when(verifier.verify("tok")).thenReturn(CompletableFuture.completedFuture(token));

		AuthContext context = authenticator.authenticate("Bearer tok").join();

		assertThat(context.getAccessToken()).isSameAs(token);
		assertThat(context.getClientId()).isEqualTo("client-123");
		assertThat(context.getSubject()).isEqualTo("alice");
		assertThat(context.hasScope("mcp:access")).isTrue();
		assertThat(context.hasScope("mcp:write")).isFalse();
	}

	@Test
	void schemeIsCaseInsensitive() {
		when(verifier.verify("tok")).thenReturn(CompletableFuture
			.completedFuture(new AccessToken("tok", "client-123", List.of("mcp:access"), null)));

		assertThat(authenticator.authenticate("bearer tok").join().getClientId()).isEqualTo("client-123");
	}

	@Test
	void missingHeaderIsRejectedWithoutVerification() {
		for (String header : new String[] { null, "", "Basic abc", "Bearer", "Bearer   " }) {
			AuthException failure = failure(authenticator.authenticate(header));
			assertThat(failure.getError()).as("header %s", header).isEqualTo(AuthError.MISSING_CREDENTIALS);
		}
		verify(verifier, never()).verify(anyString());
	}

	@Test
	void verifierFailureIsPropagated() {
		when(verifier.verify("bad")).thenReturn(
				CompletableFuture.failedFuture(new AuthException(AuthError.INVALID_TOKEN, "Invalid token: bad")));

		assertThat(failure(authenticator.authenticate("Bearer bad")).getError()).isEqualTo(AuthError.INVALID_TOKEN);
	}

	@Test
	void expiredResultIsRejected() {
		when(verifier.verify("old")).thenReturn(CompletableFuture.completedFuture(
				new AccessToken("old", "client-123", List.of("mcp:access"), NOW.minusSeconds(1).getEpochSecond())));

		assertThat(failure(authenticator.authenticate("Bearer old")).getError()).isEqualTo(AuthError.EXPIRED_TOKEN);
	}

	@Test
	void insufficientScopeIsForbidden() {
		when(verifier.verify("tok")).thenReturn(
				CompletableFuture.completedFuture(new AccessToken("tok", "client-123", List.of("openid"), null)));

		AuthException failure = failure(authenticator.authenticate("Bearer tok"));

		assertThat(failure.getError()).isEqualTo(AuthError.INSUFFICIENT_SCOPE);
		assertThat(failure.getOutcome().getHttpStatus()).isEqualTo(403);
	}

	private static AuthException failure(CompletableFuture<?> future) {
		AuthException authException = AuthException.unwrap(catchThrowable(future::join));
		assertThat(authException).isNotNull();
		return authException;
	}

}
