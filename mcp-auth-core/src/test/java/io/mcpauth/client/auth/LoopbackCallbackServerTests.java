/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.mcpauth.client.auth;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import io.mcpauth.auth.exception.AuthError;
import io.mcpauth.auth.exception.AuthException;

import static org.assertj.core.api.Assertions.assertThat;

class LoopbackCallbackServerTests {

	private final HttpClient httpClient = HttpClient.newHttpClient();

	private LoopbackCallbackServer server;

	@BeforeEach
	void setUp() throws Exception {
		server = LoopbackCallbackServer.start(0, "/oauth/callback");
	}

	@AfterEach
	void tearDown() {
		server.close();
	}

	private HttpResponse<String> get(String query) throws Exception {
		URI uri = URI.create(server.getRedirectUri() + query);
		return httpClient.send(HttpRequest.newBuilder(uri).GET().build(), HttpResponse.BodyHandlers.ofString());
	}

	@Test
	void capturesCodeAndState() throws Exception {
		HttpResponse<String> response = get("?code=AUTHCODE1&state=xyz");

		assertThat(response.statusCode()).isEqualTo(200);
		assertThat(response.body()).contains("Authorization Successful");
		StepVerifier.create(server.awaitCallback(Duration.ofSeconds(5))).assertNext(result -> {
			assertThat(result.getCode()).isEqualTo("AUTHCODE1");
			assertThat(result.getState()).isEqualTo("xyz");
		}).verifyComplete();
	}

	@Test
	void errorCallbackIsRejectedAndWaitingContinues() throws Exception {
		HttpResponse<String> denied = get("?error=access_denied&error_description=%3Cb%3Eno%3C%2Fb%3E");

		assertThat(denied.statusCode()).isEqualTo(400);
		assertThat(denied.body()).contains("access_denied").contains("&lt;b&gt;no&lt;/b&gt;").doesNotContain("<b>");

		StepVerifier.create(server.awaitCallback(Duration.ofSeconds(5)))
			.then(() -> {
				try {
					get("?code=LATER&state=s");
				}
				catch (Exception e) {
					throw new IllegalStateException(e);
				}
			})
			.assertNext(result -> assertThat(result.getCode()).isEqualTo("LATER"))
			.verifyComplete();
	}

	@Test
	void onlyTheFirstCodeIsAccepted() throws Exception {
		get("?code=FIRST&state=s");

		assertThat(get("?code=SECOND&state=s").statusCode()).isEqualTo(400);
		StepVerifier.create(server.awaitCallback(Duration.ofSeconds(5)))
			.assertNext(result -> assertThat(result.getCode()).isEqualTo("FIRST"))
			.verifyComplete();
	}

	@Test
	void requestsBesideTheCallbackPathAreNotFound() throws Exception {
		URI sibling = URI.create("http://localhost:" + server.getPort() + "/oauth/callbackXYZ?code=STRAY&state=s");
		URI nested = URI.create("http://localhost:" + server.getPort() + "/oauth/callback/extra?code=STRAY&state=s");

		assertThat(httpClient.send(HttpRequest.newBuilder(sibling).GET().build(), HttpResponse.BodyHandlers.ofString())
			.statusCode()).isEqualTo(404);
		assertThat(httpClient.send(HttpRequest.newBuilder(nested).GET().build(), HttpResponse.BodyHandlers.ofString())
			.statusCode()).isEqualTo(404);

		assertThat(get("?code=REAL&state=s").statusCode()).isEqualTo(200);
		StepVerifier.create(server.awaitCallback(Duration.ofSeconds(5)))
			.assertNext(result -> assertThat(result.getCode()).isEqualTo("REAL"))
			.verifyComplete();
	}

	@Test
	void waitingTimesOut() {
		StepVerifier.create(server.awaitCallback(Duration.ofMillis(300)))
			.expectErrorSatisfies(e -> assertThat(((AuthException) e).getError()).isEqualTo(AuthError.CALLBACK_TIMEOUT))
			.verify(Duration.ofSeconds(5));
	}

}
