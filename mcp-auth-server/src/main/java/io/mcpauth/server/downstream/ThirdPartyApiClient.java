/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.mcpauth.server.downstream;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.mcpauth.util.Assert;

/**
 * Calls the downstream API on behalf of a user with a token obtained through token
 * exchange.
 */
public class ThirdPartyApiClient {

	private static final Logger logger = LoggerFactory.getLogger(ThirdPartyApiClient.class);

	private final URI apiUri;

	private final HttpClient httpClient;

	private final Duration timeout;

	public ThirdPartyApiClient(URI apiUri, HttpClient httpClient, Duration timeout) {
		Assert.notNull(apiUri, "apiUri must not be null");
		Assert.notNull(httpClient, "httpClient must not be null");
		Assert.notNull(timeout, "timeout must not be null");
		this.apiUri = apiUri;
		this.httpClient = httpClient;
		this.timeout = timeout;
	}

	public URI getApiUri() {
		return apiUri;
	}

	/**
	 * GET the downstream API. Any HTTP status is returned to the caller.
	 * @param accessToken the exchanged token, sent as a bearer token
	 * @return a future completing with the response status and body
	 */
	public CompletableFuture<ApiResponse> fetch(String accessToken) {
		HttpRequest request = HttpRequest.newBuilder()
			.uri(apiUri)
			.timeout(timeout)
			.header("Authorization", "Bearer " + accessToken)
			.header("Accept", "application/json")
			.GET()
			.build();
		return httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString()).thenApply(response -> {
			logger.info("Downstream API {} answered {}", apiUri, response.statusCode());
			return new ApiResponse(response.statusCode(), response.body());
		});
	}

	/**
	 * Status and body of a downstream response.
	 */
	public record ApiResponse(int status, String body) {

		public boolean isSuccess() {
			return status >= 200 && status < 300;
		}

	}

}
