/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.mcpauth.server.auth.introspection;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.mcpauth.auth.IntrospectionResult;
import io.mcpauth.auth.exception.AuthError;
import io.mcpauth.auth.exception.AuthException;
import io.mcpauth.server.auth.middleware.ScopeEnforcer;
import io.mcpauth.util.Assert;
import io.mcpauth.util.Utils;

/**
 * Calls the identity provider's RFC 7662 introspection endpoint, authenticating as a
 * confidential client with HTTP Basic credentials.
 */
public class IntrospectionClient {

	private static final Logger logger = LoggerFactory.getLogger(IntrospectionClient.class);

	private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
	};

	private final URI introspectionUri;

	private final String clientId;

	private final String clientSecret;

	private final HttpClient httpClient;

	private final Duration timeout;

	private final ObjectMapper objectMapper;

	public IntrospectionClient(URI introspectionUri, String clientId, String clientSecret, HttpClient httpClient,
			Duration timeout, ObjectMapper objectMapper) {
		Assert.notNull(introspectionUri, "introspectionUri must not be null");
		Assert.hasText(clientId, "clientId is required for token introspection");
		Assert.hasText(clientSecret, "clientSecret is required for token introspection");
		Assert.notNull(httpClient, "httpClient must not be null");
		Assert.notNull(objectMapper, "objectMapper must not be null");
		this.introspectionUri = introspectionUri;
		this.clientId = clientId;
		this.clientSecret = clientSecret;
		this.httpClient = httpClient;
		this.timeout = timeout;
		this.objectMapper = objectMapper;
	}

	/**
	 * Introspect an access token.
	 * @param token the token
	 * @return a future completing with the parsed response; fails with
	 * {@link AuthError#NOT_VERIFIED} on a non-200 status or a malformed body, or with the
	 * transport exception
	 */
	public CompletableFuture<IntrospectionResult> introspect(String token) {
		Map<String, String> form = new LinkedHashMap<>();
		form.put("token", token);
		form.put("token_type_hint", "access_token");

		HttpRequest request = HttpRequest.newBuilder(introspectionUri)
			.header("Content-Type", "application/x-www-form-urlencoded")
			.header("Accept", "application/json")
			.header("Authorization", Utils.basicAuthorization(clientId, clientSecret))
			.timeout(timeout)
			.POST(HttpRequest.BodyPublishers.ofString(Utils.formEncode(form)))
			.build();

		return httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString()).thenApply(response -> {
			if (response.statusCode() != 200) {
				throw new AuthException(AuthError.NOT_VERIFIED,
						"Token introspection failed: HTTP " + response.statusCode());
			}
			try {
				return parse(objectMapper.readValue(response.body(), MAP_TYPE));
			}
			catch (IOException e) {
				throw new AuthException(AuthError.NOT_VERIFIED, "Malformed introspection response", e);
			}
		});
	}

	static IntrospectionResult parse(Map<String, Object> data) {
		boolean active = Boolean.TRUE.equals(data.get("active"));
		if (!active) {
			logger.debug("Introspection reported token inactive");
			return new IntrospectionResult(false, List.of(), null, null, null);
		}

		List<String> scopes = new ArrayList<>(ScopeEnforcer.normalize(data.get("scope")));
		Object clientId = data.get("client_id") != null ? data.get("client_id") : "unknown";
		Object subject = data.get("username") != null ? data.get("username") : data.get("sub");
		Long expiresAt = data.get("exp") instanceof Number ? ((Number) data.get("exp")).longValue() : null;

		return new IntrospectionResult(true, scopes, String.valueOf(clientId),
				expiresAt, subject != null ? subject.toString() : null);
	}

}
