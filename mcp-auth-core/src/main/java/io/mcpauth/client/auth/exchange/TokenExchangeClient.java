/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.mcpauth.client.auth.exchange;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nimbusds.jose.jwk.RSAKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.mcpauth.auth.AuthSettings;
import io.mcpauth.auth.exception.AuthError;
import io.mcpauth.auth.exception.AuthException;
import io.mcpauth.auth.exception.OAuthHttpException;
import io.mcpauth.client.auth.dpop.DPoPProofFactory;
import io.mcpauth.util.Assert;
import io.mcpauth.util.Redaction;
import io.mcpauth.util.Utils;

/**
 * RFC 8693 token exchange client that proves possession of an ephemeral key with DPoP.
 * <p>
 * Each {@link #exchange(String)} call uses its own key pair. If the token endpoint
 * answers {@code 400 use_dpop_nonce}, the request is repeated exactly once with a proof
 * that carries the server's nonce. No other failure is retried.
 */
public class TokenExchangeClient {

	private static final Logger logger = LoggerFactory.getLogger(TokenExchangeClient.class);

	public static final String GRANT_TYPE = "urn:ietf:params:oauth:grant-type:token-exchange";

	public static final String ACCESS_TOKEN_TYPE = "urn:ietf:params:oauth:token-type:access_token";

	public static final String USE_DPOP_NONCE = "use_dpop_nonce";

	public static final String DPOP_HEADER = "DPoP";

	public static final String DPOP_NONCE_HEADER = "DPoP-Nonce";

	private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
	};

	private final URI tokenUri;

	private final String clientId;

	private final String clientSecret;

	private final String scope;

	private final String audience;

	private final HttpClient httpClient;

	private final DPoPProofFactory proofFactory;

	private final Duration timeout;

	private final ObjectMapper objectMapper;

	public TokenExchangeClient(AuthSettings settings, HttpClient httpClient) {
		this(settings.getTokenUri(), settings.getClientId(), settings.getClientSecret(),
				settings.getDownstreamScope(), settings.getDownstreamAudience(), httpClient, new DPoPProofFactory(),
				settings.getRequestTimeout(), new ObjectMapper());
	}

	public TokenExchangeClient(URI tokenUri, String clientId, String clientSecret, String scope, String audience,
			HttpClient httpClient, DPoPProofFactory proofFactory, Duration timeout, ObjectMapper objectMapper) {
		Assert.notNull(tokenUri, "tokenUri must not be null");
		Assert.hasText(clientId, "clientId must not be empty");
		Assert.hasText(clientSecret, "clientSecret must not be empty");
		Assert.notNull(httpClient, "httpClient must not be null");
		Assert.notNull(proofFactory, "proofFactory must not be null");
		Assert.notNull(timeout, "timeout must not be null");
		Assert.notNull(objectMapper, "objectMapper must not be null");
		this.tokenUri = tokenUri;
		this.clientId = clientId;
		this.clientSecret = clientSecret;
		this.scope = scope;
		this.audience = audience;
		this.httpClient = httpClient;
		this.proofFactory = proofFactory;
		this.timeout = timeout;
		this.objectMapper = objectMapper;
	}

	/**
	 * Exchange a verified access token for one scoped to the downstream API.
	 * @param subjectToken the caller's access token
	 * @return a future completing with the new access token
	 */
	public CompletableFuture<String> exchange(String subjectToken) {
		Assert.hasText(subjectToken, "subjectToken must not be empty");

		RSAKey dpopKey;
		try {
			dpopKey = proofFactory.generateKey();
		}
		catch (RuntimeException e) {
			return CompletableFuture.failedFuture(e);
		}

		String body = Utils.formEncode(formParameters(subjectToken));
		logger.debug("Exchanging token {} for audience {}", Redaction.token(subjectToken), audience);

		return send(body, dpopKey, null).thenCompose(response -> {
			if (!isNonceChallenge(response)) {
				return CompletableFuture.completedFuture(response);
			}
			String nonce = response.headers().firstValue(DPOP_NONCE_HEADER).orElse(null);
			if (!Utils.hasText(nonce)) {
				throw new AuthException(AuthError.MISSING_NONCE,
						"Token endpoint requires a DPoP nonce but sent no " + DPOP_NONCE_HEADER + " header");
			}
			logger.warn("Token endpoint requested a DPoP nonce, retrying once");
			return send(body, dpopKey, nonce);
		}).thenApply(this::accessTokenOf);
	}

	private Map<String, String> formParameters(String subjectToken) {
		Map<String, String> params = new LinkedHashMap<>();
		params.put("grant_type", GRANT_TYPE);
		params.put("subject_token", subjectToken);
		params.put("subject_token_type", ACCESS_TOKEN_TYPE);
		params.put("requested_token_type", ACCESS_TOKEN_TYPE);
		params.put("scope", scope);
		params.put("audience", audience);
		return params;
	}

	private CompletableFuture<HttpResponse<String>> send(String body, RSAKey dpopKey, String nonce) {
		HttpRequest request = HttpRequest.newBuilder()
			.uri(tokenUri)
			.timeout(timeout)
			.header("Content-Type", "application/x-www-form-urlencoded")
			.header("Accept", "application/json")
			.header("Authorization", Utils.basicAuthorization(clientId, clientSecret))
			.header(DPOP_HEADER, proofFactory.createProof("POST", tokenUri, dpopKey, nonce))
			.POST(HttpRequest.BodyPublishers.ofString(body))
			.build();
		return httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString());
	}

	private boolean isNonceChallenge(HttpResponse<String> response) {
		if (response.statusCode() != 400) {
			return false;
		}
		Map<String, Object> error = readJson(response.body());
		return error != null && USE_DPOP_NONCE.equals(error.get("error"));
	}

	private String accessTokenOf(HttpResponse<String> response) {
		if (response.statusCode() != 200) {
			throw new OAuthHttpException(AuthError.TOKEN_EXCHANGE_FAILED, response.statusCode(), response.body());
		}
		Map<String, Object> data = readJson(response.body());
		Object accessToken = data != null ? data.get("access_token") : null;
		if (!(accessToken instanceof String)) {
			throw new OAuthHttpException(AuthError.TOKEN_EXCHANGE_FAILED, response.statusCode(), response.body());
		}
		logger.info("Token exchange succeeded for audience {}", audience);
		return (String) accessToken;
	}

	private Map<String, Object> readJson(String body) {
		if (!Utils.hasText(body)) {
			return null;
		}
		try {
			return objectMapper.readValue(body, MAP_TYPE);
		}
		catch (IOException e) {
			logger.debug("Token endpoint returned a non-JSON body: {}", e.getMessage());
			return null;
		}
	}

}
