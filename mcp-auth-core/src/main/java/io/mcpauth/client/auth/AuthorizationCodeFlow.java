/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.mcpauth.client.auth;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;
import java.util.function.Supplier;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.mcpauth.auth.AuthSettings;
import io.mcpauth.auth.OAuthClientInformation;
import io.mcpauth.auth.OAuthToken;
import io.mcpauth.auth.exception.AuthError;
import io.mcpauth.auth.exception.AuthException;
import io.mcpauth.auth.exception.OAuthHttpException;
import io.mcpauth.util.Assert;
import io.mcpauth.util.Redaction;
import io.mcpauth.util.Utils;

/**
 * OAuth 2.0 authorization code flow with PKCE for a client that owns a loopback
 * redirect URI.
 * <p>
 * One call to {@link #authenticate()} is one attempt: it starts the callback listener,
 * hands the authorization URL to the redirect handler (usually a browser launcher),
 * waits for the code, checks the returned state and exchanges the code for tokens. The
 * listener is stopped whether the attempt succeeds or fails.
 */
public class AuthorizationCodeFlow {

	private static final Logger logger = LoggerFactory.getLogger(AuthorizationCodeFlow.class);

	private final URI authorizationUri;

	private final URI tokenUri;

	private final OAuthClientInformation clientInfo;

	private final int callbackPort;

	private final String callbackPath;

	private final Duration callbackTimeout;

	private final Duration requestTimeout;

	private final HttpClient httpClient;

	private final TokenStorage storage;

	private final Function<String, CompletableFuture<Void>> redirectHandler;

	private final Supplier<OAuthSession> sessionFactory;

	private final ObjectMapper objectMapper = new ObjectMapper();

	/**
	 * Creates a flow that generates a fresh PKCE verifier and state for every attempt.
	 * @param settings the client settings
	 * @param httpClient client used for the token request
	 * @param storage where obtained tokens are stored
	 * @param redirectHandler function to handle the authorization URL (e.g., opening a
	 * browser)
	 */
	public AuthorizationCodeFlow(AuthSettings settings, HttpClient httpClient, TokenStorage storage,
			Function<String, CompletableFuture<Void>> redirectHandler) {
		this(settings, httpClient, storage, redirectHandler, OAuthSession::create);
	}

	public AuthorizationCodeFlow(AuthSettings settings, HttpClient httpClient, TokenStorage storage,
			Function<String, CompletableFuture<Void>> redirectHandler, Supplier<OAuthSession> sessionFactory) {
		Assert.notNull(settings, "settings must not be null");
		Assert.hasText(settings.getClientId(), "clientId must not be empty");
		Assert.notNull(httpClient, "httpClient must not be null");
		Assert.notNull(storage, "storage must not be null");
		Assert.notNull(redirectHandler, "redirectHandler must not be null");
		Assert.notNull(sessionFactory, "sessionFactory must not be null");
		this.authorizationUri = settings.getAuthorizationUri();
		this.tokenUri = settings.getTokenUri();
		this.clientInfo = OAuthClientInformation.from(settings);
		this.callbackPort = settings.getCallbackPort();
		this.callbackPath = settings.getCallbackPath();
		this.callbackTimeout = settings.getCallbackTimeout();
		this.requestTimeout = settings.getRequestTimeout();
		this.httpClient = httpClient;
		this.storage = storage;
		this.redirectHandler = redirectHandler;
		this.sessionFactory = sessionFactory;
	}

	/**
	 * Run one authorization attempt.
	 * @return A CompletableFuture that resolves to the tokens, or fails with an
	 * {@link AuthException}
	 */
	public CompletableFuture<OAuthToken> authenticate() {
		OAuthSession session = sessionFactory.get();
		LoopbackCallbackServer listener;
		try {
			listener = LoopbackCallbackServer.start(callbackPort, callbackPath);
		}
		catch (IOException e) {
			session.fail();
			return CompletableFuture.failedFuture(
					new UncheckedIOException("Cannot listen for the OAuth callback on port " + callbackPort, e));
		}

		CompletableFuture<OAuthToken> attempt;
		try {
			session.awaitingCallback();
			URI redirectUri = listener.getRedirectUri();
			String authUrl = buildAuthorizationUrl(session, redirectUri);
			logger.info("Waiting up to {}s for authorization on {}", callbackTimeout.toSeconds(), redirectUri);

			attempt = redirectHandler.apply(authUrl)
				.thenCompose(v -> listener.awaitCallback(callbackTimeout).toFuture())
				.thenCompose(callback -> {
					session.codeReceived(callback.getCode());
					if (!session.isStateMatching(callback.getState())) {
						throw new AuthException(AuthError.CSRF_MISMATCH,
								"State parameter mismatch: possible CSRF attack");
					}
					session.exchanging();
					return exchangeCodeForToken(session, redirectUri);
				})
				.thenCompose(tokens -> storage.setTokens(tokens)
					.thenCompose(v -> storage.setClientInfo(clientInfo))
					.thenApply(v -> tokens));
		}
		catch (RuntimeException e) {
			attempt = CompletableFuture.failedFuture(e);
		}

		return attempt.whenComplete((tokens, ex) -> {
			listener.close();
			if (ex != null) {
				session.fail();
				logger.warn("Authorization failed: {}", AuthException.unwrapFailure(ex).getMessage());
			}
			else {
				session.complete();
				logger.info("Authorization complete, access token {}", Redaction.token(tokens.getAccessToken()));
			}
		});
	}

	/**
	 * Build the authorization URL. The client secret is never part of it.
	 */
	String buildAuthorizationUrl(OAuthSession session, URI redirectUri) {
		Map<String, String> params = new LinkedHashMap<>();
		params.put("response_type", "code");
		params.put("client_id", clientInfo.getClientId());
		params.put("scope", clientInfo.getScope());
		params.put("redirect_uri", redirectUri.toString());
		params.put("state", session.getState());
		params.put("code_challenge", session.getCodeChallenge());
		params.put("code_challenge_method", "S256");
		return authorizationUri + "?" + Utils.formEncode(params);
	}

	private CompletableFuture<OAuthToken> exchangeCodeForToken(OAuthSession session, URI redirectUri) {
		Map<String, String> formData = new LinkedHashMap<>();
		formData.put("grant_type", "authorization_code");
		formData.put("code", session.getAuthorizationCode());
		formData.put("redirect_uri", redirectUri.toString());
		formData.put("client_id", clientInfo.getClientId());
		formData.put("code_verifier", session.getCodeVerifier());
		formData.put("client_secret", clientInfo.getClientSecret());

		HttpRequest request = HttpRequest.newBuilder()
			.uri(tokenUri)
			.header("Content-Type", "application/x-www-form-urlencoded")
			.header("Accept", "application/json")
			.timeout(requestTimeout)
			.POST(HttpRequest.BodyPublishers.ofString(Utils.formEncode(formData)))
			.build();

		logger.debug("Exchanging authorization code {} at {}", Redaction.token(session.getAuthorizationCode()),
				tokenUri);
		return httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString()).thenApply(response -> {
			if (response.statusCode() != 200) {
				throw new OAuthHttpException(AuthError.CODE_EXCHANGE_FAILED, response.statusCode(), response.body());
			}
			OAuthToken tokens;
			try {
				tokens = objectMapper.readValue(response.body(), OAuthToken.class);
			}
			catch (IOException e) {
				throw new OAuthHttpException(AuthError.CODE_EXCHANGE_FAILED, response.statusCode(), response.body());
			}
			if (!Utils.hasText(tokens.getAccessToken())) {
				throw new OAuthHttpException(AuthError.CODE_EXCHANGE_FAILED, response.statusCode(), response.body());
			}
			return tokens;
		});
	}

}
