/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.mcpauth.server.auth.keys;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.text.ParseException;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.locks.ReentrantLock;

import com.nimbusds.jose.jwk.JWK;
import com.nimbusds.jose.jwk.JWKSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.mcpauth.auth.exception.AuthError;
import io.mcpauth.auth.exception.AuthException;
import io.mcpauth.util.Assert;

/**
 * Fetches and caches the identity provider's signing keys from its JWKS endpoint.
 * <p>
 * The cache has no expiry: a key id that is not cached triggers one fetch of the key
 * set, and the fetched set replaces the cache. Concurrent misses share a single
 * in-flight fetch. Reads never block; the key map is replaced, not mutated.
 */
public class JwksKeyProvider {

	private static final Logger logger = LoggerFactory.getLogger(JwksKeyProvider.class);

	private final URI jwksUri;

	private final HttpClient httpClient;

	private final Duration timeout;

	private volatile Map<String, JWK> keys = Map.of();

	private final ReentrantLock refreshLock = new ReentrantLock();

	// Guarded by refreshLock
	private CompletableFuture<Map<String, JWK>> inFlight;

	public JwksKeyProvider(URI jwksUri, HttpClient httpClient, Duration timeout) {
		Assert.notNull(jwksUri, "jwksUri must not be null");
		Assert.notNull(httpClient, "httpClient must not be null");
		Assert.notNull(timeout, "timeout must not be null");
		this.jwksUri = jwksUri;
		this.httpClient = httpClient;
		this.timeout = timeout;
	}

	/**
	 * Resolve the signing key with the given key id, fetching the key set if the id is
	 * not cached.
	 * @param keyId the {@code kid} from the token header
	 * @return a future completing with the key, or failing with
	 * {@link AuthError#KEY_NOT_FOUND} if no key in the current set matches
	 */
	public CompletableFuture<JWK> getKey(String keyId) {
		JWK cached = keys.get(keyId);
		if (cached != null) {
			return CompletableFuture.completedFuture(cached);
		}

		logger.debug("Signing key {} not cached, fetching {}", keyId, jwksUri);
		return refresh().thenApply(refreshed -> {
			JWK key = refreshed.get(keyId);
			if (key == null) {
				throw new AuthException(AuthError.KEY_NOT_FOUND, "Unable to find appropriate key");
			}
			return key;
		});
	}

	/**
	 * The currently cached key ids.
	 * @return an immutable snapshot
	 */
	public Map<String, JWK> getCachedKeys() {
		return keys;
	}

	private CompletableFuture<Map<String, JWK>> refresh() {
		refreshLock.lock();
		try {
			if (inFlight != null) {
				return inFlight;
			}
			CompletableFuture<Map<String, JWK>> fetch = new CompletableFuture<>();
			inFlight = fetch;
			fetchKeys().whenComplete((fetched, ex) -> {
				refreshLock.lock();
				try {
					if (fetched != null) {
						keys = fetched;
					}
					if (inFlight == fetch) {
						inFlight = null;
					}
				}
				finally {
					refreshLock.unlock();
				}
				if (ex != null) {
					fetch.completeExceptionally(ex);
				}
				else {
					fetch.complete(fetched);
				}
			});
			return fetch;
		}
		finally {
			refreshLock.unlock();
		}
	}

	private CompletableFuture<Map<String, JWK>> fetchKeys() {
		HttpRequest request = HttpRequest.newBuilder(jwksUri)
			.header("Accept", "application/json")
			.timeout(timeout)
			.GET()
			.build();

		return httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString())
			.handle((response, ex) -> {
				if (ex != null) {
					throw new AuthException(AuthError.KEY_NOT_FOUND, "Unable to fetch signing keys from " + jwksUri,
							ex);
				}
				if (response.statusCode() != 200) {
					throw new AuthException(AuthError.KEY_NOT_FOUND,
							"Unable to fetch signing keys: HTTP " + response.statusCode());
				}
				try {
					Map<String, JWK> fetched = new HashMap<>();
					for (JWK jwk : JWKSet.parse(response.body()).getKeys()) {
						if (jwk.getKeyID() != null) {
							fetched.put(jwk.getKeyID(), jwk);
						}
					}
					logger.info("Fetched {} signing key(s) from {}", fetched.size(), jwksUri);
					return Map.copyOf(fetched);
				}
				catch (ParseException e) {
					throw new AuthException(AuthError.KEY_NOT_FOUND, "Malformed key set from " + jwksUri, e);
				}
			});
	}

}
