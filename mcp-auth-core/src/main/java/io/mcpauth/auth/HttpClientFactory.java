/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.mcpauth.auth;

import java.io.IOException;
import java.io.InputStream;
import java.net.Socket;
import java.net.http.HttpClient;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.KeyStore;
import java.security.SecureRandom;
import java.security.cert.Certificate;
import java.security.cert.CertificateFactory;
import java.security.cert.X509Certificate;
import java.time.Duration;
import java.util.Collection;

import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLEngine;
import javax.net.ssl.TrustManager;
import javax.net.ssl.TrustManagerFactory;
import javax.net.ssl.X509ExtendedTrustManager;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.mcpauth.util.Utils;

/**
 * Creates the {@link HttpClient} used for every call to the identity provider and to
 * downstream services, honoring the SSL verification toggle and custom CA bundle.
 */
public final class HttpClientFactory {

	private static final Logger logger = LoggerFactory.getLogger(HttpClientFactory.class);

	public static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(30);

	private HttpClientFactory() {
	}

	/**
	 * Create a client for the given settings. A custom CA bundle takes precedence over
	 * the verification toggle.
	 * @param settings the settings
	 * @return a new client
	 * @throws IllegalStateException if the CA bundle cannot be read
	 */
	public static HttpClient create(AuthSettings settings) {
		HttpClient.Builder builder = HttpClient.newBuilder()
			.connectTimeout(CONNECT_TIMEOUT)
			.followRedirects(HttpClient.Redirect.NORMAL);

		if (Utils.hasText(settings.getCaBundlePath())) {
			logger.info("Using custom CA bundle: {}", settings.getCaBundlePath());
			builder.sslContext(trustingBundle(Path.of(settings.getCaBundlePath())));
		}
		else if (!settings.isVerifySsl()) {
			logger.warn("SSL verification is disabled. This is insecure and should only be used in testing environments.");
			builder.sslContext(trustingAll());
		}
		return builder.build();
	}

	static SSLContext trustingBundle(Path bundle) {
		try (InputStream in = Files.newInputStream(bundle)) {
			CertificateFactory certificateFactory = CertificateFactory.getInstance("X.509");
			Collection<? extends Certificate> certificates = certificateFactory.generateCertificates(in);
			if (certificates.isEmpty()) {
				throw new IllegalStateException("No certificates found in CA bundle " + bundle);
			}

			KeyStore trustStore = KeyStore.getInstance(KeyStore.getDefaultType());
			trustStore.load(null, null);
			int index = 0;
			for (Certificate certificate : certificates) {
				trustStore.setCertificateEntry("ca-" + index++, certificate);
			}

			TrustManagerFactory trustManagerFactory = TrustManagerFactory
				.getInstance(TrustManagerFactory.getDefaultAlgorithm());
			trustManagerFactory.init(trustStore);

			SSLContext sslContext = SSLContext.getInstance("TLS");
			sslContext.init(null, trustManagerFactory.getTrustManagers(), new SecureRandom());
			return sslContext;
		}
		catch (IOException | GeneralSecurityException e) {
			throw new IllegalStateException("Failed to load CA bundle " + bundle, e);
		}
	}

	/**
	 * An SSL context that accepts any server certificate and host name. The trust manager
	 * is an {@link X509ExtendedTrustManager} so the JDK does not wrap it with its own
	 * endpoint identification.
	 */
	static SSLContext trustingAll() {
		TrustManager[] trustAll = { new TrustAllManager() };
		try {
			SSLContext sslContext = SSLContext.getInstance("TLS");
			sslContext.init(null, trustAll, new SecureRandom());
			return sslContext;
		}
		catch (GeneralSecurityException e) {
			throw new IllegalStateException("Failed to initialize SSL context", e);
		}
	}

	private static final class TrustAllManager extends X509ExtendedTrustManager {

		@Override
		public void checkClientTrusted(X509Certificate[] chain, String authType) {
		}

		@Override
		public void checkServerTrusted(X509Certificate[] chain, String authType) {
		}

		@Override
		public void checkClientTrusted(X509Certificate[] chain, String authType, Socket socket) {
		}

		@Override
		public void checkServerTrusted(X509Certificate[] chain, String authType, Socket socket) {
		}

		@Override
		public void checkClientTrusted(X509Certificate[] chain, String authType, SSLEngine engine) {
		}

		@Override
		public void checkServerTrusted(X509Certificate[] chain, String authType, SSLEngine engine) {
		}

		@Override
		public X509Certificate[] getAcceptedIssuers() {
			return new X509Certificate[0];
		}

	}

}
