/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.mcpauth.server;

import java.util.Map;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.catalina.LifecycleException;
import org.apache.catalina.startup.Tomcat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.mcpauth.auth.AuthSettings;
import io.mcpauth.auth.HttpClientFactory;
import io.mcpauth.server.auth.keys.JwksKeyProvider;
import io.mcpauth.server.auth.verifier.JwtTokenVerifier;
import io.mcpauth.server.transport.JwtValidatorServlet;

/**
 * Standalone service that validates JWTs locally and returns their claims.
 */
public final class JwtValidatorServer {

	private static final Logger logger = LoggerFactory.getLogger(JwtValidatorServer.class);

	private JwtValidatorServer() {
	}

	public static Tomcat start(AuthSettings settings, JwtTokenVerifier verifier) throws LifecycleException {
		Tomcat tomcat = EmbeddedTomcat.start(null, settings.getValidatorPort(),
				Map.of("/", new JwtValidatorServlet(verifier, new ObjectMapper())));
		logger.info("JWT validator started on port {} for issuer {} and audience {}",
				EmbeddedTomcat.localPort(tomcat), settings.getIssuer(), settings.getAudience());
		return tomcat;
	}

	public static void main(String[] args) throws Exception {
		AuthSettings settings = AuthSettings.fromEnvironment(System.getenv());
		JwksKeyProvider keyProvider = new JwksKeyProvider(settings.getJwksUri(), HttpClientFactory.create(settings),
				settings.getRequestTimeout());
		Tomcat tomcat = start(settings, new JwtTokenVerifier(keyProvider, settings.getIssuer(), settings.getAudience()));
		try {
			tomcat.getServer().await();
		}
		finally {
			EmbeddedTomcat.stop(tomcat);
		}
	}

}
