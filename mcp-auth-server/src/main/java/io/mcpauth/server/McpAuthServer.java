/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.mcpauth.server;

import java.net.URI;
import java.net.http.HttpClient;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.Servlet;
import org.apache.catalina.LifecycleException;
import org.apache.catalina.startup.Tomcat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.mcpauth.auth.AuthSettings;
import io.mcpauth.auth.HttpClientFactory;
import io.mcpauth.client.auth.exchange.TokenExchangeClient;
import io.mcpauth.server.auth.introspection.IntrospectionClient;
import io.mcpauth.server.auth.keys.JwksKeyProvider;
import io.mcpauth.server.auth.middleware.BearerAuthenticator;
import io.mcpauth.server.auth.middleware.ScopeEnforcer;
import io.mcpauth.server.auth.verifier.IntrospectionTokenVerifier;
import io.mcpauth.server.auth.verifier.JwtTokenVerifier;
import io.mcpauth.server.auth.verifier.TokenVerifier;
import io.mcpauth.server.downstream.ThirdPartyApiClient;
import io.mcpauth.server.metadata.ProtectedResourceMetadata;
import io.mcpauth.server.tools.ServerTools;
import io.mcpauth.server.tools.ToolSpecification;
import io.mcpauth.server.transport.McpToolServlet;
import io.mcpauth.server.transport.ProtectedResourceMetadataServlet;

/**
 * MCP resource server protected by the identity provider's access tokens.
 * <p>
 * Tokens are introspected when a client secret is configured and verified locally
 * against the published keys otherwise.
 */
public class McpAuthServer {

	private static final Logger logger = LoggerFactory.getLogger(McpAuthServer.class);

	public static final String MCP_ENDPOINT = "/mcp";

	private final AuthSettings settings;

	private final HttpClient httpClient;

	private final TokenVerifier verifier;

	private final ObjectMapper objectMapper = new ObjectMapper();

	private Tomcat tomcat;

	public McpAuthServer(AuthSettings settings) {
		this(settings, HttpClientFactory.create(settings));
	}

	public McpAuthServer(AuthSettings settings, HttpClient httpClient) {
		this(settings, httpClient, createVerifier(settings, httpClient));
	}

	public McpAuthServer(AuthSettings settings, HttpClient httpClient, TokenVerifier verifier) {
		this.settings = settings;
		this.httpClient = httpClient;
		this.verifier = verifier;
	}

	static TokenVerifier createVerifier(AuthSettings settings, HttpClient httpClient) {
		if (settings.hasClientSecret()) {
			logger.info("Verifying tokens by introspection at {}", settings.getIntrospectionUri());
			return new IntrospectionTokenVerifier(new IntrospectionClient(settings.getIntrospectionUri(),
					settings.getClientId(), settings.getClientSecret(), httpClient, settings.getRequestTimeout(),
					new ObjectMapper()));
		}
		logger.info("Verifying tokens locally with keys from {}", settings.getJwksUri());
		JwksKeyProvider keyProvider = new JwksKeyProvider(settings.getJwksUri(), httpClient,
				settings.getRequestTimeout());
		return new JwtTokenVerifier(keyProvider, settings.getIssuer(), settings.getAudience());
	}

	List<ToolSpecification> tools() {
		List<ToolSpecification> tools = new ArrayList<>();
		tools.add(ServerTools.getCurrentTime(Clock.systemUTC()));
		tools.add(ServerTools.calculateSquare());
		if (settings.hasDownstreamApi() && settings.hasClientSecret()) {
			TokenExchangeClient exchangeClient = new TokenExchangeClient(settings, httpClient);
			ThirdPartyApiClient apiClient = new ThirdPartyApiClient(URI.create(settings.getDownstreamApiUrl()),
					httpClient, settings.getRequestTimeout());
			tools.add(ServerTools.callThirdPartyApi(exchangeClient, apiClient));
		}
		else {
			logger.info("No third-party API configured, call_third_party_api is disabled");
		}
		return tools;
	}

	/**
	 * Start serving.
	 * @return the bound port
	 */
	public int start() throws LifecycleException {
		String metadataUrl = ProtectedResourceMetadata.urlFor(settings.getServerUrl());
		BearerAuthenticator authenticator = new BearerAuthenticator(verifier,
				new ScopeEnforcer(settings.getRequiredScopes()));

		Map<String, Servlet> servlets = new LinkedHashMap<>();
		servlets.put(MCP_ENDPOINT, new McpToolServlet(authenticator, tools(), objectMapper, metadataUrl,
				settings.getRequiredScopes()));
		servlets.put(ProtectedResourceMetadata.WELL_KNOWN_PATH,
				new ProtectedResourceMetadataServlet(ProtectedResourceMetadata.from(settings), objectMapper));

		tomcat = EmbeddedTomcat.start(settings.getServerHost(), settings.getServerPort(), servlets);
		int port = EmbeddedTomcat.localPort(tomcat);
		logger.info("MCP server started on {}:{}", settings.getServerHost(), port);
		logger.info("Using issuer: {}", settings.getIssuer());
		logger.info("Required scopes: {}", settings.getRequiredScopes());
		return port;
	}

	public void stop() throws LifecycleException {
		if (tomcat != null) {
			EmbeddedTomcat.stop(tomcat);
			tomcat = null;
		}
	}

	public static void main(String[] args) throws Exception {
		McpAuthServer server = new McpAuthServer(AuthSettings.fromEnvironment(System.getenv()));
		try {
			server.start();
			server.tomcat.getServer().await();
		}
		catch (LifecycleException e) {
			logger.error("Failed to start server", e);
			throw e;
		}
		finally {
			logger.info("Shutting down MCP server...");
			server.stop();
		}
	}

}
