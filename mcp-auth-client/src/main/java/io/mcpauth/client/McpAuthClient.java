/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.mcpauth.client;

import java.net.URI;
import java.net.http.HttpClient;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.mcpauth.auth.AuthSettings;
import io.mcpauth.auth.HttpClientFactory;
import io.mcpauth.auth.OAuthToken;
import io.mcpauth.auth.exception.AuthException;
import io.mcpauth.client.auth.AuthorizationCodeFlow;
import io.mcpauth.client.auth.InMemoryTokenStorage;
import io.mcpauth.client.auth.TokenStorage;
import io.mcpauth.client.transport.McpHttpClient;
import io.mcpauth.spec.McpToolSchema.CallToolResult;
import io.mcpauth.spec.McpToolSchema.TextContent;
import io.mcpauth.spec.McpToolSchema.Tool;

/**
 * Command-line client: logs in with the authorization code flow, then lists the
 * server's tools and calls each of them.
 */
public class McpAuthClient {

	private static final Logger logger = LoggerFactory.getLogger(McpAuthClient.class);

	private final AuthSettings settings;

	private final HttpClient httpClient;

	private final TokenStorage tokenStorage = new InMemoryTokenStorage();

	public McpAuthClient(AuthSettings settings) {
		this.settings = settings;
		this.httpClient = HttpClientFactory.create(settings);
	}

	/**
	 * Log in and run the three tools.
	 * @return the process exit code
	 */
	public int run() {
		try {
			System.out.println("🔑 Starting OAuth login against " + settings.getIssuer());
			OAuthToken tokens = new AuthorizationCodeFlow(settings, httpClient, tokenStorage, new BrowserLauncher())
				.authenticate()
				.join();
			System.out.println("✅ Logged in, token expires in " + tokens.getExpiresIn() + "s");

			McpHttpClient client = new McpHttpClient(mcpEndpoint(settings.getServerUrl()), httpClient,
					() -> tokenStorage.getTokens().join().getAccessToken(), settings.getRequestTimeout(),
					new ObjectMapper());

			List<Tool> tools = client.listTools().join().tools();
			System.out.println("\n📋 Available tools:");
			for (Tool tool : tools) {
				System.out.println("  - " + tool.name() + ": " + tool.description());
			}

			print("get_current_time", client.callTool("get_current_time", Map.of()).join());
			print("calculate_square", client.callTool("calculate_square", Map.of("number", 7)).join());
			if (tools.stream().anyMatch(tool -> "call_third_party_api".equals(tool.name()))) {
				print("call_third_party_api", client.callTool("call_third_party_api", Map.of()).join());
			}
			return 0;
		}
		catch (RuntimeException e) {
			AuthException authException = AuthException.unwrap(e);
			Throwable cause = authException != null ? authException : AuthException.unwrapFailure(e);
			logger.error("Client failed: {}", cause.getMessage(), cause);
			System.err.println("❌ " + cause.getMessage());
			return 1;
		}
	}

	/**
	 * The JSON-RPC endpoint for a server base URL. A URL that already names the
	 * {@code /mcp} endpoint is used as is.
	 * @param serverUrl the configured server URL
	 * @return the endpoint URI
	 */
	static URI mcpEndpoint(String serverUrl) {
		String base = serverUrl.trim();
		while (base.endsWith("/")) {
			base = base.substring(0, base.length() - 1);
		}
		return URI.create(base.endsWith("/mcp") ? base : base + "/mcp");
	}

	private static void print(String name, CallToolResult result) {
		System.out.println("\n🔧 " + name + (Boolean.TRUE.equals(result.isError()) ? " (error)" : ""));
		for (TextContent content : result.content()) {
			System.out.println("  " + content.text());
		}
	}

	public static void main(String[] args) {
		int exitCode = new McpAuthClient(AuthSettings.fromEnvironment(System.getenv())).run();
		System.exit(exitCode);
	}

}
