/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.mcpauth.server;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import io.mcpauth.auth.AccessToken;
import io.mcpauth.auth.AuthSettings;
import io.mcpauth.auth.exception.AuthError;
import io.mcpauth.auth.exception.AuthException;
import io.mcpauth.server.auth.verifier.TokenVerifier;
import io.mcpauth.spec.McpToolSchema.ErrorCodes;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Drives the protected MCP endpoint over HTTP with a stub verifier.
 */
@Timeout(20)
class McpAuthServerTests {

	private static final int PORT = TomcatTestUtil.findAvailablePort();

	private static final String BASE_URL = "http://localhost:" + PORT;

	private final ObjectMapper objectMapper = new ObjectMapper();

	private final HttpClient httpClient = HttpClient.newHttpClient();

	private McpAuthServer server;

	@BeforeEach
	void setUp() throws Exception {
		AuthSettings settings = AuthSettings.builder()
			.issuer("https://idp.example.com/oauth2/default")
			.serverHost("localhost")
			.serverPort(PORT)
			.build();
		TokenVerifier verifier = token -> switch (token) {
			case "good-token" -> CompletableFuture.completedFuture(new AccessToken(token, "client-123",
					List.of("openid", "mcp:access"), null, "alice@example.com"));
			case "narrow-token" ->
				CompletableFuture.completedFuture(new AccessToken(token, "client-123", List.of("openid"), null));
			default -> CompletableFuture.failedFuture(new AuthException(AuthError.INVALID_TOKEN, "Invalid token"));
		};
		server = new McpAuthServer(settings, httpClient, verifier);
		assertThat(server.start()).isEqualTo(PORT);
	}

	@AfterEach
	void tearDown() throws Exception {
		server.stop();
	}

	private HttpResponse<String> post(String authorization, String body) throws Exception {
		HttpRequest.Builder request = HttpRequest.newBuilder(URI.create(BASE_URL + McpAuthServer.MCP_ENDPOINT))
			.header("Content-Type", "application/json")
			.POST(HttpRequest.BodyPublishers.ofString(body));
		if (authorization != null) {
			request.header("Authorization", authorization);
		}
		return httpClient.send(request.build(), HttpResponse.BodyHandlers.ofString());
	}

	private JsonNode call(String body) throws Exception {
		HttpResponse<String> response = post("Bearer good-token", body);
		assertThat(response.statusCode()).isEqualTo(200);
		return objectMapper.readTree(response.body());
	}

	@Test
	void missingTokenIsChallengedWithResourceMetadata() throws Exception {
		HttpResponse<String> response = post(null, "{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"tools/list\"}");

		assertThat(response.statusCode()).isEqualTo(401);
		assertThat(response.headers().firstValue("WWW-Authenticate")).hasValue(
				"Bearer resource_metadata=\"" + BASE_URL + "/.well-known/oauth-protected-resource\"");
		assertThat(objectMapper.readTree(response.body()).get("error").asText()).isEqualTo("invalid_request");
	}

	@Test
	void invalidTokenIsRejected() throws Exception {
		HttpResponse<String> response = post("Bearer forged", "{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"tools/list\"}");

		assertThat(response.statusCode()).isEqualTo(401);
		assertThat(response.headers().firstValue("WWW-Authenticate").orElseThrow())
			.startsWith("Bearer error=\"invalid_token\", error_description=\"Invalid token\"")
			.contains("resource_metadata=");
	}

	@Test
	void otherSchemesCountAsMissingCredentials() throws Exception {
		HttpResponse<String> response = post("Basic Y2xpZW50OnNlY3JldA==",
				"{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"tools/list\"}");

		assertThat(response.statusCode()).isEqualTo(401);
		assertThat(response.headers().firstValue("WWW-Authenticate").orElseThrow()).doesNotContain("error=");
	}

	@Test
	void missingScopeIsForbidden() throws Exception {
		HttpResponse<String> response = post("Bearer narrow-token",
				"{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"tools/list\"}");

		assertThat(response.statusCode()).isEqualTo(403);
		assertThat(response.headers().firstValue("WWW-Authenticate").orElseThrow())
			.contains("error=\"insufficient_scope\"")
			.contains("scope=\"mcp:access\"");
		assertThat(objectMapper.readTree(response.body()).get("error_description").asText())
			.isEqualTo("Missing required scope: mcp:access");
	}

	@Test
	void listsToolsWithoutThirdPartyApiWhenNotConfigured() throws Exception {
		JsonNode response = call("{\"jsonrpc\":\"2.0\",\"id\":\"req-1\",\"method\":\"tools/list\"}");

		assertThat(response.get("id").asText()).isEqualTo("req-1");
		assertThat(response.at("/result/tools").findValuesAsText("name")).containsExactly("get_current_time",
				"calculate_square");
	}

	@Test
	void callsCalculateSquare() throws Exception {
		JsonNode response = call("""
				{"jsonrpc":"2.0","id":2,"method":"tools/call","params":{"name":"calculate_square","arguments":{"number":7}}}
				""");

		assertThat(response.get("id").asInt()).isEqualTo(2);
		assertThat(response.at("/result/isError").asBoolean()).isFalse();
		assertThat(response.at("/result/structuredContent/square").asDouble()).isEqualTo(49.0);
		assertThat(response.at("/result/content/0/text").asText()).contains("\"square\":49.0");
	}

	@Test
	void callsGetCurrentTime() throws Exception {
		JsonNode response = call("""
				{"jsonrpc":"2.0","id":3,"method":"tools/call","params":{"name":"get_current_time"}}
				""");

		assertThat(response.at("/result/structuredContent/timezone").asText()).isEqualTo("UTC");
		assertThat(response.at("/result/structuredContent/message").asText())
			.isEqualTo("Hello from authenticated MCP server!");
	}

	@Test
	void badArgumentsAreInvalidParams() throws Exception {
		JsonNode response = call("""
				{"jsonrpc":"2.0","id":4,"method":"tools/call","params":{"name":"calculate_square","arguments":{"number":"seven"}}}
				""");

		assertThat(response.at("/error/code").asInt()).isEqualTo(ErrorCodes.INVALID_PARAMS);
	}

	@Test
	void unknownToolIsInvalidParams() throws Exception {
		JsonNode response = call("""
				{"jsonrpc":"2.0","id":5,"method":"tools/call","params":{"name":"rm_rf"}}
				""");

		assertThat(response.at("/error/code").asInt()).isEqualTo(ErrorCodes.INVALID_PARAMS);
		assertThat(response.at("/error/message").asText()).isEqualTo("Unknown tool: rm_rf");
	}

	@Test
	void unknownMethodIsNotFound() throws Exception {
		JsonNode response = call("{\"jsonrpc\":\"2.0\",\"id\":6,\"method\":\"resources/list\"}");

		assertThat(response.at("/error/code").asInt()).isEqualTo(ErrorCodes.METHOD_NOT_FOUND);
	}

	@Test
	void malformedBodyIsParseError() throws Exception {
		HttpResponse<String> response = post("Bearer good-token", "{not json");

		assertThat(response.statusCode()).isEqualTo(400);
		assertThat(objectMapper.readTree(response.body()).at("/error/code").asInt()).isEqualTo(ErrorCodes.PARSE_ERROR);
	}

	@Test
	void servesProtectedResourceMetadataWithoutAuthentication() throws Exception {
		HttpResponse<String> response = httpClient.send(
				HttpRequest.newBuilder(URI.create(BASE_URL + "/.well-known/oauth-protected-resource")).GET().build(),
				HttpResponse.BodyHandlers.ofString());

		assertThat(response.statusCode()).isEqualTo(200);
		JsonNode metadata = objectMapper.readTree(response.body());
		assertThat(metadata.get("resource").asText()).isEqualTo(BASE_URL);
		assertThat(metadata.get("authorization_servers").get(0).asText())
			.isEqualTo("https://idp.example.com/oauth2/default");
		assertThat(metadata.get("scopes_supported").get(0).asText()).isEqualTo("mcp:access");
		assertThat(metadata.get("bearer_methods_supported").get(0).asText()).isEqualTo("header");
	}

	@Test
	void getIsNotAllowedOnMcpEndpoint() throws Exception {
		HttpResponse<String> response = httpClient.send(
				HttpRequest.newBuilder(URI.create(BASE_URL + McpAuthServer.MCP_ENDPOINT)).GET().build(),
				HttpResponse.BodyHandlers.ofString());

		assertThat(response.statusCode()).isEqualTo(405);
	}

}
