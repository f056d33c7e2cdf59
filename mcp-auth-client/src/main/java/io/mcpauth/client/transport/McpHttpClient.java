/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.mcpauth.client.transport;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.mcpauth.auth.exception.AuthError;
import io.mcpauth.auth.exception.AuthException;
import io.mcpauth.spec.McpToolSchema;
import io.mcpauth.spec.McpToolSchema.CallToolRequest;
import io.mcpauth.spec.McpToolSchema.CallToolResult;
import io.mcpauth.spec.McpToolSchema.JsonRpcRequest;
import io.mcpauth.spec.McpToolSchema.JsonRpcResponse;
import io.mcpauth.spec.McpToolSchema.ListToolsResult;
import io.mcpauth.util.Assert;

/**
 * Calls the resource server's tool endpoint with a bearer token.
 */
public class McpHttpClient {

	private static final Logger logger = LoggerFactory.getLogger(McpHttpClient.class);

	private final URI endpoint;

	private final HttpClient httpClient;

	private final Supplier<String> accessToken;

	private final Duration timeout;

	private final ObjectMapper objectMapper;

	private final AtomicLong requestIds = new AtomicLong();

	/**
	 * @param endpoint the tool endpoint, e.g. {@code http://localhost:8001/mcp}
	 * @param httpClient the HTTP client
	 * @param accessToken supplies the current access token for each request
	 * @param timeout per-request timeout
	 * @param objectMapper mapper for JSON-RPC messages
	 */
	public McpHttpClient(URI endpoint, HttpClient httpClient, Supplier<String> accessToken, Duration timeout,
			ObjectMapper objectMapper) {
		Assert.notNull(endpoint, "endpoint must not be null");
		Assert.notNull(httpClient, "httpClient must not be null");
		Assert.notNull(accessToken, "accessToken must not be null");
		Assert.notNull(timeout, "timeout must not be null");
		Assert.notNull(objectMapper, "objectMapper must not be null");
		this.endpoint = endpoint;
		this.httpClient = httpClient;
		this.accessToken = accessToken;
		this.timeout = timeout;
		this.objectMapper = objectMapper;
	}

	public CompletableFuture<ListToolsResult> listTools() {
		return send(McpToolSchema.METHOD_TOOLS_LIST, Map.of(), ListToolsResult.class);
	}

	public CompletableFuture<CallToolResult> callTool(String name, Map<String, Object> arguments) {
		Map<String, Object> params = objectMapper.convertValue(new CallToolRequest(name, arguments),
				McpToolSchema.MAP_TYPE);
		return send(McpToolSchema.METHOD_TOOLS_CALL, params, CallToolResult.class);
	}

	private <T> CompletableFuture<T> send(String method, Map<String, Object> params, Class<T> resultType) {
		JsonRpcRequest rpcRequest = new JsonRpcRequest(McpToolSchema.JSONRPC_VERSION, method,
				requestIds.incrementAndGet(), params);
		String body;
		try {
			body = objectMapper.writeValueAsString(rpcRequest);
		}
		catch (IOException e) {
			return CompletableFuture.failedFuture(new McpToolException("Failed to serialize request", e));
		}

		HttpRequest request = HttpRequest.newBuilder()
			.uri(endpoint)
			.timeout(timeout)
			.header("Content-Type", "application/json")
			.header("Accept", "application/json")
			.header("Authorization", "Bearer " + accessToken.get())
			.POST(HttpRequest.BodyPublishers.ofString(body))
			.build();

		logger.debug("Sending {} to {}", method, endpoint);
		return httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString())
			.thenApply(response -> readResult(response, resultType));
	}

	private <T> T readResult(HttpResponse<String> response, Class<T> resultType) {
		if (response.statusCode() == 401 || response.statusCode() == 403) {
			String challenge = response.headers().firstValue("WWW-Authenticate").orElse("");
			AuthError error = response.statusCode() == 403 ? AuthError.INSUFFICIENT_SCOPE : AuthError.INVALID_TOKEN;
			throw new AuthException(error, "Server rejected the token (HTTP " + response.statusCode() + "): "
					+ challenge);
		}

		JsonRpcResponse rpcResponse;
		try {
			rpcResponse = objectMapper.readValue(response.body(), JsonRpcResponse.class);
		}
		catch (IOException e) {
			throw new McpToolException("Unreadable response (HTTP " + response.statusCode() + ")", e);
		}
		if (rpcResponse.error() != null) {
			throw new McpToolException(rpcResponse.error().code(), rpcResponse.error().message());
		}
		return objectMapper.convertValue(rpcResponse.result(), resultType);
	}

}
