/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.mcpauth.server.tools;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import io.mcpauth.auth.exception.AuthException;
import io.mcpauth.client.auth.exchange.TokenExchangeClient;
import io.mcpauth.server.downstream.ThirdPartyApiClient;
import io.mcpauth.spec.McpToolSchema.CallToolResult;
import io.mcpauth.spec.McpToolSchema.TextContent;
import io.mcpauth.spec.McpToolSchema.Tool;

/**
 * The tools offered by the resource server.
 */
public final class ServerTools {

	private static final Logger logger = LoggerFactory.getLogger(ServerTools.class);

	private static final DateTimeFormatter FORMATTED = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss")
		.withZone(ZoneOffset.UTC);

	private static final Map<String, Object> NO_ARGUMENTS_SCHEMA = Map.of("type", "object", "properties", Map.of());

	private static final ObjectMapper objectMapper = new ObjectMapper();

	private ServerTools() {
	}

	public static ToolSpecification getCurrentTime(Clock clock) {
		Tool tool = new Tool("get_current_time", "Get the current server time.", NO_ARGUMENTS_SCHEMA);
		return new ToolSpecification(tool, (auth, arguments) -> {
			Instant now = clock.instant();
			Map<String, Object> result = new LinkedHashMap<>();
			result.put("current_time", now.atOffset(ZoneOffset.UTC).toString());
			result.put("timezone", "UTC");
			result.put("timestamp", now.toEpochMilli() / 1000.0);
			result.put("formatted", FORMATTED.format(now));
			result.put("message", "Hello from authenticated MCP server!");
			return Mono.just(structured(result));
		});
	}

	public static ToolSpecification calculateSquare() {
		Map<String, Object> schema = Map.of("type", "object", "properties",
				Map.of("number", Map.of("type", "number", "description", "The number to square")), "required",
				List.of("number"));
		Tool tool = new Tool("calculate_square", "Calculate the square of a number.", schema);
		return new ToolSpecification(tool, (auth, arguments) -> {
			Object number = arguments.get("number");
			if (!(number instanceof Number)) {
				return Mono.error(new IllegalArgumentException("Argument 'number' must be a number"));
			}
			double input = ((Number) number).doubleValue();
			double square = input * input;
			Map<String, Object> result = new LinkedHashMap<>();
			result.put("input", input);
			result.put("square", square);
			result.put("calculation", input + "² = " + square);
			return Mono.just(structured(result));
		});
	}

	/**
	 * Exchanges the caller's token for one scoped to the downstream API and calls it.
	 * Exchange and downstream failures are reported as tool errors.
	 */
	public static ToolSpecification callThirdPartyApi(TokenExchangeClient exchangeClient,
			ThirdPartyApiClient apiClient) {
		Tool tool = new Tool("call_third_party_api",
				"Call the third-party API on behalf of the user with an exchanged token.", NO_ARGUMENTS_SCHEMA);
		return new ToolSpecification(tool,
				(auth, arguments) -> Mono.fromFuture(() -> exchangeClient.exchange(auth.getAccessToken().getToken()))
					.flatMap(exchanged -> Mono.fromFuture(() -> apiClient.fetch(exchanged)))
					.map(response -> {
						Map<String, Object> result = new LinkedHashMap<>();
						result.put("api_url", apiClient.getApiUri().toString());
						result.put("status", response.status());
						result.put("body", response.body());
						return response.isSuccess() ? structured(result)
								: new CallToolResult(List.of(new TextContent(json(result))), true, result);
					})
					.onErrorResume(e -> AuthException.unwrap(e) != null, e -> {
						String message = AuthException.unwrap(e).getMessage();
						logger.warn("Third-party call failed for client {}: {}", auth.getClientId(), message);
						return Mono.just(error(message));
					}));
	}

	static CallToolResult structured(Map<String, Object> result) {
		return new CallToolResult(List.of(new TextContent(json(result))), false, result);
	}

	static CallToolResult error(String message) {
		return new CallToolResult(List.of(new TextContent(message)), true, null);
	}

	private static String json(Map<String, Object> result) {
		try {
			return objectMapper.writeValueAsString(result);
		}
		catch (JsonProcessingException e) {
			throw new IllegalStateException("Tool result is not serializable", e);
		}
	}

}
