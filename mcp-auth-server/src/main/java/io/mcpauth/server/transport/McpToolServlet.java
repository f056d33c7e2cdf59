/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.mcpauth.server.transport;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.mcpauth.server.auth.middleware.AuthContext;
import io.mcpauth.server.auth.middleware.BearerAuthenticator;
import io.mcpauth.server.tools.ToolSpecification;
import io.mcpauth.spec.McpToolSchema;
import io.mcpauth.spec.McpToolSchema.CallToolRequest;
import io.mcpauth.spec.McpToolSchema.CallToolResult;
import io.mcpauth.spec.McpToolSchema.ErrorCodes;
import io.mcpauth.spec.McpToolSchema.JsonRpcRequest;
import io.mcpauth.spec.McpToolSchema.JsonRpcResponse;
import io.mcpauth.spec.McpToolSchema.ListToolsResult;
import io.mcpauth.spec.McpToolSchema.Tool;
import io.mcpauth.util.Assert;

/**
 * JSON-RPC endpoint for the tool catalog. Every request must carry a bearer token with
 * the required scopes; the verified {@link AuthContext} is stored as a request attribute
 * and passed to the tool handlers.
 */
public class McpToolServlet extends BearerAuthServlet {

	private static final Logger logger = LoggerFactory.getLogger(McpToolServlet.class);

	private final BearerAuthenticator authenticator;

	private final Map<String, ToolSpecification> tools = new LinkedHashMap<>();

	public McpToolServlet(BearerAuthenticator authenticator, List<ToolSpecification> tools, ObjectMapper objectMapper,
			String resourceMetadataUrl, List<String> requiredScopes) {
		super(objectMapper, resourceMetadataUrl, requiredScopes);
		Assert.notNull(authenticator, "authenticator must not be null");
		Assert.notNull(tools, "tools must not be null");
		this.authenticator = authenticator;
		for (ToolSpecification tool : tools) {
			this.tools.put(tool.tool().name(), tool);
		}
	}

	@Override
	protected void doPost(HttpServletRequest request, HttpServletResponse response)
			throws ServletException, IOException {
		AuthContext authContext = authenticateRequest(request, response);
		if (authContext == null) {
			return;
		}

		JsonRpcRequest rpcRequest;
		try {
			rpcRequest = getObjectMapper().readValue(request.getInputStream(), JsonRpcRequest.class);
		}
		catch (IOException | IllegalArgumentException e) {
			logger.debug("Malformed JSON-RPC request: {}", e.getMessage());
			response.setStatus(HttpServletResponse.SC_BAD_REQUEST);
			writeJson(response, JsonRpcResponse.failure(null, ErrorCodes.PARSE_ERROR, "Invalid JSON-RPC request"));
			return;
		}

		response.setStatus(HttpServletResponse.SC_OK);
		writeJson(response, dispatch(rpcRequest, authContext));
	}

	@Override
	protected void doGet(HttpServletRequest request, HttpServletResponse response)
			throws ServletException, IOException {
		response.setHeader("Allow", "POST");
		response.sendError(HttpServletResponse.SC_METHOD_NOT_ALLOWED);
	}

	/**
	 * Authenticates a request using the Bearer token in the Authorization header.
	 * @return the context, or {@code null} if an error response has been sent
	 */
	protected AuthContext authenticateRequest(HttpServletRequest request, HttpServletResponse response)
			throws IOException {
		try {
			AuthContext authContext = authenticator.authenticate(request.getHeader("Authorization")).join();
			request.setAttribute(AuthContext.REQUEST_ATTRIBUTE, authContext);
			return authContext;
		}
		catch (RuntimeException e) {
			sendAuthError(response, e);
			return null;
		}
	}

	JsonRpcResponse dispatch(JsonRpcRequest request, AuthContext authContext) {
		if (request.method() == null) {
			return JsonRpcResponse.failure(request.id(), ErrorCodes.INVALID_REQUEST, "Missing method");
		}
		switch (request.method()) {
			case McpToolSchema.METHOD_TOOLS_LIST:
				return JsonRpcResponse.success(request.id(), listTools());
			case McpToolSchema.METHOD_TOOLS_CALL:
				return callTool(request, authContext);
			default:
				return JsonRpcResponse.failure(request.id(), ErrorCodes.METHOD_NOT_FOUND,
						"Method not found: " + request.method());
		}
	}

	private ListToolsResult listTools() {
		List<Tool> definitions = new ArrayList<>();
		for (ToolSpecification tool : tools.values()) {
			definitions.add(tool.tool());
		}
		return new ListToolsResult(definitions);
	}

	private JsonRpcResponse callTool(JsonRpcRequest request, AuthContext authContext) {
		CallToolRequest call;
		try {
			call = getObjectMapper().convertValue(request.params(), CallToolRequest.class);
		}
		catch (IllegalArgumentException e) {
			return JsonRpcResponse.failure(request.id(), ErrorCodes.INVALID_PARAMS, "Invalid tool call parameters");
		}
		if (call == null || call.name() == null) {
			return JsonRpcResponse.failure(request.id(), ErrorCodes.INVALID_PARAMS, "Missing tool name");
		}

		ToolSpecification tool = tools.get(call.name());
		if (tool == null) {
			return JsonRpcResponse.failure(request.id(), ErrorCodes.INVALID_PARAMS, "Unknown tool: " + call.name());
		}

		Map<String, Object> arguments = call.arguments() != null ? call.arguments() : Map.of();
		logger.info("Tool '{}' called by client {}", call.name(), authContext.getClientId());
		try {
			CallToolResult result = tool.callHandler().apply(authContext, arguments).block();
			return JsonRpcResponse.success(request.id(), result);
		}
		catch (IllegalArgumentException e) {
			return JsonRpcResponse.failure(request.id(), ErrorCodes.INVALID_PARAMS, e.getMessage());
		}
		catch (RuntimeException e) {
			logger.error("Tool '{}' failed", call.name(), e);
			return JsonRpcResponse.failure(request.id(), ErrorCodes.INTERNAL_ERROR,
					"Tool execution failed: " + e.getMessage());
		}
	}

}
