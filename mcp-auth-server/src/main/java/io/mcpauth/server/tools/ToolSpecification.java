/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.mcpauth.server.tools;

import java.util.Map;
import java.util.function.BiFunction;

import reactor.core.publisher.Mono;

import io.mcpauth.server.auth.middleware.AuthContext;
import io.mcpauth.spec.McpToolSchema.CallToolResult;
import io.mcpauth.spec.McpToolSchema.Tool;
import io.mcpauth.util.Assert;

/**
 * A tool definition together with its call handler. The handler receives the caller's
 * authentication context and the call arguments.
 *
 * @param tool The tool definition
 * @param callHandler Produces the result; signals {@link IllegalArgumentException} for
 * invalid arguments
 */
public record ToolSpecification(Tool tool,
		BiFunction<AuthContext, Map<String, Object>, Mono<CallToolResult>> callHandler) {

	public ToolSpecification {
		Assert.notNull(tool, "tool must not be null");
		Assert.notNull(callHandler, "callHandler must not be null");
	}

}
