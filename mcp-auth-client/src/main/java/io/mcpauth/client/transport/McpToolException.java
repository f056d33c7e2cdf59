/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.mcpauth.client.transport;

/**
 * A JSON-RPC error returned by the server, or a response that could not be read.
 */
public class McpToolException extends RuntimeException {

	private final Integer code;

	public McpToolException(Integer code, String message) {
		super(message);
		this.code = code;
	}

	public McpToolException(String message, Throwable cause) {
		super(message, cause);
		this.code = null;
	}

	/**
	 * The JSON-RPC error code, {@code null} if the failure was not a JSON-RPC error.
	 */
	public Integer getCode() {
		return code;
	}

}
