/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.mcpauth.server.transport;

import java.io.IOException;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import io.mcpauth.server.metadata.ProtectedResourceMetadata;

/**
 * Serves the protected resource metadata document. Unauthenticated; also used as the
 * container health check.
 */
public class ProtectedResourceMetadataServlet extends HttpServlet {

	private final ProtectedResourceMetadata metadata;

	private final ObjectMapper objectMapper;

	public ProtectedResourceMetadataServlet(ProtectedResourceMetadata metadata, ObjectMapper objectMapper) {
		this.metadata = metadata;
		this.objectMapper = objectMapper;
	}

	@Override
	protected void doGet(HttpServletRequest request, HttpServletResponse response) throws IOException {
		response.setContentType("application/json");
		response.setCharacterEncoding("UTF-8");
		response.setStatus(HttpServletResponse.SC_OK);
		objectMapper.writeValue(response.getOutputStream(), metadata);
	}

}
