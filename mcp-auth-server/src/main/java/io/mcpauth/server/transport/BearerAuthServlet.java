/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.mcpauth.server.transport;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.mcpauth.auth.exception.AuthError;
import io.mcpauth.auth.exception.AuthException;

/**
 * Base class for servlets that sit behind bearer-token authentication. Renders
 * authentication and authorization failures as RFC 6750 responses.
 */
public abstract class BearerAuthServlet extends HttpServlet {

	private static final Logger logger = LoggerFactory.getLogger(BearerAuthServlet.class);

	public static final String WWW_AUTHENTICATE = "WWW-Authenticate";

	private final ObjectMapper objectMapper;

	private final String resourceMetadataUrl;

	private final List<String> requiredScopes;

	/**
	 * @param objectMapper mapper for JSON bodies
	 * @param resourceMetadataUrl advertised in 401 challenges, may be {@code null}
	 * @param requiredScopes advertised in 403 challenges
	 */
	protected BearerAuthServlet(ObjectMapper objectMapper, String resourceMetadataUrl, List<String> requiredScopes) {
		this.objectMapper = objectMapper;
		this.resourceMetadataUrl = resourceMetadataUrl;
		this.requiredScopes = List.copyOf(requiredScopes);
	}

	protected ObjectMapper getObjectMapper() {
		return objectMapper;
	}

	/**
	 * Send the response for a failed authentication or authorization. Failures that are
	 * not {@link AuthException}s are treated as an invalid token.
	 * @param response The HTTP response
	 * @param failure The failure, possibly wrapped by a CompletableFuture
	 */
	protected void sendAuthError(HttpServletResponse response, Throwable failure) throws IOException {
		AuthException authException = AuthException.unwrap(failure);
		if (authException == null) {
			logger.error("Unexpected error during authentication", AuthException.unwrapFailure(failure));
			authException = new AuthException(AuthError.INVALID_TOKEN, "Token could not be verified");
		}

		AuthError error = authException.getError();
		String description = authException.getMessage();
		logger.warn("Rejected request: {} ({})", error, description);

		response.setStatus(error.getOutcome().getHttpStatus());
		response.setHeader(WWW_AUTHENTICATE, challenge(error, description));
		writeJson(response, errorBody(error.getErrorCode(), description));
	}

	private String challenge(AuthError error, String description) {
		StringBuilder challenge = new StringBuilder("Bearer");
		String separator = " ";
		if (error != AuthError.MISSING_CREDENTIALS) {
			challenge.append(separator).append("error=\"").append(error.getErrorCode()).append('"');
			challenge.append(", error_description=\"").append(quote(description)).append('"');
			separator = ", ";
		}
		if (error == AuthError.INSUFFICIENT_SCOPE) {
			challenge.append(separator).append("scope=\"").append(String.join(" ", requiredScopes)).append('"');
			separator = ", ";
		}
		if (resourceMetadataUrl != null) {
			challenge.append(separator).append("resource_metadata=\"").append(resourceMetadataUrl).append('"');
		}
		return challenge.toString();
	}

	private static String quote(String value) {
		return value == null ? "" : value.replace('"', '\'').replace("\\", "");
	}

	protected static Map<String, Object> errorBody(String error, String description) {
		Map<String, Object> body = new LinkedHashMap<>();
		body.put("error", error);
		body.put("error_description", description);
		return body;
	}

	protected void writeJson(HttpServletResponse response, Object body) throws IOException {
		response.setContentType("application/json");
		response.setCharacterEncoding("UTF-8");
		objectMapper.writeValue(response.getOutputStream(), body);
	}

}
