/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.mcpauth.server.transport;

import java.io.IOException;
import java.util.List;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.mcpauth.auth.ClaimSet;
import io.mcpauth.server.auth.middleware.BearerAuthenticator;
import io.mcpauth.server.auth.verifier.JwtTokenVerifier;
import io.mcpauth.util.Assert;

/**
 * {@code GET /}: validates the bearer JWT locally and echoes its claims.
 */
public class JwtValidatorServlet extends BearerAuthServlet {

	private static final Logger logger = LoggerFactory.getLogger(JwtValidatorServlet.class);

	private final JwtTokenVerifier verifier;

	public JwtValidatorServlet(JwtTokenVerifier verifier, ObjectMapper objectMapper) {
		super(objectMapper, null, List.of());
		Assert.notNull(verifier, "verifier must not be null");
		this.verifier = verifier;
	}

	@Override
	protected void doGet(HttpServletRequest request, HttpServletResponse response) throws IOException {
		if (!"/".equals(request.getRequestURI())) {
			response.sendError(HttpServletResponse.SC_NOT_FOUND);
			return;
		}

		ClaimSet claims;
		try {
			String token = BearerAuthenticator.extractToken(request.getHeader("Authorization"));
			claims = verifier.verifyClaims(token).join();
		}
		catch (RuntimeException e) {
			sendAuthError(response, e);
			return;
		}

		logger.info("Validated JWT for subject {} issued by {}, claims: {}", claims.subject(), claims.issuer(),
				claims.claims().keySet());
		response.setStatus(HttpServletResponse.SC_OK);
		writeJson(response, claims.claims());
	}

}
