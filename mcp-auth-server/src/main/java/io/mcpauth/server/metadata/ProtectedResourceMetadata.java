/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.mcpauth.server.metadata;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import io.mcpauth.auth.AuthSettings;

/**
 * OAuth 2.0 Protected Resource Metadata (RFC 9728) describing this resource server.
 *
 * @param resource The resource identifier, the server's base URL
 * @param authorizationServers Issuers whose tokens are accepted
 * @param scopesSupported Scopes a token must carry
 * @param bearerMethodsSupported How the token may be presented
 */
@JsonInclude(JsonInclude.Include.NON_ABSENT)
@JsonIgnoreProperties(ignoreUnknown = true)
public record ProtectedResourceMetadata( // @formatter:off
	@JsonProperty("resource") String resource,
	@JsonProperty("authorization_servers") List<String> authorizationServers,
	@JsonProperty("scopes_supported") List<String> scopesSupported,
	@JsonProperty("bearer_methods_supported") List<String> bearerMethodsSupported) { // @formatter:on

	public static final String WELL_KNOWN_PATH = "/.well-known/oauth-protected-resource";

	public static ProtectedResourceMetadata from(AuthSettings settings) {
		return new ProtectedResourceMetadata(settings.getServerUrl(), List.of(settings.getIssuer()),
				settings.getRequiredScopes(), List.of("header"));
	}

	/**
	 * Absolute URL of the metadata document for a server base URL.
	 */
	public static String urlFor(String serverUrl) {
		String base = serverUrl.endsWith("/") ? serverUrl.substring(0, serverUrl.length() - 1) : serverUrl;
		return base + WELL_KNOWN_PATH;
	}

}
