/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.mcpauth.auth;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import io.mcpauth.util.Assert;
import io.mcpauth.util.Utils;

/**
 * Immutable configuration shared by the verifier, the token exchange client, the
 * authorization code flow and the servers. Built once at startup and passed to each
 * component's constructor.
 * <p>
 * Use {@link #builder()} for programmatic configuration or
 * {@link #fromEnvironment(Map)} to read the environment-variable surface:
 * <ul>
 * <li>{@code OKTA_ISSUER} (or {@code OKTA_DOMAIN}, giving
 * {@code https://{domain}/oauth2/default})</li>
 * <li>{@code OKTA_AUDIENCE}, {@code OKTA_CLIENT_ID}, {@code OKTA_CLIENT_SECRET}</li>
 * <li>{@code MCP_REQUIRED_SCOPES} (space-delimited)</li>
 * <li>{@code THIRD_PARTY_API_URL}, {@code THIRD_PARTY_API_SCOPE},
 * {@code THIRD_PARTY_API_AUDIENCE}</li>
 * <li>{@code OAUTH_CALLBACK_PORT}, {@code OAUTH_CALLBACK_PATH}</li>
 * <li>{@code VERIFY_SSL}, {@code CA_BUNDLE_PATH}</li>
 * <li>{@code MCP_SERVER_HOST}, {@code MCP_SERVER_PORT}, {@code MCP_SERVER_URL},
 * {@code JWT_VALIDATOR_PORT}</li>
 * </ul>
 */
public final class AuthSettings {

	public static final String DEFAULT_AUDIENCE = "api://default";

	public static final List<String> DEFAULT_REQUIRED_SCOPES = List.of("mcp:access");

	public static final List<String> LOGIN_SCOPES = List.of("openid", "profile", "offline_access");

	public static final int DEFAULT_CALLBACK_PORT = 3030;

	public static final String DEFAULT_CALLBACK_PATH = "/oauth/callback";

	public static final Duration DEFAULT_CALLBACK_TIMEOUT = Duration.ofSeconds(300);

	public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(10);

	private final String issuer;

	private final String audience;

	private final List<String> requiredScopes;

	private final String clientId;

	private final String clientSecret;

	private final String downstreamApiUrl;

	private final String downstreamScope;

	private final String downstreamAudience;

	private final int callbackPort;

	private final String callbackPath;

	private final Duration callbackTimeout;

	private final Duration requestTimeout;

	private final boolean verifySsl;

	private final String caBundlePath;

	private final String serverHost;

	private final int serverPort;

	private final String serverUrl;

	private final int validatorPort;

	private AuthSettings(Builder builder) {
		this.issuer = stripTrailingSlash(builder.issuer);
		this.audience = builder.audience;
		this.requiredScopes = List.copyOf(builder.requiredScopes);
		this.clientId = builder.clientId;
		this.clientSecret = builder.clientSecret;
		this.downstreamApiUrl = builder.downstreamApiUrl;
		this.downstreamScope = builder.downstreamScope;
		this.downstreamAudience = builder.downstreamAudience;
		this.callbackPort = builder.callbackPort;
		this.callbackPath = builder.callbackPath;
		this.callbackTimeout = builder.callbackTimeout;
		this.requestTimeout = builder.requestTimeout;
		this.verifySsl = builder.verifySsl;
		this.caBundlePath = builder.caBundlePath;
		this.serverHost = builder.serverHost;
		this.serverPort = builder.serverPort;
		this.serverUrl = Utils.hasText(builder.serverUrl) ? builder.serverUrl
				: "http://" + builder.serverHost + ":" + builder.serverPort;
		this.validatorPort = builder.validatorPort;
	}

	private static String stripTrailingSlash(String url) {
		return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Read the settings from an environment-style map, typically {@link System#getenv()}.
	 * @param env the variables
	 * @return the settings
	 * @throws IllegalArgumentException if a required variable is missing or a numeric
	 * variable cannot be parsed
	 */
	public static AuthSettings fromEnvironment(Map<String, String> env) {
		Builder builder = builder();

		String issuer = env.get("OKTA_ISSUER");
		if (!Utils.hasText(issuer) && Utils.hasText(env.get("OKTA_DOMAIN"))) {
			String domain = env.get("OKTA_DOMAIN").replaceFirst("^https?://", "");
			issuer = "https://" + stripTrailingSlash(domain) + "/oauth2/default";
		}
		Assert.hasText(issuer, "OKTA_ISSUER (or OKTA_DOMAIN) environment variable is required");
		builder.issuer(issuer);

		builder.clientId(env.get("OKTA_CLIENT_ID"));
		builder.clientSecret(env.get("OKTA_CLIENT_SECRET"));
		if (Utils.hasText(env.get("OKTA_AUDIENCE"))) {
			builder.audience(env.get("OKTA_AUDIENCE"));
		}
		if (env.containsKey("MCP_REQUIRED_SCOPES")) {
			builder.requiredScopes(splitScopes(env.get("MCP_REQUIRED_SCOPES")));
		}

		builder.downstreamApiUrl(env.get("THIRD_PARTY_API_URL"));
		builder.downstreamScope(env.get("THIRD_PARTY_API_SCOPE"));
		builder.downstreamAudience(env.get("THIRD_PARTY_API_AUDIENCE"));

		if (Utils.hasText(env.get("OAUTH_CALLBACK_PORT"))) {
			builder.callbackPort(parsePort("OAUTH_CALLBACK_PORT", env.get("OAUTH_CALLBACK_PORT")));
		}
		if (Utils.hasText(env.get("OAUTH_CALLBACK_PATH"))) {
			builder.callbackPath(env.get("OAUTH_CALLBACK_PATH"));
		}

		builder.verifySsl(!"false".equalsIgnoreCase(env.getOrDefault("VERIFY_SSL", "true").trim()));
		builder.caBundlePath(env.get("CA_BUNDLE_PATH"));

		if (Utils.hasText(env.get("MCP_SERVER_HOST"))) {
			builder.serverHost(env.get("MCP_SERVER_HOST"));
		}
		if (Utils.hasText(env.get("MCP_SERVER_PORT"))) {
			builder.serverPort(parsePort("MCP_SERVER_PORT", env.get("MCP_SERVER_PORT")));
		}
		builder.serverUrl(env.get("MCP_SERVER_URL"));
		if (Utils.hasText(env.get("JWT_VALIDATOR_PORT"))) {
			builder.validatorPort(parsePort("JWT_VALIDATOR_PORT", env.get("JWT_VALIDATOR_PORT")));
		}

		return builder.build();
	}

	private static List<String> splitScopes(String scopes) {
		if (!Utils.hasText(scopes)) {
			return List.of();
		}
		return Arrays.asList(scopes.trim().split("\\s+"));
	}

	private static int parsePort(String name, String value) {
		try {
			return Integer.parseInt(value.trim());
		}
		catch (NumberFormatException e) {
			throw new IllegalArgumentException(name + " must be a port number but was '" + value + "'", e);
		}
	}

	public String getIssuer() {
		return issuer;
	}

	public String getAudience() {
		return audience;
	}

	public List<String> getRequiredScopes() {
		return requiredScopes;
	}

	public String getClientId() {
		return clientId;
	}

	public String getClientSecret() {
		return clientSecret;
	}

	public String getDownstreamApiUrl() {
		return downstreamApiUrl;
	}

	public String getDownstreamScope() {
		return downstreamScope;
	}

	public String getDownstreamAudience() {
		return downstreamAudience;
	}

	public int getCallbackPort() {
		return callbackPort;
	}

	public String getCallbackPath() {
		return callbackPath;
	}

	public Duration getCallbackTimeout() {
		return callbackTimeout;
	}

	public Duration getRequestTimeout() {
		return requestTimeout;
	}

	public boolean isVerifySsl() {
		return verifySsl;
	}

	public String getCaBundlePath() {
		return caBundlePath;
	}

	public String getServerHost() {
		return serverHost;
	}

	public int getServerPort() {
		return serverPort;
	}

	public String getServerUrl() {
		return serverUrl;
	}

	public int getValidatorPort() {
		return validatorPort;
	}

	public URI getJwksUri() {
		return URI.create(issuer + "/v1/keys");
	}

	public URI getIntrospectionUri() {
		return URI.create(issuer + "/v1/introspect");
	}

	public URI getTokenUri() {
		return URI.create(issuer + "/v1/token");
	}

	public URI getAuthorizationUri() {
		return URI.create(issuer + "/v1/authorize");
	}

	public URI getRedirectUri() {
		return URI.create("http://localhost:" + callbackPort + callbackPath);
	}

	/**
	 * Scope requested at login: the OpenID Connect scopes followed by the scopes the
	 * resource server requires.
	 * @return the space-delimited scope string
	 */
	public String getLoginScope() {
		List<String> scopes = new ArrayList<>(LOGIN_SCOPES);
		for (String scope : requiredScopes) {
			if (!scopes.contains(scope)) {
				scopes.add(scope);
			}
		}
		return String.join(" ", scopes);
	}

	/**
	 * Whether a client secret is available for confidential-client calls (introspection,
	 * token exchange).
	 * @return {@code true} if a secret is configured
	 */
	public boolean hasClientSecret() {
		return Utils.hasText(clientSecret);
	}

	/**
	 * Whether a downstream API is configured for token exchange.
	 * @return {@code true} if URL, scope and audience are all set
	 */
	public boolean hasDownstreamApi() {
		return Utils.hasText(downstreamApiUrl) && Utils.hasText(downstreamScope) && Utils.hasText(downstreamAudience);
	}

	/**
	 * Builder for {@link AuthSettings}. Not thread-safe.
	 */
	public static final class Builder {

		private String issuer;

		private String audience = DEFAULT_AUDIENCE;

		private List<String> requiredScopes = DEFAULT_REQUIRED_SCOPES;

		private String clientId;

		private String clientSecret;

		private String downstreamApiUrl;

		private String downstreamScope;

		private String downstreamAudience;

		private int callbackPort = DEFAULT_CALLBACK_PORT;

		private String callbackPath = DEFAULT_CALLBACK_PATH;

		private Duration callbackTimeout = DEFAULT_CALLBACK_TIMEOUT;

		private Duration requestTimeout = DEFAULT_REQUEST_TIMEOUT;

		private boolean verifySsl = true;

		private String caBundlePath;

		private String serverHost = "localhost";

		private int serverPort = 8001;

		private String serverUrl;

		private int validatorPort = 8000;

		private Builder() {
		}

		public Builder issuer(String issuer) {
			this.issuer = issuer;
			return this;
		}

		public Builder audience(String audience) {
			this.audience = audience;
			return this;
		}

		public Builder requiredScopes(List<String> requiredScopes) {
			Assert.notNull(requiredScopes, "requiredScopes must not be null");
			this.requiredScopes = requiredScopes;
			return this;
		}

		public Builder clientId(String clientId) {
			this.clientId = clientId;
			return this;
		}

		public Builder clientSecret(String clientSecret) {
			this.clientSecret = clientSecret;
			return this;
		}

		public Builder downstreamApiUrl(String downstreamApiUrl) {
			this.downstreamApiUrl = downstreamApiUrl;
			return this;
		}

		public Builder downstreamScope(String downstreamScope) {
			this.downstreamScope = downstreamScope;
			return this;
		}

		public Builder downstreamAudience(String downstreamAudience) {
			this.downstreamAudience = downstreamAudience;
			return this;
		}

		public Builder callbackPort(int callbackPort) {
			this.callbackPort = callbackPort;
			return this;
		}

		public Builder callbackPath(String callbackPath) {
			Assert.isTrue(callbackPath != null && callbackPath.startsWith("/"), "callbackPath must start with '/'");
			this.callbackPath = callbackPath;
			return this;
		}

		public Builder callbackTimeout(Duration callbackTimeout) {
			Assert.notNull(callbackTimeout, "callbackTimeout must not be null");
			this.callbackTimeout = callbackTimeout;
			return this;
		}

		public Builder requestTimeout(Duration requestTimeout) {
			Assert.notNull(requestTimeout, "requestTimeout must not be null");
			this.requestTimeout = requestTimeout;
			return this;
		}

		public Builder verifySsl(boolean verifySsl) {
			this.verifySsl = verifySsl;
			return this;
		}

		public Builder caBundlePath(String caBundlePath) {
			this.caBundlePath = caBundlePath;
			return this;
		}

		public Builder serverHost(String serverHost) {
			this.serverHost = serverHost;
			return this;
		}

		public Builder serverPort(int serverPort) {
			this.serverPort = serverPort;
			return this;
		}

		public Builder serverUrl(String serverUrl) {
			this.serverUrl = serverUrl;
			return this;
		}

		public Builder validatorPort(int validatorPort) {
			this.validatorPort = validatorPort;
			return this;
		}

		public AuthSettings build() {
			Assert.hasText(issuer, "issuer must not be empty");
			Assert.hasText(audience, "audience must not be empty");
			return new AuthSettings(this);
		}

	}

}
