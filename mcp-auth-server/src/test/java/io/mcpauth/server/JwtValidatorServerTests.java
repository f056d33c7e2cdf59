/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.mcpauth.server;

import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.List;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.JWSHeader;
import com.nimbusds.jose.crypto.RSASSASigner;
import com.nimbusds.jose.jwk.JWKSet;
import com.nimbusds.jose.jwk.RSAKey;
import com.nimbusds.jose.jwk.gen.RSAKeyGenerator;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;
import com.sun.net.httpserver.HttpServer;
import org.apache.catalina.startup.Tomcat;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import io.mcpauth.auth.AuthSettings;
import io.mcpauth.server.auth.keys.JwksKeyProvider;
import io.mcpauth.server.auth.verifier.JwtTokenVerifier;

import static org.assertj.core.api.Assertions.assertThat;

@Timeout(20)
class JwtValidatorServerTests {

	private static final String AUDIENCE = "api://default";

	private final ObjectMapper objectMapper = new ObjectMapper();

	private final HttpClient httpClient = HttpClient.newHttpClient();

	private HttpServer jwksServer;

	private Tomcat tomcat;

	private RSAKey signingKey;

	private String issuer;

	private String baseUrl;

	@BeforeEach
	void setUp() throws Exception {
		signingKey = new RSAKeyGenerator(2048).keyID("key-1").generate();
		byte[] jwks = new JWKSet(signingKey.toPublicJWK()).toString().getBytes(StandardCharsets.UTF_8);

		jwksServer = HttpServer.create(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0), 0);
		jwksServer.createContext("/oauth2/default/v1/keys", exchange -> {
			exchange.getResponseHeaders().add("Content-Type", "application/json");
			exchange.sendResponseHeaders(200, jwks.length);
			exchange.getResponseBody().write(jwks);
			exchange.close();
		});
		jwksServer.start();
		issuer = "http://localhost:" + jwksServer.getAddress().getPort() + "/oauth2/default";

		int port = TomcatTestUtil.findAvailablePort();
		AuthSettings settings = AuthSettings.builder().issuer(issuer).validatorPort(port).build();
		JwksKeyProvider keyProvider = new JwksKeyProvider(settings.getJwksUri(), httpClient, Duration.ofSeconds(5));
		tomcat = JwtValidatorServer.start(settings, new JwtTokenVerifier(keyProvider, issuer, AUDIENCE));
		baseUrl = "http://localhost:" + port;
	}

	@AfterEach
	void tearDown() throws Exception {
		EmbeddedTomcat.stop(tomcat);
		jwksServer.stop(0);
	}

	private String sign(JWTClaimsSet claims) throws Exception {
		SignedJWT jwt = new SignedJWT(new JWSHeader.Builder(JWSAlgorithm.RS256).keyID("key-1").build(), claims);
		jwt.sign(new RSASSASigner(signingKey));
		return jwt.serialize();
	}

	private JWTClaimsSet.Builder claims() {
		Instant now = Instant.now();
		return new JWTClaimsSet.Builder().issuer(issuer)
			.audience(AUDIENCE)
			.subject("alice@example.com")
			.issueTime(Date.from(now))
			.expirationTime(Date.from(now.plusSeconds(3600)))
			.claim("cid", "client-123")
			.claim("scp", List.of("openid", "mcp:access"));
	}

	private HttpResponse<String> get(String path, String authorization) throws Exception {
		HttpRequest.Builder request = HttpRequest.newBuilder(URI.create(baseUrl + path)).GET();
		if (authorization != null) {
			request.header("Authorization", authorization);
		}
		return httpClient.send(request.build(), HttpResponse.BodyHandlers.ofString());
	}

	@Test
	void echoesClaimsOfAValidToken() throws Exception {
		HttpResponse<String> response = get("/", "Bearer " + sign(claims().build()));

		assertThat(response.statusCode()).isEqualTo(200);
		JsonNode body = objectMapper.readTree(response.body());
		assertThat(body.get("sub").asText()).isEqualTo("alice@example.com");
		assertThat(body.get("cid").asText()).isEqualTo("client-123");
		assertThat(body.get("iss").asText()).isEqualTo(issuer);
	}

	@Test
	void expiredTokenIsUnauthorized() throws Exception {
		Instant past = Instant.now().minusSeconds(7200);
		String token = sign(claims().issueTime(Date.from(past)).expirationTime(Date.from(past.plusSeconds(60))).build());

		HttpResponse<String> response = get("/", "Bearer " + token);

		assertThat(response.statusCode()).isEqualTo(401);
		assertThat(response.headers().firstValue("WWW-Authenticate").orElseThrow())
			.isEqualTo("Bearer error=\"invalid_token\", error_description=\"Token has expired\"");
	}

	@Test
	void wrongAudienceIsUnauthorized() throws Exception {
		HttpResponse<String> response = get("/", "Bearer " + sign(claims().audience("api://other").build()));

		assertThat(response.statusCode()).isEqualTo(401);
		assertThat(objectMapper.readTree(response.body()).get("error_description").asText())
			.isEqualTo("Invalid token: Invalid audience");
	}

	@Test
	void missingHeaderIsUnauthorized() throws Exception {
		HttpResponse<String> response = get("/", null);

		assertThat(response.statusCode()).isEqualTo(401);
		assertThat(response.headers().firstValue("WWW-Authenticate")).hasValue("Bearer");
	}

	@Test
	void otherPathsAreNotFound() throws Exception {
		assertThat(get("/claims", "Bearer " + sign(claims().build())).statusCode()).isEqualTo(404);
	}

}
