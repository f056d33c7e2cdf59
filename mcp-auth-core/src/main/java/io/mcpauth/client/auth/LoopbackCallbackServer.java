/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.mcpauth.client.auth;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicReference;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import io.mcpauth.auth.exception.AuthError;
import io.mcpauth.auth.exception.AuthException;
import io.mcpauth.util.Assert;
import io.mcpauth.util.Utils;

/**
 * Single-use HTTP listener on the loopback interface that receives the authorization
 * server's redirect.
 * <p>
 * The first request carrying a {@code code} parameter is captured and answered with a
 * success page. Requests without a code (including {@code error} redirects) get a 400
 * page and the listener keeps waiting. The listener runs on its own thread; callers
 * poll for the captured result with {@link #awaitCallback(Duration)}.
 */
public class LoopbackCallbackServer implements AutoCloseable {

	private static final Logger logger = LoggerFactory.getLogger(LoopbackCallbackServer.class);

	static final Duration POLL_INTERVAL = Duration.ofMillis(100);

	private static final String SUCCESS_PAGE = """
			<html>
			<body>
			<h1>Authorization Successful!</h1>
			<p>You can close this window and return to the terminal.</p>
			<script>setTimeout(() => window.close(), 2000);</script>
			</body>
			</html>
			""";

	private final HttpServer server;

	private final ExecutorService executor;

	private final String path;

	private final AtomicReference<AuthCallbackResult> captured = new AtomicReference<>();

	private LoopbackCallbackServer(HttpServer server, ExecutorService executor, String path) {
		this.server = server;
		this.executor = executor;
		this.path = path;
	}

	/**
	 * Bind and start a listener.
	 * @param port the loopback port, {@code 0} for an ephemeral one
	 * @param path the callback path, e.g. {@code /oauth/callback}
	 * @return the running listener
	 * @throws IOException if the port cannot be bound
	 */
	public static LoopbackCallbackServer start(int port, String path) throws IOException {
		Assert.hasText(path, "path must not be empty");
		HttpServer server = HttpServer.create(new InetSocketAddress(InetAddress.getLoopbackAddress(), port), 0);
		ExecutorService executor = Executors.newSingleThreadExecutor(runnable -> {
			Thread thread = new Thread(runnable, "oauth-callback");
			thread.setDaemon(true);
			return thread;
		});
		LoopbackCallbackServer callbackServer = new LoopbackCallbackServer(server, executor, path);
		server.createContext(path, callbackServer::handle);
		server.setExecutor(executor);
		server.start();
		logger.debug("OAuth callback listener started on port {}", callbackServer.getPort());
		return callbackServer;
	}

	public int getPort() {
		return server.getAddress().getPort();
	}

	/**
	 * The redirect URI this listener answers, as registered with the authorization server.
	 */
	public URI getRedirectUri() {
		return URI.create("http://localhost:" + getPort() + path);
	}

	/**
	 * Wait for the callback, polling every 100 ms.
	 * @param timeout overall bound on the wait
	 * @return a Mono emitting the captured result, or failing with
	 * {@link AuthError#CALLBACK_TIMEOUT}
	 */
	public Mono<AuthCallbackResult> awaitCallback(Duration timeout) {
		return Flux.interval(POLL_INTERVAL)
			.<AuthCallbackResult>handle((tick, sink) -> {
				AuthCallbackResult result = captured.get();
				if (result != null) {
					sink.next(result);
				}
			})
			.next()
			.timeout(timeout, Mono.error(() -> new AuthException(AuthError.CALLBACK_TIMEOUT,
					"Timed out after " + timeout.toSeconds() + "s waiting for the authorization callback")));
	}

	private void handle(HttpExchange exchange) throws IOException {
		try {
			// HttpServer contexts match by prefix
			if (!path.equals(exchange.getRequestURI().getPath())) {
				logger.debug("Ignoring request outside the callback path");
				exchange.sendResponseHeaders(404, -1);
				return;
			}
			Map<String, String> params = Utils.parseQuery(exchange.getRequestURI());
			String code = params.get("code");
			if (Utils.hasText(code)) {
				if (captured.compareAndSet(null, new AuthCallbackResult(code, params.get("state")))) {
					logger.info("Authorization callback received");
					respond(exchange, 200, SUCCESS_PAGE);
				}
				else {
					respond(exchange, 400, errorPage("callback_already_received", "This login has already completed."));
				}
				return;
			}

			String error = params.getOrDefault("error", "missing_code");
			String description = params.getOrDefault("error_description", "No authorization code in the callback.");
			logger.warn("Authorization callback without code: {} ({})", error, description);
			respond(exchange, 400, errorPage(error, description));
		}
		finally {
			exchange.close();
		}
	}

	private static void respond(HttpExchange exchange, int status, String html) throws IOException {
		byte[] body = html.getBytes(StandardCharsets.UTF_8);
		exchange.getResponseHeaders().set("Content-Type", "text/html; charset=utf-8");
		exchange.sendResponseHeaders(status, body.length);
		try (OutputStream out = exchange.getResponseBody()) {
			out.write(body);
		}
	}

	private static String errorPage(String error, String description) {
		return """
				<html>
				<body>
				<h1>Authorization Failed</h1>
				<p>%s: %s</p>
				</body>
				</html>
				""".formatted(escape(error), escape(description));
	}

	static String escape(String text) {
		StringBuilder escaped = new StringBuilder(text.length());
		for (char c : text.toCharArray()) {
			switch (c) {
				case '<' -> escaped.append("&lt;");
				case '>' -> escaped.append("&gt;");
				case '&' -> escaped.append("&amp;");
				case '"' -> escaped.append("&quot;");
				case '\'' -> escaped.append("&#39;");
				default -> escaped.append(c);
			}
		}
		return escaped.toString();
	}

	@Override
	public void close() {
		server.stop(0);
		executor.shutdownNow();
		logger.debug("OAuth callback listener stopped");
	}

}
