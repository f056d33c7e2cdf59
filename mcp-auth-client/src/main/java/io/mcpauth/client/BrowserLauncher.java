/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.mcpauth.client;

import java.awt.Desktop;
import java.awt.GraphicsEnvironment;
import java.io.IOException;
import java.net.URI;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Redirect handler that opens the authorization URL in the desktop browser. When no
 * browser is available (headless hosts, containers) the URL is printed for the user to
 * open by hand.
 */
public class BrowserLauncher implements Function<String, CompletableFuture<Void>> {

	private static final Logger logger = LoggerFactory.getLogger(BrowserLauncher.class);

	@Override
	public CompletableFuture<Void> apply(String url) {
		if (!GraphicsEnvironment.isHeadless() && Desktop.isDesktopSupported()
				&& Desktop.getDesktop().isSupported(Desktop.Action.BROWSE)) {
			try {
				logger.info("Opening browser for authorization");
				Desktop.getDesktop().browse(URI.create(url));
				return CompletableFuture.completedFuture(null);
			}
			catch (IOException | UnsupportedOperationException e) {
				logger.warn("Failed to open browser: {}", e.getMessage());
			}
		}
		System.out.println("Please open this URL in your browser to authorize:");
		System.out.println(url);
		return CompletableFuture.completedFuture(null);
	}

}
