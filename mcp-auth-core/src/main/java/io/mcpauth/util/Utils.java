/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.mcpauth.util;

import java.net.URI;
import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;

import reactor.util.annotation.Nullable;

/**
 * Miscellaneous utility methods.
 */
public final class Utils {

	private Utils() {
	}

	/**
	 * Check whether the given {@code String} contains actual <em>text</em>.
	 * @param str the {@code String} to check (may be {@code null})
	 * @return {@code true} if the {@code String} is not {@code null}, its length is
	 * greater than 0, and it does not contain whitespace only
	 */
	public static boolean hasText(@Nullable String str) {
		return (str != null && !str.isBlank());
	}

	/**
	 * Format parameters as an {@code application/x-www-form-urlencoded} string, which is
	 * also a valid URL query string. Entries with a {@code null} value are skipped.
	 * @param params the parameters, in the order they should appear
	 * @return the encoded string
	 */
	public static String formEncode(Map<String, String> params) {
		StringBuilder result = new StringBuilder();
		for (Map.Entry<String, String> entry : params.entrySet()) {
			if (entry.getValue() == null) {
				continue;
			}
			if (result.length() > 0) {
				result.append('&');
			}
			result.append(URLEncoder.encode(entry.getKey(), StandardCharsets.UTF_8));
			result.append('=');
			result.append(URLEncoder.encode(entry.getValue(), StandardCharsets.UTF_8));
		}
		return result.toString();
	}

	/**
	 * Parse the query component of a URI into a map. Only the first value of a repeated
	 * parameter is kept. Keys and values are URL-decoded.
	 * @param uri the URI to read the query from
	 * @return the decoded parameters, never {@code null}
	 */
	public static Map<String, String> parseQuery(URI uri) {
		Map<String, String> params = new LinkedHashMap<>();
		String query = uri.getRawQuery();
		if (query == null || query.isEmpty()) {
			return params;
		}
		for (String pair : query.split("&")) {
			if (pair.isEmpty()) {
				continue;
			}
			int idx = pair.indexOf('=');
			String key = idx > 0 ? pair.substring(0, idx) : pair;
			String value = idx > 0 ? pair.substring(idx + 1) : "";
			params.putIfAbsent(URLDecoder.decode(key, StandardCharsets.UTF_8),
					URLDecoder.decode(value, StandardCharsets.UTF_8));
		}
		return params;
	}

	/**
	 * Build an HTTP Basic {@code Authorization} header value.
	 * @param username the user name, for OAuth the client id
	 * @param password the password, for OAuth the client secret
	 * @return the header value including the {@code Basic} scheme
	 */
	public static String basicAuthorization(String username, String password) {
		String credentials = username + ":" + password;
		return "Basic " + Base64.getEncoder().encodeToString(credentials.getBytes(StandardCharsets.UTF_8));
	}

}
