/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.mcpauth.server.auth.middleware;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import io.mcpauth.auth.AccessToken;
import io.mcpauth.auth.exception.AuthError;
import io.mcpauth.auth.exception.AuthException;
import io.mcpauth.util.Assert;

/**
 * Checks that a verified token carries every scope a resource requires.
 * <p>
 * Scopes are matched by exact string equality. A token's scope claim may arrive either
 * as a space-delimited string or as a list; both normalize to the same set.
 */
public class ScopeEnforcer {

	private final List<String> requiredScopes;

	public ScopeEnforcer(List<String> requiredScopes) {
		Assert.notNull(requiredScopes, "requiredScopes must not be null");
		this.requiredScopes = List.copyOf(requiredScopes);
	}

	public List<String> getRequiredScopes() {
		return requiredScopes;
	}

	/**
	 * Whether the given granted scopes include all required scopes.
	 */
	public boolean hasRequiredScopes(Collection<String> grantedScopes) {
		for (String required : requiredScopes) {
			if (!hasRequiredScope(grantedScopes, required)) {
				return false;
			}
		}
		return true;
	}

	/**
	 * Enforce the required scopes against a verified token.
	 * @param accessToken the verified token
	 * @throws AuthException with {@link AuthError#INSUFFICIENT_SCOPE} if a scope is missing
	 */
	public void enforce(AccessToken accessToken) {
		for (String required : requiredScopes) {
			if (!hasRequiredScope(accessToken.getScopes(), required)) {
				throw new AuthException(AuthError.INSUFFICIENT_SCOPE, "Missing required scope: " + required);
			}
		}
	}

	public static boolean hasRequiredScope(Collection<String> grantedScopes, String requiredScope) {
		return grantedScopes != null && grantedScopes.contains(requiredScope);
	}

	/**
	 * Normalize a scope claim to an ordered set of scope strings.
	 * @param claim a space-delimited string, a collection of strings, or {@code null}
	 * @return the scopes, empty if the claim is absent or of another type
	 */
	public static Set<String> normalize(Object claim) {
		if (claim instanceof String) {
			Set<String> scopes = new LinkedHashSet<>();
			for (String scope : ((String) claim).trim().split("\\s+")) {
				if (!scope.isEmpty()) {
					scopes.add(scope);
				}
			}
			return scopes;
		}
		if (claim instanceof Collection<?>) {
			Set<String> scopes = new LinkedHashSet<>();
			for (Object scope : (Collection<?>) claim) {
				if (scope != null) {
					scopes.add(scope.toString());
				}
			}
			return scopes;
		}
		return Collections.emptySet();
	}

}
