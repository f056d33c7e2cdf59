/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.mcpauth.client.auth;

import io.mcpauth.util.Assert;

/**
 * State of one authorization-code attempt: the PKCE pair, the anti-CSRF state and the
 * code once it arrives. Discarded when the attempt completes or fails.
 */
public class OAuthSession {

	/**
	 * Lifecycle of an attempt.
	 */
	public enum FlowState {

		IDLE, AWAITING_CALLBACK, CODE_RECEIVED, EXCHANGING, COMPLETE, FAILED

	}

	private final String codeVerifier;

	private final String codeChallenge;

	private final String state;

	private volatile String authorizationCode;

	private volatile FlowState flowState = FlowState.IDLE;

	public OAuthSession(String codeVerifier, String state) {
		Assert.hasText(codeVerifier, "codeVerifier must not be empty");
		Assert.hasText(state, "state must not be empty");
		this.codeVerifier = codeVerifier;
		this.codeChallenge = PkceUtils.generateCodeChallenge(codeVerifier);
		this.state = state;
	}

	/**
	 * A session with a freshly generated verifier and state.
	 */
	public static OAuthSession create() {
		return new OAuthSession(PkceUtils.generateCodeVerifier(), PkceUtils.generateState());
	}

	public String getCodeVerifier() {
		return codeVerifier;
	}

	public String getCodeChallenge() {
		return codeChallenge;
	}

	public String getState() {
		return state;
	}

	public String getAuthorizationCode() {
		return authorizationCode;
	}

	public FlowState getFlowState() {
		return flowState;
	}

	void awaitingCallback() {
		transition(FlowState.IDLE, FlowState.AWAITING_CALLBACK);
	}

	void codeReceived(String code) {
		transition(FlowState.AWAITING_CALLBACK, FlowState.CODE_RECEIVED);
		this.authorizationCode = code;
	}

	void exchanging() {
		transition(FlowState.CODE_RECEIVED, FlowState.EXCHANGING);
	}

	void complete() {
		transition(FlowState.EXCHANGING, FlowState.COMPLETE);
	}

	void fail() {
		this.flowState = FlowState.FAILED;
	}

	public boolean isStateMatching(String returnedState) {
		return state.equals(returnedState);
	}

	private void transition(FlowState expected, FlowState next) {
		if (flowState != expected) {
			throw new IllegalStateException("Cannot move from " + flowState + " to " + next);
		}
		flowState = next;
	}

}
