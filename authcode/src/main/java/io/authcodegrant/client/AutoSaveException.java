/*
 * Copyright 2025 the original author or authors.
 */
package io.authcodegrant.client;

import io.authcodegrant.spec.OAuthClientException;

/**
 * The auto-save hook failed after a token was granted or refreshed. The in-memory token
 * keeps its new state and is available from {@link #getToken()}, so the caller can retry
 * persistence or discard it. The cause is the hook's own failure.
 */
public class AutoSaveException extends OAuthClientException {

	private static final long serialVersionUID = 1L;

	private final transient AccessToken token;

	public AutoSaveException(String message, AccessToken token, Throwable cause) {
		super(message, cause);
		this.token = token;
	}

	/**
	 * @return the token whose new state could not be saved
	 */
	public AccessToken getToken() {
		return token;
	}

}
