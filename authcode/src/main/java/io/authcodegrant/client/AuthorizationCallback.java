/*
 * Copyright 2025 the original author or authors.
 */
package io.authcodegrant.client;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Map;

import io.authcodegrant.spec.OAuthProtocolException;
import io.authcodegrant.util.Assert;
import io.authcodegrant.util.Utils;
import reactor.util.annotation.Nullable;

/**
 * Result of an OAuth authorization callback: the query the authorization server sends
 * back to the redirect URI.
 */
public final class AuthorizationCallback {

	private final String code;

	private final String state;

	private final String error;

	private final String errorDescription;

	private final String errorUri;

	public AuthorizationCallback(@Nullable String code, @Nullable String state, @Nullable String error,
			@Nullable String errorDescription, @Nullable String errorUri) {
		this.code = code;
		this.state = state;
		this.error = error;
		this.errorDescription = errorDescription;
		this.errorUri = errorUri;
	}

	/**
	 * @param callbackUri the full callback URI, e.g. the servlet request URL with query
	 * @return the parsed callback
	 */
	public static AuthorizationCallback fromUri(URI callbackUri) {
		Assert.notNull(callbackUri, "callbackUri must not be null");
		return fromQuery(callbackUri.getRawQuery());
	}

	/**
	 * @param rawQuery the still encoded query string, may be {@code null}
	 * @return the parsed callback
	 */
	public static AuthorizationCallback fromQuery(@Nullable String rawQuery) {
		Map<String, String> params = Utils.parseQuery(rawQuery);
		return new AuthorizationCallback(params.get("code"), params.get("state"), params.get("error"),
				params.get("error_description"), params.get("error_uri"));
	}

	@Nullable
	public String getCode() {
		return code;
	}

	@Nullable
	public String getState() {
		return state;
	}

	@Nullable
	public String getError() {
		return error;
	}

	@Nullable
	public String getErrorDescription() {
		return errorDescription;
	}

	@Nullable
	public String getErrorUri() {
		return errorUri;
	}

	public boolean isError() {
		return Utils.hasText(error);
	}

	/**
	 * @return the authorization code
	 * @throws OAuthProtocolException if the server reported an error, e.g.
	 * {@code access_denied}, or sent no code
	 */
	public String requireCode() {
		if (isError()) {
			String message = "Authorization failed: " + error + (errorDescription != null ? " - " + errorDescription : "");
			throw new OAuthProtocolException(message, OAuthProtocolException.NO_STATUS, error, errorDescription,
					errorUri);
		}
		if (!Utils.hasText(code)) {
			throw new OAuthProtocolException("No authorization code received");
		}
		return code;
	}

	/**
	 * Check the returned state against the one sent with the authorization request.
	 * @param expectedState the state generated for this session
	 * @throws OAuthProtocolException if the states differ
	 */
	public void verifyState(String expectedState) {
		Assert.hasText(expectedState, "expectedState must not be empty");
		if (state == null || !MessageDigest.isEqual(expectedState.getBytes(StandardCharsets.UTF_8),
				state.getBytes(StandardCharsets.UTF_8))) {
			throw new OAuthProtocolException("State parameter mismatch: possible CSRF attack");
		}
	}

}
