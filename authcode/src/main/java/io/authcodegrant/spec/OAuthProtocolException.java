/*
 * Copyright 2025 the original author or authors.
 */
package io.authcodegrant.spec;

import reactor.util.annotation.Nullable;

/**
 * The authorization server answered, but not with something usable: a non-2xx status, a
 * body that could not be parsed, a successful response without {@code access_token}, or
 * an error reported on the authorization callback.
 * <p>
 * When the server supplied RFC 6749 error fields they are exposed through
 * {@link #getError()}, {@link #getErrorDescription()} and {@link #getErrorUri()}.
 */
public class OAuthProtocolException extends OAuthClientException {

	private static final long serialVersionUID = 1L;

	/** Status code used when the failure is not tied to an HTTP response. */
	public static final int NO_STATUS = -1;

	private final int statusCode;

	private final String error;

	private final String errorDescription;

	private final String errorUri;

	public OAuthProtocolException(String message) {
		this(message, NO_STATUS, null, null, null, null);
	}

	public OAuthProtocolException(String message, int statusCode) {
		this(message, statusCode, null, null, null, null);
	}

	public OAuthProtocolException(String message, int statusCode, Throwable cause) {
		this(message, statusCode, null, null, null, cause);
	}

	public OAuthProtocolException(String message, int statusCode, @Nullable String error,
			@Nullable String errorDescription, @Nullable String errorUri) {
		this(message, statusCode, error, errorDescription, errorUri, null);
	}

	private OAuthProtocolException(String message, int statusCode, @Nullable String error,
			@Nullable String errorDescription, @Nullable String errorUri, @Nullable Throwable cause) {
		super(message, cause);
		this.statusCode = statusCode;
		this.error = error;
		this.errorDescription = errorDescription;
		this.errorUri = errorUri;
	}

	/**
	 * @return the HTTP status of the failed response, or {@link #NO_STATUS}
	 */
	public int getStatusCode() {
		return statusCode;
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

}
