/*
 * Copyright 2025 the original author or authors.
 */
package io.authcodegrant.client.transport;

import reactor.util.annotation.Nullable;

/**
 * Raw answer of the token endpoint, before any interpretation.
 *
 * @param statusCode the HTTP status
 * @param contentType the {@code Content-Type} header, if any
 * @param body the response body, never {@code null}
 */
public record TokenEndpointResponse(int statusCode, @Nullable String contentType, String body) {

	public TokenEndpointResponse {
		body = (body != null) ? body : "";
	}

	public boolean isSuccessful() {
		return statusCode >= 200 && statusCode < 300;
	}

}
