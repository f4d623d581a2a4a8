/*
 * Copyright 2025 the original author or authors.
 */
package io.authcodegrant.client;

import java.io.IOException;
import java.net.URI;
import java.util.Map;

import jakarta.servlet.http.HttpServletResponse;

import io.authcodegrant.util.Assert;

/**
 * An HTTP {@code 307 Temporary Redirect} to the authorization endpoint, with an empty
 * body.
 */
public final class AuthorizationRedirect {

	public static final int STATUS_TEMPORARY_REDIRECT = 307;

	public static final String LOCATION = "Location";

	private final URI location;

	public AuthorizationRedirect(URI location) {
		Assert.notNull(location, "location must not be null");
		this.location = location;
	}

	public int getStatus() {
		return STATUS_TEMPORARY_REDIRECT;
	}

	public URI getLocation() {
		return location;
	}

	public Map<String, String> getHeaders() {
		return Map.of(LOCATION, location.toString());
	}

	public String getBody() {
		return "";
	}

	/**
	 * Write this redirect to a servlet response.
	 * @param response the response, not yet committed
	 * @throws IOException if the response could not be flushed
	 */
	public void sendTo(HttpServletResponse response) throws IOException {
		response.setStatus(STATUS_TEMPORARY_REDIRECT);
		response.setHeader(LOCATION, location.toString());
		response.setContentLength(0);
		response.flushBuffer();
	}

	@Override
	public String toString() {
		return "AuthorizationRedirect{status=" + STATUS_TEMPORARY_REDIRECT + ", location=" + location + "}";
	}

}
