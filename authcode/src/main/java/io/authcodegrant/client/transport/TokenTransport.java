/*
 * Copyright 2025 the original author or authors.
 */
package io.authcodegrant.client.transport;

import io.authcodegrant.spec.OAuthNetworkException;

/**
 * Sends token endpoint requests. Implementations own connection handling, TLS and
 * timeouts; the exchange logic only sees a status, a content type and a body.
 *
 * @see HttpClientTokenTransport
 */
@FunctionalInterface
public interface TokenTransport {

	/**
	 * Send the request and wait for the complete response.
	 * @param request the token endpoint request
	 * @return the response, whatever its status
	 * @throws OAuthNetworkException if no response could be obtained, including timeouts
	 */
	TokenEndpointResponse send(TokenEndpointRequest request);

}
