/*
 * Copyright 2025 the original author or authors.
 */
package io.authcodegrant.client.transport;

import java.net.URI;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import io.authcodegrant.util.Assert;
import io.authcodegrant.util.Utils;

/**
 * A form-encoded POST to the token endpoint.
 *
 * @param uri the token endpoint
 * @param formParameters body parameters, in the order they are sent
 * @param headers extra request headers, e.g. HTTP Basic client credentials
 */
public record TokenEndpointRequest(URI uri, Map<String, String> formParameters, Map<String, String> headers) {

	public TokenEndpointRequest {
		Assert.notNull(uri, "uri must not be null");
		Assert.notNull(formParameters, "formParameters must not be null");
		Assert.notNull(headers, "headers must not be null");
		formParameters = Collections.unmodifiableMap(new LinkedHashMap<>(formParameters));
		headers = Collections.unmodifiableMap(new LinkedHashMap<>(headers));
	}

	/**
	 * @return the {@code application/x-www-form-urlencoded} body
	 */
	public String encodedBody() {
		return Utils.formEncode(formParameters);
	}

}
