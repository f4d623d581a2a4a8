/*
 * Copyright 2025 the original author or authors.
 */
package io.authcodegrant.client.transport;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.authcodegrant.spec.OAuthNetworkException;
import io.authcodegrant.util.Assert;

/**
 * {@link TokenTransport} backed by the JDK {@link HttpClient}. Each request carries the
 * configured request timeout; a timeout, an I/O failure or an interrupt is reported as
 * {@link OAuthNetworkException}.
 */
public class HttpClientTokenTransport implements TokenTransport {

	private static final Logger logger = LoggerFactory.getLogger(HttpClientTokenTransport.class);

	private static final String CONTENT_TYPE = "Content-Type";

	private static final String ACCEPT = "Accept";

	private static final String APPLICATION_FORM_URLENCODED = "application/x-www-form-urlencoded";

	private static final String ACCEPT_TOKEN_RESPONSE = "application/json, application/x-www-form-urlencoded;q=0.9, */*;q=0.1";

	private final HttpClient httpClient;

	private final Duration requestTimeout;

	HttpClientTokenTransport(HttpClient httpClient, Duration requestTimeout) {
		Assert.notNull(httpClient, "httpClient must not be null");
		Assert.notNull(requestTimeout, "requestTimeout must not be null");
		this.httpClient = httpClient;
		this.requestTimeout = requestTimeout;
	}

	/**
	 * @return a transport with default timeouts
	 */
	public static HttpClientTokenTransport create() {
		return builder().build();
	}

	public static Builder builder() {
		return new Builder();
	}

	@Override
	public TokenEndpointResponse send(TokenEndpointRequest request) {
		HttpRequest.Builder requestBuilder = HttpRequest.newBuilder()
			.uri(request.uri())
			.header(CONTENT_TYPE, APPLICATION_FORM_URLENCODED)
			.header(ACCEPT, ACCEPT_TOKEN_RESPONSE)
			.timeout(requestTimeout)
			.POST(HttpRequest.BodyPublishers.ofString(request.encodedBody()));
		request.headers().forEach(requestBuilder::setHeader);

		try {
			HttpResponse<String> response = httpClient.send(requestBuilder.build(),
					HttpResponse.BodyHandlers.ofString());
			logger.debug("Token endpoint {} answered with status {}", request.uri(), response.statusCode());
			return new TokenEndpointResponse(response.statusCode(),
					response.headers().firstValue(CONTENT_TYPE).orElse(null), response.body());
		}
		catch (HttpTimeoutException e) {
			throw new OAuthNetworkException("Token endpoint " + request.uri() + " timed out", e);
		}
		catch (IOException e) {
			throw new OAuthNetworkException("Token endpoint " + request.uri() + " could not be reached", e);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new OAuthNetworkException("Interrupted while calling token endpoint " + request.uri(), e);
		}
	}

	public static class Builder {

		private HttpClient.Builder clientBuilder = HttpClient.newBuilder()
			.version(HttpClient.Version.HTTP_1_1)
			.connectTimeout(Duration.ofSeconds(10));

		private HttpClient httpClient;

		private Duration requestTimeout = Duration.ofSeconds(30);

		Builder() {
		}

		/**
		 * Customizes the builder of the {@link HttpClient} created by {@link #build()}.
		 * @param clientBuilder the HTTP client builder
		 * @return this builder
		 */
		public Builder clientBuilder(HttpClient.Builder clientBuilder) {
			Assert.notNull(clientBuilder, "clientBuilder must not be null");
			this.clientBuilder = clientBuilder;
			return this;
		}

		/**
		 * Uses an existing client; takes precedence over {@link #clientBuilder}.
		 * @param httpClient the client
		 * @return this builder
		 */
		public Builder httpClient(HttpClient httpClient) {
			Assert.notNull(httpClient, "httpClient must not be null");
			this.httpClient = httpClient;
			return this;
		}

		public Builder connectTimeout(Duration connectTimeout) {
			Assert.notNull(connectTimeout, "connectTimeout must not be null");
			this.clientBuilder.connectTimeout(connectTimeout);
			return this;
		}

		public Builder requestTimeout(Duration requestTimeout) {
			Assert.notNull(requestTimeout, "requestTimeout must not be null");
			Assert.isTrue(!requestTimeout.isNegative() && !requestTimeout.isZero(), "requestTimeout must be positive");
			this.requestTimeout = requestTimeout;
			return this;
		}

		public HttpClientTokenTransport build() {
			return new HttpClientTokenTransport(httpClient != null ? httpClient : clientBuilder.build(),
					requestTimeout);
		}

	}

}
