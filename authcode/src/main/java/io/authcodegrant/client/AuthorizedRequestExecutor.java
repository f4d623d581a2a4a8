/*
 * Copyright 2025 the original author or authors.
 */
package io.authcodegrant.client;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.authcodegrant.spec.OAuthNetworkException;
import io.authcodegrant.util.Assert;

/**
 * Sends requests to a protected resource with an {@link AccessToken} attached.
 * <p>
 * A token known to be expired is refreshed before the request goes out. A {@code 401}
 * answer is taken as a sign that the token was revoked or expired early: if the token
 * can be refreshed it is refreshed once and the request is sent a second time. The
 * second response is returned whatever its status. Tokens without a refresh token get
 * their {@code 401} back; the caller has to restart the authorization flow.
 */
public class AuthorizedRequestExecutor {

	private static final Logger logger = LoggerFactory.getLogger(AuthorizedRequestExecutor.class);

	private static final int UNAUTHORIZED = 401;

	private final HttpClient httpClient;

	private final RequestAuthenticator authenticator;

	public AuthorizedRequestExecutor(HttpClient httpClient) {
		this(httpClient, new RequestAuthenticator());
	}

	public AuthorizedRequestExecutor(HttpClient httpClient, RequestAuthenticator authenticator) {
		Assert.notNull(httpClient, "httpClient must not be null");
		Assert.notNull(authenticator, "authenticator must not be null");
		this.httpClient = httpClient;
		this.authenticator = authenticator;
	}

	/**
	 * Send an authorized request.
	 * @param request the request without credentials
	 * @param token the token to attach
	 * @param bodyHandler the response body handler
	 * @param <T> the response body type
	 * @return the response of the protected resource
	 * @throws OAuthNetworkException if the resource could not be reached
	 */
	public <T> HttpResponse<T> send(HttpRequest request, AccessToken token, HttpResponse.BodyHandler<T> bodyHandler) {
		Assert.notNull(request, "request must not be null");
		Assert.notNull(token, "token must not be null");
		Assert.notNull(bodyHandler, "bodyHandler must not be null");

		token.refreshIfExpired();

		long generation = token.refreshGeneration();
		HttpResponse<T> response = doSend(authenticator.attach(request, token), bodyHandler);
		if (response.statusCode() != UNAUTHORIZED || !token.canRefresh()) {
			return response;
		}

		logger.debug("{} {} answered 401, refreshing the access token and retrying once", request.method(),
				request.uri());
		// skipped when another request already refreshed the token after ours went out
		token.getExchanger().exchangeRefresh(token, ExchangeOptions.none(), generation);
		return doSend(authenticator.attach(request, token), bodyHandler);
	}

	public HttpResponse<String> send(HttpRequest request, AccessToken token) {
		return send(request, token, HttpResponse.BodyHandlers.ofString());
	}

	private <T> HttpResponse<T> doSend(HttpRequest request, HttpResponse.BodyHandler<T> bodyHandler) {
		try {
			return httpClient.send(request, bodyHandler);
		}
		catch (IOException e) {
			throw new OAuthNetworkException("Request to " + request.uri() + " failed", e);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new OAuthNetworkException("Interrupted while sending request to " + request.uri(), e);
		}
	}

}
