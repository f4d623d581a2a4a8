/*
 * Copyright 2025 the original author or authors.
 */
package io.authcodegrant.client;

import java.net.http.HttpRequest;

import io.authcodegrant.auth.TokenScheme;
import io.authcodegrant.util.Assert;
import io.authcodegrant.util.Utils;

/**
 * Authenticator for requests to a protected resource. Adds the access token to a
 * request according to a {@link TokenScheme}:
 * <ul>
 * <li>{@code auth-header:<label>} sets {@code Authorization: <label> <token>}</li>
 * <li>{@code uri-query:<name>} sets the query parameter {@code <name>=<token>}</li>
 * </ul>
 * Applying the same token twice yields a single header or parameter. The profile's
 * {@code referer}, when configured, is sent as the {@code Referer} header.
 */
public class RequestAuthenticator {

	public static final String AUTHORIZATION = "Authorization";

	public static final String REFERER = "Referer";

	/**
	 * Authenticate a request with the token's own scheme.
	 * @param request the request to decorate
	 * @param token the token to attach
	 * @return a decorated copy of {@code request}
	 */
	public HttpRequest attach(HttpRequest request, AccessToken token) {
		Assert.notNull(token, "token must not be null");
		return attach(request, token, token.getScheme());
	}

	/**
	 * Authenticate a request with an explicit scheme.
	 * @param request the request to decorate
	 * @param token the token to attach
	 * @param scheme where and under which label the token goes
	 * @return a decorated copy of {@code request}
	 */
	public HttpRequest attach(HttpRequest request, AccessToken token, TokenScheme scheme) {
		Assert.notNull(request, "request must not be null");
		Assert.notNull(token, "token must not be null");
		Assert.notNull(scheme, "scheme must not be null");

		HttpRequest.Builder builder = HttpRequest.newBuilder(request, (name, value) -> true);
		switch (scheme.getLocation()) {
			case AUTH_HEADER:
				builder.setHeader(AUTHORIZATION, scheme.getLabel() + " " + token.getAccessToken());
				break;
			case URI_QUERY:
				builder.uri(Utils.replaceQueryParameter(request.uri(), scheme.getLabel(), token.getAccessToken()));
				break;
			default:
				throw new IllegalStateException("Unsupported token location: " + scheme.getLocation());
		}

		String referer = token.getProfile().getReferer();
		if (Utils.hasText(referer)) {
			builder.setHeader(REFERER, referer);
		}
		return builder.build();
	}

}
