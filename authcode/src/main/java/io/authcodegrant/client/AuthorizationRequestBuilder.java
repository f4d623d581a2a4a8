/*
 * Copyright 2025 the original author or authors.
 */
package io.authcodegrant.client;

import java.net.URI;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;

import io.authcodegrant.auth.AuthorizationRequest;
import io.authcodegrant.spec.OAuthConfigurationException;
import io.authcodegrant.util.Assert;
import io.authcodegrant.util.Utils;

/**
 * Builds the URL the resource owner is redirected to in order to grant access. The
 * client secret is never part of it.
 */
public class AuthorizationRequestBuilder {

	private static final SecureRandom secureRandom = new SecureRandom();

	private final ClientProfile profile;

	public AuthorizationRequestBuilder(ClientProfile profile) {
		Assert.notNull(profile, "profile must not be null");
		this.profile = profile;
	}

	/**
	 * Generate an unguessable value for the {@code state} parameter.
	 * @return 256 random bits, base64url encoded without padding
	 */
	public static String generateState() {
		byte[] stateBytes = new byte[32];
		secureRandom.nextBytes(stateBytes);
		return Base64.getUrlEncoder().withoutPadding().encodeToString(stateBytes);
	}

	/**
	 * @return the authorization URL using only the profile's defaults
	 */
	public URI buildAuthorizeUrl() {
		return buildAuthorizeUrl(AuthorizationRequest.empty());
	}

	/**
	 * Build the authorization URL. Query parameters are {@code response_type} and
	 * {@code client_id}, followed by {@code redirect_uri}, {@code scope} and
	 * {@code state} when they are not empty, then the PKCE challenge and any additional
	 * parameters.
	 * @param request per-session overrides of the profile defaults
	 * @return the URL to redirect the resource owner to
	 */
	public URI buildAuthorizeUrl(AuthorizationRequest request) {
		Assert.notNull(request, "request must not be null");

		Map<String, String> params = new LinkedHashMap<>();
		params.put("response_type", firstNonEmpty(request.getResponseType(), AuthorizationRequest.RESPONSE_TYPE_CODE));
		params.put("client_id", firstNonEmpty(request.getClientId(), profile.getClientId()));
		putIfText(params, "redirect_uri", firstNonEmpty(request.getRedirectUri(), profile.getRedirectUri()));
		putIfText(params, "scope", firstNonEmpty(request.getScope(), profile.getScope()));
		putIfText(params, "state", request.getState());
		if (request.getCodeChallenge() != null) {
			params.put("code_challenge", request.getCodeChallenge());
			params.put("code_challenge_method", request.getCodeChallengeMethod());
		}
		request.getAdditionalParameters().forEach(params::putIfAbsent);

		String authorizeUrl = profile.getAuthorizeUrl();
		String separator = authorizeUrl.contains("?") ? "&" : "?";
		try {
			return URI.create(authorizeUrl + separator + Utils.formEncode(params));
		}
		catch (IllegalArgumentException e) {
			throw new OAuthConfigurationException("Invalid authorization URL: " + authorizeUrl, e);
		}
	}

	/**
	 * @param request per-session overrides of the profile defaults
	 * @return a 307 redirect to the authorization URL
	 */
	public AuthorizationRedirect buildRedirect(AuthorizationRequest request) {
		return new AuthorizationRedirect(buildAuthorizeUrl(request));
	}

	public AuthorizationRedirect buildRedirect() {
		return buildRedirect(AuthorizationRequest.empty());
	}

	private static String firstNonEmpty(String value, String fallback) {
		return Utils.hasText(value) ? value : fallback;
	}

	private static void putIfText(Map<String, String> params, String name, String value) {
		if (Utils.hasText(value)) {
			params.put(name, value);
		}
	}

}
