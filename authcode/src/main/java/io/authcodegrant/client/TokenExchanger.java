/*
 * Copyright 2025 the original author or authors.
 */
package io.authcodegrant.client;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Base64;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.authcodegrant.auth.StoredToken;
import io.authcodegrant.auth.TokenResponse;
import io.authcodegrant.client.ClientProfile.ClientAuthentication;
import io.authcodegrant.client.transport.HttpClientTokenTransport;
import io.authcodegrant.client.transport.TokenEndpointRequest;
import io.authcodegrant.client.transport.TokenResponseParser;
import io.authcodegrant.client.transport.TokenTransport;
import io.authcodegrant.spec.OAuthConfigurationException;
import io.authcodegrant.spec.OAuthNetworkException;
import io.authcodegrant.spec.OAuthProtocolException;
import io.authcodegrant.util.Assert;
import io.authcodegrant.util.Utils;

/**
 * Exchanges authorization codes and refresh tokens for access tokens at the token
 * endpoint of a {@link ClientProfile}.
 * <p>
 * Every successful exchange marks the token as changed and runs the profile's auto-save
 * hook before returning. Failed exchanges never modify a token. Nothing is retried: a
 * {@link OAuthNetworkException} or {@link OAuthProtocolException} goes straight to the
 * caller.
 * <p>
 * Refreshes of a single token are serialized. Authorization servers may invalidate a
 * refresh token as soon as it is used, so a second refresh started while one is in
 * flight waits for it and returns its result instead of sending the stale refresh token.
 */
public class TokenExchanger {

	private static final Logger logger = LoggerFactory.getLogger(TokenExchanger.class);

	public static final String GRANT_TYPE_REFRESH_TOKEN = "refresh_token";

	private static final String AUTHORIZATION = "Authorization";

	private final ClientProfile profile;

	private final TokenTransport transport;

	private final TokenResponseParser parser;

	private final ChangeNotifier changeNotifier;

	private final URI tokenEndpoint;

	/**
	 * Creates an exchanger talking to the token endpoint through the JDK HTTP client.
	 * @param profile the client profile
	 */
	public TokenExchanger(ClientProfile profile) {
		this(profile, HttpClientTokenTransport.create());
	}

	public TokenExchanger(ClientProfile profile, TokenTransport transport) {
		this(profile, transport, new TokenResponseParser(), new ChangeNotifier());
	}

	public TokenExchanger(ClientProfile profile, TokenTransport transport, TokenResponseParser parser,
			ChangeNotifier changeNotifier) {
		Assert.notNull(profile, "profile must not be null");
		Assert.notNull(transport, "transport must not be null");
		Assert.notNull(parser, "parser must not be null");
		Assert.notNull(changeNotifier, "changeNotifier must not be null");
		this.profile = profile;
		this.transport = transport;
		this.parser = parser;
		this.changeNotifier = changeNotifier;
		this.tokenEndpoint = toUri(profile.getAccessTokenUrl());
	}

	public ClientProfile getProfile() {
		return profile;
	}

	public AccessToken exchangeCode(String code) {
		return exchangeCode(code, ExchangeOptions.none());
	}

	/**
	 * Exchange an authorization code for a new token.
	 * @param code the code returned on the authorization callback
	 * @param options credential and redirect URI overrides
	 * @return the granted token, already passed to the auto-save hook
	 * @throws OAuthNetworkException if the token endpoint could not be reached
	 * @throws OAuthProtocolException if the endpoint refused the code or answered with
	 * something other than a token
	 * @throws AutoSaveException if the auto-save hook failed
	 */
	public AccessToken exchangeCode(String code, ExchangeOptions options) {
		Assert.hasText(code, "code must not be empty");
		Assert.notNull(options, "options must not be null");

		Map<String, String> form = new LinkedHashMap<>();
		form.put("grant_type", profile.getGrantType());
		form.put("code", code);
		String redirectUri = Utils.hasText(options.getRedirectUri()) ? options.getRedirectUri()
				: profile.getRedirectUri();
		if (Utils.hasText(redirectUri)) {
			form.put("redirect_uri", redirectUri);
		}
		if (Utils.hasText(options.getCodeVerifier())) {
			form.put("code_verifier", options.getCodeVerifier());
		}

		logger.debug("Exchanging authorization code for client {}", clientId(options));
		TokenResponse response = requestToken(form, options);

		AccessToken token = new AccessToken(this, response, now());
		changeNotifier.notify(profile, token);
		return token;
	}

	public AccessToken exchangeRefresh(AccessToken token) {
		return exchangeRefresh(token, ExchangeOptions.none());
	}

	/**
	 * Refresh {@code token} in place using its refresh token.
	 * <p>
	 * If another thread completes a refresh of the same token while this call waits for
	 * it, this call returns the token as refreshed by the other thread without contacting
	 * the token endpoint. If the response carries no refresh token the current one is
	 * kept.
	 * @param token the token to refresh
	 * @param options credential overrides
	 * @return {@code token}
	 * @throws OAuthConfigurationException if the token has no refresh token
	 * @throws OAuthNetworkException if the token endpoint could not be reached
	 * @throws OAuthProtocolException if the endpoint rejected the refresh
	 * @throws AutoSaveException if the auto-save hook failed
	 */
	public AccessToken exchangeRefresh(AccessToken token, ExchangeOptions options) {
		Assert.notNull(token, "token must not be null");
		return exchangeRefresh(token, options, token.refreshGeneration());
	}

	/**
	 * Refresh {@code token} unless it was already refreshed after the caller observed
	 * {@code observedGeneration}.
	 */
	AccessToken exchangeRefresh(AccessToken token, ExchangeOptions options, long observedGeneration) {
		Assert.notNull(token, "token must not be null");
		Assert.notNull(options, "options must not be null");
		if (!token.canRefresh()) {
			throw new OAuthConfigurationException("Cannot refresh access token: no refresh token");
		}

		ReentrantLock lock = token.refreshLock();
		lock.lock();
		try {
			if (token.refreshGeneration() != observedGeneration) {
				logger.debug("Token for client {} was refreshed concurrently, reusing the result", clientId(options));
				return token;
			}

			Map<String, String> form = new LinkedHashMap<>();
			form.put("grant_type", GRANT_TYPE_REFRESH_TOKEN);
			form.put("refresh_token", token.getRefreshToken());

			logger.debug("Refreshing access token for client {}", clientId(options));
			TokenResponse response = requestToken(form, options);

			token.applyRefresh(response, now());
			changeNotifier.notify(profile, token);
			return token;
		}
		finally {
			lock.unlock();
		}
	}

	/**
	 * Rebind a persisted token to this exchanger. The restored token is not marked as
	 * changed and is not passed to the auto-save hook.
	 * @param stored the persisted snapshot
	 * @return a live token
	 * @throws OAuthConfigurationException if the snapshot has no access token
	 */
	public AccessToken restore(StoredToken stored) {
		Assert.notNull(stored, "stored must not be null");
		if (!Utils.hasText(stored.getAccessToken())) {
			throw new OAuthConfigurationException("Stored token has no access_token");
		}
		return new AccessToken(this, stored);
	}

	private TokenResponse requestToken(Map<String, String> form, ExchangeOptions options) {
		String clientId = clientId(options);
		String clientSecret = Utils.hasText(options.getClientSecret()) ? options.getClientSecret()
				: profile.getClientSecret();

		Map<String, String> headers = Collections.emptyMap();
		if (profile.getClientAuthentication() == ClientAuthentication.BASIC) {
			String credentials = Utils.urlEncode(clientId) + ":" + Utils.urlEncode(clientSecret);
			headers = Map.of(AUTHORIZATION,
					"Basic " + Base64.getEncoder().encodeToString(credentials.getBytes(StandardCharsets.UTF_8)));
		}
		else {
			form.put("client_id", clientId);
			form.put("client_secret", clientSecret);
		}

		return parser.parse(transport.send(new TokenEndpointRequest(tokenEndpoint, form, headers)));
	}

	private String clientId(ExchangeOptions options) {
		return Utils.hasText(options.getClientId()) ? options.getClientId() : profile.getClientId();
	}

	private Instant now() {
		return profile.getClock().instant();
	}

	private static URI toUri(String url) {
		try {
			return URI.create(url);
		}
		catch (IllegalArgumentException e) {
			throw new OAuthConfigurationException("Invalid token endpoint URL: " + url, e);
		}
	}

}
