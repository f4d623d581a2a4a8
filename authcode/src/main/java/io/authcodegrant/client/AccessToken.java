/*
 * Copyright 2025 the original author or authors.
 */
package io.authcodegrant.client;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

import io.authcodegrant.auth.StoredToken;
import io.authcodegrant.auth.TokenResponse;
import io.authcodegrant.auth.TokenScheme;
import io.authcodegrant.util.Utils;
import reactor.util.annotation.Nullable;

/**
 * Live token material of one granted session.
 * <p>
 * A token is issued by a {@link TokenExchanger} and keeps a reference to it, so it can
 * refresh itself against the same token endpoint and notify the same profile's
 * auto-save hook. The profile is shared, never copied: the token must not outlive it.
 * <p>
 * The material (access token, refresh token, expiry, type and scope) is replaced as one
 * unit when the token is refreshed, so readers never see a half-applied refresh.
 * Refreshes of the same token are serialized; see {@link TokenExchanger#exchangeRefresh}.
 */
public class AccessToken {

	private final TokenExchanger exchanger;

	private final ReentrantLock refreshLock = new ReentrantLock();

	private volatile Material material;

	private volatile TokenScheme schemeOverride;

	private volatile boolean changed;

	// bumped on every successful refresh, read before waiting for the refresh lock
	private volatile long refreshGeneration;

	AccessToken(TokenExchanger exchanger, TokenResponse response, Instant now) {
		this.exchanger = exchanger;
		this.material = Material.granted(response, now);
		this.changed = true;
	}

	AccessToken(TokenExchanger exchanger, StoredToken stored) {
		this.exchanger = exchanger;
		this.material = Material.restored(stored);
		this.schemeOverride = Utils.hasText(stored.getTokenScheme()) ? TokenScheme.parse(stored.getTokenScheme())
				: null;
		this.changed = false;
	}

	public ClientProfile getProfile() {
		return exchanger.getProfile();
	}

	public String getAccessToken() {
		return material.accessToken;
	}

	@Nullable
	public String getRefreshToken() {
		return material.refreshToken;
	}

	/**
	 * @return the absolute expiry, or {@code null} when the server did not say
	 */
	@Nullable
	public Instant getExpiresAt() {
		return material.expiresAt;
	}

	@Nullable
	public String getTokenType() {
		return material.tokenType;
	}

	@Nullable
	public String getScope() {
		return material.scope;
	}

	/**
	 * @return response fields not modelled explicitly, such as {@code id_token}
	 */
	public Map<String, Object> getAdditionalParameters() {
		return material.additionalParameters;
	}

	/**
	 * @return the scheme used to attach this token: its override if set, otherwise the
	 * profile's scheme
	 */
	public TokenScheme getScheme() {
		TokenScheme override = this.schemeOverride;
		return (override != null) ? override : getProfile().getTokenScheme();
	}

	@Nullable
	public TokenScheme getSchemeOverride() {
		return schemeOverride;
	}

	public void setSchemeOverride(@Nullable TokenScheme schemeOverride) {
		this.schemeOverride = schemeOverride;
	}

	/**
	 * @return {@code true} if the token was granted or refreshed since the persistence
	 * layer last called {@link #markSaved()}
	 */
	public boolean isChanged() {
		return changed;
	}

	/**
	 * Clear the changed flag. Only the persistence layer calls this, after it stored the
	 * current state.
	 */
	public void markSaved() {
		this.changed = false;
	}

	/**
	 * Whether the token is past its expiry. Tokens without a known expiry never expire
	 * on their own; they are refreshed explicitly, typically after a 401.
	 * @param now the instant to compare against
	 * @return {@code true} if an expiry is known and {@code now} is at or after it
	 */
	public boolean isExpired(Instant now) {
		Instant expiresAt = material.expiresAt;
		return expiresAt != null && !now.isBefore(expiresAt);
	}

	/**
	 * @return {@link #isExpired(Instant)} evaluated with the profile's clock
	 */
	public boolean isExpired() {
		return isExpired(getProfile().getClock().instant());
	}

	public boolean canRefresh() {
		return Utils.hasText(material.refreshToken);
	}

	/**
	 * Refresh this token in place.
	 * @return this token
	 * @see TokenExchanger#exchangeRefresh(AccessToken)
	 */
	public AccessToken refresh() {
		return exchanger.exchangeRefresh(this);
	}

	/**
	 * Refresh this token if it is expired and has a refresh token.
	 * @return {@code true} if a refresh was performed or joined
	 */
	public boolean refreshIfExpired() {
		long generation = this.refreshGeneration;
		if (!isExpired() || !canRefresh()) {
			return false;
		}
		exchanger.exchangeRefresh(this, ExchangeOptions.none(), generation);
		return true;
	}

	/**
	 * @return a snapshot suitable for persistence
	 */
	public StoredToken toStored() {
		Material current = this.material;
		StoredToken stored = new StoredToken();
		stored.setAccessToken(current.accessToken);
		stored.setRefreshToken(current.refreshToken);
		stored.setExpiresAt(current.expiresAt != null ? current.expiresAt.getEpochSecond() : null);
		stored.setTokenType(current.tokenType);
		stored.setScope(current.scope);
		TokenScheme override = this.schemeOverride;
		stored.setTokenScheme(override != null ? override.toString() : null);
		stored.setAdditionalParameters(new LinkedHashMap<>(current.additionalParameters));
		return stored;
	}

	TokenExchanger getExchanger() {
		return exchanger;
	}

	ReentrantLock refreshLock() {
		return refreshLock;
	}

	long refreshGeneration() {
		return refreshGeneration;
	}

	boolean hasQueuedRefreshes() {
		return refreshLock.hasQueuedThreads();
	}

	/**
	 * Apply a refresh response. Must be called with the refresh lock held.
	 */
	void applyRefresh(TokenResponse response, Instant now) {
		this.material = material.refreshed(response, now);
		this.refreshGeneration++;
		this.changed = true;
	}

	@Override
	public String toString() {
		Material current = this.material;
		return "AccessToken{expiresAt=" + current.expiresAt + ", refreshable=" + canRefresh() + ", scheme="
				+ getScheme() + ", changed=" + changed + "}";
	}

	private static final class Material {

		private final String accessToken;

		private final String refreshToken;

		private final Instant expiresAt;

		private final String tokenType;

		private final String scope;

		private final Map<String, Object> additionalParameters;

		private Material(String accessToken, String refreshToken, Instant expiresAt, String tokenType, String scope,
				Map<String, Object> additionalParameters) {
			this.accessToken = accessToken;
			this.refreshToken = refreshToken;
			this.expiresAt = expiresAt;
			this.tokenType = tokenType;
			this.scope = scope;
			this.additionalParameters = Collections.unmodifiableMap(new LinkedHashMap<>(additionalParameters));
		}

		static Material granted(TokenResponse response, Instant now) {
			return new Material(response.getAccessToken(), emptyToNull(response.getRefreshToken()),
					expiresAt(response, now), response.getTokenType(), response.getScope(),
					response.getAdditionalParameters());
		}

		static Material restored(StoredToken stored) {
			Instant expiresAt = (stored.getExpiresAt() != null) ? Instant.ofEpochSecond(stored.getExpiresAt()) : null;
			return new Material(stored.getAccessToken(), emptyToNull(stored.getRefreshToken()), expiresAt,
					stored.getTokenType(), stored.getScope(), stored.getAdditionalParameters());
		}

		// a refresh response without refresh_token keeps the current one
		Material refreshed(TokenResponse response, Instant now) {
			String newRefreshToken = Utils.hasText(response.getRefreshToken()) ? response.getRefreshToken()
					: this.refreshToken;
			return new Material(response.getAccessToken(), newRefreshToken, expiresAt(response, now),
					response.getTokenType() != null ? response.getTokenType() : this.tokenType,
					response.getScope() != null ? response.getScope() : this.scope,
					response.getAdditionalParameters().isEmpty() ? this.additionalParameters
							: response.getAdditionalParameters());
		}

		private static Instant expiresAt(TokenResponse response, Instant now) {
			return (response.getExpiresIn() != null) ? now.plusSeconds(response.getExpiresIn()) : null;
		}

		private static String emptyToNull(String value) {
			return Utils.hasText(value) ? value : null;
		}

	}

}
