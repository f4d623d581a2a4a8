/*
 * Copyright 2025 the original author or authors.
 */
package io.authcodegrant.client;

import reactor.util.annotation.Nullable;

/**
 * Per-call overrides for token endpoint exchanges. Unset values fall back to the client
 * profile.
 */
public final class ExchangeOptions {

	private static final ExchangeOptions NONE = builder().build();

	private final String clientId;

	private final String clientSecret;

	private final String redirectUri;

	private final String codeVerifier;

	private ExchangeOptions(Builder builder) {
		this.clientId = builder.clientId;
		this.clientSecret = builder.clientSecret;
		this.redirectUri = builder.redirectUri;
		this.codeVerifier = builder.codeVerifier;
	}

	public static ExchangeOptions none() {
		return NONE;
	}

	public static Builder builder() {
		return new Builder();
	}

	@Nullable
	public String getClientId() {
		return clientId;
	}

	@Nullable
	public String getClientSecret() {
		return clientSecret;
	}

	/**
	 * @return the redirect URI to send with a code exchange; it must match the one used
	 * in the authorization request
	 */
	@Nullable
	public String getRedirectUri() {
		return redirectUri;
	}

	/**
	 * @return the PKCE code verifier to send with a code exchange
	 */
	@Nullable
	public String getCodeVerifier() {
		return codeVerifier;
	}

	public static class Builder {

		private String clientId;

		private String clientSecret;

		private String redirectUri;

		private String codeVerifier;

		Builder() {
		}

		public Builder clientId(String clientId) {
			this.clientId = clientId;
			return this;
		}

		public Builder clientSecret(String clientSecret) {
			this.clientSecret = clientSecret;
			return this;
		}

		public Builder redirectUri(String redirectUri) {
			this.redirectUri = redirectUri;
			return this;
		}

		public Builder codeVerifier(String codeVerifier) {
			this.codeVerifier = codeVerifier;
			return this;
		}

		public ExchangeOptions build() {
			return new ExchangeOptions(this);
		}

	}

}
