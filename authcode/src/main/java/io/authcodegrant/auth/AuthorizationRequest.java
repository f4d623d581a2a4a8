/*
 * Copyright 2025 the original author or authors.
 */
package io.authcodegrant.auth;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import io.authcodegrant.util.Assert;

/**
 * Per-session overrides for the authorization redirect. Every field is optional: a
 * {@code null} falls back to the client profile, and {@code responseType} falls back to
 * {@code code}. Instances are built when a user starts a login, turned into a redirect
 * and then discarded.
 */
public final class AuthorizationRequest {

	public static final String RESPONSE_TYPE_CODE = "code";

	private static final AuthorizationRequest EMPTY = builder().build();

	private final String responseType;

	private final String clientId;

	private final String redirectUri;

	private final String scope;

	private final String state;

	private final String codeChallenge;

	private final String codeChallengeMethod;

	private final Map<String, String> additionalParameters;

	private AuthorizationRequest(Builder builder) {
		this.responseType = builder.responseType;
		this.clientId = builder.clientId;
		this.redirectUri = builder.redirectUri;
		this.scope = builder.scope;
		this.state = builder.state;
		this.codeChallenge = builder.codeChallenge;
		this.codeChallengeMethod = builder.codeChallengeMethod;
		this.additionalParameters = Collections.unmodifiableMap(new LinkedHashMap<>(builder.additionalParameters));
	}

	/**
	 * @return a request that overrides nothing
	 */
	public static AuthorizationRequest empty() {
		return EMPTY;
	}

	public static Builder builder() {
		return new Builder();
	}

	public String getResponseType() {
		return responseType;
	}

	public String getClientId() {
		return clientId;
	}

	public String getRedirectUri() {
		return redirectUri;
	}

	public String getScope() {
		return scope;
	}

	public String getState() {
		return state;
	}

	public String getCodeChallenge() {
		return codeChallenge;
	}

	public String getCodeChallengeMethod() {
		return codeChallengeMethod;
	}

	public Map<String, String> getAdditionalParameters() {
		return additionalParameters;
	}

	public static class Builder {

		private String responseType;

		private String clientId;

		private String redirectUri;

		private String scope;

		private String state;

		private String codeChallenge;

		private String codeChallengeMethod;

		private final Map<String, String> additionalParameters = new LinkedHashMap<>();

		Builder() {
		}

		public Builder responseType(String responseType) {
			this.responseType = responseType;
			return this;
		}

		public Builder clientId(String clientId) {
			this.clientId = clientId;
			return this;
		}

		public Builder redirectUri(String redirectUri) {
			this.redirectUri = redirectUri;
			return this;
		}

		public Builder scope(String scope) {
			this.scope = scope;
			return this;
		}

		public Builder state(String state) {
			this.state = state;
			return this;
		}

		/**
		 * Sets an S256 PKCE code challenge.
		 * @param codeChallenge the challenge derived from the code verifier
		 * @return this builder
		 */
		public Builder codeChallenge(String codeChallenge) {
			return codeChallenge(codeChallenge, "S256");
		}

		public Builder codeChallenge(String codeChallenge, String method) {
			Assert.hasText(codeChallenge, "codeChallenge must not be empty");
			Assert.hasText(method, "codeChallengeMethod must not be empty");
			this.codeChallenge = codeChallenge;
			this.codeChallengeMethod = method;
			return this;
		}

		/**
		 * Adds a provider specific query parameter, e.g. {@code prompt=consent}.
		 * @param name the parameter name
		 * @param value the parameter value
		 * @return this builder
		 */
		public Builder parameter(String name, String value) {
			Assert.hasText(name, "name must not be empty");
			Assert.notNull(value, "value must not be null");
			this.additionalParameters.put(name, value);
			return this;
		}

		public AuthorizationRequest build() {
			return new AuthorizationRequest(this);
		}

	}

}
