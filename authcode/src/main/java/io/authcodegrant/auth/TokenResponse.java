/*
 * Copyright 2025 the original author or authors.
 */
package io.authcodegrant.auth;

import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Successful token endpoint response as defined in RFC 6749 section 5.1
 * https://datatracker.ietf.org/doc/html/rfc6749#section-5.1
 * <p>
 * Fields the client does not model, such as {@code id_token}, are kept in
 * {@link #getAdditionalParameters()}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TokenResponse {

	@JsonProperty("access_token")
	private String accessToken;

	@JsonProperty("token_type")
	private String tokenType;

	// some providers still send the pre-RFC "expires" name
	@JsonProperty("expires_in")
	@JsonAlias("expires")
	private Long expiresIn;

	@JsonProperty("scope")
	private String scope;

	@JsonProperty("refresh_token")
	private String refreshToken;

	private final Map<String, Object> additionalParameters = new LinkedHashMap<>();

	public TokenResponse() {
	}

	public TokenResponse(String accessToken, Long expiresIn, String refreshToken) {
		this.accessToken = accessToken;
		this.expiresIn = expiresIn;
		this.refreshToken = refreshToken;
	}

	public String getAccessToken() {
		return accessToken;
	}

	public void setAccessToken(String accessToken) {
		this.accessToken = accessToken;
	}

	public String getTokenType() {
		return tokenType;
	}

	public void setTokenType(String tokenType) {
		this.tokenType = tokenType;
	}

	public Long getExpiresIn() {
		return expiresIn;
	}

	public void setExpiresIn(Long expiresIn) {
		this.expiresIn = expiresIn;
	}

	public String getScope() {
		return scope;
	}

	public void setScope(String scope) {
		this.scope = scope;
	}

	public String getRefreshToken() {
		return refreshToken;
	}

	public void setRefreshToken(String refreshToken) {
		this.refreshToken = refreshToken;
	}

	@JsonAnyGetter
	public Map<String, Object> getAdditionalParameters() {
		return additionalParameters;
	}

	@JsonAnySetter
	public void setAdditionalParameter(String name, Object value) {
		this.additionalParameters.put(name, value);
	}

}
