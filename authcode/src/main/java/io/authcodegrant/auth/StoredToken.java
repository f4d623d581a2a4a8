/*
 * Copyright 2025 the original author or authors.
 */
package io.authcodegrant.auth;

import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Persistable snapshot of an access token. Instances are plain Jackson beans so a
 * persistence layer can write them as JSON; {@code expiresAt} is kept in epoch seconds.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class StoredToken {

	@JsonProperty("access_token")
	private String accessToken;

	@JsonProperty("refresh_token")
	private String refreshToken;

	@JsonProperty("expires_at")
	private Long expiresAt;

	@JsonProperty("token_type")
	private String tokenType;

	@JsonProperty("scope")
	private String scope;

	@JsonProperty("token_scheme")
	private String tokenScheme;

	@JsonProperty("additional_parameters")
	private Map<String, Object> additionalParameters = new LinkedHashMap<>();

	public String getAccessToken() {
		return accessToken;
	}

	public void setAccessToken(String accessToken) {
		this.accessToken = accessToken;
	}

	public String getRefreshToken() {
		return refreshToken;
	}

	public void setRefreshToken(String refreshToken) {
		this.refreshToken = refreshToken;
	}

	public Long getExpiresAt() {
		return expiresAt;
	}

	public void setExpiresAt(Long expiresAt) {
		this.expiresAt = expiresAt;
	}

	public String getTokenType() {
		return tokenType;
	}

	public void setTokenType(String tokenType) {
		this.tokenType = tokenType;
	}

	public String getScope() {
		return scope;
	}

	public void setScope(String scope) {
		this.scope = scope;
	}

	/**
	 * @return the scheme override descriptor, or {@code null} when the token follows its
	 * profile
	 */
	public String getTokenScheme() {
		return tokenScheme;
	}

	public void setTokenScheme(String tokenScheme) {
		this.tokenScheme = tokenScheme;
	}

	public Map<String, Object> getAdditionalParameters() {
		return additionalParameters;
	}

	public void setAdditionalParameters(Map<String, Object> additionalParameters) {
		this.additionalParameters = additionalParameters != null ? additionalParameters : new LinkedHashMap<>();
	}

}
