/*
 * Copyright 2025 the original author or authors.
 */
package io.authcodegrant.client.transport;

import java.io.IOException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.authcodegrant.auth.TokenResponse;
import io.authcodegrant.spec.OAuthProtocolException;
import io.authcodegrant.util.Assert;
import io.authcodegrant.util.Utils;

/**
 * Turns raw token endpoint responses into {@link TokenResponse}s. Bodies may be JSON or
 * {@code application/x-www-form-urlencoded}; the {@code Content-Type} decides, and a
 * missing or unhelpful one falls back to looking at the first character of the body.
 */
public class TokenResponseParser {

	private static final Logger logger = LoggerFactory.getLogger(TokenResponseParser.class);

	private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE_REF = new TypeReference<>() {
	};

	// a century; keeps the absolute expiry representable for any current clock
	static final long MAX_EXPIRES_IN_SECONDS = 100L * 365 * 24 * 60 * 60;

	private final ObjectMapper objectMapper;

	public TokenResponseParser() {
		this(new ObjectMapper());
	}

	public TokenResponseParser(ObjectMapper objectMapper) {
		Assert.notNull(objectMapper, "objectMapper must not be null");
		this.objectMapper = objectMapper;
	}

	/**
	 * Interpret a token endpoint response.
	 * @param response the raw response
	 * @return the parsed token response, with a non-empty access token
	 * @throws OAuthProtocolException if the status is not 2xx, the body cannot be parsed,
	 * no {@code access_token} is present, or {@code expires_in} is negative or too large
	 */
	public TokenResponse parse(TokenEndpointResponse response) {
		if (!response.isSuccessful()) {
			throw errorResponse(response, readFieldsLeniently(response));
		}

		Map<String, Object> fields = readFields(response);
		if (!Utils.hasText(asString(fields.get("access_token")))) {
			if (fields.containsKey("error")) {
				// a few providers answer 200 with an error document
				throw errorResponse(response, fields);
			}
			throw new OAuthProtocolException("Token response does not contain an access_token",
					response.statusCode());
		}

		TokenResponse tokenResponse;
		try {
			tokenResponse = objectMapper.convertValue(fields, TokenResponse.class);
		}
		catch (IllegalArgumentException e) {
			throw new OAuthProtocolException("Token response has malformed fields: " + e.getMessage(),
					response.statusCode(), e);
		}
		Long expiresIn = tokenResponse.getExpiresIn();
		if (expiresIn != null && (expiresIn < 0 || expiresIn > MAX_EXPIRES_IN_SECONDS)) {
			throw new OAuthProtocolException("Token response has an out of range expires_in: " + expiresIn,
					response.statusCode());
		}
		return tokenResponse;
	}

	private Map<String, Object> readFields(TokenEndpointResponse response) {
		String body = response.body().trim();
		if (isJson(response.contentType(), body)) {
			Map<String, Object> fields;
			try {
				fields = objectMapper.readValue(body, MAP_TYPE_REF);
			}
			catch (IOException e) {
				throw new OAuthProtocolException("Token response is not a JSON object", response.statusCode(), e);
			}
			// the literal "null" parses without error
			if (fields == null) {
				throw new OAuthProtocolException("Token response is not a JSON object", response.statusCode());
			}
			return fields;
		}
		return new LinkedHashMap<>(Utils.parseQuery(body));
	}

	private Map<String, Object> readFieldsLeniently(TokenEndpointResponse response) {
		try {
			return readFields(response);
		}
		catch (OAuthProtocolException e) {
			logger.debug("Could not parse error body of token endpoint response with status {}",
					response.statusCode());
			return Collections.emptyMap();
		}
	}

	private static boolean isJson(String contentType, String body) {
		if (contentType != null) {
			String type = contentType.toLowerCase(Locale.ROOT);
			if (type.contains("json")) {
				return true;
			}
			if (type.contains("x-www-form-urlencoded")) {
				return false;
			}
		}
		return body.startsWith("{");
	}

	private static OAuthProtocolException errorResponse(TokenEndpointResponse response, Map<String, Object> fields) {
		String error = asString(fields.get("error"));
		String description = asString(fields.get("error_description"));
		String errorUri = asString(fields.get("error_uri"));

		StringBuilder message = new StringBuilder("Token exchange failed (HTTP ").append(response.statusCode())
			.append(")");
		if (error != null) {
			message.append(": ").append(error);
			if (description != null) {
				message.append(" - ").append(description);
			}
		}
		logger.warn("Token endpoint rejected the request with status {} and error '{}'", response.statusCode(),
				error);
		return new OAuthProtocolException(message.toString(), response.statusCode(), error, description, errorUri);
	}

	private static String asString(Object value) {
		return (value != null) ? value.toString() : null;
	}

}
