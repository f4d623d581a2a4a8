/*
 * Copyright 2025 the original author or authors.
 */
package io.authcodegrant.auth;

import java.util.Locale;
import java.util.Objects;

import io.authcodegrant.spec.OAuthConfigurationException;
import io.authcodegrant.util.Utils;

/**
 * Describes how an access token is attached to requests for a protected resource. A
 * scheme has a location, either the {@code Authorization} header or the request URI
 * query, and a label: the header prefix ({@code Bearer}, {@code OAuth}) or the name of
 * the query parameter.
 * <p>
 * Schemes are written as {@code <location>:<label>}, for example
 * {@code auth-header:Bearer} or {@code uri-query:access_token}.
 */
public final class TokenScheme {

	public enum Location {

		AUTH_HEADER("auth-header"),

		URI_QUERY("uri-query");

		private final String descriptor;

		Location(String descriptor) {
			this.descriptor = descriptor;
		}

		public String descriptor() {
			return descriptor;
		}

		static Location fromDescriptor(String descriptor) {
			String normalized = descriptor.trim().toLowerCase(Locale.ROOT);
			for (Location location : values()) {
				if (location.descriptor.equals(normalized)) {
					return location;
				}
			}
			return null;
		}

	}

	public static final TokenScheme BEARER_HEADER = authHeader("Bearer");

	public static final TokenScheme OAUTH_HEADER = authHeader("OAuth");

	public static final TokenScheme ACCESS_TOKEN_QUERY = uriQuery("access_token");

	private final Location location;

	private final String label;

	private TokenScheme(Location location, String label) {
		this.location = location;
		this.label = label;
	}

	public static TokenScheme authHeader(String label) {
		return of(Location.AUTH_HEADER, label);
	}

	public static TokenScheme uriQuery(String parameterName) {
		return of(Location.URI_QUERY, parameterName);
	}

	private static TokenScheme of(Location location, String label) {
		if (!Utils.hasText(label) || label.chars().anyMatch(Character::isWhitespace)) {
			throw new OAuthConfigurationException("Token scheme label must be a single non-empty word: '" + label + "'");
		}
		return new TokenScheme(location, label);
	}

	/**
	 * Parse a scheme descriptor such as {@code auth-header:OAuth}.
	 * @param descriptor the descriptor
	 * @return the scheme
	 * @throws OAuthConfigurationException if the descriptor is malformed
	 */
	public static TokenScheme parse(String descriptor) {
		if (!Utils.hasText(descriptor)) {
			throw new OAuthConfigurationException("Token scheme must not be empty");
		}
		int idx = descriptor.indexOf(':');
		if (idx <= 0 || idx == descriptor.length() - 1) {
			throw new OAuthConfigurationException(
					"Token scheme must look like '<location>:<label>', got '" + descriptor + "'");
		}
		Location location = Location.fromDescriptor(descriptor.substring(0, idx));
		if (location == null) {
			throw new OAuthConfigurationException("Unknown token scheme location in '" + descriptor
					+ "', expected 'auth-header' or 'uri-query'");
		}
		return of(location, descriptor.substring(idx + 1).trim());
	}

	public Location getLocation() {
		return location;
	}

	public String getLabel() {
		return label;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof TokenScheme)) {
			return false;
		}
		TokenScheme that = (TokenScheme) o;
		return location == that.location && label.equals(that.label);
	}

	@Override
	public int hashCode() {
		return Objects.hash(location, label);
	}

	@Override
	public String toString() {
		return location.descriptor() + ":" + label;
	}

}
