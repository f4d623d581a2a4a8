/*
 * Copyright 2025 the original author or authors.
 */
package io.authcodegrant.util;

import java.net.URI;
import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import reactor.util.annotation.Nullable;

/**
 * String, collection and URL helpers shared by the request builders, the token exchange
 * and the request authenticator.
 */
public final class Utils {

	private Utils() {
	}

	/**
	 * Check whether the given {@code String} contains actual <em>text</em>.
	 * <p>
	 * More specifically, this method returns {@code true} if the {@code String} is not
	 * {@code null}, its length is greater than 0, and it contains at least one
	 * non-whitespace character.
	 * @param str the {@code String} to check (may be {@code null})
	 * @return {@code true} if the {@code String} is not {@code null}, its length is
	 * greater than 0, and it does not contain whitespace only
	 * @see Character#isWhitespace
	 */
	public static boolean hasText(@Nullable String str) {
		return (str != null && !str.isBlank());
	}

	/**
	 * Return {@code true} if the supplied Collection is {@code null} or empty. Otherwise,
	 * return {@code false}.
	 * @param collection the Collection to check
	 * @return whether the given Collection is empty
	 */
	public static boolean isEmpty(@Nullable Collection<?> collection) {
		return (collection == null || collection.isEmpty());
	}

	/**
	 * Return {@code true} if the supplied Map is {@code null} or empty. Otherwise, return
	 * {@code false}.
	 * @param map the Map to check
	 * @return whether the given Map is empty
	 */
	public static boolean isEmpty(@Nullable Map<?, ?> map) {
		return (map == null || map.isEmpty());
	}

	/**
	 * URL-encodes a single value using UTF-8 and the
	 * {@code application/x-www-form-urlencoded} rules.
	 * @param value the value to encode
	 * @return the encoded value
	 */
	public static String urlEncode(String value) {
		return URLEncoder.encode(value, StandardCharsets.UTF_8);
	}

	/**
	 * Format parameters for a URL query or a form body. Iteration order of the map is
	 * preserved.
	 * @param params The parameters.
	 * @return The formatted query string.
	 */
	public static String formEncode(Map<String, String> params) {
		StringBuilder result = new StringBuilder();
		boolean first = true;

		for (Map.Entry<String, String> entry : params.entrySet()) {
			if (!first) {
				result.append("&");
			}
			first = false;

			result.append(urlEncode(entry.getKey()));
			result.append("=");
			result.append(urlEncode(entry.getValue()));
		}

		return result.toString();
	}

	/**
	 * Parse a raw (still encoded) query string or form body into a map. Later duplicates
	 * of a key win; keys without a value map to an empty string.
	 * @param query the raw query, may be {@code null}
	 * @return the decoded parameters in their original order
	 */
	public static Map<String, String> parseQuery(@Nullable String query) {
		Map<String, String> params = new LinkedHashMap<>();
		if (!hasText(query)) {
			return params;
		}
		for (String pair : query.trim().split("&")) {
			if (pair.isEmpty()) {
				continue;
			}
			int idx = pair.indexOf('=');
			String key = (idx >= 0) ? pair.substring(0, idx) : pair;
			String value = (idx >= 0) ? pair.substring(idx + 1) : "";
			params.put(URLDecoder.decode(key, StandardCharsets.UTF_8),
					URLDecoder.decode(value, StandardCharsets.UTF_8));
		}
		return params;
	}

	public static boolean isAbsoluteUrl(@Nullable String url) {
		if (url == null) {
			return false;
		}
		String lower = url.toLowerCase();
		return lower.startsWith("http://") || lower.startsWith("https://");
	}

	/**
	 * Join a base URL and a relative path with exactly one slash between them. An
	 * absolute {@code path} is returned unchanged.
	 * @param baseUrl the base URL, e.g. {@code https://auth.example.com/}
	 * @param path the path, e.g. {@code /oauth/token}
	 * @return the joined URL
	 */
	public static String joinUrl(String baseUrl, String path) {
		if (isAbsoluteUrl(path)) {
			return path;
		}
		if (!hasText(path)) {
			return baseUrl;
		}
		String base = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
		return path.startsWith("/") ? base + path : base + "/" + path;
	}

	/**
	 * Return a copy of {@code uri} whose query carries exactly one {@code name} parameter
	 * set to {@code value}. Existing occurrences of {@code name} are dropped, the other
	 * parameters and the fragment are kept as they were.
	 * @param uri the URI to extend
	 * @param name the parameter name
	 * @param value the parameter value (unencoded)
	 * @return the new URI
	 */
	public static URI replaceQueryParameter(URI uri, String name, String value) {
		String raw = uri.toString();
		String fragment = uri.getRawFragment();
		if (fragment != null) {
			raw = raw.substring(0, raw.length() - fragment.length() - 1);
		}
		String query = uri.getRawQuery();
		if (query != null) {
			raw = raw.substring(0, raw.length() - query.length() - 1);
		}

		List<String> pairs = new ArrayList<>();
		if (query != null) {
			for (String pair : query.split("&")) {
				if (pair.isEmpty()) {
					continue;
				}
				int idx = pair.indexOf('=');
				String key = URLDecoder.decode((idx >= 0) ? pair.substring(0, idx) : pair, StandardCharsets.UTF_8);
				if (!key.equals(name)) {
					pairs.add(pair);
				}
			}
		}
		pairs.add(urlEncode(name) + "=" + urlEncode(value));

		StringBuilder result = new StringBuilder(raw).append('?').append(String.join("&", pairs));
		if (fragment != null) {
			result.append('#').append(fragment);
		}
		return URI.create(result.toString());
	}

}
