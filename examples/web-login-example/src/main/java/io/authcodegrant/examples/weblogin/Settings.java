/*
 * Copyright 2025 the original author or authors.
 */
package io.authcodegrant.examples.weblogin;

import java.util.Map;

/**
 * Example settings, read from environment variables with local defaults.
 */
public final class Settings {

	public static final String DEFAULT_SITE = "http://localhost:9200";

	public static final String DEFAULT_CLIENT_ID = "example-client";

	public static final String DEFAULT_CLIENT_SECRET = "example-secret";

	public static final String DEFAULT_SCOPE = "read write";

	public static final int DEFAULT_PORT = 3000;

	private final Map<String, String> env;

	Settings(Map<String, String> env) {
		this.env = env;
	}

	public static Settings fromEnvironment() {
		return new Settings(System.getenv());
	}

	public String site() {
		return get("OAUTH_SITE", DEFAULT_SITE);
	}

	public String clientId() {
		return get("OAUTH_CLIENT_ID", DEFAULT_CLIENT_ID);
	}

	public String clientSecret() {
		return get("OAUTH_CLIENT_SECRET", DEFAULT_CLIENT_SECRET);
	}

	public String scope() {
		return get("OAUTH_SCOPE", DEFAULT_SCOPE);
	}

	public int port() {
		return Integer.parseInt(get("PORT", String.valueOf(DEFAULT_PORT)));
	}

	public String redirectUri() {
		return get("OAUTH_REDIRECT_URI", "http://localhost:" + port() + "/callback");
	}

	/**
	 * @return the protected resource shown on {@code /me}
	 */
	public String userInfoUrl() {
		return get("OAUTH_USERINFO_URL", site() + "/userinfo");
	}

	private String get(String name, String defaultValue) {
		String value = env.get(name);
		return (value != null && !value.isBlank()) ? value : defaultValue;
	}

}
