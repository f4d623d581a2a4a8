/*
 * Copyright 2025 the original author or authors.
 */
package io.authcodegrant.client;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Clock;

import io.authcodegrant.auth.TokenScheme;
import io.authcodegrant.spec.OAuthConfigurationException;
import io.authcodegrant.util.Assert;
import io.authcodegrant.util.Utils;
import reactor.util.annotation.Nullable;

/**
 * Immutable configuration of one OAuth2 integration: who the client is, where the
 * authorization server lives, what to ask for by default, how tokens are attached to
 * resource requests and where granted tokens are saved.
 * <p>
 * A profile is built once and shared by every session of the integration. Use
 * {@link #mutate()} to derive a modified copy.
 *
 * <pre class="code">
 * ClientProfile profile = ClientProfile.builder()
 * 	.clientId("my-app")
 * 	.clientSecret(secret)
 * 	.site("https://auth.example.com")
 * 	.redirectUri("https://app.example.com/callback")
 * 	.tokenScheme("auth-header:Bearer")
 * 	.autoSave((p, token) -&gt; repository.save(token.toStored()))
 * 	.build();
 * </pre>
 */
public final class ClientProfile {

	public static final String DEFAULT_AUTHORIZE_PATH = "/oauth/authorize";

	public static final String DEFAULT_ACCESS_TOKEN_PATH = "/oauth/token";

	public static final String GRANT_TYPE_AUTHORIZATION_CODE = "authorization_code";

	public static final String DEFAULT_TOKEN_SCHEME = "auth-header:Bearer";

	/**
	 * How client credentials are presented to the token endpoint.
	 */
	public enum ClientAuthentication {

		/** {@code client_id} and {@code client_secret} form fields. */
		REQUEST_BODY,

		/** HTTP Basic {@code Authorization} header (RFC 6749 section 2.3.1). */
		BASIC

	}

	private final String clientId;

	private final String clientSecret;

	private final URI site;

	private final String authorizePath;

	private final String accessTokenPath;

	private final String redirectUri;

	private final String scope;

	private final String referer;

	private final String grantType;

	private final TokenScheme tokenScheme;

	private final AutoSaveHook autoSave;

	private final ClientAuthentication clientAuthentication;

	private final Clock clock;

	private ClientProfile(Builder builder, URI site, TokenScheme tokenScheme) {
		this.clientId = builder.clientId;
		this.clientSecret = builder.clientSecret;
		this.site = site;
		this.authorizePath = builder.authorizePath;
		this.accessTokenPath = builder.accessTokenPath;
		this.redirectUri = builder.redirectUri;
		this.scope = builder.scope;
		this.referer = builder.referer;
		this.grantType = builder.grantType;
		this.tokenScheme = tokenScheme;
		this.autoSave = builder.autoSave;
		this.clientAuthentication = builder.clientAuthentication;
		this.clock = builder.clock;
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * @return a builder initialised with this profile's settings
	 */
	public Builder mutate() {
		return new Builder().clientId(clientId)
			.clientSecret(clientSecret)
			.site(site.toString())
			.authorizePath(authorizePath)
			.accessTokenPath(accessTokenPath)
			.redirectUri(redirectUri)
			.scope(scope)
			.referer(referer)
			.grantType(grantType)
			.tokenScheme(tokenScheme)
			.autoSave(autoSave)
			.clientAuthentication(clientAuthentication)
			.clock(clock);
	}

	public String getClientId() {
		return clientId;
	}

	public String getClientSecret() {
		return clientSecret;
	}

	public URI getSite() {
		return site;
	}

	public String getAuthorizePath() {
		return authorizePath;
	}

	public String getAccessTokenPath() {
		return accessTokenPath;
	}

	/**
	 * @return {@code site} joined with {@code authorizePath}
	 */
	public String getAuthorizeUrl() {
		return Utils.joinUrl(site.toString(), authorizePath);
	}

	/**
	 * @return {@code site} joined with {@code accessTokenPath}
	 */
	public String getAccessTokenUrl() {
		return Utils.joinUrl(site.toString(), accessTokenPath);
	}

	@Nullable
	public String getRedirectUri() {
		return redirectUri;
	}

	@Nullable
	public String getScope() {
		return scope;
	}

	@Nullable
	public String getReferer() {
		return referer;
	}

	public String getGrantType() {
		return grantType;
	}

	public TokenScheme getTokenScheme() {
		return tokenScheme;
	}

	@Nullable
	public AutoSaveHook getAutoSave() {
		return autoSave;
	}

	public ClientAuthentication getClientAuthentication() {
		return clientAuthentication;
	}

	public Clock getClock() {
		return clock;
	}

	@Override
	public String toString() {
		return "ClientProfile{clientId='" + clientId + "', site=" + site + ", tokenScheme=" + tokenScheme + "}";
	}

	public static class Builder {

		private String clientId;

		private String clientSecret;

		private String site;

		private String authorizePath = DEFAULT_AUTHORIZE_PATH;

		private String accessTokenPath = DEFAULT_ACCESS_TOKEN_PATH;

		private String redirectUri;

		private String scope;

		private String referer;

		private String grantType = GRANT_TYPE_AUTHORIZATION_CODE;

		private String tokenScheme = DEFAULT_TOKEN_SCHEME;

		private AutoSaveHook autoSave;

		private ClientAuthentication clientAuthentication = ClientAuthentication.REQUEST_BODY;

		private Clock clock = Clock.systemUTC();

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

		/**
		 * Sets the base URI of the authorization server.
		 * @param site an absolute URI such as {@code https://auth.example.com}
		 * @return this builder
		 */
		public Builder site(String site) {
			this.site = site;
			return this;
		}

		public Builder authorizePath(String authorizePath) {
			Assert.notNull(authorizePath, "authorizePath must not be null");
			this.authorizePath = authorizePath;
			return this;
		}

		public Builder accessTokenPath(String accessTokenPath) {
			Assert.notNull(accessTokenPath, "accessTokenPath must not be null");
			this.accessTokenPath = accessTokenPath;
			return this;
		}

		public Builder redirectUri(@Nullable String redirectUri) {
			this.redirectUri = redirectUri;
			return this;
		}

		public Builder scope(@Nullable String scope) {
			this.scope = scope;
			return this;
		}

		public Builder referer(@Nullable String referer) {
			this.referer = referer;
			return this;
		}

		public Builder grantType(String grantType) {
			Assert.hasText(grantType, "grantType must not be empty");
			this.grantType = grantType;
			return this;
		}

		/**
		 * Sets the token attachment scheme from a descriptor, e.g.
		 * {@code uri-query:access_token}. The descriptor is validated by {@link #build()}.
		 * @param tokenScheme the descriptor
		 * @return this builder
		 */
		public Builder tokenScheme(String tokenScheme) {
			this.tokenScheme = tokenScheme;
			return this;
		}

		public Builder tokenScheme(TokenScheme tokenScheme) {
			Assert.notNull(tokenScheme, "tokenScheme must not be null");
			this.tokenScheme = tokenScheme.toString();
			return this;
		}

		public Builder autoSave(@Nullable AutoSaveHook autoSave) {
			this.autoSave = autoSave;
			return this;
		}

		public Builder clientAuthentication(ClientAuthentication clientAuthentication) {
			Assert.notNull(clientAuthentication, "clientAuthentication must not be null");
			this.clientAuthentication = clientAuthentication;
			return this;
		}

		public Builder clock(Clock clock) {
			Assert.notNull(clock, "clock must not be null");
			this.clock = clock;
			return this;
		}

		/**
		 * Validate the settings and create the profile.
		 * @return the profile
		 * @throws OAuthConfigurationException if a required field is missing or the site
		 * or token scheme is malformed
		 */
		public ClientProfile build() {
			if (!Utils.hasText(clientId)) {
				throw new OAuthConfigurationException("clientId must not be empty");
			}
			if (!Utils.hasText(clientSecret)) {
				throw new OAuthConfigurationException("clientSecret must not be empty");
			}
			return new ClientProfile(this, parseSite(site), TokenScheme.parse(tokenScheme));
		}

		private static URI parseSite(String site) {
			if (!Utils.hasText(site)) {
				throw new OAuthConfigurationException("site must not be empty");
			}
			try {
				URI uri = new URI(site.trim());
				if (!uri.isAbsolute() || uri.getHost() == null) {
					throw new OAuthConfigurationException("site must be an absolute URI with a host: " + site);
				}
				return uri;
			}
			catch (URISyntaxException e) {
				throw new OAuthConfigurationException("Invalid site URI: " + site, e);
			}
		}

	}

}
