/*
 * Copyright 2025 the original author or authors.
 */

package io.authcodegrant.client;

import org.junit.jupiter.api.Test;

import io.authcodegrant.auth.TokenScheme;
import io.authcodegrant.spec.OAuthConfigurationException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link ClientProfile} defaults and validation.
 */
public class ClientProfileTests {

	@Test
	void testDefaults() {
		ClientProfile profile = ClientProfile.builder()
			.clientId("id")
			.clientSecret("secret")
			.site("https://auth.example.com")
			.build();

		assertThat(profile.getGrantType()).isEqualTo("authorization_code");
		assertThat(profile.getTokenScheme()).isEqualTo(TokenScheme.BEARER_HEADER);
		assertThat(profile.getAuthorizeUrl()).isEqualTo("https://auth.example.com/oauth/authorize");
		assertThat(profile.getAccessTokenUrl()).isEqualTo("https://auth.example.com/oauth/token");
		assertThat(profile.getClientAuthentication()).isEqualTo(ClientProfile.ClientAuthentication.REQUEST_BODY);
		assertThat(profile.getAutoSave()).isNull();
		assertThat(profile.getRedirectUri()).isNull();
	}

	@Test
	void testCustomPathsAndScheme() {
		ClientProfile profile = ProfileFixtures.builder()
			.site("https://graph.example.com/")
			.authorizePath("/dialog/oauth")
			.accessTokenPath("oauth/access_token")
			.tokenScheme("uri-query:access_token")
			.build();

		assertThat(profile.getAuthorizeUrl()).isEqualTo("https://graph.example.com/dialog/oauth");
		assertThat(profile.getAccessTokenUrl()).isEqualTo("https://graph.example.com/oauth/access_token");
		assertThat(profile.getTokenScheme()).isEqualTo(TokenScheme.ACCESS_TOKEN_QUERY);
	}

	@Test
	void testMissingCredentialsAreRejected() {
		assertThatThrownBy(() -> ProfileFixtures.builder().clientId(" ").build())
			.isInstanceOf(OAuthConfigurationException.class)
			.hasMessageContaining("clientId");
		assertThatThrownBy(() -> ProfileFixtures.builder().clientSecret(null).build())
			.isInstanceOf(OAuthConfigurationException.class)
			.hasMessageContaining("clientSecret");
	}

	@Test
	void testSiteMustBeAbsolute() {
		assertThatThrownBy(() -> ProfileFixtures.builder().site(null).build())
			.isInstanceOf(OAuthConfigurationException.class);
		assertThatThrownBy(() -> ProfileFixtures.builder().site("/relative/path").build())
			.isInstanceOf(OAuthConfigurationException.class);
		assertThatThrownBy(() -> ProfileFixtures.builder().site("https://bad host").build())
			.isInstanceOf(OAuthConfigurationException.class);
	}

	@Test
	void testMalformedTokenSchemeIsRejectedAtBuild() {
		assertThatThrownBy(() -> ProfileFixtures.builder().tokenScheme("header").build())
			.isInstanceOf(OAuthConfigurationException.class);
	}

	@Test
	void testMutateCopiesAndOverrides() {
		AutoSaveHook hook = (p, token) -> {
		};
		ClientProfile original = ProfileFixtures.builder().autoSave(hook).referer("https://app.example.com").build();

		ClientProfile copy = original.mutate().scope("admin").build();

		assertThat(copy).isNotSameAs(original);
		assertThat(copy.getScope()).isEqualTo("admin");
		assertThat(original.getScope()).isEqualTo("read write");
		assertThat(copy.getClientId()).isEqualTo(original.getClientId());
		assertThat(copy.getAutoSave()).isSameAs(hook);
		assertThat(copy.getReferer()).isEqualTo("https://app.example.com");
		assertThat(copy.getClock()).isSameAs(original.getClock());
	}

	@Test
	void testToStringDoesNotLeakSecret() {
		assertThat(ProfileFixtures.profile().toString()).doesNotContain("test-client-secret");
	}

}
