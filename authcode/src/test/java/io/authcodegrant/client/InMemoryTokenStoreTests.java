/*
 * Copyright 2025 the original author or authors.
 */

package io.authcodegrant.client;

import java.time.Instant;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.authcodegrant.auth.StoredToken;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link InMemoryTokenStore}.
 */
public class InMemoryTokenStoreTests {

	private InMemoryTokenStore store;

	private MockTokenEndpoint endpoint;

	private TokenExchanger exchanger;

	@BeforeEach
	void setUp() {
		store = new InMemoryTokenStore();
		endpoint = new MockTokenEndpoint();
		exchanger = new TokenExchanger(ProfileFixtures.builder().autoSave(store.asAutoSaveHook()).build(), endpoint);
	}

	@Test
	void testPutGetRemove() {
		endpoint.respondJson("{\"access_token\":\"A\"}");
		AccessToken token = exchanger.exchangeCode("code");
		assertThat(token.isChanged()).isTrue();

		store.put("session-1", token);

		assertThat(token.isChanged()).isFalse();
		assertThat(store.get("session-1")).isSameAs(token);
		assertThat(store.get("session-2")).isNull();
		assertThat(store.size()).isEqualTo(1);
		assertThat(store.remove("session-1")).isSameAs(token);
		assertThat(store.get("session-1")).isNull();
		assertThat(store.remove("session-1")).isNull();
	}

	@Test
	void testHookMarksStoredTokensSavedAfterRefresh() {
		endpoint.respondJson("{\"access_token\":\"A\",\"refresh_token\":\"R\"}").respondJson("{\"access_token\":\"A2\"}");
		AccessToken token = exchanger.exchangeCode("code");
		// not stored yet when the grant is saved
		assertThat(token.isChanged()).isTrue();
		store.put("session-1", token);

		token.refresh();

		assertThat(token.getAccessToken()).isEqualTo("A2");
		assertThat(token.isChanged()).isFalse();
	}

	@Test
	void testHookIgnoresTokensNoLongerStored() {
		endpoint.respondJson("{\"access_token\":\"A2\"}").respondJson("{\"access_token\":\"A3\"}");
		AccessToken token = restored("A", "R", null);
		store.put("session-1", token);
		store.put("session-2", token);

		store.remove("session-1");
		token.refresh();
		assertThat(token.isChanged()).isFalse();

		store.remove("session-2");
		token.refresh();
		assertThat(token.isChanged()).isTrue();
	}

	@Test
	void testEvictUnrefreshable() {
		store.put("expired", restored("A", null, ProfileFixtures.NOW.minusSeconds(1)));
		store.put("expired-refreshable", restored("B", "R", ProfileFixtures.NOW.minusSeconds(1)));
		store.put("valid", restored("C", null, ProfileFixtures.NOW.plusSeconds(60)));
		store.put("no-expiry", restored("D", null, null));

		assertThat(store.evictUnrefreshable(ProfileFixtures.NOW)).isEqualTo(1);

		assertThat(store.get("expired")).isNull();
		assertThat(store.size()).isEqualTo(3);
		assertThat(store.evictUnrefreshable(ProfileFixtures.NOW)).isZero();
	}

	@Test
	void testInvalidArguments() {
		AccessToken token = restored("A", null, null);
		assertThatThrownBy(() -> store.put("", token)).isInstanceOf(IllegalArgumentException.class);
		assertThatThrownBy(() -> store.put("s", null)).isInstanceOf(IllegalArgumentException.class);
		assertThatThrownBy(() -> store.evictUnrefreshable(null)).isInstanceOf(IllegalArgumentException.class);
	}

	private AccessToken restored(String accessToken, String refreshToken, Instant expiresAt) {
		StoredToken stored = new StoredToken();
		stored.setAccessToken(accessToken);
		stored.setRefreshToken(refreshToken);
		stored.setExpiresAt(expiresAt != null ? expiresAt.getEpochSecond() : null);
		return exchanger.restore(stored);
	}

}
