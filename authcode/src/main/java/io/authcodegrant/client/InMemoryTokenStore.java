/*
 * Copyright 2025 the original author or authors.
 */
package io.authcodegrant.client;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.authcodegrant.util.Assert;

/**
 * In-memory implementation of {@link TokenStore}, for applications that do not persist
 * tokens. Holding the live token counts as saving it: {@link #put} clears the changed
 * flag, and the hook returned by {@link #asAutoSaveHook()} does the same for tokens of
 * this store after each refresh.
 */
public class InMemoryTokenStore implements TokenStore {

	private static final Logger logger = LoggerFactory.getLogger(InMemoryTokenStore.class);

	private final Map<String, AccessToken> tokens = new ConcurrentHashMap<>();

	// tokens currently held under at least one session, compared by identity
	private final Set<AccessToken> held = Collections
		.synchronizedSet(Collections.newSetFromMap(new IdentityHashMap<>()));

	@Override
	public void put(String sessionId, AccessToken token) {
		Assert.hasText(sessionId, "sessionId must not be empty");
		Assert.notNull(token, "token must not be null");
		held.add(token);
		AccessToken previous = tokens.put(sessionId, token);
		if (previous != null && previous != token) {
			release(previous);
		}
		token.markSaved();
	}

	@Override
	public AccessToken get(String sessionId) {
		Assert.notNull(sessionId, "sessionId must not be null");
		return tokens.get(sessionId);
	}

	@Override
	public AccessToken remove(String sessionId) {
		Assert.notNull(sessionId, "sessionId must not be null");
		AccessToken removed = tokens.remove(sessionId);
		if (removed != null) {
			release(removed);
		}
		return removed;
	}

	@Override
	public int evictUnrefreshable(Instant now) {
		Assert.notNull(now, "now must not be null");
		List<AccessToken> evicted = new ArrayList<>();
		tokens.values().removeIf(token -> {
			boolean unrefreshable = token.isExpired(now) && !token.canRefresh();
			if (unrefreshable) {
				evicted.add(token);
			}
			return unrefreshable;
		});
		evicted.forEach(this::release);
		if (!evicted.isEmpty()) {
			logger.debug("Evicted {} expired tokens without refresh token", evicted.size());
		}
		return evicted.size();
	}

	public int size() {
		return tokens.size();
	}

	/**
	 * @return an auto-save hook that marks tokens held by this store as saved
	 */
	public AutoSaveHook asAutoSaveHook() {
		return (profile, token) -> {
			if (held.contains(token)) {
				token.markSaved();
			}
		};
	}

	// the same token may be stored under several sessions
	private void release(AccessToken token) {
		if (!tokens.containsValue(token)) {
			held.remove(token);
		}
	}

}
