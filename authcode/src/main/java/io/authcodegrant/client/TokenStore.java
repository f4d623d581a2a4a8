/*
 * Copyright 2025 the original author or authors.
 */
package io.authcodegrant.client;

import java.time.Instant;

import reactor.util.annotation.Nullable;

/**
 * Interface for session token storage implementations. A store maps a caller chosen
 * session identifier to the live token of that session. Entries are added when a code
 * is exchanged and removed on logout, or once they expired and cannot be refreshed.
 */
public interface TokenStore {

	/**
	 * Store the token of a session, replacing any previous one.
	 * @param sessionId the session identifier
	 * @param token the token granted to the session
	 */
	void put(String sessionId, AccessToken token);

	/**
	 * Get the token of a session.
	 * @param sessionId the session identifier
	 * @return the token, or {@code null} if the session has none
	 */
	@Nullable
	AccessToken get(String sessionId);

	/**
	 * Forget the token of a session, e.g. on logout.
	 * @param sessionId the session identifier
	 * @return the removed token, or {@code null} if the session had none
	 */
	@Nullable
	AccessToken remove(String sessionId);

	/**
	 * Remove tokens that are expired at {@code now} and have no refresh token; their
	 * sessions have to authorize again.
	 * @param now the reference instant
	 * @return the number of removed tokens
	 */
	int evictUnrefreshable(Instant now);

}
