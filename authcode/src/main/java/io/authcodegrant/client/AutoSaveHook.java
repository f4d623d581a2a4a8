/*
 * Copyright 2025 the original author or authors.
 */
package io.authcodegrant.client;

/**
 * Persistence callback invoked after every token grant and refresh.
 * <p>
 * The hook runs synchronously on the thread that performed the exchange, while the
 * refreshed token is still locked against concurrent refreshes. Implementations that
 * persist successfully are expected to call {@link AccessToken#markSaved()}. Any
 * exception thrown here reaches the caller of the exchange wrapped in an
 * {@link AutoSaveException}, unless it already is one.
 */
@FunctionalInterface
public interface AutoSaveHook {

	/**
	 * Persist the given token.
	 * @param profile the profile the token belongs to
	 * @param token the token that was just granted or refreshed
	 * @throws Exception if the token could not be persisted
	 */
	void save(ClientProfile profile, AccessToken token) throws Exception;

}
