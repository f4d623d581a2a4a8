/*
 * Copyright 2025 the original author or authors.
 */
package io.authcodegrant.client;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;


/**
 * Runs the profile's {@link AutoSaveHook} after a token mutation. Called exactly once per
 * grant or refresh, on the caller's thread, before the exchange returns.
 */
public class ChangeNotifier {

	private static final Logger logger = LoggerFactory.getLogger(ChangeNotifier.class);

	/**
	 * Invoke the auto-save hook of {@code profile} for {@code token}. Does nothing when
	 * the profile has no hook.
	 * @param profile the owning profile
	 * @param token the token that changed
	 * @throws AutoSaveException if the hook fails; the token keeps its new state
	 */
	public void notify(ClientProfile profile, AccessToken token) {
		AutoSaveHook hook = profile.getAutoSave();
		if (hook == null) {
			return;
		}
		try {
			hook.save(profile, token);
			logger.debug("Auto-saved token for client {}", profile.getClientId());
		}
		catch (AutoSaveException e) {
			throw e;
		}
		catch (Exception e) {
			throw new AutoSaveException("Auto-save of token for client " + profile.getClientId() + " failed", token,
					e);
		}
	}

}
