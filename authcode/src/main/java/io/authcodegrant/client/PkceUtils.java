/*
 * Copyright 2025 the original author or authors.
 */
package io.authcodegrant.client;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.Base64;

/**
 * Proof Key for Code Exchange (RFC 7636) for public and confidential clients. A caller
 * keeps the verifier with the pending login, sends its S256 challenge through
 * {@link io.authcodegrant.auth.AuthorizationRequest.Builder#codeChallenge(String)} and
 * hands the verifier back to {@link TokenExchanger} via
 * {@link ExchangeOptions.Builder#codeVerifier(String)}.
 */
public final class PkceUtils {

	private static final SecureRandom secureRandom = new SecureRandom();

	private static final String ALLOWED_CHARS = "ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz0123456789-._~";

	private PkceUtils() {
	}

	/**
	 * Generates a cryptographically random code verifier for PKCE.
	 * @return A random 128 character code verifier string.
	 */
	public static String generateCodeVerifier() {
		StringBuilder codeVerifier = new StringBuilder(128);
		for (int i = 0; i < 128; i++) {
			codeVerifier.append(ALLOWED_CHARS.charAt(secureRandom.nextInt(ALLOWED_CHARS.length())));
		}
		return codeVerifier.toString();
	}

	/**
	 * Generates an S256 code challenge from a code verifier.
	 * @param codeVerifier The code verifier to hash.
	 * @return The base64url encoded SHA-256 of the verifier.
	 */
	public static String generateCodeChallenge(String codeVerifier) {
		try {
			MessageDigest digest = MessageDigest.getInstance("SHA-256");
			byte[] hash = digest.digest(codeVerifier.getBytes(StandardCharsets.US_ASCII));
			return Base64.getUrlEncoder().withoutPadding().encodeToString(hash);
		}
		catch (NoSuchAlgorithmException e) {
			throw new IllegalStateException("SHA-256 algorithm not available", e);
		}
	}

}
