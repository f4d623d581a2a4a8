/*
 * Copyright 2025 the original author or authors.
 */

package io.authcodegrant.client;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import io.authcodegrant.auth.StoredToken;
import io.authcodegrant.spec.OAuthNetworkException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link AuthorizedRequestExecutor} against a protected resource served by a
 * local {@link HttpServer} that only accepts one access token.
 */
@Timeout(10)
public class AuthorizedRequestExecutorTests {

	private HttpServer server;

	private String baseUrl;

	private volatile String validToken = "A2";

	private final List<String> receivedAuthorizations = new CopyOnWriteArrayList<>();

	private MockTokenEndpoint endpoint;

	private AuthorizedRequestExecutor executor;

	@BeforeEach
	void setUp() throws IOException {
		server = HttpServer.create(new InetSocketAddress("localhost", 0), 0);
		server.createContext("/me", this::handleResource);
		server.start();
		baseUrl = "http://localhost:" + server.getAddress().getPort();

		endpoint = new MockTokenEndpoint();
		executor = new AuthorizedRequestExecutor(HttpClient.newHttpClient());
	}

	@AfterEach
	void tearDown() {
		server.stop(0);
	}

	@Test
	void testValidTokenIsSentOnce() {
		validToken = "A";
		AccessToken token = token("A", "R", null);

		HttpResponse<String> response = executor.send(get(), token);

		assertThat(response.statusCode()).isEqualTo(200);
		assertThat(response.body()).isEqualTo("hello");
		assertThat(receivedAuthorizations).containsExactly("Bearer A");
		assertThat(endpoint.getRequestCount()).isZero();
	}

	@Test
	void testUnauthorizedTriggersRefreshAndRetry() {
		AccessToken token = token("A", "R", null);
		endpoint.respondJson("{\"access_token\":\"A2\",\"expires_in\":3600}");

		HttpResponse<String> response = executor.send(get(), token);

		assertThat(response.statusCode()).isEqualTo(200);
		assertThat(receivedAuthorizations).containsExactly("Bearer A", "Bearer A2");
		assertThat(endpoint.getRequestCount()).isEqualTo(1);
		assertThat(token.getAccessToken()).isEqualTo("A2");
		assertThat(token.isChanged()).isTrue();
	}

	@Test
	void testRetriesOnlyOnce() {
		validToken = "never";
		AccessToken token = token("A", "R", null);
		endpoint.respondJson("{\"access_token\":\"A2\"}");

		HttpResponse<String> response = executor.send(get(), token);

		assertThat(response.statusCode()).isEqualTo(401);
		assertThat(receivedAuthorizations).containsExactly("Bearer A", "Bearer A2");
		assertThat(endpoint.getRequestCount()).isEqualTo(1);
	}

	@Test
	void testUnauthorizedWithoutRefreshTokenIsReturned() {
		AccessToken token = token("A", null, null);

		HttpResponse<String> response = executor.send(get(), token);

		assertThat(response.statusCode()).isEqualTo(401);
		assertThat(receivedAuthorizations).containsExactly("Bearer A");
		assertThat(endpoint.getRequestCount()).isZero();
	}

	@Test
	void testExpiredTokenIsRefreshedBeforeSending() {
		AccessToken token = token("A", "R", ProfileFixtures.NOW.minusSeconds(60).getEpochSecond());
		endpoint.respondJson("{\"access_token\":\"A2\",\"expires_in\":3600}");

		HttpResponse<String> response = executor.send(get(), token);

		assertThat(response.statusCode()).isEqualTo(200);
		assertThat(receivedAuthorizations).containsExactly("Bearer A2");
		assertThat(endpoint.getRequestCount()).isEqualTo(1);
	}

	@Test
	void testUnreachableResource() throws IOException {
		AccessToken token = token("A", "R", null);
		HttpServer stopped = HttpServer.create(new InetSocketAddress("localhost", 0), 0);
		int port = stopped.getAddress().getPort();
		stopped.start();
		stopped.stop(0);
		HttpRequest request = HttpRequest.newBuilder(URI.create("http://localhost:" + port + "/me")).GET().build();

		assertThatThrownBy(() -> executor.send(request, token)).isInstanceOf(OAuthNetworkException.class);
	}

	private HttpRequest get() {
		return HttpRequest.newBuilder(URI.create(baseUrl + "/me")).GET().build();
	}

	private AccessToken token(String accessToken, String refreshToken, Long expiresAt) {
		StoredToken stored = new StoredToken();
		stored.setAccessToken(accessToken);
		stored.setRefreshToken(refreshToken);
		stored.setExpiresAt(expiresAt);
		return new TokenExchanger(ProfileFixtures.profile(), endpoint).restore(stored);
	}

	private void handleResource(HttpExchange exchange) throws IOException {
		String authorization = exchange.getRequestHeaders().getFirst("Authorization");
		receivedAuthorizations.add(authorization);
		if (("Bearer " + validToken).equals(authorization)) {
			byte[] body = "hello".getBytes(StandardCharsets.UTF_8);
			exchange.getResponseHeaders().set("Content-Type", "text/plain");
			exchange.sendResponseHeaders(200, body.length);
			try (OutputStream out = exchange.getResponseBody()) {
				out.write(body);
			}
		}
		else {
			exchange.sendResponseHeaders(401, -1);
			exchange.close();
		}
	}

}
