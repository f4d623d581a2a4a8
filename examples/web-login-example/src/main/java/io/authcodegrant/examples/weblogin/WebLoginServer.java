/*
 * Copyright 2025 the original author or authors.
 */
package io.authcodegrant.examples.weblogin;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.authcodegrant.auth.AuthorizationRequest;
import io.authcodegrant.client.AccessToken;
import io.authcodegrant.client.AuthorizationCallback;
import io.authcodegrant.client.AuthorizationRedirect;
import io.authcodegrant.client.AuthorizationRequestBuilder;
import io.authcodegrant.client.AuthorizedRequestExecutor;
import io.authcodegrant.client.ClientProfile;
import io.authcodegrant.client.ExchangeOptions;
import io.authcodegrant.client.InMemoryTokenStore;
import io.authcodegrant.client.PkceUtils;
import io.authcodegrant.client.TokenExchanger;
import io.authcodegrant.spec.OAuthClientException;

/**
 * Small web application that logs users in with the authorization code grant.
 * <ul>
 * <li>{@code /login} redirects the browser to the authorization server</li>
 * <li>{@code /callback} exchanges the returned code and keeps the token in memory</li>
 * <li>{@code /me} calls the protected user info resource with the session's token</li>
 * <li>{@code /logout} forgets the token</li>
 * </ul>
 */
public class WebLoginServer {

	private static final Logger logger = LoggerFactory.getLogger(WebLoginServer.class);

	private static final String SESSION_COOKIE = "SID";

	private final Settings settings;

	private final InMemoryTokenStore tokenStore = new InMemoryTokenStore();

	private final Map<String, PendingLogin> pendingLogins = new ConcurrentHashMap<>();

	private final AuthorizationRequestBuilder requestBuilder;

	private final TokenExchanger exchanger;

	private final AuthorizedRequestExecutor executor = new AuthorizedRequestExecutor(HttpClient.newHttpClient());

	private final ScheduledExecutorService housekeeping = Executors.newSingleThreadScheduledExecutor();

	private HttpServer server;

	public WebLoginServer(Settings settings) {
		this.settings = settings;
		ClientProfile profile = ClientProfile.builder()
			.site(settings.site())
			.clientId(settings.clientId())
			.clientSecret(settings.clientSecret())
			.redirectUri(settings.redirectUri())
			.scope(settings.scope())
			.autoSave(tokenStore.asAutoSaveHook())
			.build();
		this.requestBuilder = new AuthorizationRequestBuilder(profile);
		this.exchanger = new TokenExchanger(profile);
	}

	public void start() throws IOException {
		server = HttpServer.create(new InetSocketAddress(settings.port()), 0);
		server.createContext("/login", handle(this::login));
		server.createContext("/callback", handle(this::callback));
		server.createContext("/me", handle(this::me));
		server.createContext("/logout", handle(this::logout));
		server.createContext("/", handle(this::home));
		server.setExecutor(Executors.newCachedThreadPool());
		server.start();
		housekeeping.scheduleAtFixedRate(() -> tokenStore.evictUnrefreshable(Instant.now()), 1, 1,
				TimeUnit.MINUTES);
		logger.info("Web login example listening on http://localhost:{}/ (authorization server {})", settings.port(),
				settings.site());
	}

	public void stop() {
		housekeeping.shutdownNow();
		if (server != null) {
			server.stop(1);
		}
	}

	private void home(HttpExchange exchange, String sessionId) throws IOException {
		AccessToken token = tokenStore.get(sessionId);
		String body = (token == null) ? "<a href=\"/login\">Log in</a>"
				: "Logged in (" + token + ")<br><a href=\"/me\">Who am I?</a> <a href=\"/logout\">Log out</a>";
		respond(exchange, 200, "<html><body>" + body + "</body></html>");
	}

	private void login(HttpExchange exchange, String sessionId) throws IOException {
		String state = AuthorizationRequestBuilder.generateState();
		String codeVerifier = PkceUtils.generateCodeVerifier();
		pendingLogins.put(sessionId, new PendingLogin(state, codeVerifier));

		AuthorizationRedirect redirect = requestBuilder.buildRedirect(AuthorizationRequest.builder()
			.state(state)
			.codeChallenge(PkceUtils.generateCodeChallenge(codeVerifier))
			.build());
		redirect.getHeaders().forEach(exchange.getResponseHeaders()::set);
		exchange.sendResponseHeaders(redirect.getStatus(), -1);
		exchange.close();
	}

	private void callback(HttpExchange exchange, String sessionId) throws IOException {
		PendingLogin pending = pendingLogins.remove(sessionId);
		if (pending == null) {
			respond(exchange, 400, "No login in progress for this session");
			return;
		}
		AuthorizationCallback callback = AuthorizationCallback.fromUri(exchange.getRequestURI());
		callback.verifyState(pending.state());
		AccessToken token = exchanger.exchangeCode(callback.requireCode(),
				ExchangeOptions.builder().codeVerifier(pending.codeVerifier()).build());
		tokenStore.put(sessionId, token);
		logger.info("Session logged in, token {}", token);

		exchange.getResponseHeaders().set("Location", "/");
		exchange.sendResponseHeaders(303, -1);
		exchange.close();
	}

	private void me(HttpExchange exchange, String sessionId) throws IOException {
		AccessToken token = tokenStore.get(sessionId);
		if (token == null) {
			respond(exchange, 401, "Not logged in");
			return;
		}
		HttpRequest request = HttpRequest.newBuilder(URI.create(settings.userInfoUrl())).GET().build();
		HttpResponse<String> response = executor.send(request, token);
		if (response.statusCode() == 401) {
			tokenStore.remove(sessionId);
			respond(exchange, 401, "Token rejected, please log in again");
			return;
		}
		respond(exchange, response.statusCode(), response.body());
	}

	private void logout(HttpExchange exchange, String sessionId) throws IOException {
		tokenStore.remove(sessionId);
		exchange.getResponseHeaders().set("Location", "/");
		exchange.sendResponseHeaders(303, -1);
		exchange.close();
	}

	private HttpHandler handle(SessionHandler handler) {
		return exchange -> {
			try {
				handler.handle(exchange, session(exchange));
			}
			catch (OAuthClientException e) {
				logger.warn("Login flow failed: {}", e.getMessage());
				respond(exchange, 502, "Login failed: " + e.getMessage());
			}
			catch (IllegalArgumentException e) {
				respond(exchange, 400, e.getMessage());
			}
		};
	}

	private static String session(HttpExchange exchange) {
		String cookies = exchange.getRequestHeaders().getFirst("Cookie");
		if (cookies != null) {
			for (String cookie : cookies.split(";")) {
				String[] pair = cookie.trim().split("=", 2);
				if (pair.length == 2 && SESSION_COOKIE.equals(pair[0]) && !pair[1].isEmpty()) {
					return pair[1];
				}
			}
		}
		String sessionId = AuthorizationRequestBuilder.generateState();
		exchange.getResponseHeaders().add("Set-Cookie", SESSION_COOKIE + "=" + sessionId + "; Path=/; HttpOnly");
		return sessionId;
	}

	private static void respond(HttpExchange exchange, int status, String body) throws IOException {
		byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
		exchange.getResponseHeaders().set("Content-Type", "text/html; charset=utf-8");
		exchange.sendResponseHeaders(status, bytes.length);
		try (OutputStream out = exchange.getResponseBody()) {
			out.write(bytes);
		}
	}

	@FunctionalInterface
	private interface SessionHandler {

		void handle(HttpExchange exchange, String sessionId) throws IOException;

	}

	private record PendingLogin(String state, String codeVerifier) {
	}

	public static void main(String[] args) throws IOException {
		WebLoginServer server = new WebLoginServer(Settings.fromEnvironment());
		Runtime.getRuntime().addShutdownHook(new Thread(server::stop));
		server.start();
	}

}
