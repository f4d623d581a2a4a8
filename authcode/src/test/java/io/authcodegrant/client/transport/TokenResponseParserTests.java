/*
 * Copyright 2025 the original author or authors.
 */

package io.authcodegrant.client.transport;

import org.junit.jupiter.api.Test;

import io.authcodegrant.auth.TokenResponse;
import io.authcodegrant.spec.OAuthProtocolException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link TokenResponseParser}.
 */
public class TokenResponseParserTests {

	private final TokenResponseParser parser = new TokenResponseParser();

	@Test
	void testJsonResponse() {
		TokenResponse response = parser.parse(new TokenEndpointResponse(200, "application/json;charset=UTF-8",
				"{\"access_token\":\"A\",\"token_type\":\"bearer\",\"expires_in\":3600,"
						+ "\"refresh_token\":\"R\",\"scope\":\"read\",\"id_token\":\"jwt\"}"));

		assertThat(response.getAccessToken()).isEqualTo("A");
		assertThat(response.getTokenType()).isEqualTo("bearer");
		assertThat(response.getExpiresIn()).isEqualTo(3600L);
		assertThat(response.getRefreshToken()).isEqualTo("R");
		assertThat(response.getScope()).isEqualTo("read");
		assertThat(response.getAdditionalParameters()).containsEntry("id_token", "jwt");
	}

	@Test
	void testFormEncodedResponse() {
		TokenResponse response = parser.parse(new TokenEndpointResponse(200, "application/x-www-form-urlencoded",
				"access_token=A%2Fb&expires=5183999&refresh_token=R"));

		assertThat(response.getAccessToken()).isEqualTo("A/b");
		assertThat(response.getExpiresIn()).isEqualTo(5183999L);
		assertThat(response.getRefreshToken()).isEqualTo("R");
	}

	@Test
	void testContentTypeIsSniffedWhenMissingOrGeneric() {
		assertThat(parser.parse(new TokenEndpointResponse(200, null, " {\"access_token\":\"A\"}")).getAccessToken())
			.isEqualTo("A");
		assertThat(parser.parse(new TokenEndpointResponse(200, "text/plain", "access_token=B&expires_in=60"))
			.getExpiresIn()).isEqualTo(60L);
	}

	@Test
	void testExpiresInAsString() {
		TokenResponse response = parser
			.parse(new TokenEndpointResponse(200, "application/json", "{\"access_token\":\"A\",\"expires_in\":\"1800\"}"));

		assertThat(response.getExpiresIn()).isEqualTo(1800L);
	}

	@Test
	void testMissingAccessToken() {
		assertThatThrownBy(() -> parser
			.parse(new TokenEndpointResponse(200, "application/json", "{\"refresh_token\":\"R\"}")))
			.isInstanceOf(OAuthProtocolException.class)
			.hasMessageContaining("access_token");
	}

	@Test
	void testUnparsableBody() {
		assertThatThrownBy(() -> parser.parse(new TokenEndpointResponse(200, "application/json", "{not json")))
			.isInstanceOfSatisfying(OAuthProtocolException.class, e -> assertThat(e.getStatusCode()).isEqualTo(200));
		assertThatThrownBy(() -> parser.parse(new TokenEndpointResponse(200, "text/html", "<html>oops</html>")))
			.isInstanceOf(OAuthProtocolException.class);
	}

	@Test
	void testMalformedExpiresIn() {
		assertThatThrownBy(() -> parser.parse(new TokenEndpointResponse(200, "application/json",
				"{\"access_token\":\"A\",\"expires_in\":\"soon\"}")))
			.isInstanceOf(OAuthProtocolException.class)
			.hasMessageContaining("malformed");
	}

	@Test
	void testErrorStatusWithJsonDescription() {
		assertThatThrownBy(() -> parser.parse(new TokenEndpointResponse(400, "application/json",
				"{\"error\":\"invalid_grant\",\"error_description\":\"Code expired\",\"error_uri\":\"https://docs\"}")))
			.isInstanceOfSatisfying(OAuthProtocolException.class, e -> {
				assertThat(e.getStatusCode()).isEqualTo(400);
				assertThat(e.getError()).isEqualTo("invalid_grant");
				assertThat(e.getErrorDescription()).isEqualTo("Code expired");
				assertThat(e.getErrorUri()).isEqualTo("https://docs");
				assertThat(e.getMessage()).contains("invalid_grant").contains("Code expired");
			});
	}

	@Test
	void testErrorStatusWithUnparsableBody() {
		assertThatThrownBy(() -> parser.parse(new TokenEndpointResponse(502, "application/json", "Bad gateway")))
			.isInstanceOfSatisfying(OAuthProtocolException.class, e -> {
				assertThat(e.getStatusCode()).isEqualTo(502);
				assertThat(e.getError()).isNull();
			});
	}

	@Test
	void testSuccessStatusCarryingErrorDocument() {
		assertThatThrownBy(() -> parser.parse(new TokenEndpointResponse(200, "application/x-www-form-urlencoded",
				"error=bad_verification_code&error_description=The+code+is+incorrect")))
			.isInstanceOfSatisfying(OAuthProtocolException.class,
					e -> assertThat(e.getError()).isEqualTo("bad_verification_code"));
	}

	@Test
	void testJsonNullBody() {
		assertThatThrownBy(() -> parser.parse(new TokenEndpointResponse(200, "application/json", "null")))
			.isInstanceOfSatisfying(OAuthProtocolException.class, e -> {
				assertThat(e.getStatusCode()).isEqualTo(200);
				assertThat(e.getMessage()).contains("not a JSON object");
			});
		assertThatThrownBy(() -> parser.parse(new TokenEndpointResponse(400, "application/json", "null")))
			.isInstanceOfSatisfying(OAuthProtocolException.class, e -> {
				assertThat(e.getStatusCode()).isEqualTo(400);
				assertThat(e.getError()).isNull();
			});
	}

	@Test
	void testOutOfRangeExpiresIn() {
		assertThatThrownBy(() -> parser.parse(new TokenEndpointResponse(200, "application/json",
				"{\"access_token\":\"A\",\"expires_in\":9223372036854775807}")))
			.isInstanceOf(OAuthProtocolException.class)
			.hasMessageContaining("expires_in");
		assertThatThrownBy(() -> parser.parse(new TokenEndpointResponse(200, "application/json",
				"{\"access_token\":\"A\",\"expires_in\":-5}")))
			.isInstanceOf(OAuthProtocolException.class)
			.hasMessageContaining("expires_in");
		assertThat(parser.parse(new TokenEndpointResponse(200, "application/json",
				"{\"access_token\":\"A\",\"expires_in\":" + TokenResponseParser.MAX_EXPIRES_IN_SECONDS + "}"))
			.getExpiresIn()).isEqualTo(TokenResponseParser.MAX_EXPIRES_IN_SECONDS);
	}

}
