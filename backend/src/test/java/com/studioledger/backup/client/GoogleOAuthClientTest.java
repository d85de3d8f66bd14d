package com.studioledger.backup.client;

import com.studioledger.backup.exception.StorageProviderException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.ExpectedCount;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

import java.net.SocketTimeoutException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.hamcrest.Matchers.containsString;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.*;
import static org.springframework.test.web.client.response.MockRestResponseCreators.*;

@DisplayName("GoogleOAuthClient")
class GoogleOAuthClientTest {

    private MockRestServiceServer server;
    private GoogleOAuthClient client;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        client = new GoogleOAuthClient(restTemplate);
    }

    @Nested
    @DisplayName("refreshAccessToken")
    class RefreshAccessToken {

        @Test
        @DisplayName("should post refresh grant and return access token")
        void shouldRefresh() {
            server.expect(requestTo(GoogleOAuthClient.TOKEN_ENDPOINT))
                    .andExpect(method(HttpMethod.POST))
                    .andExpect(content().string(containsString("grant_type=refresh_token")))
                    .andExpect(content().string(containsString("refresh_token=rt-1")))
                    .andRespond(withSuccess("{\"access_token\":\"at-1\",\"expires_in\":3599}", MediaType.APPLICATION_JSON));

            GoogleOAuthClient.TokenResponse response = client.refreshAccessToken("id", "secret", "rt-1");

            assertThat(response.getAccessToken()).isEqualTo("at-1");
            assertThat(response.getExpiresIn()).isEqualTo(3599L);
            server.verify();
        }

        @Test
        @DisplayName("should surface Google's error description for a revoked token")
        void shouldReportRevokedToken() {
            server.expect(requestTo(GoogleOAuthClient.TOKEN_ENDPOINT))
                    .andRespond(withStatus(HttpStatus.BAD_REQUEST)
                            .contentType(MediaType.APPLICATION_JSON)
                            .body("{\"error\":\"invalid_grant\",\"error_description\":\"Token has been expired or revoked.\"}"));

            assertThatThrownBy(() -> client.refreshAccessToken("id", "secret", "rt-1"))
                    .isInstanceOf(StorageProviderException.class)
                    .hasMessageContaining("Token has been expired or revoked.");
        }

        @Test
        @DisplayName("should let a server error propagate so it can be retried")
        void shouldPropagateServerError() {
            server.expect(requestTo(GoogleOAuthClient.TOKEN_ENDPOINT))
                    .andRespond(withStatus(HttpStatus.SERVICE_UNAVAILABLE));

            assertThatThrownBy(() -> client.refreshAccessToken("id", "secret", "rt-1"))
                    .isInstanceOf(HttpServerErrorException.class);
        }

        @Test
        @DisplayName("should let a connection failure propagate so it can be retried")
        void shouldPropagateConnectionFailure() {
            server.expect(requestTo(GoogleOAuthClient.TOKEN_ENDPOINT))
                    .andRespond(withException(new SocketTimeoutException("connect timed out")));

            assertThatThrownBy(() -> client.refreshAccessToken("id", "secret", "rt-1"))
                    .isInstanceOf(ResourceAccessException.class);
        }
    }

    @Nested
    @DisplayName("exchangeAuthorizationCode")
    class ExchangeAuthorizationCode {

        @Test
        @DisplayName("should return refresh token from code exchange")
        void shouldExchangeCode() {
            server.expect(requestTo(GoogleOAuthClient.TOKEN_ENDPOINT))
                    .andExpect(content().string(containsString("grant_type=authorization_code")))
                    .andExpect(content().string(containsString("code=auth-code")))
                    .andRespond(withSuccess("{\"access_token\":\"at\",\"refresh_token\":\"rt\",\"expires_in\":3600}",
                            MediaType.APPLICATION_JSON));

            GoogleOAuthClient.TokenResponse response =
                    client.exchangeAuthorizationCode("auth-code", "id", "secret", "http://localhost/callback");

            assertThat(response.getRefreshToken()).isEqualTo("rt");
        }

        @Test
        @DisplayName("should return error fields instead of throwing")
        void shouldReturnError() {
            server.expect(requestTo(GoogleOAuthClient.TOKEN_ENDPOINT))
                    .andRespond(withStatus(HttpStatus.BAD_REQUEST)
                            .contentType(MediaType.APPLICATION_JSON)
                            .body("{\"error\":\"invalid_grant\"}"));

            GoogleOAuthClient.TokenResponse response =
                    client.exchangeAuthorizationCode("used-code", "id", "secret", "http://localhost/callback");

            assertThat(response.getAccessToken()).isNull();
            assertThat(response.describeError()).isEqualTo("invalid_grant");
        }

        @Test
        @DisplayName("should wrap a server error without retrying the single-use code")
        void shouldWrapServerError() {
            server.expect(ExpectedCount.once(), requestTo(GoogleOAuthClient.TOKEN_ENDPOINT))
                    .andRespond(withServerError());

            assertThatThrownBy(() -> client.exchangeAuthorizationCode("auth-code", "id", "secret", "http://localhost/callback"))
                    .isInstanceOf(StorageProviderException.class)
                    .hasMessageContaining("Google token endpoint unreachable");
            server.verify();
        }
    }

    @Nested
    @DisplayName("fetchUserEmail")
    class FetchUserEmail {

        @Test
        @DisplayName("should return email of the token owner")
        void shouldReturnEmail() {
            server.expect(requestTo(GoogleOAuthClient.USERINFO_ENDPOINT))
                    .andExpect(header("Authorization", "Bearer at"))
                    .andRespond(withSuccess("{\"email\":\"owner@studio.test\"}", MediaType.APPLICATION_JSON));

            assertThat(client.fetchUserEmail("at")).isEqualTo("owner@studio.test");
        }

        @Test
        @DisplayName("should return empty string when lookup fails")
        void shouldReturnEmptyOnFailure() {
            server.expect(requestTo(GoogleOAuthClient.USERINFO_ENDPOINT))
                    .andRespond(withServerError());

            assertThat(client.fetchUserEmail("at")).isEmpty();
        }
    }
}
