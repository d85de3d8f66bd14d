package com.studioledger.backup.client;

import com.studioledger.backup.exception.StorageProviderException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.client.ExpectedCount;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.RestTemplate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.*;

@SpringBootTest(properties = {
        "resilience4j.retry.instances.google-token.max-attempts=3",
        "resilience4j.retry.instances.google-token.wait-duration=10ms"
})
@ActiveProfiles("test")
@DisplayName("GoogleOAuthClient retry policy")
class GoogleOAuthClientRetryTest {

    @Autowired
    private GoogleOAuthClient client;

    @Autowired
    @Qualifier("googleRestTemplate")
    private RestTemplate googleRestTemplate;

    private MockRestServiceServer server;

    @BeforeEach
    void setUp() {
        server = MockRestServiceServer.bindTo(googleRestTemplate).build();
    }

    @Test
    @DisplayName("should call the token endpoint three times while it returns 503")
    void shouldRetryServerErrors() {
        server.expect(ExpectedCount.times(3), requestTo(GoogleOAuthClient.TOKEN_ENDPOINT))
                .andExpect(method(HttpMethod.POST))
                .andRespond(withStatus(HttpStatus.SERVICE_UNAVAILABLE));

        assertThatThrownBy(() -> client.refreshAccessToken("id", "secret", "rt-1"))
                .isInstanceOf(HttpServerErrorException.class);
        server.verify();
    }

    @Test
    @DisplayName("should return the token once a retried call succeeds")
    void shouldRecoverAfterServerError() {
        server.expect(ExpectedCount.once(), requestTo(GoogleOAuthClient.TOKEN_ENDPOINT))
                .andRespond(withServerError());
        server.expect(ExpectedCount.once(), requestTo(GoogleOAuthClient.TOKEN_ENDPOINT))
                .andRespond(withSuccess("{\"access_token\":\"at-2\",\"expires_in\":3600}", MediaType.APPLICATION_JSON));

        assertThat(client.refreshAccessToken("id", "secret", "rt-1").getAccessToken()).isEqualTo("at-2");
        server.verify();
    }

    @Test
    @DisplayName("should not retry a rejected refresh token")
    void shouldNotRetryRejectedToken() {
        server.expect(ExpectedCount.once(), requestTo(GoogleOAuthClient.TOKEN_ENDPOINT))
                .andRespond(withStatus(HttpStatus.BAD_REQUEST)
                        .contentType(MediaType.APPLICATION_JSON)
                        .body("{\"error\":\"invalid_grant\"}"));

        assertThatThrownBy(() -> client.refreshAccessToken("id", "secret", "rt-1"))
                .isInstanceOf(StorageProviderException.class)
                .hasMessageContaining("invalid_grant");
        server.verify();
    }
}
