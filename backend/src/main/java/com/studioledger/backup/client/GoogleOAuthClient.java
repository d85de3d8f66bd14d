package com.studioledger.backup.client;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.studioledger.backup.exception.StorageProviderException;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.*;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/**
 * Client for Google's OAuth 2.0 token and userinfo endpoints.
 */
@Slf4j
@Component
public class GoogleOAuthClient {

    public static final String AUTHORIZATION_ENDPOINT = "https://accounts.google.com/o/oauth2/v2/auth";
    public static final String TOKEN_ENDPOINT = "https://oauth2.googleapis.com/token";
    public static final String USERINFO_ENDPOINT = "https://www.googleapis.com/oauth2/v2/userinfo";

    private final RestTemplate restTemplate;

    public GoogleOAuthClient(@Qualifier("googleRestTemplate") RestTemplate restTemplate) {
        this.restTemplate = restTemplate;
    }

    /**
     * Exchange a refresh token for a short-lived access token. Server errors and
     * connection failures propagate unchanged so the retry policy can repeat the call.
     *
     * @throws StorageProviderException if Google rejects the refresh token
     * @throws RestClientException if the token endpoint fails or cannot be reached
     */
    @Retry(name = "google-token")
    public TokenResponse refreshAccessToken(String clientId, String clientSecret, String refreshToken) {
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("client_id", clientId);
        form.add("client_secret", clientSecret);
        form.add("refresh_token", refreshToken);
        form.add("grant_type", "refresh_token");

        TokenResponse response = postTokenRequest(form);
        if (response.getAccessToken() == null) {
            throw new StorageProviderException("Failed to refresh Google access token: " + response.describeError());
        }
        log.debug("Refreshed Google access token, expires in {}s", response.getExpiresIn());
        return response;
    }

    /**
     * Exchange an authorization code for tokens. Authorization codes are single-use,
     * so this call is never retried. Errors are returned in the response body fields.
     */
    public TokenResponse exchangeAuthorizationCode(String code, String clientId, String clientSecret,
                                                   String redirectUri) {
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("code", code);
        form.add("client_id", clientId);
        form.add("client_secret", clientSecret);
        form.add("redirect_uri", redirectUri);
        form.add("grant_type", "authorization_code");

        try {
            return postTokenRequest(form);
        } catch (RestClientException e) {
            throw new StorageProviderException("Google token endpoint unreachable: " + e.getMessage(), e);
        }
    }

    /**
     * Look up the email of the account an access token belongs to. Returns an empty
     * string when it cannot be determined; the email is only used for display.
     */
    public String fetchUserEmail(String accessToken) {
        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(accessToken);
        try {
            ResponseEntity<UserInfo> response = restTemplate.exchange(
                    USERINFO_ENDPOINT, HttpMethod.GET, new HttpEntity<>(headers), UserInfo.class);
            UserInfo body = response.getBody();
            return body != null && body.getEmail() != null ? body.getEmail() : "";
        } catch (RestClientException e) {
            log.warn("Failed to fetch Google account email: {}", e.getMessage());
            return "";
        }
    }

    // 4xx responses carry Google's error fields; anything else is left to the caller
    private TokenResponse postTokenRequest(MultiValueMap<String, String> form) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_FORM_URLENCODED);
        try {
            ResponseEntity<TokenResponse> response = restTemplate.exchange(
                    TOKEN_ENDPOINT, HttpMethod.POST, new HttpEntity<>(form, headers), TokenResponse.class);
            return response.getBody() != null ? response.getBody() : TokenResponse.error("empty_response");
        } catch (HttpClientErrorException e) {
            TokenResponse error = e.getResponseBodyAs(TokenResponse.class);
            return error != null ? error : TokenResponse.error(e.getStatusCode().toString());
        }
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class TokenResponse {
        @JsonProperty("access_token")
        private String accessToken;
        @JsonProperty("expires_in")
        private Long expiresIn;
        @JsonProperty("refresh_token")
        private String refreshToken;
        private String scope;
        private String error;
        @JsonProperty("error_description")
        private String errorDescription;

        static TokenResponse error(String error) {
            TokenResponse response = new TokenResponse();
            response.setError(error);
            return response;
        }

        public String describeError() {
            if (errorDescription != null && !errorDescription.isBlank()) {
                return errorDescription;
            }
            return error != null ? error : "no access token returned";
        }
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class UserInfo {
        private String email;
    }
}
