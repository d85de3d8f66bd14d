package com.studioledger.backup.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.studioledger.backup.client.GoogleOAuthClient;
import com.studioledger.backup.exception.ApiException;
import com.studioledger.backup.model.dto.BackupSettings;
import com.studioledger.backup.security.JwtTokenProvider;
import com.studioledger.backup.util.SecureRandomUtils;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseCookie;
import org.springframework.stereotype.Service;
import org.springframework.web.util.HtmlUtils;
import org.springframework.web.util.UriComponentsBuilder;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Links a Google account for Drive backups through the OAuth authorization-code flow.
 * The state is kept in a signed, short-lived, HttpOnly cookie. The refresh token obtained
 * at the end is handed back to the browser only and never stored here.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GoogleDriveOAuthService {

    public static final String STATE_COOKIE = "gdrive_state";
    public static final String CALLBACK_PATH = "/api/v1/backups/gdrive/callback";
    public static final String RESULT_STORAGE_KEY = "gdrive-auth-result";

    static final String SCOPE = "https://www.googleapis.com/auth/drive.file email";
    static final Duration STATE_TTL = Duration.ofMinutes(10);
    static final String VERIFICATION_FAILED = "Authorization could not be verified. Please try again.";

    private static final String STATE_SUBJECT = "gdrive-oauth-state";

    private final GoogleOAuthClient googleOAuthClient;
    private final AppSettingsService appSettingsService;
    private final JwtTokenProvider jwtTokenProvider;
    private final SecureRandomUtils secureRandomUtils;
    private final ObjectMapper objectMapper;

    @Value("${oauth.google.redirect-base-url:http://localhost:8080}")
    private String redirectBaseUrl;

    @Value("${oauth.google.cookie-secure:false}")
    private boolean cookieSecure;

    /**
     * Start linking from the app, using the Google client saved in settings.
     */
    public AuthorizationStart startAuthorization() {
        BackupSettings settings = appSettingsService.loadBackupSettings();
        if (!settings.hasGoogleClient()) {
            throw new ApiException("Google OAuth client is not configured", HttpStatus.BAD_REQUEST);
        }
        return begin(settings.getGoogleClientId().trim(), Map.of());
    }

    /**
     * Start linking during setup, before any settings exist. The client credentials travel
     * in the signed state cookie so the callback can use them.
     */
    public AuthorizationStart startSetupAuthorization(String clientId, String clientSecret) {
        if (clientId == null || clientId.isBlank() || clientSecret == null || clientSecret.isBlank()) {
            throw new IllegalArgumentException("Client ID and Client Secret are required");
        }
        return begin(clientId.trim(), Map.of("clientId", clientId.trim(), "clientSecret", clientSecret.trim()));
    }

    /**
     * Complete the flow and render the page shown in the consent popup. The state cookie must
     * be cleared by the caller whatever the outcome; see {@link #clearStateCookie()}.
     */
    public String handleCallback(String code, String state, String error, String stateCookie) {
        if (error != null && !error.isBlank()) {
            log.info("Google authorization was denied: {}", error);
            return errorPage("Google authorization was denied.");
        }
        if (code == null || code.isBlank() || state == null || state.isBlank()) {
            return errorPage("Missing authorization code.");
        }
        if (stateCookie == null || stateCookie.isBlank()) {
            log.warn("OAuth callback without state cookie");
            return errorPage(VERIFICATION_FAILED);
        }

        Claims claims;
        try {
            claims = jwtTokenProvider.getAllClaims(stateCookie);
        } catch (JwtException | IllegalArgumentException e) {
            log.warn("OAuth state cookie rejected: {}", e.getMessage());
            return errorPage(VERIFICATION_FAILED);
        }

        String expectedState = claims.get("state", String.class);
        if (!STATE_SUBJECT.equals(claims.getSubject()) || expectedState == null || !constantTimeEquals(expectedState, state)) {
            log.warn("OAuth state mismatch");
            return errorPage(VERIFICATION_FAILED);
        }

        String clientId = claims.get("clientId", String.class);
        String clientSecret = claims.get("clientSecret", String.class);
        if (clientId == null || clientSecret == null) {
            BackupSettings settings = appSettingsService.loadBackupSettings();
            if (!settings.hasGoogleClient()) {
                return errorPage("Google OAuth client is not configured.");
            }
            clientId = settings.getGoogleClientId().trim();
            clientSecret = settings.getGoogleClientSecret().trim();
        }

        try {
            GoogleOAuthClient.TokenResponse tokens =
                    googleOAuthClient.exchangeAuthorizationCode(code, clientId, clientSecret, callbackUrl());
            if (tokens.getRefreshToken() == null || tokens.getRefreshToken().isBlank()) {
                String message = tokens.getError() != null ? tokens.describeError() : "Failed to get refresh token";
                log.warn("Google token exchange returned no refresh token: {}", message);
                return errorPage(message);
            }

            String email = tokens.getAccessToken() != null ? googleOAuthClient.fetchUserEmail(tokens.getAccessToken()) : "";
            log.info("Google Drive authorization completed for {}", email.isEmpty() ? "unknown account" : email);
            return successPage(tokens.getRefreshToken(), email);
        } catch (Exception e) {
            log.error("Google Drive OAuth callback failed: {}", e.getMessage(), e);
            return errorPage("An unexpected error occurred.");
        }
    }

    public ResponseCookie clearStateCookie() {
        return stateCookie("", Duration.ZERO);
    }

    String callbackUrl() {
        String base = redirectBaseUrl.endsWith("/")
                ? redirectBaseUrl.substring(0, redirectBaseUrl.length() - 1)
                : redirectBaseUrl;
        return base + CALLBACK_PATH;
    }

    private AuthorizationStart begin(String clientId, Map<String, String> extraClaims) {
        String state = secureRandomUtils.generateHexToken(32);

        Map<String, Object> claims = new LinkedHashMap<>(extraClaims);
        claims.put("state", state);
        String cookieValue = jwtTokenProvider.generateShortLivedToken(STATE_SUBJECT, claims, STATE_TTL);

        String url = UriComponentsBuilder.fromHttpUrl(GoogleOAuthClient.AUTHORIZATION_ENDPOINT)
                .queryParam("response_type", "code")
                .queryParam("client_id", clientId)
                .queryParam("redirect_uri", callbackUrl())
                .queryParam("scope", SCOPE)
                .queryParam("access_type", "offline")
                .queryParam("prompt", "consent")
                .queryParam("state", state)
                .encode()
                .build()
                .toUriString();

        return new AuthorizationStart(url, stateCookie(cookieValue, STATE_TTL));
    }

    private ResponseCookie stateCookie(String value, Duration maxAge) {
        return ResponseCookie.from(STATE_COOKIE, value)
                .httpOnly(true)
                .secure(cookieSecure)
                .sameSite("Lax")
                .path("/")
                .maxAge(maxAge)
                .build();
    }

    private static boolean constantTimeEquals(String a, String b) {
        return MessageDigest.isEqual(a.getBytes(StandardCharsets.UTF_8), b.getBytes(StandardCharsets.UTF_8));
    }

    String successPage(String refreshToken, String email) {
        Map<String, String> result = new LinkedHashMap<>();
        result.put("type", "gdrive-linked");
        result.put("refreshToken", refreshToken);
        result.put("email", email);
        String shown = email.isEmpty() ? "" : " as " + HtmlUtils.htmlEscape(email);
        return PAGE_TEMPLATE
                .replace("{{title}}", "Google Drive Linked")
                .replace("{{color}}", "#059669")
                .replace("{{message}}", "Linked" + shown + ". You can close this window.")
                .replace("{{result}}", scriptJson(result))
                .replace("{{closeDelay}}", "1500");
    }

    String errorPage(String message) {
        Map<String, String> result = new LinkedHashMap<>();
        result.put("type", "gdrive-error");
        result.put("message", message);
        return PAGE_TEMPLATE
                .replace("{{title}}", "Link Failed")
                .replace("{{color}}", "#dc2626")
                .replace("{{message}}", HtmlUtils.htmlEscape(message))
                .replace("{{result}}", scriptJson(result))
                .replace("{{closeDelay}}", "-1");
    }

    /**
     * JSON safe to embed inside a script element.
     */
    private String scriptJson(Map<String, String> value) {
        try {
            return objectMapper.writeValueAsString(value)
                    .replace("<", "\\u003c")
                    .replace(">", "\\u003e")
                    .replace("&", "\\u0026");
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to render OAuth result", e);
        }
    }

    private static final String PAGE_TEMPLATE = """
            <!DOCTYPE html>
            <html><head><meta charset="utf-8"><title>{{title}}</title>
            <style>
              body { font-family: system-ui, sans-serif; display: flex; align-items: center; justify-content: center; min-height: 100vh; margin: 0; background: #f9fafb; }
              .card { background: white; border-radius: 12px; padding: 32px; box-shadow: 0 1px 3px rgba(0,0,0,0.1); max-width: 400px; text-align: center; }
              h2 { margin: 0 0 8px; font-size: 18px; color: {{color}}; }
              p { color: #6b7280; margin: 0 0 16px; }
              button { background: #374151; color: white; border: none; border-radius: 8px; padding: 10px 20px; cursor: pointer; }
            </style></head>
            <body>
            <div class="card">
              <h2>{{title}}</h2>
              <p>{{message}}</p>
              <button onclick="window.close()">Close</button>
            </div>
            <script>
              try { localStorage.setItem('gdrive-auth-result', JSON.stringify({{result}})); } catch (e) {}
              if ({{closeDelay}} >= 0) { setTimeout(function () { window.close(); }, {{closeDelay}}); }
            </script>
            </body></html>
            """;

    /**
     * Consent URL to open and the state cookie to set on the response.
     */
    public record AuthorizationStart(String url, ResponseCookie stateCookie) {
    }
}
