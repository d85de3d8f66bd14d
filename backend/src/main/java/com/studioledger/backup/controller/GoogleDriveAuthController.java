package com.studioledger.backup.controller;

import com.studioledger.backup.service.GoogleDriveOAuthService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/backups/gdrive")
@RequiredArgsConstructor
@Tag(name = "Google Drive", description = "Link a Google account for Drive backups")
public class GoogleDriveAuthController {

    private final GoogleDriveOAuthService oauthService;

    @PostMapping("/authorize")
    @PreAuthorize("hasRole('ADMIN')")
    @Operation(summary = "Get a Google consent URL for the saved OAuth client")
    public ResponseEntity<Map<String, String>> authorize() {
        GoogleDriveOAuthService.AuthorizationStart start = oauthService.startAuthorization();
        return ResponseEntity.ok()
                .header(HttpHeaders.SET_COOKIE, start.stateCookie().toString())
                .body(Map.of("url", start.url()));
    }

    @GetMapping(value = "/callback", produces = MediaType.TEXT_HTML_VALUE)
    @Operation(summary = "OAuth redirect target registered with Google; not for direct use")
    public ResponseEntity<String> callback(
            @RequestParam(required = false) String code,
            @RequestParam(required = false) String state,
            @RequestParam(required = false) String error,
            @CookieValue(name = GoogleDriveOAuthService.STATE_COOKIE, required = false) String stateCookie) {
        String page = oauthService.handleCallback(code, state, error, stateCookie);
        return ResponseEntity.ok()
                .header(HttpHeaders.SET_COOKIE, oauthService.clearStateCookie().toString())
                .contentType(MediaType.TEXT_HTML)
                .body(page);
    }
}
