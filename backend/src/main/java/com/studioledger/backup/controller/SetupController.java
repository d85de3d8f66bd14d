package com.studioledger.backup.controller;

import com.studioledger.backup.model.dto.GoogleClientRequest;
import com.studioledger.backup.model.dto.RestoreRequest;
import com.studioledger.backup.model.dto.RestoreResponse;
import com.studioledger.backup.model.dto.SetupStatusResponse;
import com.studioledger.backup.service.GoogleDriveOAuthService;
import com.studioledger.backup.service.SetupRestoreService;
import com.studioledger.backup.storage.ConnectionTestResult;
import com.studioledger.backup.storage.StorageObject;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * Unauthenticated routes used by the setup wizard of a fresh install. All but the status
 * route answer 403 once setup has completed.
 */
@RestController
@RequestMapping("/api/v1/setup")
@RequiredArgsConstructor
@Tag(name = "Setup", description = "Disaster recovery from a backup during initial setup")
public class SetupController {

    private final SetupRestoreService setupRestoreService;
    private final GoogleDriveOAuthService oauthService;

    @GetMapping
    @Operation(summary = "Whether initial setup has completed")
    public ResponseEntity<SetupStatusResponse> getStatus() {
        return ResponseEntity.ok(setupRestoreService.getStatus());
    }

    @PostMapping("/restore/test")
    @Operation(summary = "Test storage credentials")
    public ResponseEntity<ConnectionTestResult> testConnection(@RequestBody RestoreRequest request) {
        return ResponseEntity.ok(setupRestoreService.testConnection(request.getProvider(), request.getCredentials()));
    }

    @PostMapping("/restore/list")
    @Operation(summary = "List archives available at a provider, newest first")
    public ResponseEntity<List<StorageObject>> listBackups(@RequestBody RestoreRequest request) {
        return ResponseEntity.ok(setupRestoreService.listBackups(request.getProvider(), request.getCredentials()));
    }

    @PostMapping("/restore/execute")
    @Operation(summary = "Restore database and uploads from an archive, then complete setup")
    public ResponseEntity<RestoreResponse> executeRestore(@RequestBody RestoreRequest request) {
        return ResponseEntity.ok(setupRestoreService.executeRestore(request));
    }

    @PostMapping("/gdrive/authorize")
    @Operation(summary = "Get a Google consent URL for the given OAuth client")
    public ResponseEntity<Map<String, String>> authorizeGoogleDrive(@RequestBody GoogleClientRequest request) {
        setupRestoreService.requireSetupIncomplete();
        GoogleDriveOAuthService.AuthorizationStart start =
                oauthService.startSetupAuthorization(request.getClientId(), request.getClientSecret());
        return ResponseEntity.ok()
                .header(HttpHeaders.SET_COOKIE, start.stateCookie().toString())
                .body(Map.of("url", start.url()));
    }
}
