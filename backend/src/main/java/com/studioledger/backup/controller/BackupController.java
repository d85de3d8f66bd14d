package com.studioledger.backup.controller;

import com.studioledger.backup.model.dto.BackupListResponse;
import com.studioledger.backup.model.dto.BackupResponse;
import com.studioledger.backup.model.dto.BackupSettingsRequest;
import com.studioledger.backup.model.dto.BackupSettingsResponse;
import com.studioledger.backup.security.AuthenticatedUser;
import com.studioledger.backup.service.BackupScheduler;
import com.studioledger.backup.service.BackupService;
import com.studioledger.backup.service.BackupSettingsService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.Map;
import java.util.UUID;

@RestController
@RequestMapping("/api/v1/backups")
@RequiredArgsConstructor
@PreAuthorize("hasRole('ADMIN')")
@Tag(name = "Backups", description = "Backup runs, history and schedule")
@SecurityRequirement(name = "bearerAuth")
public class BackupController {

    private final BackupService backupService;
    private final BackupScheduler backupScheduler;
    private final BackupSettingsService backupSettingsService;

    @PostMapping
    @Operation(summary = "Start a manual backup to every active destination")
    public ResponseEntity<Map<String, UUID>> triggerBackup(@AuthenticationPrincipal AuthenticatedUser user) {
        UUID id = backupScheduler.triggerManualBackup(user != null ? user.id() : null);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(Map.of("id", id));
    }

    @GetMapping
    @Operation(summary = "List recent backups, newest first, with per-destination uploads")
    public ResponseEntity<BackupListResponse> listHistory() {
        return ResponseEntity.ok(backupService.listHistory());
    }

    @GetMapping("/{backupId}")
    @Operation(summary = "Get backup details")
    public ResponseEntity<BackupResponse> getBackup(@PathVariable UUID backupId) {
        return ResponseEntity.ok(backupService.getBackup(backupId));
    }

    @DeleteMapping("/{backupId}")
    @Operation(summary = "Delete a backup and its archive at every destination")
    public ResponseEntity<Map<String, String>> deleteBackup(@PathVariable UUID backupId) {
        backupService.deleteBackup(backupId);
        return ResponseEntity.ok(Map.of("message", "Backup deleted successfully"));
    }

    @GetMapping("/settings")
    @Operation(summary = "Get schedule, retention and Google OAuth client settings")
    public ResponseEntity<BackupSettingsResponse> getSettings() {
        return ResponseEntity.ok(backupSettingsService.getSettings());
    }

    @PutMapping("/settings")
    @Operation(summary = "Update backup settings")
    public ResponseEntity<BackupSettingsResponse> updateSettings(
            @Valid @RequestBody BackupSettingsRequest request,
            @AuthenticationPrincipal AuthenticatedUser user) {
        return ResponseEntity.ok(backupSettingsService.updateSettings(request, user != null ? user.id() : null));
    }
}
