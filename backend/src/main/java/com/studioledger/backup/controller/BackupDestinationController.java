package com.studioledger.backup.controller;

import com.studioledger.backup.model.dto.DestinationRequest;
import com.studioledger.backup.model.dto.DestinationResponse;
import com.studioledger.backup.model.dto.TestConnectionRequest;
import com.studioledger.backup.service.BackupDestinationService;
import com.studioledger.backup.storage.ConnectionTestResult;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.UUID;

@RestController
@RequestMapping("/api/v1/backups/destinations")
@RequiredArgsConstructor
@PreAuthorize("hasRole('ADMIN')")
@Tag(name = "Backup destinations", description = "Storage targets that backups are uploaded to")
@SecurityRequirement(name = "bearerAuth")
public class BackupDestinationController {

    private final BackupDestinationService destinationService;

    @GetMapping
    @Operation(summary = "List destinations with secrets masked")
    public ResponseEntity<List<DestinationResponse>> listDestinations() {
        return ResponseEntity.ok(destinationService.listDestinations());
    }

    @PostMapping
    @Operation(summary = "Create a destination")
    public ResponseEntity<DestinationResponse> createDestination(@Valid @RequestBody DestinationRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(destinationService.createDestination(request));
    }

    @GetMapping("/{destinationId}")
    @Operation(summary = "Get a destination with secrets masked")
    public ResponseEntity<DestinationResponse> getDestination(@PathVariable UUID destinationId) {
        return ResponseEntity.ok(destinationService.getDestination(destinationId));
    }

    @PutMapping("/{destinationId}")
    @Operation(summary = "Update a destination; masked secrets keep their saved value")
    public ResponseEntity<DestinationResponse> updateDestination(
            @PathVariable UUID destinationId,
            @Valid @RequestBody DestinationRequest request) {
        return ResponseEntity.ok(destinationService.updateDestination(destinationId, request));
    }

    @DeleteMapping("/{destinationId}")
    @Operation(summary = "Delete a destination and its upload history")
    public ResponseEntity<Map<String, String>> deleteDestination(@PathVariable UUID destinationId) {
        destinationService.deleteDestination(destinationId);
        return ResponseEntity.ok(Map.of("message", "Destination deleted successfully"));
    }

    @PostMapping("/{destinationId}/toggle")
    @Operation(summary = "Enable or disable a destination")
    public ResponseEntity<DestinationResponse> toggleDestination(@PathVariable UUID destinationId) {
        return ResponseEntity.ok(destinationService.toggleActive(destinationId));
    }

    @PostMapping("/{destinationId}/test")
    @Operation(summary = "Test the saved credentials of a destination")
    public ResponseEntity<ConnectionTestResult> testDestination(@PathVariable UUID destinationId) {
        return ResponseEntity.ok(destinationService.testDestination(destinationId));
    }

    @PostMapping("/test")
    @Operation(summary = "Test credentials before saving them")
    public ResponseEntity<ConnectionTestResult> testUnsaved(@Valid @RequestBody TestConnectionRequest request) {
        return ResponseEntity.ok(destinationService.testUnsaved(request));
    }
}
