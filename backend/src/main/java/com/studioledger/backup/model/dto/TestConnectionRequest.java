package com.studioledger.backup.model.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;
import java.util.UUID;

/**
 * Credentials to try without saving them. When they contain masked values, the saved
 * destination named by {@code destinationId} is tested instead.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TestConnectionRequest {

    @NotBlank(message = "Provider is required")
    private String provider;

    private Map<String, String> credentials;

    private UUID destinationId;
}
