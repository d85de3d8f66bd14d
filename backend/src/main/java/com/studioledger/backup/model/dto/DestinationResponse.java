package com.studioledger.backup.model.dto;

import com.studioledger.backup.model.entity.BackupDestination;
import com.studioledger.backup.util.CredentialUtils;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Destination as returned to clients. Secret credential fields are always masked.
 */
@Data
@Builder
@AllArgsConstructor
public class DestinationResponse {

    private UUID id;
    private String name;
    private String provider;
    private Map<String, String> credentials;
    private boolean active;
    private Instant createdAt;
    private Instant updatedAt;

    public static DestinationResponse fromEntity(BackupDestination destination) {
        return DestinationResponse.builder()
                .id(destination.getId())
                .name(destination.getName())
                .provider(destination.getProvider())
                .credentials(CredentialUtils.maskCredentials(destination.getProvider(), destination.getCredentials()))
                .active(destination.isActive())
                .createdAt(destination.getCreatedAt())
                .updatedAt(destination.getUpdatedAt())
                .build();
    }
}
