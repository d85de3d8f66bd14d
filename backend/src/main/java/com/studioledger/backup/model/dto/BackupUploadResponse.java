package com.studioledger.backup.model.dto;

import com.studioledger.backup.model.entity.BackupUpload;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.UUID;

@Data
@Builder
@AllArgsConstructor
public class BackupUploadResponse {

    private UUID id;
    private UUID destinationId;
    private String destinationName;
    private String provider;
    private String status;
    private String errorMessage;
    private Instant startedAt;
    private Instant completedAt;

    public static BackupUploadResponse fromEntity(BackupUpload upload) {
        return BackupUploadResponse.builder()
                .id(upload.getId())
                .destinationId(upload.getDestination().getId())
                .destinationName(upload.getDestination().getName())
                .provider(upload.getDestination().getProvider())
                .status(upload.getStatus())
                .errorMessage(upload.getErrorMessage())
                .startedAt(upload.getStartedAt())
                .completedAt(upload.getCompletedAt())
                .build();
    }
}
