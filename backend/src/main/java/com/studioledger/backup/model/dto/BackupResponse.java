package com.studioledger.backup.model.dto;

import com.fasterxml.jackson.annotation.JsonRawValue;
import com.studioledger.backup.model.entity.Backup;
import com.studioledger.backup.util.FormatUtils;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;

@Data
@Builder
@AllArgsConstructor
public class BackupResponse {

    private UUID id;
    private String provider;
    private String status;
    private String fileName;
    private Long fileSize;
    private String formattedSize;
    @JsonRawValue
    private String manifest;
    private String errorMessage;
    private String triggeredBy;
    private UUID userId;
    private Instant startedAt;
    private Instant completedAt;
    private Instant createdAt;
    private List<BackupUploadResponse> uploads;

    public static BackupResponse fromEntity(Backup backup) {
        List<BackupUploadResponse> uploads = backup.getUploads().stream()
                .sorted(Comparator.comparing(u -> u.getDestination().getName(), String.CASE_INSENSITIVE_ORDER))
                .map(BackupUploadResponse::fromEntity)
                .toList();

        return BackupResponse.builder()
                .id(backup.getId())
                .provider(backup.getProvider())
                .status(backup.getStatus())
                .fileName(backup.getFileName())
                .fileSize(backup.getFileSize())
                .formattedSize(FormatUtils.formatBytes(backup.getFileSize() != null ? backup.getFileSize() : 0L))
                .manifest(backup.getManifest())
                .errorMessage(backup.getErrorMessage())
                .triggeredBy(backup.getTriggeredBy())
                .userId(backup.getUserId())
                .startedAt(backup.getStartedAt())
                .completedAt(backup.getCompletedAt())
                .createdAt(backup.getCreatedAt())
                .uploads(uploads)
                .build();
    }
}
