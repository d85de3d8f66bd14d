package com.studioledger.backup.model.dto;

import com.studioledger.backup.model.entity.Backup;
import com.studioledger.backup.util.FormatUtils;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Backup history, newest first, with a summary for the settings page header.
 */
@Data
@Builder
@AllArgsConstructor
public class BackupListResponse {

    private List<BackupResponse> backups;
    private Map<String, Long> statusCounts;
    private Instant lastSuccessfulAt;
    private long storedBytes;
    private String formattedStoredSize;

    public static BackupListResponse fromEntities(List<Backup> backups) {
        Map<String, Long> counts = new TreeMap<>();
        backups.forEach(backup -> counts.merge(backup.getStatus(), 1L, Long::sum));

        // Only archives that reached at least one destination occupy remote storage
        long storedBytes = backups.stream()
                .filter(Backup::hasRemoteCopy)
                .map(Backup::getFileSize)
                .filter(Objects::nonNull)
                .mapToLong(Long::longValue)
                .sum();

        Instant lastSuccessful = backups.stream()
                .filter(backup -> Backup.STATUS_COMPLETED.equals(backup.getStatus()))
                .map(Backup::getCompletedAt)
                .filter(Objects::nonNull)
                .max(Instant::compareTo)
                .orElse(null);

        return BackupListResponse.builder()
                .backups(backups.stream().map(BackupResponse::fromEntity).toList())
                .statusCounts(counts)
                .lastSuccessfulAt(lastSuccessful)
                .storedBytes(storedBytes)
                .formattedStoredSize(FormatUtils.formatBytes(storedBytes))
                .build();
    }
}
