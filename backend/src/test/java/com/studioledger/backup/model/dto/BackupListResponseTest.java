package com.studioledger.backup.model.dto;

import com.studioledger.backup.model.entity.Backup;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("BackupListResponse")
class BackupListResponseTest {

    @Test
    @DisplayName("should summarize statuses and count only archives stored remotely")
    void shouldSummarizeHistory() {
        Instant older = Instant.parse("2024-03-01T02:05:00Z");
        Instant newer = Instant.parse("2024-03-02T02:05:00Z");
        List<Backup> history = List.of(
                backup(Backup.STATUS_FAILED, 4096L, null),
                backup(Backup.STATUS_PARTIAL, 2048L, newer),
                backup(Backup.STATUS_COMPLETED, 1024L, newer),
                backup(Backup.STATUS_COMPLETED, 1024L, older),
                backup(Backup.STATUS_RUNNING, null, null));

        BackupListResponse response = BackupListResponse.fromEntities(history);

        assertThat(response.getBackups()).hasSize(5);
        assertThat(response.getStatusCounts())
                .containsEntry("completed", 2L)
                .containsEntry("partial", 1L)
                .containsEntry("failed", 1L)
                .containsEntry("running", 1L);
        assertThat(response.getStoredBytes()).isEqualTo(4096L);
        assertThat(response.getFormattedStoredSize()).isEqualTo("4.00 KB");
        assertThat(response.getLastSuccessfulAt()).isEqualTo(newer);
    }

    @Test
    @DisplayName("should handle an empty history")
    void shouldHandleEmptyHistory() {
        BackupListResponse response = BackupListResponse.fromEntities(List.of());

        assertThat(response.getBackups()).isEmpty();
        assertThat(response.getStatusCounts()).isEmpty();
        assertThat(response.getLastSuccessfulAt()).isNull();
        assertThat(response.getFormattedStoredSize()).isEqualTo("0 B");
    }

    private static Backup backup(String status, Long size, Instant completedAt) {
        return Backup.builder()
                .id(UUID.randomUUID())
                .provider("s3")
                .status(status)
                .triggeredBy(Backup.TRIGGERED_BY_MANUAL)
                .fileSize(size)
                .completedAt(completedAt)
                .build();
    }
}
