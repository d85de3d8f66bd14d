package com.studioledger.backup.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.studioledger.backup.archive.ArchiveResult;
import com.studioledger.backup.event.BackupRequestedEvent;
import com.studioledger.backup.exception.ApiException;
import com.studioledger.backup.model.dto.BackupListResponse;
import com.studioledger.backup.model.dto.BackupResponse;
import com.studioledger.backup.model.entity.Backup;
import com.studioledger.backup.model.entity.BackupDestination;
import com.studioledger.backup.model.entity.BackupUpload;
import com.studioledger.backup.repository.BackupDestinationRepository;
import com.studioledger.backup.repository.BackupRepository;
import com.studioledger.backup.repository.BackupUploadRepository;
import com.studioledger.backup.storage.BackupStorageProvider;
import com.studioledger.backup.storage.StorageProviderFactory;
import com.studioledger.backup.util.FileTreeUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.event.EventListener;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.stream.Collectors;

/**
 * Orchestrates backup runs: records a run with one upload per active destination,
 * builds the archive once, fans it out to every destination and derives the final status.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BackupService {

    /**
     * Remote objects live under this prefix; Drive flattens it to the file name.
     */
    public static final String REMOTE_KEY_PREFIX = "backups/";

    static final String INTERRUPTED_MESSAGE = "Interrupted by application restart";

    private final BackupRepository backupRepository;
    private final BackupUploadRepository backupUploadRepository;
    private final BackupDestinationRepository destinationRepository;
    private final BackupArchiveService backupArchiveService;
    private final StorageProviderFactory storageProviderFactory;
    private final ApplicationEventPublisher eventPublisher;
    private final ObjectMapper objectMapper;

    @Qualifier("backupUploadExecutor")
    private final Executor backupUploadExecutor;

    @Value("${backup.temp-dir:}")
    private String tempDir;

    // Runs recorded before this bean existed belong to a previous process
    private Instant serviceStartedAt = Instant.now();

    /**
     * Record a new run and request its execution once this transaction commits.
     *
     * @throws IllegalStateException when no destination is active; nothing is persisted
     */
    @Transactional
    public Backup triggerBackup(String triggeredBy, UUID userId) {
        List<BackupDestination> destinations = destinationRepository.findByActiveTrueOrderByCreatedAtAsc();
        if (destinations.isEmpty()) {
            throw new IllegalStateException("No active backup destinations configured");
        }

        String providerLabel = destinations.size() == 1
                ? destinations.get(0).getProvider()
                : Backup.PROVIDER_MULTI;

        Backup backup = Backup.builder()
                .provider(providerLabel)
                .status(Backup.STATUS_PENDING)
                .triggeredBy(triggeredBy)
                .userId(userId)
                .build();
        backup = backupRepository.save(backup);

        for (BackupDestination destination : destinations) {
            BackupUpload upload = BackupUpload.builder()
                    .backup(backup)
                    .destination(destination)
                    .status(BackupUpload.STATUS_PENDING)
                    .build();
            backup.getUploads().add(backupUploadRepository.save(upload));
        }

        eventPublisher.publishEvent(new BackupRequestedEvent(this, backup.getId()));

        log.info("Backup {} requested ({}, {} destination(s))", backup.getId(), triggeredBy, destinations.size());
        return backup;
    }

    /**
     * Entry point for the async listener. Any failure escaping the run marks it failed.
     */
    public void executeBackupAsync(UUID backupId) {
        try {
            executeBackup(backupId);
        } catch (Exception e) {
            log.error("Failed to execute backup {}: {}", backupId, e.getMessage(), e);
            markBackupFailed(backupId, e.getMessage());
        }
    }

    /**
     * Run a pending backup to completion. Status changes are saved as they happen so
     * progress is visible while uploads are still running.
     */
    public void executeBackup(UUID backupId) {
        Backup backup = backupRepository.findById(backupId)
                .orElseThrow(() -> new IllegalArgumentException("Backup not found: " + backupId));

        if (!Backup.STATUS_PENDING.equals(backup.getStatus())) {
            log.warn("Backup {} is {} and will not be run again", backupId, backup.getStatus());
            return;
        }

        backup.transitionTo(Backup.STATUS_RUNNING);
        backup.setStartedAt(Instant.now());
        backup = backupRepository.save(backup);
        log.info("Backup {} running", backupId);

        List<BackupUpload> uploads = backupUploadRepository.findByBackupId(backupId);
        Path workDir = null;
        try {
            workDir = createWorkDir(backupId);

            ArchiveResult archive;
            try {
                archive = backupArchiveService.createArchive(workDir);
            } catch (Exception e) {
                log.error("Archive creation failed for backup {}: {}", backupId, e.getMessage(), e);
                String message = "Archive creation failed: " + e.getMessage();
                failPendingUploads(uploads, message);
                finalizeBackup(backup, uploads, message);
                return;
            }

            String remoteKey = REMOTE_KEY_PREFIX + archive.getFileName();
            backup.setFileName(remoteKey);
            backup.setFileSize(archive.getSize());
            backup.setManifest(toJson(archive));
            backup = backupRepository.save(backup);

            Path archivePath = archive.getArchivePath();
            CompletableFuture<?>[] transfers = uploads.stream()
                    .map(upload -> CompletableFuture.runAsync(
                            () -> uploadToDestination(upload, archivePath, remoteKey), backupUploadExecutor))
                    .toArray(CompletableFuture[]::new);
            CompletableFuture.allOf(transfers).join();

            finalizeBackup(backup, uploads, null);
        } finally {
            FileTreeUtils.deleteQuietly(workDir);
        }
    }

    /**
     * Push the archive to one destination. Never throws: failures are recorded on the upload row.
     */
    void uploadToDestination(BackupUpload upload, Path archivePath, String remoteKey) {
        BackupDestination destination = upload.getDestination();
        try {
            upload.setStatus(BackupUpload.STATUS_UPLOADING);
            upload.setStartedAt(Instant.now());
            backupUploadRepository.save(upload);

            try (BackupStorageProvider provider = storageProviderFactory.create(destination)) {
                provider.upload(archivePath, remoteKey);
            }

            upload.setStatus(BackupUpload.STATUS_COMPLETED);
            upload.setErrorMessage(null);
            log.info("Uploaded {} to destination '{}'", remoteKey, destination.getName());
        } catch (Exception e) {
            log.error("Upload of {} to destination '{}' failed: {}", remoteKey, destination.getName(), e.getMessage());
            upload.setStatus(BackupUpload.STATUS_FAILED);
            upload.setErrorMessage(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
        upload.setCompletedAt(Instant.now());
        try {
            backupUploadRepository.save(upload);
        } catch (Exception e) {
            log.error("Failed to record upload result for destination '{}': {}", destination.getName(), e.getMessage());
        }
    }

    /**
     * Derive the terminal status of a run from its uploads: completed when every upload
     * completed, failed when every upload failed (or there are none), partial otherwise.
     */
    public static String aggregateStatus(Collection<BackupUpload> uploads) {
        if (uploads == null || uploads.isEmpty()) {
            return Backup.STATUS_FAILED;
        }
        if (uploads.stream().allMatch(BackupUpload::isCompleted)) {
            return Backup.STATUS_COMPLETED;
        }
        if (uploads.stream().allMatch(BackupUpload::isFailed)) {
            return Backup.STATUS_FAILED;
        }
        return Backup.STATUS_PARTIAL;
    }

    private void finalizeBackup(Backup backup, List<BackupUpload> uploads, String errorMessage) {
        String status = aggregateStatus(uploads);
        backup.transitionTo(status);
        backup.setCompletedAt(Instant.now());
        backup.setErrorMessage(errorMessage != null ? errorMessage : summarizeFailures(uploads));
        backupRepository.save(backup);
        log.info("Backup {} finished with status {}", backup.getId(), status);
    }

    private void failPendingUploads(List<BackupUpload> uploads, String message) {
        Instant now = Instant.now();
        for (BackupUpload upload : uploads) {
            if (!upload.isCompleted() && !upload.isFailed()) {
                upload.setStatus(BackupUpload.STATUS_FAILED);
                upload.setErrorMessage(message);
                upload.setCompletedAt(now);
            }
        }
        backupUploadRepository.saveAll(uploads);
    }

    /**
     * Mark a run failed after an unexpected error. Runs that already finished are left alone.
     */
    public void markBackupFailed(UUID backupId, String errorMessage) {
        backupRepository.findById(backupId).ifPresent(backup -> {
            if (backup.isTerminal()) {
                return;
            }
            String message = errorMessage != null ? errorMessage : "Backup failed";
            failPendingUploads(backupUploadRepository.findByBackupId(backupId), message);
            backup.transitionTo(Backup.STATUS_FAILED);
            backup.setCompletedAt(Instant.now());
            backup.setErrorMessage(message);
            backupRepository.save(backup);
        });
    }

    /**
     * Fail runs left pending or running by a previous process. Their worker is gone, so
     * they would otherwise never reach a terminal state and could never be deleted.
     */
    @EventListener(ApplicationReadyEvent.class)
    @Order(Ordered.HIGHEST_PRECEDENCE)
    public void failInterruptedBackups() {
        List<Backup> candidates = new ArrayList<>(backupRepository.findByStatusOrderByCreatedAtDesc(Backup.STATUS_RUNNING));
        candidates.addAll(backupRepository.findByStatusOrderByCreatedAtDesc(Backup.STATUS_PENDING));

        int failed = 0;
        for (Backup backup : candidates) {
            if (backup.getCreatedAt() != null && !backup.getCreatedAt().isBefore(serviceStartedAt)) {
                continue;
            }
            log.warn("Backup {} was {} when the application stopped, marking it failed", backup.getId(), backup.getStatus());
            markBackupFailed(backup.getId(), INTERRUPTED_MESSAGE);
            failed++;
        }
        if (failed > 0) {
            log.info("Marked {} interrupted backup(s) failed", failed);
        }
    }

    /**
     * Delete a finished run. The archive is removed from every destination it reached,
     * best effort, before the row and its uploads are deleted.
     */
    @Transactional
    public void deleteBackup(UUID backupId) {
        Backup backup = backupRepository.findById(backupId)
                .orElseThrow(() -> new ApiException("Backup not found", HttpStatus.NOT_FOUND));

        if (!backup.isTerminal()) {
            throw new IllegalStateException("Backup is still in progress");
        }

        if (backup.getFileName() != null) {
            for (BackupUpload upload : backupUploadRepository.findByBackupIdAndStatus(backupId, BackupUpload.STATUS_COMPLETED)) {
                deleteRemoteArchive(upload.getDestination(), backup.getFileName());
            }
        }

        backupRepository.delete(backup);
        log.info("Backup {} deleted", backupId);
    }

    @Transactional(readOnly = true)
    public BackupListResponse listHistory() {
        return BackupListResponse.fromEntities(backupRepository.findTop50ByOrderByCreatedAtDesc());
    }

    @Transactional(readOnly = true)
    public BackupResponse getBackup(UUID backupId) {
        return backupRepository.findById(backupId)
                .map(BackupResponse::fromEntity)
                .orElseThrow(() -> new ApiException("Backup not found", HttpStatus.NOT_FOUND));
    }

    private void deleteRemoteArchive(BackupDestination destination, String remoteKey) {
        try (BackupStorageProvider provider = storageProviderFactory.create(destination)) {
            provider.delete(remoteKey);
            log.debug("Deleted {} from destination '{}'", remoteKey, destination.getName());
        } catch (Exception e) {
            log.warn("Failed to delete {} from destination '{}': {}", remoteKey, destination.getName(), e.getMessage());
        }
    }

    private Path createWorkDir(UUID backupId) {
        try {
            String prefix = "backup-" + backupId + "-";
            if (tempDir == null || tempDir.isBlank()) {
                return Files.createTempDirectory(prefix);
            }
            Path parent = Paths.get(tempDir);
            Files.createDirectories(parent);
            return Files.createTempDirectory(parent, prefix);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot create temporary directory for backup " + backupId, e);
        }
    }

    private String toJson(ArchiveResult archive) {
        try {
            return objectMapper.writeValueAsString(archive.getManifest());
        } catch (JsonProcessingException e) {
            log.warn("Failed to serialize manifest for {}: {}", archive.getFileName(), e.getMessage());
            return null;
        }
    }

    private static String summarizeFailures(List<BackupUpload> uploads) {
        String summary = uploads.stream()
                .filter(BackupUpload::isFailed)
                .map(u -> u.getDestination().getName() + ": " + u.getErrorMessage())
                .collect(Collectors.joining("; "));
        return summary.isEmpty() ? null : summary;
    }
}
