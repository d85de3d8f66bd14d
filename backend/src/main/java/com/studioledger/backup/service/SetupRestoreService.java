package com.studioledger.backup.service;

import com.studioledger.backup.archive.ArchiveCodec;
import com.studioledger.backup.archive.BackupManifest;
import com.studioledger.backup.exception.ApiException;
import com.studioledger.backup.model.dto.RestoreRequest;
import com.studioledger.backup.model.dto.RestoreResponse;
import com.studioledger.backup.model.dto.SetupStatusResponse;
import com.studioledger.backup.storage.BackupStorageProvider;
import com.studioledger.backup.storage.ConnectionTestResult;
import com.studioledger.backup.storage.StorageObject;
import com.studioledger.backup.storage.StorageProviderFactory;
import com.studioledger.backup.util.FileTreeUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Disaster recovery for a fresh install: restores database and uploads from an archive
 * held by a storage provider. Every operation is refused once setup has completed.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SetupRestoreService {

    public static final String SETUP_COMPLETED_MESSAGE = "Setup already completed";

    static final String DOWNLOADED_ARCHIVE = "restore.tar.gz";
    static final String EXTRACT_DIR = "extracted";

    private final AppSettingsService appSettingsService;
    private final StorageProviderFactory storageProviderFactory;
    private final ArchiveCodec archiveCodec;
    private final PostgresCommandService postgresCommandService;
    private final SchemaSynchronizer schemaSynchronizer;

    private final AtomicBoolean restoreInProgress = new AtomicBoolean(false);

    @Value("${backup.uploads-dir:./uploads}")
    private String uploadsDir;

    @Value("${backup.temp-dir:}")
    private String tempDir;

    public SetupStatusResponse getStatus() {
        return new SetupStatusResponse(appSettingsService.isSetupComplete());
    }

    /**
     * @throws ApiException 403 once setup has completed
     */
    public void requireSetupIncomplete() {
        if (appSettingsService.isSetupComplete()) {
            throw new ApiException(SETUP_COMPLETED_MESSAGE, HttpStatus.FORBIDDEN);
        }
    }

    public ConnectionTestResult testConnection(String provider, Map<String, String> credentials) {
        requireSetupIncomplete();
        try (BackupStorageProvider storage = storageProviderFactory.create(provider, credentials)) {
            return storage.testConnection();
        } catch (Exception e) {
            return ConnectionTestResult.failed(e.getMessage() != null ? e.getMessage() : "Connection test failed");
        }
    }

    /**
     * List the archives available at a provider, newest first.
     */
    public List<StorageObject> listBackups(String provider, Map<String, String> credentials) {
        requireSetupIncomplete();
        try (BackupStorageProvider storage = storageProviderFactory.create(provider, credentials)) {
            return storage.list().stream()
                    .sorted(StorageObject.NEWEST_FIRST)
                    .toList();
        }
    }

    /**
     * Restore the selected archive and mark setup complete. Only one restore runs at a time;
     * the temporary directory is removed on every exit path.
     *
     * @throws ApiException 403 once setup has completed, 409 while another restore runs
     */
    public RestoreResponse executeRestore(RestoreRequest request) {
        requireSetupIncomplete();
        if (request.getBackupKey() == null || request.getBackupKey().isBlank()) {
            throw new IllegalArgumentException("Backup key is required");
        }
        if (!restoreInProgress.compareAndSet(false, true)) {
            throw new ApiException("A restore is already in progress", HttpStatus.CONFLICT);
        }
        try {
            // A restore that held the flag may have completed setup since the first check
            requireSetupIncomplete();
            return restore(request);
        } finally {
            restoreInProgress.set(false);
        }
    }

    private RestoreResponse restore(RestoreRequest request) {
        log.info("Restoring {} from {}", request.getBackupKey(), request.getProvider());
        Path workDir = createWorkDir();
        try (BackupStorageProvider storage = storageProviderFactory.create(request.getProvider(), request.getCredentials())) {
            Path archive = workDir.resolve(DOWNLOADED_ARCHIVE);
            storage.download(request.getBackupKey(), archive);
            log.info("Downloaded archive {}", request.getBackupKey());

            Path extracted = workDir.resolve(EXTRACT_DIR);
            BackupManifest manifest = archiveCodec.extract(archive, extracted);
            log.info("Extracted archive created {} by version {}", manifest.getCreatedAt(), manifest.getAppVersion());

            Path dump = extracted.resolve(ArchiveCodec.DATABASE_FILE);
            boolean databaseRestored = Files.isRegularFile(dump);
            if (databaseRestored) {
                postgresCommandService.restoreDatabase(dump);
            } else {
                log.warn("Archive has no {}, database left unchanged", ArchiveCodec.DATABASE_FILE);
            }

            Path uploads = extracted.resolve(ArchiveCodec.UPLOADS_DIR);
            boolean uploadsRestored = Files.isDirectory(uploads);
            if (uploadsRestored) {
                int copied = FileTreeUtils.copyTree(uploads, Paths.get(uploadsDir));
                log.info("Restored {} upload file(s)", copied);
            }

            schemaSynchronizer.synchronize();
            appSettingsService.markSetupComplete();

            log.info("Restore of {} complete", request.getBackupKey());
            return RestoreResponse.builder()
                    .success(true)
                    .manifest(manifest)
                    .databaseRestored(databaseRestored)
                    .uploadsRestored(uploadsRestored)
                    .build();
        } catch (IOException e) {
            throw new ApiException("Failed to restore uploaded files: " + e.getMessage(), HttpStatus.INTERNAL_SERVER_ERROR, e);
        } finally {
            FileTreeUtils.deleteQuietly(workDir);
        }
    }

    private Path createWorkDir() {
        try {
            if (tempDir == null || tempDir.isBlank()) {
                return Files.createTempDirectory("restore-");
            }
            Path parent = Paths.get(tempDir);
            Files.createDirectories(parent);
            return Files.createTempDirectory(parent, "restore-");
        } catch (IOException e) {
            throw new ApiException("Cannot create temporary directory for restore", HttpStatus.INTERNAL_SERVER_ERROR, e);
        }
    }
}
