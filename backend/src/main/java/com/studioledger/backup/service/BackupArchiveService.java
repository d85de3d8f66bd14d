package com.studioledger.backup.service;

import com.studioledger.backup.archive.ArchiveCodec;
import com.studioledger.backup.archive.ArchiveResult;
import com.studioledger.backup.archive.BackupManifest;
import com.studioledger.backup.exception.ArchiveFormatException;
import com.studioledger.backup.util.FileTreeUtils;
import com.studioledger.backup.util.FormatUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeFormatter;

/**
 * Produces a complete backup archive: database dump, uploads snapshot and manifest.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BackupArchiveService {

    static final String STAGING_DIR = "backup-work";

    private static final DateTimeFormatter FILE_NAME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd-HHmmss");

    private final PostgresCommandService postgresCommandService;
    private final ArchiveCodec archiveCodec;

    @Value("${backup.uploads-dir:./uploads}")
    private String uploadsDir;

    @Value("${backup.app-version:unknown}")
    private String appVersion;

    private Clock clock = Clock.systemDefaultZone();

    /**
     * Build an archive inside {@code workDir}. The staging directory used to assemble
     * the contents is removed before returning, whether or not packing succeeded.
     */
    public ArchiveResult createArchive(Path workDir) {
        Path staging = workDir.resolve(STAGING_DIR);
        try {
            Files.createDirectories(staging);

            postgresCommandService.dumpDatabase(staging.resolve(ArchiveCodec.DATABASE_FILE));

            Path uploadsSource = Paths.get(uploadsDir);
            boolean hasUploads = Files.isDirectory(uploadsSource);
            if (hasUploads) {
                int copied = FileTreeUtils.copyTree(uploadsSource, staging.resolve(ArchiveCodec.UPLOADS_DIR));
                log.debug("Copied {} upload files into archive staging", copied);
            }

            Instant now = clock.instant();
            BackupManifest manifest = BackupManifest.builder()
                    .formatVersion(BackupManifest.CURRENT_FORMAT_VERSION)
                    .appVersion(appVersion)
                    .createdAt(now)
                    .dbName(postgresCommandService.getDatabaseName())
                    .javaVersion(System.getProperty("java.version"))
                    .hasDatabase(true)
                    .hasUploads(hasUploads)
                    .files(archiveCodec.inventory(staging))
                    .build();
            archiveCodec.writeManifest(manifest, staging);

            String fileName = "backup-" + FILE_NAME_FORMAT.format(now.atZone(clock.getZone())) + ".tar.gz";
            Path archivePath = workDir.resolve(fileName);
            archiveCodec.pack(staging, archivePath);

            long size = Files.size(archivePath);
            log.info("Created backup archive {} ({})", fileName, FormatUtils.formatBytes(size));

            return ArchiveResult.builder()
                    .archivePath(archivePath)
                    .fileName(fileName)
                    .size(size)
                    .manifest(manifest)
                    .build();
        } catch (IOException e) {
            throw new ArchiveFormatException("Failed to assemble backup archive: " + e.getMessage(), e);
        } finally {
            FileTreeUtils.deleteQuietly(staging);
        }
    }

    void setClock(Clock clock) {
        this.clock = clock;
    }
}
