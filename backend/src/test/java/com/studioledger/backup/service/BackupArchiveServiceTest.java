package com.studioledger.backup.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.studioledger.backup.archive.ArchiveCodec;
import com.studioledger.backup.archive.ArchiveResult;
import com.studioledger.backup.archive.BackupManifest;
import com.studioledger.backup.exception.DatabaseCommandException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.when;

@DisplayName("BackupArchiveService")
@ExtendWith(MockitoExtension.class)
class BackupArchiveServiceTest {

    @Mock
    private PostgresCommandService postgresCommandService;

    @TempDir
    Path tempDir;

    private ArchiveCodec archiveCodec;
    private BackupArchiveService service;
    private Path uploadsDir;

    @BeforeEach
    void setUp() throws Exception {
        archiveCodec = new ArchiveCodec(new ObjectMapper().findAndRegisterModules());
        service = new BackupArchiveService(postgresCommandService, archiveCodec);
        uploadsDir = tempDir.resolve("uploads");
        ReflectionTestUtils.setField(service, "uploadsDir", uploadsDir.toString());
        ReflectionTestUtils.setField(service, "appVersion", "2.4.0");
        service.setClock(Clock.fixed(Instant.parse("2024-03-01T02:00:00Z"), ZoneOffset.UTC));
    }

    @Test
    @DisplayName("should package dump, uploads and manifest under a timestamped name")
    void shouldCreateArchive() throws Exception {
        Files.createDirectories(uploadsDir.resolve("logos"));
        Files.writeString(uploadsDir.resolve("logos/studio.png"), "png");
        stubDump("CREATE TABLE clients (id uuid);");
        when(postgresCommandService.getDatabaseName()).thenReturn("studio");
        Path workDir = Files.createDirectories(tempDir.resolve("work"));

        ArchiveResult result = service.createArchive(workDir);

        assertThat(result.getFileName()).isEqualTo("backup-2024-03-01-020000.tar.gz");
        assertThat(result.getArchivePath()).exists();
        assertThat(result.getSize()).isEqualTo(Files.size(result.getArchivePath()));
        assertThat(workDir.resolve(BackupArchiveService.STAGING_DIR)).doesNotExist();

        BackupManifest manifest = result.getManifest();
        assertThat(manifest.getAppVersion()).isEqualTo("2.4.0");
        assertThat(manifest.getDbName()).isEqualTo("studio");
        assertThat(manifest.isHasDatabase()).isTrue();
        assertThat(manifest.isHasUploads()).isTrue();
        assertThat(manifest.getFiles()).extracting(BackupManifest.FileEntry::getPath)
                .containsExactly("database.sql", "uploads/logos/studio.png");

        Path extracted = tempDir.resolve("extracted");
        archiveCodec.extract(result.getArchivePath(), extracted);
        assertThat(extracted.resolve("database.sql")).hasContent("CREATE TABLE clients (id uuid);");
        assertThat(extracted.resolve("uploads/logos/studio.png")).hasContent("png");
    }

    @Test
    @DisplayName("should record missing uploads directory in manifest")
    void shouldHandleMissingUploads() throws Exception {
        stubDump("SELECT 1;");
        when(postgresCommandService.getDatabaseName()).thenReturn("studio");

        ArchiveResult result = service.createArchive(Files.createDirectories(tempDir.resolve("work")));

        assertThat(result.getManifest().isHasUploads()).isFalse();
    }

    @Test
    @DisplayName("should propagate dump failure and remove staging")
    void shouldPropagateDumpFailure() throws Exception {
        doThrow(new DatabaseCommandException("pg_dump failed with exit code 1"))
                .when(postgresCommandService).dumpDatabase(any(Path.class));
        Path workDir = Files.createDirectories(tempDir.resolve("work"));

        assertThatThrownBy(() -> service.createArchive(workDir))
                .isInstanceOf(DatabaseCommandException.class);
        assertThat(workDir.resolve(BackupArchiveService.STAGING_DIR)).doesNotExist();
    }

    private void stubDump(String sql) {
        doAnswer(inv -> {
            Path target = inv.getArgument(0);
            Files.writeString(target, sql);
            return null;
        }).when(postgresCommandService).dumpDatabase(any(Path.class));
    }
}
