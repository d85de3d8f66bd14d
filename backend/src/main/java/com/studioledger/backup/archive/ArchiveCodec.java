package com.studioledger.backup.archive;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.studioledger.backup.exception.ArchiveFormatException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.compress.archivers.tar.TarArchiveEntry;
import org.apache.commons.compress.archivers.tar.TarArchiveInputStream;
import org.apache.commons.compress.archivers.tar.TarArchiveOutputStream;
import org.apache.commons.compress.compressors.gzip.GzipCompressorInputStream;
import org.apache.commons.compress.compressors.gzip.GzipCompressorOutputStream;
import org.springframework.stereotype.Component;

import java.io.*;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Reads and writes backup archives: a gzip-compressed tar holding
 * {@code manifest.json}, an optional {@code database.sql} and an optional {@code uploads/} tree.
 */
@Slf4j
@Component
public class ArchiveCodec {

    public static final String MANIFEST_FILE = "manifest.json";
    public static final String DATABASE_FILE = "database.sql";
    public static final String UPLOADS_DIR = "uploads";

    static final Set<String> SUPPORTED_FORMAT_VERSIONS = Set.of(BackupManifest.CURRENT_FORMAT_VERSION);

    private final ObjectMapper objectMapper;

    public ArchiveCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy()
                .enable(SerializationFeature.INDENT_OUTPUT)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    /**
     * Write every file and directory under {@code sourceDir} into a new tar.gz at {@code archiveFile}.
     */
    public void pack(Path sourceDir, Path archiveFile) {
        List<Path> paths;
        try (Stream<Path> walk = Files.walk(sourceDir)) {
            paths = walk.filter(p -> !p.equals(sourceDir)).sorted().toList();
        } catch (IOException e) {
            throw new ArchiveFormatException("Cannot read archive source " + sourceDir, e);
        }

        try (OutputStream out = new BufferedOutputStream(Files.newOutputStream(archiveFile));
             GzipCompressorOutputStream gzip = new GzipCompressorOutputStream(out);
             TarArchiveOutputStream tar = new TarArchiveOutputStream(gzip)) {
            tar.setLongFileMode(TarArchiveOutputStream.LONGFILE_POSIX);
            tar.setBigNumberMode(TarArchiveOutputStream.BIGNUMBER_POSIX);

            for (Path path : paths) {
                String name = entryName(sourceDir, path);
                if (Files.isDirectory(path)) {
                    tar.putArchiveEntry(new TarArchiveEntry(path, name + "/"));
                    tar.closeArchiveEntry();
                } else if (Files.isRegularFile(path)) {
                    tar.putArchiveEntry(new TarArchiveEntry(path, name));
                    Files.copy(path, tar);
                    tar.closeArchiveEntry();
                }
            }
            tar.finish();
        } catch (IOException e) {
            throw new ArchiveFormatException("Failed to write archive " + archiveFile.getFileName(), e);
        }
        log.debug("Packed {} entries into {}", paths.size(), archiveFile.getFileName());
    }

    /**
     * Unpack {@code archiveFile} into {@code targetDir} and return its manifest.
     *
     * @throws ArchiveFormatException if the archive is corrupt, tries to write outside the
     *                                target directory, or lacks a readable manifest
     */
    public BackupManifest extract(Path archiveFile, Path targetDir) {
        Path root = targetDir.toAbsolutePath().normalize();
        try {
            Files.createDirectories(root);
        } catch (IOException e) {
            throw new ArchiveFormatException("Cannot create extraction directory " + targetDir, e);
        }

        try (InputStream in = new BufferedInputStream(Files.newInputStream(archiveFile));
             GzipCompressorInputStream gzip = new GzipCompressorInputStream(in);
             TarArchiveInputStream tar = new TarArchiveInputStream(gzip)) {
            TarArchiveEntry entry;
            while ((entry = tar.getNextEntry()) != null) {
                Path target = resolveEntry(root, entry.getName());
                if (entry.isDirectory()) {
                    Files.createDirectories(target);
                } else if (entry.isFile()) {
                    Files.createDirectories(target.getParent());
                    Files.copy(tar, target, StandardCopyOption.REPLACE_EXISTING);
                } else {
                    throw new ArchiveFormatException("Unsupported archive entry type: " + entry.getName());
                }
            }
        } catch (IOException e) {
            throw new ArchiveFormatException("Archive is corrupt or not a tar.gz file: " + e.getMessage(), e);
        }

        return readManifest(root);
    }

    /**
     * Read and validate {@code manifest.json} from an unpacked archive directory.
     */
    public BackupManifest readManifest(Path dir) {
        Path manifestFile = dir.resolve(MANIFEST_FILE);
        if (!Files.isRegularFile(manifestFile)) {
            throw new ArchiveFormatException("Archive does not contain " + MANIFEST_FILE);
        }
        BackupManifest manifest;
        try {
            manifest = objectMapper.readValue(manifestFile.toFile(), BackupManifest.class);
        } catch (IOException e) {
            throw new ArchiveFormatException("Archive manifest is not valid JSON", e);
        }
        if (manifest == null || !SUPPORTED_FORMAT_VERSIONS.contains(manifest.getFormatVersion())) {
            throw new ArchiveFormatException("Unsupported archive format version: "
                    + (manifest != null ? manifest.getFormatVersion() : null));
        }
        return manifest;
    }

    public void writeManifest(BackupManifest manifest, Path dir) {
        try {
            objectMapper.writeValue(dir.resolve(MANIFEST_FILE).toFile(), manifest);
        } catch (IOException e) {
            throw new ArchiveFormatException("Failed to write " + MANIFEST_FILE, e);
        }
    }

    /**
     * List every regular file under {@code dir} with its size, relative paths using '/'.
     */
    public List<BackupManifest.FileEntry> inventory(Path dir) {
        try (Stream<Path> walk = Files.walk(dir)) {
            return walk.filter(Files::isRegularFile)
                    .filter(p -> !p.equals(dir.resolve(MANIFEST_FILE)))
                    .sorted()
                    .map(p -> new BackupManifest.FileEntry(entryName(dir, p), sizeOf(p)))
                    .toList();
        } catch (IOException e) {
            throw new ArchiveFormatException("Cannot list files under " + dir, e);
        }
    }

    private static Path resolveEntry(Path root, String name) {
        if (name.startsWith("/") || name.startsWith("\\")) {
            throw new ArchiveFormatException("Archive entry has an absolute path: " + name);
        }
        Path target = root.resolve(name).normalize();
        if (!target.startsWith(root)) {
            throw new ArchiveFormatException("Archive entry escapes the target directory: " + name);
        }
        return target;
    }

    private static String entryName(Path base, Path path) {
        return base.relativize(path).toString().replace(File.separatorChar, '/');
    }

    private static long sizeOf(Path path) {
        try {
            return Files.size(path);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
