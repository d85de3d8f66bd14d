package com.studioledger.backup.archive;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Contents of {@code manifest.json}, describing what an archive holds.
 * Archives written by older releases used {@code version}/{@code timestamp}; both are accepted on read.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class BackupManifest {

    public static final String CURRENT_FORMAT_VERSION = "1.0.0";

    @JsonAlias("version")
    private String formatVersion;

    private String appVersion;

    @JsonAlias("timestamp")
    private Instant createdAt;

    private String dbName;

    private String javaVersion;

    private boolean hasDatabase;

    private boolean hasUploads;

    @Builder.Default
    private List<FileEntry> files = new ArrayList<>();

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class FileEntry {
        private String path;
        private long size;
    }
}
