package com.studioledger.backup.archive;

import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;

@Value
@Builder
public class ArchiveResult {

    Path archivePath;
    String fileName;
    long size;
    BackupManifest manifest;
}
