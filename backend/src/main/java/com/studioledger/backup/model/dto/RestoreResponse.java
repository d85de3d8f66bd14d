package com.studioledger.backup.model.dto;

import com.studioledger.backup.archive.BackupManifest;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
@AllArgsConstructor
public class RestoreResponse {

    private boolean success;
    private BackupManifest manifest;
    private boolean databaseRestored;
    private boolean uploadsRestored;
}
