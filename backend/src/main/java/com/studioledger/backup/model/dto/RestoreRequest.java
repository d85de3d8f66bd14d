package com.studioledger.backup.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Provider credentials entered during setup, plus the archive to restore when executing.
 * Validated by the restore service after the setup gate, not by bean validation.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RestoreRequest {

    private String provider;

    private String backupKey;

    private Map<String, String> credentials;
}
