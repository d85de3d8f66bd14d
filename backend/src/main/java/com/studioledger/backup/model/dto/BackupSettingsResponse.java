package com.studioledger.backup.model.dto;

import com.studioledger.backup.util.CredentialUtils;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
@AllArgsConstructor
public class BackupSettingsResponse {

    private String schedule;
    private int retentionDays;
    private String googleClientId;
    private String googleClientSecret;
    private boolean googleConfigured;

    public static BackupSettingsResponse fromSettings(BackupSettings settings) {
        String secret = settings.getGoogleClientSecret();
        return BackupSettingsResponse.builder()
                .schedule(settings.getSchedule())
                .retentionDays(settings.getRetentionDays())
                .googleClientId(settings.getGoogleClientId() != null ? settings.getGoogleClientId() : "")
                .googleClientSecret(secret != null && !secret.isEmpty() ? CredentialUtils.MASK : "")
                .googleConfigured(settings.hasGoogleClient())
                .build();
    }
}
