package com.studioledger.backup.service;

import com.studioledger.backup.model.dto.BackupSettings;
import com.studioledger.backup.model.dto.BackupSettingsRequest;
import com.studioledger.backup.model.dto.BackupSettingsResponse;
import com.studioledger.backup.util.CredentialUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Objects;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class BackupSettingsService {

    private final AppSettingsService appSettingsService;
    private final BackupScheduler backupScheduler;

    @Transactional(readOnly = true)
    public BackupSettingsResponse getSettings() {
        return BackupSettingsResponse.fromSettings(appSettingsService.loadBackupSettings());
    }

    /**
     * Persist the submitted settings. The Google client secret is kept when submitted masked,
     * and the recurring trigger is re-applied only when the schedule actually changed.
     */
    @Transactional
    public BackupSettingsResponse updateSettings(BackupSettingsRequest request, UUID userId) {
        BackupSettings current = appSettingsService.loadBackupSettings();

        if (request.getRetentionDays() != null) {
            appSettingsService.put(AppSettingsService.KEY_BACKUP_RETENTION_DAYS,
                    String.valueOf(request.getRetentionDays()), userId);
        }
        if (request.getGoogleClientId() != null) {
            appSettingsService.put(AppSettingsService.KEY_GOOGLE_CLIENT_ID, request.getGoogleClientId().trim(), userId);
        }
        if (request.getGoogleClientSecret() != null && !CredentialUtils.MASK.equals(request.getGoogleClientSecret())) {
            appSettingsService.put(AppSettingsService.KEY_GOOGLE_CLIENT_SECRET,
                    request.getGoogleClientSecret().trim(), userId);
        }

        boolean scheduleChanged = request.getSchedule() != null
                && !Objects.equals(request.getSchedule(), current.getSchedule());
        if (scheduleChanged) {
            appSettingsService.put(AppSettingsService.KEY_BACKUP_SCHEDULE, request.getSchedule(), userId);
            backupScheduler.applySchedule(request.getSchedule());
        }

        log.info("Backup settings updated by {}", userId);
        return BackupSettingsResponse.fromSettings(appSettingsService.loadBackupSettings());
    }
}
