package com.studioledger.backup.service;

import com.studioledger.backup.model.dto.BackupSettings;
import com.studioledger.backup.model.entity.AppSetting;
import com.studioledger.backup.repository.AppSettingRepository;
import com.studioledger.backup.storage.StorageProviderType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.*;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Access to the flat {@code app_settings} table.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AppSettingsService {

    public static final String KEY_BACKUP_SCHEDULE = "backup_schedule";
    public static final String KEY_BACKUP_RETENTION_DAYS = "backup_retention_days";
    public static final String KEY_GOOGLE_CLIENT_ID = "google_client_id";
    public static final String KEY_GOOGLE_CLIENT_SECRET = "google_client_secret";
    public static final String KEY_SETUP_COMPLETE = "setup_complete";
    public static final String KEY_LEGACY_PROVIDER = "backup_provider";

    private final AppSettingRepository appSettingRepository;

    @Transactional(readOnly = true)
    public Optional<String> get(String key) {
        return appSettingRepository.findById(key).map(AppSetting::getValue);
    }

    @Transactional
    public void put(String key, String value, UUID editedBy) {
        AppSetting setting = appSettingRepository.findById(key)
                .orElseGet(() -> AppSetting.builder().key(key).build());
        setting.setValue(value != null ? value : "");
        setting.setLastEditedBy(editedBy);
        appSettingRepository.save(setting);
    }

    /**
     * Load every backup-related setting, including the legacy flat keys, in a single query.
     */
    @Transactional(readOnly = true)
    public BackupSettings loadBackupSettings() {
        Set<String> legacyKeys = Arrays.stream(StorageProviderType.values())
                .flatMap(type -> type.getLegacySettingKeys().values().stream())
                .collect(Collectors.toCollection(LinkedHashSet::new));

        Set<String> keys = new LinkedHashSet<>(List.of(
                KEY_BACKUP_SCHEDULE, KEY_BACKUP_RETENTION_DAYS, KEY_GOOGLE_CLIENT_ID,
                KEY_GOOGLE_CLIENT_SECRET, KEY_SETUP_COMPLETE, KEY_LEGACY_PROVIDER));
        keys.addAll(legacyKeys);

        Map<String, String> values = appSettingRepository.findByKeyIn(keys).stream()
                .filter(setting -> setting.getValue() != null)
                .collect(Collectors.toMap(AppSetting::getKey, AppSetting::getValue, (a, b) -> a));

        Map<String, String> legacyValues = legacyKeys.stream()
                .filter(values::containsKey)
                .collect(Collectors.toMap(Function.identity(), values::get, (a, b) -> a, LinkedHashMap::new));

        return BackupSettings.builder()
                .schedule(values.getOrDefault(KEY_BACKUP_SCHEDULE, BackupSettings.SCHEDULE_NONE))
                .retentionDays(parseRetentionDays(values.get(KEY_BACKUP_RETENTION_DAYS)))
                .googleClientId(values.get(KEY_GOOGLE_CLIENT_ID))
                .googleClientSecret(values.get(KEY_GOOGLE_CLIENT_SECRET))
                .setupComplete(Boolean.parseBoolean(values.get(KEY_SETUP_COMPLETE)))
                .legacyProvider(values.get(KEY_LEGACY_PROVIDER))
                .legacyValues(legacyValues)
                .build();
    }

    @Transactional(readOnly = true)
    public boolean isSetupComplete() {
        return get(KEY_SETUP_COMPLETE).map(Boolean::parseBoolean).orElse(false);
    }

    @Transactional
    public void markSetupComplete() {
        put(KEY_SETUP_COMPLETE, "true", null);
        log.info("Initial setup marked as complete");
    }

    private int parseRetentionDays(String value) {
        if (value == null || value.isBlank()) {
            return BackupSettings.DEFAULT_RETENTION_DAYS;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            log.warn("Ignoring invalid {} value '{}'", KEY_BACKUP_RETENTION_DAYS, value);
            return BackupSettings.DEFAULT_RETENTION_DAYS;
        }
    }
}
