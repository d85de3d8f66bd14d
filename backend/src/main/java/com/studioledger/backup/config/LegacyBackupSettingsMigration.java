package com.studioledger.backup.config;

import com.studioledger.backup.model.dto.BackupSettings;
import com.studioledger.backup.model.entity.BackupDestination;
import com.studioledger.backup.repository.BackupDestinationRepository;
import com.studioledger.backup.service.AppSettingsService;
import com.studioledger.backup.storage.StorageProviderType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Converts the flat backup settings used before destinations existed into a single
 * destination. Does nothing once any destination exists, so it is safe on every start.
 */
@Slf4j
@Component
@Order(1)
@RequiredArgsConstructor
public class LegacyBackupSettingsMigration implements ApplicationRunner {

    private final BackupDestinationRepository destinationRepository;
    private final AppSettingsService appSettingsService;

    @Override
    @Transactional
    public void run(ApplicationArguments args) {
        migrate();
    }

    /**
     * @return the created destination, or empty when nothing needed migrating
     */
    @Transactional
    public Optional<BackupDestination> migrate() {
        if (destinationRepository.count() > 0) {
            log.debug("Backup destinations already exist, skipping legacy settings migration");
            return Optional.empty();
        }

        BackupSettings settings = appSettingsService.loadBackupSettings();
        Optional<StorageProviderType> type = StorageProviderType.find(settings.getLegacyProvider());
        if (type.isEmpty()) {
            log.debug("No legacy backup provider configured, nothing to migrate");
            return Optional.empty();
        }

        Map<String, String> credentials = new LinkedHashMap<>();
        type.get().getLegacySettingKeys().forEach((credentialKey, settingKey) -> {
            String value = settings.getLegacyValues().get(settingKey);
            if (value != null && !value.isBlank()) {
                credentials.put(credentialKey, value.trim());
            }
        });

        if (credentials.isEmpty()) {
            log.info("Legacy backup provider '{}' has no credentials, skipping migration", type.get().getProviderName());
            return Optional.empty();
        }

        BackupDestination destination = destinationRepository.save(BackupDestination.builder()
                .name("Default (" + type.get().getProviderName() + ")")
                .provider(type.get().getProviderName())
                .credentials(credentials)
                .active(true)
                .build());

        log.info("Migrated legacy {} backup settings into destination '{}'",
                type.get().getProviderName(), destination.getName());
        return Optional.of(destination);
    }
}
