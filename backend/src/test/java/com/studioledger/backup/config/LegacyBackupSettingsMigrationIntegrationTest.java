package com.studioledger.backup.config;

import com.studioledger.backup.model.entity.BackupDestination;
import com.studioledger.backup.repository.BackupDestinationRepository;
import com.studioledger.backup.service.AppSettingsService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
@Transactional
@DisplayName("LegacyBackupSettingsMigration against the database")
class LegacyBackupSettingsMigrationIntegrationTest {

    @Autowired
    private LegacyBackupSettingsMigration migration;

    @Autowired
    private BackupDestinationRepository destinationRepository;

    @Autowired
    private AppSettingsService appSettingsService;

    @BeforeEach
    void setUp() {
        destinationRepository.deleteAll();
        appSettingsService.put(AppSettingsService.KEY_LEGACY_PROVIDER, "s3", null);
        appSettingsService.put("backup_s3_access_key", "AKIA", null);
        appSettingsService.put("backup_s3_secret_key", "secret", null);
        appSettingsService.put("backup_s3_bucket", "studio-backups", null);
        appSettingsService.put("backup_s3_region", "eu-west-1", null);
    }

    @Test
    @DisplayName("should leave exactly one destination after running twice")
    void shouldCreateOneDestinationWhenRunTwice() {
        assertThat(migration.migrate()).isPresent();
        assertThat(migration.migrate()).isEmpty();

        List<BackupDestination> destinations = destinationRepository.findAll();
        assertThat(destinations).hasSize(1);
        assertThat(destinations.get(0).getProvider()).isEqualTo("s3");
        assertThat(destinations.get(0).getCredentials())
                .containsEntry("accessKeyId", "AKIA")
                .containsEntry("bucket", "studio-backups");
    }
}
