package com.studioledger.backup.model.dto;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Snapshot of the backup-related rows of the settings table, read in one query.
 */
@Value
@Builder
public class BackupSettings {

    public static final String SCHEDULE_DAILY = "daily";
    public static final String SCHEDULE_WEEKLY = "weekly";
    public static final String SCHEDULE_NONE = "none";

    public static final int DEFAULT_RETENTION_DAYS = 30;

    String schedule;
    int retentionDays;
    String googleClientId;
    String googleClientSecret;
    boolean setupComplete;

    /**
     * Provider name stored under the legacy {@code backup_provider} key, if any.
     */
    String legacyProvider;

    /**
     * Raw values of the legacy flat credential keys, keyed by settings key.
     */
    Map<String, String> legacyValues;

    public boolean hasGoogleClient() {
        return googleClientId != null && !googleClientId.isBlank()
                && googleClientSecret != null && !googleClientSecret.isBlank();
    }
}
