package com.studioledger.backup.storage;

import com.studioledger.backup.client.GoogleOAuthClient;
import com.studioledger.backup.model.dto.BackupSettings;
import com.studioledger.backup.model.entity.BackupDestination;
import com.studioledger.backup.service.AppSettingsService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Builds {@link BackupStorageProvider} instances from a provider name and its credentials.
 * Callers own the returned provider and must close it.
 */
@Slf4j
@Component
public class StorageProviderFactory {

    static final String DEFAULT_S3_REGION = "us-east-1";

    private static final Pattern B2_REGION_PATTERN = Pattern.compile("s3\\.([a-z0-9-]+)\\.backblazeb2\\.com");

    private final RestTemplate googleRestTemplate;
    private final GoogleOAuthClient googleOAuthClient;
    private final AppSettingsService appSettingsService;
    private final Clock clock;

    public StorageProviderFactory(@Qualifier("googleRestTemplate") RestTemplate googleRestTemplate,
                                  GoogleOAuthClient googleOAuthClient,
                                  AppSettingsService appSettingsService) {
        this(googleRestTemplate, googleOAuthClient, appSettingsService, Clock.systemUTC());
    }

    StorageProviderFactory(RestTemplate googleRestTemplate, GoogleOAuthClient googleOAuthClient,
                           AppSettingsService appSettingsService, Clock clock) {
        this.googleRestTemplate = googleRestTemplate;
        this.googleOAuthClient = googleOAuthClient;
        this.appSettingsService = appSettingsService;
        this.clock = clock;
    }

    public BackupStorageProvider create(BackupDestination destination) {
        log.debug("Creating {} provider for destination '{}'", destination.getProvider(), destination.getName());
        return create(destination.getProvider(), destination.getCredentials());
    }

    /**
     * @throws IllegalArgumentException for an unsupported provider or a missing required credential
     */
    public BackupStorageProvider create(String provider, Map<String, String> credentials) {
        StorageProviderType type = StorageProviderType.fromName(provider);
        Map<String, String> creds = credentials != null ? credentials : Map.of();

        return switch (type) {
            case S3 -> S3CompatibleStorageProvider.create(
                    required(creds, "accessKeyId"),
                    required(creds, "secretAccessKey"),
                    required(creds, "bucket"),
                    optional(creds, "region", DEFAULT_S3_REGION),
                    optional(creds, "endpoint", null));
            case B2 -> {
                String endpoint = normalizeEndpoint(required(creds, "endpoint"));
                yield S3CompatibleStorageProvider.create(
                        required(creds, "keyId"),
                        required(creds, "applicationKey"),
                        required(creds, "bucket"),
                        b2Region(endpoint),
                        endpoint);
            }
            case GDRIVE -> createGoogleDrive(creds);
        };
    }

    private BackupStorageProvider createGoogleDrive(Map<String, String> creds) {
        String refreshToken = required(creds, "refreshToken");
        String folderId = required(creds, "folderId");
        String clientId = optional(creds, "clientId", null);
        String clientSecret = optional(creds, "clientSecret", null);

        if (clientId == null || clientSecret == null) {
            BackupSettings settings = appSettingsService.loadBackupSettings();
            if (!settings.hasGoogleClient()) {
                throw new IllegalArgumentException("Google OAuth client is not configured");
            }
            clientId = settings.getGoogleClientId().trim();
            clientSecret = settings.getGoogleClientSecret().trim();
        }

        return new GoogleDriveStorageProvider(googleRestTemplate, googleOAuthClient,
                clientId, clientSecret, refreshToken, folderId, clock);
    }

    static String b2Region(String endpoint) {
        Matcher matcher = B2_REGION_PATTERN.matcher(endpoint.toLowerCase());
        if (!matcher.find()) {
            throw new IllegalArgumentException("Cannot determine region from B2 endpoint: " + endpoint);
        }
        return matcher.group(1);
    }

    static String normalizeEndpoint(String endpoint) {
        return endpoint.contains("://") ? endpoint : "https://" + endpoint;
    }

    private static String required(Map<String, String> creds, String key) {
        String value = creds.get(key);
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Missing required credential: " + key);
        }
        return value.trim();
    }

    private static String optional(Map<String, String> creds, String key, String defaultValue) {
        String value = creds.get(key);
        return value == null || value.isBlank() ? defaultValue : value.trim();
    }
}
