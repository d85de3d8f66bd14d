package com.studioledger.backup.storage;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Closed set of supported storage providers and the credential shape each one expects.
 * Adding a provider means one constant here plus its {@link BackupStorageProvider} variant.
 */
public enum StorageProviderType {

    S3("s3",
            List.of("accessKeyId", "secretAccessKey", "bucket", "region", "endpoint"),
            Set.of("accessKeyId", "secretAccessKey", "bucket"),
            Set.of("secretAccessKey"),
            legacyKeys(
                    "accessKeyId", "backup_s3_access_key",
                    "secretAccessKey", "backup_s3_secret_key",
                    "bucket", "backup_s3_bucket",
                    "region", "backup_s3_region",
                    "endpoint", "backup_s3_endpoint")),

    B2("b2",
            List.of("keyId", "applicationKey", "bucket", "endpoint"),
            Set.of("keyId", "applicationKey", "bucket", "endpoint"),
            Set.of("applicationKey"),
            legacyKeys(
                    "keyId", "backup_b2_key_id",
                    "applicationKey", "backup_b2_app_key",
                    "bucket", "backup_b2_bucket",
                    "endpoint", "backup_b2_endpoint")),

    GDRIVE("gdrive",
            List.of("clientId", "clientSecret", "refreshToken", "folderId"),
            Set.of("refreshToken", "folderId"),
            Set.of("clientSecret", "refreshToken"),
            legacyKeys(
                    "clientId", "backup_gdrive_client_id",
                    "clientSecret", "backup_gdrive_client_secret",
                    "refreshToken", "backup_gdrive_refresh_token",
                    "folderId", "backup_gdrive_folder_id"));

    private final String providerName;
    private final List<String> credentialKeys;
    private final Set<String> requiredKeys;
    private final Set<String> sensitiveKeys;
    private final Map<String, String> legacySettingKeys;

    StorageProviderType(String providerName, List<String> credentialKeys, Set<String> requiredKeys,
                        Set<String> sensitiveKeys, Map<String, String> legacySettingKeys) {
        this.providerName = providerName;
        this.credentialKeys = credentialKeys;
        this.requiredKeys = requiredKeys;
        this.sensitiveKeys = sensitiveKeys;
        this.legacySettingKeys = legacySettingKeys;
    }

    public String getProviderName() {
        return providerName;
    }

    /**
     * All credential keys the provider understands, in display order.
     */
    public List<String> getCredentialKeys() {
        return credentialKeys;
    }

    public Set<String> getRequiredKeys() {
        return requiredKeys;
    }

    public Set<String> getSensitiveKeys() {
        return sensitiveKeys;
    }

    /**
     * Credential key to the flat settings key it was stored under before destinations existed.
     */
    public Map<String, String> getLegacySettingKeys() {
        return legacySettingKeys;
    }

    public boolean isSensitive(String credentialKey) {
        return sensitiveKeys.contains(credentialKey);
    }

    public static Optional<StorageProviderType> find(String providerName) {
        if (providerName == null) {
            return Optional.empty();
        }
        String normalized = providerName.trim().toLowerCase();
        return Arrays.stream(values())
                .filter(type -> type.providerName.equals(normalized))
                .findFirst();
    }

    /**
     * @throws IllegalArgumentException for an unknown provider name
     */
    public static StorageProviderType fromName(String providerName) {
        return find(providerName)
                .orElseThrow(() -> new IllegalArgumentException("Unsupported provider: " + providerName));
    }

    private static Map<String, String> legacyKeys(String... pairs) {
        Map<String, String> keys = new LinkedHashMap<>();
        for (int i = 0; i < pairs.length; i += 2) {
            keys.put(pairs[i], pairs[i + 1]);
        }
        return Map.copyOf(keys);
    }
}
