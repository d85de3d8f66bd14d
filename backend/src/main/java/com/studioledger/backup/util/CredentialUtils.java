package com.studioledger.backup.util;

import com.studioledger.backup.storage.StorageProviderType;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Display-time masking of secret credential fields and the matching merge on write.
 */
public final class CredentialUtils {

    /**
     * Placeholder sent instead of a stored secret. Echoing it back means "unchanged".
     */
    public static final String MASK = "********";

    private CredentialUtils() {
    }

    /**
     * Replace every non-empty sensitive value with {@link #MASK}.
     */
    public static Map<String, String> maskCredentials(String provider, Map<String, String> credentials) {
        StorageProviderType type = StorageProviderType.fromName(provider);
        Map<String, String> masked = new LinkedHashMap<>();
        if (credentials == null) {
            return masked;
        }
        credentials.forEach((key, value) -> {
            boolean hide = type.isSensitive(key) && value != null && !value.isEmpty();
            masked.put(key, hide ? MASK : value);
        });
        return masked;
    }

    /**
     * Combine stored credentials with the values submitted from an edit form.
     * A sensitive field submitted as {@link #MASK} keeps its stored value; every other
     * field takes the submitted value. Keys the provider does not know are dropped.
     */
    public static Map<String, String> mergeCredentials(Map<String, String> existing,
                                                       Map<String, String> incoming,
                                                       String provider) {
        StorageProviderType type = StorageProviderType.fromName(provider);
        Map<String, String> stored = existing != null ? existing : Map.of();
        Map<String, String> submitted = incoming != null ? incoming : Map.of();

        Map<String, String> merged = new LinkedHashMap<>();
        for (String key : type.getCredentialKeys()) {
            if (!submitted.containsKey(key)) {
                if (stored.containsKey(key)) {
                    merged.put(key, stored.get(key));
                }
                continue;
            }
            String value = submitted.get(key);
            if (type.isSensitive(key) && MASK.equals(value)) {
                if (stored.containsKey(key)) {
                    merged.put(key, stored.get(key));
                }
            } else {
                merged.put(key, value != null ? value.trim() : null);
            }
        }
        return merged;
    }

    /**
     * Keep only the provider's credential keys, trimmed, for a newly created destination.
     */
    public static Map<String, String> sanitizeCredentials(String provider, Map<String, String> credentials) {
        StorageProviderType type = StorageProviderType.fromName(provider);
        Map<String, String> sanitized = new LinkedHashMap<>();
        if (credentials == null) {
            return sanitized;
        }
        for (String key : type.getCredentialKeys()) {
            String value = credentials.get(key);
            if (value != null) {
                sanitized.put(key, value.trim());
            }
        }
        return sanitized;
    }

    public static boolean containsMask(Map<String, String> credentials) {
        return credentials != null && credentials.containsValue(MASK);
    }
}
