package com.studioledger.backup.config;

import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Checks backup configuration at startup. A bad JWT secret or an unusable temp directory
 * stops the application; anything that only disables part of the feature is logged.
 */
@Slf4j
@Component
public class StartupValidator {

    @Value("${jwt.secret:}")
    private String jwtSecret;

    @Value("${spring.datasource.url:}")
    private String datasourceUrl;

    @Value("${backup.uploads-dir:./uploads}")
    private String uploadsDir;

    @Value("${backup.temp-dir:}")
    private String tempDir;

    @Value("${oauth.google.redirect-base-url:http://localhost:8080}")
    private String redirectBaseUrl;

    @Value("${oauth.google.cookie-secure:false}")
    private boolean cookieSecure;

    @PostConstruct
    public void validate() {
        log.info("Validating backup configuration...");

        validateJwtSecret();
        validateDatasource();
        validateUploadsDir();
        validateTempDir();
        validateOAuthRedirect();

        log.info("Backup configuration validation complete");
    }

    void validateJwtSecret() {
        if (jwtSecret == null || jwtSecret.length() < 32) {
            throw new IllegalStateException("JWT_SECRET must be set and at least 32 characters long");
        }
    }

    void validateDatasource() {
        if (datasourceUrl == null || !datasourceUrl.startsWith("jdbc:postgresql:")) {
            log.warn("Datasource is not PostgreSQL ({}). Database dump and restore will be unavailable.",
                    datasourceUrl == null || datasourceUrl.isBlank() ? "unset" : datasourceUrl.split("\\?")[0]);
        }
    }

    void validateUploadsDir() {
        Path uploads = Path.of(uploadsDir);
        if (!Files.exists(uploads)) {
            log.warn("Uploads directory does not exist: {}. Backups will contain no uploaded files.",
                    uploads.toAbsolutePath());
        } else if (!Files.isDirectory(uploads)) {
            throw new IllegalStateException("backup.uploads-dir is not a directory: " + uploads.toAbsolutePath());
        } else {
            log.info("Uploads directory: {}", uploads.toAbsolutePath());
        }
    }

    void validateTempDir() {
        if (tempDir == null || tempDir.isBlank()) {
            return;
        }
        Path temp = Path.of(tempDir);
        if (Files.exists(temp) && (!Files.isDirectory(temp) || !Files.isWritable(temp))) {
            throw new IllegalStateException("backup.temp-dir is not a writable directory: " + temp.toAbsolutePath());
        }
    }

    void validateOAuthRedirect() {
        if (redirectBaseUrl.startsWith("https://") && !cookieSecure) {
            log.warn("OAuth redirect base URL uses HTTPS but oauth.google.cookie-secure is false");
        }
    }
}
