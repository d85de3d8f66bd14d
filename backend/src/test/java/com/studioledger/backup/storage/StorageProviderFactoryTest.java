package com.studioledger.backup.storage;

import com.studioledger.backup.client.GoogleOAuthClient;
import com.studioledger.backup.model.dto.BackupSettings;
import com.studioledger.backup.model.entity.BackupDestination;
import com.studioledger.backup.service.AppSettingsService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@DisplayName("StorageProviderFactory")
@ExtendWith(MockitoExtension.class)
class StorageProviderFactoryTest {

    @Mock private GoogleOAuthClient googleOAuthClient;
    @Mock private AppSettingsService appSettingsService;

    private StorageProviderFactory factory;

    @BeforeEach
    void setUp() {
        factory = new StorageProviderFactory(new RestTemplate(), googleOAuthClient, appSettingsService, Clock.systemUTC());
    }

    @Nested
    @DisplayName("S3 and B2")
    class S3Compatible {

        @Test
        @DisplayName("should build an S3 provider with default region")
        void shouldBuildS3() {
            try (BackupStorageProvider provider = factory.create("s3", Map.of(
                    "accessKeyId", "AKIA", "secretAccessKey", "secret", "bucket", "studio-backups"))) {
                assertThat(provider).isInstanceOf(S3CompatibleStorageProvider.class);
            }
        }

        @Test
        @DisplayName("should build a B2 provider from its endpoint")
        void shouldBuildB2() {
            BackupDestination destination = BackupDestination.builder()
                    .name("Offsite")
                    .provider("b2")
                    .credentials(Map.of("keyId", "0012", "applicationKey", "K001", "bucket", "studio",
                            "endpoint", "s3.eu-central-003.backblazeb2.com"))
                    .build();

            try (BackupStorageProvider provider = factory.create(destination)) {
                assertThat(provider).isInstanceOf(S3CompatibleStorageProvider.class);
            }
        }

        @Test
        @DisplayName("should name the missing credential")
        void shouldRejectMissingCredential() {
            assertThatThrownBy(() -> factory.create("s3", Map.of("accessKeyId", "AKIA", "bucket", "b")))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessage("Missing required credential: secretAccessKey");
        }

        @Test
        @DisplayName("should reject unsupported provider")
        void shouldRejectUnknownProvider() {
            assertThatThrownBy(() -> factory.create("dropbox", Map.of()))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("Unsupported provider");
        }
    }

    @Nested
    @DisplayName("B2 endpoint helpers")
    class B2Helpers {

        @Test
        @DisplayName("should derive region from endpoint host")
        void shouldDeriveRegion() {
            assertThat(StorageProviderFactory.b2Region("https://s3.us-west-004.backblazeb2.com"))
                    .isEqualTo("us-west-004");
        }

        @Test
        @DisplayName("should reject endpoints that are not Backblaze")
        void shouldRejectForeignEndpoint() {
            assertThatThrownBy(() -> StorageProviderFactory.b2Region("https://minio.local:9000"))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("should add https scheme when missing")
        void shouldNormalizeEndpoint() {
            assertThat(StorageProviderFactory.normalizeEndpoint("s3.eu-central-003.backblazeb2.com"))
                    .isEqualTo("https://s3.eu-central-003.backblazeb2.com");
            assertThat(StorageProviderFactory.normalizeEndpoint("http://localhost:9000"))
                    .isEqualTo("http://localhost:9000");
        }
    }

    @Nested
    @DisplayName("Google Drive")
    class GoogleDrive {

        @Test
        @DisplayName("should use client credentials stored on the destination")
        void shouldUseDestinationClient() {
            BackupStorageProvider provider = factory.create("gdrive", Map.of(
                    "clientId", "id", "clientSecret", "secret", "refreshToken", "rt", "folderId", "f"));

            assertThat(provider).isInstanceOf(GoogleDriveStorageProvider.class);
            verifyNoInteractions(appSettingsService);
        }

        @Test
        @DisplayName("should fall back to the OAuth client from settings")
        void shouldFallBackToSettings() {
            when(appSettingsService.loadBackupSettings()).thenReturn(BackupSettings.builder()
                    .googleClientId("settings-id")
                    .googleClientSecret("settings-secret")
                    .build());

            BackupStorageProvider provider = factory.create("gdrive", Map.of("refreshToken", "rt", "folderId", "f"));

            assertThat(provider).isInstanceOf(GoogleDriveStorageProvider.class);
        }

        @Test
        @DisplayName("should fail when no OAuth client is configured anywhere")
        void shouldFailWithoutClient() {
            when(appSettingsService.loadBackupSettings()).thenReturn(BackupSettings.builder().build());

            assertThatThrownBy(() -> factory.create("gdrive", Map.of("refreshToken", "rt", "folderId", "f")))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessage("Google OAuth client is not configured");
        }
    }
}
