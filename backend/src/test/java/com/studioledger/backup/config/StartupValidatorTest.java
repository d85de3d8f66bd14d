package com.studioledger.backup.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.test.util.ReflectionTestUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThatNoException;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("StartupValidator")
class StartupValidatorTest {

    private static final String SECRET = "a-secret-that-is-definitely-longer-than-32-chars";

    @Nested
    @DisplayName("validateJwtSecret")
    class ValidateJwtSecret {

        @Test
        @DisplayName("should throw when secret is too short")
        void shouldThrowWhenShort(@TempDir Path tempDir) {
            StartupValidator validator = createValidator("short", tempDir.toString(), "");

            assertThatThrownBy(validator::validate)
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("JWT_SECRET");
        }

        @Test
        @DisplayName("should pass with a complete configuration")
        void shouldPass(@TempDir Path tempDir) {
            StartupValidator validator = createValidator(SECRET, tempDir.toString(), tempDir.toString());

            assertThatNoException().isThrownBy(validator::validate);
        }
    }

    @Nested
    @DisplayName("validateUploadsDir")
    class ValidateUploadsDir {

        @Test
        @DisplayName("should only warn when uploads directory is missing")
        void shouldWarnWhenMissing(@TempDir Path tempDir) {
            StartupValidator validator = createValidator(SECRET, tempDir.resolve("missing").toString(), "");

            assertThatNoException().isThrownBy(validator::validate);
        }

        @Test
        @DisplayName("should throw when uploads path is a file")
        void shouldThrowWhenFile(@TempDir Path tempDir) throws IOException {
            Path file = Files.createFile(tempDir.resolve("uploads"));
            StartupValidator validator = createValidator(SECRET, file.toString(), "");

            assertThatThrownBy(validator::validateUploadsDir)
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("backup.uploads-dir");
        }
    }

    @Nested
    @DisplayName("validateTempDir")
    class ValidateTempDir {

        @Test
        @DisplayName("should accept a temp directory that does not exist yet")
        void shouldAcceptMissing(@TempDir Path tempDir) {
            StartupValidator validator = createValidator(SECRET, tempDir.toString(), tempDir.resolve("later").toString());

            assertThatNoException().isThrownBy(validator::validateTempDir);
        }

        @Test
        @DisplayName("should throw when temp path is a file")
        void shouldThrowWhenFile(@TempDir Path tempDir) throws IOException {
            Path file = Files.createFile(tempDir.resolve("tmp"));
            StartupValidator validator = createValidator(SECRET, tempDir.toString(), file.toString());

            assertThatThrownBy(validator::validateTempDir)
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("backup.temp-dir");
        }
    }

    private StartupValidator createValidator(String jwtSecret, String uploadsDir, String tempDir) {
        StartupValidator validator = new StartupValidator();
        ReflectionTestUtils.setField(validator, "jwtSecret", jwtSecret);
        ReflectionTestUtils.setField(validator, "datasourceUrl", "jdbc:postgresql://localhost:5432/studio");
        ReflectionTestUtils.setField(validator, "uploadsDir", uploadsDir);
        ReflectionTestUtils.setField(validator, "tempDir", tempDir);
        ReflectionTestUtils.setField(validator, "redirectBaseUrl", "https://studio.example.com");
        ReflectionTestUtils.setField(validator, "cookieSecure", true);
        return validator;
    }
}
