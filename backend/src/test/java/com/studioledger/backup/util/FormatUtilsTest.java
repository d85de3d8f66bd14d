package com.studioledger.backup.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("FormatUtils")
class FormatUtilsTest {

    @Nested
    @DisplayName("formatBytes")
    class FormatBytes {

        @Test
        @DisplayName("should return 0 B for zero or negative")
        void shouldHandleZero() {
            assertThat(FormatUtils.formatBytes(0)).isEqualTo("0 B");
            assertThat(FormatUtils.formatBytes(-5)).isEqualTo("0 B");
        }

        @Test
        @DisplayName("should scale to the largest whole unit")
        void shouldScale() {
            assertThat(FormatUtils.formatBytes(512)).isEqualTo("512.00 B");
            assertThat(FormatUtils.formatBytes(1536)).isEqualTo("1.50 KB");
            assertThat(FormatUtils.formatBytes(5L * 1024 * 1024 * 1024)).isEqualTo("5.00 GB");
        }
    }

    @Test
    @DisplayName("formatDuration should render seconds with one decimal")
    void shouldFormatDuration() {
        assertThat(FormatUtils.formatDuration(Duration.ofMillis(12_340))).isEqualTo("12.3s");
    }

    @Nested
    @DisplayName("tail")
    class Tail {

        @Test
        @DisplayName("should keep short output intact")
        void shouldKeepShort() {
            assertThat(FormatUtils.tail("  ERROR: syntax error\n", 100)).isEqualTo("ERROR: syntax error");
        }

        @Test
        @DisplayName("should keep only the end of long output")
        void shouldTruncate() {
            assertThat(FormatUtils.tail("abcdefghij", 4)).isEqualTo("...ghij");
        }

        @Test
        @DisplayName("should treat null as empty")
        void shouldHandleNull() {
            assertThat(FormatUtils.tail(null, 10)).isEmpty();
        }
    }
}
