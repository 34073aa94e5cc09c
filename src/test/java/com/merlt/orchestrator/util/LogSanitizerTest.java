package com.merlt.orchestrator.util;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class LogSanitizerTest {

    @Nested
    @DisplayName("querySummary()")
    class QuerySummaryTest {
        @Test
        @DisplayName("Should return len=0 and id=none for null query")
        void shouldHandleNull() {
            assertThat(LogSanitizer.querySummary(null)).isEqualTo("[len=0,id=none]");
        }

        @Test
        @DisplayName("Should never echo the query text")
        void shouldNotLeakQueryText() {
            String result = LogSanitizer.querySummary("responsabilità del vettore art. 1681");
            assertThat(result).startsWith("[len=36,id=").doesNotContain("vettore");
        }

        @Test
        @DisplayName("Should return consistent id for same input")
        void shouldBeConsistent() {
            assertThat(LogSanitizer.querySummary("art. 2043 c.c."))
                    .isEqualTo(LogSanitizer.querySummary("art. 2043 c.c."));
        }
    }

    @Nested
    @DisplayName("sanitize()")
    class SanitizeTest {
        @Test
        @DisplayName("Should return empty string for null input")
        void shouldHandleNull() {
            assertThat(LogSanitizer.sanitize(null)).isEmpty();
        }

        @Test
        @DisplayName("Should replace newlines and strip carriage returns")
        void shouldFlattenLines() {
            assertThat(LogSanitizer.sanitize("fb-1\r\nforged entry")).isEqualTo("fb-1 forged entry");
        }

        @Test
        @DisplayName("Should strip control characters")
        void shouldStripControlChars() {
            assertThat(LogSanitizer.sanitize("user\u0000\u001B42")).isEqualTo("user42");
        }

        @Test
        @DisplayName("Should truncate long values")
        void shouldTruncate() {
            String result = LogSanitizer.sanitize("x".repeat(500));
            assertThat(result).hasSize(203).endsWith("...");
        }
    }
}
