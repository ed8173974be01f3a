package com.phillippitts.engramdesk.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class LogSanitizerTest {

    @Test
    void shouldReturnEmptyStringForNull() {
        assertThat(LogSanitizer.truncate(null, 10)).isEmpty();
        assertThat(LogSanitizer.line(null, 10)).isEmpty();
    }

    @Test
    void shouldReturnEmptyStringForNonPositiveMax() {
        assertThat(LogSanitizer.truncate("hello world", 0)).isEmpty();
        assertThat(LogSanitizer.truncate("hello world", -1)).isEmpty();
    }

    @Test
    void shouldReturnFullStringWhenWithinMax() {
        assertThat(LogSanitizer.truncate("hello", 10)).isEqualTo("hello");
        assertThat(LogSanitizer.truncate("12345", 5)).isEqualTo("12345");
    }

    @Test
    void shouldTruncateWhenLongerThanMax() {
        assertThat(LogSanitizer.truncate("hello world", 5)).isEqualTo("hello");
        assertThat(LogSanitizer.truncate("a".repeat(10000), 100)).hasSize(100);
    }

    @Test
    void lineStripsTrailingWhitespaceAndCarriageReturn() {
        assertThat(LogSanitizer.line("Server listening on 3838\r", 100)).isEqualTo("Server listening on 3838");
        assertThat(LogSanitizer.line("  indented  ", 100)).isEqualTo("  indented");
    }
}
