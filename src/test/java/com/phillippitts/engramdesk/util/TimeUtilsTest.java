package com.phillippitts.engramdesk.util;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class TimeUtilsTest {

    @Test
    void secondsSinceHandlesNullAndFuture() {
        assertThat(TimeUtils.secondsSince(null)).isZero();
        assertThat(TimeUtils.secondsSince(Instant.now().plusSeconds(60))).isZero();
    }

    @Test
    void secondsSinceCountsElapsedTime() {
        assertThat(TimeUtils.secondsSince(Instant.now().minusSeconds(90))).isBetween(89L, 91L);
    }

    @Test
    void backoffDoublesPerAttempt() {
        Duration base = Duration.ofSeconds(2);

        assertThat(TimeUtils.exponentialBackoff(base, 1)).isEqualTo(Duration.ofSeconds(2));
        assertThat(TimeUtils.exponentialBackoff(base, 2)).isEqualTo(Duration.ofSeconds(4));
        assertThat(TimeUtils.exponentialBackoff(base, 3)).isEqualTo(Duration.ofSeconds(8));
    }

    @Test
    void backoffForNonPositiveAttemptIsBase() {
        assertThat(TimeUtils.exponentialBackoff(Duration.ofSeconds(2), 0)).isEqualTo(Duration.ofSeconds(2));
    }
}
