package com.phillippitts.engramdesk.util;

import java.time.Duration;
import java.time.Instant;

/**
 * Utility methods for elapsed time calculations.
 *
 * @since 1.0
 */
public final class TimeUtils {

    private TimeUtils() {
        // Utility class - prevent instantiation
    }

    /**
     * Whole seconds elapsed since the given instant; 0 if the instant is null or in the future.
     *
     * @param since start instant
     * @return elapsed seconds
     */
    public static long secondsSince(Instant since) {
        if (since == null) {
            return 0;
        }
        long seconds = Duration.between(since, Instant.now()).getSeconds();
        return Math.max(0, seconds);
    }

    /**
     * Backoff delay before the given restart attempt: {@code base * 2^(attempt-1)}.
     * With a 2s base this yields 2s, 4s, 8s for attempts 1-3.
     *
     * @param base delay before the first attempt
     * @param attempt 1-based attempt number
     * @return delay before that attempt
     */
    public static Duration exponentialBackoff(Duration base, int attempt) {
        if (attempt <= 1) {
            return base;
        }
        return base.multipliedBy(1L << Math.min(attempt - 1, 30));
    }
}
