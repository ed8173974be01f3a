package com.phillippitts.engramdesk.util;

import java.time.Duration;

/**
 * Standard timeout values for worker process and thread management.
 *
 * <p><b>Usage:</b> Used by {@link com.phillippitts.engramdesk.service.sidecar.process.SidecarProcess}
 * for stream draining and termination.
 *
 * @since 1.0
 */
public final class ProcessTimeouts {

    /**
     * Timeout for stream gobbler threads to flush buffered output after the worker exits,
     * before the termination event is emitted.
     */
    public static final Duration GOBBLER_FLUSH_TIMEOUT = Duration.ofMillis(500);

    /**
     * Timeout for graceful termination via {@link Process#destroy()} (SIGTERM on Unix).
     *
     * <p>The worker closes its HTTP listener and database on SIGTERM; two seconds covers
     * a normal shutdown.
     */
    public static final Duration GRACEFUL_SHUTDOWN_TIMEOUT = Duration.ofSeconds(2);

    /**
     * Timeout for forceful termination via {@link Process#destroyForcibly()}.
     *
     * <p>Processes that survive this are reported through
     * {@link com.phillippitts.engramdesk.exception.SidecarKillException}.
     */
    public static final Duration FORCEFUL_SHUTDOWN_TIMEOUT = Duration.ofMillis(1000);

    private ProcessTimeouts() {
        // Utility class - prevent instantiation
    }
}
