package com.phillippitts.engramdesk.service.sidecar.health;

import java.time.Duration;
import java.util.Optional;

/**
 * Probes the worker's HTTP status endpoint. Implementations never throw to the caller:
 * transport errors, timeouts and non-success codes are reported as failure.
 */
public interface HealthProber {

    /**
     * Background probe with the configured health-probe timeout.
     *
     * @param port worker port
     * @return true iff {@code GET /api/status} answered with a 2xx status code
     */
    boolean probe(int port);

    /**
     * Fetches and parses the worker status.
     *
     * @param port worker port
     * @param timeout request timeout
     * @return parsed status, or empty if unreachable, non-2xx or unparseable
     */
    Optional<WorkerStatusReport> fetchStatus(int port, Duration timeout);
}
