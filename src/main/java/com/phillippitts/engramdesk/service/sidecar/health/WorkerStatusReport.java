package com.phillippitts.engramdesk.service.sidecar.health;

/**
 * Fields the supervisor reads from the worker's {@code GET /api/status} body.
 * Every component is {@code null} when the worker omits it.
 *
 * @param status worker-reported status string (e.g. "ok")
 * @param memories number of stored memories
 * @param uptime worker uptime in seconds
 * @param version worker version string
 */
public record WorkerStatusReport(
        String status,
        Long memories,
        Long uptime,
        String version
) {
}
