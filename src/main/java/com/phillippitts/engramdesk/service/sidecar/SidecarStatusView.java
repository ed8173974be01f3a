package com.phillippitts.engramdesk.service.sidecar;

/**
 * Status answer returned to collaborators.
 *
 * @param running true iff the worker answered a live status fetch
 * @param status worker-reported status when live, otherwise the lifecycle status in lowercase
 * @param port worker port
 * @param memoryCount stored memories, 0 when unknown
 * @param uptime worker uptime in seconds, null when not live
 * @param version worker version, "unknown" when not reported
 * @param restartCount automatic restarts consumed since the last healthy start
 */
public record SidecarStatusView(
        boolean running,
        String status,
        int port,
        long memoryCount,
        Long uptime,
        String version,
        int restartCount
) {
    static final String UNKNOWN_VERSION = "unknown";
}
