package com.phillippitts.engramdesk.service.events;

import com.phillippitts.engramdesk.service.sidecar.event.SidecarStatusChangedEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Central observer of sidecar status notices. Every transition is logged at INFO; an exhausted
 * restart budget is raised as a user-facing error, throttled to avoid log spam.
 */
@Component
class SidecarEventsListener {
    private static final Logger LOG = LogManager.getLogger(SidecarEventsListener.class);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private static final Duration THROTTLE = Duration.ofMinutes(1);

    @EventListener
    void onStatusChanged(SidecarStatusChangedEvent e) {
        LOG.info("Sidecar status: {}", e.value());
        if (e.isFailure() && shouldLog("sidecar-failed")) {
            LOG.error("Memory service could not be kept running and auto-restart was abandoned. "
                    + "Check the [engram stderr] lines above, then POST /api/sidecar/start to retry.");
        }
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = Instant.now();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
