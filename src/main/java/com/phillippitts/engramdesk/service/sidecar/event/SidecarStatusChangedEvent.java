package com.phillippitts.engramdesk.service.sidecar.event;

import java.time.Instant;

/**
 * Published on the Spring application event bus for observers outside the supervisor
 * (status views, tray integrations, metrics).
 *
 * @param value one of "starting", "running", "crashed", "stopped", "failed"
 * @param at when the supervisor emitted the notice
 */
public record SidecarStatusChangedEvent(String value, Instant at) {
    public SidecarStatusChangedEvent {
        if (at == null) {
            at = Instant.now();
        }
    }

    public boolean isFailure() {
        return SidecarNotice.FAILED.value().equals(value);
    }
}
