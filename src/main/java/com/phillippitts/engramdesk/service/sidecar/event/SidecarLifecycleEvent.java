package com.phillippitts.engramdesk.service.sidecar.event;

import java.time.Instant;
import java.util.Objects;

/**
 * Events carried by the {@link SidecarEventChannel}.
 */
public interface SidecarLifecycleEvent {

    Instant at();

    /** The supervisor's externally visible status changed. */
    record StatusChanged(SidecarNotice notice, Instant at) implements SidecarLifecycleEvent {
        public StatusChanged {
            Objects.requireNonNull(notice, "notice");
            if (at == null) {
                at = Instant.now();
            }
        }

        public static StatusChanged of(SidecarNotice notice) {
            return new StatusChanged(notice, Instant.now());
        }
    }

    /** The worker should be (re)started by the consumer of the channel. */
    record RestartNeeded(String reason, Instant at) implements SidecarLifecycleEvent {
        public RestartNeeded {
            if (at == null) {
                at = Instant.now();
            }
        }

        public static RestartNeeded because(String reason) {
            return new RestartNeeded(reason, Instant.now());
        }
    }
}
