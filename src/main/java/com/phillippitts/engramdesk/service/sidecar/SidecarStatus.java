package com.phillippitts.engramdesk.service.sidecar;

import java.util.Locale;

/**
 * Stored lifecycle status of the worker.
 *
 * <pre>
 * STOPPED → STARTING → RUNNING → CRASHED → STARTING → …
 * RUNNING/CRASHED → STOPPED (manual stop)
 * </pre>
 */
public enum SidecarStatus {
    STOPPED,
    STARTING,
    RUNNING,
    CRASHED;

    /**
     * @return serialized form, e.g. {@code "running"}
     */
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * @return true for the states in which a start request is a no-op
     */
    public boolean isActive() {
        return this == STARTING || this == RUNNING;
    }
}
