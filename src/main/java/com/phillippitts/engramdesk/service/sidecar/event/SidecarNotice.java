package com.phillippitts.engramdesk.service.sidecar.event;

import java.util.Locale;

/**
 * Values carried by status-changed notifications.
 *
 * <p>{@link #FAILED} is a notification only: it is never a stored supervisor status. It marks
 * an exhausted restart budget, after which only a manual start brings the worker back.
 */
public enum SidecarNotice {
    STARTING,
    RUNNING,
    CRASHED,
    STOPPED,
    FAILED;

    /**
     * @return wire value, e.g. {@code "crashed"}
     */
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
