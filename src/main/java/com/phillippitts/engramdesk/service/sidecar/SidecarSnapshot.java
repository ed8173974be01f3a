package com.phillippitts.engramdesk.service.sidecar;

/**
 * Consistent point-in-time copy of {@link SidecarState}, taken under its lock.
 *
 * @param status lifecycle status
 * @param restartCount automatic restarts consumed from the budget
 * @param port worker port
 * @param pid OS pid of the owned worker, or -1 when no process is owned
 * @param processAttached whether a process handle is owned
 * @param adopted whether the running worker is a pre-existing listener this supervisor did not spawn
 */
public record SidecarSnapshot(
        SidecarStatus status,
        int restartCount,
        int port,
        long pid,
        boolean processAttached,
        boolean adopted
) {
    public boolean isRunning() {
        return status == SidecarStatus.RUNNING;
    }
}
