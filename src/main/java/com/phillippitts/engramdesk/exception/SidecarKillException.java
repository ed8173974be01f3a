package com.phillippitts.engramdesk.exception;

/**
 * Thrown when a worker process could not be terminated. Supervisor state is cleared
 * regardless, so this is reported but never leaves a dead handle behind.
 */
public class SidecarKillException extends EngramDeskException {

    private final long pid;

    public SidecarKillException(long pid, String reason) {
        super("Failed to kill sidecar (pid=" + pid + "): " + reason);
        this.pid = pid;
    }

    public SidecarKillException(long pid, String reason, Throwable cause) {
        super("Failed to kill sidecar (pid=" + pid + "): " + reason, cause);
        this.pid = pid;
    }

    public long getPid() {
        return pid;
    }
}
