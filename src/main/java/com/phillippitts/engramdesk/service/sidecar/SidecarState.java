package com.phillippitts.engramdesk.service.sidecar;

import com.phillippitts.engramdesk.config.properties.SidecarProperties;
import com.phillippitts.engramdesk.service.sidecar.process.SidecarProcess;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.OptionalInt;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Shared supervisor state: {status, process, restartCount, port}.
 *
 * <p><b>Thread Safety:</b> every field is read and written only while holding a single
 * {@link ReentrantLock}. Each public method is one lock acquisition, so compound
 * transitions (check-and-set, take-and-clear) are atomic. The lock is never held across
 * network I/O, sleeps or process spawning; callers do that work between transitions.
 *
 * <p><b>Invariant:</b> a process is owned iff status is STARTING or RUNNING, with two
 * exceptions: CRASHED without a process right after termination is observed, and RUNNING
 * without a process when a pre-existing listener was adopted.
 */
@Component
public class SidecarState {

    private final Lock lock = new ReentrantLock();
    private final int port;

    private SidecarStatus status = SidecarStatus.STOPPED;
    private SidecarProcess process;
    private int restartCount;
    private boolean adopted;

    @Autowired
    public SidecarState(SidecarProperties props) {
        this(props.getPort());
    }

    public SidecarState(int port) {
        this.port = port;
    }

    /**
     * Atomically claims the right to start: moves to STARTING unless already STARTING or RUNNING.
     *
     * @return true if the caller now owns the start attempt
     */
    public boolean beginStart() {
        lock.lock();
        try {
            if (status.isActive()) {
                return false;
            }
            status = SidecarStatus.STARTING;
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Claims an automatic restart: CRASHED → STARTING. Any other status means a manual
     * stop or start happened after the restart was requested.
     *
     * @return true if the caller now owns the start attempt
     */
    public boolean beginAutomaticRestart() {
        lock.lock();
        try {
            if (status != SidecarStatus.CRASHED) {
                return false;
            }
            status = SidecarStatus.STARTING;
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Treats an existing listener on the port as this worker: RUNNING, no owned process,
     * restart budget reset.
     *
     * @return true if the start attempt was still pending
     */
    public boolean adoptExisting() {
        lock.lock();
        try {
            if (status != SidecarStatus.STARTING || process != null) {
                return false;
            }
            status = SidecarStatus.RUNNING;
            adopted = true;
            restartCount = 0;
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Stores a freshly spawned handle.
     *
     * @param spawned the new handle
     * @return false if the start attempt was abandoned meanwhile (e.g. a stop ran); the caller
     *         then owns the handle and must kill it
     */
    public boolean attachProcess(SidecarProcess spawned) {
        lock.lock();
        try {
            if (status != SidecarStatus.STARTING || process != null) {
                return false;
            }
            process = spawned;
            adopted = false;
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Grace-period promotion: STARTING → RUNNING if the handle is still the owned one.
     *
     * @param candidate handle the grace task was started for
     * @param healthy whether the confirmation probe succeeded; resets the restart budget
     * @return true if promoted
     */
    public boolean promoteToRunning(SidecarProcess candidate, boolean healthy) {
        lock.lock();
        try {
            if (process != candidate || status != SidecarStatus.STARTING) {
                return false;
            }
            status = SidecarStatus.RUNNING;
            if (healthy) {
                restartCount = 0;
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Termination observed: CRASHED and handle cleared, but only if the handle is still owned.
     *
     * @param terminated handle whose termination was observed
     * @return false if the handle had already been released by stop or the health loop
     */
    public boolean crashIfCurrent(SidecarProcess terminated) {
        lock.lock();
        try {
            if (terminated == null || process != terminated) {
                return false;
            }
            process = null;
            status = SidecarStatus.CRASHED;
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * A start attempt failed before a handle was stored (resolution or spawn failure).
     *
     * @return true if the attempt was still pending and is now CRASHED
     */
    public boolean failPendingStart() {
        lock.lock();
        try {
            if (status != SidecarStatus.STARTING || process != null) {
                return false;
            }
            status = SidecarStatus.CRASHED;
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Health-loop crash classification: RUNNING → CRASHED, handle released without killing it.
     *
     * @return true if the status was RUNNING
     */
    public boolean crashIfRunning() {
        lock.lock();
        try {
            if (status != SidecarStatus.RUNNING) {
                return false;
            }
            status = SidecarStatus.CRASHED;
            process = null;
            adopted = false;
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Manual stop: takes the handle, STOPPED, restart budget reset.
     *
     * @return the released handle for the caller to kill, or null if none was owned
     */
    public SidecarProcess markStopped() {
        lock.lock();
        try {
            SidecarProcess released = process;
            process = null;
            status = SidecarStatus.STOPPED;
            restartCount = 0;
            adopted = false;
            return released;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Consumes one automatic restart from the budget.
     *
     * @param maxAttempts budget size
     * @return the 1-based attempt number, or empty if the budget is exhausted
     */
    public OptionalInt tryConsumeRestartAttempt(int maxAttempts) {
        lock.lock();
        try {
            if (restartCount >= maxAttempts) {
                return OptionalInt.empty();
            }
            restartCount++;
            return OptionalInt.of(restartCount);
        } finally {
            lock.unlock();
        }
    }

    public SidecarSnapshot snapshot() {
        lock.lock();
        try {
            return new SidecarSnapshot(status, restartCount, port,
                    process == null ? -1 : process.pid(), process != null, adopted);
        } finally {
            lock.unlock();
        }
    }

    public SidecarStatus status() {
        lock.lock();
        try {
            return status;
        } finally {
            lock.unlock();
        }
    }

    public int restartCount() {
        lock.lock();
        try {
            return restartCount;
        } finally {
            lock.unlock();
        }
    }

    /** Visible for tests and diagnostics. */
    SidecarProcess process() {
        lock.lock();
        try {
            return process;
        } finally {
            lock.unlock();
        }
    }

    /**
     * The worker port is fixed for the lifetime of the supervisor.
     */
    public int port() {
        return port;
    }
}
