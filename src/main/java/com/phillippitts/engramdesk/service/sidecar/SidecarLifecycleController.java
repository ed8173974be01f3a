package com.phillippitts.engramdesk.service.sidecar;

import com.phillippitts.engramdesk.config.properties.SidecarProperties;
import com.phillippitts.engramdesk.exception.ExecutableNotFoundException;
import com.phillippitts.engramdesk.exception.SidecarKillException;
import com.phillippitts.engramdesk.exception.SidecarSpawnException;
import com.phillippitts.engramdesk.service.sidecar.event.SidecarEventChannel;
import com.phillippitts.engramdesk.service.sidecar.event.SidecarLifecycleEvent.RestartNeeded;
import com.phillippitts.engramdesk.service.sidecar.event.SidecarLifecycleEvent.StatusChanged;
import com.phillippitts.engramdesk.service.sidecar.event.SidecarNotice;
import com.phillippitts.engramdesk.service.sidecar.health.HealthProber;
import com.phillippitts.engramdesk.service.sidecar.health.PortProbe;
import com.phillippitts.engramdesk.service.sidecar.locator.CommandSpec;
import com.phillippitts.engramdesk.service.sidecar.locator.ExecutableLocator;
import com.phillippitts.engramdesk.service.sidecar.locator.LocatorEnvironment;
import com.phillippitts.engramdesk.service.sidecar.process.ProcessEvent;
import com.phillippitts.engramdesk.service.sidecar.process.ProcessEventStream;
import com.phillippitts.engramdesk.service.sidecar.process.SidecarProcess;
import com.phillippitts.engramdesk.service.sidecar.process.SidecarProcessLauncher;
import com.phillippitts.engramdesk.util.LogSanitizer;
import com.phillippitts.engramdesk.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Owns every transition of {@link SidecarState}: start, stop, restart, crash detection
 * and the restart policy.
 *
 * <p>Per spawn, two detached tasks run on the sidecar task group:
 * <ul>
 *   <li>an output monitor that logs worker output and reacts to the single terminal event</li>
 *   <li>a grace-period confirmation that optimistically marks the worker RUNNING</li>
 * </ul>
 * Both communicate only through the state and the {@link SidecarEventChannel}. A
 * {@link RestartNeeded} event is turned back into {@link #start()} by the channel's consumer.
 *
 * <p>Restart policy: each crash consumes one attempt from a budget of
 * {@code sidecar.max-restart-attempts} (default 3) and waits {@code backoff-base * 2^(n-1)}
 * (2s, 4s, 8s) before requesting the restart. Spawn failures skip the wait. An exhausted budget
 * is reported as "failed" and left for a manual start.
 */
@Service
public class SidecarLifecycleController {

    private static final Logger LOG = LogManager.getLogger(SidecarLifecycleController.class);

    private static final int MAX_LOGGED_LINE = 2000;

    private final SidecarState state;
    private final SidecarProperties props;
    private final ExecutableLocator locator;
    private final SidecarProcessLauncher launcher;
    private final HealthProber prober;
    private final PortProbe portProbe;
    private final SidecarEventChannel channel;
    private final Executor taskGroup;
    private final Sleeper sleeper;

    @Autowired
    public SidecarLifecycleController(SidecarState state,
                                      SidecarProperties props,
                                      ExecutableLocator locator,
                                      SidecarProcessLauncher launcher,
                                      HealthProber prober,
                                      PortProbe portProbe,
                                      SidecarEventChannel channel,
                                      @Qualifier("sidecarExecutor") Executor taskGroup) {
        this(state, props, locator, launcher, prober, portProbe, channel, taskGroup, Sleeper.SYSTEM);
    }

    SidecarLifecycleController(SidecarState state,
                               SidecarProperties props,
                               ExecutableLocator locator,
                               SidecarProcessLauncher launcher,
                               HealthProber prober,
                               PortProbe portProbe,
                               SidecarEventChannel channel,
                               Executor taskGroup,
                               Sleeper sleeper) {
        this.state = Objects.requireNonNull(state, "state");
        this.props = Objects.requireNonNull(props, "props");
        this.locator = Objects.requireNonNull(locator, "locator");
        this.launcher = Objects.requireNonNull(launcher, "launcher");
        this.prober = Objects.requireNonNull(prober, "prober");
        this.portProbe = Objects.requireNonNull(portProbe, "portProbe");
        this.channel = Objects.requireNonNull(channel, "channel");
        this.taskGroup = Objects.requireNonNull(taskGroup, "taskGroup");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    }

    /**
     * Starts the worker unless it is already STARTING or RUNNING.
     *
     * <p>Returns as soon as the process is spawned; readiness is observed asynchronously.
     * If something already listens on the port it is adopted instead of spawning.
     *
     * @throws ExecutableNotFoundException if the worker cannot be located (status becomes CRASHED)
     * @throws SidecarSpawnException if the OS refuses to spawn it (status becomes CRASHED and an
     *         immediate restart is requested while budget remains), or if the task group cannot
     *         take the supervision tasks (the fresh process is killed, status becomes CRASHED)
     */
    public void start() {
        if (!state.beginStart()) {
            LOG.debug("Start ignored: sidecar already {}", state.status().value());
            return;
        }
        startClaimed();
    }

    /**
     * Restart requested by the restart policy or the health loop. Only proceeds while the
     * worker is still CRASHED, so a manual stop or start issued after the request wins.
     *
     * @throws ExecutableNotFoundException as for {@link #start()}
     * @throws SidecarSpawnException as for {@link #start()}
     */
    public void restartAfterCrash() {
        if (!state.beginAutomaticRestart()) {
            LOG.info("Automatic restart skipped: sidecar is now {}", state.status().value());
            return;
        }
        startClaimed();
    }

    private void startClaimed() {
        int port = state.port();

        if (portProbe.isListening(port, props.getAdoptionProbeTimeout())) {
            if (state.adoptExisting()) {
                LOG.info("Port {} already in use, attaching to existing instance", port);
                notify(SidecarNotice.RUNNING);
            }
            return;
        }

        CommandSpec command;
        try {
            command = locator.locate(LocatorEnvironment.detect(props.getLocator(), port));
        } catch (ExecutableNotFoundException e) {
            LOG.error("Cannot start sidecar: {}", e.getMessage());
            if (state.failPendingStart()) {
                notify(SidecarNotice.CRASHED);
            }
            throw e;
        }

        SidecarProcess process;
        try {
            process = launcher.spawn(command);
        } catch (SidecarSpawnException e) {
            LOG.error("{} (cmd={})", e.getMessage(), e.getCommandLine());
            if (state.failPendingStart()) {
                notify(SidecarNotice.CRASHED);
                applyRestartPolicy(false, "spawn failed");
            }
            throw e;
        }

        if (!state.attachProcess(process)) {
            LOG.warn("Start attempt superseded while spawning; killing {}", process);
            killQuietly(process);
            return;
        }
        notify(SidecarNotice.STARTING);

        try {
            taskGroup.execute(() -> monitor(process));
            taskGroup.execute(() -> confirmAfterGracePeriod(process));
        } catch (RejectedExecutionException e) {
            // no worker may run without an output monitor
            LOG.error("Sidecar task group rejected supervision of {}; killing it", process);
            if (state.crashIfCurrent(process)) {
                notify(SidecarNotice.CRASHED);
            }
            killQuietly(process);
            throw new SidecarSpawnException(command.commandLine(),
                    new RejectedExecutionException("sidecar task group saturated", e));
        }
    }

    /**
     * Stops the worker: releases and kills the owned process, STOPPED, restart budget reset,
     * "stopped" published. Safe to call when nothing runs.
     *
     * @throws SidecarKillException if the process survived termination; state is cleared anyway
     */
    public void stop() {
        SidecarProcess released = state.markStopped();
        SidecarKillException failure = null;
        if (released != null) {
            try {
                released.kill();
                LOG.info("Sidecar stopped (pid={})", released.pid());
            } catch (SidecarKillException e) {
                LOG.error("Failed to kill sidecar: {}", e.getMessage());
                failure = e;
            }
        }
        notify(SidecarNotice.STOPPED);
        if (failure != null) {
            throw failure;
        }
    }

    /**
     * Stop, wait the cooldown so the port and file locks are released, then start.
     */
    public void restart() {
        try {
            stop();
        } catch (SidecarKillException e) {
            LOG.warn("Continuing restart after kill failure: {}", e.getMessage());
        }
        try {
            sleeper.sleep(props.getRestartCooldown());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Restart interrupted during cooldown; sidecar left stopped");
            return;
        }
        start();
    }

    /** Consumes the worker's events until the terminal one. */
    void monitor(SidecarProcess process) {
        ThreadContext.put("sidecarPid", String.valueOf(process.pid()));
        try {
            ProcessEventStream events = process.events();
            ProcessEvent event;
            while ((event = events.next()) != null) {
                if (event instanceof ProcessEvent.StdoutLine out) {
                    LOG.info("[engram stdout] {}", LogSanitizer.line(out.line(), MAX_LOGGED_LINE));
                } else if (event instanceof ProcessEvent.StderrLine err) {
                    LOG.warn("[engram stderr] {}", LogSanitizer.line(err.line(), MAX_LOGGED_LINE));
                } else if (event instanceof ProcessEvent.Terminated terminated) {
                    onTerminated(process, terminated);
                } else if (event instanceof ProcessEvent.SpawnFailed failed) {
                    onSpawnFailed(process, failed);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.debug("Output monitor for {} interrupted", process);
        } finally {
            ThreadContext.remove("sidecarPid");
        }
    }

    private void onTerminated(SidecarProcess process, ProcessEvent.Terminated terminated) {
        LOG.warn("Process terminated with code: {}, signal: {} after {}s",
                terminated.exitCode(), terminated.signal(), TimeUtils.secondsSince(process.startedAt()));
        if (!state.crashIfCurrent(process)) {
            LOG.info("Termination of released {} ignored", process);
            return;
        }
        notify(SidecarNotice.CRASHED);
        applyRestartPolicy(true, "exit code " + terminated.exitCode());
    }

    private void onSpawnFailed(SidecarProcess process, ProcessEvent.SpawnFailed failed) {
        LOG.error("Process error: {}", String.valueOf(failed.error()));
        if (!state.crashIfCurrent(process)) {
            return;
        }
        notify(SidecarNotice.CRASHED);
        applyRestartPolicy(false, "process error");
    }

    /**
     * Consumes one restart attempt and, after the backoff, requests a restart; reports
     * "failed" when the budget is exhausted.
     */
    private void applyRestartPolicy(boolean withBackoff, String reason) {
        int max = props.getMaxRestartAttempts();
        OptionalInt attempt = state.tryConsumeRestartAttempt(max);
        if (attempt.isEmpty()) {
            LOG.error("Sidecar crashed {} times. Giving up auto-restart.", max);
            notify(SidecarNotice.FAILED);
            return;
        }
        int n = attempt.getAsInt();
        LOG.warn("Sidecar crashed. Will restart (attempt {}/{})", n, max);
        if (withBackoff) {
            Duration delay = TimeUtils.exponentialBackoff(props.getBackoffBase(), n);
            try {
                sleeper.sleep(delay);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                LOG.debug("Backoff before attempt {} interrupted", n);
                return;
            }
            if (state.status() != SidecarStatus.CRASHED) {
                // a manual start or stop happened during the backoff
                LOG.info("Restart attempt {} skipped: sidecar is now {}", n, state.status().value());
                return;
            }
        }
        channel.publish(RestartNeeded.because(reason + ", attempt " + n + "/" + max));
    }

    /** Waits the grace period, probes once and marks the worker RUNNING either way. */
    void confirmAfterGracePeriod(SidecarProcess process) {
        try {
            sleeper.sleep(props.getGracePeriod());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return;
        }
        int port = state.port();
        boolean healthy = prober.probe(port);
        if (!state.promoteToRunning(process, healthy)) {
            LOG.debug("Grace-period confirmation for {} superseded", process);
            return;
        }
        if (healthy) {
            LOG.info("Sidecar started successfully on port {}", port);
        } else {
            LOG.info("Sidecar started (health check pending)");
        }
        notify(SidecarNotice.RUNNING);
    }

    private void killQuietly(SidecarProcess process) {
        try {
            process.kill();
        } catch (SidecarKillException e) {
            LOG.error("Failed to kill orphaned sidecar: {}", e.getMessage());
        }
    }

    private void notify(SidecarNotice notice) {
        channel.publish(StatusChanged.of(notice));
    }
}
