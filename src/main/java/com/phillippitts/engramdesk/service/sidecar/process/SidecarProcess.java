package com.phillippitts.engramdesk.service.sidecar.process;

import com.phillippitts.engramdesk.exception.SidecarKillException;
import com.phillippitts.engramdesk.service.sidecar.locator.CommandSpec;
import com.phillippitts.engramdesk.util.ProcessTimeouts;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * An owned worker process.
 *
 * <p>Responsibilities:
 * - Drain stdout and stderr continuously on daemon threads so the worker never blocks on a full pipe
 * - Publish each line, then exactly one terminal event, to a single-pass {@link ProcessEventStream}
 * - Terminate the worker on request, gracefully first, then forcibly
 *
 * <p>Instances are compared by identity: the supervisor uses the handle itself to tell whether
 * an event belongs to the worker it currently owns.
 */
public final class SidecarProcess {

    private static final Logger LOG = LogManager.getLogger(SidecarProcess.class);

    private final Process process;
    private final CommandSpec command;
    private final Instant startedAt;
    private final ProcessEventStream events = new ProcessEventStream();

    private SidecarProcess(Process process, CommandSpec command) {
        this.process = Objects.requireNonNull(process, "process");
        this.command = Objects.requireNonNull(command, "command");
        this.startedAt = Instant.now();
    }

    /**
     * Wraps a freshly started process and begins streaming its output.
     *
     * @param process started OS process
     * @param command command it was started with
     * @return owned handle
     */
    static SidecarProcess attach(Process process, CommandSpec command) {
        SidecarProcess handle = new SidecarProcess(process, command);
        handle.startPumps();
        return handle;
    }

    private void startPumps() {
        long pid = pid();
        Thread out = startGobbler(process.getInputStream(), ProcessEvent.StdoutLine::new, "sidecar-out-" + pid);
        Thread err = startGobbler(process.getErrorStream(), ProcessEvent.StderrLine::new, "sidecar-err-" + pid);
        Thread watcher = new Thread(() -> awaitExit(out, err), "sidecar-exit-" + pid);
        watcher.setDaemon(true);
        watcher.start();
    }

    private void awaitExit(Thread out, Thread err) {
        try {
            int code = process.waitFor();
            // Let gobblers flush the last lines before the terminal event closes the stream
            joinQuietly(out, ProcessTimeouts.GOBBLER_FLUSH_TIMEOUT);
            joinQuietly(err, ProcessTimeouts.GOBBLER_FLUSH_TIMEOUT);
            events.emit(ProcessEvent.Terminated.fromExitCode(code));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            events.emit(new ProcessEvent.SpawnFailed(e));
        } catch (RuntimeException e) {
            LOG.warn("Exit watcher for pid {} failed: {}", pid(), e.toString());
            events.emit(new ProcessEvent.SpawnFailed(e));
        }
    }

    private Thread startGobbler(InputStream inputStream, Function<String, ProcessEvent> toEvent, String name) {
        Thread thread = new Thread(new StreamGobbler(inputStream, toEvent, events, name), name);
        thread.setDaemon(true);
        thread.start();
        return thread;
    }

    /**
     * Reads lines from one of the worker's output streams until EOF and emits one event per line.
     */
    private static final class StreamGobbler implements Runnable {
        private final InputStream inputStream;
        private final Function<String, ProcessEvent> toEvent;
        private final ProcessEventStream sink;
        private final String name;

        StreamGobbler(InputStream inputStream, Function<String, ProcessEvent> toEvent,
                      ProcessEventStream sink, String name) {
            this.inputStream = inputStream;
            this.toEvent = toEvent;
            this.sink = sink;
            this.name = name;
        }

        @Override
        public void run() {
            try (BufferedReader br = new BufferedReader(new InputStreamReader(inputStream, StandardCharsets.UTF_8))) {
                String line;
                while ((line = br.readLine()) != null) {
                    sink.emit(toEvent.apply(line));
                }
            } catch (IOException e) {
                LOG.debug("Stream gobbler '{}' stopped: {}", name, e.toString());
            }
        }
    }

    private static void joinQuietly(Thread thread, Duration timeout) {
        try {
            thread.join(timeout.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Terminates the worker: {@link Process#destroy()}, then {@link Process#destroyForcibly()}
     * if it does not exit in time. No-op if the worker already exited.
     *
     * @throws SidecarKillException if the worker is still alive afterwards
     */
    public void kill() {
        if (!process.isAlive()) {
            return;
        }
        try {
            process.destroy();
            boolean exited = process.waitFor(ProcessTimeouts.GRACEFUL_SHUTDOWN_TIMEOUT.toMillis(),
                    TimeUnit.MILLISECONDS);
            if (!exited && process.isAlive()) {
                LOG.warn("Sidecar pid {} ignored SIGTERM; forcing", pid());
                process.destroyForcibly();
                process.waitFor(ProcessTimeouts.FORCEFUL_SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
                if (process.isAlive()) {
                    throw new SidecarKillException(pid(), "still alive after destroyForcibly");
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SidecarKillException(pid(), "interrupted while waiting for exit", e);
        } catch (SidecarKillException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new SidecarKillException(pid(), e.toString(), e);
        }
    }

    /**
     * @return the event stream of this worker; consume it exactly once
     */
    public ProcessEventStream events() {
        return events;
    }

    public boolean isAlive() {
        return process.isAlive();
    }

    /**
     * @return OS process id, or -1 if the platform does not expose it
     */
    public long pid() {
        try {
            return process.pid();
        } catch (UnsupportedOperationException e) {
            return -1;
        }
    }

    public CommandSpec command() {
        return command;
    }

    public Instant startedAt() {
        return startedAt;
    }

    @Override
    public String toString() {
        return "SidecarProcess[pid=" + pid() + ", source=" + command.source() + "]";
    }
}
