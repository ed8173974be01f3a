package com.phillippitts.engramdesk.service.sidecar.process;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * Single-pass stream of {@link ProcessEvent}s for one worker process.
 *
 * <p>Producers are the stream gobblers and the exit watcher of {@link SidecarProcess}.
 * Events emitted after the terminal event are discarded. Once the consumer has taken the
 * terminal event, {@link #next()} returns {@code null} forever.
 */
public final class ProcessEventStream {

    private final BlockingQueue<ProcessEvent> queue = new LinkedBlockingQueue<>();
    private boolean terminalEmitted;
    private volatile boolean exhausted;

    synchronized void emit(ProcessEvent event) {
        if (terminalEmitted) {
            return;
        }
        if (event.isTerminal()) {
            terminalEmitted = true;
        }
        queue.add(event);
    }

    /**
     * Blocks until the next event is available.
     *
     * @return next event, or {@code null} if the stream is exhausted
     * @throws InterruptedException if the consumer is interrupted while waiting
     */
    public ProcessEvent next() throws InterruptedException {
        if (exhausted) {
            return null;
        }
        ProcessEvent event = queue.take();
        if (event.isTerminal()) {
            exhausted = true;
        }
        return event;
    }

    public boolean isExhausted() {
        return exhausted;
    }
}
