package com.phillippitts.engramdesk.testutil;

import com.phillippitts.engramdesk.service.sidecar.Sleeper;

import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;

/**
 * {@link Sleeper} that records requested delays and returns at once, except for "held"
 * durations, which block until {@link #release()}.
 */
public class RecordingSleeper implements Sleeper {

    private final List<Duration> requested = new CopyOnWriteArrayList<>();
    private final Set<Duration> held;
    private final CountDownLatch gate = new CountDownLatch(1);

    public RecordingSleeper(Duration... held) {
        this.held = Set.of(held);
    }

    @Override
    public void sleep(Duration duration) throws InterruptedException {
        requested.add(duration);
        if (held.contains(duration)) {
            gate.await();
        }
    }

    /** Lets every held sleep, current and future, complete. */
    public void release() {
        gate.countDown();
    }

    public List<Duration> requested() {
        return List.copyOf(requested);
    }

    public List<Duration> requestedExcept(Duration excluded) {
        return requested.stream().filter(d -> !d.equals(excluded)).toList();
    }
}
