package com.phillippitts.engramdesk.service.sidecar.event;

import com.phillippitts.engramdesk.config.properties.SidecarProperties;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Bounded, single-consumer channel between crash detection and the restart action.
 *
 * <p>Any task may publish. Only {@link SidecarEventDispatcher} consumes. When the channel is
 * full, a publisher waits up to {@link #PUBLISH_TIMEOUT} and then drops the event with a warning.
 */
@Component
public class SidecarEventChannel {

    private static final Logger LOG = LogManager.getLogger(SidecarEventChannel.class);

    static final Duration PUBLISH_TIMEOUT = Duration.ofSeconds(1);

    private final BlockingQueue<SidecarLifecycleEvent> queue;

    @Autowired
    public SidecarEventChannel(SidecarProperties props) {
        this(props.getChannelCapacity());
    }

    public SidecarEventChannel(int capacity) {
        this.queue = new ArrayBlockingQueue<>(capacity);
    }

    /**
     * Enqueues an event.
     *
     * @param event event to deliver
     * @return true if enqueued, false if dropped
     */
    public boolean publish(SidecarLifecycleEvent event) {
        Objects.requireNonNull(event, "event");
        try {
            if (queue.offer(event, PUBLISH_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
                return true;
            }
            LOG.warn("Sidecar event channel full; dropping {}", event);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while publishing {}; dropped", event);
        }
        return false;
    }

    /**
     * Blocks until an event is available.
     */
    public SidecarLifecycleEvent take() throws InterruptedException {
        return queue.take();
    }

    /**
     * Waits up to the timeout for an event.
     *
     * @return next event, or null on timeout
     */
    public SidecarLifecycleEvent poll(Duration timeout) throws InterruptedException {
        return queue.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public int size() {
        return queue.size();
    }
}
