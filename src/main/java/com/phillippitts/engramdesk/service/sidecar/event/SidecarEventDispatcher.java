package com.phillippitts.engramdesk.service.sidecar.event;

import com.phillippitts.engramdesk.exception.EngramDeskException;
import com.phillippitts.engramdesk.service.sidecar.SidecarLifecycleController;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

/**
 * Single consumer of the {@link SidecarEventChannel}.
 *
 * <p>{@link SidecarLifecycleEvent.RestartNeeded} becomes a call to
 * {@link SidecarLifecycleController#restartAfterCrash()}, which is a no-op once a manual stop
 * or start has moved the worker out of CRASHED; {@link SidecarLifecycleEvent.StatusChanged} is
 * republished as a {@link SidecarStatusChangedEvent} Spring application event for the UI shell
 * and any other observer. Delivery order follows publish order.
 */
@Component
public class SidecarEventDispatcher implements SmartLifecycle {

    private static final Logger LOG = LogManager.getLogger(SidecarEventDispatcher.class);

    private final SidecarEventChannel channel;
    private final SidecarLifecycleController controller;
    private final ApplicationEventPublisher publisher;

    private volatile Thread consumer;

    public SidecarEventDispatcher(SidecarEventChannel channel,
                                  SidecarLifecycleController controller,
                                  ApplicationEventPublisher publisher) {
        this.channel = channel;
        this.controller = controller;
        this.publisher = publisher;
    }

    @Override
    public synchronized void start() {
        if (consumer != null) {
            return;
        }
        Thread t = new Thread(this::consumeLoop, "sidecar-events");
        t.setDaemon(true);
        consumer = t;
        t.start();
        LOG.debug("Sidecar event dispatcher started");
    }

    @Override
    public synchronized void stop() {
        Thread t = consumer;
        if (t == null) {
            return;
        }
        consumer = null;
        t.interrupt();
        LOG.debug("Sidecar event dispatcher stopped");
    }

    @Override
    public boolean isRunning() {
        return consumer != null;
    }

    @Override
    public int getPhase() {
        return DEFAULT_PHASE - 2;
    }

    private void consumeLoop() {
        while (!Thread.currentThread().isInterrupted()) {
            SidecarLifecycleEvent event;
            try {
                event = channel.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            dispatch(event);
        }
    }

    void dispatch(SidecarLifecycleEvent event) {
        if (event instanceof SidecarLifecycleEvent.RestartNeeded restart) {
            LOG.info("Restarting sidecar: {}", restart.reason());
            try {
                controller.restartAfterCrash();
            } catch (EngramDeskException e) {
                LOG.error("Automatic restart failed: {}", e.getMessage());
            } catch (RuntimeException e) {
                LOG.error("Automatic restart failed unexpectedly", e);
            }
        } else if (event instanceof SidecarLifecycleEvent.StatusChanged changed) {
            publisher.publishEvent(new SidecarStatusChangedEvent(changed.notice().value(), changed.at()));
        }
    }
}
