package com.phillippitts.engramdesk.service.sidecar;

import com.phillippitts.engramdesk.config.properties.SidecarProperties;
import com.phillippitts.engramdesk.service.sidecar.event.SidecarEventChannel;
import com.phillippitts.engramdesk.service.sidecar.event.SidecarLifecycleEvent.RestartNeeded;
import com.phillippitts.engramdesk.service.sidecar.event.SidecarLifecycleEvent.StatusChanged;
import com.phillippitts.engramdesk.service.sidecar.event.SidecarNotice;
import com.phillippitts.engramdesk.service.sidecar.health.HealthProber;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ScheduledFuture;

/**
 * Periodic liveness check of a RUNNING worker.
 *
 * <p>The first check runs {@code initial-delay + interval} after startup (40s with defaults),
 * then every {@code interval}. A failed probe while RUNNING reclassifies the worker as CRASHED
 * and requests a restart. The handle is released without killing it and the restart budget
 * is left untouched.
 */
@Service
public class SidecarHealthMonitor implements SmartLifecycle {

    private static final Logger LOG = LogManager.getLogger(SidecarHealthMonitor.class);

    static final String HEALTH_CHECK_FAILED = "health check failed";

    private final SidecarState state;
    private final HealthProber prober;
    private final SidecarEventChannel channel;
    private final TaskScheduler scheduler;
    private final SidecarProperties.HealthCheck config;

    private volatile ScheduledFuture<?> task;

    public SidecarHealthMonitor(SidecarState state,
                                HealthProber prober,
                                SidecarEventChannel channel,
                                @Qualifier("sidecarScheduler") TaskScheduler scheduler,
                                SidecarProperties props) {
        this.state = state;
        this.prober = prober;
        this.channel = channel;
        this.scheduler = scheduler;
        this.config = props.getHealthCheck();
    }

    @Override
    public synchronized void start() {
        if (task != null) {
            return;
        }
        if (!config.isEnabled()) {
            LOG.info("Sidecar health loop disabled");
            return;
        }
        Duration interval = config.getInterval();
        Instant first = Instant.now().plus(config.getInitialDelay()).plus(interval);
        task = scheduler.scheduleWithFixedDelay(this::checkOnce, first, interval);
        LOG.info("Sidecar health loop scheduled: first check at {}, interval={}", first, interval);
    }

    @Override
    public synchronized void stop() {
        if (task == null) {
            return;
        }
        task.cancel(false);
        task = null;
        LOG.info("Sidecar health loop stopped");
    }

    @Override
    public boolean isRunning() {
        return task != null;
    }

    @Override
    public int getPhase() {
        return DEFAULT_PHASE - 1;
    }

    /**
     * One iteration of the loop.
     *
     * @return true if the worker was classified as crashed by this check
     */
    boolean checkOnce() {
        if (state.status() != SidecarStatus.RUNNING) {
            return false;
        }
        int port = state.port();
        if (prober.probe(port)) {
            LOG.debug("Sidecar health check ok on port {}", port);
            return false;
        }
        if (!state.crashIfRunning()) {
            // stopped or restarted while the probe was in flight
            return false;
        }
        LOG.warn("Health check failed on port {}; requesting restart", port);
        channel.publish(StatusChanged.of(SidecarNotice.CRASHED));
        channel.publish(RestartNeeded.because(HEALTH_CHECK_FAILED));
        return true;
    }
}
