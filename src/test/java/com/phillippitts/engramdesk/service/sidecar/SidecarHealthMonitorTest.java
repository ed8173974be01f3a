package com.phillippitts.engramdesk.service.sidecar;

import com.phillippitts.engramdesk.config.properties.SidecarProperties;
import com.phillippitts.engramdesk.service.sidecar.event.SidecarEventChannel;
import com.phillippitts.engramdesk.service.sidecar.event.SidecarLifecycleEvent;
import com.phillippitts.engramdesk.service.sidecar.event.SidecarNotice;
import com.phillippitts.engramdesk.service.sidecar.health.HealthProber;
import com.phillippitts.engramdesk.service.sidecar.health.WorkerStatusReport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.TaskScheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class SidecarHealthMonitorTest {

    private SidecarState state;
    private SidecarEventChannel channel;
    private SidecarProperties props;
    private AtomicBoolean healthy;
    private AtomicInteger probes;
    private TaskScheduler scheduler;

    @BeforeEach
    void setUp() {
        state = new SidecarState(3838);
        channel = new SidecarEventChannel(16);
        props = new SidecarProperties();
        healthy = new AtomicBoolean(true);
        probes = new AtomicInteger();
        scheduler = mock(TaskScheduler.class);
    }

    private SidecarHealthMonitor monitor() {
        HealthProber prober = new HealthProber() {
            @Override
            public boolean probe(int port) {
                probes.incrementAndGet();
                return healthy.get();
            }

            @Override
            public Optional<WorkerStatusReport> fetchStatus(int port, Duration timeout) {
                return Optional.empty();
            }
        };
        return new SidecarHealthMonitor(state, prober, channel, scheduler, props);
    }

    private void makeRunning() {
        state.beginStart();
        state.adoptExisting();
    }

    @Test
    void failedProbeWhileRunningRequestsRestart() throws InterruptedException {
        makeRunning();
        healthy.set(false);

        boolean crashed = monitor().checkOnce();

        assertThat(crashed).isTrue();
        assertThat(state.status()).isEqualTo(SidecarStatus.CRASHED);
        assertThat(channel.poll(Duration.ofSeconds(1)))
                .isInstanceOfSatisfying(SidecarLifecycleEvent.StatusChanged.class,
                        e -> assertThat(e.notice()).isEqualTo(SidecarNotice.CRASHED));
        assertThat(channel.poll(Duration.ofSeconds(1)))
                .isInstanceOfSatisfying(SidecarLifecycleEvent.RestartNeeded.class,
                        e -> assertThat(e.reason()).isEqualTo("health check failed"));
    }

    @Test
    void healthCheckCrashDoesNotConsumeRestartBudget() {
        makeRunning();
        healthy.set(false);

        monitor().checkOnce();

        assertThat(state.restartCount()).isZero();
    }

    @Test
    void healthyProbeChangesNothing() {
        makeRunning();

        assertThat(monitor().checkOnce()).isFalse();

        assertThat(state.status()).isEqualTo(SidecarStatus.RUNNING);
        assertThat(channel.size()).isZero();
        assertThat(probes.get()).isEqualTo(1);
    }

    @Test
    void notRunningSkipsProbe() {
        healthy.set(false);
        SidecarHealthMonitor monitor = monitor();

        assertThat(monitor.checkOnce()).isFalse();
        state.beginStart();
        assertThat(monitor.checkOnce()).isFalse();

        assertThat(probes.get()).isZero();
        assertThat(state.status()).isEqualTo(SidecarStatus.STARTING);
        assertThat(channel.size()).isZero();
    }

    @Test
    void firstCheckScheduledAfterInitialDelayPlusInterval() {
        ScheduledFuture<?> future = mock(ScheduledFuture.class);
        doReturn(future).when(scheduler)
                .scheduleWithFixedDelay(any(Runnable.class), any(Instant.class), any(Duration.class));
        SidecarHealthMonitor monitor = monitor();
        Instant before = Instant.now();

        monitor.start();

        verify(scheduler).scheduleWithFixedDelay(any(Runnable.class),
                argThat((Instant first) ->
                        !first.isBefore(before.plusSeconds(40)) && first.isBefore(before.plusSeconds(41))),
                eq(Duration.ofSeconds(30)));
        assertThat(monitor.isRunning()).isTrue();

        monitor.stop();

        verify(future).cancel(false);
        assertThat(monitor.isRunning()).isFalse();
    }

    @Test
    void disabledLoopIsNeverScheduled() {
        props.getHealthCheck().setEnabled(false);
        SidecarHealthMonitor monitor = monitor();

        monitor.start();

        verify(scheduler, never()).scheduleWithFixedDelay(any(Runnable.class), any(Instant.class), any(Duration.class));
        assertThat(monitor.isRunning()).isFalse();
    }
}
