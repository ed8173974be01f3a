package com.phillippitts.engramdesk.service.sidecar;

import com.phillippitts.engramdesk.config.properties.SidecarProperties;
import com.phillippitts.engramdesk.service.sidecar.health.HealthProber;
import com.phillippitts.engramdesk.service.sidecar.health.WorkerStatusReport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SidecarCommandServiceTest {

    private SidecarLifecycleController controller;
    private SidecarState state;
    private HealthProber prober;
    private SidecarCommandService service;

    @BeforeEach
    void setUp() {
        controller = mock(SidecarLifecycleController.class);
        state = new SidecarState(3838);
        prober = mock(HealthProber.class);
        service = new SidecarCommandService(controller, state, prober, new SidecarProperties());
    }

    @Test
    void stoppedStatusFallsBackToLifecycleState() {
        SidecarStatusView view = service.getStatus();

        assertThat(view.running()).isFalse();
        assertThat(view.status()).isEqualTo("stopped");
        assertThat(view.port()).isEqualTo(3838);
        assertThat(view.memoryCount()).isZero();
        assertThat(view.uptime()).isNull();
        assertThat(view.version()).isEqualTo("unknown");
        verify(prober, never()).fetchStatus(anyInt(), any());
    }

    @Test
    void runningStatusUsesLiveReport() {
        state.beginStart();
        state.adoptExisting();
        when(prober.fetchStatus(eq(3838), eq(Duration.ofSeconds(3))))
                .thenReturn(Optional.of(new WorkerStatusReport("ok", 42L, 120L, "1.4.0")));

        SidecarStatusView view = service.getStatus();

        assertThat(view.running()).isTrue();
        assertThat(view.status()).isEqualTo("ok");
        assertThat(view.memoryCount()).isEqualTo(42L);
        assertThat(view.uptime()).isEqualTo(120L);
        assertThat(view.version()).isEqualTo("1.4.0");
    }

    @Test
    void liveReportWithMissingFieldsUsesDefaults() {
        state.beginStart();
        state.adoptExisting();
        when(prober.fetchStatus(eq(3838), eq(Duration.ofSeconds(3))))
                .thenReturn(Optional.of(new WorkerStatusReport(null, null, null, null)));

        SidecarStatusView view = service.getStatus();

        assertThat(view.running()).isTrue();
        assertThat(view.status()).isEqualTo("running");
        assertThat(view.memoryCount()).isZero();
        assertThat(view.version()).isEqualTo("unknown");
    }

    @Test
    void unreachableRunningWorkerReportsNotRunning() {
        state.beginStart();
        state.adoptExisting();
        when(prober.fetchStatus(eq(3838), eq(Duration.ofSeconds(3)))).thenReturn(Optional.empty());

        SidecarStatusView view = service.getStatus();

        assertThat(view.running()).isFalse();
        assertThat(view.status()).isEqualTo("running");
        assertThat(view.uptime()).isNull();
    }

    @Test
    void checkHealthProbesConfiguredPort() {
        when(prober.probe(3838)).thenReturn(true);

        assertThat(service.checkHealth()).isTrue();
    }

    @Test
    void commandsDelegateToController() {
        service.start();
        service.stop();
        service.restart();

        verify(controller).start();
        verify(controller).stop();
        verify(controller).restart();
    }
}
