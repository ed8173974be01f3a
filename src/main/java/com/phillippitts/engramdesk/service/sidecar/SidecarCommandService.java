package com.phillippitts.engramdesk.service.sidecar;

import com.phillippitts.engramdesk.config.properties.SidecarProperties;
import com.phillippitts.engramdesk.service.sidecar.health.HealthProber;
import com.phillippitts.engramdesk.service.sidecar.health.WorkerStatusReport;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Collaborator-facing commands. Thin facade over {@link SidecarLifecycleController} plus the
 * status query, which combines lifecycle state with a live fetch from the worker.
 */
@Service
public class SidecarCommandService {

    private final SidecarLifecycleController controller;
    private final SidecarState state;
    private final HealthProber prober;
    private final SidecarProperties props;

    public SidecarCommandService(SidecarLifecycleController controller,
                                 SidecarState state,
                                 HealthProber prober,
                                 SidecarProperties props) {
        this.controller = controller;
        this.state = state;
        this.prober = prober;
        this.props = props;
    }

    public SidecarStatusView getStatus() {
        SidecarSnapshot snapshot = state.snapshot();
        if (snapshot.status() == SidecarStatus.RUNNING) {
            Optional<WorkerStatusReport> live = prober.fetchStatus(snapshot.port(), props.getStatusProbeTimeout());
            if (live.isPresent()) {
                WorkerStatusReport report = live.get();
                return new SidecarStatusView(
                        true,
                        report.status() != null ? report.status() : SidecarStatus.RUNNING.value(),
                        snapshot.port(),
                        report.memories() != null ? report.memories() : 0L,
                        report.uptime(),
                        report.version() != null ? report.version() : SidecarStatusView.UNKNOWN_VERSION,
                        snapshot.restartCount());
            }
        }
        return new SidecarStatusView(false, snapshot.status().value(), snapshot.port(), 0L, null,
                SidecarStatusView.UNKNOWN_VERSION, snapshot.restartCount());
    }

    public void start() {
        controller.start();
    }

    public void stop() {
        controller.stop();
    }

    public void restart() {
        controller.restart();
    }

    /**
     * Probes the worker once, bounded by {@code sidecar.health-probe-timeout}. Never throws.
     */
    public boolean checkHealth() {
        return prober.probe(state.port());
    }
}
