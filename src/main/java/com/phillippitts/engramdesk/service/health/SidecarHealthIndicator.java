package com.phillippitts.engramdesk.service.health;

import com.phillippitts.engramdesk.service.sidecar.SidecarSnapshot;
import com.phillippitts.engramdesk.service.sidecar.SidecarState;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health indicator for the supervised worker, from stored lifecycle state only (no probe).
 *
 * <ul>
 *   <li>UP: RUNNING</li>
 *   <li>UNKNOWN: STARTING, grace period not over yet</li>
 *   <li>OUT_OF_SERVICE: STOPPED</li>
 *   <li>DOWN: CRASHED</li>
 * </ul>
 *
 * <p>Exposed via /actuator/health endpoint.
 */
@Component
public class SidecarHealthIndicator implements HealthIndicator {

    private final SidecarState state;

    public SidecarHealthIndicator(SidecarState state) {
        this.state = state;
    }

    @Override
    public Health health() {
        SidecarSnapshot snapshot = state.snapshot();

        Health.Builder builder = switch (snapshot.status()) {
            case RUNNING -> Health.up();
            case STARTING -> Health.unknown();
            case STOPPED -> Health.outOfService();
            case CRASHED -> Health.down();
        };

        builder.withDetail("status", snapshot.status().value())
                .withDetail("port", snapshot.port())
                .withDetail("restartCount", snapshot.restartCount());
        if (snapshot.processAttached()) {
            builder.withDetail("pid", snapshot.pid());
        }
        if (snapshot.adopted()) {
            builder.withDetail("adopted", true);
        }
        return builder.build();
    }
}
