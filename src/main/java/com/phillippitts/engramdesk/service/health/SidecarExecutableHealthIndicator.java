package com.phillippitts.engramdesk.service.health;

import com.phillippitts.engramdesk.config.properties.SidecarProperties;
import com.phillippitts.engramdesk.exception.ExecutableNotFoundException;
import com.phillippitts.engramdesk.service.sidecar.locator.CommandSpec;
import com.phillippitts.engramdesk.service.sidecar.locator.ExecutableLocator;
import com.phillippitts.engramdesk.service.sidecar.locator.LocatorEnvironment;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health indicator for the worker installation: verifies that the executable locator
 * resolves a command, independently of whether the worker is running.
 *
 * <p>Exposed via /actuator/health endpoint.
 */
@Component
public class SidecarExecutableHealthIndicator implements HealthIndicator {

    private final ExecutableLocator locator;
    private final SidecarProperties props;

    public SidecarExecutableHealthIndicator(ExecutableLocator locator, SidecarProperties props) {
        this.locator = locator;
        this.props = props;
    }

    @Override
    public Health health() {
        try {
            CommandSpec command = locator.locate(LocatorEnvironment.detect(props.getLocator(), props.getPort()));
            return Health.up()
                    .withDetail("source", command.source().name())
                    .withDetail("executable", command.executable())
                    .build();
        } catch (ExecutableNotFoundException e) {
            return Health.down()
                    .withDetail("status", "Engram worker not found")
                    .withDetail("searched", e.getSearchedLocations().toString())
                    .build();
        }
    }
}
