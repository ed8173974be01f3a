package com.phillippitts.engramdesk.config.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Configuration properties for the engram sidecar supervisor.
 * Binds to properties prefixed with "sidecar".
 *
 * <p>Example application.properties:
 * <pre>
 * sidecar.port=3838
 * sidecar.max-restart-attempts=3
 * sidecar.grace-period=5s
 * sidecar.backoff-base=2s
 * sidecar.health-check.interval=30s
 * sidecar.locator.override-dir=/opt/engram
 * </pre>
 */
@ConfigurationProperties(prefix = "sidecar")
@Validated
public class SidecarProperties {

    /** TCP port of the worker's HTTP endpoint. Never mutated by the supervisor. */
    @Min(value = 1, message = "Port must be between 1 and 65535")
    @Max(value = 65535, message = "Port must be between 1 and 65535")
    private int port = 3838;

    /** Start the worker when the application is ready. */
    private boolean autoStart = true;

    /** Automatic restarts allowed before the supervisor gives up and reports "failed". */
    @Positive(message = "Max restart attempts must be positive")
    private int maxRestartAttempts = 3;

    /** Delay after spawn before the worker is optimistically marked running. */
    @NotNull
    private Duration gracePeriod = Duration.ofSeconds(5);

    /** Delay before restart attempt 1; doubles for each further attempt (2s, 4s, 8s). */
    @NotNull
    private Duration backoffBase = Duration.ofSeconds(2);

    /** Pause between stop and start during a manual restart, so the port is released. */
    @NotNull
    private Duration restartCooldown = Duration.ofSeconds(1);

    /** Connect timeout for the "is something already listening" adoption check. */
    @NotNull
    private Duration adoptionProbeTimeout = Duration.ofMillis(500);

    /** Request timeout for background health probes. */
    @NotNull
    private Duration healthProbeTimeout = Duration.ofSeconds(5);

    /** Request timeout for interactive status queries. */
    @NotNull
    private Duration statusProbeTimeout = Duration.ofSeconds(3);

    /** Capacity of the lifecycle notification channel. */
    @Positive(message = "Channel capacity must be positive")
    private int channelCapacity = 64;

    @Valid
    private HealthCheck healthCheck = new HealthCheck();

    @Valid
    private Locator locator = new Locator();

    public int getPort() {
        return port;
    }

    public void setPort(int port) {
        this.port = port;
    }

    public boolean isAutoStart() {
        return autoStart;
    }

    public void setAutoStart(boolean autoStart) {
        this.autoStart = autoStart;
    }

    public int getMaxRestartAttempts() {
        return maxRestartAttempts;
    }

    public void setMaxRestartAttempts(int maxRestartAttempts) {
        this.maxRestartAttempts = maxRestartAttempts;
    }

    public Duration getGracePeriod() {
        return gracePeriod;
    }

    public void setGracePeriod(Duration gracePeriod) {
        this.gracePeriod = gracePeriod;
    }

    public Duration getBackoffBase() {
        return backoffBase;
    }

    public void setBackoffBase(Duration backoffBase) {
        this.backoffBase = backoffBase;
    }

    public Duration getRestartCooldown() {
        return restartCooldown;
    }

    public void setRestartCooldown(Duration restartCooldown) {
        this.restartCooldown = restartCooldown;
    }

    public Duration getAdoptionProbeTimeout() {
        return adoptionProbeTimeout;
    }

    public void setAdoptionProbeTimeout(Duration adoptionProbeTimeout) {
        this.adoptionProbeTimeout = adoptionProbeTimeout;
    }

    public Duration getHealthProbeTimeout() {
        return healthProbeTimeout;
    }

    public void setHealthProbeTimeout(Duration healthProbeTimeout) {
        this.healthProbeTimeout = healthProbeTimeout;
    }

    public Duration getStatusProbeTimeout() {
        return statusProbeTimeout;
    }

    public void setStatusProbeTimeout(Duration statusProbeTimeout) {
        this.statusProbeTimeout = statusProbeTimeout;
    }

    public int getChannelCapacity() {
        return channelCapacity;
    }

    public void setChannelCapacity(int channelCapacity) {
        this.channelCapacity = channelCapacity;
    }

    public HealthCheck getHealthCheck() {
        return healthCheck;
    }

    public void setHealthCheck(HealthCheck healthCheck) {
        this.healthCheck = healthCheck;
    }

    public Locator getLocator() {
        return locator;
    }

    public void setLocator(Locator locator) {
        this.locator = locator;
    }

    /**
     * Periodic health-check loop configuration.
     */
    public static class HealthCheck {
        private boolean enabled = true;

        /** Delay before the loop starts, so it does not race the first startup. */
        @NotNull
        private Duration initialDelay = Duration.ofSeconds(10);

        @NotNull
        private Duration interval = Duration.ofSeconds(30);

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Duration getInitialDelay() {
            return initialDelay;
        }

        public void setInitialDelay(Duration initialDelay) {
            this.initialDelay = initialDelay;
        }

        public Duration getInterval() {
            return interval;
        }

        public void setInterval(Duration interval) {
            this.interval = interval;
        }
    }

    /**
     * Where to look for the worker executable.
     */
    public static class Locator {
        /** Packaged application resources directory (holds the bundled runtime). Optional. */
        private String resourceDir;

        /** Explicit directory expected to contain {@code bin/engram.js}. Optional. */
        private String overrideDir;

        /** Interpreter used for the script form of the worker. */
        @NotBlank(message = "Node command must not be blank")
        private String nodeCommand = "node";

        public String getResourceDir() {
            return resourceDir;
        }

        public void setResourceDir(String resourceDir) {
            this.resourceDir = resourceDir;
        }

        public String getOverrideDir() {
            return overrideDir;
        }

        public void setOverrideDir(String overrideDir) {
            this.overrideDir = overrideDir;
        }

        public String getNodeCommand() {
            return nodeCommand;
        }

        public void setNodeCommand(String nodeCommand) {
            this.nodeCommand = nodeCommand;
        }
    }
}
