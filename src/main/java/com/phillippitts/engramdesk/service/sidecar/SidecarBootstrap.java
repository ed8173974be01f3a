package com.phillippitts.engramdesk.service.sidecar;

import com.phillippitts.engramdesk.config.properties.SidecarProperties;
import com.phillippitts.engramdesk.exception.EngramDeskException;
import com.phillippitts.engramdesk.exception.SidecarKillException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

import jakarta.annotation.PreDestroy;

/**
 * Ties the worker to the application lifecycle: starts it once the context is up (when
 * {@code sidecar.auto-start=true}) and stops it, killing the owned process, on shutdown.
 * Runs in the last phase so the event dispatcher and health loop are up first and stop last.
 */
@Component
public class SidecarBootstrap implements SmartLifecycle {

    private static final Logger LOG = LogManager.getLogger(SidecarBootstrap.class);

    private final SidecarLifecycleController controller;
    private final SidecarProperties props;

    private volatile boolean running;

    public SidecarBootstrap(SidecarLifecycleController controller, SidecarProperties props) {
        this.controller = controller;
        this.props = props;
    }

    @Override
    public void start() {
        running = true;
        if (!props.isAutoStart()) {
            LOG.info("sidecar.auto-start=false; worker will start on demand");
            return;
        }
        try {
            controller.start();
        } catch (EngramDeskException e) {
            // app stays up; the user can retry via POST /api/sidecar/start
            LOG.error("Sidecar auto-start failed: {}", e.getMessage());
        }
    }

    @Override
    public void stop() {
        if (!running) {
            return;
        }
        running = false;
        try {
            controller.stop();
        } catch (SidecarKillException e) {
            LOG.error("Sidecar did not exit on shutdown (pid={}): {}", e.getPid(), e.getMessage());
        }
    }

    @PreDestroy
    public void shutdown() {
        // the context may close without a lifecycle stop (failed refresh)
        stop();
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public int getPhase() {
        return DEFAULT_PHASE;
    }
}
