package com.phillippitts.engramdesk.service.sidecar.process;

import com.phillippitts.engramdesk.exception.SidecarSpawnException;
import com.phillippitts.engramdesk.service.sidecar.locator.CommandSpec;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Objects;

/**
 * Spawns worker processes and hands back owned {@link SidecarProcess} handles.
 */
@Component
public class SidecarProcessLauncher {

    private static final Logger LOG = LogManager.getLogger(SidecarProcessLauncher.class);

    private final ProcessFactory processFactory;

    public SidecarProcessLauncher(ProcessFactory processFactory) {
        this.processFactory = Objects.requireNonNull(processFactory, "processFactory");
    }

    /**
     * Spawns the worker.
     *
     * @param command resolved worker command
     * @return owned handle whose event stream is already being fed
     * @throws SidecarSpawnException if the OS refuses to create the process
     */
    public SidecarProcess spawn(CommandSpec command) {
        Objects.requireNonNull(command, "command");
        Process process;
        try {
            process = processFactory.start(command);
        } catch (IOException | RuntimeException e) {
            throw new SidecarSpawnException(command.commandLine(), e);
        }
        SidecarProcess handle = SidecarProcess.attach(process, command);
        LOG.info("Spawned sidecar pid={} cmd={}", handle.pid(), command.commandLine());
        return handle;
    }
}
