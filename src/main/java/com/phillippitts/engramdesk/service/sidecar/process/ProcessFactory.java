package com.phillippitts.engramdesk.service.sidecar.process;

import com.phillippitts.engramdesk.service.sidecar.locator.CommandSpec;

import java.io.IOException;

/**
 * Abstraction over {@link ProcessBuilder} to enable hermetic testing of the supervisor.
 *
 * <p>Production code uses {@link DefaultProcessFactory}. Tests provide a stub that returns
 * a fake {@link Process} whose output and exit they control.
 */
public interface ProcessFactory {
    /**
     * Starts a new process for the given command.
     *
     * @param command resolved worker command
     * @return started {@link Process}
     * @throws IOException if the OS refuses to create the process
     */
    Process start(CommandSpec command) throws IOException;
}
