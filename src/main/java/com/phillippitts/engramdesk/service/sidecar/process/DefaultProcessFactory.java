package com.phillippitts.engramdesk.service.sidecar.process;

import com.phillippitts.engramdesk.service.sidecar.locator.CommandSpec;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * Default production implementation of {@link ProcessFactory} using {@link ProcessBuilder}.
 */
@Component
public final class DefaultProcessFactory implements ProcessFactory {

    @Override
    public Process start(CommandSpec command) throws IOException {
        ProcessBuilder pb = new ProcessBuilder(command.commandLine());
        if (command.workingDirectory() != null) {
            pb.directory(command.workingDirectory().toFile());
        }
        pb.environment().putAll(command.environment());
        // Keep stderr separate from stdout (both are streamed as tagged events)
        pb.redirectErrorStream(false);
        return pb.start();
    }
}
