package com.phillippitts.engramdesk.service.sidecar.locator;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Fully resolved invocation of the worker: executable, arguments, environment overrides and
 * working directory.
 *
 * @param executable interpreter or binary to run (absolute path or a name resolved via PATH)
 * @param arguments arguments after the executable, ending with {@code start --port <port>}
 * @param environment variables added to the inherited environment (may be empty)
 * @param workingDirectory directory the worker runs in
 * @param source which locator candidate produced this command
 */
public record CommandSpec(
        String executable,
        List<String> arguments,
        Map<String, String> environment,
        Path workingDirectory,
        Source source
) {

    /**
     * Locator candidates, in the order they are tried.
     */
    public enum Source {
        /** Bundled node runtime plus {@code engram-bundle.cjs} in the packaged resources. */
        BUNDLED_RUNTIME,
        /** Packaged source tree at {@code <resources>/engram}. */
        PACKAGED_SCRIPT,
        /** {@code ./resources} relative to the working directory (development build). */
        DEVELOPMENT_BUNDLE,
        /** Source tree found by walking up from the running executable. */
        EXECUTABLE_ANCESTOR,
        /** Explicitly configured override directory. */
        OVERRIDE_DIRECTORY,
        /** Current working directory. */
        WORKING_DIRECTORY
    }

    public CommandSpec {
        Objects.requireNonNull(executable, "executable");
        Objects.requireNonNull(source, "source");
        arguments = arguments == null ? List.of() : List.copyOf(arguments);
        environment = environment == null ? Map.of() : Map.copyOf(environment);
    }

    /**
     * Returns the command line as handed to the OS: executable followed by arguments.
     */
    public List<String> commandLine() {
        List<String> cmd = new ArrayList<>(arguments.size() + 1);
        cmd.add(executable);
        cmd.addAll(arguments);
        return List.copyOf(cmd);
    }
}
