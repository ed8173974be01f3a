package com.phillippitts.engramdesk.exception;

import java.util.List;

/**
 * Thrown when the operating system refuses to create the worker process.
 */
public class SidecarSpawnException extends EngramDeskException {

    private final List<String> commandLine;

    public SidecarSpawnException(List<String> commandLine, Throwable cause) {
        super("Failed to spawn sidecar: " + (cause == null ? "unknown error" : cause.getMessage()), cause);
        this.commandLine = List.copyOf(commandLine);
    }

    public List<String> getCommandLine() {
        return commandLine;
    }
}
