package com.phillippitts.engramdesk.service.sidecar.process;

/**
 * Tagged events produced by a running worker. A stream ends with exactly one terminal
 * event ({@link Terminated} or {@link SpawnFailed}).
 */
public interface ProcessEvent {

    /**
     * @return true if no further events follow this one
     */
    default boolean isTerminal() {
        return false;
    }

    /** One line the worker wrote to stdout. */
    record StdoutLine(String line) implements ProcessEvent { }

    /** One line the worker wrote to stderr. */
    record StderrLine(String line) implements ProcessEvent { }

    /**
     * The worker exited.
     *
     * @param exitCode exit status as reported by the OS
     * @param signal terminating signal when the exit status encodes one, otherwise {@code null}
     */
    record Terminated(int exitCode, Integer signal) implements ProcessEvent {

        /**
         * Decodes an exit status; the JDK reports death by signal N as 128+N on Unix.
         */
        public static Terminated fromExitCode(int exitCode) {
            Integer signal = (exitCode > 128 && exitCode < 160) ? exitCode - 128 : null;
            return new Terminated(exitCode, signal);
        }

        @Override
        public boolean isTerminal() {
            return true;
        }
    }

    /** The worker could not be launched or observed. */
    record SpawnFailed(Throwable error) implements ProcessEvent {
        @Override
        public boolean isTerminal() {
            return true;
        }
    }
}
