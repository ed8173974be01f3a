package com.phillippitts.engramdesk.service.sidecar.process;

import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;

class ProcessEventStreamTest {

    @Test
    void eventsAfterTerminalAreDiscarded() throws InterruptedException {
        ProcessEventStream stream = new ProcessEventStream();
        stream.emit(new ProcessEvent.StdoutLine("a"));
        stream.emit(ProcessEvent.Terminated.fromExitCode(0));
        stream.emit(new ProcessEvent.StdoutLine("late"));
        stream.emit(new ProcessEvent.SpawnFailed(new IOException("late")));

        assertThat(stream.next()).isEqualTo(new ProcessEvent.StdoutLine("a"));
        assertThat(stream.next()).isEqualTo(new ProcessEvent.Terminated(0, null));
        assertThat(stream.isExhausted()).isTrue();
        assertThat(stream.next()).isNull();
    }

    @Test
    void signalDecodedFromExitStatus() {
        assertThat(ProcessEvent.Terminated.fromExitCode(137).signal()).isEqualTo(9);
        assertThat(ProcessEvent.Terminated.fromExitCode(143).signal()).isEqualTo(15);
        assertThat(ProcessEvent.Terminated.fromExitCode(1).signal()).isNull();
        assertThat(ProcessEvent.Terminated.fromExitCode(128).signal()).isNull();
    }

    @Test
    void onlyTerminationAndSpawnFailureAreTerminal() {
        assertThat(new ProcessEvent.StdoutLine("x").isTerminal()).isFalse();
        assertThat(new ProcessEvent.StderrLine("x").isTerminal()).isFalse();
        assertThat(new ProcessEvent.SpawnFailed(new IOException()).isTerminal()).isTrue();
    }
}
