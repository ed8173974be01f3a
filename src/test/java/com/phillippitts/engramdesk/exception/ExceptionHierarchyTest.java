package com.phillippitts.engramdesk.exception;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ExceptionHierarchyTest {

    @Test
    void engramDeskExceptionShouldIncludeMessage() {
        EngramDeskException ex = new EngramDeskException("test error");
        assertThat(ex.getMessage()).isEqualTo("test error");
    }

    @Test
    void engramDeskExceptionShouldIncludeCause() {
        IOException cause = new IOException("IO failure");
        EngramDeskException ex = new EngramDeskException("wrapper error", cause);

        assertThat(ex.getMessage()).isEqualTo("wrapper error");
        assertThat(ex.getCause()).isEqualTo(cause);
    }

    @Test
    void executableNotFoundShouldListSearchedLocations() {
        List<Path> searched = new ArrayList<>(List.of(Path.of("/a/bin/engram.js"), Path.of("/b/bin/engram.js")));
        ExecutableNotFoundException ex = new ExecutableNotFoundException(searched);
        searched.clear();

        assertThat(ex).isInstanceOf(EngramDeskException.class);
        assertThat(ex.getMessage()).contains("bin/engram.js").contains("/a/bin/engram.js");
        assertThat(ex.getSearchedLocations()).hasSize(2);
    }

    @Test
    void spawnExceptionShouldCarryCauseAndCommand() {
        IOException cause = new IOException("error=13, Permission denied");
        SidecarSpawnException ex = new SidecarSpawnException(List.of("node", "bin/engram.js"), cause);

        assertThat(ex).isInstanceOf(EngramDeskException.class);
        assertThat(ex.getMessage()).isEqualTo("Failed to spawn sidecar: error=13, Permission denied");
        assertThat(ex.getCause()).isEqualTo(cause);
        assertThat(ex.getCommandLine()).containsExactly("node", "bin/engram.js");
    }

    @Test
    void killExceptionShouldIncludePid() {
        SidecarKillException ex = new SidecarKillException(321, "still alive");

        assertThat(ex).isInstanceOf(EngramDeskException.class);
        assertThat(ex.getMessage()).contains("pid=321").contains("still alive");
        assertThat(ex.getPid()).isEqualTo(321);
    }

    @Test
    void killExceptionShouldIncludeCause() {
        InterruptedException cause = new InterruptedException();
        SidecarKillException ex = new SidecarKillException(9, "interrupted", cause);

        assertThat(ex.getCause()).isSameAs(cause);
    }
}
