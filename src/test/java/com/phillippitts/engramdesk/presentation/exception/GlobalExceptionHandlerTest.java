package com.phillippitts.engramdesk.presentation.exception;

import com.phillippitts.engramdesk.exception.ExecutableNotFoundException;
import com.phillippitts.engramdesk.exception.SidecarKillException;
import com.phillippitts.engramdesk.exception.SidecarSpawnException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class GlobalExceptionHandlerTest {

    private GlobalExceptionHandler handler;

    @BeforeEach
    void setUp() {
        handler = new GlobalExceptionHandler();
    }

    @Test
    void executableNotFoundReturns503() {
        ExecutableNotFoundException ex = new ExecutableNotFoundException(
                List.of(Path.of("/Users/alice/engram/bin/engram.js")));

        ResponseEntity<GlobalExceptionHandler.ApiError> response = handler.handleExecutableNotFound(ex);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(response.getBody()).isNotNull();
        assertThat(response.getBody().errorCode()).isEqualTo("ExecutableNotFoundException");
    }

    @Test
    void executableNotFoundDoesNotLeakPaths() {
        ExecutableNotFoundException ex = new ExecutableNotFoundException(
                List.of(Path.of("/Users/alice/engram/bin/engram.js")));

        ResponseEntity<GlobalExceptionHandler.ApiError> response = handler.handleExecutableNotFound(ex);

        assertThat(response.getBody().toString()).doesNotContain("/Users/alice");
    }

    @Test
    void spawnFailureReturns503() {
        SidecarSpawnException ex = new SidecarSpawnException(List.of("node", "bin/engram.js"),
                new IOException("error=2"));

        ResponseEntity<GlobalExceptionHandler.ApiError> response = handler.handleSpawnFailure(ex);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(response.getBody().details()).contains("retry");
    }

    @Test
    void killFailureReturns500WithPid() {
        SidecarKillException ex = new SidecarKillException(4242, "still alive after destroyForcibly");

        ResponseEntity<GlobalExceptionHandler.ApiError> response = handler.handleKillFailure(ex);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody().details()).contains("4242");
    }

    @Test
    void unexpectedErrorReturns500WithoutDetails() {
        ResponseEntity<GlobalExceptionHandler.ApiError> response =
                handler.handleUnexpected(new IllegalStateException("secret internals"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody().errorCode()).isEqualTo("InternalServerError");
        assertThat(response.getBody().toString()).doesNotContain("secret internals");
        assertThat(response.getBody().timestamp()).isNotNull();
    }
}
