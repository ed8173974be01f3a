package com.phillippitts.engramdesk.presentation.exception;

import com.phillippitts.engramdesk.exception.ExecutableNotFoundException;
import com.phillippitts.engramdesk.exception.SidecarKillException;
import com.phillippitts.engramdesk.exception.SidecarSpawnException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.time.Instant;

/**
 * Translates sidecar failures escaping the REST controllers into {@link ApiError} bodies.
 *
 * Converts supervisor exceptions to HTTP responses with appropriate status codes.
 * Paths and command lines are logged server-side, never returned to clients.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    /**
     * Installation problem - no retry will help until the worker is reinstalled (HTTP 503).
     */
    @ExceptionHandler(ExecutableNotFoundException.class)
    ResponseEntity<ApiError> handleExecutableNotFound(ExecutableNotFoundException ex) {
        LOG.error("Engram worker not found; searched: {}", ex.getSearchedLocations());
        return ResponseEntity
            .status(HttpStatus.SERVICE_UNAVAILABLE)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Memory service unavailable",
                "Engram worker not installed. Reinstall the application.",
                Instant.now()
            ));
    }

    /**
     * OS refused to spawn the worker; automatic retries may still be in flight (HTTP 503).
     */
    @ExceptionHandler(SidecarSpawnException.class)
    ResponseEntity<ApiError> handleSpawnFailure(SidecarSpawnException ex) {
        LOG.error("Sidecar spawn failed: cmd={}", ex.getCommandLine(), ex);
        return ResponseEntity
            .status(HttpStatus.SERVICE_UNAVAILABLE)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Memory service failed to start",
                "Please retry in a few seconds",
                Instant.now()
            ));
    }

    /**
     * Worker survived termination (HTTP 500).
     */
    @ExceptionHandler(SidecarKillException.class)
    ResponseEntity<ApiError> handleKillFailure(SidecarKillException ex) {
        LOG.error("Sidecar kill failed: pid={}", ex.getPid(), ex);
        return ResponseEntity
            .status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Memory service could not be stopped",
                "Worker process pid " + ex.getPid() + " is still running",
                Instant.now()
            ));
    }

    /**
     * Anything not mapped above becomes a 500 without leaking internals.
     */
    @ExceptionHandler(Exception.class)
    ResponseEntity<ApiError> handleUnexpected(Exception ex) {
        LOG.error("Unexpected error", ex);
        return ResponseEntity
            .status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ApiError(
                "InternalServerError",
                "Supervisor request failed",
                "See the supervisor log for this request ID",
                Instant.now()
            ));
    }

    /**
     * Error body returned by every sidecar endpoint.
     */
    record ApiError(
        String errorCode,
        String message,
        String details,
        Instant timestamp
    ) {}
}
