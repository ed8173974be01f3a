/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.engramdesk.exception.EngramDeskException} - Base exception
 *       for all application-specific errors</li>
 *   <li>{@link com.phillippitts.engramdesk.exception.ExecutableNotFoundException} - Thrown when
 *       the worker executable cannot be resolved; fatal to a start attempt</li>
 *   <li>{@link com.phillippitts.engramdesk.exception.SidecarSpawnException} - Thrown when the OS
 *       refuses to create the worker process</li>
 *   <li>{@link com.phillippitts.engramdesk.exception.SidecarKillException} - Thrown when a worker
 *       process survives termination; best-effort, state is cleared regardless</li>
 * </ul>
 *
 * <p>All exceptions are unchecked and map to HTTP status codes via {@code GlobalExceptionHandler}.
 * Runtime crashes and failed health probes are not exceptions; they are absorbed by the
 * supervisor's restart policy.
 *
 * @see com.phillippitts.engramdesk.presentation.exception.GlobalExceptionHandler
 * @since 1.0
 */
package com.phillippitts.engramdesk.exception;
