/**
 * Global exception handling for REST API responses.
 *
 * <p>Exception Mapping:
 * <ul>
 *   <li>{@link com.phillippitts.engramdesk.exception.ExecutableNotFoundException} → 503 Service Unavailable</li>
 *   <li>{@link com.phillippitts.engramdesk.exception.SidecarSpawnException} → 503 Service Unavailable</li>
 *   <li>{@link com.phillippitts.engramdesk.exception.SidecarKillException} → 500 Internal Server Error</li>
 *   <li>{@code Exception} (catch-all) → 500 Internal Server Error</li>
 * </ul>
 *
 * <p>Response Format:
 * <pre>
 * {
 *   "errorCode": "ExecutableNotFoundException",
 *   "message": "Memory service unavailable",
 *   "details": "Engram worker not installed. Reinstall the application.",
 *   "timestamp": "2026-03-02T09:12:44.120Z"
 * }
 * </pre>
 */
package com.phillippitts.engramdesk.presentation.exception;
