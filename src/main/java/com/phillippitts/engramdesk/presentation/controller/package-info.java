/**
 * REST API controllers for HTTP endpoints.
 *
 * <p>Current Endpoints:
 * <ul>
 *   <li>{@code GET /api/sidecar/status} - lifecycle status merged with the worker's live status</li>
 *   <li>{@code POST /api/sidecar/start}, {@code /stop}, {@code /restart} - lifecycle commands</li>
 *   <li>{@code GET /api/sidecar/health} - one bounded probe of the worker</li>
 * </ul>
 *
 * <p>Controllers delegate to {@link com.phillippitts.engramdesk.service.sidecar.SidecarCommandService}
 * and let {@code GlobalExceptionHandler} translate failures.
 */
package com.phillippitts.engramdesk.presentation.controller;
