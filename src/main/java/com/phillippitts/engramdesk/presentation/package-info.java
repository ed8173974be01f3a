/**
 * Presentation layer (REST API controllers and exception handling).
 *
 * <p>The HTTP boundary through which the desktop shell and other collaborators query and
 * command the sidecar supervisor. Presentation depends on service, never the reverse.
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code presentation.controller} - REST controllers for the sidecar commands</li>
 *   <li>{@code presentation.exception} - Global exception handling for HTTP responses</li>
 * </ul>
 *
 * @see com.phillippitts.engramdesk.presentation.controller.SidecarController
 * @since 1.0
 */
package com.phillippitts.engramdesk.presentation;
