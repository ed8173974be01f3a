/**
 * Service layer.
 *
 * <p>Service Sub-packages:
 * <ul>
 *   <li>{@code service.sidecar} - supervisor of the engram worker process (lifecycle, restart
 *       policy, health loop)</li>
 *   <li>{@code service.events} - observers of supervisor notices</li>
 *   <li>{@code service.health} - Actuator health indicators</li>
 * </ul>
 *
 * <p>Services use constructor injection and throw domain exceptions, never HTTP exceptions.
 *
 * @see com.phillippitts.engramdesk.service.sidecar
 * @since 1.0
 */
package com.phillippitts.engramdesk.service;
