/**
 * Supervisor for the engram worker process.
 *
 * <p>{@link com.phillippitts.engramdesk.service.sidecar.SidecarLifecycleController} owns every
 * transition of {@link com.phillippitts.engramdesk.service.sidecar.SidecarState}. Crash detection,
 * grace-period confirmation and the periodic
 * {@link com.phillippitts.engramdesk.service.sidecar.SidecarHealthMonitor} talk back to it only
 * through the bounded event channel in the {@code event} subpackage.
 */
package com.phillippitts.engramdesk.service.sidecar;
