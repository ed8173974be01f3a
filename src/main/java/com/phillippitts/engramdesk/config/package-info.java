/**
 * Spring configuration: thread pools for the sidecar task group, Micrometer bindings and
 * request-scoped logging context.
 *
 * <p>Typed configuration properties live in {@code config.properties}.
 */
package com.phillippitts.engramdesk.config;
