/**
 * Spawning, output streaming and termination of the worker OS process.
 */
package com.phillippitts.engramdesk.service.sidecar.process;
