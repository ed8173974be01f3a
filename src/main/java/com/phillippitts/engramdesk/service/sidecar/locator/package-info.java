/**
 * Resolution of the worker command line from the installation layout.
 */
package com.phillippitts.engramdesk.service.sidecar.locator;
