package com.phillippitts.engramdesk.service.sidecar.health;

import java.time.Duration;

/**
 * Checks whether something already accepts TCP connections on a local port.
 */
@FunctionalInterface
public interface PortProbe {

    /**
     * @param port local TCP port
     * @param timeout connect timeout
     * @return true if a connection to 127.0.0.1:port succeeded within the timeout
     */
    boolean isListening(int port, Duration timeout);
}
