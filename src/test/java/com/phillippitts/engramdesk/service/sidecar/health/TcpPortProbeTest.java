package com.phillippitts.engramdesk.service.sidecar.health;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class TcpPortProbeTest {

    private final TcpPortProbe probe = new TcpPortProbe();

    @Test
    void listeningPortDetected() throws IOException {
        try (ServerSocket socket = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
            assertThat(probe.isListening(socket.getLocalPort(), Duration.ofMillis(500))).isTrue();
        }
    }

    @Test
    void closedPortNotListening() throws IOException {
        int port;
        try (ServerSocket socket = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
            port = socket.getLocalPort();
        }

        assertThat(probe.isListening(port, Duration.ofMillis(500))).isFalse();
    }
}
