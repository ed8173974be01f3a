package com.phillippitts.engramdesk.service.sidecar.health;

import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.time.Duration;

/**
 * {@link PortProbe} backed by a plain socket connect to the loopback address.
 */
@Component
public class TcpPortProbe implements PortProbe {

    @Override
    public boolean isListening(int port, Duration timeout) {
        try (Socket socket = new Socket()) {
            socket.connect(new InetSocketAddress(InetAddress.getLoopbackAddress(), port),
                    (int) Math.max(1, timeout.toMillis()));
            return true;
        } catch (IOException e) {
            return false;
        }
    }
}
