package com.phillippitts.engramdesk.service.sidecar.health;

import com.phillippitts.engramdesk.config.properties.SidecarProperties;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Optional;

/**
 * {@link HealthProber} over the JDK {@link HttpClient}, targeting
 * {@code http://localhost:<port>/api/status}.
 */
@Component
public class HttpHealthProber implements HealthProber {

    private static final Logger LOG = LogManager.getLogger(HttpHealthProber.class);

    static final String STATUS_PATH = "/api/status";

    private final HttpClient client;
    private final Duration probeTimeout;

    @Autowired
    public HttpHealthProber(SidecarProperties props) {
        this(props.getHealthProbeTimeout());
    }

    HttpHealthProber(Duration probeTimeout) {
        this.probeTimeout = probeTimeout;
        this.client = HttpClient.newBuilder()
                .connectTimeout(probeTimeout)
                .followRedirects(HttpClient.Redirect.NEVER)
                .build();
    }

    @Override
    public boolean probe(int port) {
        return send(port, probeTimeout)
                .map(resp -> isSuccess(resp.statusCode()))
                .orElse(false);
    }

    @Override
    public Optional<WorkerStatusReport> fetchStatus(int port, Duration timeout) {
        return send(port, timeout)
                .filter(resp -> isSuccess(resp.statusCode()))
                .flatMap(resp -> WorkerStatusParser.parse(resp.body()));
    }

    private Optional<HttpResponse<String>> send(int port, Duration timeout) {
        HttpRequest request = HttpRequest.newBuilder(statusUri(port))
                .GET()
                .header("Accept", "application/json")
                .timeout(timeout)
                .build();
        try {
            return Optional.of(client.send(request, HttpResponse.BodyHandlers.ofString()));
        } catch (IOException e) {
            LOG.debug("Status probe on port {} failed: {}", port, e.toString());
            return Optional.empty();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        } catch (RuntimeException e) {
            LOG.debug("Status probe on port {} rejected: {}", port, e.toString());
            return Optional.empty();
        }
    }

    static URI statusUri(int port) {
        return URI.create("http://localhost:" + port + STATUS_PATH);
    }

    private static boolean isSuccess(int statusCode) {
        return statusCode >= 200 && statusCode < 300;
    }
}
