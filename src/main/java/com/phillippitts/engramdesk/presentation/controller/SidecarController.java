package com.phillippitts.engramdesk.presentation.controller;

import com.phillippitts.engramdesk.service.sidecar.SidecarCommandService;
import com.phillippitts.engramdesk.service.sidecar.SidecarStatusView;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.Map;

/**
 * Command surface of the sidecar supervisor.
 */
@RestController
@RequestMapping("/api/sidecar")
class SidecarController {

    private static final Logger LOG = LogManager.getLogger(SidecarController.class);

    private final SidecarCommandService commands;

    SidecarController(SidecarCommandService commands) {
        this.commands = commands;
    }

    @GetMapping("/status")
    ResponseEntity<SidecarStatusView> status() {
        return ResponseEntity.ok(commands.getStatus());
    }

    /**
     * Returns once the worker is spawned (or adopted); readiness follows asynchronously.
     */
    @PostMapping("/start")
    ResponseEntity<SidecarStatusView> start() {
        LOG.info("Start requested");
        commands.start();
        return ResponseEntity.accepted().body(commands.getStatus());
    }

    @PostMapping("/stop")
    ResponseEntity<SidecarStatusView> stop() {
        LOG.info("Stop requested");
        commands.stop();
        return ResponseEntity.ok(commands.getStatus());
    }

    @PostMapping("/restart")
    ResponseEntity<SidecarStatusView> restart() {
        LOG.info("Restart requested");
        commands.restart();
        return ResponseEntity.accepted().body(commands.getStatus());
    }

    @GetMapping("/health")
    ResponseEntity<Map<String, Object>> health() {
        boolean healthy = commands.checkHealth();
        return ResponseEntity.ok(Map.of(
                "healthy", healthy,
                "timestamp", Instant.now().toString()
        ));
    }
}
