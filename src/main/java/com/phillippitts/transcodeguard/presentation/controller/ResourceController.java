package com.phillippitts.transcodeguard.presentation.controller;

import com.phillippitts.transcodeguard.domain.MonitoringSession;
import com.phillippitts.transcodeguard.domain.ResourceSnapshot;
import com.phillippitts.transcodeguard.service.monitor.ResourceMonitor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Device readings from the resource monitor.
 */
@RestController
@RequestMapping("/api/resources")
class ResourceController {

    private final ResourceMonitor monitor;

    ResourceController(ResourceMonitor monitor) {
        this.monitor = monitor;
    }

    record SessionView(String id, Instant startedAt, Instant endedAt, Duration pollInterval, long samplesTaken) {
        static SessionView from(MonitoringSession s) {
            return new SessionView(s.getId(), s.getStartedAt(), s.getEndedAt(), s.getPollInterval(),
                    s.getSamplesTaken());
        }
    }

    @GetMapping("/latest")
    ResponseEntity<ResourceSnapshot> latest() {
        return monitor.latest().map(ResponseEntity::ok).orElseGet(() -> ResponseEntity.noContent().build());
    }

    @GetMapping("/history")
    List<ResourceSnapshot> history(@RequestParam(defaultValue = "60") int limit) {
        return monitor.history(limit);
    }

    /** Takes an out-of-band reading; a timed-out poll returns the last reading marked stale. */
    @PostMapping("/snapshot")
    ResourceSnapshot snapshotNow() {
        return monitor.snapshotNow();
    }

    @GetMapping("/session")
    ResponseEntity<SessionView> session() {
        return monitor.currentSession()
                .map(s -> ResponseEntity.ok(SessionView.from(s)))
                .orElseGet(() -> ResponseEntity.noContent().build());
    }
}
