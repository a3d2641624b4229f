package com.phillippitts.transcodeguard.presentation.controller;

import com.phillippitts.transcodeguard.domain.Alert;
import com.phillippitts.transcodeguard.service.alert.AlertLog;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;

@RestController
@RequestMapping("/api/alerts")
class AlertController {

    private final AlertLog alertLog;

    AlertController(AlertLog alertLog) {
        this.alertLog = alertLog;
    }

    record AlertView(String id, String severity, String kind, String message, Instant triggeringSnapshot,
                     String jobId, Instant createdAt, Instant acknowledgedAt) {
        static AlertView from(Alert a) {
            return new AlertView(a.id(), a.severity().name(), a.kind().name(), a.message(),
                    a.triggeringSnapshot(), a.jobId() == null ? null : a.jobId().value(),
                    a.createdAt(), a.acknowledgedAt());
        }
    }

    @GetMapping
    List<AlertView> recent(@RequestParam(defaultValue = "50") int limit) {
        return alertLog.recent(limit).stream().map(AlertView::from).toList();
    }

    /**
     * 404 for an unknown id; a second acknowledgement surfaces as 409 through the exception handler.
     */
    @PostMapping("/{id}/acknowledge")
    ResponseEntity<AlertView> acknowledge(@PathVariable String id) {
        return alertLog.acknowledge(id)
                .map(a -> ResponseEntity.ok(AlertView.from(a)))
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @DeleteMapping
    ResponseEntity<Void> clear() {
        alertLog.clear();
        return ResponseEntity.noContent().build();
    }
}
