package com.phillippitts.transcodeguard.domain;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Immutable alert record. The only later change is a single acknowledgement, represented by
 * a replacement instance from {@link #acknowledge(Instant)}.
 *
 * @param id unique id
 * @param severity severity
 * @param kind subject
 * @param message human-readable text
 * @param triggeringSnapshot timestamp of the snapshot that raised it, or null for non-device alerts
 * @param jobId job affected at the time, or null
 * @param createdAt creation time
 * @param acknowledgedAt set once on acknowledgement
 */
public record Alert(
        String id,
        AlertSeverity severity,
        AlertKind kind,
        String message,
        Instant triggeringSnapshot,
        JobId jobId,
        Instant createdAt,
        Instant acknowledgedAt
) {
    public Alert {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(severity, "severity");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(createdAt, "createdAt");
    }

    public static Alert raise(AlertSeverity severity, AlertKind kind, String message,
                              Instant triggeringSnapshot, JobId jobId, Instant now) {
        return new Alert(UUID.randomUUID().toString(), severity, kind, message, triggeringSnapshot,
                jobId, now, null);
    }

    public boolean isAcknowledged() {
        return acknowledgedAt != null;
    }

    public Alert acknowledge(Instant at) {
        if (acknowledgedAt != null) {
            throw new IllegalStateException("Alert " + id + " already acknowledged at " + acknowledgedAt);
        }
        return new Alert(id, severity, kind, message, triggeringSnapshot, jobId, createdAt,
                Objects.requireNonNull(at, "at"));
    }
}
