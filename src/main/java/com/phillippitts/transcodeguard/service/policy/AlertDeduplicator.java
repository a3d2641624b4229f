package com.phillippitts.transcodeguard.service.policy;

import com.phillippitts.transcodeguard.domain.AlertKind;
import com.phillippitts.transcodeguard.domain.AlertSeverity;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;

/**
 * Suppresses repeats of a persisting condition. An alert kind is emitted again only when its
 * severity escalates or the cooldown has passed since it was last emitted; clearing the
 * condition forgets it so the next occurrence is emitted immediately.
 *
 * <p>Not thread-safe; owned by {@link PolicyEngine}.
 */
final class AlertDeduplicator {

    private record Emitted(AlertSeverity severity, Instant at) {}

    private final Map<AlertKind, Emitted> lastEmitted = new EnumMap<>(AlertKind.class);
    private final Duration cooldown;

    AlertDeduplicator(Duration cooldown) {
        this.cooldown = cooldown;
    }

    boolean shouldEmit(AlertKind kind, AlertSeverity severity, Instant now) {
        Emitted prev = lastEmitted.get(kind);
        if (prev == null
                || severity.isHigherThan(prev.severity())
                || Duration.between(prev.at(), now).compareTo(cooldown) >= 0) {
            lastEmitted.put(kind, new Emitted(severity, now));
            return true;
        }
        return false;
    }

    void clear(AlertKind kind) {
        lastEmitted.remove(kind);
    }
}
