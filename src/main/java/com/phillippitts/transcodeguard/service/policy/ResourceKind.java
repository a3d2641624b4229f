package com.phillippitts.transcodeguard.service.policy;

import com.phillippitts.transcodeguard.domain.AlertKind;
import com.phillippitts.transcodeguard.domain.ResourceSnapshot;

/**
 * Resource a {@link Threshold} watches. Declaration order is evaluation priority, highest first.
 */
public enum ResourceKind {
    THERMAL_CEILING(AlertKind.THERMAL_EMERGENCY),
    THERMAL_THROTTLE(AlertKind.THERMAL_THROTTLING),
    BATTERY(AlertKind.LOW_BATTERY),
    STORAGE(AlertKind.LOW_STORAGE),
    MEMORY(AlertKind.MEMORY_PRESSURE);

    private final AlertKind alertKind;

    ResourceKind(AlertKind alertKind) {
        this.alertKind = alertKind;
    }

    public AlertKind alertKind() {
        return alertKind;
    }

    /**
     * Value compared against the limit: thermal ordinal, battery fraction, or free bytes.
     */
    public double measure(ResourceSnapshot snapshot) {
        return switch (this) {
            case THERMAL_CEILING, THERMAL_THROTTLE -> snapshot.thermalState().ordinal();
            case BATTERY -> snapshot.batteryLevel();
            case STORAGE -> snapshot.availableStorageBytes();
            case MEMORY -> snapshot.availableMemoryBytes();
        };
    }

    /**
     * Whether the rule can apply at all to this snapshot. A charging device never trips the
     * battery rule.
     */
    public boolean applies(ResourceSnapshot snapshot) {
        return this != BATTERY || !snapshot.charging();
    }
}
