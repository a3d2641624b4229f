package com.phillippitts.transcodeguard.domain;

/**
 * What an alert is about.
 */
public enum AlertKind {
    THERMAL_THROTTLING(false),
    THERMAL_EMERGENCY(false),
    LOW_BATTERY(false),
    LOW_STORAGE(false),
    MEMORY_PRESSURE(false),
    MONITORING_DEGRADED(true),
    ENGINE_STOP_TIMEOUT(true);

    private final boolean degradation;

    AlertKind(boolean degradation) {
        this.degradation = degradation;
    }

    /**
     * True for alerts that report a fault in the subsystem itself rather than a device condition.
     */
    public boolean isDegradation() {
        return degradation;
    }
}
