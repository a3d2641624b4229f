package com.phillippitts.transcodeguard.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * Point-in-time device reading produced by the resource monitor.
 *
 * @param timestamp when the reading was taken
 * @param thermalState device thermal state
 * @param batteryLevel 0.0 - 1.0
 * @param charging whether external power is connected
 * @param availableMemoryBytes free memory
 * @param availableStorageBytes free storage in the work area
 * @param stale true when returned in place of a fresh reading that timed out
 */
public record ResourceSnapshot(
        Instant timestamp,
        ThermalState thermalState,
        double batteryLevel,
        boolean charging,
        long availableMemoryBytes,
        long availableStorageBytes,
        boolean stale
) {
    public ResourceSnapshot {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(thermalState, "thermalState");
        if (Double.isNaN(batteryLevel)) {
            batteryLevel = 1.0;
        }
        batteryLevel = Math.max(0.0, Math.min(1.0, batteryLevel));
        availableMemoryBytes = Math.max(0L, availableMemoryBytes);
        availableStorageBytes = Math.max(0L, availableStorageBytes);
    }

    public ResourceSnapshot asStale() {
        if (stale) {
            return this;
        }
        return new ResourceSnapshot(timestamp, thermalState, batteryLevel, charging,
                availableMemoryBytes, availableStorageBytes, true);
    }
}
