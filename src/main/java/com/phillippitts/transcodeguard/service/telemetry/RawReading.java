package com.phillippitts.transcodeguard.service.telemetry;

import com.phillippitts.transcodeguard.domain.ThermalState;

/**
 * Unstamped telemetry values as returned by a {@link TelemetrySource}.
 */
public record RawReading(
        ThermalState thermalState,
        double batteryLevel,
        boolean charging,
        long availableMemoryBytes,
        long availableStorageBytes
) {
    public RawReading {
        if (thermalState == null) {
            thermalState = ThermalState.NOMINAL;
        }
    }
}
