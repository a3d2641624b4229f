package com.phillippitts.transcodeguard.service.telemetry;

import com.phillippitts.transcodeguard.exception.TelemetryException;

/**
 * Device telemetry backend. Called once per poll tick from the monitor's polling thread.
 *
 * <p>Implementations may block (sensor drivers can hang); callers that need a bounded wait
 * apply their own timeout.
 */
public interface TelemetrySource {

    /**
     * Reads current device state.
     *
     * @return point-in-time reading
     * @throws TelemetryException if the reading could not be taken
     */
    RawReading poll();

    /**
     * Human-readable backend name for logs and health output.
     */
    default String getSourceName() {
        return getClass().getSimpleName();
    }
}
