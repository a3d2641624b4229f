package com.phillippitts.transcodeguard.exception;

/**
 * Transient failure reading device telemetry. Absorbed by the resource monitor.
 */
public class TelemetryException extends TranscodeGuardException {

    public TelemetryException(String message) {
        super(message);
    }

    public TelemetryException(String message, Throwable cause) {
        super(message, cause);
    }
}
