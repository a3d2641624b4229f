package com.phillippitts.transcodeguard.exception;

import java.time.Duration;
import java.util.Locale;

/**
 * Thrown when a bounded operation (precheck, engine stop, forced telemetry poll) exceeds its
 * deadline. Every such operation has a defined fallback; this exception reports which one ran.
 */
public class OperationTimeoutException extends TranscodeGuardException {

    public enum Operation { PRECHECK, ENGINE_STOP, TELEMETRY_POLL }

    private final Operation operation;
    private final Duration timeout;

    public OperationTimeoutException(Operation operation, Duration timeout) {
        super(operation.name().toLowerCase(Locale.ROOT).replace('_', ' ')
                + " timed out after " + timeout.toMillis() + "ms");
        this.operation = operation;
        this.timeout = timeout;
    }

    public Operation getOperation() {
        return operation;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
