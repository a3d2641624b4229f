package com.phillippitts.transcodeguard.exception;

/**
 * Base exception for all transcode-guard application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class TranscodeGuardException extends RuntimeException {

    public TranscodeGuardException(String message) {
        super(message);
    }

    public TranscodeGuardException(String message, Throwable cause) {
        super(message, cause);
    }

    public TranscodeGuardException(Throwable cause) {
        super(cause);
    }
}
