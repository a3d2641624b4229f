package com.phillippitts.transcodeguard.exception;

/**
 * Wraps a codec engine failure. Always terminal for the affected job and never retried.
 */
public class EngineException extends TranscodeGuardException {

    private final String code;

    public EngineException(String code, String message) {
        super(message);
        this.code = code == null ? "ENGINE_ERROR" : code;
    }

    public EngineException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code == null ? "ENGINE_ERROR" : code;
    }

    public String getCode() {
        return code;
    }
}
