package com.phillippitts.transcodeguard.service.engine;

import java.util.Objects;

/**
 * Terminal outcome of one conversion.
 *
 * @param success whether the output was produced
 * @param code engine error code, null on success
 * @param message engine error message, null on success
 */
public record EngineResult(boolean success, String code, String message) {

    public EngineResult {
        if (!success) {
            Objects.requireNonNull(message, "message");
            if (code == null) {
                code = "ENGINE_ERROR";
            }
        }
    }

    public static EngineResult succeeded() {
        return new EngineResult(true, null, null);
    }

    public static EngineResult error(String code, String message) {
        return new EngineResult(false, code, message);
    }
}
