package com.phillippitts.transcodeguard.service.engine;

/**
 * Progress report from the engine.
 *
 * @param percent 0.0 - 100.0
 * @param phase engine phase label
 * @param processedUnits work done, in engine units
 * @param totalUnits total work, 0 if unknown
 * @param etaSeconds estimated seconds remaining, -1 if unknown
 */
public record ProgressEvent(double percent, String phase, long processedUnits, long totalUnits, long etaSeconds) {

    public static ProgressEvent of(double percent, String phase) {
        return new ProgressEvent(percent, phase, 0, 0, -1);
    }
}
