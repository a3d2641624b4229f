package com.phillippitts.transcodeguard.domain;

/**
 * Progress of a job as last reported by the codec engine.
 *
 * @param percent 0.0 - 100.0
 * @param phase engine-defined phase label, e.g. {@code encoding}
 * @param processedUnits units (frames or microseconds) done so far
 * @param totalUnits total units, 0 when unknown
 * @param estimatedSecondsRemaining -1 when unknown
 */
public record JobProgress(
        double percent,
        String phase,
        long processedUnits,
        long totalUnits,
        long estimatedSecondsRemaining
) {
    public static final JobProgress NONE = new JobProgress(0.0, "pending", 0, 0, -1);

    public JobProgress {
        if (Double.isNaN(percent)) {
            percent = 0.0;
        }
        percent = Math.max(0.0, Math.min(100.0, percent));
        if (phase == null) {
            phase = "";
        }
    }

    public boolean isComplete() {
        return percent >= 100.0;
    }

    public JobProgress finished() {
        return new JobProgress(100.0, "completed", totalUnits > 0 ? totalUnits : processedUnits, totalUnits, 0);
    }
}
