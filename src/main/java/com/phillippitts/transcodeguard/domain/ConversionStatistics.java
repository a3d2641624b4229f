package com.phillippitts.transcodeguard.domain;

import java.time.Duration;

/**
 * Aggregate counters over every job the coordinator has seen since startup.
 *
 * @param submitted jobs accepted by {@code submit}
 * @param completed jobs that reached COMPLETED
 * @param failed jobs that reached FAILED
 * @param cancelled jobs that reached CANCELLED
 * @param averageProcessingTime mean start-to-end time of completed jobs
 */
public record ConversionStatistics(
        long submitted,
        long completed,
        long failed,
        long cancelled,
        Duration averageProcessingTime
) {
    public static final ConversionStatistics EMPTY = new ConversionStatistics(0, 0, 0, 0, Duration.ZERO);

    /** Completed jobs as a percentage of finished jobs, 0 when none have finished. */
    public double successRate() {
        long finished = completed + failed + cancelled;
        return finished == 0 ? 0.0 : (completed * 100.0) / finished;
    }
}
