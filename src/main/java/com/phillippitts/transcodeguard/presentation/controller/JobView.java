package com.phillippitts.transcodeguard.presentation.controller;

import com.phillippitts.transcodeguard.domain.ConversionJob;
import com.phillippitts.transcodeguard.domain.JobProgress;

import java.time.Instant;

/**
 * JSON view of a job.
 */
record JobView(
        String id,
        String state,
        String inputPath,
        String outputPath,
        JobProgress progress,
        Instant createdAt,
        Instant startedAt,
        Instant endedAt,
        String failureCode,
        String failureReason,
        boolean throttled,
        String pauseOrigin,
        boolean engineResourcesLeaked
) {
    static JobView from(ConversionJob job) {
        return new JobView(
                job.id().value(),
                job.state().name(),
                job.input().path().toString(),
                job.output().path().toString(),
                job.progress(),
                job.createdAt(),
                job.startedAt(),
                job.endedAt(),
                job.failureReason() == null ? null : job.failureReason().code(),
                job.failureReason() == null ? null : job.failureReason().message(),
                job.throttled(),
                job.pauseOrigin() == null ? null : job.pauseOrigin().name(),
                job.engineResourcesLeaked());
    }
}
