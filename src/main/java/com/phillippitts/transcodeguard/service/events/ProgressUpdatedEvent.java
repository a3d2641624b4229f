package com.phillippitts.transcodeguard.service.events;

import com.phillippitts.transcodeguard.domain.JobId;
import com.phillippitts.transcodeguard.domain.JobProgress;

import java.time.Instant;

/**
 * Published when engine progress has been applied to the active job.
 */
public record ProgressUpdatedEvent(JobId jobId, JobProgress progress, Instant at) implements ConversionEvent {
}
