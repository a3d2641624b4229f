package com.phillippitts.transcodeguard.service.events;

import com.phillippitts.transcodeguard.domain.ConversionJob;
import com.phillippitts.transcodeguard.domain.JobId;
import com.phillippitts.transcodeguard.domain.JobState;

import java.time.Instant;

/**
 * Published after every job state transition.
 *
 * @param jobId job
 * @param from previous state, null for a newly created job
 * @param to new state
 * @param job job view after the transition
 * @param at transition time
 */
public record JobStateChangedEvent(
        JobId jobId,
        JobState from,
        JobState to,
        ConversionJob job,
        Instant at
) implements ConversionEvent {
}
