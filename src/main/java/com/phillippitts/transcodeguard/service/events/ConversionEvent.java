package com.phillippitts.transcodeguard.service.events;

import com.phillippitts.transcodeguard.domain.JobId;

import java.time.Instant;

/**
 * Event published on the {@link ConversionEventBus}.
 */
public interface ConversionEvent {

    /** When the event happened. */
    Instant at();

    /** Job the event concerns, or null when none (e.g. a device alert with no active job). */
    JobId jobId();
}
