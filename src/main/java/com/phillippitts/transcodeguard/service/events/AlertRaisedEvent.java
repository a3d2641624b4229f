package com.phillippitts.transcodeguard.service.events;

import com.phillippitts.transcodeguard.domain.Alert;
import com.phillippitts.transcodeguard.domain.JobId;

import java.time.Instant;

/**
 * Published when an alert is appended to the alert log.
 */
public record AlertRaisedEvent(Alert alert) implements ConversionEvent {

    @Override
    public Instant at() {
        return alert.createdAt();
    }

    @Override
    public JobId jobId() {
        return alert.jobId();
    }
}
