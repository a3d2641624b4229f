package com.phillippitts.transcodeguard.exception;

import com.phillippitts.transcodeguard.domain.JobId;

/**
 * Thrown when a conversion is submitted while another job is still active.
 * Not a fault: the request is rejected and nothing is queued.
 */
public class AlreadyRunningException extends TranscodeGuardException {

    private final JobId activeJobId;

    public AlreadyRunningException(JobId activeJobId) {
        super("A conversion is already in progress (job: " + activeJobId + ")");
        this.activeJobId = activeJobId;
    }

    public JobId getActiveJobId() {
        return activeJobId;
    }
}
