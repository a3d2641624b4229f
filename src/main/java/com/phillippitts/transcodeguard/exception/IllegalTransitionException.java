package com.phillippitts.transcodeguard.exception;

import com.phillippitts.transcodeguard.domain.JobId;
import com.phillippitts.transcodeguard.domain.JobState;

/**
 * Thrown when a job transition is not defined for the job's current state, including any
 * attempt to leave a terminal state. Indicates a programming error in the caller.
 */
public class IllegalTransitionException extends TranscodeGuardException {

    private final JobId jobId;
    private final JobState from;
    private final String event;

    public IllegalTransitionException(JobId jobId, JobState from, String event) {
        super("Illegal transition for job " + jobId + ": " + event + " from " + from
                + (from.isTerminal() ? " (terminal)" : ""));
        this.jobId = jobId;
        this.from = from;
        this.event = event;
    }

    public JobId getJobId() {
        return jobId;
    }

    public JobState getFrom() {
        return from;
    }

    public String getEvent() {
        return event;
    }
}
