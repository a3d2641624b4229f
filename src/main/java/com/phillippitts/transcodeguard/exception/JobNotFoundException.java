package com.phillippitts.transcodeguard.exception;

import com.phillippitts.transcodeguard.domain.JobId;

/**
 * Thrown at the API boundary when a job id matches neither the active job nor history.
 */
public class JobNotFoundException extends TranscodeGuardException {

    private final JobId jobId;

    public JobNotFoundException(JobId jobId) {
        super("Job not found: " + jobId);
        this.jobId = jobId;
    }

    public JobId getJobId() {
        return jobId;
    }
}
