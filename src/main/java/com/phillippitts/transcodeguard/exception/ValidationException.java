package com.phillippitts.transcodeguard.exception;

import com.phillippitts.transcodeguard.domain.JobId;

/**
 * Thrown when a conversion request fails its prechecks (input missing, output not writable,
 * not enough free space). The job has already been recorded as FAILED when this is thrown.
 */
public class ValidationException extends TranscodeGuardException {

    public enum ValidationFailure {
        INPUT_MISSING("input not accessible"),
        OUTPUT_NOT_WRITABLE("output not writable"),
        INSUFFICIENT_STORAGE("insufficient storage");

        private final String description;

        ValidationFailure(String description) {
            this.description = description;
        }

        public String description() {
            return description;
        }
    }

    private final ValidationFailure failure;
    private final String detail;
    private final JobId jobId;

    public ValidationException(ValidationFailure failure, String detail) {
        this(failure, detail, null);
    }

    public ValidationException(ValidationFailure failure, String detail, JobId jobId) {
        super(failure.description() + (detail == null || detail.isBlank() ? "" : ": " + detail));
        this.failure = failure;
        this.detail = detail;
        this.jobId = jobId;
    }

    public ValidationFailure getFailure() {
        return failure;
    }

    /** Job that failed validation, or null when raised before a job existed. */
    public JobId getJobId() {
        return jobId;
    }

    public String getDetail() {
        return detail;
    }

    public ValidationException forJob(JobId id) {
        return new ValidationException(failure, detail, id);
    }
}
