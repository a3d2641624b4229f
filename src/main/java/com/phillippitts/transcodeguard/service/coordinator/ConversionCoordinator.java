package com.phillippitts.transcodeguard.service.coordinator;

import com.phillippitts.transcodeguard.domain.ConversionJob;
import com.phillippitts.transcodeguard.domain.ConversionRequest;
import com.phillippitts.transcodeguard.domain.ConversionStatistics;
import com.phillippitts.transcodeguard.domain.JobId;
import com.phillippitts.transcodeguard.exception.AlreadyRunningException;
import com.phillippitts.transcodeguard.exception.EngineException;
import com.phillippitts.transcodeguard.exception.OperationTimeoutException;
import com.phillippitts.transcodeguard.exception.ValidationException;
import com.phillippitts.transcodeguard.service.engine.EngineResult;
import com.phillippitts.transcodeguard.service.engine.ProgressEvent;
import com.phillippitts.transcodeguard.service.policy.Decision;
import com.phillippitts.transcodeguard.service.policy.ResourceKind;
import com.phillippitts.transcodeguard.service.policy.Threshold;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Owns the single active conversion job and is the only component that changes job state.
 *
 * <p>Implementations serialize every mutation of the active job, the job history and the
 * policy threshold set behind one lock, so a policy decision and an engine callback can never
 * interleave into an inconsistent job.
 *
 * @since 1.0
 */
public interface ConversionCoordinator {

    /**
     * Creates a job, runs the pre-flight checks and starts the codec engine.
     *
     * @param request what to convert and where to
     * @return id of the new job, RUNNING unless it was cancelled while preparing
     * @throws AlreadyRunningException if a non-terminal job exists
     * @throws ValidationException if a pre-flight check failed; the job ends FAILED
     * @throws OperationTimeoutException if the pre-flight checks timed out; the job ends FAILED
     * @throws EngineException if the engine could not be started; the job ends FAILED
     */
    JobId submit(ConversionRequest request);

    /**
     * Requests cancellation of the active job.
     *
     * @return NOT_FOUND when {@code jobId} is not the active job
     */
    CommandOutcome cancel(JobId jobId);

    /**
     * Pauses the active job at the caller's request. User pauses are never lifted by policy.
     */
    CommandOutcome pause(JobId jobId);

    /**
     * Resumes a paused job after checking current resource state once.
     *
     * @return REJECTED if resources still require the job to stay paused
     */
    CommandOutcome resume(JobId jobId);

    /**
     * Applies an engine progress report. Reports for other jobs and regressing percentages
     * are ignored; 100% completes the job.
     */
    void onProgressEvent(JobId jobId, ProgressEvent event);

    /**
     * Applies the engine's terminal result.
     */
    void onEngineResult(JobId jobId, EngineResult result);

    /**
     * Applies the highest-priority decision to the active job, unless a decision from a newer
     * snapshot was already applied to it. No-op without an active job.
     */
    void onPolicyTick(List<Decision> decisions);

    Optional<ConversionJob> getActiveJob();

    /** Active or historical job by id. */
    Optional<ConversionJob> getJob(JobId jobId);

    /** Up to {@code limit} finished jobs, newest first. */
    List<ConversionJob> getHistory(int limit);

    /** Forgets finished jobs. Statistics are cumulative and unaffected. */
    void clearHistory();

    ConversionStatistics getStatistics();

    void setThreshold(ResourceKind kind, Threshold threshold);

    Optional<Threshold> clearThreshold(ResourceKind kind);

    Map<ResourceKind, Threshold> thresholds();
}
