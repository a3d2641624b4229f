package com.phillippitts.transcodeguard.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable view of one conversion job at a point in time.
 *
 * <p>The coordinator replaces its active instance on every change; once a job reaches a terminal
 * state the last instance is retained as the historical record. Timestamps are written once:
 * {@code startedAt} on first entry to RUNNING, {@code endedAt} on entry to a terminal state.
 *
 * @param id immutable identifier
 * @param state lifecycle state
 * @param input source description
 * @param output destination and encode parameters
 * @param progress last applied progress
 * @param createdAt creation time
 * @param startedAt first time the job entered RUNNING, or null
 * @param endedAt time the job entered a terminal state, or null
 * @param failureReason set only on FAILED
 * @param throttled whether the engine is currently running throttled
 * @param pauseOrigin who paused the job while PAUSED, otherwise null
 * @param engineResourcesLeaked true when the engine never acknowledged a stop request
 */
public record ConversionJob(
        JobId id,
        JobState state,
        InputDescriptor input,
        OutputTarget output,
        JobProgress progress,
        Instant createdAt,
        Instant startedAt,
        Instant endedAt,
        FailureReason failureReason,
        boolean throttled,
        PauseOrigin pauseOrigin,
        boolean engineResourcesLeaked
) {
    public ConversionJob {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(input, "input");
        Objects.requireNonNull(output, "output");
        Objects.requireNonNull(createdAt, "createdAt");
        if (progress == null) {
            progress = JobProgress.NONE;
        }
    }

    /** New job in {@link JobState#PENDING}. */
    public static ConversionJob pending(JobId id, ConversionRequest request, Instant now) {
        return new ConversionJob(id, JobState.PENDING, request.input(), request.output(),
                JobProgress.NONE, now, null, null, null, false, null, false);
    }

    public boolean isTerminal() {
        return state.isTerminal();
    }

    public boolean isActive() {
        return !state.isTerminal();
    }

    public ConversionJob withState(JobState newState, Instant now) {
        Instant started = startedAt;
        if (started == null && newState == JobState.RUNNING) {
            started = now;
        }
        Instant ended = endedAt;
        if (ended == null && newState.isTerminal()) {
            ended = now;
        }
        PauseOrigin origin = newState == JobState.PAUSED ? pauseOrigin : null;
        boolean stillThrottled = throttled && !newState.isTerminal();
        return new ConversionJob(id, newState, input, output, progress, createdAt, started, ended,
                failureReason, stillThrottled, origin, engineResourcesLeaked);
    }

    public ConversionJob withProgress(JobProgress newProgress) {
        return new ConversionJob(id, state, input, output, newProgress, createdAt, startedAt, endedAt,
                failureReason, throttled, pauseOrigin, engineResourcesLeaked);
    }

    public ConversionJob withFailureReason(FailureReason reason) {
        if (failureReason != null) {
            return this;
        }
        return new ConversionJob(id, state, input, output, progress, createdAt, startedAt, endedAt,
                reason, throttled, pauseOrigin, engineResourcesLeaked);
    }

    public ConversionJob withThrottled(boolean value) {
        return new ConversionJob(id, state, input, output, progress, createdAt, startedAt, endedAt,
                failureReason, value, pauseOrigin, engineResourcesLeaked);
    }

    public ConversionJob withPauseOrigin(PauseOrigin origin) {
        return new ConversionJob(id, state, input, output, progress, createdAt, startedAt, endedAt,
                failureReason, throttled, origin, engineResourcesLeaked);
    }

    public ConversionJob withEngineResourcesLeaked() {
        return new ConversionJob(id, state, input, output, progress, createdAt, startedAt, endedAt,
                failureReason, throttled, pauseOrigin, true);
    }
}
