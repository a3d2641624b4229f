package com.phillippitts.transcodeguard.service.job;

import com.phillippitts.transcodeguard.domain.ConversionJob;
import com.phillippitts.transcodeguard.domain.FailureReason;
import com.phillippitts.transcodeguard.domain.JobState;
import com.phillippitts.transcodeguard.exception.IllegalTransitionException;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Transition rules for conversion jobs.
 *
 * <p><b>State Transitions:</b>
 * <pre>
 * PENDING    --START-------------&gt; PREPARING
 * PENDING    --CANCEL_REQUEST----&gt; CANCELLED
 * PREPARING  --ENGINE_READY------&gt; RUNNING
 * PREPARING  --VALIDATION_FAILED-&gt; FAILED
 * PREPARING  --PRECHECK_TIMEOUT--&gt; FAILED
 * PREPARING  --ENGINE_ERROR------&gt; FAILED
 * PREPARING  --CANCEL_REQUEST----&gt; CANCELLED   (engine not contacted yet)
 * RUNNING    --PAUSE-------------&gt; PAUSED
 * RUNNING    --PROGRESS_COMPLETE-&gt; COMPLETED
 * RUNNING    --ENGINE_SUCCESS----&gt; COMPLETED
 * RUNNING    --ENGINE_ERROR------&gt; FAILED
 * RUNNING    --ABORT-------------&gt; CANCELLING
 * RUNNING    --CANCEL_REQUEST----&gt; CANCELLING
 * PAUSED     --RESUME------------&gt; RUNNING
 * PAUSED     --ABORT-------------&gt; CANCELLING
 * PAUSED     --CANCEL_REQUEST----&gt; CANCELLING
 * PAUSED     --ENGINE_ERROR------&gt; FAILED
 * CANCELLING --ENGINE_STOPPED----&gt; CANCELLED
 * CANCELLING --STOP_TIMEOUT------&gt; CANCELLED
 * </pre>
 * COMPLETED, FAILED and CANCELLED accept nothing.
 *
 * <p>Stateless and thread-safe; callers own the job instance and serialize changes to it.
 */
public final class JobStateMachine {

    private static final Map<JobState, Map<JobEvent, JobState>> TRANSITIONS = buildTable();

    private static Map<JobState, Map<JobEvent, JobState>> buildTable() {
        Map<JobState, Map<JobEvent, JobState>> table = new EnumMap<>(JobState.class);
        for (JobState s : JobState.values()) {
            table.put(s, new EnumMap<>(JobEvent.class));
        }
        table.get(JobState.PENDING).put(JobEvent.START, JobState.PREPARING);
        table.get(JobState.PENDING).put(JobEvent.CANCEL_REQUEST, JobState.CANCELLED);

        table.get(JobState.PREPARING).put(JobEvent.ENGINE_READY, JobState.RUNNING);
        table.get(JobState.PREPARING).put(JobEvent.VALIDATION_FAILED, JobState.FAILED);
        table.get(JobState.PREPARING).put(JobEvent.PRECHECK_TIMEOUT, JobState.FAILED);
        table.get(JobState.PREPARING).put(JobEvent.ENGINE_ERROR, JobState.FAILED);
        table.get(JobState.PREPARING).put(JobEvent.CANCEL_REQUEST, JobState.CANCELLED);

        table.get(JobState.RUNNING).put(JobEvent.PAUSE, JobState.PAUSED);
        table.get(JobState.RUNNING).put(JobEvent.PROGRESS_COMPLETE, JobState.COMPLETED);
        table.get(JobState.RUNNING).put(JobEvent.ENGINE_SUCCESS, JobState.COMPLETED);
        table.get(JobState.RUNNING).put(JobEvent.ENGINE_ERROR, JobState.FAILED);
        table.get(JobState.RUNNING).put(JobEvent.ABORT, JobState.CANCELLING);
        table.get(JobState.RUNNING).put(JobEvent.CANCEL_REQUEST, JobState.CANCELLING);

        table.get(JobState.PAUSED).put(JobEvent.RESUME, JobState.RUNNING);
        table.get(JobState.PAUSED).put(JobEvent.ABORT, JobState.CANCELLING);
        table.get(JobState.PAUSED).put(JobEvent.CANCEL_REQUEST, JobState.CANCELLING);
        table.get(JobState.PAUSED).put(JobEvent.ENGINE_ERROR, JobState.FAILED);

        table.get(JobState.CANCELLING).put(JobEvent.ENGINE_STOPPED, JobState.CANCELLED);
        table.get(JobState.CANCELLING).put(JobEvent.STOP_TIMEOUT, JobState.CANCELLED);

        Map<JobState, Map<JobEvent, JobState>> frozen = new EnumMap<>(JobState.class);
        table.forEach((k, v) -> frozen.put(k, Collections.unmodifiableMap(v)));
        return Collections.unmodifiableMap(frozen);
    }

    /**
     * Target state for {@code event} in {@code from}, if the transition is defined.
     */
    public Optional<JobState> target(JobState from, JobEvent event) {
        return Optional.ofNullable(TRANSITIONS.get(from).get(event));
    }

    public boolean canFire(JobState from, JobEvent event) {
        return TRANSITIONS.get(from).containsKey(event);
    }

    /**
     * Applies {@code event} to {@code job}.
     *
     * @return the job in its new state, with timestamps set once
     * @throws IllegalTransitionException if the event is not defined for the job's state,
     *         always the case for terminal states
     */
    public ConversionJob fire(ConversionJob job, JobEvent event, Instant now) {
        Objects.requireNonNull(job, "job");
        Objects.requireNonNull(event, "event");
        JobState next = TRANSITIONS.get(job.state()).get(event);
        if (next == null) {
            throw new IllegalTransitionException(job.id(), job.state(), event.name());
        }
        return job.withState(next, now);
    }

    /**
     * Applies a failure event and records why.
     *
     * @throws IllegalArgumentException if {@code event} does not lead to FAILED
     * @throws IllegalTransitionException if the event is not defined for the job's state
     */
    public ConversionJob fail(ConversionJob job, JobEvent event, FailureReason reason, Instant now) {
        Objects.requireNonNull(reason, "reason");
        if (event != JobEvent.VALIDATION_FAILED && event != JobEvent.PRECHECK_TIMEOUT
                && event != JobEvent.ENGINE_ERROR) {
            throw new IllegalArgumentException(event + " is not a failure event");
        }
        return fire(job, event, now).withFailureReason(reason);
    }
}
