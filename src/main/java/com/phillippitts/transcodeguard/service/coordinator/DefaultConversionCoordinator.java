package com.phillippitts.transcodeguard.service.coordinator;

import com.phillippitts.transcodeguard.domain.Alert;
import com.phillippitts.transcodeguard.domain.AlertKind;
import com.phillippitts.transcodeguard.domain.AlertSeverity;
import com.phillippitts.transcodeguard.domain.ConversionJob;
import com.phillippitts.transcodeguard.domain.ConversionRequest;
import com.phillippitts.transcodeguard.domain.ConversionStatistics;
import com.phillippitts.transcodeguard.domain.FailureReason;
import com.phillippitts.transcodeguard.domain.InputDescriptor;
import com.phillippitts.transcodeguard.domain.JobId;
import com.phillippitts.transcodeguard.domain.JobProgress;
import com.phillippitts.transcodeguard.domain.JobState;
import com.phillippitts.transcodeguard.domain.PauseOrigin;
import com.phillippitts.transcodeguard.domain.ResourceSnapshot;
import com.phillippitts.transcodeguard.exception.AlreadyRunningException;
import com.phillippitts.transcodeguard.exception.EngineException;
import com.phillippitts.transcodeguard.exception.OperationTimeoutException;
import com.phillippitts.transcodeguard.exception.TranscodeGuardException;
import com.phillippitts.transcodeguard.exception.ValidationException;
import com.phillippitts.transcodeguard.exception.ValidationException.ValidationFailure;
import com.phillippitts.transcodeguard.service.alert.AlertLog;
import com.phillippitts.transcodeguard.service.engine.CodecEngine;
import com.phillippitts.transcodeguard.service.engine.EngineHandle;
import com.phillippitts.transcodeguard.service.engine.EngineResult;
import com.phillippitts.transcodeguard.service.engine.ProgressEvent;
import com.phillippitts.transcodeguard.service.events.ConversionEventBus;
import com.phillippitts.transcodeguard.service.events.JobStateChangedEvent;
import com.phillippitts.transcodeguard.service.events.ProgressUpdatedEvent;
import com.phillippitts.transcodeguard.service.job.JobEvent;
import com.phillippitts.transcodeguard.service.job.JobStateMachine;
import com.phillippitts.transcodeguard.service.metrics.ConversionMetrics;
import com.phillippitts.transcodeguard.service.monitor.ResourceMonitor;
import com.phillippitts.transcodeguard.service.monitor.SnapshotListener;
import com.phillippitts.transcodeguard.service.policy.Decision;
import com.phillippitts.transcodeguard.service.policy.DecisionType;
import com.phillippitts.transcodeguard.service.policy.PolicyEngine;
import com.phillippitts.transcodeguard.service.policy.PolicyEvaluation;
import com.phillippitts.transcodeguard.service.policy.ResourceKind;
import com.phillippitts.transcodeguard.service.policy.Threshold;
import com.phillippitts.transcodeguard.service.storage.FileStore;
import com.phillippitts.transcodeguard.util.BoundedHistory;
import com.phillippitts.transcodeguard.util.ByteSizes;
import org.apache.logging.log4j.CloseableThreadContext;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Default {@link ConversionCoordinator}.
 *
 * <p>One {@link ReentrantLock} guards the active job, its engine handle, the last applied
 * decision timestamp, the policy engine and the statistics counters. Engine callbacks arrive
 * through an {@link EngineEventChannel} and are applied on its dispatcher thread in arrival
 * order; policy ticks arrive on the resource monitor thread via {@link #onSnapshot}.
 *
 * <p><b>Blocking:</b> pre-flight checks run on the precheck executor without the lock held.
 * Revalidation before a resume reads telemetry while holding the lock, bounded by the
 * monitor's snapshot timeout.
 *
 * <p><b>Stop acknowledgement:</b> a stop request waits at most {@code engine-stop-timeout}.
 * After that the job is forced to CANCELLED, flagged {@code engineResourcesLeaked} and an
 * {@link AlertKind#ENGINE_STOP_TIMEOUT} alert is recorded.
 *
 * @since 1.0
 */
public class DefaultConversionCoordinator implements ConversionCoordinator, SnapshotListener, AutoCloseable {

    private static final Logger LOG = LogManager.getLogger(DefaultConversionCoordinator.class);

    static final String MDC_JOB_ID = "jobId";

    private final CodecEngine engine;
    private final FileStore fileStore;
    private final ResourceMonitor monitor;
    private final PolicyEngine policy;
    private final JobStateMachine stateMachine;
    private final AlertLog alertLog;
    private final ConversionEventBus bus;
    private final ConversionMetrics metrics;
    private final Executor precheckExecutor;
    private final Clock clock;
    private final Duration pollInterval;
    private final Duration engineStopTimeout;
    private final Duration precheckTimeout;
    private final double spaceSafetyFactor;
    private final BoundedHistory<ConversionJob> history;
    private final EngineEventChannel engineEvents;

    private final Lock lock = new ReentrantLock();

    // Guarded by lock
    private ConversionJob active;
    private EngineHandle handle;
    private Instant lastDecisionAt;
    private long submitted;
    private long completed;
    private long failed;
    private long cancelled;
    private Duration completedTime = Duration.ZERO;

    DefaultConversionCoordinator(ConversionCoordinatorBuilder b) {
        this.engine = b.codecEngine;
        this.fileStore = b.fileStore;
        this.monitor = b.resourceMonitor;
        this.policy = b.policyEngine;
        this.stateMachine = b.stateMachine;
        this.alertLog = b.alertLog;
        this.bus = b.eventBus;
        this.metrics = b.metrics;
        this.precheckExecutor = b.precheckExecutor;
        this.clock = b.clock;
        this.pollInterval = b.pollInterval;
        this.engineStopTimeout = b.properties.engineStopTimeout();
        this.precheckTimeout = b.properties.precheckTimeout();
        this.spaceSafetyFactor = b.properties.getSpaceSafetyFactor();
        this.history = new BoundedHistory<>(b.properties.getHistorySize());
        this.engineEvents = new EngineEventChannel(b.properties.getEngineEventQueueCapacity(), this::dispatch);
    }

    // ---------------------------------------------------------------- submission

    @Override
    public JobId submit(ConversionRequest request) {
        Objects.requireNonNull(request, "request");
        ConversionJob job;
        lock.lock();
        try {
            if (active != null) {
                LOG.info("Submission rejected: job {} is {}", active.id(), active.state());
                throw new AlreadyRunningException(active.id());
            }
            job = ConversionJob.pending(JobId.random(), request, clock.instant());
            active = job;
            handle = null;
            lastDecisionAt = null;
            submitted++;
            metrics.incrementSubmitted();
            publishState(null, job);
            transition(JobEvent.START);
        } finally {
            lock.unlock();
        }

        try (CloseableThreadContext.Instance ctx = jobContext(job.id())) {
            LOG.info("Job {} submitted: {} -> {}", job.id(), request.input().path(), request.output().path());
            monitor.start(pollInterval);
            PrecheckFailure failure = runPrechecks(job);
            return startEngine(job.id(), failure);
        }
    }

    private record PrecheckFailure(JobEvent event, FailureReason reason, RuntimeException error) {
    }

    private PrecheckFailure runPrechecks(ConversionJob job) {
        CompletableFuture<Void> checks = null;
        try {
            checks = CompletableFuture.runAsync(() -> precheck(job), precheckExecutor);
            checks.get(precheckTimeout.toMillis(), TimeUnit.MILLISECONDS);
            return null;
        } catch (TimeoutException e) {
            checks.cancel(true);
            OperationTimeoutException timeout =
                    new OperationTimeoutException(OperationTimeoutException.Operation.PRECHECK, precheckTimeout);
            return new PrecheckFailure(JobEvent.PRECHECK_TIMEOUT,
                    new FailureReason(FailureReason.Category.TIMEOUT, "PRECHECK_TIMEOUT", timeout.getMessage()),
                    timeout);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof ValidationException ve) {
                ValidationException forJob = ve.forJob(job.id());
                return new PrecheckFailure(JobEvent.VALIDATION_FAILED,
                        new FailureReason(FailureReason.Category.VALIDATION, ve.getFailure().name(), ve.getMessage()),
                        forJob);
            }
            return unexpectedPrecheckFailure(cause);
        } catch (RejectedExecutionException e) {
            return unexpectedPrecheckFailure(e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return unexpectedPrecheckFailure(e);
        }
    }

    private static PrecheckFailure unexpectedPrecheckFailure(Throwable cause) {
        TranscodeGuardException error = new TranscodeGuardException("Pre-flight checks failed: " + cause, cause);
        return new PrecheckFailure(JobEvent.VALIDATION_FAILED,
                new FailureReason(FailureReason.Category.VALIDATION, "PRECHECK_ERROR", error.getMessage()), error);
    }

    /**
     * Input readable, output location writable, and enough free space for the input size times
     * the safety factor.
     */
    private void precheck(ConversionJob job) {
        InputDescriptor input = job.input();
        if (!fileStore.isReadable(input.path())) {
            throw new ValidationException(ValidationFailure.INPUT_MISSING, input.path().toString());
        }
        if (!fileStore.isWritableTarget(job.output().path())) {
            throw new ValidationException(ValidationFailure.OUTPUT_NOT_WRITABLE, job.output().path().toString());
        }
        long inputSize = input.sizeBytes();
        long free;
        try {
            if (inputSize == 0) {
                inputSize = fileStore.size(input.path());
            }
            free = fileStore.freeSpace(job.output().path());
        } catch (IOException e) {
            throw new ValidationException(ValidationFailure.OUTPUT_NOT_WRITABLE,
                    "unable to query " + job.output().path() + ": " + e.getMessage());
        }
        long required = (long) Math.ceil(inputSize * spaceSafetyFactor);
        if (free < required) {
            throw new ValidationException(ValidationFailure.INSUFFICIENT_STORAGE,
                    "need " + ByteSizes.format(required) + ", " + ByteSizes.format(free) + " available");
        }
        LOG.debug("Pre-flight checks passed (required={}, free={})", required, free);
    }

    private JobId startEngine(JobId id, PrecheckFailure failure) {
        lock.lock();
        try {
            if (!isActive(id) || active.state() != JobState.PREPARING) {
                LOG.info("Job {} left PREPARING before the engine was started", id);
                return id;
            }
            if (failure != null) {
                LOG.warn("Job {} failed pre-flight checks: {}", id, failure.reason().message());
                fail(failure.event(), failure.reason());
                throw failure.error();
            }
            ConversionJob job = active;
            try {
                handle = engine.begin(job.input(), job.output(), engineEvents.listenerFor(id));
            } catch (EngineException e) {
                LOG.error("Engine {} failed to start job {}: {}", engine.getEngineName(), id, e.getMessage());
                fail(JobEvent.ENGINE_ERROR,
                        new FailureReason(FailureReason.Category.ENGINE, e.getCode(), e.getMessage()));
                throw e;
            } catch (RuntimeException e) {
                EngineException wrapped = new EngineException("ENGINE_START_FAILED",
                        "Engine " + engine.getEngineName() + " failed to start: " + e.getMessage(), e);
                LOG.error("Engine {} failed to start job {}", engine.getEngineName(), id, e);
                fail(JobEvent.ENGINE_ERROR,
                        new FailureReason(FailureReason.Category.ENGINE, wrapped.getCode(), wrapped.getMessage()));
                throw wrapped;
            }
            transition(JobEvent.ENGINE_READY);
            LOG.info("Job {} running on {}", id, engine.getEngineName());
            return id;
        } finally {
            lock.unlock();
        }
    }

    // ---------------------------------------------------------------- commands

    @Override
    public CommandOutcome cancel(JobId jobId) {
        lock.lock();
        try (CloseableThreadContext.Instance ctx = jobContext(jobId)) {
            if (!isActive(jobId)) {
                LOG.debug("cancel({}) ignored: not the active job", jobId);
                return CommandOutcome.NOT_FOUND;
            }
            JobState state = active.state();
            if (state == JobState.PENDING || state == JobState.PREPARING) {
                transition(JobEvent.CANCEL_REQUEST);
            } else if (state == JobState.RUNNING || state == JobState.PAUSED) {
                LOG.info("Cancelling job {} at {}%", jobId, active.progress().percent());
                beginCancelling(JobEvent.CANCEL_REQUEST);
            }
            return CommandOutcome.ACCEPTED;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public CommandOutcome pause(JobId jobId) {
        lock.lock();
        try (CloseableThreadContext.Instance ctx = jobContext(jobId)) {
            if (!isActive(jobId)) {
                return CommandOutcome.NOT_FOUND;
            }
            if (active.state() == JobState.RUNNING) {
                pauseEngine(PauseOrigin.USER, "paused by user");
                return CommandOutcome.ACCEPTED;
            }
            if (active.state() == JobState.PAUSED) {
                // A user pause is never lifted by policy
                active = active.withPauseOrigin(PauseOrigin.USER);
                return CommandOutcome.ACCEPTED;
            }
            return CommandOutcome.REJECTED;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public CommandOutcome resume(JobId jobId) {
        lock.lock();
        try (CloseableThreadContext.Instance ctx = jobContext(jobId)) {
            if (!isActive(jobId)) {
                return CommandOutcome.NOT_FOUND;
            }
            if (active.state() == JobState.RUNNING) {
                return CommandOutcome.ACCEPTED;
            }
            if (active.state() != JobState.PAUSED) {
                return CommandOutcome.REJECTED;
            }
            return resumeWithRevalidation();
        } finally {
            lock.unlock();
        }
    }

    // ---------------------------------------------------------------- engine callbacks

    private void dispatch(EngineEventChannel.Envelope envelope) {
        if (envelope.progress() != null) {
            onProgressEvent(envelope.jobId(), envelope.progress());
        } else {
            onEngineResult(envelope.jobId(), envelope.result());
        }
    }

    @Override
    public void onProgressEvent(JobId jobId, ProgressEvent event) {
        Objects.requireNonNull(event, "event");
        lock.lock();
        try (CloseableThreadContext.Instance ctx = jobContext(jobId)) {
            if (!isActive(jobId)) {
                LOG.debug("Progress for inactive job {} ignored", jobId);
                return;
            }
            JobState state = active.state();
            if (state != JobState.RUNNING && state != JobState.PAUSED) {
                LOG.debug("Progress ignored while {}", state);
                return;
            }
            JobProgress current = active.progress();
            if (Double.isNaN(event.percent()) || event.percent() < current.percent()) {
                LOG.debug("Ignoring non-monotonic progress {}% (current {}%)", event.percent(), current.percent());
                return;
            }
            JobProgress next = new JobProgress(event.percent(), event.phase(), event.processedUnits(),
                    event.totalUnits(), event.etaSeconds());
            active = active.withProgress(next);
            bus.publish(new ProgressUpdatedEvent(jobId, next, clock.instant()));
            if (next.isComplete()) {
                complete(JobEvent.PROGRESS_COMPLETE);
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void onEngineResult(JobId jobId, EngineResult result) {
        Objects.requireNonNull(result, "result");
        lock.lock();
        try (CloseableThreadContext.Instance ctx = jobContext(jobId)) {
            if (!isActive(jobId)) {
                LOG.debug("Engine result for inactive job {} ignored (success={})", jobId, result.success());
                return;
            }
            switch (active.state()) {
                case CANCELLING -> {
                    LOG.info("Engine finished while cancelling job {}; treating as stop acknowledgement", jobId);
                    transition(JobEvent.ENGINE_STOPPED);
                }
                case RUNNING, PAUSED -> {
                    if (result.success()) {
                        complete(JobEvent.ENGINE_SUCCESS);
                    } else {
                        LOG.error("Engine failed job {}: [{}] {}", jobId, result.code(), result.message());
                        fail(JobEvent.ENGINE_ERROR,
                                new FailureReason(FailureReason.Category.ENGINE, result.code(), result.message()));
                    }
                }
                default -> LOG.debug("Engine result ignored while {}", active.state());
            }
        } finally {
            lock.unlock();
        }
    }

    // ---------------------------------------------------------------- policy

    /**
     * Evaluates a fresh snapshot against the active job, records the resulting alerts and
     * applies the decisions. Called on the resource monitor thread.
     */
    @Override
    public void onSnapshot(ResourceSnapshot snapshot) {
        lock.lock();
        try {
            ConversionJob job = active;
            PolicyEvaluation evaluation = policy.evaluate(snapshot,
                    job == null ? null : job.state(), job == null ? null : job.id());
            for (Alert alert : evaluation.alerts()) {
                alertLog.record(alert);
            }
            onPolicyTick(evaluation.decisions());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void onPolicyTick(List<Decision> decisions) {
        Objects.requireNonNull(decisions, "decisions");
        if (decisions.isEmpty()) {
            return;
        }
        Decision primary = primaryOf(decisions);
        lock.lock();
        try {
            metrics.recordDecision(primary.type());
            if (active == null) {
                return;
            }
            try (CloseableThreadContext.Instance ctx = jobContext(active.id())) {
                if (primary.isOlderThan(lastDecisionAt)) {
                    LOG.debug("Discarding stale {} decision from snapshot {} (already applied {})",
                            primary.type(), primary.snapshotTimestamp(), lastDecisionAt);
                    return;
                }
                lastDecisionAt = primary.snapshotTimestamp();
                apply(primary);
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Highest-priority decision: an action (abort, pause, throttle) ranked by resource kind
     * order, then an alert, then continue.
     */
    static Decision primaryOf(List<Decision> decisions) {
        return decisions.stream()
                .min(Comparator.comparingInt(DefaultConversionCoordinator::rank))
                .orElseThrow();
    }

    private static int rank(Decision d) {
        int kinds = ResourceKind.values().length;
        return switch (d.type()) {
            case ABORT, PAUSE, THROTTLE -> d.kind() == null ? kinds : d.kind().ordinal();
            case ALERT -> kinds + 1;
            case CONTINUE -> kinds + 2;
        };
    }

    private void apply(Decision decision) {
        JobState state = active.state();
        if (state == JobState.RUNNING) {
            applyWhileRunning(decision);
        } else if (state == JobState.PAUSED) {
            applyWhilePaused(decision);
        } else {
            LOG.debug("{} decision not applicable while {}", decision.type(), state);
        }
    }

    private void applyWhileRunning(Decision decision) {
        switch (decision.type()) {
            case ABORT -> {
                LOG.warn("Aborting job {}: {}", active.id(), decision.reason());
                beginCancelling(JobEvent.ABORT);
            }
            case PAUSE -> pauseEngine(PauseOrigin.POLICY, decision.reason());
            case THROTTLE -> setThrottle(true, decision.reason());
            case CONTINUE, ALERT -> setThrottle(false, decision.reason());
        }
    }

    private void applyWhilePaused(Decision decision) {
        switch (decision.type()) {
            case ABORT -> {
                LOG.warn("Aborting paused job {}: {}", active.id(), decision.reason());
                beginCancelling(JobEvent.ABORT);
            }
            case PAUSE -> LOG.debug("Job {} stays paused: {}", active.id(), decision.reason());
            case THROTTLE, CONTINUE, ALERT -> {
                if (active.pauseOrigin() == PauseOrigin.POLICY) {
                    resumeWithRevalidation();
                }
            }
        }
    }

    private void pauseEngine(PauseOrigin origin, String reason) {
        try {
            handle.pause();
        } catch (RuntimeException e) {
            LOG.warn("Engine pause failed for job {}: {}", active.id(), e.toString());
        }
        ConversionJob before = active;
        ConversionJob after = stateMachine.fire(before, JobEvent.PAUSE, clock.instant()).withPauseOrigin(origin);
        LOG.info("Job {} paused ({}): {}", before.id(), origin, reason);
        commit(before, after, JobEvent.PAUSE);
    }

    /**
     * Reads resources once more before leaving PAUSED. Stays paused (or aborts) if the fresh
     * reading still calls for it; resumes throttled if it calls for throttling.
     */
    private CommandOutcome resumeWithRevalidation() {
        JobId id = active.id();
        Decision check = null;
        try {
            ResourceSnapshot fresh = monitor.snapshotNow();
            check = primaryOf(policy.assess(fresh));
            if (fresh.stale()) {
                LOG.warn("Revalidating job {} against a stale snapshot from {}", id, fresh.timestamp());
            }
        } catch (TranscodeGuardException e) {
            LOG.warn("No resource data to revalidate job {} before resume: {}", id, e.getMessage());
        }

        if (check != null) {
            if (!check.isOlderThan(lastDecisionAt)) {
                lastDecisionAt = check.snapshotTimestamp();
            }
            if (check.type() == DecisionType.ABORT) {
                LOG.warn("Revalidation before resume requires abort of job {}: {}", id, check.reason());
                beginCancelling(JobEvent.ABORT);
                return CommandOutcome.REJECTED;
            }
            if (check.type() == DecisionType.PAUSE) {
                LOG.info("Job {} stays paused after revalidation: {}", id, check.reason());
                return CommandOutcome.REJECTED;
            }
        }

        try {
            handle.resume();
        } catch (RuntimeException e) {
            LOG.warn("Engine resume failed for job {}: {}", id, e.toString());
        }
        transition(JobEvent.RESUME);
        boolean throttle = check != null && check.type() == DecisionType.THROTTLE;
        setThrottle(throttle, check == null ? "no resource data" : check.reason());
        return CommandOutcome.ACCEPTED;
    }

    private void setThrottle(boolean enabled, String reason) {
        if (active.throttled() == enabled) {
            return;
        }
        try {
            handle.setThrottled(enabled);
        } catch (RuntimeException e) {
            LOG.warn("Engine throttle change failed for job {}: {}", active.id(), e.toString());
            return;
        }
        active = active.withThrottled(enabled);
        if (enabled) {
            LOG.info("Job {} throttled: {}", active.id(), reason);
        } else {
            LOG.info("Job {} throttle lifted: {}", active.id(), reason);
        }
    }

    // ---------------------------------------------------------------- cancellation

    private void beginCancelling(JobEvent event) {
        ConversionJob job = transition(event);
        JobId id = job.id();
        CompletableFuture<Void> ack;
        try {
            ack = handle == null ? CompletableFuture.completedFuture(null) : handle.stop();
            if (ack == null) {
                ack = CompletableFuture.failedFuture(new IllegalStateException("engine returned no stop future"));
            }
        } catch (RuntimeException e) {
            ack = CompletableFuture.failedFuture(e);
        }
        ack.copy()
                .orTimeout(engineStopTimeout.toMillis(), TimeUnit.MILLISECONDS)
                .whenComplete((ignored, error) -> onStopOutcome(id, error));
    }

    private void onStopOutcome(JobId id, Throwable error) {
        lock.lock();
        try (CloseableThreadContext.Instance ctx = jobContext(id)) {
            if (!isActive(id) || active.state() != JobState.CANCELLING) {
                return;
            }
            if (error == null) {
                LOG.info("Engine acknowledged stop for job {}", id);
                transition(JobEvent.ENGINE_STOPPED);
                return;
            }
            Throwable cause = error instanceof CompletionException && error.getCause() != null
                    ? error.getCause() : error;
            String message = cause instanceof TimeoutException
                    ? "Engine did not acknowledge stop of job " + id + " within " + engineStopTimeout.toMillis()
                            + " ms; engine resources may be leaked"
                    : "Engine stop failed for job " + id + " (" + cause + "); engine resources may be leaked";
            LOG.error(message);
            active = active.withEngineResourcesLeaked();
            transition(JobEvent.STOP_TIMEOUT);
            alertLog.record(Alert.raise(AlertSeverity.ERROR, AlertKind.ENGINE_STOP_TIMEOUT, message, null, id,
                    clock.instant()));
        } finally {
            lock.unlock();
        }
    }

    // ---------------------------------------------------------------- transitions

    private void complete(JobEvent event) {
        if (active.state() == JobState.PAUSED) {
            // The engine finished before the pause took effect
            transition(JobEvent.RESUME);
        }
        active = active.withProgress(active.progress().finished());
        transition(event);
    }

    private ConversionJob transition(JobEvent event) {
        ConversionJob before = active;
        return commit(before, stateMachine.fire(before, event, clock.instant()), event);
    }

    private ConversionJob fail(JobEvent event, FailureReason reason) {
        ConversionJob before = active;
        return commit(before, stateMachine.fail(before, event, reason, clock.instant()), event);
    }

    private ConversionJob commit(ConversionJob before, ConversionJob after, JobEvent event) {
        LOG.info("Job {} {} -> {} ({})", after.id(), before.state(), after.state(), event);
        publishState(before.state(), after);
        if (after.isTerminal()) {
            finish(after);
        } else {
            active = after;
        }
        return after;
    }

    private void finish(ConversionJob job) {
        active = null;
        handle = null;
        lastDecisionAt = null;
        history.add(job);

        Instant from = job.startedAt() != null ? job.startedAt() : job.createdAt();
        Duration elapsed = Duration.between(from, job.endedAt());
        switch (job.state()) {
            case COMPLETED -> {
                completed++;
                completedTime = completedTime.plus(elapsed);
            }
            case FAILED -> failed++;
            case CANCELLED -> cancelled++;
            default -> throw new IllegalStateException("finish() on non-terminal job " + job.id());
        }
        metrics.recordFinished(job.state(), elapsed);
    }

    private void publishState(JobState from, ConversionJob job) {
        bus.publish(new JobStateChangedEvent(job.id(), from, job.state(), job, clock.instant()));
    }

    private boolean isActive(JobId jobId) {
        return active != null && active.id().equals(jobId);
    }

    private static CloseableThreadContext.Instance jobContext(JobId jobId) {
        return CloseableThreadContext.put(MDC_JOB_ID, jobId == null ? "-" : jobId.value());
    }

    // ---------------------------------------------------------------- queries

    @Override
    public Optional<ConversionJob> getActiveJob() {
        lock.lock();
        try {
            return Optional.ofNullable(active);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<ConversionJob> getJob(JobId jobId) {
        Objects.requireNonNull(jobId, "jobId");
        lock.lock();
        try {
            if (isActive(jobId)) {
                return Optional.of(active);
            }
        } finally {
            lock.unlock();
        }
        return history.find(job -> job.id().equals(jobId));
    }

    @Override
    public List<ConversionJob> getHistory(int limit) {
        return history.newestFirst(limit);
    }

    @Override
    public void clearHistory() {
        history.clear();
        LOG.info("Job history cleared");
    }

    @Override
    public ConversionStatistics getStatistics() {
        lock.lock();
        try {
            Duration average = completed == 0 ? Duration.ZERO : completedTime.dividedBy(completed);
            return new ConversionStatistics(submitted, completed, failed, cancelled, average);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void setThreshold(ResourceKind kind, Threshold threshold) {
        lock.lock();
        try {
            policy.setThreshold(kind, threshold);
            LOG.info("Threshold for {} set: {}", kind, threshold);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<Threshold> clearThreshold(ResourceKind kind) {
        lock.lock();
        try {
            Optional<Threshold> removed = policy.clearThreshold(kind);
            removed.ifPresent(t -> LOG.info("Threshold for {} cleared", kind));
            return removed;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Map<ResourceKind, Threshold> thresholds() {
        lock.lock();
        try {
            return policy.thresholds();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Waits until queued engine callbacks have been applied.
     */
    boolean awaitEngineEvents(Duration timeout) throws InterruptedException {
        return engineEvents.awaitIdle(timeout);
    }

    /**
     * Asks a still-running engine to stop and shuts down engine event dispatch.
     */
    @Override
    public void close() {
        lock.lock();
        try {
            if (active != null && handle != null) {
                LOG.warn("Shutting down with job {} {}; stopping engine", active.id(), active.state());
                try {
                    handle.stop();
                } catch (RuntimeException e) {
                    LOG.warn("Engine stop failed during shutdown: {}", e.toString());
                }
            }
        } finally {
            lock.unlock();
        }
        engineEvents.close();
    }
}
