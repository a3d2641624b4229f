package com.phillippitts.transcodeguard.service.coordinator;

import com.phillippitts.transcodeguard.config.properties.ConversionProperties;
import com.phillippitts.transcodeguard.domain.Alert;
import com.phillippitts.transcodeguard.domain.AlertKind;
import com.phillippitts.transcodeguard.domain.AlertSeverity;
import com.phillippitts.transcodeguard.domain.ConversionJob;
import com.phillippitts.transcodeguard.domain.ConversionRequest;
import com.phillippitts.transcodeguard.domain.ConversionStatistics;
import com.phillippitts.transcodeguard.domain.EncodeParameters;
import com.phillippitts.transcodeguard.domain.FailureReason;
import com.phillippitts.transcodeguard.domain.InputDescriptor;
import com.phillippitts.transcodeguard.domain.JobId;
import com.phillippitts.transcodeguard.domain.JobState;
import com.phillippitts.transcodeguard.domain.OutputTarget;
import com.phillippitts.transcodeguard.domain.PauseOrigin;
import com.phillippitts.transcodeguard.domain.ResourceSnapshot;
import com.phillippitts.transcodeguard.domain.ThermalState;
import com.phillippitts.transcodeguard.exception.AlreadyRunningException;
import com.phillippitts.transcodeguard.exception.EngineException;
import com.phillippitts.transcodeguard.exception.OperationTimeoutException;
import com.phillippitts.transcodeguard.exception.ValidationException;
import com.phillippitts.transcodeguard.service.alert.AlertLog;
import com.phillippitts.transcodeguard.service.events.ConversionEvent;
import com.phillippitts.transcodeguard.service.events.ConversionEventBus;
import com.phillippitts.transcodeguard.service.events.JobStateChangedEvent;
import com.phillippitts.transcodeguard.service.events.ProgressUpdatedEvent;
import com.phillippitts.transcodeguard.service.metrics.ConversionMetrics;
import com.phillippitts.transcodeguard.service.monitor.ResourceMonitor;
import com.phillippitts.transcodeguard.service.policy.Decision;
import com.phillippitts.transcodeguard.service.policy.DecisionType;
import com.phillippitts.transcodeguard.service.policy.PolicyEngine;
import com.phillippitts.transcodeguard.service.policy.ResourceKind;
import com.phillippitts.transcodeguard.service.policy.Threshold;
import com.phillippitts.transcodeguard.service.policy.ThresholdComparator;
import com.phillippitts.transcodeguard.testutil.FakeCodecEngine;
import com.phillippitts.transcodeguard.testutil.FakeTelemetrySource;
import com.phillippitts.transcodeguard.testutil.InMemoryFileStore;
import com.phillippitts.transcodeguard.testutil.MutableClock;
import com.phillippitts.transcodeguard.testutil.SyncExecutor;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.awaitility.Awaitility;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link DefaultConversionCoordinator}.
 */
class DefaultConversionCoordinatorTest {

    private static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");
    private static final Path INPUT = Path.of("/media/in/clip.mov");
    private static final Path OUTPUT = Path.of("/media/out/clip.mp4");
    private static final long MB = 1024L * 1024;
    private static final Duration EVENT_WAIT = Duration.ofSeconds(2);

    private MutableClock clock;
    private MeterRegistry registry;
    private AlertLog alertLog;
    private FakeTelemetrySource telemetry;
    private ResourceMonitor monitor;
    private InMemoryFileStore fileStore;
    private FakeCodecEngine engine;
    private ConversionMetrics metrics;
    private ConversionEventBus bus;
    private PolicyEngine policy;
    private DefaultConversionCoordinator coordinator;
    private final List<ConversionEvent> events = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        registry = new SimpleMeterRegistry();
        metrics = new ConversionMetrics(registry);
        bus = new ConversionEventBus(new SyncExecutor(), 256);
        bus.subscribe(e -> true, events::add);
        alertLog = new AlertLog(100, bus, metrics, clock);
        telemetry = new FakeTelemetrySource();
        monitor = new ResourceMonitor(telemetry, alertLog, metrics, clock, 50, Duration.ofMillis(500), 3);
        policy = new PolicyEngine(List.of(
                Threshold.thermalCeiling(ThermalState.CRITICAL),
                Threshold.thermalThrottle(ThermalState.SERIOUS),
                Threshold.batteryMinimum(0.15)), Duration.ofSeconds(60));
        fileStore = new InMemoryFileStore().withFile(INPUT, 100 * MB);
        engine = new FakeCodecEngine();

        coordinator = newCoordinator(new SyncExecutor(), 2_000);
    }

    private DefaultConversionCoordinator newCoordinator(Executor precheckExecutor, long precheckTimeoutMs) {
        ConversionProperties props = new ConversionProperties();
        props.setEngineStopTimeoutMs(300);
        props.setPrecheckTimeoutMs(precheckTimeoutMs);

        return ConversionCoordinatorBuilder.builder()
                .codecEngine(engine)
                .fileStore(fileStore)
                .resourceMonitor(monitor)
                .policyEngine(policy)
                .alertLog(alertLog)
                .eventBus(bus)
                .metrics(metrics)
                .precheckExecutor(precheckExecutor)
                .properties(props)
                .pollInterval(Duration.ofHours(1))
                .clock(clock)
                .build();
    }

    @AfterEach
    void tearDown() {
        coordinator.close();
        monitor.close();
    }

    private static ConversionRequest request(Path input) {
        return new ConversionRequest(
                new InputDescriptor(input, 0, Duration.ofMinutes(2), 1920, 1080, "prores"),
                new OutputTarget(OUTPUT, EncodeParameters.mp4Defaults()));
    }

    private static ResourceSnapshot snapshot(Instant at, ThermalState thermal) {
        return new ResourceSnapshot(at, thermal, 0.9, false, 4L << 30, 100L << 30, false);
    }

    private ConversionJob active() {
        return coordinator.getActiveJob().orElseThrow();
    }

    private void drainEngineEvents() throws InterruptedException {
        assertThat(coordinator.awaitEngineEvents(EVENT_WAIT)).isTrue();
    }

    @Test
    void shouldStartEngineAndRunJobOnSubmit() {
        JobId id = coordinator.submit(request(INPUT));

        ConversionJob job = active();
        assertThat(job.id()).isEqualTo(id);
        assertThat(job.state()).isEqualTo(JobState.RUNNING);
        assertThat(job.startedAt()).isEqualTo(T0);
        assertThat(engine.beginCount()).isEqualTo(1);
        assertThat(monitor.isRunning()).isTrue();
        assertThat(events).filteredOn(JobStateChangedEvent.class::isInstance)
                .extracting(e -> ((JobStateChangedEvent) e).to())
                .containsExactly(JobState.PENDING, JobState.PREPARING, JobState.RUNNING);
    }

    @Test
    void shouldRejectSecondSubmissionWhileJobActive() {
        JobId first = coordinator.submit(request(INPUT));

        assertThatThrownBy(() -> coordinator.submit(request(INPUT)))
                .isInstanceOf(AlreadyRunningException.class)
                .satisfies(ex -> assertThat(((AlreadyRunningException) ex).getActiveJobId()).isEqualTo(first));

        assertThat(active().id()).isEqualTo(first);
        assertThat(engine.beginCount()).isEqualTo(1);
        assertThat(coordinator.getStatistics().submitted()).isEqualTo(1);
    }

    @Test
    void shouldFailWithInsufficientStorageWithoutStartingEngine() {
        fileStore.withFile(INPUT, 500 * MB);
        fileStore.freeSpace = 400 * MB;

        assertThatThrownBy(() -> coordinator.submit(request(INPUT)))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("insufficient storage");

        assertThat(engine.beginCount()).isZero();
        assertThat(coordinator.getActiveJob()).isEmpty();
        ConversionJob failed = coordinator.getHistory(1).get(0);
        assertThat(failed.state()).isEqualTo(JobState.FAILED);
        assertThat(failed.endedAt()).isNotNull();
        assertThat(failed.failureReason().category()).isEqualTo(FailureReason.Category.VALIDATION);
        assertThat(failed.failureReason().code()).isEqualTo("INSUFFICIENT_STORAGE");
    }

    @Test
    void shouldFailWhenInputIsMissing() {
        assertThatThrownBy(() -> coordinator.submit(request(Path.of("/media/in/missing.mov"))))
                .isInstanceOf(ValidationException.class)
                .satisfies(ex -> assertThat(((ValidationException) ex).getFailure())
                        .isEqualTo(ValidationException.ValidationFailure.INPUT_MISSING));

        assertThat(coordinator.getHistory(1).get(0).failureReason().code()).isEqualTo("INPUT_MISSING");
    }

    @Test
    void shouldFailWithTimeoutWhenPrechecksHang() throws Exception {
        ExecutorService precheckPool = Executors.newSingleThreadExecutor();
        CountDownLatch release = new CountDownLatch(1);
        fileStore.onReadCheck = () -> {
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        };
        coordinator.close();
        coordinator = newCoordinator(precheckPool, 200);
        try {
            assertThatThrownBy(() -> coordinator.submit(request(INPUT)))
                    .isInstanceOf(OperationTimeoutException.class)
                    .satisfies(ex -> assertThat(((OperationTimeoutException) ex).getOperation())
                            .isEqualTo(OperationTimeoutException.Operation.PRECHECK));

            assertThat(engine.beginCount()).isZero();
            assertThat(coordinator.getActiveJob()).isEmpty();
            ConversionJob failed = coordinator.getHistory(1).get(0);
            assertThat(failed.state()).isEqualTo(JobState.FAILED);
            assertThat(failed.failureReason().category()).isEqualTo(FailureReason.Category.TIMEOUT);
            assertThat(failed.failureReason().code()).isEqualTo("PRECHECK_TIMEOUT");

            fileStore.onReadCheck = null;
            release.countDown();
            JobId next = coordinator.submit(request(INPUT));
            assertThat(active().id()).isEqualTo(next);
            assertThat(engine.beginCount()).isEqualTo(1);
        } finally {
            release.countDown();
            precheckPool.shutdownNow();
        }
    }

    @Test
    void shouldCancelDuringPrechecksWithoutStartingEngine() {
        fileStore.onReadCheck = () ->
                assertThat(coordinator.cancel(active().id())).isEqualTo(CommandOutcome.ACCEPTED);

        JobId id = coordinator.submit(request(INPUT));

        assertThat(engine.beginCount()).isZero();
        assertThat(coordinator.getActiveJob()).isEmpty();
        ConversionJob job = coordinator.getJob(id).orElseThrow();
        assertThat(job.state()).isEqualTo(JobState.CANCELLED);
        assertThat(job.startedAt()).isNull();
        assertThat(job.endedAt()).isNotNull();
        assertThat(events).filteredOn(JobStateChangedEvent.class::isInstance)
                .extracting(e -> ((JobStateChangedEvent) e).to())
                .containsExactly(JobState.PENDING, JobState.PREPARING, JobState.CANCELLED);
    }

    @Test
    void shouldFailWhenEngineCannotStart() {
        engine.failOnBegin = new EngineException("FFMPEG_NOT_FOUND", "ffmpeg binary not found");

        assertThatThrownBy(() -> coordinator.submit(request(INPUT)))
                .isInstanceOf(EngineException.class);

        ConversionJob failed = coordinator.getHistory(1).get(0);
        assertThat(failed.state()).isEqualTo(JobState.FAILED);
        assertThat(failed.failureReason().category()).isEqualTo(FailureReason.Category.ENGINE);
        assertThat(failed.failureReason().code()).isEqualTo("FFMPEG_NOT_FOUND");
    }

    @Test
    void shouldThrottleOnSeriousThermalAndStillComplete() throws Exception {
        JobId id = coordinator.submit(request(INPUT));

        coordinator.onSnapshot(snapshot(T0.plusSeconds(5), ThermalState.SERIOUS));

        assertThat(active().state()).isEqualTo(JobState.RUNNING);
        assertThat(active().throttled()).isTrue();
        assertThat(engine.lastHandle().throttled).isTrue();
        assertThat(alertLog.recent(10)).extracting(Alert::kind).contains(AlertKind.THERMAL_THROTTLING);

        engine.lastHandle().progress(40);
        engine.lastHandle().progress(100);
        drainEngineEvents();

        ConversionJob done = coordinator.getJob(id).orElseThrow();
        assertThat(done.state()).isEqualTo(JobState.COMPLETED);
        assertThat(done.progress().percent()).isEqualTo(100.0);
        assertThat(done.throttled()).isFalse();
    }

    @Test
    void shouldLiftThrottleWhenConditionClears() {
        coordinator.submit(request(INPUT));
        coordinator.onSnapshot(snapshot(T0.plusSeconds(5), ThermalState.SERIOUS));

        coordinator.onSnapshot(snapshot(T0.plusSeconds(10), ThermalState.NOMINAL));

        assertThat(active().throttled()).isFalse();
        assertThat(engine.lastHandle().throttled).isFalse();
    }

    @Test
    void shouldCancelWhenEngineAcknowledgesStop() throws Exception {
        JobId id = coordinator.submit(request(INPUT));
        engine.lastHandle().progress(30);
        drainEngineEvents();

        CommandOutcome outcome = coordinator.cancel(id);

        assertThat(outcome).isEqualTo(CommandOutcome.ACCEPTED);
        assertThat(coordinator.getActiveJob()).isEmpty();
        ConversionJob job = coordinator.getJob(id).orElseThrow();
        assertThat(job.state()).isEqualTo(JobState.CANCELLED);
        assertThat(job.endedAt()).isNotNull();
        assertThat(job.engineResourcesLeaked()).isFalse();
        assertThat(job.progress().percent()).isEqualTo(30.0);
        assertThat(engine.lastHandle().stopCalls).isEqualTo(1);
    }

    @Test
    void shouldForceCancelledAndRaiseAlertWhenStopIsNeverAcknowledged() {
        engine.acknowledgeStop = false;
        JobId id = coordinator.submit(request(INPUT));

        assertThat(coordinator.cancel(id)).isEqualTo(CommandOutcome.ACCEPTED);
        assertThat(active().state()).isEqualTo(JobState.CANCELLING);

        Awaitility.await().atMost(2, TimeUnit.SECONDS).until(() -> coordinator.getActiveJob().isEmpty());

        ConversionJob job = coordinator.getJob(id).orElseThrow();
        assertThat(job.state()).isEqualTo(JobState.CANCELLED);
        assertThat(job.endedAt()).isNotNull();
        assertThat(job.engineResourcesLeaked()).isTrue();
        assertThat(alertLog.recent(10))
                .filteredOn(a -> a.kind() == AlertKind.ENGINE_STOP_TIMEOUT)
                .singleElement()
                .satisfies(a -> {
                    assertThat(a.severity()).isEqualTo(AlertSeverity.ERROR);
                    assertThat(a.jobId()).isEqualTo(id);
                });
    }

    @Test
    void shouldTreatEngineResultWhileCancellingAsStopAcknowledgement() throws Exception {
        engine.acknowledgeStop = false;
        JobId id = coordinator.submit(request(INPUT));
        coordinator.cancel(id);

        engine.lastHandle().fail("FFMPEG_STOPPED", "stopped on request");
        drainEngineEvents();

        ConversionJob job = coordinator.getJob(id).orElseThrow();
        assertThat(job.state()).isEqualTo(JobState.CANCELLED);
        assertThat(job.engineResourcesLeaked()).isFalse();
        assertThat(job.failureReason()).isNull();
    }

    @Test
    void shouldReturnNotFoundForUnknownJob() {
        coordinator.submit(request(INPUT));
        JobId other = JobId.random();

        assertThat(coordinator.cancel(other)).isEqualTo(CommandOutcome.NOT_FOUND);
        assertThat(coordinator.pause(other)).isEqualTo(CommandOutcome.NOT_FOUND);
        assertThat(coordinator.resume(other)).isEqualTo(CommandOutcome.NOT_FOUND);
        assertThat(active().state()).isEqualTo(JobState.RUNNING);
    }

    @Test
    void shouldDiscardDecisionOlderThanLastApplied() {
        coordinator.submit(request(INPUT));
        coordinator.onPolicyTick(List.of(
                new Decision(DecisionType.THROTTLE, ResourceKind.THERMAL_THROTTLE, T0.plusSeconds(10), "hot")));

        coordinator.onPolicyTick(List.of(
                new Decision(DecisionType.ABORT, ResourceKind.THERMAL_CEILING, T0.plusSeconds(5), "late reading")));

        assertThat(active().state()).isEqualTo(JobState.RUNNING);
        assertThat(active().throttled()).isTrue();
        assertThat(engine.lastHandle().stopCalls).isZero();
    }

    @Test
    void shouldAbortOnThermalCeiling() {
        JobId id = coordinator.submit(request(INPUT));

        coordinator.onSnapshot(snapshot(T0.plusSeconds(5), ThermalState.CRITICAL));

        ConversionJob job = coordinator.getJob(id).orElseThrow();
        assertThat(job.state()).isEqualTo(JobState.CANCELLED);
        assertThat(alertLog.recent(10)).extracting(Alert::kind).contains(AlertKind.THERMAL_EMERGENCY);
    }

    @Test
    void shouldIgnoreRegressingAndNaNProgress() throws Exception {
        coordinator.submit(request(INPUT));
        FakeCodecEngine.FakeHandle handle = engine.lastHandle();

        handle.progress(40);
        handle.progress(30);
        handle.progress(Double.NaN);
        handle.progress(55);
        drainEngineEvents();

        assertThat(active().progress().percent()).isEqualTo(55.0);
        assertThat(events).filteredOn(ProgressUpdatedEvent.class::isInstance)
                .extracting(e -> ((ProgressUpdatedEvent) e).progress().percent())
                .containsExactly(40.0, 55.0);
    }

    @Test
    void shouldAutoResumePolicyPauseWhenConditionClears() {
        JobId id = coordinator.submit(request(INPUT));
        telemetry.reading = FakeTelemetrySource.battery(0.10, false);
        coordinator.onPolicyTick(List.of(
                new Decision(DecisionType.PAUSE, ResourceKind.BATTERY, T0.plusSeconds(1), "battery low")));

        assertThat(active().state()).isEqualTo(JobState.PAUSED);
        assertThat(active().pauseOrigin()).isEqualTo(PauseOrigin.POLICY);
        assertThat(engine.lastHandle().pauseCalls).isEqualTo(1);

        telemetry.reading = FakeTelemetrySource.battery(0.10, true);
        clock.advance(Duration.ofSeconds(2));
        coordinator.onPolicyTick(List.of(Decision.proceed(T0.plusSeconds(2))));

        ConversionJob job = coordinator.getJob(id).orElseThrow();
        assertThat(job.state()).isEqualTo(JobState.RUNNING);
        assertThat(job.pauseOrigin()).isNull();
        assertThat(engine.lastHandle().resumeCalls).isEqualTo(1);
    }

    @Test
    void shouldStayPausedWhenRevalidationStillCallsForPause() {
        JobId id = coordinator.submit(request(INPUT));
        telemetry.reading = FakeTelemetrySource.battery(0.10, false);
        coordinator.onPolicyTick(List.of(
                new Decision(DecisionType.PAUSE, ResourceKind.BATTERY, T0.plusSeconds(1), "battery low")));

        coordinator.onPolicyTick(List.of(Decision.proceed(T0.plusSeconds(2))));
        CommandOutcome userResume = coordinator.resume(id);

        assertThat(userResume).isEqualTo(CommandOutcome.REJECTED);
        assertThat(active().state()).isEqualTo(JobState.PAUSED);
        assertThat(engine.lastHandle().resumeCalls).isZero();
    }

    @Test
    void shouldNotAutoResumeUserPause() {
        JobId id = coordinator.submit(request(INPUT));

        assertThat(coordinator.pause(id)).isEqualTo(CommandOutcome.ACCEPTED);
        coordinator.onPolicyTick(List.of(Decision.proceed(T0.plusSeconds(1))));

        assertThat(active().state()).isEqualTo(JobState.PAUSED);
        assertThat(active().pauseOrigin()).isEqualTo(PauseOrigin.USER);

        assertThat(coordinator.resume(id)).isEqualTo(CommandOutcome.ACCEPTED);
        assertThat(active().state()).isEqualTo(JobState.RUNNING);
    }

    @Test
    void shouldResumeThrottledWhenRevalidationCallsForThrottle() {
        JobId id = coordinator.submit(request(INPUT));
        coordinator.pause(id);
        telemetry.reading = FakeTelemetrySource.thermal(ThermalState.SERIOUS);

        assertThat(coordinator.resume(id)).isEqualTo(CommandOutcome.ACCEPTED);

        assertThat(active().state()).isEqualTo(JobState.RUNNING);
        assertThat(active().throttled()).isTrue();
        assertThat(engine.lastHandle().throttled).isTrue();
    }

    @Test
    void shouldRejectPauseOutsideRunningOrPaused() {
        engine.acknowledgeStop = false;
        JobId id = coordinator.submit(request(INPUT));
        coordinator.cancel(id);

        assertThat(coordinator.pause(id)).isEqualTo(CommandOutcome.REJECTED);
        assertThat(coordinator.resume(id)).isEqualTo(CommandOutcome.REJECTED);
        assertThat(coordinator.cancel(id)).isEqualTo(CommandOutcome.ACCEPTED);
    }

    @Test
    void shouldAbortPausedJob() {
        JobId id = coordinator.submit(request(INPUT));
        coordinator.pause(id);

        coordinator.onPolicyTick(List.of(
                new Decision(DecisionType.ABORT, ResourceKind.THERMAL_CEILING, T0.plusSeconds(1), "too hot")));

        assertThat(coordinator.getJob(id).orElseThrow().state()).isEqualTo(JobState.CANCELLED);
    }

    @Test
    void shouldCompleteWhenEngineSucceedsWhilePaused() throws Exception {
        JobId id = coordinator.submit(request(INPUT));
        coordinator.pause(id);

        engine.lastHandle().succeed();
        drainEngineEvents();

        ConversionJob job = coordinator.getJob(id).orElseThrow();
        assertThat(job.state()).isEqualTo(JobState.COMPLETED);
        assertThat(job.progress().isComplete()).isTrue();
    }

    @Test
    void shouldFailJobOnEngineError() throws Exception {
        JobId id = coordinator.submit(request(INPUT));

        engine.lastHandle().fail("FFMPEG_EXIT_1", "Invalid data found when processing input");
        drainEngineEvents();

        ConversionJob job = coordinator.getJob(id).orElseThrow();
        assertThat(job.state()).isEqualTo(JobState.FAILED);
        assertThat(job.failureReason().code()).isEqualTo("FFMPEG_EXIT_1");
        assertThat(job.failureReason().message()).contains("Invalid data");
    }

    @Test
    void shouldIgnoreEngineEventsAfterJobFinished() throws Exception {
        JobId id = coordinator.submit(request(INPUT));
        FakeCodecEngine.FakeHandle handle = engine.lastHandle();
        handle.succeed();
        drainEngineEvents();

        handle.progress(50);
        handle.fail("LATE", "late failure");
        drainEngineEvents();

        assertThat(coordinator.getJob(id).orElseThrow().state()).isEqualTo(JobState.COMPLETED);
        assertThat(coordinator.getStatistics().failed()).isZero();
    }

    @Test
    void shouldKeepCumulativeStatisticsAcrossHistoryClear() throws Exception {
        coordinator.submit(request(INPUT));
        clock.advance(Duration.ofSeconds(10));
        engine.lastHandle().succeed();
        drainEngineEvents();

        JobId second = coordinator.submit(request(INPUT));
        coordinator.cancel(second);

        fileStore.freeSpace = 1;
        assertThatThrownBy(() -> coordinator.submit(request(INPUT))).isInstanceOf(ValidationException.class);

        coordinator.clearHistory();

        ConversionStatistics stats = coordinator.getStatistics();
        assertThat(coordinator.getHistory(10)).isEmpty();
        assertThat(stats.submitted()).isEqualTo(3);
        assertThat(stats.completed()).isEqualTo(1);
        assertThat(stats.failed()).isEqualTo(1);
        assertThat(stats.cancelled()).isEqualTo(1);
        assertThat(stats.averageProcessingTime()).isEqualTo(Duration.ofSeconds(10));
        assertThat(stats.successRate()).isBetween(33.3, 33.4);
        assertThat(registry.find("transcodeguard.jobs.submitted").counter().count()).isEqualTo(3.0);
    }

    @Test
    void shouldRecordDeviceAlertsWithoutActiveJob() {
        coordinator.onSnapshot(snapshot(T0, ThermalState.CRITICAL));

        assertThat(alertLog.recent(10)).extracting(Alert::kind).contains(AlertKind.THERMAL_EMERGENCY);
        assertThat(alertLog.recent(10)).allSatisfy(a -> assertThat(a.jobId()).isNull());
        assertThat(coordinator.getActiveJob()).isEmpty();
    }

    @Test
    void shouldPickHighestPriorityDecision() {
        Decision pause = new Decision(DecisionType.PAUSE, ResourceKind.BATTERY, T0, "battery");
        Decision abort = new Decision(DecisionType.ABORT, ResourceKind.THERMAL_CEILING, T0, "ceiling");
        Decision alert = new Decision(DecisionType.ALERT, ResourceKind.MEMORY, T0, "memory");
        Decision proceed = Decision.proceed(T0);

        assertThat(DefaultConversionCoordinator.primaryOf(List.of(pause, alert, abort, proceed))).isSameAs(abort);
        assertThat(DefaultConversionCoordinator.primaryOf(List.of(proceed, alert))).isSameAs(alert);
        assertThat(DefaultConversionCoordinator.primaryOf(List.of(proceed))).isSameAs(proceed);
    }

    @Test
    void shouldApplyRuntimeThresholdChangesOnNextTick() {
        coordinator.submit(request(INPUT));
        coordinator.setThreshold(ResourceKind.THERMAL_THROTTLE,
                new Threshold(ResourceKind.THERMAL_THROTTLE, ThresholdComparator.GREATER_THAN_OR_EQUAL,
                        ThermalState.FAIR.ordinal(), DecisionType.PAUSE));

        coordinator.onSnapshot(snapshot(T0.plusSeconds(1), ThermalState.FAIR));

        assertThat(active().state()).isEqualTo(JobState.PAUSED);
        assertThat(coordinator.clearThreshold(ResourceKind.THERMAL_THROTTLE)).isPresent();
        assertThat(coordinator.thresholds()).doesNotContainKey(ResourceKind.THERMAL_THROTTLE);
    }
}
