package com.phillippitts.transcodeguard.service.metrics;

import com.phillippitts.transcodeguard.domain.AlertKind;
import com.phillippitts.transcodeguard.domain.JobState;
import com.phillippitts.transcodeguard.service.policy.DecisionType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Locale;

/**
 * Centralized metrics for the conversion subsystem.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Jobs submitted and finished, tagged by terminal state</li>
 *   <li>Job wall-clock duration per terminal state</li>
 *   <li>Policy decisions applied, tagged by decision type</li>
 *   <li>Alerts raised per kind and telemetry read failures</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available at /actuator/metrics.
 */
public class ConversionMetrics {

    private static final String METRIC_PREFIX = "transcodeguard";

    private final MeterRegistry registry;

    public ConversionMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void incrementSubmitted() {
        Counter.builder(METRIC_PREFIX + ".jobs.submitted")
                .description("Number of conversion jobs accepted")
                .register(registry)
                .increment();
    }

    /**
     * Records a job reaching a terminal state.
     *
     * @param state terminal state
     * @param duration creation-to-end time of the job
     */
    public void recordFinished(JobState state, Duration duration) {
        String tag = tag(state);
        Counter.builder(METRIC_PREFIX + ".jobs.finished")
                .description("Number of conversion jobs that reached a terminal state")
                .tag("state", tag)
                .register(registry)
                .increment();
        Timer.builder(METRIC_PREFIX + ".jobs.duration")
                .description("Wall-clock time from job creation to terminal state")
                .tag("state", tag)
                .register(registry)
                .record(duration);
    }

    public void recordDecision(DecisionType type) {
        Counter.builder(METRIC_PREFIX + ".policy.decisions")
                .description("Policy decisions applied to the active job")
                .tag("type", tag(type))
                .register(registry)
                .increment();
    }

    public void recordAlert(AlertKind kind) {
        Counter.builder(METRIC_PREFIX + ".alerts.raised")
                .description("Alerts raised")
                .tag("kind", tag(kind))
                .register(registry)
                .increment();
    }

    public void incrementTelemetryFailure() {
        Counter.builder(METRIC_PREFIX + ".telemetry.failures")
                .description("Failed telemetry polls")
                .register(registry)
                .increment();
    }

    private static String tag(Enum<?> value) {
        return value.name().toLowerCase(Locale.ROOT);
    }
}
