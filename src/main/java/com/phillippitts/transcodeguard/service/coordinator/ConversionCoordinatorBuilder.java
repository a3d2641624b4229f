package com.phillippitts.transcodeguard.service.coordinator;

import com.phillippitts.transcodeguard.config.properties.ConversionProperties;
import com.phillippitts.transcodeguard.service.alert.AlertLog;
import com.phillippitts.transcodeguard.service.engine.CodecEngine;
import com.phillippitts.transcodeguard.service.events.ConversionEventBus;
import com.phillippitts.transcodeguard.service.job.JobStateMachine;
import com.phillippitts.transcodeguard.service.metrics.ConversionMetrics;
import com.phillippitts.transcodeguard.service.monitor.ResourceMonitor;
import com.phillippitts.transcodeguard.service.policy.PolicyEngine;
import com.phillippitts.transcodeguard.service.storage.FileStore;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executor;

/**
 * Builder for {@link DefaultConversionCoordinator}, which has too many collaborators for a
 * readable constructor call.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * DefaultConversionCoordinator coordinator = ConversionCoordinatorBuilder.builder()
 *     .codecEngine(engine)
 *     .fileStore(fileStore)
 *     .resourceMonitor(monitor)
 *     .policyEngine(policy)
 *     .alertLog(alerts)
 *     .eventBus(bus)
 *     .metrics(metrics)
 *     .precheckExecutor(precheckExecutor)
 *     .properties(conversionProperties)
 *     .pollInterval(Duration.ofSeconds(5))
 *     .build();
 * }</pre>
 *
 * <p>{@code stateMachine} and {@code clock} are optional and default to a new
 * {@link JobStateMachine} and the UTC system clock.
 *
 * @since 1.0
 */
public final class ConversionCoordinatorBuilder {

    // Required dependencies
    CodecEngine codecEngine;
    FileStore fileStore;
    ResourceMonitor resourceMonitor;
    PolicyEngine policyEngine;
    AlertLog alertLog;
    ConversionEventBus eventBus;
    ConversionMetrics metrics;
    Executor precheckExecutor;
    ConversionProperties properties;
    Duration pollInterval;

    // Optional dependencies
    JobStateMachine stateMachine = new JobStateMachine();
    Clock clock = Clock.systemUTC();

    private ConversionCoordinatorBuilder() {
        // Private constructor - use builder() factory method
    }

    public static ConversionCoordinatorBuilder builder() {
        return new ConversionCoordinatorBuilder();
    }

    public ConversionCoordinatorBuilder codecEngine(CodecEngine codecEngine) {
        this.codecEngine = codecEngine;
        return this;
    }

    public ConversionCoordinatorBuilder fileStore(FileStore fileStore) {
        this.fileStore = fileStore;
        return this;
    }

    public ConversionCoordinatorBuilder resourceMonitor(ResourceMonitor resourceMonitor) {
        this.resourceMonitor = resourceMonitor;
        return this;
    }

    public ConversionCoordinatorBuilder policyEngine(PolicyEngine policyEngine) {
        this.policyEngine = policyEngine;
        return this;
    }

    public ConversionCoordinatorBuilder alertLog(AlertLog alertLog) {
        this.alertLog = alertLog;
        return this;
    }

    public ConversionCoordinatorBuilder eventBus(ConversionEventBus eventBus) {
        this.eventBus = eventBus;
        return this;
    }

    public ConversionCoordinatorBuilder metrics(ConversionMetrics metrics) {
        this.metrics = metrics;
        return this;
    }

    /**
     * Executor for pre-flight file system checks, which may block on slow volumes.
     */
    public ConversionCoordinatorBuilder precheckExecutor(Executor precheckExecutor) {
        this.precheckExecutor = precheckExecutor;
        return this;
    }

    public ConversionCoordinatorBuilder properties(ConversionProperties properties) {
        this.properties = properties;
        return this;
    }

    /**
     * Interval used when a submission has to start the resource monitor.
     */
    public ConversionCoordinatorBuilder pollInterval(Duration pollInterval) {
        this.pollInterval = pollInterval;
        return this;
    }

    public ConversionCoordinatorBuilder stateMachine(JobStateMachine stateMachine) {
        this.stateMachine = stateMachine;
        return this;
    }

    public ConversionCoordinatorBuilder clock(Clock clock) {
        this.clock = clock;
        return this;
    }

    /**
     * @throws NullPointerException if a required dependency is missing
     */
    public DefaultConversionCoordinator build() {
        Objects.requireNonNull(codecEngine, "codecEngine is required");
        Objects.requireNonNull(fileStore, "fileStore is required");
        Objects.requireNonNull(resourceMonitor, "resourceMonitor is required");
        Objects.requireNonNull(policyEngine, "policyEngine is required");
        Objects.requireNonNull(alertLog, "alertLog is required");
        Objects.requireNonNull(eventBus, "eventBus is required");
        Objects.requireNonNull(metrics, "metrics is required");
        Objects.requireNonNull(precheckExecutor, "precheckExecutor is required");
        Objects.requireNonNull(properties, "properties is required");
        Objects.requireNonNull(pollInterval, "pollInterval is required");
        Objects.requireNonNull(stateMachine, "stateMachine");
        Objects.requireNonNull(clock, "clock");
        return new DefaultConversionCoordinator(this);
    }
}
