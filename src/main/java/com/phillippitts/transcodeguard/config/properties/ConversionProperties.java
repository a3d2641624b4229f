package com.phillippitts.transcodeguard.config.properties;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Configuration properties for the conversion coordinator.
 */
@ConfigurationProperties(prefix = "conversion")
@Validated
public class ConversionProperties {

    /** How long to wait for the engine to acknowledge a stop before force-cancelling, in ms. */
    @Positive(message = "Engine stop timeout must be positive")
    private long engineStopTimeoutMs = 10_000;

    /** Deadline for submit-time prechecks (path and free-space I/O), in ms. */
    @Positive(message = "Precheck timeout must be positive")
    private long precheckTimeoutMs = 5_000;

    /** Required free space as a multiple of the input size. */
    @DecimalMin(value = "0.0", message = "Space safety factor must be >= 0")
    private double spaceSafetyFactor = 1.2;

    /** Finished jobs retained in history. */
    @Positive(message = "History size must be positive")
    private int historySize = 50;

    /** Capacity of the queue between engine callbacks and the coordinator. */
    @Positive(message = "Engine event queue capacity must be positive")
    private int engineEventQueueCapacity = 256;

    /** Events buffered per event bus subscriber before new ones are dropped. */
    @Positive(message = "Subscriber queue capacity must be positive")
    private int subscriberQueueCapacity = 256;

    public long getEngineStopTimeoutMs() {
        return engineStopTimeoutMs;
    }

    public void setEngineStopTimeoutMs(long engineStopTimeoutMs) {
        this.engineStopTimeoutMs = engineStopTimeoutMs;
    }

    public Duration engineStopTimeout() {
        return Duration.ofMillis(engineStopTimeoutMs);
    }

    public long getPrecheckTimeoutMs() {
        return precheckTimeoutMs;
    }

    public void setPrecheckTimeoutMs(long precheckTimeoutMs) {
        this.precheckTimeoutMs = precheckTimeoutMs;
    }

    public Duration precheckTimeout() {
        return Duration.ofMillis(precheckTimeoutMs);
    }

    public double getSpaceSafetyFactor() {
        return spaceSafetyFactor;
    }

    public void setSpaceSafetyFactor(double spaceSafetyFactor) {
        this.spaceSafetyFactor = spaceSafetyFactor;
    }

    public int getHistorySize() {
        return historySize;
    }

    public void setHistorySize(int historySize) {
        this.historySize = historySize;
    }

    public int getEngineEventQueueCapacity() {
        return engineEventQueueCapacity;
    }

    public void setEngineEventQueueCapacity(int engineEventQueueCapacity) {
        this.engineEventQueueCapacity = engineEventQueueCapacity;
    }

    public int getSubscriberQueueCapacity() {
        return subscriberQueueCapacity;
    }

    public void setSubscriberQueueCapacity(int subscriberQueueCapacity) {
        this.subscriberQueueCapacity = subscriberQueueCapacity;
    }
}
