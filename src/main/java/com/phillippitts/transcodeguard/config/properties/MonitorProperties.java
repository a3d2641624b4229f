package com.phillippitts.transcodeguard.config.properties;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Configuration properties for the resource monitor polling loop.
 */
@ConfigurationProperties(prefix = "monitor")
@Validated
public class MonitorProperties {

    /** Delay between telemetry polls, in milliseconds. */
    @Positive(message = "Poll interval must be positive")
    private long pollIntervalMs = 5_000;

    /** Deadline for an out-of-band {@code snapshotNow()} telemetry read, in milliseconds. */
    @Positive(message = "Snapshot timeout must be positive")
    private long snapshotTimeoutMs = 2_000;

    /** Number of snapshots retained for diagnostics. */
    @Positive(message = "History size must be positive")
    @Max(value = 10_000, message = "History size must be <= 10000")
    private int historySize = 120;

    /** Consecutive telemetry failures before MONITORING_DEGRADED is raised. */
    @Positive(message = "Degraded-after-failures must be positive")
    private int degradedAfterFailures = 3;

    /** Start polling when the application context is ready. */
    private boolean autoStart = true;

    public long getPollIntervalMs() {
        return pollIntervalMs;
    }

    public void setPollIntervalMs(long pollIntervalMs) {
        this.pollIntervalMs = pollIntervalMs;
    }

    public Duration pollInterval() {
        return Duration.ofMillis(pollIntervalMs);
    }

    public long getSnapshotTimeoutMs() {
        return snapshotTimeoutMs;
    }

    public void setSnapshotTimeoutMs(long snapshotTimeoutMs) {
        this.snapshotTimeoutMs = snapshotTimeoutMs;
    }

    public Duration snapshotTimeout() {
        return Duration.ofMillis(snapshotTimeoutMs);
    }

    public int getHistorySize() {
        return historySize;
    }

    public void setHistorySize(int historySize) {
        this.historySize = historySize;
    }

    public int getDegradedAfterFailures() {
        return degradedAfterFailures;
    }

    public void setDegradedAfterFailures(int degradedAfterFailures) {
        this.degradedAfterFailures = degradedAfterFailures;
    }

    public boolean isAutoStart() {
        return autoStart;
    }

    public void setAutoStart(boolean autoStart) {
        this.autoStart = autoStart;
    }
}
