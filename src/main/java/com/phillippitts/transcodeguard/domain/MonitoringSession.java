package com.phillippitts.transcodeguard.domain;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;

/**
 * One polling lifetime of the resource monitor, from {@code start} to {@code stop}.
 *
 * <p>Thread-safe: the polling thread increments the sample count while readers inspect it.
 */
public final class MonitoringSession {

    private final String id;
    private final Instant startedAt;
    private final Duration pollInterval;
    private final AtomicLong samplesTaken = new AtomicLong();
    private volatile Instant endedAt;

    public MonitoringSession(Duration pollInterval, Instant startedAt) {
        this.id = UUID.randomUUID().toString();
        this.pollInterval = Objects.requireNonNull(pollInterval, "pollInterval");
        this.startedAt = Objects.requireNonNull(startedAt, "startedAt");
    }

    public String getId() {
        return id;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public Instant getEndedAt() {
        return endedAt;
    }

    public Duration getPollInterval() {
        return pollInterval;
    }

    public long getSamplesTaken() {
        return samplesTaken.get();
    }

    public boolean isActive() {
        return endedAt == null;
    }

    public void recordSample() {
        samplesTaken.incrementAndGet();
    }

    /** Marks the session ended; later calls keep the first end time. */
    public synchronized void end(Instant at) {
        if (endedAt == null) {
            endedAt = at;
        }
    }

    @Override
    public String toString() {
        return "MonitoringSession{id=" + id + ", startedAt=" + startedAt + ", endedAt=" + endedAt
                + ", pollInterval=" + pollInterval + ", samplesTaken=" + samplesTaken.get() + '}';
    }
}
