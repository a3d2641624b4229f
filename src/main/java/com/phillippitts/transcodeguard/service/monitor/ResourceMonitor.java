package com.phillippitts.transcodeguard.service.monitor;

import com.phillippitts.transcodeguard.domain.Alert;
import com.phillippitts.transcodeguard.domain.AlertKind;
import com.phillippitts.transcodeguard.domain.AlertSeverity;
import com.phillippitts.transcodeguard.domain.MonitoringSession;
import com.phillippitts.transcodeguard.domain.ResourceSnapshot;
import com.phillippitts.transcodeguard.exception.OperationTimeoutException;
import com.phillippitts.transcodeguard.exception.TelemetryException;
import com.phillippitts.transcodeguard.service.alert.AlertLog;
import com.phillippitts.transcodeguard.service.metrics.ConversionMetrics;
import com.phillippitts.transcodeguard.service.telemetry.RawReading;
import com.phillippitts.transcodeguard.service.telemetry.TelemetrySource;
import com.phillippitts.transcodeguard.util.BoundedHistory;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Periodically polls a {@link TelemetrySource} and publishes {@link ResourceSnapshot}s to
 * registered {@link SnapshotListener}s.
 *
 * <p><b>Lifecycle:</b> {@link #start(Duration)} is idempotent; while a session is active it
 * returns that session and never creates a second polling loop. {@link #stop()} cancels the
 * schedule and shuts the polling thread down after any in-flight poll; a stopped monitor has no
 * live timer.
 *
 * <p><b>Failures:</b> a failed telemetry read is logged and skipped. After
 * {@code degradedAfterFailures} consecutive failures one MONITORING_DEGRADED alert is raised;
 * the counter resets on the next successful read.
 *
 * <p><b>Thread Safety:</b> start/stop are serialized by a {@link ReentrantLock}; history is a
 * self-locking ring buffer.
 */
public class ResourceMonitor implements AutoCloseable {

    private static final Logger LOG = LogManager.getLogger(ResourceMonitor.class);

    private final TelemetrySource telemetry;
    private final AlertLog alertLog;
    private final ConversionMetrics metrics;
    private final Clock clock;
    private final Duration snapshotTimeout;
    private final int degradedAfterFailures;

    private final BoundedHistory<ResourceSnapshot> history;
    private final List<SnapshotListener> listeners = new CopyOnWriteArrayList<>();
    private final AtomicInteger consecutiveFailures = new AtomicInteger();
    private final ExecutorService outOfBandExecutor;

    private final Lock lifecycleLock = new ReentrantLock();
    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> pollTask;
    private volatile MonitoringSession session;

    public ResourceMonitor(TelemetrySource telemetry,
                           AlertLog alertLog,
                           ConversionMetrics metrics,
                           Clock clock,
                           int historySize,
                           Duration snapshotTimeout,
                           int degradedAfterFailures) {
        this.telemetry = Objects.requireNonNull(telemetry, "telemetry");
        this.alertLog = Objects.requireNonNull(alertLog, "alertLog");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.snapshotTimeout = Objects.requireNonNull(snapshotTimeout, "snapshotTimeout");
        if (degradedAfterFailures <= 0) {
            throw new IllegalArgumentException("degradedAfterFailures must be positive");
        }
        this.degradedAfterFailures = degradedAfterFailures;
        this.history = new BoundedHistory<>(historySize);
        this.outOfBandExecutor = Executors.newSingleThreadExecutor(daemonThreads("telemetry-oob"));
    }

    public void addListener(SnapshotListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    /**
     * Starts polling every {@code pollInterval}, or returns the running session unchanged.
     * Never blocks on telemetry; the first poll runs on the polling thread.
     *
     * @param pollInterval delay between the end of one poll and the start of the next
     * @return the active monitoring session
     */
    public MonitoringSession start(Duration pollInterval) {
        Objects.requireNonNull(pollInterval, "pollInterval");
        if (pollInterval.isZero() || pollInterval.isNegative()) {
            throw new IllegalArgumentException("pollInterval must be positive: " + pollInterval);
        }
        lifecycleLock.lock();
        try {
            if (session != null && session.isActive()) {
                LOG.debug("Monitoring already running (session={}); start ignored", session.getId());
                return session;
            }
            MonitoringSession newSession = new MonitoringSession(pollInterval, clock.instant());
            scheduler = Executors.newSingleThreadScheduledExecutor(daemonThreads("resource-monitor"));
            pollTask = scheduler.scheduleWithFixedDelay(() -> pollOnce(newSession), 0,
                    pollInterval.toMillis(), TimeUnit.MILLISECONDS);
            session = newSession;
            consecutiveFailures.set(0);
            LOG.info("Resource monitoring started (session={}, interval={}ms, source={})",
                    newSession.getId(), pollInterval.toMillis(), telemetry.getSourceName());
            return newSession;
        } finally {
            lifecycleLock.unlock();
        }
    }

    /**
     * Stops polling. Idempotent; a no-op when not running. Waits up to the snapshot timeout for
     * an in-flight poll to finish.
     */
    public void stop() {
        ScheduledExecutorService toShutdown;
        MonitoringSession ending;
        lifecycleLock.lock();
        try {
            if (session == null || !session.isActive()) {
                return;
            }
            ending = session;
            pollTask.cancel(false);
            toShutdown = scheduler;
            toShutdown.shutdown();
            ending.end(clock.instant());
            pollTask = null;
            scheduler = null;
        } finally {
            lifecycleLock.unlock();
        }
        try {
            if (!toShutdown.awaitTermination(snapshotTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                LOG.warn("In-flight telemetry poll still running after stop; thread will exit when it returns");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        LOG.info("Resource monitoring stopped (session={}, samples={})", ending.getId(), ending.getSamplesTaken());
    }

    public boolean isRunning() {
        MonitoringSession s = session;
        return s != null && s.isActive();
    }

    /** The active session, or the last one after stop; empty before the first start. */
    public Optional<MonitoringSession> currentSession() {
        return Optional.ofNullable(session);
    }

    /**
     * Polls telemetry immediately, outside the schedule, waiting at most the snapshot timeout.
     *
     * <p>The fresh snapshot is added to history but not sent to listeners. On timeout or read
     * failure the last cached snapshot is returned tagged stale.
     *
     * @return fresh snapshot, or the last known one marked stale
     * @throws OperationTimeoutException if the read timed out and nothing is cached
     * @throws TelemetryException if the read failed and nothing is cached
     */
    public ResourceSnapshot snapshotNow() {
        Future<RawReading> future = outOfBandExecutor.submit(telemetry::poll);
        try {
            RawReading raw = future.get(snapshotTimeout.toMillis(), TimeUnit.MILLISECONDS);
            ResourceSnapshot snapshot = stamp(raw);
            history.add(snapshot);
            return snapshot;
        } catch (TimeoutException e) {
            future.cancel(true);
            LOG.warn("Out-of-band telemetry poll timed out after {}ms; returning last known snapshot",
                    snapshotTimeout.toMillis());
            return latest().map(ResourceSnapshot::asStale)
                    .orElseThrow(() -> new OperationTimeoutException(
                            OperationTimeoutException.Operation.TELEMETRY_POLL, snapshotTimeout));
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            LOG.warn("Out-of-band telemetry poll failed: {}", String.valueOf(cause));
            metrics.incrementTelemetryFailure();
            return latest().map(ResourceSnapshot::asStale)
                    .orElseThrow(() -> cause instanceof TelemetryException te ? te
                            : new TelemetryException("Telemetry poll failed", cause));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return latest().map(ResourceSnapshot::asStale)
                    .orElseThrow(() -> new TelemetryException("Interrupted while polling telemetry", e));
        }
    }

    /** Up to {@code limit} snapshots, newest first. */
    public List<ResourceSnapshot> history(int limit) {
        return history.newestFirst(limit);
    }

    public Optional<ResourceSnapshot> latest() {
        return history.newest();
    }

    public int getConsecutiveFailures() {
        return consecutiveFailures.get();
    }

    public boolean isDegraded() {
        return consecutiveFailures.get() >= degradedAfterFailures;
    }

    @Override
    public void close() {
        stop();
        outOfBandExecutor.shutdownNow();
    }

    // Package-private for tests: one scheduled tick
    void pollOnce(MonitoringSession owner) {
        if (!owner.isActive()) {
            return;
        }
        RawReading raw;
        try {
            raw = telemetry.poll();
        } catch (RuntimeException e) {
            onPollFailure(e);
            return;
        }
        if (raw == null) {
            onPollFailure(new TelemetryException("Telemetry source returned no reading"));
            return;
        }
        ResourceSnapshot snapshot = stamp(raw);
        history.add(snapshot);
        owner.recordSample();
        int previousFailures = consecutiveFailures.getAndSet(0);
        if (previousFailures >= degradedAfterFailures) {
            LOG.info("Telemetry recovered after {} consecutive failures", previousFailures);
        }
        for (SnapshotListener listener : listeners) {
            try {
                listener.onSnapshot(snapshot);
            } catch (RuntimeException e) {
                LOG.error("Snapshot listener failed: {}", e.toString(), e);
            }
        }
    }

    private void onPollFailure(RuntimeException e) {
        int failures = consecutiveFailures.incrementAndGet();
        metrics.incrementTelemetryFailure();
        LOG.warn("Telemetry poll failed ({} consecutive): {}", failures, e.toString());
        if (failures == degradedAfterFailures) {
            alertLog.record(Alert.raise(AlertSeverity.WARNING, AlertKind.MONITORING_DEGRADED,
                    "Telemetry unavailable for " + failures + " consecutive polls: " + e.getMessage(),
                    latest().map(ResourceSnapshot::timestamp).orElse(null), null, clock.instant()));
        }
    }

    private ResourceSnapshot stamp(RawReading raw) {
        return new ResourceSnapshot(clock.instant(), raw.thermalState(), raw.batteryLevel(), raw.charging(),
                raw.availableMemoryBytes(), raw.availableStorageBytes(), false);
    }

    private static ThreadFactory daemonThreads(String name) {
        return r -> {
            Thread t = new Thread(r, name);
            t.setDaemon(true);
            return t;
        };
    }
}
