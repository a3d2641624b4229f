package com.phillippitts.transcodeguard.service.coordinator;

import com.phillippitts.transcodeguard.domain.JobId;
import com.phillippitts.transcodeguard.service.engine.EngineListener;
import com.phillippitts.transcodeguard.service.engine.EngineResult;
import com.phillippitts.transcodeguard.service.engine.ProgressEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Bounded hand-off from codec engine threads to the coordinator.
 *
 * <p>Engine callbacks only enqueue; a single dispatcher thread applies envelopes in arrival
 * order. When the queue is full, progress reports are dropped (a later report supersedes them)
 * while terminal results block the engine thread until there is room.
 */
final class EngineEventChannel implements AutoCloseable {

    private static final Logger LOG = LogManager.getLogger(EngineEventChannel.class);

    /**
     * One engine callback. Exactly one of {@code progress} and {@code result} is set.
     */
    record Envelope(JobId jobId, ProgressEvent progress, EngineResult result) {
    }

    private final BlockingQueue<Envelope> queue;
    private final Consumer<Envelope> handler;
    private final Thread dispatcher;
    private final Object idleMonitor = new Object();
    private final AtomicLong droppedProgress = new AtomicLong();

    private long pending; // guarded by idleMonitor
    private volatile boolean running = true;

    EngineEventChannel(int capacity, Consumer<Envelope> handler) {
        this.queue = new ArrayBlockingQueue<>(capacity);
        this.handler = Objects.requireNonNull(handler, "handler");
        this.dispatcher = new Thread(this::dispatchLoop, "engine-events");
        this.dispatcher.setDaemon(true);
        this.dispatcher.start();
    }

    /**
     * Listener that tags every callback with {@code jobId} and enqueues it.
     */
    EngineListener listenerFor(JobId jobId) {
        Objects.requireNonNull(jobId, "jobId");
        return new EngineListener() {
            @Override
            public void onProgress(ProgressEvent event) {
                offerProgress(new Envelope(jobId, event, null));
            }

            @Override
            public void onResult(EngineResult result) {
                putResult(new Envelope(jobId, null, result));
            }
        };
    }

    private void offerProgress(Envelope envelope) {
        incrementPending();
        if (!queue.offer(envelope)) {
            decrementPending();
            long dropped = droppedProgress.incrementAndGet();
            LOG.warn("Engine event queue full; dropped progress for job {} (total dropped={})",
                    envelope.jobId(), dropped);
        }
    }

    private void putResult(Envelope envelope) {
        incrementPending();
        try {
            queue.put(envelope);
        } catch (InterruptedException e) {
            decrementPending();
            Thread.currentThread().interrupt();
            LOG.error("Interrupted while enqueueing engine result for job {}; result lost", envelope.jobId());
        }
    }

    private void dispatchLoop() {
        while (running || !queue.isEmpty()) {
            Envelope envelope;
            try {
                envelope = queue.poll(100, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            if (envelope == null) {
                continue;
            }
            try {
                handler.accept(envelope);
            } catch (RuntimeException e) {
                LOG.error("Failed to apply engine event for job {}", envelope.jobId(), e);
            } finally {
                decrementPending();
            }
        }
    }

    private void incrementPending() {
        synchronized (idleMonitor) {
            pending++;
        }
    }

    private void decrementPending() {
        synchronized (idleMonitor) {
            pending--;
            if (pending == 0) {
                idleMonitor.notifyAll();
            }
        }
    }

    /**
     * Waits until every enqueued envelope has been applied.
     *
     * @return false if the timeout elapsed first
     */
    boolean awaitIdle(Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        synchronized (idleMonitor) {
            while (pending > 0) {
                long remainingMs = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
                if (remainingMs <= 0) {
                    return false;
                }
                idleMonitor.wait(remainingMs);
            }
            return true;
        }
    }

    long droppedProgressCount() {
        return droppedProgress.get();
    }

    /**
     * Stops the dispatcher after it drains what is already queued, waiting at most one second.
     */
    @Override
    public void close() {
        running = false;
        try {
            dispatcher.join(1_000);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        if (dispatcher.isAlive()) {
            LOG.warn("Engine event dispatcher did not stop; {} events left", queue.size());
            dispatcher.interrupt();
        }
    }
}
