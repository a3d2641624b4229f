package com.phillippitts.transcodeguard.service.events;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Publish-subscribe fan-out of job state changes, progress updates and alerts.
 *
 * <p>{@link #publish(ConversionEvent)} never runs subscriber code on the caller's thread: each
 * subscriber owns a bounded queue drained on the shared delivery executor, one event at a time,
 * so events reach a subscriber in publish order. When a subscriber falls {@code queueCapacity}
 * events behind, new events for it are dropped and counted. Zero subscribers is a valid state.
 */
public class ConversionEventBus {

    private static final Logger LOG = LogManager.getLogger(ConversionEventBus.class);

    private final Executor deliveryExecutor;
    private final int queueCapacity;
    private final List<Subscriber> subscribers = new CopyOnWriteArrayList<>();

    public ConversionEventBus(Executor deliveryExecutor, int queueCapacity) {
        this.deliveryExecutor = Objects.requireNonNull(deliveryExecutor, "deliveryExecutor");
        if (queueCapacity <= 0) {
            throw new IllegalArgumentException("queueCapacity must be positive");
        }
        this.queueCapacity = queueCapacity;
    }

    /**
     * Registers a subscriber.
     *
     * @param filter events to deliver
     * @param handler receives matching events, in publish order
     * @return handle that stops delivery when closed
     */
    public Subscription subscribe(Predicate<? super ConversionEvent> filter,
                                  Consumer<? super ConversionEvent> handler) {
        Subscriber s = new Subscriber(Objects.requireNonNull(filter, "filter"),
                Objects.requireNonNull(handler, "handler"));
        subscribers.add(s);
        return s;
    }

    /**
     * Convenience overload that delivers only events of {@code type}.
     */
    public <E extends ConversionEvent> Subscription subscribe(Class<E> type, Consumer<? super E> handler) {
        Objects.requireNonNull(type, "type");
        return subscribe(type::isInstance, e -> handler.accept(type.cast(e)));
    }

    public void publish(ConversionEvent event) {
        Objects.requireNonNull(event, "event");
        for (Subscriber s : subscribers) {
            s.offer(event);
        }
    }

    public int subscriberCount() {
        return subscribers.size();
    }

    /**
     * Handle returned by {@code subscribe}.
     */
    public interface Subscription extends AutoCloseable {

        /** Events dropped because this subscriber's queue was full. */
        long droppedEvents();

        @Override
        void close();
    }

    private final class Subscriber implements Subscription {
        private final Predicate<? super ConversionEvent> filter;
        private final Consumer<? super ConversionEvent> handler;
        private final Deque<ConversionEvent> pending = new ArrayDeque<>();
        private final AtomicLong dropped = new AtomicLong();
        private boolean draining;
        private volatile boolean closed;

        Subscriber(Predicate<? super ConversionEvent> filter, Consumer<? super ConversionEvent> handler) {
            this.filter = filter;
            this.handler = handler;
        }

        void offer(ConversionEvent event) {
            if (closed) {
                return;
            }
            boolean matches;
            try {
                matches = filter.test(event);
            } catch (RuntimeException e) {
                LOG.warn("Subscriber filter threw on {}: {}", event.getClass().getSimpleName(), e.toString());
                return;
            }
            if (!matches) {
                return;
            }
            boolean schedule;
            synchronized (this) {
                if (pending.size() >= queueCapacity) {
                    long n = dropped.incrementAndGet();
                    if (n == 1 || n % 100 == 0) {
                        LOG.warn("Event subscriber lagging; dropped {} events so far", n);
                    }
                    return;
                }
                pending.addLast(event);
                schedule = !draining;
                draining = true;
            }
            if (schedule) {
                scheduleDrain();
            }
        }

        private void scheduleDrain() {
            try {
                deliveryExecutor.execute(this::drain);
            } catch (RejectedExecutionException e) {
                LOG.warn("Event delivery rejected by executor: {}", e.toString());
                synchronized (this) {
                    dropped.addAndGet(pending.size());
                    pending.clear();
                    draining = false;
                }
            }
        }

        private void drain() {
            while (true) {
                ConversionEvent next;
                synchronized (this) {
                    next = pending.pollFirst();
                    if (next == null || closed) {
                        pending.clear();
                        draining = false;
                        return;
                    }
                }
                try {
                    handler.accept(next);
                } catch (RuntimeException e) {
                    LOG.warn("Event subscriber failed on {}: {}", next.getClass().getSimpleName(), e.toString(), e);
                }
            }
        }

        @Override
        public long droppedEvents() {
            return dropped.get();
        }

        @Override
        public void close() {
            closed = true;
            subscribers.remove(this);
        }
    }
}
