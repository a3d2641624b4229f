package com.phillippitts.transcodeguard.util;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * Fixed-capacity history of recent items, newest first. Appending past capacity evicts the oldest entry.
 *
 * <p>Thread-safe; guarded by its own monitor so readers never contend with the coordinator's
 * state lock.
 *
 * @param <T> element type
 */
public final class BoundedHistory<T> {

    private final int capacity;
    private final Deque<T> items;

    public BoundedHistory(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.items = new ArrayDeque<>(capacity);
    }

    public int capacity() {
        return capacity;
    }

    public synchronized int size() {
        return items.size();
    }

    public synchronized void add(T item) {
        Objects.requireNonNull(item, "item");
        if (items.size() == capacity) {
            items.removeLast();
        }
        items.addFirst(item);
    }

    /**
     * Returns up to {@code limit} most recent items, newest first.
     */
    public synchronized List<T> newestFirst(int limit) {
        int n = Math.min(Math.max(limit, 0), items.size());
        List<T> out = new ArrayList<>(n);
        Iterator<T> it = items.iterator();
        while (out.size() < n) {
            out.add(it.next());
        }
        return out;
    }

    public synchronized Optional<T> newest() {
        return Optional.ofNullable(items.peekFirst());
    }

    /**
     * Returns the newest item matching {@code filter}.
     */
    public synchronized Optional<T> find(Predicate<? super T> filter) {
        for (T item : items) {
            if (filter.test(item)) {
                return Optional.of(item);
            }
        }
        return Optional.empty();
    }

    /**
     * Replaces the newest item matching {@code filter} in place with {@code update.apply(item)}.
     *
     * @return the replacement, or empty when nothing matched
     */
    public synchronized Optional<T> replace(Predicate<? super T> filter, UnaryOperator<T> update) {
        List<T> snapshot = new ArrayList<>(items);
        for (int i = 0; i < snapshot.size(); i++) {
            T item = snapshot.get(i);
            if (filter.test(item)) {
                T replacement = Objects.requireNonNull(update.apply(item), "replacement");
                snapshot.set(i, replacement);
                items.clear();
                items.addAll(snapshot);
                return Optional.of(replacement);
            }
        }
        return Optional.empty();
    }

    public synchronized void clear() {
        items.clear();
    }
}
