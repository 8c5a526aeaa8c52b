package com.signalwatch.service.core.history;

import com.signalwatch.service.core.model.Timestamped;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Capacity-limited, insertion-ordered store with one ring per key. Appending past capacity drops
 * the oldest entry of that key. Each ring is guarded by its own monitor, so writers for different
 * keys never contend.
 */
public final class BoundedHistory<T extends Timestamped> {

    private final int capacity;
    private final Clock clock;
    private final ConcurrentMap<String, Ring<T>> rings = new ConcurrentHashMap<>();

    public BoundedHistory(int capacity, Clock clock) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be > 0, got " + capacity);
        }
        this.capacity = capacity;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public void append(String key, T item) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(item, "item");
        rings.computeIfAbsent(key, k -> new Ring<>(capacity)).add(item);
    }

    /** Appends {@code items} in order. Readers see either none or all of them. */
    public void appendAll(String key, List<T> items) {
        Objects.requireNonNull(key, "key");
        if (items.isEmpty()) {
            return;
        }
        items.forEach(item -> Objects.requireNonNull(item, "item"));
        rings.computeIfAbsent(key, k -> new Ring<>(capacity)).addAll(items);
    }

    public List<T> query(HistoryQuery<T> query) {
        List<T> matched = new ArrayList<>();
        if (query.key() != null) {
            Ring<T> ring = rings.get(query.key());
            if (ring != null) {
                collect(ring.copy(), query, matched);
            }
        } else {
            for (Ring<T> ring : rings.values()) {
                collect(ring.copy(), query, matched);
            }
        }

        if (query.order() == HistoryOrder.NEWEST_FIRST) {
            // reverse first so equal timestamps keep newest-appended first after the stable sort
            Collections.reverse(matched);
            matched.sort(Comparator.comparing(Timestamped::timestamp).reversed());
        }

        if (query.offset() >= matched.size()) {
            return List.of();
        }
        long end = Math.min((long) query.offset() + query.limit(), matched.size());
        return List.copyOf(matched.subList(query.offset(), (int) end));
    }

    /** Last {@code count} entries of one key, oldest first. */
    public List<T> recent(String key, int count) {
        if (key == null || count <= 0) {
            return List.of();
        }
        Ring<T> ring = rings.get(key);
        if (ring == null) {
            return List.of();
        }
        List<T> all = ring.copy();
        return List.copyOf(all.subList(Math.max(0, all.size() - count), all.size()));
    }

    public int size(String key) {
        Ring<T> ring = key == null ? null : rings.get(key);
        return ring == null ? 0 : ring.size();
    }

    public int totalSize() {
        int total = 0;
        for (Ring<T> ring : rings.values()) {
            total += ring.size();
        }
        return total;
    }

    /** Removes every entry stamped at or before {@code now - age}. */
    public int purgeOlderThan(Duration age) {
        Objects.requireNonNull(age, "age");
        Instant now = Instant.now(clock);
        if (age.compareTo(Duration.between(Instant.MIN, now)) > 0) {
            // cutoff predates every representable instant
            return 0;
        }
        Instant cutoff = now.minus(age);
        int removed = 0;
        for (Ring<T> ring : rings.values()) {
            removed += ring.removeNotAfter(cutoff);
        }
        return removed;
    }

    private static <T extends Timestamped> void collect(List<T> items, HistoryQuery<T> query, List<T> out) {
        for (T item : items) {
            if (query.from() != null && item.timestamp().isBefore(query.from())) continue;
            if (query.to() != null && item.timestamp().isAfter(query.to())) continue;
            if (query.filter() != null && !query.filter().test(item)) continue;
            out.add(item);
        }
    }

    private static final class Ring<T extends Timestamped> {
        private final int capacity;
        private final ArrayDeque<T> items;

        Ring(int capacity) {
            this.capacity = capacity;
            this.items = new ArrayDeque<>(Math.min(capacity, 64));
        }

        synchronized void add(T item) {
            items.addLast(item);
            if (items.size() > capacity) {
                items.pollFirst();
            }
        }

        synchronized void addAll(List<T> batch) {
            for (T item : batch) {
                add(item);
            }
        }

        synchronized List<T> copy() {
            return new ArrayList<>(items);
        }

        synchronized int size() {
            return items.size();
        }

        synchronized int removeNotAfter(Instant cutoff) {
            int removed = 0;
            for (Iterator<T> it = items.iterator(); it.hasNext(); ) {
                if (!it.next().timestamp().isAfter(cutoff)) {
                    it.remove();
                    removed++;
                }
            }
            return removed;
        }
    }
}
