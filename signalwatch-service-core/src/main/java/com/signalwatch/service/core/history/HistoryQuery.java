package com.signalwatch.service.core.history;

import java.time.Instant;
import java.util.function.Predicate;
import lombok.Builder;

/**
 * Read request against a {@link BoundedHistory}. A {@code null} key scans every key; {@code from}
 * and {@code to} are inclusive.
 */
@Builder
public record HistoryQuery<T>(
        String key, Predicate<? super T> filter, Instant from, Instant to, int offset, int limit, HistoryOrder order) {

    public HistoryQuery {
        if (offset < 0) {
            throw new IllegalArgumentException("offset must be >= 0");
        }
        if (limit <= 0) {
            limit = Integer.MAX_VALUE;
        }
        if (order == null) {
            order = HistoryOrder.NEWEST_FIRST;
        }
    }

    public static <T> HistoryQuery<T> all() {
        return HistoryQuery.<T>builder().build();
    }

    public static <T> HistoryQuery<T> forKey(String key) {
        return HistoryQuery.<T>builder().key(key).build();
    }
}
