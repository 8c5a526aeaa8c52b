package com.signalwatch.service.core.history;

/**
 * Result ordering for {@link BoundedHistory#query(HistoryQuery)}.
 *
 * <p>{@link #NEWEST_FIRST} sorts by timestamp descending and suits administrative search.
 * {@link #INSERTION} keeps append order and suits per-source snapshot views; for a query spanning
 * every key the entries are grouped by key.
 */
public enum HistoryOrder {
    NEWEST_FIRST,
    INSERTION
}
