package com.signalwatch.service.core.broadcast;

import com.signalwatch.service.core.config.TelemetryProperties;
import com.signalwatch.service.core.model.StreamableRecord;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Subscriber registry with filtered push-on-publish fan-out.
 *
 * <p>{@link #publish(StreamableRecord)} never waits on a sink. Each subscriber owns a bounded queue
 * that a delivery task drains on the executor; at most one task per subscriber is in flight, which
 * keeps per-subscriber order equal to publish order. The owned executor is a cached pool, so a
 * reader blocked in a push holds only its own thread. A push that throws, or a queue that fills up
 * because the reader stalled, removes the subscriber and closes its sink. Nothing is retried.
 *
 * <p>{@link #cleanupStalled(Duration)} also interrupts the thread stuck in the push, so a stalled
 * reader never keeps a delivery thread after it is dropped.
 *
 * <p>The hub replays nothing on subscribe. Callers that want history read {@link #recentRecords}
 * themselves.
 */
@Component
@Slf4j
public class BroadcastHub implements AutoCloseable {

    private final Clock clock;
    private final Executor executor;
    private final ExecutorService ownedExecutor;
    private final int bufferCapacity;
    private final int queueCapacity;

    private final ConcurrentMap<String, Subscriber> subscribers = new ConcurrentHashMap<>();
    private final ArrayDeque<StreamableRecord> recent;
    private final AtomicLong totalPublished = new AtomicLong();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    @Autowired
    public BroadcastHub(TelemetryProperties properties, Clock clock) {
        this(
                properties.getBroadcast(),
                clock,
                Executors.newCachedThreadPool(new DeliveryThreadFactory()),
                true);
    }

    /** Delivers on {@code executor}; the caller keeps ownership of it. */
    public BroadcastHub(TelemetryProperties.Broadcast config, Clock clock, Executor executor) {
        this(config, clock, executor, false);
    }

    private BroadcastHub(TelemetryProperties.Broadcast config, Clock clock, Executor executor, boolean owned) {
        if (config.getBufferCapacity() <= 0 || config.getQueueCapacity() <= 0) {
            throw new IllegalArgumentException("broadcast buffer and queue capacities must be > 0");
        }
        this.clock = Objects.requireNonNull(clock, "clock");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.ownedExecutor = owned ? (ExecutorService) executor : null;
        this.bufferCapacity = config.getBufferCapacity();
        this.queueCapacity = config.getQueueCapacity();
        this.recent = new ArrayDeque<>(Math.min(bufferCapacity, 128));
    }

    /**
     * Registers {@code sink} under {@code subscriberId}. Re-using a live id replaces the previous
     * subscriber, whose sink is closed.
     */
    public void subscribe(String subscriberId, RecordSink sink, RecordFilter filter) {
        Objects.requireNonNull(subscriberId, "subscriberId");
        Objects.requireNonNull(sink, "sink");
        if (closed.get()) {
            throw new IllegalStateException("Broadcast hub is closed");
        }
        RecordFilter effective = filter == null || filter.isEmpty() ? null : filter;
        Subscriber created = new Subscriber(subscriberId, sink, effective, Instant.now(clock));
        Subscriber previous = subscribers.put(subscriberId, created);
        if (previous != null) {
            previous.shutdown();
            log.info("Subscriber {} replaced by a new connection", subscriberId);
        }
        log.info("Subscriber {} registered{}", subscriberId, effective == null ? "" : " with filter " + effective);
    }

    /** Removes the subscriber and closes its sink before returning. Unknown ids are ignored. */
    public void unsubscribe(String subscriberId) {
        if (subscriberId == null) return;
        Subscriber removed = subscribers.remove(subscriberId);
        if (removed != null) {
            removed.shutdown();
            log.info("Subscriber {} unregistered after {} pushes", subscriberId, removed.pushed.get());
        }
    }

    public boolean isSubscribed(String subscriberId) {
        return subscriberId != null && subscribers.containsKey(subscriberId);
    }

    public void publish(StreamableRecord record) {
        Objects.requireNonNull(record, "record");
        totalPublished.incrementAndGet();
        synchronized (recent) {
            recent.addLast(record);
            if (recent.size() > bufferCapacity) {
                recent.pollFirst();
            }
        }
        for (Subscriber subscriber : List.copyOf(subscribers.values())) {
            if (subscriber.filter != null && !subscriber.filter.matches(record)) {
                continue;
            }
            if (!subscriber.offer(record)) {
                log.warn(
                        "Subscriber {} fell {} records behind; dropping it",
                        subscriber.id,
                        subscriber.pending.size());
                drop(subscriber);
            }
        }
    }

    /** Buffered records matching {@code filter}, newest first. */
    public List<StreamableRecord> recentRecords(RecordFilter filter, Integer limit) {
        List<StreamableRecord> out = new ArrayList<>();
        int max = limit == null || limit <= 0 ? Integer.MAX_VALUE : limit;
        synchronized (recent) {
            for (Iterator<StreamableRecord> it = recent.descendingIterator(); it.hasNext() && out.size() < max; ) {
                StreamableRecord record = it.next();
                if (filter == null || filter.matches(record)) {
                    out.add(record);
                }
            }
        }
        return out;
    }

    /**
     * Removes subscribers whose last successful push (or subscription, if nothing was pushed yet)
     * is older than {@code idleThreshold}.
     */
    public int cleanupStale(Duration idleThreshold) {
        Instant cutoff = Instant.now(clock).minus(idleThreshold);
        int removed = 0;
        for (Subscriber subscriber : List.copyOf(subscribers.values())) {
            if (subscriber.lastPush.isBefore(cutoff) && drop(subscriber)) {
                removed++;
            }
        }
        if (removed > 0) {
            log.info("Cleaned up {} stale subscribers", removed);
        }
        return removed;
    }

    /** Removes subscribers whose in-flight push has been running longer than {@code pushTimeout}. */
    public int cleanupStalled(Duration pushTimeout) {
        Instant cutoff = Instant.now(clock).minus(pushTimeout);
        int removed = 0;
        for (Subscriber subscriber : List.copyOf(subscribers.values())) {
            Instant started = subscriber.pushStartedAt;
            if (started != null && started.isBefore(cutoff) && drop(subscriber)) {
                subscriber.interruptDelivery();
                log.warn("Subscriber {} blocked in push since {}; dropping it", subscriber.id, started);
                removed++;
            }
        }
        return removed;
    }

    public BroadcastStats stats() {
        List<BroadcastStats.SubscriberStats> perSubscriber = new ArrayList<>();
        for (Subscriber s : subscribers.values()) {
            perSubscriber.add(new BroadcastStats.SubscriberStats(
                    s.id, s.pushed.get(), s.subscribedAt, s.lastPush, s.pending.size(), s.filter));
        }
        int buffered;
        synchronized (recent) {
            buffered = recent.size();
        }
        return new BroadcastStats(totalPublished.get(), buffered, subscribers.size(), perSubscriber);
    }

    public int subscriberCount() {
        return subscribers.size();
    }

    /** Disconnects every subscriber and stops delivery. Further subscribes are refused. */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        List<Subscriber> all = List.copyOf(subscribers.values());
        all.forEach(this::drop);
        if (ownedExecutor != null) {
            ownedExecutor.shutdown();
            try {
                if (!ownedExecutor.awaitTermination(2, TimeUnit.SECONDS)) {
                    ownedExecutor.shutdownNow();
                }
            } catch (InterruptedException ie) {
                ownedExecutor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        log.info("Broadcast hub closed; disconnected {} subscribers", all.size());
    }

    private boolean drop(Subscriber subscriber) {
        if (subscribers.remove(subscriber.id, subscriber)) {
            subscriber.shutdown();
            return true;
        }
        return false;
    }

    private final class Subscriber implements Runnable {
        private final String id;
        private final RecordSink sink;
        private final RecordFilter filter;
        private final Instant subscribedAt;
        private final BlockingQueue<StreamableRecord> pending;
        private final AtomicBoolean scheduled = new AtomicBoolean(false);
        private final AtomicBoolean active = new AtomicBoolean(true);
        private final AtomicLong pushed = new AtomicLong();
        private volatile Instant lastPush;
        private volatile Instant pushStartedAt;
        private Thread deliveringThread;

        Subscriber(String id, RecordSink sink, RecordFilter filter, Instant now) {
            this.id = id;
            this.sink = sink;
            this.filter = filter;
            this.subscribedAt = now;
            this.lastPush = now;
            this.pending = new ArrayBlockingQueue<>(queueCapacity);
        }

        boolean offer(StreamableRecord record) {
            if (!active.get()) return true;
            if (!pending.offer(record)) return false;
            schedule();
            return true;
        }

        private void schedule() {
            if (!scheduled.compareAndSet(false, true)) return;
            try {
                executor.execute(this);
            } catch (RejectedExecutionException ex) {
                scheduled.set(false);
                log.warn("Delivery to subscriber {} rejected: {}", id, ex.toString());
                drop(this);
            }
        }

        @Override
        public void run() {
            while (active.get()) {
                StreamableRecord record = pending.poll();
                if (record == null) {
                    scheduled.set(false);
                    // a publish may have enqueued between the empty poll and the flag reset
                    if (pending.isEmpty() || !scheduled.compareAndSet(false, true)) {
                        return;
                    }
                    continue;
                }
                enterPush();
                try {
                    sink.push(record);
                    pushed.incrementAndGet();
                    lastPush = Instant.now(clock);
                } catch (Exception ex) {
                    if (active.get()) {
                        log.warn("Push to subscriber {} failed, unsubscribing: {}", id, ex.toString());
                    }
                    drop(this);
                    return;
                } finally {
                    exitPush();
                }
            }
        }

        private synchronized void enterPush() {
            deliveringThread = Thread.currentThread();
            pushStartedAt = Instant.now(clock);
        }

        private synchronized void exitPush() {
            deliveringThread = null;
            pushStartedAt = null;
            if (!active.get()) {
                // clear an interrupt aimed at this push before the thread serves another subscriber
                Thread.interrupted();
            }
        }

        /** Interrupts the thread blocked in this subscriber's push, if any. */
        synchronized void interruptDelivery() {
            Thread thread = deliveringThread;
            if (thread != null && thread != Thread.currentThread()) {
                thread.interrupt();
            }
        }

        void shutdown() {
            if (!active.compareAndSet(true, false)) return;
            pending.clear();
            try {
                sink.close();
            } catch (RuntimeException ex) {
                log.debug("Sink for subscriber {} already closed: {}", id, ex.toString());
            }
        }
    }

    private static final class DeliveryThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "signalwatch-broadcast-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
