package com.signalwatch.service.core.broadcast;

import java.time.Instant;
import java.util.List;

public record BroadcastStats(
        long totalPublished, int bufferedCount, int subscriberCount, List<SubscriberStats> perSubscriber) {

    public record SubscriberStats(
            String id, long pushedCount, Instant subscribedAt, Instant lastPush, int pending, RecordFilter filter) {}
}
