package com.signalwatch.service.core.stats;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Side-by-side view of every source's running statistics plus three headline insights: best
 * success rate, highest record rate and fastest average processing. Ties go to the source id that
 * sorts first.
 */
public record StatisticsComparison(List<Entry> comparison, List<String> insights, Instant timestamp) {

    /**
     * @param reliability share of operations that did not end in an error
     * @param efficiency average processing time spread over the records emitted, 0 without records
     */
    public record Entry(
            String sourceId,
            double successRate,
            double averageProcessingTime,
            double ratePerHour,
            double reliability,
            double efficiency) {

        static Entry of(String sourceId, Statistics stats) {
            long operations = Math.max(stats.totalEvents() + stats.totalRecords(), 1L);
            return new Entry(
                    sourceId,
                    stats.successRate(),
                    stats.averageProcessingTime(),
                    stats.ratePerHour(),
                    1.0 - (double) stats.errorCount() / operations,
                    stats.totalRecords() > 0 ? stats.averageProcessingTime() / stats.totalRecords() : 0.0);
        }
    }

    public static StatisticsComparison of(Map<String, Statistics> sources, Instant now) {
        List<Entry> entries = new ArrayList<>(sources.size());
        sources.forEach((id, stats) -> entries.add(Entry.of(id, stats)));
        entries.sort(Comparator.comparing(Entry::sourceId));
        if (entries.isEmpty()) {
            return new StatisticsComparison(List.of(), List.of(), now);
        }

        Entry top = entries.get(0);
        Entry productive = entries.get(0);
        Entry fastest = entries.get(0);
        for (Entry e : entries) {
            if (e.successRate() > top.successRate()) top = e;
            if (e.ratePerHour() > productive.ratePerHour()) productive = e;
            if (e.averageProcessingTime() < fastest.averageProcessingTime()) fastest = e;
        }
        List<String> insights = List.of(
                String.format(Locale.ROOT, "Top Success Rate: %s (%.1f%%)", top.sourceId(), top.successRate() * 100),
                String.format(
                        Locale.ROOT,
                        "Most Productive: %s (%.1f records/hour)",
                        productive.sourceId(),
                        productive.ratePerHour()),
                String.format(
                        Locale.ROOT,
                        "Fastest Processing: %s (%.1fms avg)",
                        fastest.sourceId(),
                        fastest.averageProcessingTime()));
        return new StatisticsComparison(List.copyOf(entries), insights, now);
    }
}
