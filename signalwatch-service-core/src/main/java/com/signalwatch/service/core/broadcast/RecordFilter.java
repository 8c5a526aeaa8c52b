package com.signalwatch.service.core.broadcast;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.signalwatch.service.core.model.Priority;
import com.signalwatch.service.core.model.RecordClassification;
import com.signalwatch.service.core.model.StreamableRecord;
import lombok.Builder;

/**
 * Subscriber-side match criteria over broadcast records. A {@code null} criterion matches anything;
 * present criteria are ANDed. {@code minConfidence} is inclusive and rejects records without a
 * confidence.
 */
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RecordFilter(
        String sourceName,
        String sourceId,
        String recordType,
        String category,
        Priority priority,
        Double minConfidence) {

    private static final RecordFilter ANY = new RecordFilter(null, null, null, null, null, null);

    public static RecordFilter any() {
        return ANY;
    }

    @JsonIgnore
    public boolean isEmpty() {
        return sourceName == null
                && sourceId == null
                && recordType == null
                && category == null
                && priority == null
                && minConfidence == null;
    }

    public boolean matches(StreamableRecord record) {
        if (record == null) return false;
        RecordClassification c = record.classification();
        if (sourceId != null && (c == null || !sourceId.equals(c.sourceId()))) return false;
        if (recordType != null && !recordType.equals(record.recordType())) return false;
        if (sourceName != null && !sourceName.equals(record.sourceName())) return false;
        if (category != null && (c == null || !category.equals(c.category()))) return false;
        if (priority != null && (c == null || priority != c.priority())) return false;
        if (minConfidence != null && (record.confidence() == null || record.confidence() < minConfidence)) {
            return false;
        }
        return true;
    }
}
