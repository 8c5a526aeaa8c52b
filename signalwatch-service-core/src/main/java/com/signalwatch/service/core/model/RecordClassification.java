package com.signalwatch.service.core.model;

public record RecordClassification(Priority priority, String category, String sourceId) {}
