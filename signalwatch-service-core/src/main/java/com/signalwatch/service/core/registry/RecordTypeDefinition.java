package com.signalwatch.service.core.registry;

import com.signalwatch.service.core.model.Priority;

/** Classification attached to every record of a given type. */
public record RecordTypeDefinition(String type, String marker, Priority priority, String category, String description) {}
