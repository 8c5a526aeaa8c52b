package com.signalwatch.service.core.registry;

import java.util.Map;
import java.util.Optional;

/**
 * Catalog of record types a source may emit. Implementations must be pure and fast: they are
 * called while the reporting source's lock is held.
 */
public interface RecordTypeRegistry {

    ValidationResult validate(String recordType, Map<String, Object> payload);

    Optional<RecordTypeDefinition> definition(String recordType);
}
