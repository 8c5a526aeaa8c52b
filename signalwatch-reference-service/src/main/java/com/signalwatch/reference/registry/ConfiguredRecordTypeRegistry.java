package com.signalwatch.reference.registry;

import com.signalwatch.service.core.registry.RecordTypeDefinition;
import com.signalwatch.service.core.registry.RecordTypeRegistry;
import com.signalwatch.service.core.registry.ValidationResult;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * {@link RecordTypeRegistry} backed by the configured catalog. The catalog is frozen at startup;
 * a type without a marker or category fails the boot.
 */
@Component
@Slf4j
public class ConfiguredRecordTypeRegistry implements RecordTypeRegistry {

    private final Map<String, Entry> entries;

    public ConfiguredRecordTypeRegistry(RecordTypeProperties properties) {
        Map<String, Entry> built = new LinkedHashMap<>();
        properties.getTypes().forEach((type, config) -> built.put(type, Entry.of(type, config)));
        this.entries = Map.copyOf(built);
        log.info("Record type registry loaded {} types: {}", built.size(), built.keySet());
    }

    @Override
    public ValidationResult validate(String recordType, Map<String, Object> payload) {
        Entry entry = recordType == null ? null : entries.get(recordType);
        if (entry == null) {
            return ValidationResult.invalid("Unknown record type: " + recordType);
        }
        Map<String, Object> values = payload == null ? Map.of() : payload;
        List<String> errors = new ArrayList<>();
        for (String field : entry.required()) {
            if (!values.containsKey(field)) {
                errors.add("Missing required field: " + field);
            }
        }
        entry.fields().forEach((field, expected) -> {
            if (values.containsKey(field)) {
                FieldType actual = FieldType.of(values.get(field));
                if (actual != expected) {
                    errors.add("Field " + field + " should be " + expected.wireName() + ", got "
                            + (actual == null ? "null" : actual.wireName()));
                }
            }
        });
        return errors.isEmpty() ? ValidationResult.ok() : ValidationResult.invalid(errors);
    }

    @Override
    public Optional<RecordTypeDefinition> definition(String recordType) {
        Entry entry = recordType == null ? null : entries.get(recordType);
        return entry == null ? Optional.empty() : Optional.of(entry.definition());
    }

    /** Every configured definition, sorted by type. */
    public List<RecordTypeDefinition> definitions() {
        return entries.values().stream()
                .map(Entry::definition)
                .sorted((a, b) -> a.type().compareTo(b.type()))
                .toList();
    }

    private record Entry(RecordTypeDefinition definition, List<String> required, Map<String, FieldType> fields) {

        static Entry of(String type, RecordTypeProperties.TypeConfig config) {
            if (config.getMarker() == null || config.getMarker().isBlank()) {
                throw new IllegalStateException("Record type " + type + " has no marker");
            }
            if (config.getCategory() == null || config.getCategory().isBlank()) {
                throw new IllegalStateException("Record type " + type + " has no category");
            }
            RecordTypeDefinition definition = new RecordTypeDefinition(
                    type, config.getMarker(), config.getPriority(), config.getCategory(), config.getDescription());
            return new Entry(
                    definition,
                    List.copyOf(config.getRequired()),
                    new LinkedHashMap<>(config.getFields()));
        }
    }
}
