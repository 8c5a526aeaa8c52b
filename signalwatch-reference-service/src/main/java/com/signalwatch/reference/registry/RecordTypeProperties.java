package com.signalwatch.reference.registry;

import com.signalwatch.service.core.model.Priority;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/** Record-type catalog bound from {@code signalwatch.registry.types.<type>.*}. */
@Component
@ConfigurationProperties(prefix = "signalwatch.registry")
public class RecordTypeProperties {

    private Map<String, TypeConfig> types = new LinkedHashMap<>();

    public Map<String, TypeConfig> getTypes() {
        return types;
    }

    public void setTypes(Map<String, TypeConfig> types) {
        this.types = types;
    }

    public static class TypeConfig {
        private String marker;
        private Priority priority = Priority.MEDIUM;
        private String category;
        private String description;
        private List<String> required = new ArrayList<>();
        private Map<String, FieldType> fields = new LinkedHashMap<>();

        public String getMarker() {
            return marker;
        }

        public void setMarker(String marker) {
            this.marker = marker;
        }

        public Priority getPriority() {
            return priority;
        }

        public void setPriority(Priority priority) {
            this.priority = priority;
        }

        public String getCategory() {
            return category;
        }

        public void setCategory(String category) {
            this.category = category;
        }

        public String getDescription() {
            return description;
        }

        public void setDescription(String description) {
            this.description = description;
        }

        public List<String> getRequired() {
            return required;
        }

        public void setRequired(List<String> required) {
            this.required = required;
        }

        public Map<String, FieldType> getFields() {
            return fields;
        }

        public void setFields(Map<String, FieldType> fields) {
            this.fields = fields;
        }
    }
}
