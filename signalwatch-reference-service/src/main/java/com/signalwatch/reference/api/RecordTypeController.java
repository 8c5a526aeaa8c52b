package com.signalwatch.reference.api;

import com.signalwatch.reference.registry.ConfiguredRecordTypeRegistry;
import com.signalwatch.service.core.registry.RecordTypeDefinition;
import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

@RestController
@RequestMapping("/api/registry/types")
public class RecordTypeController {
    private final ConfiguredRecordTypeRegistry registry;

    public RecordTypeController(ConfiguredRecordTypeRegistry registry) {
        this.registry = registry;
    }

    @GetMapping
    public List<RecordTypeDefinition> list() {
        return registry.definitions();
    }

    @GetMapping("/{type}")
    public RecordTypeDefinition get(@PathVariable String type) {
        return registry.definition(type)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Unknown record type: " + type));
    }
}
