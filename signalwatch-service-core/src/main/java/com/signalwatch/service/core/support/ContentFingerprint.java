package com.signalwatch.service.core.support;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.Map;

/** Stable digest of a memory entry's content. Map keys are sorted before hashing. */
public final class ContentFingerprint {

    private static final int LENGTH = 16;

    private static final ObjectMapper CANONICAL_JSON = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true)
            .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);

    private ContentFingerprint() {}

    public static String of(String sourceId, String kind, Map<String, Object> payload) {
        Map<String, Object> content = new LinkedHashMap<>();
        content.put("sourceId", sourceId);
        content.put("kind", kind);
        content.put("payload", payload == null ? Map.of() : payload);
        byte[] canonical;
        try {
            canonical = CANONICAL_JSON.writeValueAsBytes(content);
        } catch (JsonProcessingException e) {
            // payloads holding non-serializable values still get a deterministic digest
            canonical = String.valueOf(content).getBytes(StandardCharsets.UTF_8);
        }
        return "fp_" + HexFormat.of().formatHex(sha256(canonical)).substring(0, LENGTH);
    }

    private static byte[] sha256(byte[] input) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(input);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
