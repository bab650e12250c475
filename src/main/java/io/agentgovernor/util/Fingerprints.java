package io.agentgovernor.util;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Content hashes used as deduplication keys. Content is hashed as canonical JSON, so two maps
 * with the same entries in a different insertion order produce the same fingerprint.
 */
public final class Fingerprints {
    private Fingerprints() {
    }

    public static String task(String description, Map<String, ?> context) {
        Map<String, Object> content = new LinkedHashMap<>();
        content.put("description", description == null ? "" : description);
        content.put("context", context == null ? Map.of() : context);
        return Hashing.sha256Hex(Jsons.toCanonicalJson(content));
    }

    public static String event(String eventType, String source, Map<String, ?> payload) {
        Map<String, Object> content = new LinkedHashMap<>();
        content.put("type", eventType == null ? "" : eventType);
        content.put("source", source == null ? "" : source);
        content.put("payload", payload == null ? Map.of() : payload);
        return Hashing.sha256Hex(Jsons.toCanonicalJson(content));
    }
}
