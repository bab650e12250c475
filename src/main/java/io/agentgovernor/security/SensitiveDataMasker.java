package io.agentgovernor.security;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.agentgovernor.util.Jsons;

import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Masks credentials in audit details. Keys that look sensitive are replaced wholesale; other
 * long opaque strings are masked too unless they carry one of the governor's own id prefixes.
 * The generic {@code token} and {@code key} hints skip counters such as the {@code tokens}
 * budget dimension or {@code prompt_tokens}.
 */
public final class SensitiveDataMasker {
    public static final String MASK = "***";
    private static final Set<String> SENSITIVE_HINTS = Set.of(
            "password", "passwd", "secret", "authorization", "apikey", "api_key", "access_token",
            "auth_token", "refresh_token", "bearer", "private_key", "credential"
    );
    private static final Set<String> GENERIC_HINTS = Set.of("token", "key");
    private static final List<String> SAFE_ID_PREFIXES = List.of("tsk_", "corr_", "evt_", "res_", "agent:");

    private SensitiveDataMasker() {
    }

    public static JsonNode masked(JsonNode input) {
        if (input == null || input.isNull()) {
            return Jsons.mapper().nullNode();
        }
        if (input.isObject()) {
            ObjectNode out = Jsons.mapper().createObjectNode();
            Iterator<Map.Entry<String, JsonNode>> it = input.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> entry = it.next();
                if (isSensitiveKey(entry.getKey())) {
                    out.put(entry.getKey(), MASK);
                } else {
                    out.set(entry.getKey(), masked(entry.getValue()));
                }
            }
            return out;
        }
        if (input.isArray()) {
            ArrayNode out = Jsons.mapper().createArrayNode();
            for (JsonNode value : input) {
                out.add(masked(value));
            }
            return out;
        }
        if (input.isTextual() && likelySecretValue(input.asText(""))) {
            return Jsons.mapper().getNodeFactory().textNode(MASK);
        }
        return input;
    }

    static boolean isSensitiveKey(String rawKey) {
        if (rawKey == null || rawKey.isBlank()) {
            return false;
        }
        String key = rawKey.toLowerCase(Locale.ROOT);
        for (String hint : SENSITIVE_HINTS) {
            if (key.contains(hint)) {
                return true;
            }
        }
        if (key.endsWith("tokens") || key.endsWith("_count")) {
            return false;
        }
        for (String hint : GENERIC_HINTS) {
            if (key.contains(hint)) {
                return true;
            }
        }
        return false;
    }

    static boolean likelySecretValue(String value) {
        if (value == null) {
            return false;
        }
        String v = value.trim();
        if (v.length() < 24) {
            return false;
        }
        for (String prefix : SAFE_ID_PREFIXES) {
            if (v.startsWith(prefix)) {
                return false;
            }
        }
        return v.matches("^[A-Za-z0-9+/=_\\-:.]{24,}$");
    }
}
