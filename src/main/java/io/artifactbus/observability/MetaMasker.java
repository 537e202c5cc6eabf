package io.artifactbus.observability;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.artifactbus.util.Jsons;

import java.util.Iterator;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Masks values under credential-like keys before producer metadata reaches the audit log.
 * Values themselves are not inspected: content hashes and run ids are long opaque strings too.
 */
public final class MetaMasker {
    static final String MASK = "***";
    private static final Set<String> SENSITIVE_HINTS = Set.of(
            "password", "passwd", "secret", "token", "authorization", "apikey", "api_key", "credential"
    );

    private MetaMasker() {
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
        return false;
    }
}
