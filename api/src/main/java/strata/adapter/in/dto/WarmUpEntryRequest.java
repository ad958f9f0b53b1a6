package strata.adapter.in.dto;

import java.util.Base64;
import java.util.Locale;
import java.util.Set;

import com.fasterxml.jackson.databind.JsonNode;

import strata.core.model.CachedValue;
import strata.core.model.WarmUpEntry;

/**
 * DTO for one warm-up entry, shared by the warm-up file and the admin endpoint.
 *
 * <pre>
 * {"key": "config:flags", "value": {"beta": true}, "type": "json", "ttl": 900,
 *  "tags": ["config"], "dependencies": ["flags_table"]}
 * </pre>
 *
 * @param type {@code text} (default for string values), {@code json} (default for anything
 *             else) or {@code binary} (value is Base64)
 * @param ttl  seconds; the tier default when absent
 */
public record WarmUpEntryRequest(
        String key, JsonNode value, String type, Long ttl, Set<String> tags, Set<String> dependencies) {

    /**
     * @throws IllegalArgumentException if the key or value is missing, or the type or TTL is invalid
     */
    public WarmUpEntry toEntry() {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("missing key");
        }
        if (value == null || value.isNull()) {
            throw new IllegalArgumentException("missing value for " + key);
        }
        if (ttl != null && ttl < 0) {
            throw new IllegalArgumentException("negative ttl for " + key);
        }
        return new WarmUpEntry(key, toValue(), ttl, tags, dependencies);
    }

    private CachedValue toValue() {
        var resolvedType = type == null
                ? (value.isTextual() ? "text" : "json")
                : type.toLowerCase(Locale.ROOT);
        switch (resolvedType) {
            case "text":
                return CachedValue.text(value.isTextual() ? value.textValue() : value.toString());
            case "json":
                return CachedValue.json(value.toString());
            case "binary":
                if (!value.isTextual()) {
                    throw new IllegalArgumentException("binary value for " + key + " must be Base64 text");
                }
                return CachedValue.bytes(Base64.getDecoder().decode(value.textValue()));
            default:
                throw new IllegalArgumentException("unknown type '" + type + "' for " + key);
        }
    }
}
