package strata.core.model;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Serialized value crossing tier boundaries.
 *
 * <p>The engine never interprets the payload. Callers serialize before {@code set} and
 * deserialize after {@code get}, using {@link #typeTag()} to recover the original type.
 *
 * @param payload serialized bytes
 * @param typeTag caller-defined type label (for example a media type or class name)
 */
public record CachedValue(byte[] payload, String typeTag) {

    public static final String TEXT = "text/plain";
    public static final String JSON = "application/json";
    public static final String BINARY = "application/octet-stream";

    public CachedValue {
        if (payload == null) {
            throw new IllegalArgumentException("Cached value payload must not be null");
        }
        if (typeTag == null || typeTag.isBlank()) {
            typeTag = BINARY;
        }
    }

    public static CachedValue text(String text) {
        return new CachedValue(text.getBytes(StandardCharsets.UTF_8), TEXT);
    }

    public static CachedValue json(String json) {
        return new CachedValue(json.getBytes(StandardCharsets.UTF_8), JSON);
    }

    public static CachedValue bytes(byte[] payload) {
        return new CachedValue(payload, BINARY);
    }

    public String asUtf8() {
        return new String(payload, StandardCharsets.UTF_8);
    }

    /**
     * Estimated in-memory footprint of the value: payload plus type tag characters.
     */
    public long sizeBytes() {
        return payload.length + (long) typeTag.length() * 2;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CachedValue other)) {
            return false;
        }
        return Arrays.equals(payload, other.payload) && typeTag.equals(other.typeTag);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(payload) + typeTag.hashCode();
    }

    @Override
    public String toString() {
        return "CachedValue[typeTag=" + typeTag + ", bytes=" + payload.length + "]";
    }
}
