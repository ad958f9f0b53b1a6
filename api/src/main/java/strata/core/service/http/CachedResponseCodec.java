package strata.core.service.http;

import java.io.IOException;
import java.util.Base64;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import strata.core.model.CachedValue;
import strata.core.model.http.CachedResponse;

/**
 * Converts captured responses to and from cache values.
 */
final class CachedResponseCodec {

    static final String TYPE_TAG = "application/vnd.strata.http-response+json";

    private static final ObjectMapper OBJECT_MAPPER =
            new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private CachedResponseCodec() {}

    record StoredResponse(
            @JsonProperty("status") int status,
            @JsonProperty("contentType") String contentType,
            @JsonProperty("body") String body,
            @JsonProperty("headers") Map<String, String> headers) {}

    static CachedValue encode(CachedResponse response) {
        var stored = new StoredResponse(
                response.status(),
                response.contentType(),
                Base64.getEncoder().encodeToString(response.body()),
                response.headers());
        try {
            return new CachedValue(OBJECT_MAPPER.writeValueAsBytes(stored), TYPE_TAG);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize cached response", e);
        }
    }

    /**
     * @throws IllegalArgumentException if the value does not hold a cached response
     */
    static CachedResponse decode(CachedValue value) {
        if (!TYPE_TAG.equals(value.typeTag())) {
            throw new IllegalArgumentException("Not a cached response: " + value.typeTag());
        }
        try {
            var stored = OBJECT_MAPPER.readValue(value.payload(), StoredResponse.class);
            var body = stored.body() == null ? new byte[0] : Base64.getDecoder().decode(stored.body());
            return new CachedResponse(stored.status(), stored.contentType(), body, stored.headers());
        } catch (IOException e) {
            throw new IllegalArgumentException("Malformed cached response", e);
        }
    }
}
