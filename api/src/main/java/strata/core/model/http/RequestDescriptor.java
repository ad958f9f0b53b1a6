package strata.core.model.http;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * The parts of a request that determine its cached response.
 *
 * @param method HTTP method
 * @param path request path without query string
 * @param query query parameters; order of keys is irrelevant to the fingerprint
 * @param principal authenticated principal name, or null for anonymous requests
 */
public record RequestDescriptor(String method, String path, Map<String, List<String>> query, String principal) {

    public RequestDescriptor {
        if (method == null || method.isBlank()) {
            throw new IllegalArgumentException("Request method must not be blank");
        }
        if (path == null || path.isEmpty()) {
            throw new IllegalArgumentException("Request path must not be empty");
        }
        method = method.toUpperCase(Locale.ROOT);
        query = query == null ? Map.of() : Map.copyOf(query);
    }

    public static RequestDescriptor get(String path) {
        return new RequestDescriptor("GET", path, Map.of(), null);
    }

    public boolean isAnonymous() {
        return principal == null || principal.isBlank();
    }
}
