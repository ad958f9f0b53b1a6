package strata.core.model.http;

import java.util.Arrays;
import java.util.Map;
import java.util.Objects;

/**
 * Captured response body with the metadata needed to replay it.
 */
public record CachedResponse(int status, String contentType, byte[] body, Map<String, String> headers) {

    public CachedResponse {
        if (body == null) {
            body = new byte[0];
        }
        headers = headers == null ? Map.of() : Map.copyOf(headers);
    }

    public boolean isSuccessful() {
        return status >= 200 && status < 300;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CachedResponse other)) {
            return false;
        }
        return status == other.status
                && Objects.equals(contentType, other.contentType)
                && Arrays.equals(body, other.body)
                && headers.equals(other.headers);
    }

    @Override
    public int hashCode() {
        return Objects.hash(status, contentType, headers) * 31 + Arrays.hashCode(body);
    }
}
