package strata.core.service.http;

import strata.core.model.http.CachedResponse;
import strata.core.model.http.RequestDescriptor;

/**
 * Decides which requests may be answered from the cache and which responses may be stored.
 */
public interface ResponseCachePolicy {

    boolean isCacheableRequest(RequestDescriptor request);

    boolean isCacheableResponse(RequestDescriptor request, CachedResponse response);

    /**
     * GET requests with a 2xx response.
     */
    static ResponseCachePolicy defaults() {
        return new ResponseCachePolicy() {
            @Override
            public boolean isCacheableRequest(RequestDescriptor request) {
                return "GET".equals(request.method());
            }

            @Override
            public boolean isCacheableResponse(RequestDescriptor request, CachedResponse response) {
                return isCacheableRequest(request) && response.isSuccessful();
            }
        };
    }
}
