package strata.core.model.http;

/**
 * Response served through the response cache, with whether it came from the cache.
 */
public record ResponseCacheResult(CachedResponse response, boolean hit, String fingerprint) {

    public String cacheStatus() {
        return hit ? "HIT" : "MISS";
    }
}
