package strata.core.model;

import java.time.Instant;

/**
 * A value returned by a read, together with the tier that served it.
 */
public record CacheHit(
        String key, CachedValue value, CacheTier tier, Instant createdAt, long ttlSeconds, long accessCount) {

    public static CacheHit from(CacheEntry entry, CacheTier servedFrom) {
        return new CacheHit(
                entry.key(), entry.value(), servedFrom, entry.createdAt(), entry.ttlSeconds(), entry.accessCount());
    }
}
