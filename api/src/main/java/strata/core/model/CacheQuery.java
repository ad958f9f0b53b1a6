package strata.core.model;

import java.util.Set;

/**
 * Filter over live cache entries, used by administrators to inspect what the tiers hold.
 *
 * <p>Every criterion is optional. The persistent tier is not enumerable and never contributes
 * results. Access counts are only tracked by the memory tier; remote entries report zero.
 *
 * @param pattern glob over keys, or null for every key
 * @param tags tags that must all be present
 * @param tier tier to search, or null for memory and remote
 * @param minAccessCount minimum recorded accesses, or null
 * @param maxAgeSeconds maximum seconds since the entry was written, or null
 * @param limit maximum number of results
 */
public record CacheQuery(
        String pattern, Set<String> tags, CacheTier tier, Long minAccessCount, Long maxAgeSeconds, int limit) {

    public static final int DEFAULT_LIMIT = 100;
    public static final int MAX_LIMIT = 1_000;

    public CacheQuery {
        tags = tags == null ? Set.of() : Set.copyOf(tags);
        if (pattern != null && pattern.isBlank()) {
            pattern = null;
        }
        if (limit <= 0 || limit > MAX_LIMIT) {
            throw new IllegalArgumentException("Query limit must be between 1 and " + MAX_LIMIT + ": " + limit);
        }
        if (minAccessCount != null && minAccessCount < 0) {
            throw new IllegalArgumentException("Minimum access count must not be negative");
        }
        if (maxAgeSeconds != null && maxAgeSeconds < 0) {
            throw new IllegalArgumentException("Maximum age must not be negative");
        }
    }

    public static CacheQuery all() {
        return new CacheQuery(null, Set.of(), null, null, null, DEFAULT_LIMIT);
    }

    public static CacheQuery pattern(String pattern) {
        return new CacheQuery(pattern, Set.of(), null, null, null, DEFAULT_LIMIT);
    }

    public boolean targets(CacheTier candidate) {
        return tier == null || tier == candidate;
    }
}
