package strata.adapter.in.dto;

import java.util.List;
import java.util.Set;

import strata.core.model.CacheQuery;
import strata.core.model.CacheTier;

/**
 * DTO for entry queries. Every field is optional.
 *
 * @param pattern        glob over keys, e.g. {@code car:*}
 * @param tags           tags that must all be present
 * @param tier           {@code memory} or {@code remote}; both when absent
 * @param minAccessCount only entries read at least this often
 * @param maxAgeSeconds  only entries written within this many seconds
 * @param limit          maximum results, default 100
 */
public record CacheQueryRequest(
        String pattern, List<String> tags, String tier, Long minAccessCount, Long maxAgeSeconds, Integer limit) {

    /**
     * @throws IllegalArgumentException if the tier is unknown or a bound is out of range
     */
    public CacheQuery toQuery() {
        var parsedTier = tier == null || tier.isBlank() ? null : CacheTier.parse(tier);
        return new CacheQuery(
                pattern,
                tags == null ? Set.of() : Set.copyOf(tags),
                parsedTier,
                minAccessCount,
                maxAgeSeconds,
                limit == null ? CacheQuery.DEFAULT_LIMIT : limit);
    }
}
