package strata.adapter.in.dto;

import java.util.List;
import java.util.Set;

import strata.core.model.CacheTier;
import strata.core.model.ClearCriteria;

/**
 * DTO for bulk clear requests. Every field is optional; an empty body clears every tier.
 *
 * @param tier    tier to clear ({@code memory}, {@code remote} or {@code persistent}); all tiers when absent
 * @param pattern glob over keys, e.g. {@code car:*}
 * @param tags    tags that must all be present on a cleared key
 */
public record ClearCacheRequest(String tier, String pattern, List<String> tags) {

    /**
     * @throws IllegalArgumentException if the tier name is unknown
     */
    public ClearCriteria toCriteria() {
        var parsedTier = tier == null || tier.isBlank() ? null : CacheTier.parse(tier);
        return new ClearCriteria(parsedTier, pattern, tags == null ? Set.of() : Set.copyOf(tags));
    }
}
