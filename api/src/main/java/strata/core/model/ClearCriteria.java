package strata.core.model;

import java.util.Arrays;
import java.util.Set;

/**
 * Bulk removal criteria. A key is cleared when it matches the pattern (if any) and carries
 * every listed tag (if any). With neither, every key in the targeted tier(s) is cleared.
 *
 * @param tier target tier, or null for every tier
 * @param pattern glob over keys ({@code *}, {@code ?}, {@code [abc]}), or null
 * @param tags tags that must all be present on a cleared key
 */
public record ClearCriteria(CacheTier tier, String pattern, Set<String> tags) {

    public ClearCriteria {
        tags = tags == null ? Set.of() : Set.copyOf(tags);
        if (pattern != null && pattern.isBlank()) {
            pattern = null;
        }
    }

    public static ClearCriteria all() {
        return new ClearCriteria(null, null, Set.of());
    }

    public static ClearCriteria tier(CacheTier tier) {
        return new ClearCriteria(tier, null, Set.of());
    }

    public static ClearCriteria pattern(String pattern) {
        return new ClearCriteria(null, pattern, Set.of());
    }

    public static ClearCriteria tags(String... tags) {
        return new ClearCriteria(null, null, Set.copyOf(Arrays.asList(tags)));
    }

    public boolean isUnfiltered() {
        return pattern == null && tags.isEmpty();
    }

    public boolean targets(CacheTier candidate) {
        return tier == null || tier == candidate;
    }
}
