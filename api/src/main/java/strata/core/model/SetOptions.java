package strata.core.model;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Set;

/**
 * Write options.
 *
 * @param ttlSeconds TTL in seconds, or null to use each tier's default TTL
 * @param tiers target tiers; empty means every enabled tier
 * @param tags labels for group invalidation
 * @param dependencies upstream data sources the value was derived from
 */
public record SetOptions(Long ttlSeconds, Set<CacheTier> tiers, Set<String> tags, Set<String> dependencies) {

    public SetOptions {
        tiers = tiers == null || tiers.isEmpty() ? Set.of() : Set.copyOf(tiers);
        tags = tags == null ? Set.of() : Set.copyOf(tags);
        dependencies = dependencies == null ? Set.of() : Set.copyOf(dependencies);
    }

    public static SetOptions defaults() {
        return new SetOptions(null, Set.of(), Set.of(), Set.of());
    }

    public static SetOptions ttl(long ttlSeconds) {
        return defaults().withTtl(ttlSeconds);
    }

    public SetOptions withTtl(long seconds) {
        return new SetOptions(seconds, tiers, tags, dependencies);
    }

    public SetOptions onTier(CacheTier tier) {
        return new SetOptions(ttlSeconds, EnumSet.of(tier), tags, dependencies);
    }

    public SetOptions withTags(String... values) {
        return new SetOptions(ttlSeconds, tiers, Set.copyOf(Arrays.asList(values)), dependencies);
    }

    public SetOptions withDependencies(String... values) {
        return new SetOptions(ttlSeconds, tiers, tags, Set.copyOf(Arrays.asList(values)));
    }

    public boolean allTiers() {
        return tiers.isEmpty();
    }

    public boolean targets(CacheTier tier) {
        return tiers.isEmpty() || tiers.contains(tier);
    }
}
