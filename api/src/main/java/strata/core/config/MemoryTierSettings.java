package strata.core.config;

import java.time.Duration;

/**
 * Resolved memory tier settings.
 */
public record MemoryTierSettings(
        boolean enabled,
        long maxBytes,
        int maxItems,
        Duration defaultTtl,
        String evictionPolicy,
        Duration sweepInterval) {

    public MemoryTierSettings {
        if (maxBytes <= 0) {
            throw new IllegalArgumentException("Memory tier byte budget must be positive: " + maxBytes);
        }
        if (maxItems <= 0) {
            throw new IllegalArgumentException("Memory tier item budget must be positive: " + maxItems);
        }
    }

    public static MemoryTierSettings from(CacheConfig.MemoryConfig config) {
        return new MemoryTierSettings(
                config.enabled(),
                config.maxBytes(),
                config.maxItems(),
                config.defaultTtl(),
                config.evictionPolicy(),
                config.sweepInterval());
    }

    public static MemoryTierSettings defaults() {
        return new MemoryTierSettings(true, 100L * 1024 * 1024, 10_000, Duration.ofHours(1), "lru", Duration.ofMinutes(1));
    }

    public MemoryTierSettings withBudget(long bytes, int items) {
        return new MemoryTierSettings(enabled, bytes, items, defaultTtl, evictionPolicy, sweepInterval);
    }

    public MemoryTierSettings withEvictionPolicy(String policy) {
        return new MemoryTierSettings(enabled, maxBytes, maxItems, defaultTtl, policy, sweepInterval);
    }
}
