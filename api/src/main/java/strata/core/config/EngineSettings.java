package strata.core.config;

import java.time.Duration;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

import strata.core.model.CacheTier;

/**
 * Resolved settings for the cache engine and its tiers.
 *
 * @param defaultWriteTiers tiers written when a write names none; empty means every enabled tier
 */
public record EngineSettings(
        MemoryTierSettings memory,
        RemoteTierSettings remote,
        boolean readThrough,
        Set<CacheTier> defaultWriteTiers,
        Duration drainTimeout) {

    public EngineSettings {
        defaultWriteTiers = defaultWriteTiers == null ? Set.of() : Set.copyOf(defaultWriteTiers);
    }

    public static EngineSettings from(CacheConfig config) {
        return new EngineSettings(
                MemoryTierSettings.from(config.memory()),
                RemoteTierSettings.from(config.remote()),
                config.readThrough(),
                parseTiers(config.defaultTier()),
                config.shutdown().drainTimeout());
    }

    public static EngineSettings defaults() {
        return new EngineSettings(
                MemoryTierSettings.defaults(), RemoteTierSettings.defaults(), true, Set.of(), Duration.ofSeconds(5));
    }

    public EngineSettings withMemory(MemoryTierSettings value) {
        return new EngineSettings(value, remote, readThrough, defaultWriteTiers, drainTimeout);
    }

    public EngineSettings withRemote(RemoteTierSettings value) {
        return new EngineSettings(memory, value, readThrough, defaultWriteTiers, drainTimeout);
    }

    public EngineSettings withReadThrough(boolean value) {
        return new EngineSettings(memory, remote, value, defaultWriteTiers, drainTimeout);
    }

    static Set<CacheTier> parseTiers(String value) {
        if (value == null || value.isBlank() || "all".equals(value.trim().toLowerCase(Locale.ROOT))) {
            return Set.of();
        }
        var tiers = EnumSet.noneOf(CacheTier.class);
        for (String name : value.split(",")) {
            tiers.add(CacheTier.parse(name));
        }
        return tiers;
    }
}
