package strata.core.model;

import java.util.Map;

/**
 * Point-in-time snapshot of engine counters. Building one never touches a tier over the network.
 */
public record CacheStatistics(
        long hits,
        long misses,
        double hitRate,
        long sets,
        long deletes,
        long errors,
        long evictions,
        Map<EvictionReason, Long> evictionsByReason,
        Map<CacheTier, Long> entriesByTier,
        long memoryBytesUsed,
        long memoryBytesBudget,
        int indexedKeys,
        RemoteHealthStatus remote,
        Latency latency) {

    public CacheStatistics {
        evictionsByReason = Map.copyOf(evictionsByReason);
        entriesByTier = Map.copyOf(entriesByTier);
    }

    /**
     * Rolling latency over the most recent operations.
     */
    public record Latency(double averageMs, double maxMs, int samples) {
        public static Latency empty() {
            return new Latency(0, 0, 0);
        }
    }
}
