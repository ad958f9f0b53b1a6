package strata.adapter.in.dto;

import java.util.LinkedHashMap;
import java.util.Map;

import strata.core.model.CacheStatistics;
import strata.core.model.CacheTier;
import strata.core.model.EvictionReason;

/**
 * DTO for cache statistics.
 *
 * @param hitRate      hits / (hits + misses), 0 when nothing has been read
 * @param entries      entry count per tier label
 * @param evictions    memory tier evictions per reason
 * @param memory       memory tier byte accounting
 * @param indexedKeys  keys currently carrying tags or dependencies
 * @param remote       remote tier health
 * @param latency      rolling latency over recent operations
 */
public record CacheStatsResponse(
        long hits,
        long misses,
        double hitRate,
        long sets,
        long deletes,
        long errors,
        Map<String, Long> entries,
        Map<String, Long> evictions,
        MemoryUsage memory,
        int indexedKeys,
        RemoteHealthResponse remote,
        LatencySummary latency) {

    public record MemoryUsage(long bytesUsed, long bytesBudget) {}

    public record LatencySummary(double averageMs, double maxMs, int samples) {}

    public static CacheStatsResponse from(CacheStatistics stats) {
        var entries = new LinkedHashMap<String, Long>();
        for (CacheTier tier : CacheTier.lookupOrder()) {
            entries.put(tier.label(), stats.entriesByTier().getOrDefault(tier, 0L));
        }
        var evictions = new LinkedHashMap<String, Long>();
        evictions.put("total", stats.evictions());
        for (EvictionReason reason : EvictionReason.values()) {
            evictions.put(reason.name().toLowerCase(), stats.evictionsByReason().getOrDefault(reason, 0L));
        }
        return new CacheStatsResponse(
                stats.hits(),
                stats.misses(),
                stats.hitRate(),
                stats.sets(),
                stats.deletes(),
                stats.errors(),
                entries,
                evictions,
                new MemoryUsage(stats.memoryBytesUsed(), stats.memoryBytesBudget()),
                stats.indexedKeys(),
                RemoteHealthResponse.from(stats.remote()),
                new LatencySummary(
                        stats.latency().averageMs(), stats.latency().maxMs(), stats.latency().samples()));
    }
}
