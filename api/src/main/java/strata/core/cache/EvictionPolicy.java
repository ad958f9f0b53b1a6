package strata.core.cache;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

import strata.core.model.CacheEntry;
import strata.core.model.EvictionReason;

/**
 * Strategy choosing which memory tier entries to drop when an admission would exceed the budget.
 *
 * <p>Implementations receive a snapshot of the current entry table and must not mutate it.
 */
public interface EvictionPolicy {

    /**
     * Reason recorded for entries this policy evicts.
     */
    EvictionReason reason();

    /**
     * Order in which entries become victims, first element evicted first.
     */
    Comparator<CacheEntry> victimOrder(Instant now);

    /**
     * Select victims in {@link #victimOrder(Instant)} until both targets are met or the table is exhausted.
     *
     * @param entries current entries (candidates only; the key being admitted is excluded)
     * @param bytesToFree bytes that must be released, may be zero or negative
     * @param entriesToFree entries that must be released, may be zero or negative
     * @param now current time
     * @return victims in eviction order
     */
    default List<CacheEntry> selectVictims(
            Collection<CacheEntry> entries, long bytesToFree, int entriesToFree, Instant now) {
        var ordered = new ArrayList<>(entries);
        ordered.sort(victimOrder(now));

        var victims = new ArrayList<CacheEntry>();
        long freedBytes = 0;
        for (CacheEntry candidate : ordered) {
            if (freedBytes >= bytesToFree && victims.size() >= entriesToFree) {
                break;
            }
            victims.add(candidate);
            freedBytes += candidate.sizeBytes();
        }
        return victims;
    }

    /**
     * Resolve a policy by its configuration name.
     *
     * @throws IllegalArgumentException for unknown names
     */
    static EvictionPolicy named(String name) {
        var normalized = name == null ? "lru" : name.trim().toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case "lru" -> new LruEvictionPolicy();
            case "lfu" -> new LfuEvictionPolicy();
            case "ttl" -> new TtlEvictionPolicy();
            default -> throw new IllegalArgumentException("Unknown eviction policy: " + name);
        };
    }
}
