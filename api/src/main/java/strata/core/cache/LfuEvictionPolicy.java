package strata.core.cache;

import java.time.Instant;
import java.util.Comparator;

import strata.core.model.CacheEntry;
import strata.core.model.EvictionReason;

/**
 * Least frequently accessed entries go first; ties fall back to recency.
 */
public class LfuEvictionPolicy implements EvictionPolicy {

    private static final Comparator<CacheEntry> ORDER = Comparator.comparingLong(CacheEntry::accessCount)
            .thenComparing(CacheEntry::lastAccessedAt)
            .thenComparingLong(CacheEntry::accessSequence);

    @Override
    public EvictionReason reason() {
        return EvictionReason.LFU;
    }

    @Override
    public Comparator<CacheEntry> victimOrder(Instant now) {
        return ORDER;
    }
}
