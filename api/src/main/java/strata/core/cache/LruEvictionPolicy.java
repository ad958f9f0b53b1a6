package strata.core.cache;

import java.time.Instant;
import java.util.Comparator;

import strata.core.model.CacheEntry;
import strata.core.model.EvictionReason;

/**
 * Least recently accessed entries go first.
 *
 * <p>Recency is the store's access sequence rather than wall-clock time, so two accesses in the
 * same millisecond still have a defined order.
 */
public class LruEvictionPolicy implements EvictionPolicy {

    private static final Comparator<CacheEntry> ORDER = Comparator.comparingLong(CacheEntry::accessSequence);

    @Override
    public EvictionReason reason() {
        return EvictionReason.LRU;
    }

    @Override
    public Comparator<CacheEntry> victimOrder(Instant now) {
        return ORDER;
    }
}
