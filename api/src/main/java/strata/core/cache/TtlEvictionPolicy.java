package strata.core.cache;

import java.time.Instant;
import java.util.Comparator;

import strata.core.model.CacheEntry;
import strata.core.model.EvictionReason;

/**
 * Entries closest to expiry go first. Entries without a TTL are evicted last, oldest first.
 */
public class TtlEvictionPolicy implements EvictionPolicy {

    private static final Comparator<CacheEntry> ORDER = Comparator.comparing(
                    CacheEntry::expiresAt, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(CacheEntry::createdAt)
            .thenComparingLong(CacheEntry::accessSequence);

    @Override
    public EvictionReason reason() {
        return EvictionReason.TTL;
    }

    @Override
    public Comparator<CacheEntry> victimOrder(Instant now) {
        return ORDER;
    }
}
