package strata.core.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

/**
 * A value held by a tier, with expiry and access bookkeeping.
 *
 * <p>Everything except the access bookkeeping is immutable. A write replaces the whole entry,
 * so {@link #sizeBytes()} is always computed from the value it describes.
 */
public final class CacheEntry {

    private final String key;
    private final CachedValue value;
    private final Instant createdAt;
    private final long ttlSeconds;
    private final long sizeBytes;
    private final Set<String> tags;
    private final Set<String> dependencies;
    private final CacheTier tier;

    private final AtomicLong accessCount = new AtomicLong();
    private volatile Instant lastAccessedAt;
    private volatile long accessSequence;

    public CacheEntry(
            String key,
            CachedValue value,
            Instant createdAt,
            long ttlSeconds,
            Set<String> tags,
            Set<String> dependencies,
            CacheTier tier) {
        if (ttlSeconds < 0) {
            throw new IllegalArgumentException("TTL must not be negative: " + ttlSeconds);
        }
        this.key = key;
        this.value = value;
        this.createdAt = createdAt;
        this.ttlSeconds = ttlSeconds;
        this.tags = tags == null ? Set.of() : Set.copyOf(tags);
        this.dependencies = dependencies == null ? Set.of() : Set.copyOf(dependencies);
        this.tier = tier;
        this.sizeBytes = estimateSize(key, value);
        this.lastAccessedAt = createdAt;
    }

    /**
     * Estimated footprint: two bytes per key character plus the serialized value.
     */
    public static long estimateSize(String key, CachedValue value) {
        return (long) key.length() * 2 + value.sizeBytes();
    }

    public String key() {
        return key;
    }

    public CachedValue value() {
        return value;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant lastAccessedAt() {
        return lastAccessedAt;
    }

    public long ttlSeconds() {
        return ttlSeconds;
    }

    public long accessCount() {
        return accessCount.get();
    }

    /**
     * Monotonic access order stamp assigned by the owning store, used for recency ordering
     * when two accesses share a timestamp.
     */
    public long accessSequence() {
        return accessSequence;
    }

    public long sizeBytes() {
        return sizeBytes;
    }

    public Set<String> tags() {
        return tags;
    }

    public Set<String> dependencies() {
        return dependencies;
    }

    public CacheTier tier() {
        return tier;
    }

    public boolean hasIndexLabels() {
        return !tags.isEmpty() || !dependencies.isEmpty();
    }

    /**
     * Expiry instant, or {@code null} when the entry never expires.
     */
    public Instant expiresAt() {
        return ttlSeconds == 0 ? null : createdAt.plusSeconds(ttlSeconds);
    }

    /**
     * An entry is expired once strictly more than {@code ttlSeconds} have elapsed since creation.
     */
    public boolean isExpired(Instant now) {
        if (ttlSeconds == 0) {
            return false;
        }
        return Duration.between(createdAt, now).compareTo(Duration.ofSeconds(ttlSeconds)) > 0;
    }

    /**
     * Whole seconds left before expiry, rounded down so a copy never outlives this entry.
     *
     * <p>Returns 0 both for entries that never expire and for entries with under a second left;
     * check {@link #expiresAt()} to tell them apart.
     */
    public long remainingTtlSeconds(Instant now) {
        if (ttlSeconds == 0) {
            return 0;
        }
        long remainingMillis = createdAt.plusSeconds(ttlSeconds).toEpochMilli() - now.toEpochMilli();
        return Math.max(0, remainingMillis / 1000);
    }

    public void recordAccess(Instant now, long sequence) {
        accessCount.incrementAndGet();
        lastAccessedAt = now;
        accessSequence = sequence;
    }

    @Override
    public String toString() {
        return "CacheEntry[key=" + key + ", tier=" + tier + ", ttl=" + ttlSeconds + "s, size=" + sizeBytes + "]";
    }
}
