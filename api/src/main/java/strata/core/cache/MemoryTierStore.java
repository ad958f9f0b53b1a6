package strata.core.cache;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BiPredicate;
import java.util.function.Predicate;

import org.jboss.logging.Logger;

import strata.core.config.MemoryTierSettings;
import strata.core.model.AdmissionResult;
import strata.core.model.CacheEntry;
import strata.core.model.CacheTier;
import strata.core.model.CachedValue;
import strata.core.model.EvictionReason;

/**
 * Bounded in-process tier with per-entry TTL and a pluggable eviction policy.
 *
 * <p>Reads are lock-free map lookups. Every mutation of the table (admission, eviction,
 * removal) happens under a single lock, so the accounted byte total and the item count never
 * exceed their budgets once {@link #set} returns.
 *
 * <p>Admission is one step: if the new entry does not fit, expired entries are purged first,
 * then the eviction policy picks victims until it fits, then the entry is stored. An entry
 * larger than the whole byte budget is rejected without evicting anything.
 */
public final class MemoryTierStore {

    private static final Logger LOG = Logger.getLogger(MemoryTierStore.class);

    /**
     * Receives entries dropped by the store itself (expiry or budget pressure).
     */
    @FunctionalInterface
    public interface EvictionListener {
        void onEviction(CacheEntry entry, EvictionReason reason);
    }

    private final Map<String, CacheEntry> entries = new ConcurrentHashMap<>();
    private final ReentrantLock lock = new ReentrantLock();
    private final AtomicLong bytesUsed = new AtomicLong();
    private final AtomicLong accessSequence = new AtomicLong();

    private final long maxBytes;
    private final int maxItems;
    private final EvictionPolicy evictionPolicy;
    private final Clock clock;
    private volatile EvictionListener evictionListener = (entry, reason) -> {};

    private ScheduledExecutorService sweepExecutor;

    public MemoryTierStore(MemoryTierSettings settings, Clock clock) {
        this(settings.maxBytes(), settings.maxItems(), EvictionPolicy.named(settings.evictionPolicy()), clock);
    }

    public MemoryTierStore(long maxBytes, int maxItems, EvictionPolicy evictionPolicy, Clock clock) {
        if (maxBytes <= 0 || maxItems <= 0) {
            throw new IllegalArgumentException("Memory tier budgets must be positive");
        }
        this.maxBytes = maxBytes;
        this.maxItems = maxItems;
        this.evictionPolicy = evictionPolicy;
        this.clock = clock;
    }

    public void setEvictionListener(EvictionListener listener) {
        this.evictionListener = listener == null ? (entry, reason) -> {} : listener;
    }

    /**
     * Look up a live entry and record the access. Expired entries are removed and reported missing.
     */
    public Optional<CacheEntry> get(String key) {
        var entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        var now = clock.instant();
        if (entry.isExpired(now)) {
            if (removeIfSame(key, entry)) {
                notifyEvicted(List.of(entry), EvictionReason.EXPIRED);
            }
            return Optional.empty();
        }
        entry.recordAccess(now, accessSequence.incrementAndGet());
        return Optional.of(entry);
    }

    /**
     * Look up a live entry without touching its access bookkeeping.
     */
    public Optional<CacheEntry> peek(String key) {
        var entry = entries.get(key);
        if (entry == null || entry.isExpired(clock.instant())) {
            return Optional.empty();
        }
        return Optional.of(entry);
    }

    /**
     * Store a value, evicting as needed.
     *
     * <p>When the value is rejected for size, any previous value under the same key is removed,
     * since it no longer reflects what the caller wrote.
     */
    public AdmissionResult set(
            String key, CachedValue value, long ttlSeconds, Set<String> tags, Set<String> dependencies) {
        return admit(key, value, ttlSeconds, tags, dependencies, false);
    }

    /**
     * Store a value only if no live entry exists for the key. Used by read-through backfill so an
     * older value read from a slower tier never replaces a newer write.
     */
    public AdmissionResult setIfAbsent(
            String key, CachedValue value, long ttlSeconds, Set<String> tags, Set<String> dependencies) {
        return admit(key, value, ttlSeconds, tags, dependencies, true);
    }

    private AdmissionResult admit(
            String key,
            CachedValue value,
            long ttlSeconds,
            Set<String> tags,
            Set<String> dependencies,
            boolean onlyIfAbsent) {
        var now = clock.instant();
        var entry = new CacheEntry(key, value, now, ttlSeconds, tags, dependencies, CacheTier.MEMORY);
        entry.recordAccess(now, accessSequence.incrementAndGet());

        List<CacheEntry> expired = List.of();
        List<CacheEntry> victims = List.of();
        lock.lock();
        try {
            if (onlyIfAbsent) {
                var existing = entries.get(key);
                if (existing != null && !existing.isExpired(now)) {
                    return AdmissionResult.ALREADY_PRESENT;
                }
            }
            if (entry.sizeBytes() > maxBytes) {
                removeLocked(key);
                LOG.debugf("Rejected %s: %d bytes exceeds memory budget of %d", key, entry.sizeBytes(), maxBytes);
                return AdmissionResult.REJECTED_TOO_LARGE;
            }

            if (!fits(key, entry)) {
                expired = purgeExpiredLocked(now);
            }
            if (!fits(key, entry)) {
                var previous = entries.get(key);
                long previousBytes = previous == null ? 0 : previous.sizeBytes();
                int previousCount = previous == null ? 0 : 1;
                long bytesToFree = bytesUsed.get() - previousBytes + entry.sizeBytes() - maxBytes;
                int entriesToFree = entries.size() - previousCount + 1 - maxItems;

                var candidates = new ArrayList<CacheEntry>(entries.size());
                for (CacheEntry candidate : entries.values()) {
                    if (!candidate.key().equals(key)) {
                        candidates.add(candidate);
                    }
                }
                victims = evictionPolicy.selectVictims(candidates, bytesToFree, entriesToFree, now);
                for (CacheEntry victim : victims) {
                    removeIfSameLocked(victim.key(), victim);
                }
            }

            var previous = entries.put(key, entry);
            bytesUsed.addAndGet(entry.sizeBytes() - (previous == null ? 0 : previous.sizeBytes()));
        } finally {
            lock.unlock();
        }

        notifyEvicted(expired, EvictionReason.EXPIRED);
        notifyEvicted(victims, evictionPolicy.reason());
        return AdmissionResult.ADMITTED;
    }

    /**
     * Remove a key.
     *
     * @return true if a live entry was present
     */
    public boolean delete(String key) {
        CacheEntry removed;
        lock.lock();
        try {
            removed = removeLocked(key);
        } finally {
            lock.unlock();
        }
        return removed != null && !removed.isExpired(clock.instant());
    }

    /**
     * Remove every entry whose key and tags satisfy the predicate.
     *
     * @return number of entries removed
     */
    public int clearByPredicate(BiPredicate<String, Set<String>> predicate) {
        return clearMatching(predicate).size();
    }

    /**
     * Remove every entry whose key and tags satisfy the predicate.
     *
     * @return keys of the removed entries
     */
    public Set<String> clearMatching(BiPredicate<String, Set<String>> predicate) {
        var removed = new HashSet<String>();
        lock.lock();
        try {
            for (CacheEntry entry : List.copyOf(entries.values())) {
                if (predicate.test(entry.key(), entry.tags()) && removeIfSameLocked(entry.key(), entry)) {
                    removed.add(entry.key());
                }
            }
        } finally {
            lock.unlock();
        }
        return removed;
    }

    public Set<String> clear() {
        return clearMatching((key, tags) -> true);
    }

    /**
     * Remove all expired entries now.
     *
     * @return number of entries removed
     */
    public int sweepExpired() {
        List<CacheEntry> expired;
        lock.lock();
        try {
            expired = purgeExpiredLocked(clock.instant());
        } finally {
            lock.unlock();
        }
        notifyEvicted(expired, EvictionReason.EXPIRED);
        if (!expired.isEmpty()) {
            LOG.debugf("Swept %d expired entries from memory tier", expired.size());
        }
        return expired.size();
    }

    /**
     * Start the periodic expiry sweep on a daemon thread.
     */
    public synchronized void startSweeper(Duration interval) {
        if (sweepExecutor != null) {
            return;
        }
        sweepExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "strata-memory-sweep");
            t.setDaemon(true);
            return t;
        });
        long millis = Math.max(1, interval.toMillis());
        sweepExecutor.scheduleAtFixedRate(this::sweepSafely, millis, millis, TimeUnit.MILLISECONDS);
    }

    /**
     * Stop the sweep, waiting briefly for a running pass to finish.
     */
    public synchronized void stopSweeper() {
        if (sweepExecutor == null) {
            return;
        }
        sweepExecutor.shutdown();
        try {
            if (!sweepExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                sweepExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            sweepExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        sweepExecutor = null;
    }

    public int size() {
        return entries.size();
    }

    public long bytesUsed() {
        return bytesUsed.get();
    }

    public long maxBytes() {
        return maxBytes;
    }

    public int maxItems() {
        return maxItems;
    }

    /**
     * Snapshot of the live entries accepted by the filter, without recording access.
     */
    public List<CacheEntry> liveEntries(Predicate<CacheEntry> filter) {
        var now = clock.instant();
        var matching = new ArrayList<CacheEntry>();
        for (CacheEntry entry : entries.values()) {
            if (!entry.isExpired(now) && filter.test(entry)) {
                matching.add(entry);
            }
        }
        return matching;
    }

    public Set<String> keys() {
        return Set.copyOf(entries.keySet());
    }

    public EvictionPolicy evictionPolicy() {
        return evictionPolicy;
    }

    private void sweepSafely() {
        try {
            sweepExpired();
        } catch (RuntimeException e) {
            LOG.warnf(e, "Memory tier sweep failed");
        }
    }

    private boolean fits(String key, CacheEntry entry) {
        var previous = entries.get(key);
        long previousBytes = previous == null ? 0 : previous.sizeBytes();
        int previousCount = previous == null ? 0 : 1;
        return bytesUsed.get() - previousBytes + entry.sizeBytes() <= maxBytes
                && entries.size() - previousCount + 1 <= maxItems;
    }

    private List<CacheEntry> purgeExpiredLocked(Instant now) {
        var expired = new ArrayList<CacheEntry>();
        for (CacheEntry entry : List.copyOf(entries.values())) {
            if (entry.isExpired(now) && removeIfSameLocked(entry.key(), entry)) {
                expired.add(entry);
            }
        }
        return expired;
    }

    private boolean removeIfSame(String key, CacheEntry expected) {
        lock.lock();
        try {
            return removeIfSameLocked(key, expected);
        } finally {
            lock.unlock();
        }
    }

    private boolean removeIfSameLocked(String key, CacheEntry expected) {
        if (entries.remove(key, expected)) {
            bytesUsed.addAndGet(-expected.sizeBytes());
            return true;
        }
        return false;
    }

    private CacheEntry removeLocked(String key) {
        var removed = entries.remove(key);
        if (removed != null) {
            bytesUsed.addAndGet(-removed.sizeBytes());
        }
        return removed;
    }

    private void notifyEvicted(List<CacheEntry> evicted, EvictionReason reason) {
        for (CacheEntry entry : evicted) {
            try {
                evictionListener.onEviction(entry, reason);
            } catch (RuntimeException e) {
                LOG.warnf(e, "Eviction listener failed for key %s", entry.key());
            }
        }
    }
}
