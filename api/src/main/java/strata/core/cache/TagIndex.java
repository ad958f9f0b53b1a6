package strata.core.cache;

import java.util.Collection;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BooleanSupplier;

import strata.core.model.CacheTier;

/**
 * Secondary index from tags and dependencies to the keys carrying them.
 *
 * <p>The index also tracks which tiers hold a labelled copy of each key, so a key leaves the
 * index exactly when its last labelled copy leaves the last tier.
 *
 * <p>Dependency invalidation is guarded by per-dependency epochs. A writer takes a
 * {@link IndexStamp} before writing to a tier and records the key with that stamp afterwards;
 * if any of its dependencies was invalidated in between, {@link #record} refuses the key and
 * the writer must remove what it wrote. All mutation happens under one lock.
 */
public final class TagIndex {

    /**
     * Dependency epochs observed before a tier write.
     */
    public record IndexStamp(Map<String, Long> epochs) {

        public static final IndexStamp NONE = new IndexStamp(Map.of());

        public IndexStamp {
            epochs = Map.copyOf(epochs);
        }
    }

    private record IndexedKey(Set<String> tags, Set<String> dependencies, Set<CacheTier> tiers) {}

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, Set<String>> keysByTag = new HashMap<>();
    private final Map<String, Set<String>> keysByDependency = new HashMap<>();
    private final Map<String, IndexedKey> byKey = new HashMap<>();
    private final Map<String, Long> dependencyEpochs = new HashMap<>();

    /**
     * Capture the current epoch of each dependency.
     */
    public IndexStamp stamp(Collection<String> dependencies) {
        if (dependencies.isEmpty()) {
            return IndexStamp.NONE;
        }
        lock.lock();
        try {
            var epochs = new HashMap<String, Long>();
            for (String dependency : dependencies) {
                epochs.put(dependency, dependencyEpochs.getOrDefault(dependency, 0L));
            }
            return new IndexStamp(epochs);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Whether no dependency in the stamp has been invalidated since it was taken.
     */
    public boolean isCurrent(IndexStamp stamp) {
        lock.lock();
        try {
            return isCurrentLocked(stamp);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Record that {@code tiers} now hold {@code key} with the given labels.
     *
     * <p>Labels replace any previously recorded for the key. Recording an unlabelled write
     * removes those tiers from the key's entry instead.
     *
     * @return false if a dependency in {@code stamp} was invalidated after the stamp was taken;
     *     the key is then not recorded
     */
    public boolean record(
            String key, Set<CacheTier> tiers, Set<String> tags, Set<String> dependencies, IndexStamp stamp) {
        lock.lock();
        try {
            if (!isCurrentLocked(stamp)) {
                return false;
            }
            if (tiers.isEmpty()) {
                return true;
            }
            if (tags.isEmpty() && dependencies.isEmpty()) {
                for (CacheTier tier : tiers) {
                    removeTierLocked(key, tier);
                }
                return true;
            }

            var existing = byKey.get(key);
            var heldBy = existing == null ? EnumSet.noneOf(CacheTier.class) : EnumSet.copyOf(existing.tiers());
            heldBy.addAll(tiers);
            if (existing != null) {
                unlinkLocked(key, existing);
            }
            var indexed = new IndexedKey(Set.copyOf(tags), Set.copyOf(dependencies), heldBy);
            byKey.put(key, indexed);
            for (String tag : indexed.tags()) {
                keysByTag.computeIfAbsent(tag, t -> new HashSet<>()).add(key);
            }
            for (String dependency : indexed.dependencies()) {
                keysByDependency.computeIfAbsent(dependency, d -> new HashSet<>()).add(key);
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * The given tier no longer holds the key. The key leaves the index when no tier holds it.
     */
    public void removeTier(String key, CacheTier tier) {
        lock.lock();
        try {
            removeTierLocked(key, tier);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Like {@link #removeTier}, but keeps the tier when {@code stillHeld} reports a newer copy.
     *
     * <p>The check runs under the index lock, so a writer recording a fresh copy of the key either
     * lands before the check and is observed, or after it and re-adds the tier.
     */
    public void removeTierUnless(String key, CacheTier tier, BooleanSupplier stillHeld) {
        lock.lock();
        try {
            if (!stillHeld.getAsBoolean()) {
                removeTierLocked(key, tier);
            }
        } finally {
            lock.unlock();
        }
    }

    public void removeKey(String key) {
        lock.lock();
        try {
            var existing = byKey.remove(key);
            if (existing != null) {
                unlinkLocked(key, existing);
            }
        } finally {
            lock.unlock();
        }
    }

    public Set<String> keysForTag(String tag) {
        lock.lock();
        try {
            return Set.copyOf(keysByTag.getOrDefault(tag, Set.of()));
        } finally {
            lock.unlock();
        }
    }

    public Set<String> keysForDependency(String dependency) {
        lock.lock();
        try {
            return Set.copyOf(keysByDependency.getOrDefault(dependency, Set.of()));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Keys carrying every one of the given tags.
     */
    public Set<String> keysWithAllTags(Collection<String> tags) {
        if (tags.isEmpty()) {
            return Set.of();
        }
        lock.lock();
        try {
            Set<String> result = null;
            for (String tag : tags) {
                var keys = keysByTag.getOrDefault(tag, Set.of());
                if (result == null) {
                    result = new HashSet<>(keys);
                } else {
                    result.retainAll(keys);
                }
                if (result.isEmpty()) {
                    break;
                }
            }
            return Set.copyOf(result);
        } finally {
            lock.unlock();
        }
    }

    public Set<String> tagsOf(String key) {
        lock.lock();
        try {
            var indexed = byKey.get(key);
            return indexed == null ? Set.of() : indexed.tags();
        } finally {
            lock.unlock();
        }
    }

    public Set<CacheTier> tiersOf(String key) {
        lock.lock();
        try {
            var indexed = byKey.get(key);
            return indexed == null ? Set.of() : Set.copyOf(indexed.tiers());
        } finally {
            lock.unlock();
        }
    }

    public boolean contains(String key) {
        lock.lock();
        try {
            return byKey.containsKey(key);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Advance the epoch of each dependency and detach every key that carries one of them.
     *
     * <p>Writers holding an older stamp for any of these dependencies will fail to record.
     *
     * @return keys that carried at least one of the dependencies
     */
    public Set<String> invalidateDependencies(Collection<String> dependencies) {
        lock.lock();
        try {
            var affected = new HashSet<String>();
            for (String dependency : dependencies) {
                dependencyEpochs.merge(dependency, 1L, Long::sum);
                affected.addAll(keysByDependency.getOrDefault(dependency, Set.of()));
            }
            for (String key : affected) {
                var existing = byKey.remove(key);
                if (existing != null) {
                    unlinkLocked(key, existing);
                }
            }
            return affected;
        } finally {
            lock.unlock();
        }
    }

    public void clear() {
        lock.lock();
        try {
            byKey.clear();
            keysByTag.clear();
            keysByDependency.clear();
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return byKey.size();
        } finally {
            lock.unlock();
        }
    }

    private boolean isCurrentLocked(IndexStamp stamp) {
        for (var observed : stamp.epochs().entrySet()) {
            if (dependencyEpochs.getOrDefault(observed.getKey(), 0L) > observed.getValue()) {
                return false;
            }
        }
        return true;
    }

    private void removeTierLocked(String key, CacheTier tier) {
        var existing = byKey.get(key);
        if (existing == null) {
            return;
        }
        existing.tiers().remove(tier);
        if (existing.tiers().isEmpty()) {
            byKey.remove(key);
            unlinkLocked(key, existing);
        }
    }

    private void unlinkLocked(String key, IndexedKey indexed) {
        for (String tag : indexed.tags()) {
            removeFromBucket(keysByTag, tag, key);
        }
        for (String dependency : indexed.dependencies()) {
            removeFromBucket(keysByDependency, dependency, key);
        }
    }

    private static void removeFromBucket(Map<String, Set<String>> buckets, String label, String key) {
        var keys = buckets.get(label);
        if (keys != null) {
            keys.remove(key);
            if (keys.isEmpty()) {
                buckets.remove(label);
            }
        }
    }
}
