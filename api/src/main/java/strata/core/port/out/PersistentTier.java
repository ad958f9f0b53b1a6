package strata.core.port.out;

import java.util.Optional;
import java.util.Set;

import io.smallrye.mutiny.Uni;

import strata.core.model.CacheEntry;
import strata.core.model.CachedValue;

/**
 * Port for a durable tier consulted after memory and remote.
 *
 * <p>No durable backend ships with the engine; {@link #none()} reports every lookup as a miss
 * and every write as not stored.
 */
public interface PersistentTier {

    boolean isEnabled();

    Uni<Optional<CacheEntry>> get(String key);

    Uni<Boolean> set(String key, CachedValue value, long ttlSeconds, Set<String> tags, Set<String> dependencies);

    Uni<Boolean> delete(String key);

    static PersistentTier none() {
        return NoPersistentTier.INSTANCE;
    }

    final class NoPersistentTier implements PersistentTier {

        static final NoPersistentTier INSTANCE = new NoPersistentTier();

        private NoPersistentTier() {}

        @Override
        public boolean isEnabled() {
            return false;
        }

        @Override
        public Uni<Optional<CacheEntry>> get(String key) {
            return Uni.createFrom().item(Optional.empty());
        }

        @Override
        public Uni<Boolean> set(
                String key, CachedValue value, long ttlSeconds, Set<String> tags, Set<String> dependencies) {
            return Uni.createFrom().item(false);
        }

        @Override
        public Uni<Boolean> delete(String key) {
            return Uni.createFrom().item(false);
        }
    }
}
