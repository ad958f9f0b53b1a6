package strata.core.model;

import java.util.Set;

/**
 * Entry pre-loaded into the cache at startup.
 */
public record WarmUpEntry(String key, CachedValue value, Long ttlSeconds, Set<String> tags, Set<String> dependencies) {

    public WarmUpEntry {
        tags = tags == null ? Set.of() : Set.copyOf(tags);
        dependencies = dependencies == null ? Set.of() : Set.copyOf(dependencies);
    }

    public SetOptions toSetOptions() {
        return new SetOptions(ttlSeconds, Set.of(), tags, dependencies);
    }
}
