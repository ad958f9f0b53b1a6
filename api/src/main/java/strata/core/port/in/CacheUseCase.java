package strata.core.port.in;

import java.util.List;
import java.util.Optional;

import io.smallrye.mutiny.Uni;

import strata.core.model.CacheEntry;
import strata.core.model.CacheHit;
import strata.core.model.CacheQuery;
import strata.core.model.CacheRecommendation;
import strata.core.model.CacheStatistics;
import strata.core.model.CacheTier;
import strata.core.model.CachedValue;
import strata.core.model.ClearCriteria;
import strata.core.model.GetOptions;
import strata.core.model.RemoteHealthStatus;
import strata.core.model.SetOptions;
import strata.core.model.SetResult;
import strata.core.model.WarmUpEntry;

/**
 * Inbound port for the multi-tier cache.
 *
 * <p>Transient tier failures never surface as failed {@link Uni}s: reads degrade to misses and
 * writes report the tiers that failed. Invalid arguments are rejected with
 * {@link IllegalArgumentException} before any tier is touched.
 */
public interface CacheUseCase {

    /**
     * Read a value, consulting the preferred tier first and then memory, remote, persistent.
     *
     * @return the hit, or empty if no tier holds a live value
     */
    Uni<Optional<CacheHit>> get(String key, GetOptions options);

    default Uni<Optional<CacheHit>> get(String key) {
        return get(key, GetOptions.defaults());
    }

    /**
     * Write a value to the requested tiers.
     *
     * @return outcome; {@link SetResult#stored()} is true if at least one tier accepted it
     */
    Uni<SetResult> set(String key, CachedValue value, SetOptions options);

    /**
     * Remove a key from one tier, or from every tier when {@code tier} is null.
     *
     * @return true if a live copy was present in any targeted tier
     */
    Uni<Boolean> delete(String key, CacheTier tier);

    default Uni<Boolean> delete(String key) {
        return delete(key, null);
    }

    /**
     * Remove every key matching the criteria.
     *
     * @return number of distinct keys removed
     */
    Uni<Integer> clear(ClearCriteria criteria);

    /**
     * Remove every entry derived from any of the given dependencies, from every tier.
     *
     * @return number of keys invalidated
     */
    Uni<Integer> invalidateByDependencies(List<String> dependencies);

    /**
     * Counter snapshot. Never performs tier I/O.
     */
    CacheStatistics getMetrics();

    RemoteHealthStatus remoteHealth();

    /**
     * Tuning advice derived from {@link #getMetrics()}; empty when nothing stands out.
     */
    List<CacheRecommendation> recommendations();

    /**
     * List live entries matching the query, ordered by key then tier. A key held by several
     * tiers appears once per tier. Reading entries this way does not count as an access.
     */
    Uni<List<CacheEntry>> query(CacheQuery query);

    /**
     * Pre-load entries. Failed entries are counted and logged, never fatal.
     *
     * @return number of entries stored in at least one tier
     */
    Uni<Integer> warmUp(List<WarmUpEntry> entries);
}
