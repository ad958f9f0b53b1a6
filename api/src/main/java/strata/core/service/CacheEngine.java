package strata.core.service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import strata.core.cache.LatencyWindow;
import strata.core.cache.MemoryTierStore;
import strata.core.cache.TagIndex;
import strata.core.config.EngineSettings;
import strata.core.model.AdmissionResult;
import strata.core.model.CacheEntry;
import strata.core.model.CacheHit;
import strata.core.model.CacheQuery;
import strata.core.model.CacheRecommendation;
import strata.core.model.CacheStatistics;
import strata.core.model.CacheTier;
import strata.core.model.CachedValue;
import strata.core.model.ClearCriteria;
import strata.core.model.EvictionReason;
import strata.core.model.GetOptions;
import strata.core.model.RemoteHealthStatus;
import strata.core.model.SetOptions;
import strata.core.model.SetResult;
import strata.core.model.WarmUpEntry;
import strata.core.port.in.CacheUseCase;
import strata.core.port.out.CacheEventPublisher;
import strata.core.port.out.CacheMetrics;
import strata.core.port.out.PersistentTier;
import strata.core.port.out.RemoteStoreConnector;
import strata.core.service.remote.RemoteTierClient;
import strata.spi.CacheEvent;

/**
 * Orchestrates the memory, remote and persistent tiers.
 *
 * <p>Reads walk the tiers fastest first (or the preferred tier first) and stop at the first
 * live value. A hit in a slower tier is copied into the faster tiers in the background with
 * its remaining TTL; those copies are tracked so shutdown can drain them.
 *
 * <p>Writes fan out to the requested tiers and succeed if any tier accepted the value.
 * Dependencies are guarded against concurrent invalidation: the engine stamps the dependency
 * epochs before writing and, if an invalidation raced the write, removes what it wrote.
 *
 * <p>The engine fails open. Remote tier failures become misses or degraded writes and are
 * reported through events and metrics; only invalid arguments throw.
 */
public class CacheEngine implements CacheUseCase {

    private static final Logger LOG = Logger.getLogger(CacheEngine.class);

    private final EngineSettings settings;
    private final MemoryTierStore memory;
    private final RemoteTierClient remote;
    private final PersistentTier persistent;
    private final TagIndex index = new TagIndex();
    private final KeyPatternMatcher patternMatcher = new KeyPatternMatcher();
    private final CacheAdvisor advisor = new CacheAdvisor();
    private final CacheMetrics metrics;
    private final CacheEventPublisher events;
    private final Clock clock;

    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong sets = new AtomicLong();
    private final AtomicLong deletes = new AtomicLong();
    private final AtomicLong errors = new AtomicLong();
    private final Map<EvictionReason, AtomicLong> evictions = new EnumMap<>(EvictionReason.class);
    private final LatencyWindow latency = new LatencyWindow();

    private final ExecutorService backfillExecutor;
    private final Set<CompletableFuture<?>> pendingBackfills = ConcurrentHashMap.newKeySet();

    private volatile boolean started;
    private volatile boolean closed;

    /**
     * @param memory memory tier, or null when disabled
     * @param connector remote store connector, or null when the remote tier is disabled
     * @param persistent persistent tier; use {@link PersistentTier#none()} when absent
     */
    public CacheEngine(
            EngineSettings settings,
            MemoryTierStore memory,
            RemoteStoreConnector connector,
            PersistentTier persistent,
            CacheMetrics metrics,
            CacheEventPublisher events,
            Clock clock) {
        this.settings = settings;
        this.memory = memory;
        this.persistent = persistent == null ? PersistentTier.none() : persistent;
        this.metrics = metrics == null ? CacheMetrics.noop() : metrics;
        this.events = events == null ? CacheEventPublisher.noop() : events;
        this.clock = clock;
        this.remote = connector != null && settings.remote().enabled()
                ? new RemoteTierClient(connector, settings.remote(), this.metrics, this::onRemoteEvent, clock)
                : null;
        for (EvictionReason reason : EvictionReason.values()) {
            evictions.put(reason, new AtomicLong());
        }
        if (memory != null) {
            memory.setEvictionListener(this::onMemoryEviction);
        }
        this.backfillExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "strata-backfill");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Start background work: the memory sweep and the remote connection with its health monitor.
     * An unreachable remote tier does not fail startup.
     */
    public synchronized void start() {
        if (started) {
            return;
        }
        if (memory != null) {
            memory.startSweeper(settings.memory().sweepInterval());
        }
        if (remote != null) {
            remote.start();
        }
        started = true;
        LOG.infof("Cache engine started with tiers %s", enabledTiers());
    }

    /**
     * Stop accepting operations, drain pending backfills, stop background tasks and release the
     * remote connection once in-flight calls finish or time out.
     */
    public synchronized void shutdown(Duration drainTimeout) {
        if (closed) {
            return;
        }
        closed = true;
        drainBackfills(drainTimeout);
        backfillExecutor.shutdown();
        if (memory != null) {
            memory.stopSweeper();
        }
        if (remote != null) {
            remote.shutdown(drainTimeout);
        }
        LOG.info("Cache engine stopped");
    }

    public void shutdown() {
        shutdown(settings.drainTimeout());
    }

    @Override
    public Uni<Optional<CacheHit>> get(String key, GetOptions options) {
        requireKey(key);
        ensureOpen();
        var effective = options == null ? GetOptions.defaults() : options;
        long start = System.nanoTime();
        var order = lookupOrder(effective.preferredTier());
        return lookup(key, order, 0).map(found -> {
            recordLatency("get", start);
            if (found.isEmpty()) {
                misses.incrementAndGet();
                metrics.recordMiss();
                events.publish(new CacheEvent.Miss(clock.instant(), key));
                return Optional.<CacheHit>empty();
            }
            var served = found.get();
            hits.incrementAndGet();
            metrics.recordHit(served.tier());
            events.publish(new CacheEvent.Hit(clock.instant(), key, served.tier()));
            if (settings.readThrough() && effective.backfill()) {
                scheduleBackfill(served.entry(), served.tier());
            }
            return Optional.of(CacheHit.from(served.entry(), served.tier()));
        });
    }

    @Override
    public Uni<SetResult> set(String key, CachedValue value, SetOptions options) {
        requireKey(key);
        if (value == null) {
            throw new IllegalArgumentException("Cache value must not be null");
        }
        var effective = options == null ? SetOptions.defaults() : options;
        if (effective.ttlSeconds() != null && effective.ttlSeconds() < 0) {
            throw new IllegalArgumentException("TTL must not be negative: " + effective.ttlSeconds());
        }
        ensureOpen();

        long start = System.nanoTime();
        var requested = effective.allTiers() ? settings.defaultWriteTiers() : effective.tiers();
        var targets = requested.isEmpty() ? enabledTiers() : requested;
        return write(key, value, effective, targets, false).invoke(result -> {
            recordLatency("set", start);
            if (result.stored()) {
                sets.incrementAndGet();
                events.publish(new CacheEvent.Set(clock.instant(), key, result.storedTiers()));
            }
            if (result.degraded()) {
                LOG.warnf(
                        "Cache write for %s degraded: stored in %s, failed in %s",
                        key, result.storedTiers(), result.failedTiers());
            } else if (!result.stored()) {
                LOG.debugf("Cache write for %s not stored (failed tiers: %s)", key, result.failedTiers());
            }
        });
    }

    @Override
    public Uni<Boolean> delete(String key, CacheTier tier) {
        requireKey(key);
        ensureOpen();
        long start = System.nanoTime();
        var targets = tier == null ? enabledTiers() : EnumSet.of(tier);
        return deleteFromTiers(key, targets).invoke(removedFrom -> {
            recordLatency("delete", start);
            if (!removedFrom.isEmpty()) {
                deletes.incrementAndGet();
                events.publish(new CacheEvent.Delete(clock.instant(), key, removedFrom));
            }
        }).map(removedFrom -> !removedFrom.isEmpty());
    }

    @Override
    public Uni<Integer> clear(ClearCriteria criteria) {
        if (criteria == null) {
            throw new IllegalArgumentException("Clear criteria must not be null");
        }
        ensureOpen();
        long start = System.nanoTime();
        var cleared = ConcurrentHashMap.<String>newKeySet();

        if (memory != null && criteria.targets(CacheTier.MEMORY)) {
            var removed = memory.clearMatching((key, tags) -> matches(criteria, key, tags));
            for (String key : removed) {
                releaseMemoryIndex(key);
            }
            cleared.addAll(removed);
        }

        Uni<List<String>> remoteCleared = remote != null && criteria.targets(CacheTier.REMOTE)
                ? clearRemote(criteria)
                : Uni.createFrom().item(List.of());

        return remoteCleared.map(removed -> {
            for (String key : removed) {
                index.removeTier(key, CacheTier.REMOTE);
            }
            cleared.addAll(removed);
            recordLatency("clear", start);
            LOG.infof("Cleared %d key(s) (tier=%s, pattern=%s, tags=%s)",
                    cleared.size(), criteria.tier(), criteria.pattern(), criteria.tags());
            return cleared.size();
        });
    }

    @Override
    public Uni<Integer> invalidateByDependencies(List<String> dependencies) {
        if (dependencies == null) {
            throw new IllegalArgumentException("Dependencies must not be null");
        }
        ensureOpen();
        if (dependencies.isEmpty()) {
            return Uni.createFrom().item(0);
        }
        long start = System.nanoTime();
        var wanted = new HashSet<>(dependencies);
        var affected = ConcurrentHashMap.<String>newKeySet();
        affected.addAll(index.invalidateDependencies(wanted));
        // entries written by another node or before a restart carry their labels but are not indexed
        if (memory != null) {
            for (CacheEntry entry : memory.liveEntries(e -> carriesAny(e.dependencies(), wanted))) {
                affected.add(entry.key());
            }
        }
        Uni<List<CacheEntry>> remoteLabelled = remote != null
                ? remote.entries("*")
                : Uni.createFrom().item(List.of());

        return remoteLabelled.flatMap(found -> {
            for (CacheEntry entry : found) {
                if (carriesAny(entry.dependencies(), wanted)) {
                    affected.add(entry.key());
                }
            }
            var removals = new ArrayList<Uni<Boolean>>();
            for (String key : affected) {
                if (memory != null) {
                    memory.delete(key);
                    releaseMemoryIndex(key);
                }
                if (remote != null) {
                    removals.add(remote.delete(key));
                }
                if (persistent.isEnabled()) {
                    removals.add(persistent.delete(key).onFailure().recoverWithItem(false));
                }
            }
            return joinAll(removals);
        }).map(ignored -> {
            recordLatency("invalidate", start);
            if (!affected.isEmpty()) {
                LOG.infof("Invalidated %d key(s) for dependencies %s", affected.size(), dependencies);
            }
            return affected.size();
        });
    }

    @Override
    public CacheStatistics getMetrics() {
        long hitCount = hits.get();
        long missCount = misses.get();
        long total = hitCount + missCount;

        var byReason = new EnumMap<EvictionReason, Long>(EvictionReason.class);
        long evictionTotal = 0;
        for (var entry : evictions.entrySet()) {
            long count = entry.getValue().get();
            byReason.put(entry.getKey(), count);
            evictionTotal += count;
        }

        var byTier = new EnumMap<CacheTier, Long>(CacheTier.class);
        byTier.put(CacheTier.MEMORY, memory == null ? 0L : memory.size());
        byTier.put(CacheTier.REMOTE, remote == null ? 0L : remote.entryCount());
        byTier.put(CacheTier.PERSISTENT, 0L);

        return new CacheStatistics(
                hitCount,
                missCount,
                total == 0 ? 0.0 : (double) hitCount / total,
                sets.get(),
                deletes.get(),
                errors.get(),
                evictionTotal,
                byReason,
                byTier,
                memory == null ? 0 : memory.bytesUsed(),
                memory == null ? 0 : memory.maxBytes(),
                index.size(),
                remoteHealth(),
                latency.snapshot());
    }

    @Override
    public RemoteHealthStatus remoteHealth() {
        return remote == null ? RemoteHealthStatus.disabled() : remote.status();
    }

    @Override
    public List<CacheRecommendation> recommendations() {
        return advisor.advise(getMetrics());
    }

    @Override
    public Uni<List<CacheEntry>> query(CacheQuery query) {
        if (query == null) {
            throw new IllegalArgumentException("Cache query must not be null");
        }
        ensureOpen();
        var now = clock.instant();
        var found = new ArrayList<CacheEntry>();
        if (memory != null && query.targets(CacheTier.MEMORY)) {
            found.addAll(memory.liveEntries(entry -> matches(query, entry, now)));
        }
        Uni<List<CacheEntry>> remoteFound = remote != null && query.targets(CacheTier.REMOTE)
                ? remote.entries(query.pattern() == null ? "*" : query.pattern())
                : Uni.createFrom().item(List.of());

        return remoteFound.map(remoteEntries -> {
            for (CacheEntry entry : remoteEntries) {
                if (matches(query, entry, now)) {
                    found.add(entry);
                }
            }
            return found.stream()
                    .sorted(Comparator.comparing(CacheEntry::key).thenComparing(CacheEntry::tier))
                    .limit(query.limit())
                    .toList();
        });
    }

    @Override
    public Uni<Integer> warmUp(List<WarmUpEntry> entries) {
        if (entries == null || entries.isEmpty()) {
            return Uni.createFrom().item(0);
        }
        ensureOpen();
        var loaded = new AtomicInteger();
        var failed = new AtomicInteger();
        Uni<Void> chain = Uni.createFrom().voidItem();
        for (WarmUpEntry entry : entries) {
            chain = chain.flatMap(ignored -> warmUpOne(entry).map(stored -> {
                if (stored) {
                    loaded.incrementAndGet();
                } else {
                    failed.incrementAndGet();
                }
                return null;
            }));
        }
        return chain.map(ignored -> {
            if (failed.get() > 0) {
                LOG.warnf("Warm-up loaded %d of %d entries (%d failed)", loaded.get(), entries.size(), failed.get());
            } else {
                LOG.infof("Warm-up loaded %d entries", loaded.get());
            }
            return loaded.get();
        });
    }

    /**
     * Tiers enabled in this engine, fastest first.
     */
    public Set<CacheTier> enabledTiers() {
        var tiers = EnumSet.noneOf(CacheTier.class);
        if (memory != null) {
            tiers.add(CacheTier.MEMORY);
        }
        if (remote != null) {
            tiers.add(CacheTier.REMOTE);
        }
        if (persistent.isEnabled()) {
            tiers.add(CacheTier.PERSISTENT);
        }
        return tiers;
    }

    /**
     * Remote tier client, or null when the remote tier is disabled.
     */
    public RemoteTierClient remoteClient() {
        return remote;
    }

    public int pendingBackfills() {
        return pendingBackfills.size();
    }

    public boolean isRunning() {
        return started && !closed;
    }

    private record Served(CacheEntry entry, CacheTier tier) {}

    private Uni<Optional<Served>> lookup(String key, List<CacheTier> order, int position) {
        if (position >= order.size()) {
            return Uni.createFrom().item(Optional.empty());
        }
        var tier = order.get(position);
        return readTier(tier, key).flatMap(found -> found.isPresent()
                ? Uni.createFrom().item(Optional.of(new Served(found.get(), tier)))
                : lookup(key, order, position + 1));
    }

    private Uni<Optional<CacheEntry>> readTier(CacheTier tier, String key) {
        return switch (tier) {
            case MEMORY -> Uni.createFrom().item(memory.get(key));
            case REMOTE -> remote.get(key);
            case PERSISTENT -> persistent.get(key).onFailure().recoverWithItem(error -> {
                reportFailure(key, CacheTier.PERSISTENT, "get", error.getMessage());
                return Optional.empty();
            });
        };
    }

    private List<CacheTier> lookupOrder(CacheTier preferred) {
        var enabled = enabledTiers();
        var order = new ArrayList<CacheTier>(enabled.size());
        if (preferred != null && enabled.contains(preferred)) {
            order.add(preferred);
        }
        for (CacheTier tier : CacheTier.lookupOrder()) {
            if (enabled.contains(tier) && tier != preferred) {
                order.add(tier);
            }
        }
        return order;
    }

    /**
     * Write to the target tiers and index the key.
     *
     * @param backfill conditional memory write that never replaces a live entry
     */
    private Uni<SetResult> write(
            String key, CachedValue value, SetOptions options, Set<CacheTier> targets, boolean backfill) {
        var stamp = index.stamp(options.dependencies());
        var now = clock.instant();
        var stored = EnumSet.noneOf(CacheTier.class);
        var failed = EnumSet.noneOf(CacheTier.class);
        boolean rejectedForCapacity = false;

        for (CacheTier tier : targets) {
            if (!enabledTiers().contains(tier)) {
                failed.add(tier);
            }
        }

        if (memory != null && targets.contains(CacheTier.MEMORY)) {
            long ttl = ttlFor(options, settings.memory().defaultTtl());
            var admission = backfill
                    ? memory.setIfAbsent(key, value, ttl, options.tags(), options.dependencies())
                    : memory.set(key, value, ttl, options.tags(), options.dependencies());
            if (admission == AdmissionResult.ADMITTED) {
                stored.add(CacheTier.MEMORY);
            } else if (admission == AdmissionResult.REJECTED_TOO_LARGE) {
                rejectedForCapacity = true;
                failed.add(CacheTier.MEMORY);
                releaseMemoryIndex(key);
                reportFailure(key, CacheTier.MEMORY, "set", "value exceeds memory tier budget");
            }
            metrics.recordSet(CacheTier.MEMORY, admission == AdmissionResult.ADMITTED);
        }

        Uni<Boolean> remoteWrite = Uni.createFrom().item(false);
        boolean writesRemote = remote != null && targets.contains(CacheTier.REMOTE);
        if (writesRemote) {
            long ttl = ttlFor(options, settings.remote().defaultTtl());
            var entry = new CacheEntry(
                    key, value, now, ttl, options.tags(), options.dependencies(), CacheTier.REMOTE);
            remoteWrite = remote.set(entry);
        }

        Uni<Boolean> persistentWrite = Uni.createFrom().item(false);
        boolean writesPersistent = persistent.isEnabled() && targets.contains(CacheTier.PERSISTENT);
        if (writesPersistent) {
            long ttl = ttlFor(options, settings.memory().defaultTtl());
            persistentWrite = persistent.set(key, value, ttl, options.tags(), options.dependencies())
                    .onFailure()
                    .recoverWithItem(false);
        }

        final boolean capacityRejected = rejectedForCapacity;
        return Uni.combine().all().unis(remoteWrite, persistentWrite).asTuple().flatMap(outcome -> {
            if (writesRemote) {
                metrics.recordSet(CacheTier.REMOTE, outcome.getItem1());
                (outcome.getItem1() ? stored : failed).add(CacheTier.REMOTE);
            }
            if (writesPersistent) {
                metrics.recordSet(CacheTier.PERSISTENT, outcome.getItem2());
                (outcome.getItem2() ? stored : failed).add(CacheTier.PERSISTENT);
            }
            // a value too large for memory is a capacity outcome, not a tier error
            int tierErrors = failed.size() - (capacityRejected ? 1 : 0);
            if (tierErrors > 0) {
                errors.addAndGet(tierErrors);
            }

            if (!index.record(key, stored, options.tags(), options.dependencies(), stamp)) {
                LOG.debugf("Write for %s raced a dependency invalidation; discarding it", key);
                return deleteFromTiers(key, stored)
                        .map(ignored -> new SetResult(false, Set.of(), failed, capacityRejected, true));
            }

            Uni<Boolean> cleanup = Uni.createFrom().item(false);
            if (writesRemote && failed.contains(CacheTier.REMOTE) && !backfill) {
                // a failed overwrite may leave the previous remote value behind
                cleanup = remote.delete(key);
            }
            return cleanup.map(ignored -> new SetResult(!stored.isEmpty(), stored, failed, capacityRejected, false));
        });
    }

    private Uni<Set<CacheTier>> deleteFromTiers(String key, Set<CacheTier> targets) {
        var removedFrom = ConcurrentHashMap.<CacheTier>newKeySet();
        if (memory != null && targets.contains(CacheTier.MEMORY)) {
            if (memory.delete(key)) {
                removedFrom.add(CacheTier.MEMORY);
            }
            releaseMemoryIndex(key);
        }
        var removals = new ArrayList<Uni<Boolean>>();
        if (remote != null && targets.contains(CacheTier.REMOTE)) {
            removals.add(remote.delete(key).invoke(existed -> {
                if (existed) {
                    removedFrom.add(CacheTier.REMOTE);
                }
                index.removeTier(key, CacheTier.REMOTE);
            }));
        }
        if (persistent.isEnabled() && targets.contains(CacheTier.PERSISTENT)) {
            removals.add(persistent.delete(key).onFailure().recoverWithItem(false).invoke(existed -> {
                if (existed) {
                    removedFrom.add(CacheTier.PERSISTENT);
                }
                index.removeTier(key, CacheTier.PERSISTENT);
            }));
        }
        return joinAll(removals).map(ignored -> {
            var result = EnumSet.noneOf(CacheTier.class);
            result.addAll(removedFrom);
            return (Set<CacheTier>) result;
        });
    }

    private Uni<List<String>> clearRemote(ClearCriteria criteria) {
        var pattern = criteria.pattern() == null ? "*" : criteria.pattern();
        if (criteria.tags().isEmpty()) {
            return remote.keys(pattern).flatMap(keys -> remote.deleteAll(keys)
                    .map(count -> count > 0 ? keys : List.<String>of()));
        }

        var candidates = new HashSet<String>();
        for (String key : index.keysWithAllTags(criteria.tags())) {
            if (index.tiersOf(key).contains(CacheTier.REMOTE)
                    && (criteria.pattern() == null || patternMatcher.matches(criteria.pattern(), key))) {
                candidates.add(key);
            }
        }
        // the stored envelope carries the tags of entries this node never indexed
        return remote.entries(pattern).flatMap(found -> {
            for (CacheEntry entry : found) {
                if (entry.tags().containsAll(criteria.tags())) {
                    candidates.add(entry.key());
                }
            }
            var removed = ConcurrentHashMap.<String>newKeySet();
            var removals = new ArrayList<Uni<Boolean>>();
            for (String key : candidates) {
                removals.add(remote.delete(key).invoke(existed -> {
                    if (existed) {
                        removed.add(key);
                    }
                }));
            }
            return joinAll(removals).map(ignored -> List.copyOf(removed));
        });
    }

    private void scheduleBackfill(CacheEntry entry, CacheTier servedFrom) {
        if (closed) {
            return;
        }
        var targets = EnumSet.noneOf(CacheTier.class);
        for (CacheTier tier : enabledTiers()) {
            if (tier.isFasterThan(servedFrom)) {
                targets.add(tier);
            }
        }
        if (targets.isEmpty()) {
            return;
        }

        long remaining = entry.remainingTtlSeconds(clock.instant());
        if (entry.expiresAt() != null && remaining == 0) {
            // less than a second left; a zero TTL would make the copy immortal
            return;
        }
        var options = new SetOptions(remaining, targets, entry.tags(), entry.dependencies());
        // completes after leaving the pending set, so a finished drain leaves nothing pending
        var settled = new CompletableFuture<Void>();
        pendingBackfills.add(settled);
        write(entry.key(), entry.value(), options, targets, true)
                .runSubscriptionOn(backfillExecutor)
                .subscribeAsCompletionStage()
                .whenComplete((result, error) -> {
                    pendingBackfills.remove(settled);
                    if (error != null) {
                        LOG.debugf("Backfill of %s into %s failed: %s", entry.key(), targets, error.getMessage());
                    } else if (result.stored()) {
                        LOG.tracef("Backfilled %s into %s", entry.key(), result.storedTiers());
                    }
                    settled.complete(null);
                });
    }

    private void drainBackfills(Duration drainTimeout) {
        var pending = List.copyOf(pendingBackfills);
        if (pending.isEmpty()) {
            return;
        }
        LOG.infof("Draining %d pending backfill(s)", pending.size());
        try {
            CompletableFuture.allOf(pending.toArray(new CompletableFuture<?>[0]))
                    .get(drainTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            LOG.warnf("Gave up on %d backfill(s) after %s", pendingBackfills.size(), drainTimeout);
        } catch (ExecutionException e) {
            LOG.debugf("Backfill failed during drain: %s", e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private Uni<Boolean> warmUpOne(WarmUpEntry entry) {
        try {
            return set(entry.key(), entry.value(), entry.toSetOptions())
                    .map(SetResult::stored)
                    .onFailure()
                    .recoverWithItem(error -> {
                        LOG.warnf("Warm-up entry %s failed: %s", entry.key(), error.getMessage());
                        return false;
                    });
        } catch (IllegalArgumentException e) {
            LOG.warnf("Skipping invalid warm-up entry %s: %s", entry.key(), e.getMessage());
            return Uni.createFrom().item(false);
        }
    }

    private boolean matches(CacheQuery query, CacheEntry entry, Instant now) {
        if (query.pattern() != null && !patternMatcher.matches(query.pattern(), entry.key())) {
            return false;
        }
        if (!entry.tags().containsAll(query.tags())) {
            return false;
        }
        if (query.minAccessCount() != null && entry.accessCount() < query.minAccessCount()) {
            return false;
        }
        return query.maxAgeSeconds() == null
                || Duration.between(entry.createdAt(), now).getSeconds() <= query.maxAgeSeconds();
    }

    private boolean matches(ClearCriteria criteria, String key, Set<String> tags) {
        if (criteria.pattern() != null && !patternMatcher.matches(criteria.pattern(), key)) {
            return false;
        }
        return tags.containsAll(criteria.tags());
    }

    void onMemoryEviction(CacheEntry entry, EvictionReason reason) {
        evictions.get(reason).incrementAndGet();
        metrics.recordEviction(reason);
        releaseMemoryIndex(entry.key());
        events.publish(new CacheEvent.Evict(clock.instant(), entry.key(), reason));
    }

    /**
     * Drop the memory tier from the key's index entry unless memory already holds a newer copy.
     */
    private void releaseMemoryIndex(String key) {
        index.removeTierUnless(key, CacheTier.MEMORY, () -> memory.peek(key).isPresent());
    }

    private static boolean carriesAny(Set<String> labels, Set<String> wanted) {
        for (String label : labels) {
            if (wanted.contains(label)) {
                return true;
            }
        }
        return false;
    }

    private void onRemoteEvent(CacheEvent event) {
        if (event instanceof CacheEvent.Error) {
            errors.incrementAndGet();
        }
        events.publish(event);
    }

    private void reportFailure(String key, CacheTier tier, String operation, String message) {
        events.publish(new CacheEvent.Error(clock.instant(), key, tier, operation, message));
    }

    private void recordLatency(String operation, long startNanos) {
        long nanos = System.nanoTime() - startNanos;
        latency.record(nanos / 1_000_000.0);
        metrics.recordLatency(operation, TimeUnit.NANOSECONDS.toMillis(nanos));
    }

    private static long ttlFor(SetOptions options, Duration tierDefault) {
        return options.ttlSeconds() != null ? options.ttlSeconds() : tierDefault.toSeconds();
    }

    private static Uni<Void> joinAll(List<Uni<Boolean>> unis) {
        if (unis.isEmpty()) {
            return Uni.createFrom().voidItem();
        }
        return Uni.join().all(unis).andCollectFailures().replaceWithVoid();
    }

    private static void requireKey(String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Cache key must not be empty");
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Cache engine has been shut down");
        }
    }
}
