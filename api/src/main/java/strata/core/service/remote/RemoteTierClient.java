package strata.core.service.remote;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import strata.core.config.RemoteTierSettings;
import strata.core.model.CacheEntry;
import strata.core.model.CacheTier;
import strata.core.model.RemoteHealth;
import strata.core.model.RemoteHealthStatus;
import strata.core.port.out.CacheEventPublisher;
import strata.core.port.out.CacheMetrics;
import strata.core.port.out.RemoteStore;
import strata.core.port.out.RemoteStoreConnector;
import strata.spi.CacheEvent;
import strata.spi.RemoteTierException;

/**
 * Client for the remote tier: namespacing, encoding, timeouts, health monitoring and reconnects.
 *
 * <p>Data operations never fail. A timeout or transport error yields a miss for reads and
 * {@code false} for writes and deletes. While the tier is {@link RemoteHealth#UNREACHABLE}
 * data operations short-circuit without touching the network.
 *
 * <p>Health uses hysteresis. {@code failureThreshold} consecutive failed pings mark the tier
 * unreachable; a single failure on a healthy tier changes nothing. After a reconnect the tier is
 * {@link RemoteHealth#DEGRADED} until {@code successThreshold} consecutive pings succeed.
 *
 * <p>Reconnect attempts back off exponentially up to {@code maxDelay}. Once {@code maxAttempts}
 * have failed a {@link CacheEvent.ReconnectExhausted} event is published and attempts continue
 * at {@code maxDelay} until one succeeds or the client is shut down.
 */
public class RemoteTierClient {

    private static final Logger LOG = Logger.getLogger(RemoteTierClient.class);

    private final RemoteStoreConnector connector;
    private final RemoteTierSettings settings;
    private final RemoteEntryCodec codec;
    private final RemoteCallGuard guard;
    private final CacheMetrics metrics;
    private final CacheEventPublisher events;
    private final Clock clock;

    private final Object stateLock = new Object();
    private volatile RemoteStore store;
    private volatile RemoteHealth state = RemoteHealth.UNREACHABLE;
    private volatile long entryCount;
    private int consecutiveFailures;
    private int consecutiveSuccesses;
    private int reconnectAttempts;
    private boolean exhaustionReported;
    private long lastLatencyMs = -1;
    private Instant lastCheckedAt;
    private String lastError;

    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> pendingReconnect;
    private volatile boolean closed;

    public RemoteTierClient(
            RemoteStoreConnector connector,
            RemoteTierSettings settings,
            CacheMetrics metrics,
            CacheEventPublisher events,
            Clock clock) {
        this.connector = connector;
        this.settings = settings;
        this.metrics = metrics == null ? CacheMetrics.noop() : metrics;
        this.events = events == null ? CacheEventPublisher.noop() : events;
        this.clock = clock;
        this.codec = new RemoteEntryCodec(settings.compression());
        this.guard = new RemoteCallGuard(settings.commandTimeout(), this.metrics, this::publishFailure);
    }

    /**
     * Open the store and verify it answers a ping.
     *
     * <p>Blocks for at most the health timeout. Safe to call again after a failure. A successful
     * connect marks the tier healthy.
     *
     * @throws RemoteTierException if no node is reachable
     */
    public void connect() {
        var opened = openVerified();
        RemoteStore previous;
        synchronized (stateLock) {
            previous = store;
            store = opened;
            consecutiveFailures = 0;
            consecutiveSuccesses = settings.health().successThreshold();
            lastError = null;
            lastCheckedAt = clock.instant();
            transitionLocked(RemoteHealth.HEALTHY);
        }
        closeQuietly(previous);
        LOG.infof("Connected to remote tier via %s", opened.name());
    }

    /**
     * Connect and start the health monitor. A failed initial connect is logged and left to the
     * reconnect loop.
     */
    public void start() {
        synchronized (this) {
            if (scheduler != null) {
                return;
            }
            scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "strata-remote-health");
                t.setDaemon(true);
                return t;
            });
        }
        try {
            connect();
        } catch (RemoteTierException e) {
            LOG.warnf("Remote tier unavailable at startup, continuing with remaining tiers: %s", e.getMessage());
            publishFailure("connect", null, e);
            scheduleReconnect();
        }
        long interval = Math.max(1, settings.health().checkInterval().toMillis());
        scheduler.scheduleAtFixedRate(this::healthCheckSafely, interval, interval, TimeUnit.MILLISECONDS);
    }

    public Uni<Optional<CacheEntry>> get(String key) {
        var current = store;
        if (current == null || !state.acceptsTraffic()) {
            return Uni.createFrom().item(Optional.empty());
        }
        return guard.<String>withTimeoutGraceful(current.get(namespaced(key)), "get", key)
                .map(found -> found.flatMap(encoded -> decodeLive(key, encoded)));
    }

    /**
     * Store an entry with its own TTL.
     *
     * @return true if the store acknowledged the write
     */
    public Uni<Boolean> set(CacheEntry entry) {
        var current = store;
        if (current == null || !state.acceptsTraffic()) {
            return Uni.createFrom().item(false);
        }
        String encoded = codec.encode(entry);
        return guard.withTimeoutFallback(
                current.set(namespaced(entry.key()), encoded, entry.ttlSeconds()).replaceWith(true),
                "set",
                entry.key(),
                () -> false);
    }

    /**
     * @return true if the key existed remotely; false if absent, failed or unreachable
     */
    public Uni<Boolean> delete(String key) {
        var current = store;
        if (current == null || !state.acceptsTraffic()) {
            return Uni.createFrom().item(false);
        }
        return guard.withTimeoutFallback(current.delete(namespaced(key)), "delete", key, () -> false);
    }

    /**
     * Unprefixed keys matching a glob pattern; empty when unreachable.
     */
    public Uni<List<String>> keys(String pattern) {
        var current = store;
        if (current == null || !state.acceptsTraffic()) {
            return Uni.createFrom().item(List.of());
        }
        return guard.withTimeoutFallback(
                current.keys(namespaced(pattern)).map(found -> found.stream()
                        .map(this::stripNamespace)
                        .toList()),
                "keys",
                pattern,
                () -> List.of());
    }

    /**
     * Decode every live entry under keys matching the unprefixed glob. Keys that vanish or fail
     * to decode between the scan and the read are skipped.
     */
    public Uni<List<CacheEntry>> entries(String pattern) {
        return keys(pattern).flatMap(found -> {
            if (found.isEmpty()) {
                return Uni.createFrom().item(List.<CacheEntry>of());
            }
            List<Uni<Optional<CacheEntry>>> reads = found.stream().map(this::get).toList();
            return Uni.join().all(reads).andCollectFailures().map(results -> results.stream()
                    .flatMap(Optional::stream)
                    .toList());
        });
    }

    /**
     * Delete several unprefixed keys.
     *
     * @return number removed, 0 on failure
     */
    public Uni<Long> deleteAll(List<String> keys) {
        var current = store;
        if (keys.isEmpty() || current == null || !state.acceptsTraffic()) {
            return Uni.createFrom().item(0L);
        }
        var namespacedKeys = keys.stream().map(this::namespaced).toList();
        return guard.withTimeoutFallback(current.deleteAll(namespacedKeys), "delete", null, () -> 0L);
    }

    /**
     * Ping the store.
     *
     * @return round-trip latency in milliseconds
     */
    public Uni<Long> ping() {
        var current = store;
        if (current == null) {
            return Uni.createFrom().failure(new RemoteTierException("Remote tier is not connected"));
        }
        long start = System.nanoTime();
        return guard.withTimeout(current.ping(), "ping", settings.health().timeout())
                .map(ignored -> TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start));
    }

    /**
     * One health-monitor pass: ping, refresh the remote key count, update state.
     *
     * <p>Skipped while unreachable; the reconnect loop owns recovery then.
     */
    void runHealthCheck() {
        if (closed || state == RemoteHealth.UNREACHABLE) {
            return;
        }
        try {
            long latency = ping().await().indefinitely();
            refreshEntryCount();
            recordCheckSuccess(latency);
        } catch (RuntimeException e) {
            recordCheckFailure(e);
        }
    }

    /**
     * One reconnect attempt.
     *
     * @return true if the tier is reachable again
     */
    boolean attemptReconnect() {
        int attempt;
        synchronized (stateLock) {
            pendingReconnect = null;
            if (closed || state != RemoteHealth.UNREACHABLE) {
                return state.acceptsTraffic();
            }
            attempt = ++reconnectAttempts;
        }

        RemoteStore opened;
        try {
            opened = openVerified();
        } catch (RuntimeException e) {
            boolean exhausted;
            synchronized (stateLock) {
                lastError = e.getMessage();
                exhausted = attempt >= settings.reconnect().maxAttempts() && !exhaustionReported;
                if (exhausted) {
                    exhaustionReported = true;
                }
            }
            if (exhausted) {
                LOG.errorf(
                        "Remote tier reconnect failed %d times; retrying every %s",
                        attempt, settings.reconnect().maxDelay());
                events.publish(new CacheEvent.ReconnectExhausted(clock.instant(), attempt));
            } else {
                LOG.debugf("Remote tier reconnect attempt %d failed: %s", attempt, e.getMessage());
            }
            scheduleReconnect();
            return false;
        }

        RemoteStore previous;
        synchronized (stateLock) {
            previous = store;
            store = opened;
            reconnectAttempts = 0;
            exhaustionReported = false;
            consecutiveFailures = 0;
            consecutiveSuccesses = 1;
            lastError = null;
            lastCheckedAt = clock.instant();
            transitionLocked(
                    consecutiveSuccesses >= settings.health().successThreshold()
                            ? RemoteHealth.HEALTHY
                            : RemoteHealth.DEGRADED);
        }
        closeQuietly(previous);
        LOG.infof("Reconnected to remote tier after %d attempt(s)", attempt);
        events.publish(new CacheEvent.Reconnected(clock.instant(), attempt));
        return true;
    }

    /**
     * Delay before the next reconnect attempt.
     */
    Duration nextReconnectDelay() {
        synchronized (stateLock) {
            return settings.reconnect().delayForAttempt(reconnectAttempts + 1);
        }
    }

    public RemoteHealth health() {
        return state;
    }

    public boolean isAvailable() {
        return store != null && state.acceptsTraffic();
    }

    /**
     * Key count observed by the most recent health check.
     */
    public long entryCount() {
        return entryCount;
    }

    public RemoteHealthStatus status() {
        synchronized (stateLock) {
            return new RemoteHealthStatus(
                    state,
                    consecutiveFailures,
                    consecutiveSuccesses,
                    lastLatencyMs,
                    lastCheckedAt,
                    reconnectAttempts,
                    entryCount,
                    lastError);
        }
    }

    public int inFlight() {
        return guard.inFlight();
    }

    /**
     * Stop background tasks, wait for in-flight calls to finish or time out, then release the store.
     */
    public void shutdown(Duration drainTimeout) {
        closed = true;
        ScheduledExecutorService executor;
        synchronized (this) {
            executor = scheduler;
            scheduler = null;
        }
        if (executor != null) {
            executor.shutdownNow();
            try {
                executor.awaitTermination(drainTimeout.toMillis(), TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        if (!guard.awaitIdle(drainTimeout)) {
            LOG.warnf("Closing remote tier with %d call(s) still in flight", guard.inFlight());
        }
        RemoteStore current;
        synchronized (stateLock) {
            current = store;
            store = null;
        }
        closeQuietly(current);
    }

    private RemoteStore openVerified() {
        RemoteStore opened = connector.connect();
        try {
            guard.withTimeout(opened.ping(), "connect", settings.health().timeout()).await().indefinitely();
            return opened;
        } catch (RuntimeException e) {
            closeQuietly(opened);
            throw new RemoteTierException("Remote tier did not answer ping: " + e.getMessage(), e);
        }
    }

    private void healthCheckSafely() {
        try {
            runHealthCheck();
        } catch (RuntimeException e) {
            LOG.warnf(e, "Remote tier health check failed unexpectedly");
        }
    }

    private void refreshEntryCount() {
        var current = store;
        if (current == null) {
            return;
        }
        try {
            entryCount = guard.withTimeout(current.size(), "dbsize", settings.health().timeout())
                    .await()
                    .indefinitely();
        } catch (RuntimeException e) {
            LOG.debugf("Could not refresh remote key count: %s", e.getMessage());
        }
    }

    private void recordCheckSuccess(long latencyMs) {
        synchronized (stateLock) {
            consecutiveFailures = 0;
            consecutiveSuccesses++;
            lastLatencyMs = latencyMs;
            lastCheckedAt = clock.instant();
            lastError = null;
            if (state == RemoteHealth.DEGRADED && consecutiveSuccesses >= settings.health().successThreshold()) {
                transitionLocked(RemoteHealth.HEALTHY);
            }
        }
    }

    private void recordCheckFailure(RuntimeException error) {
        boolean becameUnreachable = false;
        int failures;
        synchronized (stateLock) {
            consecutiveSuccesses = 0;
            failures = ++consecutiveFailures;
            lastCheckedAt = clock.instant();
            lastError = error.getMessage();
            if (consecutiveFailures >= settings.health().failureThreshold() && state != RemoteHealth.UNREACHABLE) {
                transitionLocked(RemoteHealth.UNREACHABLE);
                becameUnreachable = true;
            }
        }
        LOG.debugf("Remote tier health check failed (%d consecutive): %s", failures, error.getMessage());
        if (becameUnreachable) {
            scheduleReconnect();
        }
    }

    private void transitionLocked(RemoteHealth next) {
        var previous = state;
        if (previous == next) {
            return;
        }
        state = next;
        metrics.recordRemoteHealth(next);
        if (next == RemoteHealth.UNREACHABLE) {
            LOG.warnf("Remote tier %s -> %s", previous, next);
        } else {
            LOG.infof("Remote tier %s -> %s", previous, next);
        }
        events.publish(new CacheEvent.RemoteHealthChanged(clock.instant(), previous, next));
    }

    private void scheduleReconnect() {
        synchronized (stateLock) {
            if (closed || pendingReconnect != null) {
                return;
            }
            ScheduledExecutorService executor = scheduler;
            if (executor == null || executor.isShutdown()) {
                return;
            }
            var delay = settings.reconnect().delayForAttempt(reconnectAttempts + 1);
            pendingReconnect = executor.schedule(this::reconnectSafely, delay.toMillis(), TimeUnit.MILLISECONDS);
        }
    }

    private void reconnectSafely() {
        try {
            attemptReconnect();
        } catch (RuntimeException e) {
            LOG.warnf(e, "Remote tier reconnect attempt failed unexpectedly");
            synchronized (stateLock) {
                pendingReconnect = null;
            }
            scheduleReconnect();
        }
    }

    private Optional<CacheEntry> decodeLive(String key, String encoded) {
        try {
            var entry = codec.decode(key, encoded);
            if (entry.isExpired(clock.instant())) {
                return Optional.empty();
            }
            return Optional.of(entry);
        } catch (IllegalArgumentException e) {
            LOG.warnf("Discarding undecodable remote entry %s: %s", key, e.getMessage());
            publishFailure("decode", key, e);
            return Optional.empty();
        }
    }

    private void publishFailure(String operation, String key, Throwable cause) {
        events.publish(new CacheEvent.Error(clock.instant(), key, CacheTier.REMOTE, operation, cause.getMessage()));
    }

    private String namespaced(String key) {
        var prefix = settings.keyPrefix();
        return prefix == null || prefix.isEmpty() ? key : prefix + ":" + key;
    }

    private String stripNamespace(String key) {
        var prefix = settings.keyPrefix();
        if (prefix == null || prefix.isEmpty()) {
            return key;
        }
        var marker = prefix + ":";
        return key.startsWith(marker) ? key.substring(marker.length()) : key;
    }

    private static void closeQuietly(RemoteStore target) {
        if (target == null) {
            return;
        }
        try {
            target.close().await().atMost(Duration.ofSeconds(5));
        } catch (RuntimeException e) {
            LOG.debugf("Error closing remote store: %s", e.getMessage());
        }
    }
}
