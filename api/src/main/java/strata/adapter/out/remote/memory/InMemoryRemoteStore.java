package strata.adapter.out.remote.memory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

import io.smallrye.mutiny.Uni;

import strata.core.port.out.RemoteStore;
import strata.core.service.KeyPatternMatcher;
import strata.spi.RemoteTierException;

/**
 * Process-local stand-in for a networked key-value store.
 *
 * <p>This implementation is intended for development and testing only. It survives
 * reconnects, honours TTLs lazily and can be switched offline to exercise degraded mode.
 */
public class InMemoryRemoteStore implements RemoteStore {

    private record Stored(String value, Instant expiresAt) {
        boolean isExpired(Instant now) {
            return expiresAt != null && !now.isBefore(expiresAt);
        }
    }

    private final Map<String, Stored> values = new ConcurrentHashMap<>();
    private final KeyPatternMatcher matcher = new KeyPatternMatcher();
    private final Clock clock;
    private volatile boolean online = true;

    public InMemoryRemoteStore(Clock clock) {
        this.clock = clock;
    }

    /**
     * Simulate the store going away or coming back. While offline every call fails.
     */
    public void setOnline(boolean online) {
        this.online = online;
    }

    public boolean isOnline() {
        return online;
    }

    @Override
    public String name() {
        return "memory";
    }

    @Override
    public Uni<Optional<String>> get(String key) {
        return call(() -> {
            var stored = values.get(key);
            if (stored == null) {
                return Optional.empty();
            }
            if (stored.isExpired(clock.instant())) {
                values.remove(key, stored);
                return Optional.empty();
            }
            return Optional.of(stored.value());
        });
    }

    @Override
    public Uni<Void> set(String key, String value, long ttlSeconds) {
        return call(() -> {
            var expiresAt = ttlSeconds > 0 ? clock.instant().plusSeconds(ttlSeconds) : null;
            values.put(key, new Stored(value, expiresAt));
            return null;
        });
    }

    @Override
    public Uni<Boolean> delete(String key) {
        return call(() -> {
            var removed = values.remove(key);
            return removed != null && !removed.isExpired(clock.instant());
        });
    }

    @Override
    public Uni<Long> deleteAll(List<String> keys) {
        return call(() -> {
            long count = 0;
            for (String key : keys) {
                var removed = values.remove(key);
                if (removed != null && !removed.isExpired(clock.instant())) {
                    count++;
                }
            }
            return count;
        });
    }

    @Override
    public Uni<Void> ping() {
        return call(() -> null);
    }

    @Override
    public Uni<List<String>> keys(String pattern) {
        return call(() -> {
            var now = clock.instant();
            return values.entrySet().stream()
                    .filter(e -> !e.getValue().isExpired(now))
                    .map(Map.Entry::getKey)
                    .filter(key -> matcher.matches(pattern, key))
                    .toList();
        });
    }

    @Override
    public Uni<Long> size() {
        return call(() -> {
            var now = clock.instant();
            return values.values().stream().filter(v -> !v.isExpired(now)).count();
        });
    }

    @Override
    public Uni<Void> close() {
        return Uni.createFrom().voidItem();
    }

    private <T> Uni<T> call(Supplier<T> operation) {
        return Uni.createFrom().item(() -> {
            if (!online) {
                throw new RemoteTierException("In-memory remote store is offline");
            }
            return operation.get();
        });
    }
}
