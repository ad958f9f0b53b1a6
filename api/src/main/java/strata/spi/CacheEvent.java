package strata.spi;

import java.time.Instant;

import strata.core.model.CacheTier;
import strata.core.model.EvictionReason;
import strata.core.model.RemoteHealth;

/**
 * Structured events emitted by the cache engine and the remote tier client.
 *
 * <p>Events are dispatched to registered {@link CacheEventHandler} implementations. Events for
 * the same key are delivered in the order they were published.
 *
 * <p>Event types:
 * <ul>
 *   <li>{@link Hit} - a read was served by a tier</li>
 *   <li>{@link Miss} - no tier held a live value</li>
 *   <li>{@link Set} - a write was accepted by at least one tier</li>
 *   <li>{@link Delete} - a key was removed on request</li>
 *   <li>{@link Error} - a tier operation failed or timed out</li>
 *   <li>{@link Evict} - the memory tier dropped an entry on its own</li>
 *   <li>{@link RemoteHealthChanged} - the remote tier changed connectivity state</li>
 *   <li>{@link ReconnectExhausted} - reconnect attempts reached the configured maximum</li>
 *   <li>{@link Reconnected} - the remote tier is reachable again</li>
 * </ul>
 */
public sealed interface CacheEvent {

    Instant timestamp();

    /**
     * Key the event concerns, or null for tier-wide events.
     */
    default String key() {
        return null;
    }

    Severity severity();

    enum Severity {
        INFO,
        WARNING,
        CRITICAL
    }

    record Hit(Instant timestamp, String key, CacheTier tier) implements CacheEvent {
        @Override
        public Severity severity() {
            return Severity.INFO;
        }
    }

    record Miss(Instant timestamp, String key) implements CacheEvent {
        @Override
        public Severity severity() {
            return Severity.INFO;
        }
    }

    record Set(Instant timestamp, String key, java.util.Set<CacheTier> tiers) implements CacheEvent {
        @Override
        public Severity severity() {
            return Severity.INFO;
        }
    }

    record Delete(Instant timestamp, String key, java.util.Set<CacheTier> tiers) implements CacheEvent {
        @Override
        public Severity severity() {
            return Severity.INFO;
        }
    }

    /**
     * @param key affected key, or null for tier-wide operations
     * @param operation operation that failed (get, set, delete, clear, connect)
     */
    record Error(Instant timestamp, String key, CacheTier tier, String operation, String message)
            implements CacheEvent {
        @Override
        public Severity severity() {
            return Severity.WARNING;
        }
    }

    record Evict(Instant timestamp, String key, EvictionReason reason) implements CacheEvent {
        @Override
        public Severity severity() {
            return Severity.INFO;
        }
    }

    record RemoteHealthChanged(Instant timestamp, RemoteHealth previous, RemoteHealth current)
            implements CacheEvent {
        @Override
        public Severity severity() {
            return current == RemoteHealth.UNREACHABLE ? Severity.WARNING : Severity.INFO;
        }
    }

    /**
     * Terminal reconnect event. Attempts continue at the maximum delay.
     */
    record ReconnectExhausted(Instant timestamp, int attempts) implements CacheEvent {
        @Override
        public Severity severity() {
            return Severity.CRITICAL;
        }
    }

    record Reconnected(Instant timestamp, int attempts) implements CacheEvent {
        @Override
        public Severity severity() {
            return Severity.INFO;
        }
    }
}
