package strata.adapter.out.telemetry;

import org.jboss.logging.Logger;

import strata.spi.CacheEvent;
import strata.spi.CacheEventHandler;

/**
 * Cache event handler that logs events using JBoss Logging.
 *
 * <p>Log levels follow event severity:
 * <ul>
 *   <li>INFO severity → DEBUG level</li>
 *   <li>WARNING severity → WARN level</li>
 *   <li>CRITICAL severity → ERROR level</li>
 * </ul>
 */
public class LoggingCacheEventHandler implements CacheEventHandler {

    private static final Logger LOG = Logger.getLogger("strata.cache.events");

    @Override
    public String name() {
        return "logging";
    }

    @Override
    public String description() {
        return "Logs cache events using JBoss Logging";
    }

    @Override
    public int priority() {
        return 0;
    }

    @Override
    public void handle(CacheEvent event) {
        switch (event.severity()) {
            case INFO -> {
                if (LOG.isDebugEnabled()) {
                    LOG.debug(format(event));
                }
            }
            case WARNING -> LOG.warn(format(event));
            case CRITICAL -> LOG.error(format(event));
        }
    }

    static String format(CacheEvent event) {
        if (event instanceof CacheEvent.Hit e) {
            return String.format("HIT: key=%s tier=%s", e.key(), e.tier().label());
        }
        if (event instanceof CacheEvent.Miss e) {
            return String.format("MISS: key=%s", e.key());
        }
        if (event instanceof CacheEvent.Set e) {
            return String.format("SET: key=%s tiers=%s", e.key(), e.tiers());
        }
        if (event instanceof CacheEvent.Delete e) {
            return String.format("DELETE: key=%s tiers=%s", e.key(), e.tiers());
        }
        if (event instanceof CacheEvent.Error e) {
            return String.format(
                    "ERROR: tier=%s operation=%s key=%s message=%s",
                    e.tier() != null ? e.tier().label() : "none", e.operation(), e.key(), e.message());
        }
        if (event instanceof CacheEvent.Evict e) {
            return String.format("EVICT: key=%s reason=%s", e.key(), e.reason());
        }
        if (event instanceof CacheEvent.RemoteHealthChanged e) {
            return String.format("REMOTE_HEALTH: %s -> %s", e.previous(), e.current());
        }
        if (event instanceof CacheEvent.ReconnectExhausted e) {
            return String.format("RECONNECT_EXHAUSTED: attempts=%d, retrying at maximum delay", e.attempts());
        }
        if (event instanceof CacheEvent.Reconnected e) {
            return String.format("RECONNECTED: attempts=%d", e.attempts());
        }
        return event.toString();
    }
}
