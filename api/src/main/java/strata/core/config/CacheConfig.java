package strata.core.config;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for the multi-tier cache engine.
 *
 * <p>Configuration prefix: {@code strata.cache}
 *
 * <p>Connection targets and credentials for the remote tier are read from the Quarkus Redis
 * client properties ({@code quarkus.redis.hosts}, {@code quarkus.redis.client-type},
 * {@code quarkus.redis.password}).
 *
 * <p>Environment variables:
 * <ul>
 *   <li>STRATA_CACHE_MEMORY_MAX_BYTES - memory tier byte budget (default: 104857600)</li>
 *   <li>STRATA_CACHE_MEMORY_MAX_ITEMS - memory tier item budget (default: 10000)</li>
 *   <li>STRATA_CACHE_MEMORY_EVICTION_POLICY - lru, lfu or ttl (default: lru)</li>
 *   <li>STRATA_CACHE_REMOTE_ENABLED - enable the remote tier (default: true)</li>
 *   <li>STRATA_CACHE_REMOTE_KEY_PREFIX - namespace for remote keys (default: strata)</li>
 *   <li>STRATA_CACHE_REMOTE_COMPRESSION - gzip remote payloads (default: false)</li>
 * </ul>
 */
@ConfigMapping(prefix = "strata.cache")
public interface CacheConfig {

    /**
     * In-process memory tier.
     */
    MemoryConfig memory();

    /**
     * Networked key-value tier.
     */
    RemoteConfig remote();

    /**
     * Response cache for HTTP GET requests.
     */
    HttpConfig http();

    /**
     * Shutdown behavior.
     */
    ShutdownConfig shutdown();

    /**
     * Startup pre-loading.
     */
    WarmUpConfig warmUp();

    /**
     * Micrometer metrics.
     */
    MetricsConfig metrics();

    /**
     * Copy values found in slower tiers into faster tiers on read.
     *
     * @return whether read-through backfill is on by default (default: true)
     */
    @WithDefault("true")
    boolean readThrough();

    /**
     * Tier targeted by writes that do not name one: {@code all}, {@code memory} or {@code remote}.
     *
     * @return default write tier (default: all)
     */
    @WithDefault("all")
    String defaultTier();

    interface MemoryConfig {

        @WithDefault("true")
        boolean enabled();

        /**
         * Total accounted bytes the memory tier may hold.
         *
         * @return byte budget (default: 100 MiB)
         */
        @WithDefault("104857600")
        long maxBytes();

        /**
         * Maximum number of entries.
         *
         * @return item budget (default: 10000)
         */
        @WithDefault("10000")
        int maxItems();

        /**
         * TTL applied when a write does not specify one.
         *
         * @return default TTL (default: 1 hour)
         */
        @WithDefault("PT1H")
        Duration defaultTtl();

        /**
         * Victim selection when the budget is exceeded: {@code lru}, {@code lfu} or {@code ttl}.
         *
         * @return eviction policy name (default: lru)
         */
        @WithDefault("lru")
        String evictionPolicy();

        /**
         * Interval of the background sweep that removes expired entries.
         *
         * @return sweep interval (default: 1 minute)
         */
        @WithDefault("PT1M")
        Duration sweepInterval();
    }

    interface RemoteConfig {

        @WithDefault("true")
        boolean enabled();

        /**
         * Name of the {@code RemoteStoreProvider} to use. When empty, the available provider
         * with the highest priority is selected.
         */
        Optional<String> provider();

        /**
         * Namespace prepended to every remote key as {@code prefix:key}.
         *
         * @return key prefix (default: strata)
         */
        @WithDefault("strata")
        String keyPrefix();

        /**
         * TTL applied when a write does not specify one.
         *
         * @return default TTL (default: 2 hours)
         */
        @WithDefault("PT2H")
        Duration defaultTtl();

        /**
         * Per-call timeout for get, set, delete and ping.
         *
         * <p>A timed out get is treated as a miss.
         *
         * @return command timeout (default: 250 milliseconds)
         */
        @WithDefault("PT0.25S")
        Duration commandTimeout();

        /**
         * Gzip values before transmission.
         *
         * @return whether compression is on (default: false)
         */
        @WithDefault("false")
        boolean compression();

        HealthConfig health();

        ReconnectConfig reconnect();
    }

    interface HealthConfig {

        @WithDefault("PT30S")
        Duration checkInterval();

        /**
         * Timeout of the health ping, independent of the command timeout.
         */
        @WithDefault("PT5S")
        Duration timeout();

        /**
         * Consecutive failed checks before the tier is marked unreachable.
         */
        @WithDefault("3")
        int failureThreshold();

        /**
         * Consecutive successful checks before a recovering tier is marked healthy.
         */
        @WithDefault("2")
        int successThreshold();
    }

    interface ReconnectConfig {

        @WithDefault("PT1S")
        Duration initialDelay();

        @WithDefault("2.0")
        double multiplier();

        @WithDefault("PT30S")
        Duration maxDelay();

        /**
         * Attempts before a terminal reconnect event is emitted. Attempts continue at
         * {@link #maxDelay()} afterwards.
         */
        @WithDefault("10")
        int maxAttempts();
    }

    interface HttpConfig {

        @WithDefault("false")
        boolean enabled();

        @WithDefault("PT5M")
        Duration ttl();

        /**
         * Path globs eligible for response caching.
         */
        @WithDefault("/**")
        List<String> include();

        /**
         * Path globs never cached, checked before {@link #include()}.
         */
        @WithDefault("/admin/**,/q/**")
        List<String> exclude();

        /**
         * Invalidate cached reads under a path after a successful write to it.
         */
        @WithDefault("true")
        boolean invalidateOnWrite();
    }

    interface ShutdownConfig {

        /**
         * Time allowed for pending backfills and in-flight remote calls at shutdown.
         */
        @WithDefault("PT5S")
        Duration drainTimeout();
    }

    interface MetricsConfig {

        @WithDefault("true")
        boolean enabled();
    }

    interface WarmUpConfig {

        /**
         * JSON file of entries to load at startup.
         */
        Optional<String> file();
    }
}
