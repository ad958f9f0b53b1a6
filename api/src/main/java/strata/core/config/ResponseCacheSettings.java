package strata.core.config;

import java.time.Duration;
import java.util.List;

/**
 * Resolved HTTP response cache settings.
 *
 * @param include path globs eligible for caching
 * @param exclude path globs never cached, checked first
 */
public record ResponseCacheSettings(
        boolean enabled, Duration ttl, List<String> include, List<String> exclude, boolean invalidateOnWrite) {

    public ResponseCacheSettings {
        include = include == null ? List.of() : List.copyOf(include);
        exclude = exclude == null ? List.of() : List.copyOf(exclude);
        if (ttl == null || ttl.isNegative()) {
            throw new IllegalArgumentException("Response cache TTL must not be negative: " + ttl);
        }
    }

    public static ResponseCacheSettings from(CacheConfig.HttpConfig config) {
        return new ResponseCacheSettings(
                config.enabled(), config.ttl(), config.include(), config.exclude(), config.invalidateOnWrite());
    }

    public static ResponseCacheSettings defaults() {
        return new ResponseCacheSettings(true, Duration.ofMinutes(5), List.of("/**"), List.of("/admin/**", "/q/**"), true);
    }

    public ResponseCacheSettings withTtl(Duration value) {
        return new ResponseCacheSettings(enabled, value, include, exclude, invalidateOnWrite);
    }

    public ResponseCacheSettings withInvalidateOnWrite(boolean value) {
        return new ResponseCacheSettings(enabled, ttl, include, exclude, value);
    }
}
