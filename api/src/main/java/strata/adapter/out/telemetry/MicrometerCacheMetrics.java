package strata.adapter.out.telemetry;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import strata.core.config.CacheConfig;
import strata.core.model.CacheTier;
import strata.core.model.EvictionReason;
import strata.core.model.RemoteHealth;
import strata.core.port.out.CacheMetrics;

/**
 * Records cache metrics using Micrometer.
 *
 * <p>All methods are no-ops when metrics are disabled, making it safe
 * to inject and call without checking configuration at each call site.
 *
 * <p>Metrics recorded:
 * <ul>
 *   <li>{@code strata.cache.hits.total} - Hits by serving tier</li>
 *   <li>{@code strata.cache.misses.total} - Reads no tier could serve</li>
 *   <li>{@code strata.cache.sets.total} - Tier writes by tier and outcome</li>
 *   <li>{@code strata.cache.evictions.total} - Memory tier evictions by reason</li>
 *   <li>{@code strata.cache.operation.latency} - Engine operation latency</li>
 *   <li>{@code strata.cache.remote.timeouts.total} - Remote calls that timed out</li>
 *   <li>{@code strata.cache.remote.failures.total} - Remote calls that failed</li>
 *   <li>{@code strata.cache.remote.health} - 1 healthy, 0.5 degraded, 0 unreachable</li>
 * </ul>
 */
@ApplicationScoped
public class MicrometerCacheMetrics implements CacheMetrics {

    private final MeterRegistry registry;
    private final boolean enabled;
    private final AtomicInteger remoteHealth = new AtomicInteger(RemoteHealth.UNREACHABLE.ordinal());

    @Inject
    public MicrometerCacheMetrics(MeterRegistry registry, CacheConfig config) {
        this(registry, config != null && config.metrics().enabled());
    }

    public MicrometerCacheMetrics(MeterRegistry registry, boolean enabled) {
        this.registry = registry;
        this.enabled = enabled;
    }

    @PostConstruct
    void init() {
        if (!enabled) {
            return;
        }
        Gauge.builder("strata.cache.remote.health", remoteHealth, MicrometerCacheMetrics::healthScore)
                .description("Remote tier connectivity (1 healthy, 0.5 degraded, 0 unreachable)")
                .register(registry);
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public void recordHit(CacheTier tier) {
        if (!enabled) {
            return;
        }
        Counter.builder("strata.cache.hits.total")
                .description("Cache reads served by a tier")
                .tag("tier", tier.label())
                .register(registry)
                .increment();
    }

    @Override
    public void recordMiss() {
        if (!enabled) {
            return;
        }
        Counter.builder("strata.cache.misses.total")
                .description("Cache reads no tier could serve")
                .register(registry)
                .increment();
    }

    @Override
    public void recordSet(CacheTier tier, boolean success) {
        if (!enabled) {
            return;
        }
        Counter.builder("strata.cache.sets.total")
                .description("Tier writes")
                .tag("tier", tier.label())
                .tag("outcome", success ? "stored" : "failed")
                .register(registry)
                .increment();
    }

    @Override
    public void recordEviction(EvictionReason reason) {
        if (!enabled) {
            return;
        }
        Counter.builder("strata.cache.evictions.total")
                .description("Entries dropped by the memory tier")
                .tag("reason", reason.name().toLowerCase())
                .register(registry)
                .increment();
    }

    @Override
    public void recordLatency(String operation, long latencyMs) {
        if (!enabled) {
            return;
        }
        Timer.builder("strata.cache.operation.latency")
                .description("Cache engine operation latency")
                .tag("operation", nullSafe(operation))
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry)
                .record(latencyMs, TimeUnit.MILLISECONDS);
    }

    @Override
    public void recordRemoteTimeout(String operation) {
        if (!enabled) {
            return;
        }
        Counter.builder("strata.cache.remote.timeouts.total")
                .description("Remote tier calls that exceeded their timeout")
                .tag("operation", nullSafe(operation))
                .register(registry)
                .increment();
    }

    @Override
    public void recordRemoteFailure(String operation, String errorType) {
        if (!enabled) {
            return;
        }
        Counter.builder("strata.cache.remote.failures.total")
                .description("Remote tier calls that failed")
                .tag("operation", nullSafe(operation))
                .tag("error_type", nullSafe(errorType))
                .register(registry)
                .increment();
    }

    @Override
    public void recordRemoteHealth(RemoteHealth health) {
        remoteHealth.set(health.ordinal());
    }

    private static double healthScore(AtomicInteger ordinal) {
        var health = RemoteHealth.values()[ordinal.get()];
        return switch (health) {
            case HEALTHY -> 1.0;
            case DEGRADED -> 0.5;
            case UNREACHABLE, DISABLED -> 0.0;
        };
    }

    private static String nullSafe(String value) {
        return value != null ? value : "unknown";
    }
}
