package strata.adapter.out.engine;

import java.time.Clock;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;

import org.jboss.logging.Logger;

import strata.core.cache.MemoryTierStore;
import strata.core.config.CacheConfig;
import strata.core.config.EngineSettings;
import strata.core.port.out.CacheEventPublisher;
import strata.core.port.out.CacheMetrics;
import strata.core.port.out.PersistentTier;
import strata.core.service.CacheEngine;
import strata.core.service.remote.RemoteStoreProviderRegistry;

/**
 * CDI producer for the cache engine.
 *
 * <p>Builds the single engine instance from configuration. Disabled tiers are left out; the
 * remote tier is reached through the {@link RemoteStoreProviderRegistry}, which selects a
 * {@link strata.spi.RemoteStoreProvider} on connect.
 *
 * <p>Starting and stopping the engine is handled by {@link CacheLifecycle}.
 */
@ApplicationScoped
public class CacheEngineProducer {

    private static final Logger LOG = Logger.getLogger(CacheEngineProducer.class);

    private final CacheConfig config;
    private final RemoteStoreProviderRegistry registry;
    private final CacheMetrics metrics;
    private final CacheEventPublisher events;

    @Inject
    public CacheEngineProducer(
            CacheConfig config,
            RemoteStoreProviderRegistry registry,
            CacheMetrics metrics,
            CacheEventPublisher events) {
        this.config = config;
        this.registry = registry;
        this.metrics = metrics;
        this.events = events;
    }

    @Produces
    @Singleton
    public CacheEngine cacheEngine() {
        var settings = EngineSettings.from(config);
        var clock = Clock.systemUTC();
        var memory = settings.memory().enabled() ? new MemoryTierStore(settings.memory(), clock) : null;
        var connector = settings.remote().enabled() ? registry : null;

        LOG.infof(
                "Creating cache engine (memory=%s, remote=%s, readThrough=%s)",
                memory != null, connector != null, settings.readThrough());
        return new CacheEngine(settings, memory, connector, PersistentTier.none(), metrics, events, clock);
    }
}
