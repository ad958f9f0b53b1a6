package strata.adapter.out.engine;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;

import io.quarkus.runtime.ShutdownEvent;
import io.quarkus.runtime.StartupEvent;
import org.jboss.logging.Logger;

import strata.core.config.CacheConfig;
import strata.core.service.CacheEngine;

/**
 * Starts the cache engine on application startup, loads the warm-up file if one is configured,
 * and drains the engine on shutdown.
 */
@ApplicationScoped
public class CacheLifecycle {

    private static final Logger LOG = Logger.getLogger(CacheLifecycle.class);

    private final CacheEngine engine;
    private final WarmUpLoader warmUpLoader;
    private final CacheConfig config;

    @Inject
    public CacheLifecycle(CacheEngine engine, WarmUpLoader warmUpLoader, CacheConfig config) {
        this.engine = engine;
        this.warmUpLoader = warmUpLoader;
        this.config = config;
    }

    void onStart(@Observes StartupEvent event) {
        engine.start();
        config.warmUp().file().ifPresent(this::warmUp);
    }

    void onStop(@Observes ShutdownEvent event) {
        engine.shutdown();
    }

    void warmUp(String file) {
        var entries = warmUpLoader.load(file);
        if (entries.isEmpty()) {
            return;
        }
        LOG.infof("Warming cache with %d entries from %s", entries.size(), file);
        engine.warmUp(entries)
                .subscribe()
                .with(
                        loaded -> LOG.debugf("Warm-up from %s finished: %d loaded", file, loaded),
                        e -> LOG.errorf(e, "Cache warm-up from %s failed", file));
    }
}
