package strata.adapter.out.telemetry;

import java.util.Comparator;
import java.util.List;
import java.util.ServiceLoader;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;

import org.jboss.logging.Logger;

import strata.core.port.out.CacheEventPublisher;
import strata.spi.CacheEvent;
import strata.spi.CacheEventHandler;

/**
 * Dispatches cache events to registered handlers.
 *
 * <p>Handlers are discovered via {@link ServiceLoader} and invoked in priority order
 * (highest priority first). Additional handlers can be registered with {@link #subscribe}.
 *
 * <p>Events are queued to a single daemon thread, so they are delivered in publication order
 * and never block the cache operation that produced them. When the queue is full the event
 * is dropped and counted.
 */
@ApplicationScoped
public class CacheEventDispatcher implements CacheEventPublisher {

    private static final Logger LOG = Logger.getLogger(CacheEventDispatcher.class);

    static final int DEFAULT_QUEUE_CAPACITY = 10_000;

    private final List<CacheEventHandler> handlers = new CopyOnWriteArrayList<>();
    private final AtomicLong dropped = new AtomicLong();
    private final ThreadPoolExecutor executor;

    public CacheEventDispatcher() {
        this(loadHandlers(), DEFAULT_QUEUE_CAPACITY);
    }

    public CacheEventDispatcher(List<CacheEventHandler> initialHandlers, int queueCapacity) {
        initialHandlers.stream().filter(CacheEventHandler::isAvailable).forEach(handlers::add);
        sortHandlers();
        this.executor = new ThreadPoolExecutor(
                1, 1, 0L, TimeUnit.MILLISECONDS, new LinkedBlockingQueue<>(queueCapacity), r -> {
                    var thread = new Thread(r, "strata-cache-events");
                    thread.setDaemon(true);
                    return thread;
                });

        if (handlers.isEmpty()) {
            LOG.debug("No cache event handlers found - events will be dropped");
        } else {
            LOG.infof(
                    "Loaded %d cache event handler(s): %s",
                    handlers.size(),
                    handlers.stream()
                            .map(h -> h.name() + "(priority=" + h.priority() + ")")
                            .toList());
        }
    }

    private static List<CacheEventHandler> loadHandlers() {
        return ServiceLoader.load(CacheEventHandler.class).stream()
                .map(ServiceLoader.Provider::get)
                .toList();
    }

    /**
     * Register a handler at runtime. Unavailable handlers are ignored.
     */
    public void subscribe(CacheEventHandler handler) {
        if (!handler.isAvailable()) {
            LOG.debugf("Ignoring unavailable cache event handler %s", handler.name());
            return;
        }
        handlers.add(handler);
        sortHandlers();
    }

    public void unsubscribe(CacheEventHandler handler) {
        handlers.remove(handler);
    }

    @Override
    public void publish(CacheEvent event) {
        if (handlers.isEmpty() || executor.isShutdown()) {
            return;
        }
        try {
            executor.execute(() -> deliver(event));
        } catch (RejectedExecutionException e) {
            long total = dropped.incrementAndGet();
            if (total == 1 || total % 1000 == 0) {
                LOG.warnf("Cache event queue full, dropped %d event(s) so far", total);
            }
        }
    }

    private void deliver(CacheEvent event) {
        for (var handler : handlers) {
            try {
                handler.handle(event);
            } catch (RuntimeException e) {
                LOG.warnf("Handler %s failed to process event: %s", handler.name(), e.getMessage());
            }
        }
    }

    /**
     * Stop accepting events and wait for queued ones to be delivered.
     */
    @PreDestroy
    public void shutdown() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(2, TimeUnit.SECONDS)) {
                LOG.warnf("Discarding %d undelivered cache event(s)", executor.getQueue().size());
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public List<CacheEventHandler> getHandlers() {
        return List.copyOf(handlers);
    }

    public long droppedEvents() {
        return dropped.get();
    }

    private synchronized void sortHandlers() {
        var sorted = handlers.stream()
                .sorted(Comparator.comparingInt(CacheEventHandler::priority).reversed())
                .toList();
        handlers.clear();
        handlers.addAll(sorted);
    }
}
