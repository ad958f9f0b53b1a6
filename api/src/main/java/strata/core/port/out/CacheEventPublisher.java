package strata.core.port.out;

import strata.spi.CacheEvent;

/**
 * Port for publishing cache events to observers. Publishing never blocks the caller.
 */
@FunctionalInterface
public interface CacheEventPublisher {

    void publish(CacheEvent event);

    static CacheEventPublisher noop() {
        return event -> {};
    }
}
