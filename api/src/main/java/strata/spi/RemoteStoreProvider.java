package strata.spi;

import strata.core.config.RemoteTierSettings;
import strata.core.port.out.RemoteStore;

/**
 * SPI for remote tier backends.
 *
 * <p>Providers are CDI beans. The registry selects the provider named by
 * {@code strata.cache.remote.provider}, or the available provider with the highest priority.
 *
 * <p>Built-in providers:
 * <ul>
 *   <li>{@code redis} - Redis standalone or cluster via the Quarkus Redis client (priority 10)</li>
 *   <li>{@code memory} - process-local map for development and tests (priority 0)</li>
 * </ul>
 */
public interface RemoteStoreProvider {

    String name();

    default String description() {
        return name() + " remote store";
    }

    default int priority() {
        return 0;
    }

    default boolean isAvailable() {
        return true;
    }

    /**
     * Open a store. Called again on every reconnect attempt.
     *
     * @throws RemoteTierException if the backend cannot be reached
     */
    RemoteStore connect(RemoteTierSettings settings);
}
