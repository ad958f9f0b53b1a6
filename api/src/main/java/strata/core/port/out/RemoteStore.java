package strata.core.port.out;

import java.util.List;
import java.util.Optional;

import io.smallrye.mutiny.Uni;

/**
 * Port for a networked key-value store backing the remote tier.
 *
 * <p>Keys passed here are already namespaced. Implementations may fail their {@link Uni}s on
 * transport errors; timeouts and fail-open handling are applied by the caller.
 */
public interface RemoteStore {

    String name();

    Uni<Optional<String>> get(String key);

    /**
     * Store a value.
     *
     * @param ttlSeconds expiry in seconds; 0 stores without expiry
     */
    Uni<Void> set(String key, String value, long ttlSeconds);

    /**
     * @return true if the key existed
     */
    Uni<Boolean> delete(String key);

    /**
     * Delete many keys.
     *
     * @return number of keys that existed
     */
    Uni<Long> deleteAll(List<String> keys);

    Uni<Void> ping();

    /**
     * Keys matching a glob pattern.
     */
    Uni<List<String>> keys(String pattern);

    /**
     * Number of keys held by the store.
     */
    Uni<Long> size();

    /**
     * Release connections. The store is unusable afterwards.
     */
    Uni<Void> close();
}
