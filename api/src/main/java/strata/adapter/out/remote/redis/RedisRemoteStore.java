package strata.adapter.out.remote.redis;

import java.util.List;
import java.util.Optional;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import io.quarkus.redis.datasource.keys.KeyScanArgs;
import io.quarkus.redis.datasource.keys.ReactiveKeyCommands;
import io.quarkus.redis.datasource.value.ReactiveValueCommands;
import io.smallrye.mutiny.Uni;

import strata.core.port.out.RemoteStore;

/**
 * Redis implementation of the remote tier store.
 *
 * <p>Works against a standalone node or a cluster, as configured through the Quarkus Redis
 * client. In cluster mode the client follows redirects itself; {@code SCAN} and {@code DBSIZE}
 * only see the node the client routes them to.
 */
public class RedisRemoteStore implements RemoteStore {

    private static final long SCAN_BATCH = 500;

    private final ReactiveRedisDataSource dataSource;
    private final ReactiveValueCommands<String, String> valueCommands;
    private final ReactiveKeyCommands<String> keyCommands;

    public RedisRemoteStore(ReactiveRedisDataSource dataSource) {
        this.dataSource = dataSource;
        this.valueCommands = dataSource.value(String.class, String.class);
        this.keyCommands = dataSource.key(String.class);
    }

    @Override
    public String name() {
        return "redis";
    }

    @Override
    public Uni<Optional<String>> get(String key) {
        return valueCommands.get(key).map(Optional::ofNullable);
    }

    @Override
    public Uni<Void> set(String key, String value, long ttlSeconds) {
        if (ttlSeconds <= 0) {
            return valueCommands.set(key, value);
        }
        return valueCommands.setex(key, ttlSeconds, value);
    }

    @Override
    public Uni<Boolean> delete(String key) {
        return keyCommands.del(key).map(removed -> removed != null && removed > 0);
    }

    @Override
    public Uni<Long> deleteAll(List<String> keys) {
        if (keys.isEmpty()) {
            return Uni.createFrom().item(0L);
        }
        return keyCommands.del(keys.toArray(new String[0])).map(removed -> removed == null ? 0L : removed.longValue());
    }

    @Override
    public Uni<Void> ping() {
        return dataSource.execute("PING").replaceWithVoid();
    }

    @Override
    public Uni<List<String>> keys(String pattern) {
        return keyCommands.scan(new KeyScanArgs().match(pattern).count(SCAN_BATCH))
                .toMulti()
                .collect()
                .asList();
    }

    @Override
    public Uni<Long> size() {
        return dataSource.execute("DBSIZE").map(response -> response == null ? 0L : response.toLong());
    }

    @Override
    public Uni<Void> close() {
        // connections are owned by the Quarkus Redis client
        return Uni.createFrom().voidItem();
    }
}
