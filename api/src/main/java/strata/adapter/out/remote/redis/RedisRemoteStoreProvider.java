package strata.adapter.out.remote.redis;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;

import strata.core.config.RemoteTierSettings;
import strata.core.port.out.RemoteStore;
import strata.spi.RemoteStoreProvider;
import strata.spi.RemoteTierException;

/**
 * Redis remote store provider.
 *
 * <p>Redis connection is configured via Quarkus Redis properties:
 * <ul>
 *   <li>quarkus.redis.hosts - Redis URL, or comma-separated seed nodes in cluster mode</li>
 *   <li>quarkus.redis.client-type - {@code standalone} or {@code cluster}</li>
 *   <li>quarkus.redis.password - Redis password (optional)</li>
 * </ul>
 */
@ApplicationScoped
public class RedisRemoteStoreProvider implements RemoteStoreProvider {

    private final Instance<ReactiveRedisDataSource> dataSource;

    @Inject
    public RedisRemoteStoreProvider(Instance<ReactiveRedisDataSource> dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public String name() {
        return "redis";
    }

    @Override
    public String description() {
        return "Redis standalone or cluster";
    }

    @Override
    public int priority() {
        return 10;
    }

    @Override
    public boolean isAvailable() {
        return dataSource.isResolvable();
    }

    @Override
    public RemoteStore connect(RemoteTierSettings settings) {
        try {
            return new RedisRemoteStore(dataSource.get());
        } catch (RuntimeException e) {
            throw new RemoteTierException("Failed to obtain Redis data source", e);
        }
    }
}
