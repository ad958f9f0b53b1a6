package strata.adapter.out.remote.memory;

import java.time.Clock;

import jakarta.enterprise.context.ApplicationScoped;

import strata.core.config.RemoteTierSettings;
import strata.core.port.out.RemoteStore;
import strata.spi.RemoteStoreProvider;

/**
 * In-memory remote store provider, always available as the lowest-priority fallback.
 *
 * <p>All connects share one store, so data outlives reconnects as it would on a real server.
 */
@ApplicationScoped
public class InMemoryRemoteStoreProvider implements RemoteStoreProvider {

    private final InMemoryRemoteStore store = new InMemoryRemoteStore(Clock.systemUTC());

    @Override
    public String name() {
        return "memory";
    }

    @Override
    public String description() {
        return "Process-local store for development and testing";
    }

    @Override
    public int priority() {
        return 0;
    }

    @Override
    public RemoteStore connect(RemoteTierSettings settings) {
        return store;
    }
}
