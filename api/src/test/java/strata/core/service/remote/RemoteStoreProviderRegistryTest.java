package strata.core.service.remote;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import strata.adapter.out.remote.memory.InMemoryRemoteStore;
import strata.core.config.RemoteTierSettings;
import strata.core.port.out.RemoteStore;
import strata.spi.RemoteStoreProvider;
import strata.spi.RemoteTierException;

@DisplayName("RemoteStoreProviderRegistry")
class RemoteStoreProviderRegistryTest {

    private static RemoteStoreProvider provider(String name, int priority, boolean available) {
        var store = new InMemoryRemoteStore(Clock.systemUTC());
        return new RemoteStoreProvider() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public int priority() {
                return priority;
            }

            @Override
            public boolean isAvailable() {
                return available;
            }

            @Override
            public RemoteStore connect(RemoteTierSettings settings) {
                return store;
            }
        };
    }

    private static RemoteTierSettings withProvider(String name) {
        var defaults = RemoteTierSettings.defaults();
        return new RemoteTierSettings(
                true,
                Optional.ofNullable(name),
                defaults.keyPrefix(),
                defaults.defaultTtl(),
                defaults.commandTimeout(),
                defaults.compression(),
                defaults.health(),
                defaults.reconnect());
    }

    @Test
    @DisplayName("should pick the highest priority available provider")
    void shouldPickHighestPriority() {
        var low = provider("memory", 0, true);
        var high = provider("redis", 10, true);
        var registry = new RemoteStoreProviderRegistry(List.of(low, high), RemoteTierSettings.defaults());

        assertSame(high, registry.getSelectedProvider());
    }

    @Test
    @DisplayName("should skip unavailable providers")
    void shouldSkipUnavailable() {
        var low = provider("memory", 0, true);
        var high = provider("redis", 10, false);
        var registry = new RemoteStoreProviderRegistry(List.of(low, high), RemoteTierSettings.defaults());

        assertSame(low, registry.getSelectedProvider());
        assertEquals(List.of(low), registry.getAvailableProviders());
    }

    @Test
    @DisplayName("should prefer the configured provider over priority")
    void shouldPreferConfigured() {
        var low = provider("memory", 0, true);
        var high = provider("redis", 10, true);
        var registry = new RemoteStoreProviderRegistry(List.of(low, high), withProvider("memory"));

        assertSame(low, registry.getSelectedProvider());
    }

    @Test
    @DisplayName("should fall back when the configured provider is missing")
    void shouldFallBackWhenConfiguredMissing() {
        var high = provider("redis", 10, true);
        var registry = new RemoteStoreProviderRegistry(List.of(high), withProvider("etcd"));

        assertSame(high, registry.getSelectedProvider());
    }

    @Test
    @DisplayName("should fail to connect when no provider is available")
    void shouldFailWithoutProviders() {
        var registry = new RemoteStoreProviderRegistry(List.of(), RemoteTierSettings.defaults());

        assertThrows(RemoteTierException.class, registry::connect);
    }

    @Test
    @DisplayName("should open stores through the selected provider")
    void shouldConnectThroughSelectedProvider() {
        var memory = provider("memory", 0, true);
        var registry = new RemoteStoreProviderRegistry(List.of(memory), RemoteTierSettings.defaults());

        assertEquals("memory", registry.connect().name());
    }
}
