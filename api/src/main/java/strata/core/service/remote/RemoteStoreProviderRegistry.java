package strata.core.service.remote;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import strata.core.config.CacheConfig;
import strata.core.config.RemoteTierSettings;
import strata.core.port.out.RemoteStore;
import strata.core.port.out.RemoteStoreConnector;
import strata.spi.RemoteStoreProvider;
import strata.spi.RemoteTierException;

/**
 * Registry for remote store providers.
 *
 * <p>Discovers available providers via CDI and opens stores through the selected one.
 *
 * <p>Selection order:
 * <ol>
 *   <li>Configured provider ({@code strata.cache.remote.provider})</li>
 *   <li>Highest priority available provider</li>
 * </ol>
 */
@ApplicationScoped
public class RemoteStoreProviderRegistry implements RemoteStoreConnector {

    private static final Logger LOG = Logger.getLogger(RemoteStoreProviderRegistry.class);

    private final List<RemoteStoreProvider> providers;
    private final RemoteTierSettings settings;

    private RemoteStoreProvider selectedProvider;

    @Inject
    public RemoteStoreProviderRegistry(Instance<RemoteStoreProvider> providers, CacheConfig config) {
        this(providers.stream().toList(), RemoteTierSettings.from(config.remote()));
    }

    public RemoteStoreProviderRegistry(List<RemoteStoreProvider> providers, RemoteTierSettings settings) {
        this.providers = List.copyOf(providers);
        this.settings = settings;
    }

    @Override
    public RemoteStore connect() {
        return getSelectedProvider().connect(settings);
    }

    public synchronized RemoteStoreProvider getSelectedProvider() {
        if (selectedProvider == null) {
            selectedProvider = selectProvider();
        }
        return selectedProvider;
    }

    public List<RemoteStoreProvider> getAvailableProviders() {
        return providers.stream().filter(RemoteStoreProvider::isAvailable).toList();
    }

    private RemoteStoreProvider selectProvider() {
        List<RemoteStoreProvider> available = providers.stream()
                .filter(RemoteStoreProvider::isAvailable)
                .sorted(Comparator.comparingInt(RemoteStoreProvider::priority).reversed())
                .toList();

        LOG.debugf(
                "Available remote store providers: %s",
                available.stream().map(RemoteStoreProvider::name).toList());

        Optional<String> configuredName = settings.provider();
        if (configuredName.isPresent()) {
            var configured = available.stream()
                    .filter(p -> p.name().equals(configuredName.get()))
                    .findFirst();
            if (configured.isPresent()) {
                LOG.infof("Using configured remote store provider: %s", configuredName.get());
                return configured.get();
            }
            LOG.warnf("Configured remote store provider '%s' is not available, falling back", configuredName.get());
        }

        if (available.isEmpty()) {
            throw new RemoteTierException("No remote store providers available");
        }
        var provider = available.get(0);
        LOG.infof("Using remote store provider: %s (priority: %d)", provider.name(), provider.priority());
        return provider;
    }
}
