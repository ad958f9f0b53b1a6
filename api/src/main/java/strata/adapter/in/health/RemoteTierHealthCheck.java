package strata.adapter.in.health;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.HealthCheckResponseBuilder;
import org.eclipse.microprofile.health.Readiness;

import strata.core.port.in.CacheUseCase;

/**
 * Readiness check reporting the remote cache tier's connectivity.
 *
 * <p>Always UP. The cache keeps serving from the memory tier while the remote tier is
 * unreachable, so an outage is reported in the check's data and through metrics rather than by
 * taking the instance out of rotation.
 */
@Readiness
@ApplicationScoped
public class RemoteTierHealthCheck implements HealthCheck {

    static final String NAME = "remote-cache-tier";

    private final CacheUseCase cache;

    @Inject
    public RemoteTierHealthCheck(CacheUseCase cache) {
        this.cache = cache;
    }

    @Override
    public HealthCheckResponse call() {
        var status = cache.remoteHealth();
        HealthCheckResponseBuilder builder = HealthCheckResponse.builder().name(NAME);
        builder.withData("state", status.state().name().toLowerCase());
        builder.withData("consecutiveFailures", status.consecutiveFailures());
        builder.withData("lastLatencyMs", status.lastLatencyMs());
        builder.withData("reconnectAttempts", status.reconnectAttempts());
        if (status.lastError() != null) {
            builder.withData("lastError", status.lastError());
        }
        return builder.up().build();
    }
}
