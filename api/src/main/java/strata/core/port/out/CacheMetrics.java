package strata.core.port.out;

import strata.core.model.CacheTier;
import strata.core.model.EvictionReason;
import strata.core.model.RemoteHealth;

/**
 * Port for recording cache metrics.
 *
 * <p>Implementations handle the actual metric recording (e.g., Micrometer).
 */
public interface CacheMetrics {

    boolean isEnabled();

    void recordHit(CacheTier tier);

    void recordMiss();

    void recordSet(CacheTier tier, boolean success);

    void recordEviction(EvictionReason reason);

    /**
     * Record the latency of an engine operation.
     *
     * @param operation get, set, delete, clear or invalidate
     */
    void recordLatency(String operation, long latencyMs);

    /**
     * Record a remote call that exceeded its timeout.
     */
    void recordRemoteTimeout(String operation);

    /**
     * Record a remote call that failed for a reason other than a timeout.
     */
    void recordRemoteFailure(String operation, String errorType);

    void recordRemoteHealth(RemoteHealth health);

    static CacheMetrics noop() {
        return new CacheMetrics() {
            @Override
            public boolean isEnabled() {
                return false;
            }

            @Override
            public void recordHit(CacheTier tier) {}

            @Override
            public void recordMiss() {}

            @Override
            public void recordSet(CacheTier tier, boolean success) {}

            @Override
            public void recordEviction(EvictionReason reason) {}

            @Override
            public void recordLatency(String operation, long latencyMs) {}

            @Override
            public void recordRemoteTimeout(String operation) {}

            @Override
            public void recordRemoteFailure(String operation, String errorType) {}

            @Override
            public void recordRemoteHealth(RemoteHealth health) {}
        };
    }
}
