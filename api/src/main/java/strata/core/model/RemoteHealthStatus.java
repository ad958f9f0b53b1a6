package strata.core.model;

import java.time.Instant;

/**
 * Point-in-time view of the remote tier's health monitor.
 */
public record RemoteHealthStatus(
        RemoteHealth state,
        int consecutiveFailures,
        int consecutiveSuccesses,
        long lastLatencyMs,
        Instant lastCheckedAt,
        int reconnectAttempts,
        long entryCount,
        String lastError) {

    public static RemoteHealthStatus disabled() {
        return new RemoteHealthStatus(RemoteHealth.DISABLED, 0, 0, -1, null, 0, 0, null);
    }
}
