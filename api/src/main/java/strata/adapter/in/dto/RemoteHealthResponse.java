package strata.adapter.in.dto;

import java.time.Instant;

import strata.core.model.RemoteHealthStatus;

/**
 * DTO for remote tier health.
 *
 * @param state         {@code healthy}, {@code degraded}, {@code unreachable} or {@code disabled}
 * @param lastLatencyMs latency of the last successful ping, -1 if none yet
 * @param entryCount    remote key count observed by the last health check
 */
public record RemoteHealthResponse(
        String state,
        boolean available,
        int consecutiveFailures,
        int consecutiveSuccesses,
        long lastLatencyMs,
        Instant lastCheckedAt,
        int reconnectAttempts,
        long entryCount,
        String lastError) {

    public static RemoteHealthResponse from(RemoteHealthStatus status) {
        return new RemoteHealthResponse(
                status.state().name().toLowerCase(),
                status.state().acceptsTraffic(),
                status.consecutiveFailures(),
                status.consecutiveSuccesses(),
                status.lastLatencyMs(),
                status.lastCheckedAt(),
                status.reconnectAttempts(),
                status.entryCount(),
                status.lastError());
    }
}
