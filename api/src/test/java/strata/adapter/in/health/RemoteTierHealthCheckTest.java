package strata.adapter.in.health;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.time.Instant;

import org.eclipse.microprofile.health.HealthCheckResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import strata.core.model.RemoteHealth;
import strata.core.model.RemoteHealthStatus;
import strata.core.port.in.CacheUseCase;

@DisplayName("RemoteTierHealthCheck")
class RemoteTierHealthCheckTest {

    private CacheUseCase cache;
    private RemoteTierHealthCheck healthCheck;

    @BeforeEach
    void setUp() {
        cache = mock(CacheUseCase.class);
        healthCheck = new RemoteTierHealthCheck(cache);
    }

    @Test
    @DisplayName("should report a healthy remote tier")
    void shouldReportHealthy() {
        when(cache.remoteHealth()).thenReturn(
                new RemoteHealthStatus(RemoteHealth.HEALTHY, 0, 5, 3, Instant.now(), 0, 42, null));

        HealthCheckResponse response = healthCheck.call();

        assertEquals(HealthCheckResponse.Status.UP, response.getStatus());
        assertEquals("remote-cache-tier", response.getName());
        var data = response.getData().orElseThrow();
        assertEquals("healthy", data.get("state"));
        assertEquals(3L, data.get("lastLatencyMs"));
        assertFalse(data.containsKey("lastError"));
    }

    @Test
    @DisplayName("should stay UP while the remote tier is unreachable")
    void shouldStayUpWhenUnreachable() {
        when(cache.remoteHealth()).thenReturn(
                new RemoteHealthStatus(RemoteHealth.UNREACHABLE, 3, 0, -1, Instant.now(), 2, 0, "Connection refused"));

        HealthCheckResponse response = healthCheck.call();

        assertEquals(HealthCheckResponse.Status.UP, response.getStatus());
        var data = response.getData().orElseThrow();
        assertEquals("unreachable", data.get("state"));
        assertEquals(3L, data.get("consecutiveFailures"));
        assertEquals(2L, data.get("reconnectAttempts"));
        assertEquals("Connection refused", data.get("lastError"));
    }

    @Test
    @DisplayName("should report a disabled remote tier")
    void shouldReportDisabled() {
        when(cache.remoteHealth()).thenReturn(RemoteHealthStatus.disabled());

        var data = healthCheck.call().getData().orElseThrow();

        assertEquals("disabled", data.get("state"));
        assertTrue(data.containsKey("reconnectAttempts"));
    }
}
