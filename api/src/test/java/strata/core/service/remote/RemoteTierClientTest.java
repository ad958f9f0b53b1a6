package strata.core.service.remote;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

import io.smallrye.mutiny.Uni;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import strata.adapter.out.remote.memory.InMemoryRemoteStore;
import strata.core.config.RemoteTierSettings;
import strata.core.config.RemoteTierSettings.HealthSettings;
import strata.core.config.RemoteTierSettings.ReconnectSettings;
import strata.core.model.CacheEntry;
import strata.core.model.CacheTier;
import strata.core.model.CachedValue;
import strata.core.model.RemoteHealth;
import strata.core.port.out.CacheMetrics;
import strata.core.port.out.RemoteStore;
import strata.spi.CacheEvent;
import strata.spi.RemoteTierException;
import strata.support.MutableClock;

@DisplayName("RemoteTierClient")
class RemoteTierClientTest {

    private MutableClock clock;
    private InMemoryRemoteStore store;
    private List<CacheEvent> events;
    private RemoteTierSettings settings;
    private RemoteTierClient client;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-01-01T00:00:00Z");
        store = new InMemoryRemoteStore(clock);
        events = new CopyOnWriteArrayList<>();
        settings = RemoteTierSettings.defaults()
                .withCommandTimeout(Duration.ofMillis(100))
                .withHealth(new HealthSettings(Duration.ofSeconds(30), Duration.ofMillis(200), 3, 2))
                .withReconnect(new ReconnectSettings(Duration.ofSeconds(1), 2.0, Duration.ofSeconds(30), 3));
        client = new RemoteTierClient(() -> store, settings, CacheMetrics.noop(), events::add, clock);
    }

    @AfterEach
    void tearDown() {
        client.shutdown(Duration.ofMillis(100));
    }

    private CacheEntry entry(String key, String text, long ttl) {
        return new CacheEntry(
                key, CachedValue.text(text), clock.instant(), ttl, Set.of("t"), Set.of("d"), CacheTier.REMOTE);
    }

    private <T extends CacheEvent> List<T> eventsOf(Class<T> type) {
        return events.stream().filter(type::isInstance).map(type::cast).toList();
    }

    @Nested
    @DisplayName("Data operations")
    class DataOperations {

        @BeforeEach
        void connect() {
            client.connect();
        }

        @Test
        @DisplayName("should round trip an entry with its labels")
        void shouldRoundTripEntry() {
            assertTrue(client.set(entry("car:1", "bmw", 60)).await().indefinitely());

            var found = client.get("car:1").await().indefinitely().orElseThrow();

            assertEquals("bmw", found.value().asUtf8());
            assertEquals(Set.of("t"), found.tags());
            assertEquals(Set.of("d"), found.dependencies());
            assertEquals(60, found.ttlSeconds());
        }

        @Test
        @DisplayName("should namespace keys with the configured prefix")
        void shouldNamespaceKeys() {
            client.set(entry("car:1", "bmw", 60)).await().indefinitely();

            assertTrue(store.get("strata:car:1").await().indefinitely().isPresent());
            assertEquals(List.of("car:1"), client.keys("car:*").await().indefinitely());
        }

        @Test
        @DisplayName("should treat an entry past its TTL as a miss")
        void shouldTreatExpiredEntryAsMiss() {
            client.set(entry("k", "v", 10)).await().indefinitely();

            clock.advanceSeconds(11);

            assertTrue(client.get("k").await().indefinitely().isEmpty());
        }

        @Test
        @DisplayName("should report deletes of absent keys as false")
        void shouldReportDeleteOfAbsentKey() {
            client.set(entry("k", "v", 60)).await().indefinitely();

            assertTrue(client.delete("k").await().indefinitely());
            assertFalse(client.delete("k").await().indefinitely());
        }

        @Test
        @DisplayName("should count keys removed in bulk")
        void shouldCountBulkDeletes() {
            client.set(entry("a", "1", 60)).await().indefinitely();
            client.set(entry("b", "2", 60)).await().indefinitely();

            assertEquals(2L, client.deleteAll(List.of("a", "b", "c")).await().indefinitely());
        }

        @Test
        @DisplayName("should list decoded entries under a pattern, skipping unreadable ones")
        void shouldListEntries() {
            client.set(entry("car:1", "bmw", 60)).await().indefinitely();
            client.set(entry("car:2", "audi", 60)).await().indefinitely();
            client.set(entry("user:1", "ada", 60)).await().indefinitely();
            store.set("strata:car:broken", "garbage", 60).await().indefinitely();

            var found = client.entries("car:*").await().indefinitely();

            assertEquals(Set.of("car:1", "car:2"), Set.copyOf(found.stream().map(CacheEntry::key).toList()));
            assertTrue(found.stream().allMatch(e -> e.dependencies().equals(Set.of("d"))));
        }

        @Test
        @DisplayName("should discard undecodable values as misses")
        void shouldDiscardUndecodableValues() {
            store.set("strata:k", "garbage", 60).await().indefinitely();

            assertTrue(client.get("k").await().indefinitely().isEmpty());
            assertEquals(1, eventsOf(CacheEvent.Error.class).size());
        }

        @Test
        @DisplayName("should turn store failures into misses and false writes")
        void shouldFailOpen() {
            store.setOnline(false);

            assertTrue(client.get("k").await().indefinitely().isEmpty());
            assertFalse(client.set(entry("k", "v", 60)).await().indefinitely());
            assertFalse(client.delete("k").await().indefinitely());
            assertEquals(List.of(), client.keys("*").await().indefinitely());
            assertEquals(4, eventsOf(CacheEvent.Error.class).size());
        }
    }

    @Nested
    @DisplayName("Timeouts")
    class Timeouts {

        @Test
        @DisplayName("should treat a read that exceeds the command timeout as a miss")
        void shouldTreatTimeoutAsMiss() {
            RemoteStore slow = mock(RemoteStore.class);
            when(slow.name()).thenReturn("slow");
            when(slow.ping()).thenReturn(Uni.createFrom().voidItem());
            when(slow.get(anyString())).thenReturn(Uni.createFrom().nothing());
            var slowClient = new RemoteTierClient(() -> slow, settings, CacheMetrics.noop(), events::add, clock);
            slowClient.connect();

            long start = System.nanoTime();
            var result = slowClient.get("k").await().indefinitely();
            long elapsedMs = Duration.ofNanos(System.nanoTime() - start).toMillis();

            assertTrue(result.isEmpty());
            assertTrue(elapsedMs < 2_000, "read should give up near the command timeout");
            assertEquals("get", eventsOf(CacheEvent.Error.class).get(0).operation());
        }
    }

    @Nested
    @DisplayName("Health monitoring")
    class HealthMonitoring {

        @Test
        @DisplayName("should start unreachable and become healthy on connect")
        void shouldBecomeHealthyOnConnect() {
            assertEquals(RemoteHealth.UNREACHABLE, client.health());

            client.connect();

            assertEquals(RemoteHealth.HEALTHY, client.health());
            assertTrue(client.isAvailable());
        }

        @Test
        @DisplayName("connect should fail when the store does not answer")
        void connectShouldFailWhenStoreIsDown() {
            store.setOnline(false);

            assertThrows(RemoteTierException.class, () -> client.connect());
            assertEquals(RemoteHealth.UNREACHABLE, client.health());
        }

        @Test
        @DisplayName("a single failed check should not change a healthy tier")
        void singleFailureShouldNotChangeState() {
            client.connect();
            store.setOnline(false);

            client.runHealthCheck();

            assertEquals(RemoteHealth.HEALTHY, client.health());
            assertEquals(1, client.status().consecutiveFailures());
        }

        @Test
        @DisplayName("should become unreachable after the failure threshold")
        void shouldBecomeUnreachableAfterThreshold() {
            client.connect();
            store.setOnline(false);

            client.runHealthCheck();
            client.runHealthCheck();
            client.runHealthCheck();

            assertEquals(RemoteHealth.UNREACHABLE, client.health());
            var change = eventsOf(CacheEvent.RemoteHealthChanged.class);
            assertEquals(RemoteHealth.UNREACHABLE, change.get(change.size() - 1).current());
        }

        @Test
        @DisplayName("should short-circuit data operations while unreachable")
        void shouldShortCircuitWhileUnreachable() {
            client.connect();
            client.set(entry("k", "v", 60)).await().indefinitely();
            store.setOnline(false);
            for (int i = 0; i < 3; i++) {
                client.runHealthCheck();
            }
            store.setOnline(true);

            assertTrue(client.get("k").await().indefinitely().isEmpty());
            assertFalse(client.set(entry("k", "v2", 60)).await().indefinitely());
        }

        @Test
        @DisplayName("should refresh the remote key count on each check")
        void shouldRefreshKeyCount() {
            client.connect();
            client.set(entry("a", "1", 60)).await().indefinitely();
            client.set(entry("b", "2", 60)).await().indefinitely();

            client.runHealthCheck();

            assertEquals(2, client.entryCount());
            assertTrue(client.status().lastLatencyMs() >= 0);
        }
    }

    @Nested
    @DisplayName("Reconnect")
    class Reconnect {

        private void makeUnreachable() {
            client.connect();
            store.setOnline(false);
            for (int i = 0; i < 3; i++) {
                client.runHealthCheck();
            }
        }

        @Test
        @DisplayName("should come back degraded and recover after enough successful checks")
        void shouldRecoverThroughDegraded() {
            makeUnreachable();
            store.setOnline(true);

            assertTrue(client.attemptReconnect());

            assertEquals(RemoteHealth.DEGRADED, client.health());
            assertTrue(client.isAvailable());
            assertEquals(1, eventsOf(CacheEvent.Reconnected.class).size());

            client.runHealthCheck();

            assertEquals(RemoteHealth.HEALTHY, client.health());
        }

        @Test
        @DisplayName("should back off exponentially up to the maximum delay")
        void shouldBackOffExponentially() {
            makeUnreachable();

            assertEquals(Duration.ofSeconds(1), client.nextReconnectDelay());
            client.attemptReconnect();
            assertEquals(Duration.ofSeconds(2), client.nextReconnectDelay());
            client.attemptReconnect();
            assertEquals(Duration.ofSeconds(4), client.nextReconnectDelay());
            client.attemptReconnect();
            assertEquals(Duration.ofSeconds(30), client.nextReconnectDelay());
        }

        @Test
        @DisplayName("should report exhaustion once and keep retrying")
        void shouldReportExhaustionOnce() {
            makeUnreachable();

            for (int i = 0; i < 5; i++) {
                assertFalse(client.attemptReconnect());
            }

            var exhausted = eventsOf(CacheEvent.ReconnectExhausted.class);
            assertEquals(1, exhausted.size());
            assertEquals(3, exhausted.get(0).attempts());
            assertEquals(CacheEvent.Severity.CRITICAL, exhausted.get(0).severity());

            store.setOnline(true);
            assertTrue(client.attemptReconnect());
            assertEquals(0, client.status().reconnectAttempts());
        }
    }
}
