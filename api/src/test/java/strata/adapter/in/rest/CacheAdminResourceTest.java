package strata.adapter.in.rest;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.quarkiverse.resteasy.problem.HttpProblem;
import io.smallrye.mutiny.Uni;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import strata.adapter.in.dto.CacheQueryRequest;
import strata.adapter.in.dto.ClearCacheRequest;
import strata.adapter.in.dto.InvalidateDependenciesRequest;
import strata.adapter.in.dto.WarmUpEntryRequest;
import strata.core.model.CacheEntry;
import strata.core.model.CacheQuery;
import strata.core.model.CacheRecommendation;
import strata.core.model.CacheStatistics;
import strata.core.model.CacheTier;
import strata.core.model.CachedValue;
import strata.core.model.ClearCriteria;
import strata.core.model.EvictionReason;
import strata.core.model.RemoteHealthStatus;
import strata.core.model.WarmUpEntry;
import strata.core.port.in.CacheUseCase;

@ExtendWith(MockitoExtension.class)
@DisplayName("CacheAdminResource")
class CacheAdminResourceTest {

    @Mock
    private CacheUseCase cache;

    private CacheAdminResource resource;

    @BeforeEach
    void setUp() {
        resource = new CacheAdminResource(cache);
    }

    @Nested
    @DisplayName("Statistics")
    class Statistics {

        @Test
        @DisplayName("should expose counters per tier and eviction reason")
        void shouldExposeCounters() {
            var evictions = new EnumMap<EvictionReason, Long>(EvictionReason.class);
            evictions.put(EvictionReason.LRU, 4L);
            evictions.put(EvictionReason.EXPIRED, 1L);
            when(cache.getMetrics()).thenReturn(new CacheStatistics(
                    9, 3, 0.75, 5, 1, 2, 5, evictions,
                    Map.of(CacheTier.MEMORY, 12L, CacheTier.REMOTE, 40L),
                    2048, 4096, 7,
                    RemoteHealthStatus.disabled(),
                    new CacheStatistics.Latency(1.5, 9.0, 12)));

            var stats = resource.stats();

            assertEquals(9, stats.hits());
            assertEquals(0.75, stats.hitRate());
            assertEquals(12L, stats.entries().get("memory"));
            assertEquals(40L, stats.entries().get("remote"));
            assertEquals(0L, stats.entries().get("persistent"));
            assertEquals(5L, stats.evictions().get("total"));
            assertEquals(4L, stats.evictions().get("lru"));
            assertEquals(0L, stats.evictions().get("lfu"));
            assertEquals(4096, stats.memory().bytesBudget());
            assertEquals("disabled", stats.remote().state());
            assertEquals(12, stats.latency().samples());
        }

        @Test
        @DisplayName("should expose remote health")
        void shouldExposeRemoteHealth() {
            when(cache.remoteHealth()).thenReturn(RemoteHealthStatus.disabled());

            var health = resource.health();

            assertEquals("disabled", health.state());
            assertEquals(false, health.available());
        }
    }

    @Nested
    @DisplayName("Clearing")
    class Clearing {

        @Test
        @DisplayName("should clear everything when no body is sent")
        void shouldClearAllWithoutBody() {
            when(cache.clear(any())).thenReturn(Uni.createFrom().item(3));

            var response = resource.clear(null).await().indefinitely();

            assertEquals(200, response.getStatus());
            assertEquals(Map.of("cleared", 3), response.getEntity());
            verify(cache).clear(ClearCriteria.all());
        }

        @Test
        @DisplayName("should pass tier, pattern and tags through")
        void shouldTranslateRequest() {
            when(cache.clear(any())).thenReturn(Uni.createFrom().item(1));

            resource.clear(new ClearCacheRequest("redis", "car:*", List.of("bmw"))).await().indefinitely();

            var captor = ArgumentCaptor.forClass(ClearCriteria.class);
            verify(cache).clear(captor.capture());
            assertEquals(CacheTier.REMOTE, captor.getValue().tier());
            assertEquals("car:*", captor.getValue().pattern());
            assertEquals(Set.of("bmw"), captor.getValue().tags());
        }

        @Test
        @DisplayName("should reject unknown tiers")
        void shouldRejectUnknownTier() {
            assertThrows(IllegalArgumentException.class, () -> resource.clearTier("disk"));
            assertThrows(
                    IllegalArgumentException.class,
                    () -> resource.clear(new ClearCacheRequest("disk", null, null)));
            verify(cache, never()).clear(any());
        }

        @Test
        @DisplayName("should clear a single tier")
        void shouldClearTier() {
            when(cache.clear(any())).thenReturn(Uni.createFrom().item(2));

            var response = resource.clearTier("memory").await().indefinitely();

            assertEquals(Map.of("cleared", 2), response.getEntity());
            verify(cache).clear(ClearCriteria.tier(CacheTier.MEMORY));
        }
    }

    @Nested
    @DisplayName("Invalidation")
    class Invalidation {

        @Test
        @DisplayName("should invalidate dependencies")
        void shouldInvalidate() {
            when(cache.invalidateByDependencies(List.of("cars_table"))).thenReturn(Uni.createFrom().item(2));

            var response = resource.invalidate(new InvalidateDependenciesRequest(List.of("cars_table")))
                    .await()
                    .indefinitely();

            assertEquals(Map.of("invalidated", 2), response.getEntity());
        }

        @Test
        @DisplayName("should reject missing or blank dependencies")
        void shouldRejectInvalidRequests() {
            var missing = assertThrows(HttpProblem.class, () -> resource.invalidate(null));
            assertEquals(400, missing.getStatus().getStatusCode());
            assertThrows(HttpProblem.class, () -> resource.invalidate(new InvalidateDependenciesRequest(List.of())));
            assertThrows(
                    HttpProblem.class, () -> resource.invalidate(new InvalidateDependenciesRequest(List.of(" "))));
            verify(cache, never()).invalidateByDependencies(any());
        }
    }

    @Test
    @DisplayName("should list recommendations with lower-case severities")
    void shouldListRecommendations() {
        when(cache.recommendations()).thenReturn(List.of(new CacheRecommendation(
                "low-hit-rate", CacheRecommendation.Severity.WARNING, "Hit rate is 40.0%")));

        var recommendations = resource.optimize().get("recommendations");

        assertEquals(1, recommendations.size());
        assertEquals("low-hit-rate", recommendations.get(0).category());
        assertEquals("warning", recommendations.get(0).severity());
    }

    @Nested
    @DisplayName("Queries")
    class Queries {

        @Test
        @DisplayName("should translate filters and describe entries without payloads")
        void shouldTranslateQuery() {
            var created = Instant.parse("2024-01-01T00:00:00Z");
            var entry = new CacheEntry(
                    "car:bmw", CachedValue.json("{}"), created, 60, Set.of("car"), Set.of("cars_table"),
                    CacheTier.REMOTE);
            when(cache.query(any())).thenReturn(Uni.createFrom().item(List.of(entry)));

            var found = resource.query(new CacheQueryRequest("car:*", List.of("car"), "redis", 2L, 300L, 5))
                    .await()
                    .indefinitely();

            var captor = ArgumentCaptor.forClass(CacheQuery.class);
            verify(cache).query(captor.capture());
            assertEquals(new CacheQuery("car:*", Set.of("car"), CacheTier.REMOTE, 2L, 300L, 5), captor.getValue());
            assertEquals(1, found.size());
            assertEquals("remote", found.get(0).tier());
            assertEquals(CachedValue.JSON, found.get(0).type());
            assertEquals(created.plusSeconds(60), found.get(0).expiresAt());
        }

        @Test
        @DisplayName("should default to the first hundred entries of every tier")
        void shouldDefaultWithoutBody() {
            when(cache.query(any())).thenReturn(Uni.createFrom().item(List.of()));

            resource.query(null).await().indefinitely();

            verify(cache).query(CacheQuery.all());
        }

        @Test
        @DisplayName("should reject out-of-range limits")
        void shouldRejectInvalidLimit() {
            assertThrows(
                    IllegalArgumentException.class,
                    () -> resource.query(new CacheQueryRequest(null, null, null, null, null, 5_000)));
            verify(cache, never()).query(any());
        }
    }

    @Nested
    @DisplayName("Warm-up")
    class WarmUp {

        @Test
        @SuppressWarnings("unchecked")
        @DisplayName("should load valid entries and count invalid ones")
        void shouldWarmUp() {
            when(cache.warmUp(any())).thenReturn(Uni.createFrom().item(1));
            var valid = new WarmUpEntryRequest(
                    "config:theme", TextNode.valueOf("dark"), null, 300L, Set.of("config"), null);
            var badType = new WarmUpEntryRequest("config:size", IntNode.valueOf(3), "xml", null, null, null);

            var response = resource.warmUp(List.of(valid, badType)).await().indefinitely();

            assertEquals(Map.of("loaded", 1, "skipped", 1, "invalid", 1), response.getEntity());
            ArgumentCaptor<List<WarmUpEntry>> captor = ArgumentCaptor.forClass(List.class);
            verify(cache).warmUp(captor.capture());
            assertEquals(1, captor.getValue().size());
            assertEquals("dark", captor.getValue().get(0).value().asUtf8());
            assertEquals(CachedValue.TEXT, captor.getValue().get(0).value().typeTag());
        }

        @Test
        @DisplayName("should reject an empty request")
        void shouldRejectEmptyRequest() {
            var problem = assertThrows(HttpProblem.class, () -> resource.warmUp(List.of()));
            assertEquals(400, problem.getStatus().getStatusCode());
            verify(cache, never()).warmUp(any());
        }
    }

    @Test
    @DisplayName("should report whether a deleted key existed")
    void shouldDeleteKey() {
        when(cache.delete("user:1")).thenReturn(Uni.createFrom().item(false));

        var response = resource.deleteKey("user:1").await().indefinitely();

        assertEquals(200, response.getStatus());
        assertEquals(Map.of("key", "user:1", "deleted", false), response.getEntity());
    }
}
