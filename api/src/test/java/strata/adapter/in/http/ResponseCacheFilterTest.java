package strata.adapter.in.http;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.nio.charset.StandardCharsets;
import java.security.Principal;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.container.ContainerResponseContext;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.MultivaluedHashMap;
import jakarta.ws.rs.core.MultivaluedMap;
import jakarta.ws.rs.core.SecurityContext;
import jakarta.ws.rs.core.UriInfo;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import strata.core.cache.LruEvictionPolicy;
import strata.core.cache.MemoryTierStore;
import strata.core.config.EngineSettings;
import strata.core.config.ResponseCacheSettings;
import strata.core.model.http.CachedResponse;
import strata.core.port.out.CacheEventPublisher;
import strata.core.port.out.CacheMetrics;
import strata.core.port.out.PersistentTier;
import strata.core.service.CacheEngine;
import strata.core.service.http.ResponseCachePolicy;
import strata.core.service.http.ResponseCacheService;
import strata.support.MutableClock;

@DisplayName("ResponseCacheFilter")
class ResponseCacheFilterTest {

    private CacheEngine engine;
    private ResponseCacheFilter filter;

    @BeforeEach
    void setUp() {
        var clock = MutableClock.startingAt("2024-01-01T00:00:00Z");
        engine = new CacheEngine(
                EngineSettings.defaults(),
                new MemoryTierStore(1_000_000, 1_000, new LruEvictionPolicy(), clock),
                null,
                PersistentTier.none(),
                CacheMetrics.noop(),
                CacheEventPublisher.noop(),
                clock);
        filter = filterWith(ResponseCacheSettings.defaults());
    }

    @AfterEach
    void tearDown() {
        engine.shutdown(Duration.ofSeconds(1));
    }

    private ResponseCacheFilter filterWith(ResponseCacheSettings settings) {
        var service = new ResponseCacheService(engine, ResponseCachePolicy.defaults(), settings);
        return new ResponseCacheFilter(service, new ObjectMapper());
    }

    private static ContainerRequestContext request(String method, String path, String user) {
        var context = mock(ContainerRequestContext.class);
        var uriInfo = mock(UriInfo.class);
        var properties = new HashMap<String, Object>();
        when(context.getMethod()).thenReturn(method);
        when(context.getUriInfo()).thenReturn(uriInfo);
        when(uriInfo.getPath()).thenReturn(path);
        when(uriInfo.getQueryParameters()).thenReturn(new MultivaluedHashMap<>());
        if (user != null) {
            var security = mock(SecurityContext.class);
            Principal principal = () -> user;
            when(security.getUserPrincipal()).thenReturn(principal);
            when(context.getSecurityContext()).thenReturn(security);
        }
        doAnswer(invocation -> properties.put(invocation.getArgument(0), invocation.getArgument(1)))
                .when(context)
                .setProperty(anyString(), any());
        when(context.getProperty(anyString())).thenAnswer(invocation -> properties.get(invocation.getArgument(0)));
        return context;
    }

    private static ContainerResponseContext response(int status, Object entity, MultivaluedMap<String, Object> headers) {
        var context = mock(ContainerResponseContext.class);
        when(context.getStatus()).thenReturn(status);
        when(context.getEntity()).thenReturn(entity);
        when(context.getMediaType()).thenReturn(MediaType.APPLICATION_JSON_TYPE);
        when(context.getHeaders()).thenReturn(headers);
        return context;
    }

    private void serve(String method, String path, String user, int status, Object entity) {
        var request = request(method, path, user);
        assertNull(filter.lookup(request).await().indefinitely());
        filter.store(request, response(status, entity, new MultivaluedHashMap<>())).await().indefinitely();
    }

    @Nested
    @DisplayName("Cacheable requests")
    class CacheableRequests {

        @Test
        @DisplayName("should tag the first response MISS and replay it as a HIT")
        void shouldReplayStoredResponse() {
            var first = request("GET", "/cars", null);
            assertNull(filter.lookup(first).await().indefinitely());
            var headers = new MultivaluedHashMap<String, Object>();
            filter.store(first, response(200, "[\"bmw\"]", headers)).await().indefinitely();

            assertEquals("MISS", headers.getFirst(ResponseCacheFilter.CACHE_STATUS_HEADER));
            assertEquals("http:GET:/cars::anonymous", headers.getFirst(ResponseCacheFilter.CACHE_KEY_HEADER));

            var replayed = filter.lookup(request("GET", "/cars", null)).await().indefinitely();

            assertNotNull(replayed);
            assertEquals(200, replayed.getStatus());
            assertEquals("HIT", replayed.getHeaderString(ResponseCacheFilter.CACHE_STATUS_HEADER));
            assertEquals("http:GET:/cars::anonymous", replayed.getHeaderString(ResponseCacheFilter.CACHE_KEY_HEADER));
            assertArrayEquals("[\"bmw\"]".getBytes(StandardCharsets.UTF_8), (byte[]) replayed.getEntity());
        }

        @Test
        @DisplayName("should serialize entity objects with Jackson")
        void shouldSerializeEntities() {
            serve("GET", "/cars/1", null, 200, Map.of("model", "330i"));

            var replayed = filter.lookup(request("GET", "/cars/1", null)).await().indefinitely();

            assertEquals("{\"model\":\"330i\"}", new String((byte[]) replayed.getEntity(), StandardCharsets.UTF_8));
        }

        @Test
        @DisplayName("should keep responses of different users apart")
        void shouldSeparateUsers() {
            serve("GET", "/me", "alice", 200, "alice");

            assertNull(filter.lookup(request("GET", "/me", "bob")).await().indefinitely());
            assertNotNull(filter.lookup(request("GET", "/me", "alice")).await().indefinitely());
        }

        @Test
        @DisplayName("should not store a replayed response again")
        void shouldSkipStoreOnHit() {
            serve("GET", "/cars", null, 200, "[]");
            var hit = request("GET", "/cars", null);
            assertNotNull(filter.lookup(hit).await().indefinitely());

            var headers = new MultivaluedHashMap<String, Object>();
            filter.store(hit, response(200, "[]", headers)).await().indefinitely();

            assertTrue(headers.isEmpty());
        }

        @Test
        @DisplayName("should not store error responses")
        void shouldNotStoreErrors() {
            serve("GET", "/cars", null, 503, "down");

            assertNull(filter.lookup(request("GET", "/cars", null)).await().indefinitely());
        }
    }

    @Nested
    @DisplayName("Bypassed requests")
    class BypassedRequests {

        @Test
        @DisplayName("should ignore excluded paths")
        void shouldIgnoreExcludedPaths() {
            var admin = request("GET", "/admin/cache/stats", null);
            assertNull(filter.lookup(admin).await().indefinitely());

            var headers = new MultivaluedHashMap<String, Object>();
            filter.store(admin, response(200, "{}", headers)).await().indefinitely();

            assertTrue(headers.isEmpty());
            assertNull(admin.getProperty(ResponseCacheFilter.DESCRIPTOR_PROPERTY));
        }

        @Test
        @DisplayName("should do nothing when disabled")
        void shouldDoNothingWhenDisabled() {
            filter = filterWith(new ResponseCacheSettings(false, Duration.ofMinutes(5), List.of("/**"), List.of(), true));

            serve("GET", "/cars", null, 200, "[]");

            assertNull(filter.lookup(request("GET", "/cars", null)).await().indefinitely());
        }

        @Test
        @DisplayName("should invalidate cached reads after a successful write")
        void shouldInvalidateAfterWrite() {
            serve("GET", "/cars", null, 200, "[]");
            serve("GET", "/cars/7", null, 200, "{}");

            serve("POST", "/cars", null, 201, "{}");

            assertNull(filter.lookup(request("GET", "/cars", null)).await().indefinitely());
            assertNull(filter.lookup(request("GET", "/cars/7", null)).await().indefinitely());
        }
    }

    @Test
    @DisplayName("replay should carry stored headers and content type")
    void replayShouldCarryHeaders() {
        var cached = new CachedResponse(200, "text/plain", "hi".getBytes(StandardCharsets.UTF_8), Map.of("ETag", "\"1\""));

        var response = ResponseCacheFilter.replay(cached, "http:GET:/x::anonymous");

        assertEquals("\"1\"", response.getHeaderString("ETag"));
        assertEquals("text/plain", response.getMediaType().toString());
    }
}
