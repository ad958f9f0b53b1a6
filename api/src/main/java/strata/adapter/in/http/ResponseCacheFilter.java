package strata.adapter.in.http;

import java.nio.charset.StandardCharsets;
import java.util.Map;

import jakarta.inject.Inject;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.container.ContainerResponseContext;
import jakarta.ws.rs.core.Response;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;
import org.jboss.resteasy.reactive.server.ServerRequestFilter;
import org.jboss.resteasy.reactive.server.ServerResponseFilter;

import strata.core.model.http.CachedResponse;
import strata.core.model.http.RequestDescriptor;
import strata.core.service.http.ResponseCacheService;

/**
 * Reactive HTTP response cache for JAX-RS endpoints.
 *
 * <p>The request filter answers cacheable requests from the cache with {@code X-Cache: HIT}.
 * The response filter stores cacheable responses, tagging them {@code X-Cache: MISS}, and
 * after a successful write request invalidates cached reads of the same resource family.
 * Both headers carry the fingerprint in {@code X-Cache-Key}.
 */
public class ResponseCacheFilter {

    private static final Logger LOG = Logger.getLogger(ResponseCacheFilter.class);

    static final String CACHE_STATUS_HEADER = "X-Cache";
    static final String CACHE_KEY_HEADER = "X-Cache-Key";
    static final String DESCRIPTOR_PROPERTY = "strata.cache.request";
    static final String HIT_PROPERTY = "strata.cache.hit";

    private final ResponseCacheService responseCache;
    private final ObjectMapper objectMapper;

    @Inject
    public ResponseCacheFilter(ResponseCacheService responseCache, ObjectMapper objectMapper) {
        this.responseCache = responseCache;
        this.objectMapper = objectMapper;
    }

    @ServerRequestFilter
    public Uni<Response> lookup(ContainerRequestContext requestContext) {
        if (!responseCache.isEnabled()) {
            return Uni.createFrom().nullItem();
        }
        var path = normalize(requestContext.getUriInfo().getPath());
        if (!responseCache.isPathCacheable(path)) {
            return Uni.createFrom().nullItem();
        }

        var principal = requestContext.getSecurityContext() != null
                        && requestContext.getSecurityContext().getUserPrincipal() != null
                ? requestContext.getSecurityContext().getUserPrincipal().getName()
                : null;
        var descriptor = new RequestDescriptor(
                requestContext.getMethod(),
                path,
                requestContext.getUriInfo().getQueryParameters(),
                principal);
        requestContext.setProperty(DESCRIPTOR_PROPERTY, descriptor);

        return responseCache.lookup(descriptor).map(cached -> {
            if (cached.isEmpty()) {
                return null;
            }
            requestContext.setProperty(HIT_PROPERTY, Boolean.TRUE);
            return replay(cached.get(), responseCache.fingerprint(descriptor));
        });
    }

    @ServerResponseFilter
    public Uni<Void> store(ContainerRequestContext requestContext, ContainerResponseContext responseContext) {
        var descriptor = (RequestDescriptor) requestContext.getProperty(DESCRIPTOR_PROPERTY);
        if (descriptor == null || requestContext.getProperty(HIT_PROPERTY) != null) {
            return Uni.createFrom().voidItem();
        }

        var policy = responseCache.policy();
        if (!policy.isCacheableRequest(descriptor)) {
            var written = new CachedResponse(responseContext.getStatus(), null, null, Map.of());
            return responseCache.afterResponse(descriptor, written, null);
        }

        var captured = capture(responseContext);
        if (captured == null || !policy.isCacheableResponse(descriptor, captured)) {
            return Uni.createFrom().voidItem();
        }
        responseContext.getHeaders().putSingle(CACHE_STATUS_HEADER, "MISS");
        responseContext.getHeaders().putSingle(CACHE_KEY_HEADER, responseCache.fingerprint(descriptor));
        return responseCache.store(descriptor, captured, responseCache.settings().ttl()).replaceWithVoid();
    }

    private CachedResponse capture(ContainerResponseContext responseContext) {
        var entity = responseContext.getEntity();
        byte[] body;
        if (entity == null) {
            body = new byte[0];
        } else if (entity instanceof byte[] bytes) {
            body = bytes;
        } else if (entity instanceof String text) {
            body = text.getBytes(StandardCharsets.UTF_8);
        } else {
            try {
                body = objectMapper.writeValueAsBytes(entity);
            } catch (JsonProcessingException e) {
                LOG.debugf("Not caching response of type %s: %s", entity.getClass().getName(), e.getMessage());
                return null;
            }
        }
        var mediaType = responseContext.getMediaType();
        return new CachedResponse(
                responseContext.getStatus(), mediaType != null ? mediaType.toString() : null, body, Map.of());
    }

    static Response replay(CachedResponse cached, String fingerprint) {
        var builder = Response.status(cached.status()).entity(cached.body());
        if (cached.contentType() != null) {
            builder.type(cached.contentType());
        }
        cached.headers().forEach(builder::header);
        return builder.header(CACHE_STATUS_HEADER, "HIT")
                .header(CACHE_KEY_HEADER, fingerprint)
                .build();
    }

    private static String normalize(String path) {
        if (path == null || path.isEmpty()) {
            return "/";
        }
        return path.startsWith("/") ? path : "/" + path;
    }
}
