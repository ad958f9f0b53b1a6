package strata.adapter.in.rest;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import strata.adapter.in.dto.CacheEntryResponse;
import strata.adapter.in.dto.CacheQueryRequest;
import strata.adapter.in.dto.CacheStatsResponse;
import strata.adapter.in.dto.ClearCacheRequest;
import strata.adapter.in.dto.InvalidateDependenciesRequest;
import strata.adapter.in.dto.RecommendationResponse;
import strata.adapter.in.dto.RemoteHealthResponse;
import strata.adapter.in.dto.WarmUpEntryRequest;
import strata.adapter.in.problem.CacheProblem;
import strata.core.model.CacheTier;
import strata.core.model.CacheQuery;
import strata.core.model.ClearCriteria;
import strata.core.model.WarmUpEntry;
import strata.core.port.in.CacheUseCase;

/**
 * REST resource for cache administration.
 *
 * <p>Provides endpoints for:
 * <ul>
 *   <li>Reading statistics, remote tier health and tuning recommendations</li>
 *   <li>Querying live entries</li>
 *   <li>Clearing by tier, key pattern or tags</li>
 *   <li>Invalidating entries derived from upstream dependencies</li>
 *   <li>Warming the cache at runtime</li>
 *   <li>Deleting single keys</li>
 * </ul>
 */
@Path("/admin/cache")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
public class CacheAdminResource {

    private static final Logger LOG = Logger.getLogger(CacheAdminResource.class);

    private final CacheUseCase cache;

    @Inject
    public CacheAdminResource(CacheUseCase cache) {
        this.cache = cache;
    }

    @GET
    @Path("/stats")
    public CacheStatsResponse stats() {
        return CacheStatsResponse.from(cache.getMetrics());
    }

    @GET
    @Path("/health")
    public RemoteHealthResponse health() {
        return RemoteHealthResponse.from(cache.remoteHealth());
    }

    @GET
    @Path("/optimize")
    public Map<String, List<RecommendationResponse>> optimize() {
        var recommendations = cache.recommendations().stream()
                .map(RecommendationResponse::from)
                .toList();
        return Map.of("recommendations", recommendations);
    }

    /**
     * List live entries matching the request. Payloads are not returned.
     *
     * @param request filters; an absent body lists the first entries of every tier
     */
    @POST
    @Path("/query")
    @Consumes(MediaType.APPLICATION_JSON)
    public Uni<List<CacheEntryResponse>> query(CacheQueryRequest request) {
        var query = request == null ? CacheQuery.all() : request.toQuery();
        return cache.query(query).map(entries -> entries.stream()
                .map(CacheEntryResponse::from)
                .toList());
    }

    /**
     * Load entries into the cache. Invalid entries are skipped and reported.
     *
     * @return number of entries loaded and skipped
     */
    @POST
    @Path("/warmup")
    @Consumes(MediaType.APPLICATION_JSON)
    public Uni<Response> warmUp(List<WarmUpEntryRequest> request) {
        if (request == null || request.isEmpty()) {
            throw CacheProblem.badRequest("At least one warm-up entry is required");
        }
        var entries = new ArrayList<WarmUpEntry>(request.size());
        int skipped = 0;
        for (WarmUpEntryRequest item : request) {
            try {
                if (item == null) {
                    throw new IllegalArgumentException("missing key");
                }
                entries.add(item.toEntry());
            } catch (IllegalArgumentException e) {
                LOG.warnf("Skipping warm-up entry: %s", e.getMessage());
                skipped++;
            }
        }
        final int invalid = skipped;
        return cache.warmUp(entries).map(loaded -> {
            LOG.infof("Admin warm-up loaded %d of %d entries", loaded, request.size());
            return Response.ok(Map.of("loaded", loaded, "skipped", request.size() - loaded, "invalid", invalid))
                    .build();
        });
    }

    /**
     * Clear keys matching the request's tier, pattern and tags.
     *
     * @param request clear criteria; an absent body clears everything
     * @return number of distinct keys removed
     */
    @POST
    @Path("/clear")
    @Consumes(MediaType.APPLICATION_JSON)
    public Uni<Response> clear(ClearCacheRequest request) {
        var criteria = request == null ? ClearCriteria.all() : request.toCriteria();
        return clearWith(criteria);
    }

    @DELETE
    @Path("/tiers/{tier}")
    public Uni<Response> clearTier(@PathParam("tier") String tier) {
        return clearWith(ClearCriteria.tier(CacheTier.parse(tier)));
    }

    @DELETE
    public Uni<Response> clearAll() {
        return clearWith(ClearCriteria.all());
    }

    /**
     * Remove every entry derived from the given dependencies.
     *
     * @param request dependencies to invalidate
     * @return number of keys invalidated
     */
    @POST
    @Path("/invalidate")
    @Consumes(MediaType.APPLICATION_JSON)
    public Uni<Response> invalidate(InvalidateDependenciesRequest request) {
        if (request == null || request.dependencies() == null || request.dependencies().isEmpty()) {
            throw CacheProblem.badRequest("At least one dependency is required");
        }
        if (request.dependencies().stream().anyMatch(d -> d == null || d.isBlank())) {
            throw CacheProblem.badRequest("Dependencies must not be blank");
        }
        return cache.invalidateByDependencies(request.dependencies()).map(count -> {
            LOG.infof("Admin invalidated %d key(s) for dependencies %s", count, request.dependencies());
            return Response.ok(Map.of("invalidated", count)).build();
        });
    }

    @DELETE
    @Path("/keys/{key}")
    public Uni<Response> deleteKey(@PathParam("key") String key) {
        return cache.delete(key)
                .map(deleted -> Response.ok(Map.of("key", key, "deleted", deleted)).build());
    }

    private Uni<Response> clearWith(ClearCriteria criteria) {
        return cache.clear(criteria).map(count -> {
            LOG.infof("Admin cleared %d key(s) (tier=%s, pattern=%s, tags=%s)",
                    count, criteria.tier(), criteria.pattern(), criteria.tags());
            return Response.ok(Map.of("cleared", count)).build();
        });
    }
}
