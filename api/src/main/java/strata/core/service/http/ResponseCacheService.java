package strata.core.service.http;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.function.Supplier;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import strata.core.config.CacheConfig;
import strata.core.config.ResponseCacheSettings;
import strata.core.model.CachedValue;
import strata.core.model.ClearCriteria;
import strata.core.model.GetOptions;
import strata.core.model.SetOptions;
import strata.core.model.SetResult;
import strata.core.model.http.CachedResponse;
import strata.core.model.http.RequestDescriptor;
import strata.core.model.http.ResponseCacheResult;
import strata.core.port.in.CacheUseCase;
import strata.core.service.KeyPatternMatcher;

/**
 * Caches whole HTTP responses in the cache engine, keyed by a request fingerprint.
 *
 * <p>Fingerprint: {@code http:{METHOD}:{path}:{query}:{principal}}, where the query is the
 * parameters sorted by name and joined as {@code k=v&k=v}, and the principal is
 * {@code anonymous} when the request is unauthenticated. Two requests differing only in
 * parameter order share a fingerprint. Parameter names and values, the path (except its
 * slashes) and the principal are percent-encoded, so no component can forge a separator.
 *
 * <p>Cache failures never fail the request: a broken lookup is a miss and a broken store is
 * logged. Engine calls are deferred, so synchronous argument and state checks become failed
 * {@link Uni}s.
 */
@ApplicationScoped
public class ResponseCacheService {

    private static final Logger LOG = Logger.getLogger(ResponseCacheService.class);

    static final String KEY_PREFIX = "http:";
    static final String RESPONSE_TAG = "http-response";
    private static final String ANONYMOUS = "anonymous";

    private final CacheUseCase cache;
    private final ResponseCachePolicy policy;
    private final ResponseCacheSettings settings;
    private final KeyPatternMatcher pathMatcher = new KeyPatternMatcher();

    @Inject
    public ResponseCacheService(CacheUseCase cache, CacheConfig config) {
        this(cache, ResponseCachePolicy.defaults(), ResponseCacheSettings.from(config.http()));
    }

    public ResponseCacheService(CacheUseCase cache, ResponseCachePolicy policy, ResponseCacheSettings settings) {
        this.cache = cache;
        this.policy = policy;
        this.settings = settings;
    }

    public boolean isEnabled() {
        return settings.enabled();
    }

    public ResponseCacheSettings settings() {
        return settings;
    }

    public ResponseCachePolicy policy() {
        return policy;
    }

    public String fingerprint(RequestDescriptor request) {
        var sorted = new TreeMap<String, List<String>>(request.query());
        var query = new StringBuilder();
        for (Map.Entry<String, List<String>> parameter : sorted.entrySet()) {
            var values = parameter.getValue() == null || parameter.getValue().isEmpty()
                    ? List.of("")
                    : parameter.getValue();
            for (String value : values) {
                if (query.length() > 0) {
                    query.append('&');
                }
                query.append(encode(parameter.getKey())).append('=').append(value == null ? "" : encode(value));
            }
        }
        var principal = request.isAnonymous() ? ANONYMOUS : encode(request.principal());
        return KEY_PREFIX + request.method() + ":" + encodePath(request.path()) + ":" + query + ":" + principal;
    }

    /**
     * Whether a path falls under the configured include globs and outside the exclude globs.
     */
    public boolean isPathCacheable(String path) {
        for (String glob : settings.exclude()) {
            if (pathMatcher.matches(glob, path)) {
                return false;
            }
        }
        for (String glob : settings.include()) {
            if (pathMatcher.matches(glob, path)) {
                return true;
            }
        }
        return false;
    }

    public Uni<Optional<CachedResponse>> lookup(RequestDescriptor request) {
        if (!policy.isCacheableRequest(request)) {
            return Uni.createFrom().item(Optional.empty());
        }
        var key = fingerprint(request);
        return Uni.createFrom()
                .deferred(() -> cache.get(key, GetOptions.defaults()))
                .map(hit -> hit.flatMap(found -> decode(key, found.value())))
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.warnf("Response cache lookup for %s failed: %s", key, error.getMessage());
                    return Optional.empty();
                });
    }

    /**
     * Store a response if the policy allows it.
     *
     * @return true if at least one tier accepted the response
     */
    public Uni<Boolean> store(RequestDescriptor request, CachedResponse response, Duration ttl) {
        if (!policy.isCacheableResponse(request, response)) {
            return Uni.createFrom().item(false);
        }
        var key = fingerprint(request);
        var effectiveTtl = ttl == null ? settings.ttl() : ttl;
        var options = SetOptions.ttl(effectiveTtl.toSeconds()).withTags(RESPONSE_TAG);
        return Uni.createFrom()
                .deferred(() -> cache.set(key, CachedResponseCodec.encode(response), options))
                .map(SetResult::stored)
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.warnf("Response cache store for %s failed: %s", key, error.getMessage());
                    return false;
                });
    }

    /**
     * Serve from the cache, or compute with {@code next} and store the result.
     */
    public Uni<ResponseCacheResult> handle(
            RequestDescriptor request, Duration ttl, Supplier<Uni<CachedResponse>> next) {
        var key = fingerprint(request);
        return lookup(request).flatMap(cached -> {
            if (cached.isPresent()) {
                return Uni.createFrom().item(new ResponseCacheResult(cached.get(), true, key));
            }
            return next.get().flatMap(response -> afterResponse(request, response, ttl)
                    .replaceWith(new ResponseCacheResult(response, false, key)));
        });
    }

    /**
     * Store a cacheable response, or invalidate the resource family after a successful write.
     */
    public Uni<Void> afterResponse(RequestDescriptor request, CachedResponse response, Duration ttl) {
        if (policy.isCacheableRequest(request)) {
            return store(request, response, ttl).replaceWithVoid();
        }
        if (settings.invalidateOnWrite() && response.isSuccessful()) {
            return invalidateResourceFamily(request.path()).replaceWithVoid();
        }
        return Uni.createFrom().voidItem();
    }

    /**
     * Remove cached responses whose fingerprint matches a glob.
     */
    public Uni<Integer> invalidatePattern(String glob) {
        return Uni.createFrom()
                .deferred(() -> cache.clear(ClearCriteria.pattern(glob)))
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.warnf("Response cache invalidation for %s failed: %s", glob, error.getMessage());
                    return 0;
                });
    }

    /**
     * Remove cached responses for a path and everything below it, for every method, query and
     * principal.
     */
    public Uni<Integer> invalidateResourceFamily(String path) {
        var glob = KEY_PREFIX + "*:" + escapeGlob(encodePath(path)) + "*";
        return invalidatePattern(glob).invoke(count -> {
            if (count > 0) {
                LOG.debugf("Invalidated %d cached response(s) under %s", count, path);
            }
        });
    }

    private static Optional<CachedResponse> decode(String key, CachedValue value) {
        try {
            return Optional.of(CachedResponseCodec.decode(value));
        } catch (IllegalArgumentException e) {
            LOG.debugf("Ignoring unreadable cached response %s: %s", key, e.getMessage());
            return Optional.empty();
        }
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    static String encodePath(String path) {
        return encode(path).replace("%2F", "/");
    }

    static String escapeGlob(String value) {
        var out = new StringBuilder(value.length() + 4);
        for (char c : value.toCharArray()) {
            if (c == '*' || c == '?' || c == '[' || c == ']' || c == '\\') {
                out.append('\\');
            }
            out.append(c);
        }
        return out.toString();
    }
}
