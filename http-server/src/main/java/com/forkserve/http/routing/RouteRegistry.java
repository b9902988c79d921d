package com.forkserve.http.routing;

import com.forkserve.http.HttpServer.Handler;
import com.forkserve.http.cache.LruCache;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Exact-match route table with a cache of URLs seen on the wire.
 *
 * Two tiers:
 * <ol>
 *   <li>observed-URL cache, keyed by {@code method:url} with the query string
 *       verbatim (bounded, LRU)</li>
 *   <li>canonical table, keyed by {@code method:path}</li>
 * </ol>
 * A canonical hit is remembered in the cache under the full URL, so each
 * distinct query string of one path takes its own cache entry.
 */
public final class RouteRegistry {

    private final Map<String, Handler> routes = new ConcurrentHashMap<>();
    private final LruCache<String, Handler> observed;

    public RouteRegistry(int cacheCapacity) {
        this.observed = new LruCache<>(cacheCapacity);
    }

    /**
     * Register a handler. Re-registering a key replaces the handler; URLs
     * already cached for the old handler keep resolving to it.
     */
    public void register(String method, String path, Handler handler) {
        Objects.requireNonNull(handler, "handler");
        routes.put(routeKey(method, path), handler);
    }

    /**
     * Resolve the handler for a request line.
     *
     * @param url path plus optional query string, as received
     */
    public Optional<Handler> resolve(String method, String url) {
        String cacheKey = routeKey(method, url);
        Optional<Handler> cached = observed.get(cacheKey);
        if (cached.isPresent()) {
            return cached;
        }

        Handler handler = routes.get(routeKey(method, pathOf(url)));
        if (handler == null) {
            return Optional.empty();
        }
        observed.put(cacheKey, handler);
        return Optional.of(handler);
    }

    public static String routeKey(String method, String pathOrUrl) {
        return method + ":" + pathOrUrl;
    }

    static String pathOf(String url) {
        int q = url.indexOf('?');
        return q < 0 ? url : url.substring(0, q);
    }

    public int size() {
        return routes.size();
    }

    public int cachedRoutes() {
        return observed.size();
    }
}
