package com.forkserve.http.routing;

import com.forkserve.http.HttpServer.Handler;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;

class RouteRegistryTest {

    private final Handler health = (req, res) -> CompletableFuture.completedFuture(null);
    private final Handler other = (req, res) -> CompletableFuture.completedFuture(null);

    @Test
    void resolvesExactMethodAndPath() {
        RouteRegistry routes = new RouteRegistry(100);
        routes.register("GET", "/health", health);

        assertThat(routes.resolve("GET", "/health")).containsSame(health);
        assertThat(routes.resolve("POST", "/health")).isEmpty();
        assertThat(routes.resolve("GET", "/health/")).isEmpty();
        assertThat(routes.resolve("GET", "/HEALTH")).isEmpty();
    }

    @Test
    void queryStringIsIgnoredForMatchingButCachedPerUrl() {
        RouteRegistry routes = new RouteRegistry(100);
        routes.register("GET", "/items", health);

        assertThat(routes.resolve("GET", "/items?page=1")).containsSame(health);
        assertThat(routes.resolve("GET", "/items?page=2")).containsSame(health);
        assertThat(routes.cachedRoutes()).isEqualTo(2);
    }

    @Test
    void missesAreNotCached() {
        RouteRegistry routes = new RouteRegistry(100);
        routes.resolve("GET", "/missing");
        assertThat(routes.cachedRoutes()).isZero();
    }

    @Test
    void reRegistrationReplacesTheHandler() {
        RouteRegistry routes = new RouteRegistry(100);
        routes.register("GET", "/x", health);
        routes.register("GET", "/x", other);

        assertThat(routes.size()).isEqualTo(1);
        assertThat(routes.resolve("GET", "/x")).containsSame(other);
    }

    @Test
    void observedUrlCacheIsBounded() {
        RouteRegistry routes = new RouteRegistry(5);
        routes.register("GET", "/search", health);
        for (int i = 0; i < 50; i++) {
            assertThat(routes.resolve("GET", "/search?q=" + i)).isPresent();
        }
        assertThat(routes.cachedRoutes()).isEqualTo(5);
    }

    @Test
    void pathStopsAtFirstQuestionMark() {
        assertThat(RouteRegistry.pathOf("/a?b?c")).isEqualTo("/a");
        assertThat(RouteRegistry.pathOf("/a")).isEqualTo("/a");
        assertThat(RouteRegistry.routeKey("GET", "/a?b")).isEqualTo("GET:/a?b");
    }
}
