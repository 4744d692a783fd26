package io.peermesh.routing;

import io.peermesh.ClusterId;
import io.peermesh.CrossClusterRoute;
import io.peermesh.error.UnroutableDestinationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("DestinationClassifier")
class DestinationClassifierTest {

    private final DestinationClassifier classifier = new DestinationClassifier("mesh", "default", Map.of(
        "legacy-db.internal", new CrossClusterRoute(ClusterId.of("dc1"), "postgres", "data", 5432),
        "search.internal", new CrossClusterRoute(ClusterId.of("dc2"), "search", "default", 0)
    ));

    @Nested
    @DisplayName("Mesh Host Names")
    class MeshHostTests {

        @Test
        @DisplayName("should split service, namespace and cluster")
        void shouldSplitLabels() {
            CrossClusterRoute route = classifier.classify(
                Destination.fromHostHeader("payment-service.default.east.mesh:8080", null));

            assertEquals(new CrossClusterRoute(ClusterId.of("east"), "payment-service", "default", 8080), route);
        }

        @Test
        @DisplayName("should default the port and ignore case and a trailing dot")
        void shouldNormalizeHost() {
            CrossClusterRoute route = classifier.classify(new Destination("Orders.Shop.WEST.mesh.", 0, null));

            assertEquals(new CrossClusterRoute(ClusterId.of("west"), "orders", "shop", 80), route);
        }

        @ParameterizedTest
        @ValueSource(strings = { "example.com", "orders.west.mesh", "a.b.c.d.mesh", "orders..west.mesh", "mesh" })
        @DisplayName("should reject hosts that are not mesh names")
        void shouldRejectNonMeshHosts(String host) {
            assertThrows(UnroutableDestinationException.class,
                () -> classifier.classify(new Destination(host, 80, null)));
        }

        @Test
        @DisplayName("should reject a request without host")
        void shouldRejectMissingHost() {
            assertThrows(UnroutableDestinationException.class,
                () -> classifier.classify(Destination.fromHostHeader(null, null)));
        }
    }

    @Nested
    @DisplayName("Cluster Hints")
    class HintTests {

        @Test
        @DisplayName("should use the hint with a bare service name")
        void shouldUseHintWithService() {
            CrossClusterRoute route = classifier.classify(Destination.fromHostHeader("orders:9000", "west"));

            assertEquals(new CrossClusterRoute(ClusterId.of("west"), "orders", "default", 9000), route);
        }

        @Test
        @DisplayName("should read the namespace next to the service")
        void shouldReadNamespace() {
            CrossClusterRoute route = classifier.classify(Destination.fromHostHeader("orders.shop.mesh", "west"));

            assertEquals(new CrossClusterRoute(ClusterId.of("west"), "orders", "shop", 80), route);
        }

        @Test
        @DisplayName("should reject hinted hosts with too many labels")
        void shouldRejectLongHintedHost() {
            assertThrows(UnroutableDestinationException.class,
                () -> classifier.classify(Destination.fromHostHeader("a.b.c", "west")));
        }
    }

    @Nested
    @DisplayName("Static Routes")
    class StaticRouteTests {

        @Test
        @DisplayName("should prefer a configured route")
        void shouldPreferConfiguredRoute() {
            CrossClusterRoute route = classifier.classify(Destination.fromHostHeader("legacy-db.internal:1234", null));

            assertEquals(new CrossClusterRoute(ClusterId.of("dc1"), "postgres", "data", 5432), route);
        }

        @Test
        @DisplayName("should take the request port when the route has none")
        void shouldTakeRequestPort() {
            CrossClusterRoute route = classifier.classify(Destination.fromHostHeader("search.internal:9200", null));

            assertEquals(9200, route.targetPort());
        }
    }

    @Test
    @DisplayName("should parse host headers with and without port")
    void shouldParseHostHeaders() {
        assertEquals(new Destination("a.b", 81, null), Destination.fromHostHeader("a.b:81", null));
        assertEquals(new Destination("a.b", 0, "x"), Destination.fromHostHeader(" a.b ", "x"));
        assertEquals(new Destination("a.b:port", 0, null), Destination.fromHostHeader("a.b:port", null));
    }
}
