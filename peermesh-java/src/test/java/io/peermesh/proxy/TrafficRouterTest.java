package io.peermesh.proxy;

import io.peermesh.ClusterId;
import io.peermesh.ClusterInfo;
import io.peermesh.MutableClock;
import io.peermesh.ServiceEndpoint;
import io.peermesh.ServiceInfo;
import io.peermesh.discovery.DiscoveryManager;
import io.peermesh.discovery.DiscoveryServer;
import io.peermesh.discovery.LocalService;
import io.peermesh.discovery.QueryAuthorizer;
import io.peermesh.discovery.StaticClusterScanner;
import io.peermesh.error.CircuitOpenException;
import io.peermesh.error.ErrorKind;
import io.peermesh.error.MeshException;
import io.peermesh.error.NoEndpointsException;
import io.peermesh.error.ServiceNotFoundException;
import io.peermesh.error.UnroutableDestinationException;
import io.peermesh.network.ConnectionManager;
import io.peermesh.network.transport.InMemoryAddressDirectory;
import io.peermesh.network.transport.StreamKind;
import io.peermesh.network.transport.local.LocalEndpoint;
import io.peermesh.network.transport.local.LocalNetwork;
import io.peermesh.routing.DestinationClassifier;
import io.peermesh.routing.Destination;
import io.peermesh.routing.RouteTable;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("TrafficRouter")
class TrafficRouterTest {

    private static final String RELAY = "https://relay.test";
    private static final ClusterId EAST = ClusterId.of("east");
    private static final ClusterId WEST = ClusterId.of("west");
    private static final String ORDERS_HOST = "orders.shop.east.mesh:9000";

    private LocalEndpoint eastEndpoint;
    private LocalEndpoint westEndpoint;
    private ConnectionManager eastConnections;
    private ConnectionManager westConnections;
    private DiscoveryServer eastServer;
    private ExecutorService workers;
    private MutableClock clock;
    private TrafficRouter router;

    private final Set<String> broken = ConcurrentHashMap.newKeySet();
    private final List<ProxyRequest> seen = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() {
        LocalNetwork network = new LocalNetwork();
        InMemoryAddressDirectory directory = new InMemoryAddressDirectory();
        eastEndpoint = network.bind(RELAY);
        westEndpoint = network.bind(RELAY);
        directory.publish(EAST, eastEndpoint.getNodeAddr());
        directory.publish(WEST, westEndpoint.getNodeAddr());

        StaticClusterScanner eastScanner = new StaticClusterScanner();
        eastScanner.put(new LocalService(
            new ServiceInfo("orders", "shop", 9000, "HTTP"),
            List.of(ServiceEndpoint.of("10.0.0.1", 9000), ServiceEndpoint.of("10.0.0.2", 9000))
        ));
        eastScanner.put(new LocalService(new ServiceInfo("drained", "shop", 9000, "HTTP"), List.of()));
        eastConnections = new ConnectionManager(eastEndpoint, directory);
        DiscoveryManager eastDiscovery = new DiscoveryManager(EAST, eastScanner, eastConnections);
        eastDiscovery.registerCluster(new ClusterInfo(EAST, eastEndpoint.getNodeId(), RELAY, List.of(),
            eastDiscovery.discoverLocalServices(null)));
        workers = Executors.newFixedThreadPool(4);
        eastServer = new DiscoveryServer(eastEndpoint, eastDiscovery, QueryAuthorizer.allowAll(), workers);
        eastServer.registerHandler(StreamKind.PROXY, (connection, framed) -> {
            framed.setMaxFrameSize(EnvelopeCodec.MAX_FRAME_SIZE);
            return framed.readFrame().thenCompose(bytes -> {
                ProxyRequest request = EnvelopeCodec.decodeRequest(bytes);
                seen.add(request);
                if (broken.contains(request.targetAddress())) {
                    framed.stream().reset();
                    return CompletableFuture.completedFuture(null);
                }
                int status = request.uri().startsWith("/fail") ? 500 : 200;
                ProxyResponse response = new ProxyResponse(status,
                    List.of(new Header("X-Served-By", request.targetAddress())),
                    (request.method() + " " + request.uri()).getBytes(StandardCharsets.UTF_8));
                return framed.writeFrame(EnvelopeCodec.encodeResponse(response))
                    .thenCompose(v -> framed.stream().finish());
            });
        });
        eastServer.start();

        clock = new MutableClock();
        westConnections = new ConnectionManager(westEndpoint, directory);
        DiscoveryManager westDiscovery = new DiscoveryManager(WEST, new StaticClusterScanner(), westConnections);
        RouteTable routes = new RouteTable(westDiscovery, new DestinationClassifier());
        router = new TrafficRouter(routes, westConnections, TrafficRouter.Options.builder()
            .requestTimeout(Duration.ofSeconds(2))
            .retryPolicy(RetryPolicy.builder().maxRetries(2).initialBackoff(Duration.ofMillis(5)).build())
            .circuitBreaker(CircuitBreaker.Options.builder()
                .failureThreshold(3)
                .cooldown(Duration.ofSeconds(10))
                .build())
            .build(), clock);
    }

    @AfterEach
    void tearDown() {
        router.shutdown();
        eastServer.stop();
        eastConnections.shutdown();
        westConnections.shutdown();
        eastEndpoint.close();
        westEndpoint.close();
        workers.shutdownNow();
    }

    private static InterceptedRequest request(String method, String uri, String host) {
        return new InterceptedRequest(method, uri, Destination.fromHostHeader(host, null),
            List.of(new Header("Accept", "text/plain")), new byte[0]);
    }

    private ProxyResponse call(String method, String uri) throws Exception {
        return router.handle(request(method, uri, ORDERS_HOST)).get(5, TimeUnit.SECONDS);
    }

    private Throwable failure(String method, String uri, String host) {
        ExecutionException ex = assertThrows(ExecutionException.class,
            () -> router.handle(request(method, uri, host)).get(5, TimeUnit.SECONDS));
        return ex.getCause();
    }

    @Nested
    @DisplayName("Forwarding")
    class ForwardingTests {

        @Test
        @DisplayName("should carry a request to the remote cluster and return its response")
        void shouldCarryRequest() throws Exception {
            ProxyResponse response = call("GET", "/orders/1");

            assertEquals(200, response.status());
            assertEquals("GET /orders/1", response.bodyAsString());
            ProxyRequest delivered = seen.get(0);
            assertEquals("orders", delivered.service());
            assertEquals("shop", delivered.namespace());
            assertEquals(9000, delivered.targetPort());
            assertEquals("Accept", delivered.headers().get(0).name());
            assertEquals(1, router.getStats().successes());
        }

        @Test
        @DisplayName("should spread requests over the endpoints")
        void shouldSpreadRequests() throws Exception {
            call("GET", "/a");
            call("GET", "/b");

            assertEquals(Set.of("10.0.0.1", "10.0.0.2"),
                Set.of(seen.get(0).targetAddress(), seen.get(1).targetAddress()));
        }

        @Test
        @DisplayName("should return service error statuses without retrying")
        void shouldNotRetryServiceErrors() throws Exception {
            ProxyResponse response = call("GET", "/fail");

            assertEquals(500, response.status());
            assertEquals(1, seen.size());
            assertEquals(0, router.getStats().retries());
            assertEquals(0, router.breakerFor(EAST, "orders").getStatus().recentFailures());
        }

        @Test
        @DisplayName("should share one connection between requests")
        void shouldShareConnection() throws Exception {
            for (int i = 0; i < 5; i++) {
                call("GET", "/orders/" + i);
            }

            assertEquals(1, eastEndpoint.getConnectionsIn());
        }
    }

    @Nested
    @DisplayName("Retries")
    class RetryTests {

        @Test
        @DisplayName("should retry a failed idempotent request on another endpoint")
        void shouldRetryOnAnotherEndpoint() throws Exception {
            broken.add("10.0.0.1");

            ProxyResponse response = call("GET", "/orders/1");

            assertEquals(200, response.status());
            assertEquals("10.0.0.2", response.header("X-Served-By").orElseThrow());
            assertEquals(List.of("10.0.0.1", "10.0.0.2"), seen.stream().map(ProxyRequest::targetAddress).toList());
            assertEquals(1, router.getStats().retries());
        }

        @Test
        @DisplayName("should not retry a non-idempotent request")
        void shouldNotRetryPost() {
            broken.add("10.0.0.1");
            broken.add("10.0.0.2");

            Throwable cause = failure("POST", "/orders", ORDERS_HOST);

            assertEquals(ErrorKind.CONNECTION_CLOSED, MeshException.kindOf(cause));
            assertEquals(1, seen.size());
            assertEquals(0, router.getStats().retries());
        }

        @Test
        @DisplayName("should give up after the retry budget")
        void shouldGiveUpAfterBudget() {
            broken.add("10.0.0.1");
            broken.add("10.0.0.2");

            Throwable cause = failure("GET", "/orders/1", ORDERS_HOST);

            assertTrue(MeshException.kindOf(cause).isTransportFailure());
            assertEquals(3, seen.size());
            assertEquals(2, router.getStats().retries());
            assertEquals(1, router.getStats().failures());
        }

        @Test
        @DisplayName("should keep the connection when a single stream fails")
        void shouldKeepConnection() throws Exception {
            broken.add("10.0.0.1");

            call("GET", "/orders/1");
            call("GET", "/orders/2");

            assertEquals(1, eastEndpoint.getConnectionsIn());
        }
    }

    @Nested
    @DisplayName("Circuit Breaking")
    class CircuitTests {

        @Test
        @DisplayName("should fail fast once the breaker opened")
        void shouldFailFast() {
            broken.add("10.0.0.1");
            broken.add("10.0.0.2");
            failure("GET", "/orders/1", ORDERS_HOST);
            assertEquals(CircuitBreaker.State.OPEN, router.breakerFor(EAST, "orders").getState());

            Throwable cause = failure("GET", "/orders/2", ORDERS_HOST);

            assertInstanceOf(CircuitOpenException.class, cause);
            assertEquals(3, seen.size());
            assertEquals(1, router.getStats().circuitRejections());
        }

        @Test
        @DisplayName("should close again after a successful trial")
        void shouldRecoverAfterCooldown() throws Exception {
            broken.add("10.0.0.1");
            broken.add("10.0.0.2");
            failure("GET", "/orders/1", ORDERS_HOST);
            broken.clear();

            clock.advance(Duration.ofSeconds(10));
            ProxyResponse response = call("GET", "/orders/2");

            assertEquals(200, response.status());
            assertEquals(CircuitBreaker.State.CLOSED, router.breakerFor(EAST, "orders").getState());
        }

        @Test
        @DisplayName("should not count non-transport failures")
        void shouldIgnoreNonTransportFailures() {
            for (int i = 0; i < 5; i++) {
                assertInstanceOf(NoEndpointsException.class, failure("GET", "/", "drained.shop.east.mesh"));
            }

            assertEquals(CircuitBreaker.State.CLOSED, router.breakerFor(EAST, "drained").getState());
        }

        @Test
        @DisplayName("should keep breakers per cluster and service")
        void shouldKeepSeparateBreakers() throws Exception {
            broken.add("10.0.0.1");
            broken.add("10.0.0.2");
            failure("GET", "/orders/1", ORDERS_HOST);

            assertEquals(CircuitBreaker.State.CLOSED, router.breakerFor(EAST, "drained").getState());
            assertTrue(router.getBreakerStatus().containsKey("east/orders"));
        }
    }

    @Nested
    @DisplayName("Failures")
    class FailureTests {

        @Test
        @DisplayName("should reject destinations outside the mesh")
        void shouldRejectUnroutable() {
            assertInstanceOf(UnroutableDestinationException.class, failure("GET", "/", "example.com"));
            assertEquals(1, router.getStats().failures());
        }

        @Test
        @DisplayName("should report services the target cluster does not have")
        void shouldReportMissingService() {
            assertInstanceOf(ServiceNotFoundException.class, failure("GET", "/", "ghost.shop.east.mesh"));
            assertTrue(seen.isEmpty());
        }

        @Test
        @DisplayName("should not keep breakers for services the cluster does not have")
        void shouldDropBreakersOfMissingServices() {
            for (int i = 0; i < 5; i++) {
                failure("GET", "/", "ghost" + i + ".shop.east.mesh");
            }

            assertTrue(router.getBreakerStatus().keySet().stream().noneMatch(k -> k.contains("ghost")),
                router.getBreakerStatus().toString());
        }
    }
}
