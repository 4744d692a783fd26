package io.peermesh.discovery;

import io.peermesh.ClusterId;
import io.peermesh.ServiceEndpoint;
import io.peermesh.ServiceInfo;
import io.peermesh.error.ConnectionClosedException;
import io.peermesh.network.ConnectionManager;
import io.peermesh.network.transport.FramedStream;
import io.peermesh.network.transport.InMemoryAddressDirectory;
import io.peermesh.network.transport.MeshConnection;
import io.peermesh.network.transport.MeshStream;
import io.peermesh.network.transport.StreamKind;
import io.peermesh.network.transport.local.LocalEndpoint;
import io.peermesh.network.transport.local.LocalNetwork;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("DiscoveryServer")
class DiscoveryServerTest {

    private static final String RELAY = "https://relay.test";

    private LocalNetwork network;
    private LocalEndpoint serverEndpoint;
    private LocalEndpoint clientEndpoint;
    private ConnectionManager connections;
    private DiscoveryServer server;
    private ExecutorService workers;
    private MeshConnection connection;

    @BeforeEach
    void setUp() throws Exception {
        network = new LocalNetwork();
        serverEndpoint = network.bind(RELAY);
        clientEndpoint = network.bind(RELAY);

        StaticClusterScanner scanner = new StaticClusterScanner();
        scanner.put(new LocalService(
            new ServiceInfo("payment-service", "default", 8080, "HTTP"),
            List.of(ServiceEndpoint.of("10.0.0.5", 8080))
        ));
        scanner.put(new LocalService(
            new ServiceInfo("vault", "secure", 8200, "HTTP"),
            List.of(ServiceEndpoint.of("10.0.0.7", 8200))
        ));
        connections = new ConnectionManager(serverEndpoint, new InMemoryAddressDirectory());
        DiscoveryManager discovery = new DiscoveryManager(ClusterId.of("east"), scanner, connections,
            DiscoveryManager.Options.builder().queryTimeout(Duration.ofMillis(200)).build(), Clock.systemUTC());
        workers = Executors.newFixedThreadPool(4);
        server = new DiscoveryServer(serverEndpoint, discovery,
            (peer, query) -> !query.namespace().equals("secure"), workers);
        server.start();

        connection = clientEndpoint.connect(serverEndpoint.getNodeAddr(), Duration.ofSeconds(2)).get(5, TimeUnit.SECONDS);
    }

    @AfterEach
    void tearDown() {
        server.stop();
        connections.shutdown();
        clientEndpoint.close();
        serverEndpoint.close();
        workers.shutdownNow();
    }

    private CompletableFuture<byte[]> exchange(byte kind, byte[] payload) {
        return connection.openStream().thenCompose(stream -> {
            FramedStream framed = new FramedStream(stream, DiscoveryCodec.MAX_FRAME_SIZE);
            return stream.write(new byte[] { kind })
                .thenCompose(v -> framed.writeFrame(payload))
                .thenCompose(v -> stream.finish())
                .thenCompose(v -> framed.readFrame());
        });
    }

    private DiscoveryResponse query(String service, String namespace) throws Exception {
        byte[] answer = exchange(StreamKind.DISCOVERY.code(),
            DiscoveryCodec.encodeQuery(new DiscoveryQuery(service, namespace))).get(5, TimeUnit.SECONDS);
        return DiscoveryCodec.decodeResponse(answer);
    }

    private void assertReset(CompletableFuture<byte[]> pending) {
        ExecutionException ex = assertThrows(ExecutionException.class, () -> pending.get(5, TimeUnit.SECONDS));
        assertInstanceOf(ConnectionClosedException.class, ex.getCause());
    }

    @Nested
    @DisplayName("Queries")
    class QueryTests {

        @Test
        @DisplayName("should answer a known service with its endpoints")
        void shouldAnswerKnownService() throws Exception {
            DiscoveryResponse response = query("payment-service", "default");

            assertTrue(response.isFound());
            assertEquals(List.of(ServiceEndpoint.of("10.0.0.5", 8080)), response.endpoints());
            assertEquals(1, server.getStats().queriesServed());
            assertEquals(1, server.getStats().connectionsAccepted());
        }

        @Test
        @DisplayName("should answer an unknown service with not found")
        void shouldAnswerNotFound() throws Exception {
            DiscoveryResponse response = query("ghost", "default");

            assertEquals(DiscoveryResponse.Status.NOT_FOUND, response.status());
            assertTrue(response.endpoints().isEmpty());
        }

        @Test
        @DisplayName("should serve many streams over one connection")
        void shouldServeManyStreams() throws Exception {
            for (int i = 0; i < 5; i++) {
                assertTrue(query("payment-service", "default").isFound());
            }

            assertEquals(5, server.getStats().streamsAccepted());
            assertEquals(1, server.getStats().openConnections());
        }
    }

    @Nested
    @DisplayName("Rejections")
    class RejectionTests {

        @Test
        @DisplayName("should reset a malformed query and keep the connection")
        void shouldResetMalformedQuery() throws Exception {
            assertReset(exchange(StreamKind.DISCOVERY.code(), "{not json".getBytes(StandardCharsets.UTF_8)));

            assertTrue(connection.isOpen());
            assertEquals(1, server.getStats().streamsRejected());
            assertTrue(query("payment-service", "default").isFound());
        }

        @Test
        @DisplayName("should reset a stream of unknown kind")
        void shouldResetUnknownKind() throws Exception {
            assertReset(exchange((byte) 99, new byte[0]));

            assertTrue(query("payment-service", "default").isFound());
        }

        @Test
        @DisplayName("should reset a denied query")
        void shouldResetDeniedQuery() {
            assertReset(exchange(StreamKind.DISCOVERY.code(),
                DiscoveryCodec.encodeQuery(new DiscoveryQuery("vault", "secure"))));

            assertEquals(1, server.getStats().queriesDenied());
            assertEquals(0, server.getStats().queriesServed());
        }

        @Test
        @DisplayName("should reset a stream that never sends its query")
        void shouldResetSilentStream() throws Exception {
            MeshStream stream = connection.openStream().get(5, TimeUnit.SECONDS);
            stream.write(new byte[] { StreamKind.DISCOVERY.code() }).get(5, TimeUnit.SECONDS);

            long started = System.nanoTime();
            ExecutionException ex = assertThrows(ExecutionException.class,
                () -> new FramedStream(stream, DiscoveryCodec.MAX_FRAME_SIZE).readFrame().get(5, TimeUnit.SECONDS));

            assertInstanceOf(ConnectionClosedException.class, ex.getCause());
            assertTrue(Duration.ofNanos(System.nanoTime() - started).compareTo(Duration.ofSeconds(3)) < 0);
            assertEquals(1, server.getStats().streamsRejected());
            assertEquals(0, server.getStats().queriesServed());
            assertTrue(connection.isOpen());
        }

        @Test
        @DisplayName("should reset a stream that never sends its kind")
        void shouldResetStreamWithoutKind() throws Exception {
            MeshStream stream = connection.openStream().get(5, TimeUnit.SECONDS);

            ExecutionException ex = assertThrows(ExecutionException.class, () -> stream.read().get(5, TimeUnit.SECONDS));

            assertInstanceOf(ConnectionClosedException.class, ex.getCause());
            assertEquals(1, server.getStats().streamsRejected());
        }

        @Test
        @DisplayName("should reset streams of a kind without handler")
        void shouldResetUnhandledKind() {
            assertReset(exchange(StreamKind.PROXY.code(), new byte[] { 1 }));
        }
    }

    @Nested
    @DisplayName("Handlers")
    class HandlerTests {

        @Test
        @DisplayName("should route registered kinds to their handler")
        void shouldRouteToHandler() throws Exception {
            server.registerHandler(StreamKind.PROXY, (conn, framed) -> framed.readFrame()
                .thenCompose(bytes -> framed.writeFrame(new byte[] { (byte) bytes.length }))
                .thenCompose(v -> framed.stream().finish()));

            byte[] answer = exchange(StreamKind.PROXY.code(), new byte[] { 1, 2, 3 }).get(5, TimeUnit.SECONDS);

            assertArrayEquals(new byte[] { 3 }, answer);
        }

        @Test
        @DisplayName("should not let discovery streams be taken over")
        void shouldRejectDiscoveryHandler() {
            assertThrows(IllegalArgumentException.class,
                () -> server.registerHandler(StreamKind.DISCOVERY, (conn, framed) -> CompletableFuture.completedFuture(null)));
        }

        @Test
        @DisplayName("should close accepted connections on stop")
        void shouldCloseOnStop() throws Exception {
            query("payment-service", "default");

            server.stop();

            assertFalse(server.isRunning());
            assertFalse(connection.isOpen());
        }
    }
}
