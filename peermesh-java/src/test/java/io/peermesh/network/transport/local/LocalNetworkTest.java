package io.peermesh.network.transport.local;

import io.peermesh.NodeAddr;
import io.peermesh.NodeId;
import io.peermesh.error.ConnectionClosedException;
import io.peermesh.error.ConnectionRefusedException;
import io.peermesh.error.IdentityMismatchException;
import io.peermesh.error.MeshTimeoutException;
import io.peermesh.network.transport.MeshConnection;
import io.peermesh.network.transport.MeshStream;
import io.peermesh.network.transport.PathQuality;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("LocalNetwork")
class LocalNetworkTest {

    private static final String RELAY = "https://relay.test";
    private static final Duration TIMEOUT = Duration.ofSeconds(2);

    private LocalNetwork network;
    private LocalEndpoint alice;
    private LocalEndpoint bob;

    @BeforeEach
    void setUp() {
        network = new LocalNetwork();
        alice = network.bind(RELAY);
        bob = network.bind(RELAY);
    }

    @AfterEach
    void tearDown() {
        alice.close();
        bob.close();
    }

    private static String text(byte[] bytes) {
        return new String(bytes, StandardCharsets.UTF_8);
    }

    private static byte[] bytes(String text) {
        return text.getBytes(StandardCharsets.UTF_8);
    }

    @Nested
    @DisplayName("Dialing")
    class DialingTests {

        @Test
        @DisplayName("should connect directly when a direct address is dialed")
        void shouldConnectDirectly() throws Exception {
            MeshConnection out = alice.connect(bob.getNodeAddr().directOnly(), TIMEOUT).get(5, TimeUnit.SECONDS);
            MeshConnection in = bob.accept().get(5, TimeUnit.SECONDS);

            assertEquals(PathQuality.DIRECT, out.getPathQuality());
            assertEquals(bob.getNodeId(), out.getRemoteNodeId());
            assertEquals(alice.getNodeId(), in.getRemoteNodeId());
            assertEquals(1, bob.getConnectionsIn());
            assertEquals(1, alice.getConnectionsOut());
        }

        @Test
        @DisplayName("should connect through the relay when only the relay is dialed")
        void shouldConnectThroughRelay() throws Exception {
            MeshConnection out = alice.connect(bob.getNodeAddr().relayOnly(), TIMEOUT).get(5, TimeUnit.SECONDS);

            assertEquals(PathQuality.RELAYED, out.getPathQuality());
        }

        @Test
        @DisplayName("should time out a direct dial to a node behind NAT")
        void shouldTimeOutBehindNat() {
            network.setDirectReachable(bob.getNodeId(), false);

            ExecutionException ex = assertThrows(ExecutionException.class,
                () -> alice.connect(bob.getNodeAddr().directOnly(), Duration.ofMillis(100)).get(5, TimeUnit.SECONDS));
            assertInstanceOf(MeshTimeoutException.class, ex.getCause());
        }

        @Test
        @DisplayName("should report the identity found at a dialed address")
        void shouldReportIdentityMismatch() {
            NodeAddr wrong = NodeAddr.direct(NodeId.random(), bob.getDirectAddress());

            ExecutionException ex = assertThrows(ExecutionException.class,
                () -> alice.connect(wrong, TIMEOUT).get(5, TimeUnit.SECONDS));
            IdentityMismatchException mismatch = assertInstanceOf(IdentityMismatchException.class, ex.getCause());
            assertEquals(wrong.nodeId(), mismatch.getExpected());
            assertEquals(bob.getNodeId(), mismatch.getActual());
        }

        @Test
        @DisplayName("should refuse a dial to an address nobody listens on")
        void shouldRefuseUnknownAddress() {
            NodeAddr nowhere = NodeAddr.direct(NodeId.random(), "10.9.9.9:1");

            ExecutionException ex = assertThrows(ExecutionException.class,
                () -> alice.connect(nowhere, TIMEOUT).get(5, TimeUnit.SECONDS));
            assertInstanceOf(ConnectionRefusedException.class, ex.getCause());
        }

        @Test
        @DisplayName("should refuse dials after the endpoint closed")
        void shouldRefuseAfterClose() {
            NodeAddr addr = bob.getNodeAddr();
            bob.close();

            assertFalse(bob.isOpen());
            assertThrows(ExecutionException.class, () -> alice.connect(addr, TIMEOUT).get(5, TimeUnit.SECONDS));
        }

        @Test
        @DisplayName("should fail pending accepts when the endpoint closes")
        void shouldFailPendingAccepts() {
            CompletableFuture<MeshConnection> pending = bob.accept();

            bob.close();

            ExecutionException ex = assertThrows(ExecutionException.class, () -> pending.get(5, TimeUnit.SECONDS));
            assertInstanceOf(ConnectionClosedException.class, ex.getCause());
        }
    }

    @Nested
    @DisplayName("Streams")
    class StreamTests {

        @Test
        @DisplayName("should carry bytes both ways and signal end of stream")
        void shouldCarryBytes() throws Exception {
            MeshConnection out = alice.connect(bob.getNodeAddr(), TIMEOUT).get(5, TimeUnit.SECONDS);
            MeshConnection in = bob.accept().get(5, TimeUnit.SECONDS);

            MeshStream client = out.openStream().get(5, TimeUnit.SECONDS);
            MeshStream server = in.acceptStream().get(5, TimeUnit.SECONDS);

            client.write(bytes("ping")).get(5, TimeUnit.SECONDS);
            client.finish().get(5, TimeUnit.SECONDS);
            assertEquals("ping", text(server.read().get(5, TimeUnit.SECONDS)));
            assertNull(server.read().get(5, TimeUnit.SECONDS));

            server.write(bytes("pong")).get(5, TimeUnit.SECONDS);
            assertEquals("pong", text(client.read().get(5, TimeUnit.SECONDS)));
            assertEquals(4, ((LocalConnection) out).bytesSent());
        }

        @Test
        @DisplayName("should reset one stream without touching the connection")
        void shouldResetSingleStream() throws Exception {
            MeshConnection out = alice.connect(bob.getNodeAddr(), TIMEOUT).get(5, TimeUnit.SECONDS);
            MeshConnection in = bob.accept().get(5, TimeUnit.SECONDS);

            MeshStream first = out.openStream().get(5, TimeUnit.SECONDS);
            MeshStream firstServer = in.acceptStream().get(5, TimeUnit.SECONDS);
            CompletableFuture<byte[]> pendingRead = first.read();

            firstServer.reset();

            ExecutionException ex = assertThrows(ExecutionException.class, () -> pendingRead.get(5, TimeUnit.SECONDS));
            assertInstanceOf(ConnectionClosedException.class, ex.getCause());
            assertTrue(out.isOpen());
            assertTrue(in.isOpen());

            MeshStream second = out.openStream().get(5, TimeUnit.SECONDS);
            MeshStream secondServer = in.acceptStream().get(5, TimeUnit.SECONDS);
            second.write(bytes("still here")).get(5, TimeUnit.SECONDS);
            assertEquals("still here", text(secondServer.read().get(5, TimeUnit.SECONDS)));
            assertEquals(1, ((LocalConnection) out).activeStreams());
        }

        @Test
        @DisplayName("should abort open streams when the connection closes")
        void shouldAbortStreamsOnClose() throws Exception {
            MeshConnection out = alice.connect(bob.getNodeAddr(), TIMEOUT).get(5, TimeUnit.SECONDS);
            MeshConnection in = bob.accept().get(5, TimeUnit.SECONDS);
            AtomicReference<Boolean> closedSeen = new AtomicReference<>(false);
            in.setOnClose(v -> closedSeen.set(true));

            MeshStream stream = out.openStream().get(5, TimeUnit.SECONDS);
            CompletableFuture<byte[]> pendingRead = stream.read();

            out.close();

            assertThrows(ExecutionException.class, () -> pendingRead.get(5, TimeUnit.SECONDS));
            assertFalse(in.isOpen());
            assertTrue(closedSeen.get());
            assertThrows(ExecutionException.class, () -> out.openStream().get(5, TimeUnit.SECONDS));
        }
    }

    @Nested
    @DisplayName("Path Upgrade")
    class PathUpgradeTests {

        @Test
        @DisplayName("should upgrade relayed connections in place when the node becomes reachable")
        void shouldUpgradeInPlace() throws Exception {
            network.setDirectReachable(bob.getNodeId(), false);
            MeshConnection out = alice.connect(bob.getNodeAddr().relayOnly(), TIMEOUT).get(5, TimeUnit.SECONDS);
            MeshConnection in = bob.accept().get(5, TimeUnit.SECONDS);
            AtomicReference<PathQuality> seen = new AtomicReference<>();
            out.setOnPathChange(seen::set);

            MeshStream client = out.openStream().get(5, TimeUnit.SECONDS);
            MeshStream server = in.acceptStream().get(5, TimeUnit.SECONDS);
            client.write(bytes("before")).get(5, TimeUnit.SECONDS);

            network.setDirectReachable(bob.getNodeId(), true);

            assertEquals(PathQuality.DIRECT, out.getPathQuality());
            assertEquals(PathQuality.DIRECT, in.getPathQuality());
            assertEquals(PathQuality.DIRECT, seen.get());

            client.write(bytes("after")).get(5, TimeUnit.SECONDS);
            assertEquals("before", text(server.read().get(5, TimeUnit.SECONDS)));
            assertEquals("after", text(server.read().get(5, TimeUnit.SECONDS)));
        }
    }
}
