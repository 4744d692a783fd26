package io.peermesh.network.transport.local;

import io.peermesh.NodeAddr;
import io.peermesh.NodeId;
import io.peermesh.error.ConnectionClosedException;
import io.peermesh.error.MeshException;
import io.peermesh.error.MeshTimeoutException;
import io.peermesh.network.transport.Endpoint;
import io.peermesh.network.transport.MeshConnection;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * {@link Endpoint} attached to a {@link LocalNetwork}.
 */
public class LocalEndpoint implements Endpoint {

    private final LocalNetwork network;
    private final NodeId nodeId;
    private final String directAddress;
    private final String relayUrl;
    private final AsyncQueue<MeshConnection> incoming = new AsyncQueue<>();
    private final Set<LocalConnection> connections = ConcurrentHashMap.newKeySet();
    private volatile boolean open = true;

    private final AtomicLong connectAttempts = new AtomicLong();
    private final AtomicLong connectionsIn = new AtomicLong();
    private final AtomicLong connectionsOut = new AtomicLong();

    LocalEndpoint(LocalNetwork network, NodeId nodeId, String directAddress, String relayUrl) {
        this.network = network;
        this.nodeId = nodeId;
        this.directAddress = directAddress;
        this.relayUrl = relayUrl;
    }

    @Override
    public NodeId getNodeId() {
        return nodeId;
    }

    @Override
    public NodeAddr getNodeAddr() {
        return new NodeAddr(nodeId, relayUrl, directAddress == null ? List.of() : List.of(directAddress));
    }

    public String getDirectAddress() {
        return directAddress;
    }

    public String getRelayUrl() {
        return relayUrl;
    }

    @Override
    public CompletableFuture<MeshConnection> connect(NodeAddr address, Duration timeout) {
        connectAttempts.incrementAndGet();
        if (!open) {
            return CompletableFuture.failedFuture(new ConnectionClosedException("endpoint " + nodeId.shortId() + " is closed"));
        }
        return network.dial(this, address)
            .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
            .handle((conn, ex) -> {
                if (ex == null) {
                    connectionsOut.incrementAndGet();
                    return conn;
                }
                Throwable cause = MeshException.unwrap(ex);
                if (cause instanceof TimeoutException) {
                    throw new MeshTimeoutException(
                        "connect to " + address.nodeId().shortId() + " timed out after " + timeout.toMillis() + "ms", cause);
                }
                if (cause instanceof RuntimeException runtime) {
                    throw runtime;
                }
                throw new CompletionException(cause);
            });
    }

    @Override
    public CompletableFuture<MeshConnection> accept() {
        return incoming.poll();
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    @Override
    public CompletableFuture<Void> close() {
        open = false;
        network.unbind(this);
        incoming.close(new ConnectionClosedException("endpoint " + nodeId.shortId() + " is closed"), true);
        for (LocalConnection connection : new ArrayList<>(connections)) {
            connection.close();
        }
        return CompletableFuture.completedFuture(null);
    }

    public long getConnectAttempts() {
        return connectAttempts.get();
    }

    public long getConnectionsIn() {
        return connectionsIn.get();
    }

    public long getConnectionsOut() {
        return connectionsOut.get();
    }

    public int getOpenConnectionCount() {
        return connections.size();
    }

    void track(LocalConnection connection) {
        connections.add(connection);
    }

    boolean deliver(LocalConnection connection) {
        if (!open) {
            return false;
        }
        connections.add(connection);
        if (!incoming.offer(connection)) {
            connections.remove(connection);
            return false;
        }
        connectionsIn.incrementAndGet();
        return true;
    }

    void forget(LocalConnection connection) {
        connections.remove(connection);
    }

    Set<LocalConnection> connections() {
        return connections;
    }
}
