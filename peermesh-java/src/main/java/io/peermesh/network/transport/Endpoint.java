package io.peermesh.network.transport;

import io.peermesh.NodeAddr;
import io.peermesh.NodeId;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * Secure multiplexed transport bound to one local {@link NodeId}.
 *
 * <p>Key management, handshakes, hole punching and relay protocols live behind this
 * interface. Implementations report identity failures with
 * {@code IdentityMismatchException}, unreachable addresses with
 * {@code ConnectionRefusedException} and expired deadlines with
 * {@code MeshTimeoutException}.
 */
public interface Endpoint {

    NodeId getNodeId();

    /**
     * Hints under which peers can currently reach this endpoint.
     */
    NodeAddr getNodeAddr();

    /**
     * Dials the node named by {@code address} using only the hints it carries.
     * The returned future always completes within {@code timeout}.
     */
    CompletableFuture<MeshConnection> connect(NodeAddr address, Duration timeout);

    /**
     * Next incoming connection. Each call yields a distinct connection; once the endpoint
     * is closed every pending and future call fails with {@code ConnectionClosedException}.
     */
    CompletableFuture<MeshConnection> accept();

    boolean isOpen();

    CompletableFuture<Void> close();
}
