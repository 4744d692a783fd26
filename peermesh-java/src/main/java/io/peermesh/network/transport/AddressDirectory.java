package io.peermesh.network.transport;

import io.peermesh.ClusterId;
import io.peermesh.NodeAddr;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Publishes and resolves the address record of each cluster (DNS, static files, ...).
 */
public interface AddressDirectory {

    /**
     * Completes with an empty optional when no record exists.
     */
    CompletableFuture<Optional<NodeAddr>> resolve(ClusterId clusterId);

    CompletableFuture<Void> publish(ClusterId clusterId, NodeAddr nodeAddr);
}
