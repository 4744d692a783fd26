package io.peermesh.network.transport;

import io.peermesh.ClusterId;
import io.peermesh.NodeAddr;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Static directory held in memory. Shared between nodes of the same process.
 */
public class InMemoryAddressDirectory implements AddressDirectory {

    private final Map<ClusterId, NodeAddr> records = new ConcurrentHashMap<>();
    private final AtomicLong lookups = new AtomicLong();
    private final AtomicLong publishes = new AtomicLong();

    @Override
    public CompletableFuture<Optional<NodeAddr>> resolve(ClusterId clusterId) {
        lookups.incrementAndGet();
        return CompletableFuture.completedFuture(Optional.ofNullable(records.get(clusterId)));
    }

    @Override
    public CompletableFuture<Void> publish(ClusterId clusterId, NodeAddr nodeAddr) {
        publishes.incrementAndGet();
        records.put(clusterId, nodeAddr);
        return CompletableFuture.completedFuture(null);
    }

    public void remove(ClusterId clusterId) {
        records.remove(clusterId);
    }

    public long getLookups() {
        return lookups.get();
    }

    public long getPublishes() {
        return publishes.get();
    }
}
