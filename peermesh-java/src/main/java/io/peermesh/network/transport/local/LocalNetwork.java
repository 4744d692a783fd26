package io.peermesh.network.transport.local;

import io.peermesh.NodeAddr;
import io.peermesh.NodeId;
import io.peermesh.error.ConnectionRefusedException;
import io.peermesh.error.IdentityMismatchException;
import io.peermesh.network.transport.MeshConnection;
import io.peermesh.network.transport.PathQuality;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-process switchboard connecting {@link LocalEndpoint}s.
 *
 * <p>Models the two paths a peer-to-peer transport offers. A direct dial reaches the
 * endpoint bound to one of the dialed addresses, unless a NAT still blocks that node,
 * in which case the dial hangs until the caller's deadline. A relay dial reaches any
 * node homed on the relay. Unblocking a node upgrades its relayed connections to
 * {@link PathQuality#DIRECT} in place.
 */
public class LocalNetwork {

    private static final Logger LOGGER = LoggerFactory.getLogger(LocalNetwork.class);

    private final Set<LocalEndpoint> endpoints = ConcurrentHashMap.newKeySet();
    private final Map<String, LocalEndpoint> byAddress = new ConcurrentHashMap<>();
    private final Map<String, Map<NodeId, LocalEndpoint>> relays = new ConcurrentHashMap<>();
    private final Set<NodeId> behindNat = ConcurrentHashMap.newKeySet();
    private final AtomicInteger nextPort = new AtomicInteger(7000);
    private final AtomicLong nextConnectionId = new AtomicLong();

    /**
     * Binds a fresh identity with a generated direct address.
     */
    public LocalEndpoint bind(String relayUrl) {
        return bind(NodeId.random(), "127.0.0.1:" + nextPort.getAndIncrement(), relayUrl);
    }

    public LocalEndpoint bind(NodeId nodeId, String directAddress, String relayUrl) {
        LocalEndpoint endpoint = new LocalEndpoint(this, nodeId, directAddress, relayUrl);
        endpoints.add(endpoint);
        if (directAddress != null) {
            LocalEndpoint previous = byAddress.put(directAddress, endpoint);
            if (previous != null) {
                LOGGER.info("Address {} rebound from {} to {}", directAddress, previous.getNodeId().shortId(), nodeId.shortId());
            }
        }
        if (relayUrl != null) {
            relays.computeIfAbsent(relayUrl, k -> new ConcurrentHashMap<>()).put(nodeId, endpoint);
        }
        return endpoint;
    }

    /**
     * Controls whether direct dials to {@code nodeId} get through. Restoring
     * reachability upgrades the node's relayed connections.
     */
    public void setDirectReachable(NodeId nodeId, boolean reachable) {
        if (!reachable) {
            behindNat.add(nodeId);
            return;
        }
        behindNat.remove(nodeId);
        for (LocalEndpoint endpoint : endpoints) {
            for (LocalConnection connection : endpoint.connections()) {
                boolean involved = endpoint.getNodeId().equals(nodeId) || connection.getRemoteNodeId().equals(nodeId);
                if (involved && connection.getPathQuality() == PathQuality.RELAYED && connection.upgrade()) {
                    LOGGER.debug("Connection {} upgraded to a direct path", connection.getId());
                }
            }
        }
    }

    CompletableFuture<MeshConnection> dial(LocalEndpoint dialer, NodeAddr target) {
        if (target.hasDirect()) {
            return dialDirect(dialer, target);
        }
        if (target.hasRelay()) {
            return dialRelay(dialer, target);
        }
        return CompletableFuture.failedFuture(new ConnectionRefusedException("no address hints for " + target.nodeId().shortId()));
    }

    private CompletableFuture<MeshConnection> dialDirect(LocalEndpoint dialer, NodeAddr target) {
        for (String address : target.directAddresses()) {
            LocalEndpoint listener = byAddress.get(address);
            if (listener == null || !listener.isOpen()) {
                continue;
            }
            if (!listener.getNodeId().equals(target.nodeId())) {
                return CompletableFuture.failedFuture(new IdentityMismatchException(target.nodeId(), listener.getNodeId()));
            }
            if (behindNat.contains(listener.getNodeId()) || behindNat.contains(dialer.getNodeId())) {
                // never answered: the dialer's deadline decides
                return new CompletableFuture<>();
            }
            return link(dialer, listener, PathQuality.DIRECT);
        }
        return CompletableFuture.failedFuture(new ConnectionRefusedException(
            "nothing listening on " + target.directAddresses()));
    }

    private CompletableFuture<MeshConnection> dialRelay(LocalEndpoint dialer, NodeAddr target) {
        Map<NodeId, LocalEndpoint> homed = relays.get(target.relayUrl());
        LocalEndpoint listener = homed == null ? null : homed.get(target.nodeId());
        if (listener == null || !listener.isOpen()) {
            return CompletableFuture.failedFuture(new ConnectionRefusedException(
                "relay " + target.relayUrl() + " does not know " + target.nodeId().shortId()));
        }
        return link(dialer, listener, PathQuality.RELAYED);
    }

    private CompletableFuture<MeshConnection> link(LocalEndpoint dialer, LocalEndpoint listener, PathQuality quality) {
        String id = "local-" + nextConnectionId.incrementAndGet();
        LocalConnection[] ends = LocalConnection.pair(id, dialer, listener, quality);
        if (!listener.deliver(ends[1])) {
            return CompletableFuture.failedFuture(new ConnectionRefusedException(
                listener.getNodeId().shortId() + " is not accepting connections"));
        }
        dialer.track(ends[0]);
        LOGGER.debug("Linked {} -> {} over {} path ({})", dialer.getNodeId().shortId(),
            listener.getNodeId().shortId(), quality, id);
        return CompletableFuture.completedFuture(ends[0]);
    }

    void unbind(LocalEndpoint endpoint) {
        endpoints.remove(endpoint);
        if (endpoint.getDirectAddress() != null) {
            byAddress.remove(endpoint.getDirectAddress(), endpoint);
        }
        if (endpoint.getRelayUrl() != null) {
            Map<NodeId, LocalEndpoint> homed = relays.get(endpoint.getRelayUrl());
            if (homed != null) {
                homed.remove(endpoint.getNodeId(), endpoint);
            }
        }
    }
}
