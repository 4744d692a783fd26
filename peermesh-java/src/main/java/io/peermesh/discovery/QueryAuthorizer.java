package io.peermesh.discovery;

import io.peermesh.NodeId;

/**
 * Decides whether a peer may look up a service. Denied queries get their stream reset.
 */
@FunctionalInterface
public interface QueryAuthorizer {

    boolean authorize(NodeId peer, DiscoveryQuery query);

    static QueryAuthorizer allowAll() {
        return (peer, query) -> true;
    }
}
