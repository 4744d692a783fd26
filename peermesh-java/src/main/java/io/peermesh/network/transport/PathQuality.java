package io.peermesh.network.transport;

/**
 * Current path a connection's packets take to the peer.
 */
public enum PathQuality {
    RELAYED,
    DIRECT
}
