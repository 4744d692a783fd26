package io.peermesh.network;

import io.peermesh.network.transport.PathQuality;

/**
 * Lifecycle of the connection record kept for one remote cluster.
 */
public enum ConnectionState {
    IDLE,
    RESOLVING,
    CONNECTING,
    RELAYED,
    DIRECT,
    CLOSED;

    public boolean isUsable() {
        return this == RELAYED || this == DIRECT;
    }

    public boolean canTransitionTo(ConnectionState next) {
        return switch (this) {
            case IDLE -> next == RESOLVING || next == CLOSED;
            case RESOLVING -> next == CONNECTING || next == CLOSED;
            case CONNECTING -> next == RELAYED || next == DIRECT || next == CLOSED;
            case RELAYED -> next == DIRECT || next == CLOSED;
            case DIRECT -> next == CLOSED;
            case CLOSED -> false;
        };
    }

    public static ConnectionState of(PathQuality quality) {
        return quality == PathQuality.DIRECT ? DIRECT : RELAYED;
    }
}
