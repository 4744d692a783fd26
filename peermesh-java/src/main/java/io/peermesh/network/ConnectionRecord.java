package io.peermesh.network;

import io.peermesh.ClusterId;
import io.peermesh.network.transport.MeshConnection;

import java.time.Duration;
import java.time.Instant;

/**
 * The single record {@link ConnectionManager} keeps per remote cluster. All mutation
 * happens under the record's own monitor, so different clusters never contend.
 */
final class ConnectionRecord {

    private final ClusterId clusterId;
    private ConnectionState state = ConnectionState.IDLE;
    private MeshConnection connection;
    private Instant lastActivity;
    private String closeReason;

    ConnectionRecord(ClusterId clusterId, Instant now) {
        this.clusterId = clusterId;
        this.lastActivity = now;
    }

    ClusterId clusterId() {
        return clusterId;
    }

    synchronized ConnectionState state() {
        return state;
    }

    synchronized MeshConnection connection() {
        return connection;
    }

    /**
     * @return the previous state, or {@code null} if the move is not allowed
     */
    synchronized ConnectionState transitionTo(ConnectionState next, String reason) {
        if (!state.canTransitionTo(next)) {
            return null;
        }
        ConnectionState previous = state;
        state = next;
        if (next == ConnectionState.CLOSED) {
            closeReason = reason;
        }
        return previous;
    }

    synchronized void attach(MeshConnection connection, Instant now) {
        this.connection = connection;
        this.lastActivity = now;
    }

    /**
     * Returns the connection if it can carry traffic right now, marking the record as used.
     */
    synchronized MeshConnection acquire(Instant now) {
        if (!state.isUsable() || connection == null || !connection.isOpen()) {
            return null;
        }
        lastActivity = now;
        return connection;
    }

    /**
     * Moves the record to {@link ConnectionState#CLOSED} if it has not been used for
     * {@code idleTimeout}.
     *
     * @return the connection to release, or {@code null} if the record stays
     */
    synchronized MeshConnection closeIfIdle(Instant now, Duration idleTimeout) {
        if (!state.isUsable() || Duration.between(lastActivity, now).compareTo(idleTimeout) < 0) {
            return null;
        }
        state = ConnectionState.CLOSED;
        closeReason = "idle for " + Duration.between(lastActivity, now).toSeconds() + "s";
        return connection;
    }

    synchronized ConnectionStatus toStatus() {
        return new ConnectionStatus(
            clusterId.value(),
            state,
            connection == null ? null : connection.getRemoteNodeId().value(),
            connection == null ? null : connection.getId(),
            lastActivity.toEpochMilli(),
            closeReason
        );
    }
}
