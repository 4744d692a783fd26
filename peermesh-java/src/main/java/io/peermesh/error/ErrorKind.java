package io.peermesh.error;

/**
 * Distinguishable failure classes surfaced by the mesh.
 */
public enum ErrorKind {
    UNREACHABLE,
    TIMEOUT,
    IDENTITY_MISMATCH,
    NOT_FOUND,
    CIRCUIT_OPEN,
    NO_ENDPOINTS,
    CONNECTION_CLOSED,
    REFUSED,
    PROTOCOL,
    UNROUTABLE,
    CONFIGURATION,
    INTERNAL;

    /**
     * Whether the failure happened below the application layer and may succeed on
     * another attempt.
     */
    public boolean isTransportFailure() {
        return switch (this) {
            case UNREACHABLE, TIMEOUT, CONNECTION_CLOSED, REFUSED -> true;
            default -> false;
        };
    }
}
