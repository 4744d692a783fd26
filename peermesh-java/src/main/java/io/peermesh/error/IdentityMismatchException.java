package io.peermesh.error;

import io.peermesh.ClusterId;
import io.peermesh.NodeId;

/**
 * The peer presented a {@link NodeId} other than the one bound to its cluster.
 * Fatal for that cluster: never retried.
 */
public class IdentityMismatchException extends MeshException {

    private static final long serialVersionUID = 1L;

    private final ClusterId clusterId;
    private final NodeId expected;
    private final NodeId actual;

    public IdentityMismatchException(ClusterId clusterId, NodeId expected, NodeId actual) {
        super(ErrorKind.IDENTITY_MISMATCH,
            "identity mismatch for cluster " + clusterId + ": expected " + expected + ", got " + actual);
        this.clusterId = clusterId;
        this.expected = expected;
        this.actual = actual;
    }

    /**
     * Raised by transports, which know node identities but not cluster ids.
     */
    public IdentityMismatchException(NodeId expected, NodeId actual) {
        super(ErrorKind.IDENTITY_MISMATCH, "identity mismatch: dialed " + expected + ", peer presented " + actual);
        this.clusterId = null;
        this.expected = expected;
        this.actual = actual;
    }

    public ClusterId getClusterId() {
        return clusterId;
    }

    public NodeId getExpected() {
        return expected;
    }

    public NodeId getActual() {
        return actual;
    }
}
