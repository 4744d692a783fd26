package io.peermesh.error;

/**
 * A deadline expired at a suspension point: connect, discovery round trip or proxied request.
 */
public class MeshTimeoutException extends MeshException {

    private static final long serialVersionUID = 1L;

    public MeshTimeoutException(String message) {
        super(ErrorKind.TIMEOUT, message);
    }

    public MeshTimeoutException(String message, Throwable cause) {
        super(ErrorKind.TIMEOUT, message, cause);
    }
}
