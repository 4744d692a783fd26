package io.peermesh.error;

/**
 * Every connection path to a cluster has been exhausted.
 */
public class UnreachableException extends MeshException {

    private static final long serialVersionUID = 1L;

    public UnreachableException(String message) {
        super(ErrorKind.UNREACHABLE, message);
    }

    public UnreachableException(String message, Throwable cause) {
        super(ErrorKind.UNREACHABLE, message, cause);
    }
}
