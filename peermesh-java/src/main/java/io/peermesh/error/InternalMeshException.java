package io.peermesh.error;

/**
 * A local fault that is neither an I/O failure nor a remote answer. Never retried.
 */
public class InternalMeshException extends MeshException {

    private static final long serialVersionUID = 1L;

    public InternalMeshException(String message, Throwable cause) {
        super(ErrorKind.INTERNAL, message, cause);
    }
}
