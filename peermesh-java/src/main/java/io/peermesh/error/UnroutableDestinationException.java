package io.peermesh.error;

public class UnroutableDestinationException extends MeshException {

    private static final long serialVersionUID = 1L;

    public UnroutableDestinationException(String message) {
        super(ErrorKind.UNROUTABLE, message);
    }

    public UnroutableDestinationException(String message, Throwable cause) {
        super(ErrorKind.UNROUTABLE, message, cause);
    }
}
