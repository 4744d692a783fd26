package io.peermesh.error;

public class ConnectionClosedException extends MeshException {

    private static final long serialVersionUID = 1L;

    public ConnectionClosedException(String message) {
        super(ErrorKind.CONNECTION_CLOSED, message);
    }

    public ConnectionClosedException(String message, Throwable cause) {
        super(ErrorKind.CONNECTION_CLOSED, message, cause);
    }
}
