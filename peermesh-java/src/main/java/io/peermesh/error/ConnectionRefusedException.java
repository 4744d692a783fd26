package io.peermesh.error;

public class ConnectionRefusedException extends MeshException {

    private static final long serialVersionUID = 1L;

    public ConnectionRefusedException(String message) {
        super(ErrorKind.REFUSED, message);
    }

    public ConnectionRefusedException(String message, Throwable cause) {
        super(ErrorKind.REFUSED, message, cause);
    }
}
