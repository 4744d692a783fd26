package io.peermesh.error;

public class CircuitOpenException extends MeshException {

    private static final long serialVersionUID = 1L;

    public CircuitOpenException(String message) {
        super(ErrorKind.CIRCUIT_OPEN, message);
    }

    public CircuitOpenException(String message, Throwable cause) {
        super(ErrorKind.CIRCUIT_OPEN, message, cause);
    }
}
