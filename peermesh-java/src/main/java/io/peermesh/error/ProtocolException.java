package io.peermesh.error;

/**
 * A peer sent bytes that do not decode as the expected message.
 */
public class ProtocolException extends MeshException {

    private static final long serialVersionUID = 1L;

    public ProtocolException(String message) {
        super(ErrorKind.PROTOCOL, message);
    }

    public ProtocolException(String message, Throwable cause) {
        super(ErrorKind.PROTOCOL, message, cause);
    }
}
