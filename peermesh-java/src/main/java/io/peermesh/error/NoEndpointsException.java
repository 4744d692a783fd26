package io.peermesh.error;

/**
 * Discovery returned an empty candidate set for the route.
 */
public class NoEndpointsException extends MeshException {

    private static final long serialVersionUID = 1L;

    public NoEndpointsException(String message) {
        super(ErrorKind.NO_ENDPOINTS, message);
    }

    public NoEndpointsException(String message, Throwable cause) {
        super(ErrorKind.NO_ENDPOINTS, message, cause);
    }
}
