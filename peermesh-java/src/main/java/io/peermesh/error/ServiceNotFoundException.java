package io.peermesh.error;

/**
 * The addressed service does not exist in the target cluster. A valid negative answer.
 */
public class ServiceNotFoundException extends MeshException {

    private static final long serialVersionUID = 1L;

    public ServiceNotFoundException(String message) {
        super(ErrorKind.NOT_FOUND, message);
    }

    public ServiceNotFoundException(String message, Throwable cause) {
        super(ErrorKind.NOT_FOUND, message, cause);
    }
}
