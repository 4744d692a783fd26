package io.peermesh.error;

public class ConfigurationException extends MeshException {

    private static final long serialVersionUID = 1L;

    public ConfigurationException(String message) {
        super(ErrorKind.CONFIGURATION, message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(ErrorKind.CONFIGURATION, message, cause);
    }
}
