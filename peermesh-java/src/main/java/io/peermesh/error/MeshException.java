package io.peermesh.error;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Base class of every failure the mesh surfaces to its callers.
 */
public abstract class MeshException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final ErrorKind kind;

    protected MeshException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected MeshException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }

    /**
     * Strips the wrappers added by {@code CompletableFuture} composition.
     */
    public static Throwable unwrap(Throwable t) {
        Throwable current = t;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    /**
     * Classifies a failure. I/O failures count as {@link ErrorKind#UNREACHABLE}; anything
     * else that is not a mesh failure is a local fault and counts as {@link ErrorKind#INTERNAL}.
     */
    public static ErrorKind kindOf(Throwable t) {
        Throwable cause = unwrap(t);
        if (cause instanceof MeshException mesh) {
            return mesh.getKind();
        }
        if (cause instanceof TimeoutException) {
            return ErrorKind.TIMEOUT;
        }
        if (isIoFailure(cause)) {
            return ErrorKind.UNREACHABLE;
        }
        return ErrorKind.INTERNAL;
    }

    /**
     * Converts any failure into a {@link MeshException}, keeping mesh failures as they are.
     */
    public static MeshException wrap(Throwable t, String context) {
        Throwable cause = unwrap(t);
        if (cause instanceof MeshException mesh) {
            return mesh;
        }
        if (cause instanceof TimeoutException) {
            return new MeshTimeoutException(context + ": deadline exceeded", cause);
        }
        if (isIoFailure(cause)) {
            return new UnreachableException(context + ": " + cause.getMessage(), cause);
        }
        return new InternalMeshException(context + ": " + cause, cause);
    }

    private static boolean isIoFailure(Throwable cause) {
        return cause instanceof IOException || cause instanceof UncheckedIOException;
    }
}
