package io.peermesh.network.transport;

import java.util.concurrent.CompletableFuture;

/**
 * Bidirectional byte channel inside a {@link MeshConnection}.
 */
public interface MeshStream {

    long getId();

    CompletableFuture<Void> write(byte[] data);

    /**
     * Next chunk of bytes sent by the peer, or {@code null} once the peer has finished
     * its side. Chunk boundaries carry no meaning.
     */
    CompletableFuture<byte[]> read();

    /**
     * Half-closes the write side. Reading stays possible.
     */
    CompletableFuture<Void> finish();

    /**
     * Aborts both directions. The owning connection is unaffected.
     */
    void reset();

    boolean isOpen();
}
