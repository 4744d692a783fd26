package io.peermesh.network.transport;

import io.peermesh.NodeId;

import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * An authenticated session with one remote node carrying any number of streams.
 */
public interface MeshConnection {

    String getId();

    NodeId getRemoteNodeId();

    /**
     * May move from {@link PathQuality#RELAYED} to {@link PathQuality#DIRECT} while the
     * connection stays open. Streams survive the change.
     */
    PathQuality getPathQuality();

    boolean isOpen();

    CompletableFuture<MeshStream> openStream();

    CompletableFuture<MeshStream> acceptStream();

    CompletableFuture<Void> close();

    void setOnPathChange(Consumer<PathQuality> handler);

    void setOnClose(Consumer<Void> handler);
}
