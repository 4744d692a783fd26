package io.peermesh.discovery;

import io.peermesh.network.transport.FramedStream;
import io.peermesh.network.transport.MeshConnection;

import java.util.concurrent.CompletableFuture;

/**
 * Serves one accepted stream whose kind tag has already been read.
 */
@FunctionalInterface
public interface StreamHandler {

    CompletableFuture<Void> handle(MeshConnection connection, FramedStream stream);
}
