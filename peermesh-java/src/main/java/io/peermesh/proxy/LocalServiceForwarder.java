package io.peermesh.proxy;

import java.util.concurrent.CompletableFuture;

/**
 * Delivers a request that arrived over the mesh to the local service instance it names.
 */
@FunctionalInterface
public interface LocalServiceForwarder {

    CompletableFuture<ProxyResponse> forward(ProxyRequest request);
}
