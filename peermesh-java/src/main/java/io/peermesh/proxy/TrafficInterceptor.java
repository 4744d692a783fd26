package io.peermesh.proxy;

import java.net.InetSocketAddress;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/**
 * Captures application traffic and hands each request to the mesh. The HTTP proxy is
 * one mechanism; others can be plugged in at configuration time.
 */
public interface TrafficInterceptor {

    /**
     * Starts intercepting. Completes with the bound address.
     */
    CompletableFuture<InetSocketAddress> start(Function<InterceptedRequest, CompletableFuture<ProxyResponse>> handler);

    CompletableFuture<Void> stop();
}
