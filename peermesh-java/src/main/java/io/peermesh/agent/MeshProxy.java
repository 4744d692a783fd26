package io.peermesh.agent;

import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.peermesh.config.MeshConfig;
import io.peermesh.network.transport.StreamKind;
import io.peermesh.proxy.HttpProxyInterceptor;
import io.peermesh.proxy.LocalServiceForwarder;
import io.peermesh.proxy.NettyHttpForwarder;
import io.peermesh.proxy.ProxyStreamHandler;
import io.peermesh.proxy.TrafficInterceptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * Data-plane side of a mesh node. Outbound, it feeds intercepted requests to the
 * node's traffic router; inbound, it serves {@code PROXY} streams from peers by
 * forwarding to local service instances.
 */
public class MeshProxy {

    private static final Logger LOGGER = LoggerFactory.getLogger(MeshProxy.class);

    private final MeshNode node;
    private final TrafficInterceptor interceptor;
    private final ProxyStreamHandler inbound;
    private final EventLoopGroup bossGroup;
    private final EventLoopGroup workerGroup;

    /**
     * HTTP interception on the configured proxy address, forwarding over HTTP/1.1.
     */
    public MeshProxy(MeshNode node) {
        MeshConfig config = node.getConfig();
        this.node = node;
        this.bossGroup = new NioEventLoopGroup(1);
        this.workerGroup = new NioEventLoopGroup();
        this.interceptor = new HttpProxyInterceptor(config.proxy.bindAddress, config.proxy.port, bossGroup, workerGroup);
        this.inbound = new ProxyStreamHandler(node.getDiscoveryManager(),
            new NettyHttpForwarder(workerGroup, Duration.ofMillis(config.connection.connectTimeoutMs)),
            Duration.ofMillis(config.proxy.requestTimeoutMs));
        node.getDiscoveryServer().registerHandler(StreamKind.PROXY, inbound);
    }

    public MeshProxy(MeshNode node, TrafficInterceptor interceptor, LocalServiceForwarder forwarder) {
        this.node = node;
        this.bossGroup = null;
        this.workerGroup = null;
        this.interceptor = interceptor;
        this.inbound = new ProxyStreamHandler(node.getDiscoveryManager(), forwarder,
            Duration.ofMillis(node.getConfig().proxy.requestTimeoutMs));
        node.getDiscoveryServer().registerHandler(StreamKind.PROXY, inbound);
    }

    public CompletableFuture<InetSocketAddress> start() {
        return interceptor.start(node.getTrafficRouter()::handle).whenComplete((bound, ex) -> {
            if (ex != null) {
                LOGGER.error("Proxy for cluster {} failed to start", node.getClusterId(), ex);
            }
        });
    }

    public CompletableFuture<Void> stop() {
        return interceptor.stop().whenComplete((v, ex) -> {
            if (bossGroup != null) {
                bossGroup.shutdownGracefully();
                workerGroup.shutdownGracefully();
            }
        });
    }

    public ProxyStreamHandler getInboundHandler() {
        return inbound;
    }
}
