package io.peermesh.proxy;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.codec.http.HttpUtil;
import io.netty.handler.codec.http.HttpVersion;
import io.peermesh.error.ErrorKind;
import io.peermesh.error.MeshException;
import io.peermesh.routing.Destination;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/**
 * Plain HTTP proxy front end. Applications send requests to it with a mesh host name
 * ({@code service.namespace.cluster.mesh}) or with an {@code X-Mesh-Cluster} header.
 * Mesh failures come back as generated responses carrying {@code X-Mesh-Error}.
 */
public class HttpProxyInterceptor implements TrafficInterceptor {

    private static final Logger LOGGER = LoggerFactory.getLogger(HttpProxyInterceptor.class);

    public static final String CLUSTER_HINT_HEADER = "X-Mesh-Cluster";

    static final int MAX_INITIAL_LINE_LENGTH = 4096;
    static final int MAX_HEADER_SIZE = 8192;

    private static final Set<String> HOP_BY_HOP = Set.of(
        "connection", "keep-alive", "proxy-connection", "transfer-encoding", "upgrade", "te", "trailer",
        "x-mesh-cluster"
    );

    private final String bindAddress;
    private final int port;
    private final EventLoopGroup bossGroup;
    private final EventLoopGroup workerGroup;
    private volatile Channel serverChannel;

    public HttpProxyInterceptor(String bindAddress, int port, EventLoopGroup bossGroup, EventLoopGroup workerGroup) {
        this.bindAddress = bindAddress;
        this.port = port;
        this.bossGroup = bossGroup;
        this.workerGroup = workerGroup;
    }

    /**
     * HTTP status reported to the client for a mesh failure.
     */
    public static int statusFor(ErrorKind kind) {
        return switch (kind) {
            case CIRCUIT_OPEN, NO_ENDPOINTS -> 503;
            case NOT_FOUND -> 404;
            case UNROUTABLE -> 400;
            case TIMEOUT -> 504;
            default -> 502;
        };
    }

    public static ProxyResponse errorResponse(Throwable failure) {
        Throwable cause = MeshException.unwrap(failure);
        ErrorKind kind = MeshException.kindOf(cause);
        return ProxyResponse.meshError(statusFor(kind), kind.name(), cause.getMessage());
    }

    @Override
    public CompletableFuture<InetSocketAddress> start(Function<InterceptedRequest, CompletableFuture<ProxyResponse>> handler) {
        CompletableFuture<InetSocketAddress> future = new CompletableFuture<>();
        ServerBootstrap bootstrap = new ServerBootstrap()
            .group(bossGroup, workerGroup)
            .channel(NioServerSocketChannel.class)
            .option(ChannelOption.SO_REUSEADDR, true)
            .childOption(ChannelOption.TCP_NODELAY, true)
            .childHandler(new ChannelInitializer<SocketChannel>() {
                @Override
                protected void initChannel(SocketChannel ch) {
                    ChannelPipeline p = ch.pipeline();
                    p.addLast(new HttpServerCodec(MAX_INITIAL_LINE_LENGTH, MAX_HEADER_SIZE, 8192));
                    // larger bodies get a 413 from the aggregator
                    p.addLast(new HttpObjectAggregator(EnvelopeCodec.MAX_BODY_SIZE));
                    p.addLast(new InterceptHandler(handler));
                }
            });

        ChannelFuture bindFuture = bootstrap.bind(bindAddress, port);
        bindFuture.addListener((ChannelFutureListener) f -> {
            if (f.isSuccess()) {
                serverChannel = f.channel();
                InetSocketAddress bound = (InetSocketAddress) serverChannel.localAddress();
                LOGGER.info("HTTP proxy listening on {}", bound);
                future.complete(bound);
            } else {
                future.completeExceptionally(f.cause());
            }
        });
        return future;
    }

    @Override
    public CompletableFuture<Void> stop() {
        CompletableFuture<Void> future = new CompletableFuture<>();
        Channel channel = serverChannel;
        if (channel == null) {
            future.complete(null);
            return future;
        }
        channel.close().addListener(f -> future.complete(null));
        return future;
    }

    static InterceptedRequest toIntercepted(FullHttpRequest request) {
        String hint = request.headers().get(CLUSTER_HINT_HEADER);
        Destination destination = Destination.fromHostHeader(request.headers().get(HttpHeaderNames.HOST), hint);
        List<Header> headers = new ArrayList<>();
        for (Map.Entry<String, String> entry : request.headers()) {
            if (!HOP_BY_HOP.contains(entry.getKey().toLowerCase(Locale.ROOT))) {
                headers.add(new Header(entry.getKey(), entry.getValue()));
            }
        }
        return new InterceptedRequest(
            request.method().name(),
            request.uri(),
            destination,
            headers,
            ByteBufUtil.getBytes(request.content())
        );
    }

    private static final class InterceptHandler extends SimpleChannelInboundHandler<FullHttpRequest> {

        private final Function<InterceptedRequest, CompletableFuture<ProxyResponse>> handler;

        InterceptHandler(Function<InterceptedRequest, CompletableFuture<ProxyResponse>> handler) {
            this.handler = handler;
        }

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest request) {
            boolean keepAlive = HttpUtil.isKeepAlive(request);
            InterceptedRequest intercepted = toIntercepted(request);
            CompletableFuture<ProxyResponse> pending;
            try {
                pending = handler.apply(intercepted);
            } catch (RuntimeException e) {
                pending = CompletableFuture.failedFuture(e);
            }
            pending.whenComplete((response, ex) -> {
                ProxyResponse result = ex == null ? response : errorResponse(ex);
                if (ex != null) {
                    LOGGER.debug("{} {} failed: {}", intercepted.method(), intercepted.uri(), MeshException.unwrap(ex).getMessage());
                }
                write(ctx, result, keepAlive);
            });
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
            LOGGER.warn("Proxy client connection failed", cause);
            ctx.close();
        }

        private static void write(ChannelHandlerContext ctx, ProxyResponse response, boolean keepAlive) {
            FullHttpResponse out = new DefaultFullHttpResponse(
                HttpVersion.HTTP_1_1,
                HttpResponseStatus.valueOf(response.status()),
                Unpooled.wrappedBuffer(response.body())
            );
            for (Header header : response.headers()) {
                if (!HOP_BY_HOP.contains(header.name().toLowerCase(Locale.ROOT))) {
                    out.headers().add(header.name(), header.value());
                }
            }
            out.headers().setInt(HttpHeaderNames.CONTENT_LENGTH, response.body().length);
            HttpUtil.setKeepAlive(out, keepAlive);
            ChannelFuture written = ctx.writeAndFlush(out);
            if (!keepAlive) {
                written.addListener(ChannelFutureListener.CLOSE);
            }
        }
    }
}
