package io.peermesh.agent;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.codec.http.HttpUtil;
import io.netty.handler.codec.http.HttpVersion;
import io.netty.handler.codec.http.QueryStringDecoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * Read-only HTTP surface of the agent: {@code GET /status} and {@code GET /healthz}.
 */
public class StatusServer {

    private static final Logger LOGGER = LoggerFactory.getLogger(StatusServer.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final String bindAddress;
    private final int port;
    private final EventLoopGroup bossGroup;
    private final EventLoopGroup workerGroup;
    private final Supplier<ClusterStatus> status;
    private volatile Channel serverChannel;

    public StatusServer(String bindAddress, int port, EventLoopGroup bossGroup, EventLoopGroup workerGroup,
                        Supplier<ClusterStatus> status) {
        this.bindAddress = bindAddress;
        this.port = port;
        this.bossGroup = bossGroup;
        this.workerGroup = workerGroup;
        this.status = status;
    }

    public CompletableFuture<InetSocketAddress> start() {
        CompletableFuture<InetSocketAddress> future = new CompletableFuture<>();
        ServerBootstrap bootstrap = new ServerBootstrap()
            .group(bossGroup, workerGroup)
            .channel(NioServerSocketChannel.class)
            .childHandler(new ChannelInitializer<SocketChannel>() {
                @Override
                protected void initChannel(SocketChannel ch) {
                    ChannelPipeline p = ch.pipeline();
                    p.addLast(new HttpServerCodec());
                    p.addLast(new HttpObjectAggregator(64 * 1024));
                    p.addLast(new StatusHandler());
                }
            });

        ChannelFuture bindFuture = bootstrap.bind(bindAddress, port);
        bindFuture.addListener((ChannelFutureListener) f -> {
            if (f.isSuccess()) {
                serverChannel = f.channel();
                InetSocketAddress bound = (InetSocketAddress) serverChannel.localAddress();
                LOGGER.info("Agent status endpoint listening on {}", bound);
                future.complete(bound);
            } else {
                future.completeExceptionally(f.cause());
            }
        });
        return future;
    }

    public CompletableFuture<Void> stop() {
        CompletableFuture<Void> future = new CompletableFuture<>();
        Channel channel = serverChannel;
        if (channel == null) {
            future.complete(null);
        } else {
            channel.close().addListener(f -> future.complete(null));
        }
        return future;
    }

    private class StatusHandler extends SimpleChannelInboundHandler<FullHttpRequest> {

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest request) {
            String path = new QueryStringDecoder(request.uri()).path();
            if (!HttpMethod.GET.equals(request.method())) {
                respond(ctx, request, HttpResponseStatus.METHOD_NOT_ALLOWED, "text/plain", "method not allowed");
                return;
            }
            switch (path) {
                case "/healthz" -> respond(ctx, request, HttpResponseStatus.OK, "text/plain", "ok");
                case "/status" -> {
                    try {
                        String body = MAPPER.writeValueAsString(status.get());
                        respond(ctx, request, HttpResponseStatus.OK, "application/json", body);
                    } catch (JsonProcessingException e) {
                        LOGGER.error("Cannot render status", e);
                        respond(ctx, request, HttpResponseStatus.INTERNAL_SERVER_ERROR, "text/plain", e.getMessage());
                    }
                }
                default -> respond(ctx, request, HttpResponseStatus.NOT_FOUND, "text/plain", "not found");
            }
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
            LOGGER.warn("Status connection failed", cause);
            ctx.close();
        }

        private void respond(ChannelHandlerContext ctx, FullHttpRequest request, HttpResponseStatus code,
                             String contentType, String body) {
            FullHttpResponse response = new DefaultFullHttpResponse(
                HttpVersion.HTTP_1_1, code, Unpooled.copiedBuffer(body, StandardCharsets.UTF_8));
            response.headers().set(HttpHeaderNames.CONTENT_TYPE, contentType + "; charset=utf-8");
            response.headers().setInt(HttpHeaderNames.CONTENT_LENGTH, response.content().readableBytes());
            boolean keepAlive = HttpUtil.isKeepAlive(request);
            HttpUtil.setKeepAlive(response, keepAlive);
            ChannelFuture written = ctx.writeAndFlush(response);
            if (!keepAlive) {
                written.addListener(ChannelFutureListener.CLOSE);
            }
        }
    }
}
