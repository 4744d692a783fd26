package io.peermesh.proxy;

import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.http.DefaultFullHttpRequest;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpClientCodec;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpVersion;
import io.peermesh.error.ConnectionClosedException;
import io.peermesh.error.ConnectionRefusedException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Forwards requests to local service instances over plain HTTP/1.1, one connection
 * per request.
 */
public class NettyHttpForwarder implements LocalServiceForwarder {

    private final EventLoopGroup group;
    private final Duration connectTimeout;

    public NettyHttpForwarder(EventLoopGroup group, Duration connectTimeout) {
        this.group = group;
        this.connectTimeout = connectTimeout;
    }

    @Override
    public CompletableFuture<ProxyResponse> forward(ProxyRequest request) {
        CompletableFuture<ProxyResponse> future = new CompletableFuture<>();
        FullHttpRequest outbound = toNetty(request);

        Bootstrap bootstrap = new Bootstrap()
            .group(group)
            .channel(NioSocketChannel.class)
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) connectTimeout.toMillis())
            .option(ChannelOption.TCP_NODELAY, true)
            .handler(new ChannelInitializer<SocketChannel>() {
                @Override
                protected void initChannel(SocketChannel ch) {
                    ChannelPipeline p = ch.pipeline();
                    p.addLast(new HttpClientCodec());
                    p.addLast(new HttpObjectAggregator(EnvelopeCodec.MAX_FRAME_SIZE));
                    p.addLast(new ResponseHandler(future));
                }
            });

        bootstrap.connect(request.targetAddress(), request.targetPort()).addListener((ChannelFutureListener) f -> {
            if (!f.isSuccess()) {
                outbound.release();
                future.completeExceptionally(new ConnectionRefusedException(
                    "cannot reach " + request.targetAddress() + ":" + request.targetPort(), f.cause()));
                return;
            }
            f.channel().writeAndFlush(outbound).addListener((ChannelFutureListener) w -> {
                if (!w.isSuccess()) {
                    future.completeExceptionally(new ConnectionClosedException("request write failed", w.cause()));
                    w.channel().close();
                }
            });
            future.whenComplete((r, ex) -> f.channel().close());
        });
        return future;
    }

    private static FullHttpRequest toNetty(ProxyRequest request) {
        FullHttpRequest outbound = new DefaultFullHttpRequest(
            HttpVersion.HTTP_1_1,
            HttpMethod.valueOf(request.method()),
            request.uri(),
            Unpooled.wrappedBuffer(request.body())
        );
        for (Header header : request.headers()) {
            outbound.headers().add(header.name(), header.value());
        }
        outbound.headers().set(HttpHeaderNames.HOST, request.targetAddress() + ":" + request.targetPort());
        outbound.headers().set(HttpHeaderNames.CONNECTION, HttpHeaderValues.CLOSE);
        outbound.headers().remove(HttpHeaderNames.TRANSFER_ENCODING);
        outbound.headers().setInt(HttpHeaderNames.CONTENT_LENGTH, request.body().length);
        return outbound;
    }

    private static final class ResponseHandler extends SimpleChannelInboundHandler<FullHttpResponse> {

        private final CompletableFuture<ProxyResponse> future;

        ResponseHandler(CompletableFuture<ProxyResponse> future) {
            this.future = future;
        }

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, FullHttpResponse response) {
            List<Header> headers = new ArrayList<>();
            for (Map.Entry<String, String> entry : response.headers()) {
                headers.add(new Header(entry.getKey(), entry.getValue()));
            }
            future.complete(new ProxyResponse(
                response.status().code(),
                headers,
                ByteBufUtil.getBytes(response.content())
            ));
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx) {
            future.completeExceptionally(new ConnectionClosedException("local service closed the connection"));
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
            future.completeExceptionally(new ConnectionClosedException("local service connection failed", cause));
            ctx.close();
        }
    }
}
