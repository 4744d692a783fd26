package io.peermesh.proxy;

import io.peermesh.discovery.DiscoveryManager;
import io.peermesh.discovery.LocalService;
import io.peermesh.discovery.StreamHandler;
import io.peermesh.error.ErrorKind;
import io.peermesh.error.MeshException;
import io.peermesh.error.ProtocolException;
import io.peermesh.network.transport.FramedStream;
import io.peermesh.network.transport.MeshConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Receiving end of the data plane: decodes a request envelope, checks that it targets
 * an endpoint of a local service, forwards it and writes the response envelope back.
 */
public class ProxyStreamHandler implements StreamHandler {

    private static final Logger LOGGER = LoggerFactory.getLogger(ProxyStreamHandler.class);

    public static final String FORBIDDEN = "FORBIDDEN";

    private final DiscoveryManager discovery;
    private final LocalServiceForwarder forwarder;
    private final Duration forwardTimeout;

    private final AtomicLong forwarded = new AtomicLong();
    private final AtomicLong forbidden = new AtomicLong();
    private final AtomicLong forwardFailures = new AtomicLong();

    public ProxyStreamHandler(DiscoveryManager discovery, LocalServiceForwarder forwarder, Duration forwardTimeout) {
        this.discovery = discovery;
        this.forwarder = forwarder;
        this.forwardTimeout = forwardTimeout;
    }

    @Override
    public CompletableFuture<Void> handle(MeshConnection connection, FramedStream stream) {
        stream.setMaxFrameSize(EnvelopeCodec.MAX_FRAME_SIZE);
        return FramedStream.within(stream.readFrame(), forwardTimeout, "proxy request")
            .thenCompose(bytes -> {
                if (bytes == null) {
                    throw new ProtocolException("proxy stream ended before the request");
                }
                return respond(connection, EnvelopeCodec.decodeRequest(bytes));
            })
            .thenCompose(response -> stream.writeFrame(EnvelopeCodec.encodeResponse(response)))
            .thenCompose(v -> stream.stream().finish());
    }

    public long getForwarded() {
        return forwarded.get();
    }

    public long getForbidden() {
        return forbidden.get();
    }

    public long getForwardFailures() {
        return forwardFailures.get();
    }

    private CompletableFuture<ProxyResponse> respond(MeshConnection connection, ProxyRequest request) {
        Optional<LocalService> service = discovery.findLocal(request.service(), request.namespace());
        if (service.isEmpty() || !service.get().hasEndpoint(request.targetAddress(), request.targetPort())) {
            forbidden.incrementAndGet();
            LOGGER.warn("Refusing request from {} for {}:{} ({}.{}): not a local service endpoint",
                connection.getRemoteNodeId().shortId(), request.targetAddress(), request.targetPort(),
                request.service(), request.namespace());
            return CompletableFuture.completedFuture(ProxyResponse.meshError(403, FORBIDDEN,
                request.targetAddress() + ":" + request.targetPort() + " is not an endpoint of " + request.service()));
        }

        return forwarder.forward(request)
            .orTimeout(forwardTimeout.toMillis(), TimeUnit.MILLISECONDS)
            .handle((response, ex) -> {
                if (ex == null) {
                    forwarded.incrementAndGet();
                    return response;
                }
                forwardFailures.incrementAndGet();
                Throwable cause = MeshException.unwrap(ex);
                ErrorKind kind = MeshException.kindOf(cause);
                LOGGER.warn("Forwarding {} {} to {}:{} failed: {}", request.method(), request.uri(),
                    request.targetAddress(), request.targetPort(), cause.getMessage());
                int status = kind == ErrorKind.TIMEOUT ? 504 : 502;
                return ProxyResponse.meshError(status, kind.name(), cause.getMessage());
            });
    }
}
