package io.peermesh.discovery;

import io.peermesh.error.MeshException;
import io.peermesh.error.ProtocolException;
import io.peermesh.network.transport.Endpoint;
import io.peermesh.network.transport.FramedStream;
import io.peermesh.network.transport.MeshConnection;
import io.peermesh.network.transport.MeshStream;
import io.peermesh.network.transport.StreamKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Accepts peer connections on the local {@link Endpoint} and serves their streams.
 *
 * <p>Each accepted connection and each accepted stream is served as its own task on the
 * worker executor. Discovery streams are answered from the {@link DiscoveryManager};
 * other kinds go to the handler registered for them. A malformed, denied or
 * unsupported stream is reset on its own and never takes the connection down.
 */
public class DiscoveryServer {

    private static final Logger LOGGER = LoggerFactory.getLogger(DiscoveryServer.class);

    private final Endpoint endpoint;
    private final DiscoveryManager discovery;
    private final QueryAuthorizer authorizer;
    private final Executor workers;
    private final Map<StreamKind, StreamHandler> handlers = new ConcurrentHashMap<>();
    private final Set<MeshConnection> connections = ConcurrentHashMap.newKeySet();
    private volatile boolean running = false;

    private final AtomicLong connectionsAccepted = new AtomicLong();
    private final AtomicLong streamsAccepted = new AtomicLong();
    private final AtomicLong queriesServed = new AtomicLong();
    private final AtomicLong queriesDenied = new AtomicLong();
    private final AtomicLong streamsRejected = new AtomicLong();

    public DiscoveryServer(Endpoint endpoint, DiscoveryManager discovery, QueryAuthorizer authorizer, Executor workers) {
        this.endpoint = endpoint;
        this.discovery = discovery;
        this.authorizer = authorizer;
        this.workers = workers;
    }

    /**
     * Routes streams opened with {@code kind} to {@code handler}.
     */
    public void registerHandler(StreamKind kind, StreamHandler handler) {
        if (kind == StreamKind.DISCOVERY) {
            throw new IllegalArgumentException("discovery streams are served by the discovery server itself");
        }
        handlers.put(kind, handler);
    }

    public void start() {
        if (running) {
            return;
        }
        running = true;
        LOGGER.info("Discovery server listening as node {}", endpoint.getNodeId().shortId());
        acceptNext();
    }

    public void stop() {
        running = false;
        for (MeshConnection connection : new ArrayList<>(connections)) {
            connection.close();
        }
        connections.clear();
    }

    public boolean isRunning() {
        return running;
    }

    public Stats getStats() {
        return new Stats(
            connectionsAccepted.get(),
            connections.size(),
            streamsAccepted.get(),
            queriesServed.get(),
            queriesDenied.get(),
            streamsRejected.get()
        );
    }

    private void acceptNext() {
        if (!running) {
            return;
        }
        endpoint.accept().whenCompleteAsync((connection, ex) -> {
            if (ex != null) {
                if (running && endpoint.isOpen()) {
                    LOGGER.warn("Accept failed, continuing", MeshException.unwrap(ex));
                    acceptNext();
                } else {
                    LOGGER.debug("Endpoint closed, accept loop finished");
                }
                return;
            }
            if (connection != null) {
                connectionsAccepted.incrementAndGet();
                connections.add(connection);
                connection.setOnClose(v -> connections.remove(connection));
                LOGGER.debug("Accepted connection {} from {}", connection.getId(), connection.getRemoteNodeId().shortId());
                acceptStreams(connection);
            }
            acceptNext();
        }, workers);
    }

    private void acceptStreams(MeshConnection connection) {
        if (!running || !connection.isOpen()) {
            return;
        }
        connection.acceptStream().whenCompleteAsync((stream, ex) -> {
            if (ex != null || stream == null) {
                LOGGER.debug("Connection {} stopped yielding streams", connection.getId());
                connections.remove(connection);
                return;
            }
            streamsAccepted.incrementAndGet();
            workers.execute(() -> serve(connection, stream));
            acceptStreams(connection);
        }, workers);
    }

    private void serve(MeshConnection connection, MeshStream stream) {
        FramedStream framed = new FramedStream(stream, DiscoveryCodec.MAX_FRAME_SIZE);
        Duration deadline = discovery.getOptions().queryTimeout();
        FramedStream.within(framed.readKind(), deadline, "stream kind")
            .thenCompose(kind -> {
                if (kind == null) {
                    return CompletableFuture.<Void>completedFuture(null);
                }
                if (kind == StreamKind.DISCOVERY) {
                    return answer(connection, framed, deadline);
                }
                StreamHandler handler = handlers.get(kind);
                if (handler == null) {
                    return CompletableFuture.<Void>failedFuture(new ProtocolException("no handler for " + kind + " streams"));
                }
                return handler.handle(connection, framed);
            })
            .whenComplete((v, ex) -> {
                if (ex != null) {
                    streamsRejected.incrementAndGet();
                    LOGGER.warn("Resetting stream {} from {}: {}", stream.getId(),
                        connection.getRemoteNodeId().shortId(), MeshException.unwrap(ex).getMessage());
                    stream.reset();
                }
                framed.release();
            });
    }

    private CompletableFuture<Void> answer(MeshConnection connection, FramedStream framed, Duration deadline) {
        return FramedStream.within(framed.readFrame(), deadline, "discovery query").thenCompose(bytes -> {
            if (bytes == null) {
                throw new ProtocolException("discovery stream ended before the query");
            }
            DiscoveryQuery query = DiscoveryCodec.decodeQuery(bytes);
            if (!authorizer.authorize(connection.getRemoteNodeId(), query)) {
                queriesDenied.incrementAndGet();
                throw new ProtocolException("query for " + query.service() + "." + query.namespace() + " denied");
            }
            DiscoveryResponse response = discovery.answerQuery(query);
            queriesServed.incrementAndGet();
            return framed.writeFrame(DiscoveryCodec.encodeResponse(response))
                .thenCompose(v -> framed.stream().finish());
        });
    }

    public record Stats(
        long connectionsAccepted,
        int openConnections,
        long streamsAccepted,
        long queriesServed,
        long queriesDenied,
        long streamsRejected
    ) {}
}
