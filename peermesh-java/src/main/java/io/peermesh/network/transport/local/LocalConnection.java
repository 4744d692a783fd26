package io.peermesh.network.transport.local;

import io.peermesh.NodeId;
import io.peermesh.error.ConnectionClosedException;
import io.peermesh.network.transport.MeshConnection;
import io.peermesh.network.transport.MeshStream;
import io.peermesh.network.transport.PathQuality;

import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

final class LocalConnection implements MeshConnection {

    private final String id;
    private final LocalEndpoint owner;
    private final NodeId remoteNodeId;
    private final Link link;
    private final AsyncQueue<MeshStream> incomingStreams = new AsyncQueue<>();
    private final Set<LocalStream> streams = ConcurrentHashMap.newKeySet();
    private final AtomicLong bytesSent = new AtomicLong();
    private LocalConnection peer;
    private volatile boolean open = true;

    private volatile Consumer<PathQuality> onPathChange;
    private volatile Consumer<Void> onClose;

    private LocalConnection(String id, LocalEndpoint owner, NodeId remoteNodeId, Link link) {
        this.id = id;
        this.owner = owner;
        this.remoteNodeId = remoteNodeId;
        this.link = link;
    }

    /**
     * Creates both ends of a connection between {@code dialer} and {@code listener}.
     * Index 0 belongs to the dialer.
     */
    static LocalConnection[] pair(String id, LocalEndpoint dialer, LocalEndpoint listener, PathQuality quality) {
        Link link = new Link(quality);
        LocalConnection out = new LocalConnection(id + "-out", dialer, listener.getNodeId(), link);
        LocalConnection in = new LocalConnection(id + "-in", listener, dialer.getNodeId(), link);
        out.peer = in;
        in.peer = out;
        link.ends = new LocalConnection[] { out, in };
        return link.ends;
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public NodeId getRemoteNodeId() {
        return remoteNodeId;
    }

    @Override
    public PathQuality getPathQuality() {
        return link.quality;
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    @Override
    public CompletableFuture<MeshStream> openStream() {
        if (!open) {
            return CompletableFuture.failedFuture(new ConnectionClosedException("connection " + id + " is closed"));
        }
        LocalStream[] ends = LocalStream.pair(link.nextStreamId.incrementAndGet(), this, peer);
        streams.add(ends[0]);
        peer.streams.add(ends[1]);
        if (!peer.incomingStreams.offer(ends[1])) {
            streams.remove(ends[0]);
            return CompletableFuture.failedFuture(new ConnectionClosedException("connection " + id + " is closed"));
        }
        return CompletableFuture.completedFuture(ends[0]);
    }

    @Override
    public CompletableFuture<MeshStream> acceptStream() {
        return incomingStreams.poll();
    }

    @Override
    public CompletableFuture<Void> close() {
        link.close();
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public void setOnPathChange(Consumer<PathQuality> handler) {
        this.onPathChange = handler;
    }

    @Override
    public void setOnClose(Consumer<Void> handler) {
        this.onClose = handler;
    }

    int activeStreams() {
        return streams.size();
    }

    long bytesSent() {
        return bytesSent.get();
    }

    void recordBytesSent(int count) {
        bytesSent.addAndGet(count);
    }

    void forget(LocalStream stream) {
        streams.remove(stream);
    }

    boolean upgrade() {
        return link.upgrade();
    }

    private void teardown() {
        open = false;
        incomingStreams.close(new ConnectionClosedException("connection " + id + " is closed"), true);
        for (LocalStream stream : streams) {
            stream.abort(new ConnectionClosedException("connection " + id + " is closed"));
        }
        streams.clear();
        owner.forget(this);
        Consumer<Void> handler = onClose;
        if (handler != null) {
            handler.accept(null);
        }
    }

    private void notifyPathChange(PathQuality quality) {
        Consumer<PathQuality> handler = onPathChange;
        if (handler != null) {
            handler.accept(quality);
        }
    }

    /**
     * State shared by both ends: the current path and the stream id sequence.
     */
    private static final class Link {
        final AtomicLong nextStreamId = new AtomicLong();
        volatile PathQuality quality;
        volatile boolean closed;
        LocalConnection[] ends;

        Link(PathQuality quality) {
            this.quality = quality;
        }

        boolean upgrade() {
            synchronized (this) {
                if (closed || quality == PathQuality.DIRECT) {
                    return false;
                }
                quality = PathQuality.DIRECT;
            }
            for (LocalConnection end : ends) {
                end.notifyPathChange(PathQuality.DIRECT);
            }
            return true;
        }

        void close() {
            synchronized (this) {
                if (closed) {
                    return;
                }
                closed = true;
            }
            for (LocalConnection end : ends) {
                end.teardown();
            }
        }
    }
}
