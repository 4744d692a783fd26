package io.peermesh.network.transport.local;

import io.peermesh.error.ConnectionClosedException;
import io.peermesh.network.transport.MeshStream;

import java.util.Arrays;
import java.util.concurrent.CompletableFuture;

final class LocalStream implements MeshStream {

    private final long id;
    private final LocalConnection owner;
    private final AsyncQueue<byte[]> inbound = new AsyncQueue<>();
    private LocalStream peer;
    private volatile boolean writeFinished = false;
    private volatile boolean reset = false;

    LocalStream(long id, LocalConnection owner) {
        this.id = id;
        this.owner = owner;
    }

    static LocalStream[] pair(long id, LocalConnection opener, LocalConnection acceptor) {
        LocalStream a = new LocalStream(id, opener);
        LocalStream b = new LocalStream(id, acceptor);
        a.peer = b;
        b.peer = a;
        return new LocalStream[] { a, b };
    }

    @Override
    public long getId() {
        return id;
    }

    @Override
    public CompletableFuture<Void> write(byte[] data) {
        if (reset) {
            return CompletableFuture.failedFuture(new ConnectionClosedException("stream " + id + " was reset"));
        }
        if (writeFinished) {
            return CompletableFuture.failedFuture(new IllegalStateException("stream " + id + " already finished"));
        }
        if (!peer.inbound.offer(Arrays.copyOf(data, data.length))) {
            return CompletableFuture.failedFuture(new ConnectionClosedException("stream " + id + " closed by peer"));
        }
        owner.recordBytesSent(data.length);
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public CompletableFuture<byte[]> read() {
        return inbound.poll();
    }

    @Override
    public CompletableFuture<Void> finish() {
        writeFinished = true;
        peer.inbound.close(null, false);
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public void reset() {
        abort(new ConnectionClosedException("stream " + id + " was reset"));
        peer.abort(new ConnectionClosedException("stream " + id + " reset by peer"));
    }

    void abort(Throwable reason) {
        reset = true;
        inbound.close(reason, true);
        owner.forget(this);
    }

    @Override
    public boolean isOpen() {
        return !reset && !(writeFinished && inbound.isClosed());
    }
}
