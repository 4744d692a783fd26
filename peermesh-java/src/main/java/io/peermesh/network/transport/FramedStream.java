package io.peermesh.network.transport;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.peermesh.error.MeshException;
import io.peermesh.error.MeshTimeoutException;
import io.peermesh.error.ProtocolException;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Length-prefixed framing over a {@link MeshStream}: a 4-byte big-endian length
 * followed by the payload. Reads are not thread-safe; one reader per stream.
 */
public class FramedStream {

    public static final int LENGTH_FIELD_SIZE = 4;

    private final MeshStream stream;
    private volatile int maxFrameSize;
    private final ByteBuf buffer = Unpooled.buffer();

    public FramedStream(MeshStream stream, int maxFrameSize) {
        this.stream = stream;
        this.maxFrameSize = maxFrameSize;
    }

    public MeshStream stream() {
        return stream;
    }

    /**
     * Changes the frame limit once the stream kind is known. Buffered bytes are kept.
     */
    public void setMaxFrameSize(int maxFrameSize) {
        this.maxFrameSize = maxFrameSize;
    }

    public CompletableFuture<Void> writeKind(StreamKind kind) {
        return stream.write(new byte[] { kind.code() });
    }

    public CompletableFuture<Void> writeFrame(byte[] payload) {
        if (payload.length > maxFrameSize) {
            return CompletableFuture.failedFuture(new ProtocolException(
                "frame of " + payload.length + " bytes exceeds limit " + maxFrameSize));
        }
        ByteBuf out = Unpooled.buffer(LENGTH_FIELD_SIZE + payload.length);
        try {
            out.writeInt(payload.length);
            out.writeBytes(payload);
            byte[] bytes = new byte[out.readableBytes()];
            out.readBytes(bytes);
            return stream.write(bytes);
        } finally {
            out.release();
        }
    }

    /**
     * Reads the opening tag. Completes with {@code null} if the stream ends first.
     */
    public CompletableFuture<StreamKind> readKind() {
        return readExactly(1, true).thenApply(bytes -> {
            if (bytes == null) {
                return null;
            }
            StreamKind kind = StreamKind.fromCode(bytes[0]);
            if (kind == null) {
                throw new ProtocolException("unknown stream kind " + bytes[0]);
            }
            return kind;
        });
    }

    /**
     * Next complete frame payload. Fails with {@link ProtocolException} on a truncated
     * or oversized frame; completes with {@code null} on a clean end of stream.
     */
    public CompletableFuture<byte[]> readFrame() {
        return readExactly(LENGTH_FIELD_SIZE, true).thenCompose(header -> {
            if (header == null) {
                return CompletableFuture.completedFuture(null);
            }
            int length = ((header[0] & 0xFF) << 24) | ((header[1] & 0xFF) << 16)
                | ((header[2] & 0xFF) << 8) | (header[3] & 0xFF);
            if (length < 0 || length > maxFrameSize) {
                return CompletableFuture.failedFuture(
                    new ProtocolException("frame length " + length + " outside [0, " + maxFrameSize + "]"));
            }
            return readExactly(length, false);
        });
    }

    /**
     * Fails {@code read} with {@link MeshTimeoutException} if the peer has not supplied
     * {@code what} within {@code deadline}.
     */
    public static <T> CompletableFuture<T> within(CompletableFuture<T> read, Duration deadline, String what) {
        return read.orTimeout(deadline.toMillis(), TimeUnit.MILLISECONDS).handle((value, ex) -> {
            if (ex == null) {
                return value;
            }
            Throwable cause = MeshException.unwrap(ex);
            if (cause instanceof TimeoutException) {
                throw new MeshTimeoutException(what + " not received within " + deadline.toMillis() + " ms", cause);
            }
            throw new CompletionException(cause);
        });
    }

    public void release() {
        if (buffer.refCnt() > 0) {
            buffer.release();
        }
    }

    private CompletableFuture<byte[]> readExactly(int length, boolean allowEnd) {
        if (buffer.readableBytes() >= length) {
            byte[] out = new byte[length];
            buffer.readBytes(out);
            buffer.discardReadBytes();
            return CompletableFuture.completedFuture(out);
        }
        return stream.read().thenCompose(chunk -> {
            if (chunk == null) {
                if (allowEnd && buffer.readableBytes() == 0) {
                    return CompletableFuture.completedFuture(null);
                }
                return CompletableFuture.failedFuture(new ProtocolException("stream ended inside a frame"));
            }
            buffer.writeBytes(chunk);
            return readExactly(length, allowEnd);
        });
    }
}
