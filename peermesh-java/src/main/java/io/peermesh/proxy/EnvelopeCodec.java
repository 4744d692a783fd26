package io.peermesh.proxy;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.peermesh.error.ProtocolException;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Binary envelopes for the data plane. Strings are a 4-byte length followed by UTF-8;
 * header lists are a count followed by name/value pairs; bodies are length-prefixed.
 * Each envelope travels as one frame on a {@code PROXY} stream.
 */
public final class EnvelopeCodec {

    public static final int MAX_FRAME_SIZE = 1024 * 1024;

    /**
     * Largest request body the proxy accepts. The rest of the frame is left for the
     * request line, the headers and their length fields.
     */
    public static final int MAX_BODY_SIZE = MAX_FRAME_SIZE - 64 * 1024;

    private EnvelopeCodec() {}

    public static byte[] encodeRequest(ProxyRequest request) {
        ByteBuf buf = Unpooled.buffer();
        try {
            writeString(buf, request.method());
            writeString(buf, request.uri());
            writeString(buf, request.service());
            writeString(buf, request.namespace());
            writeString(buf, request.targetAddress());
            buf.writeInt(request.targetPort());
            writeHeaders(buf, request.headers());
            writeBytes(buf, request.body());
            return toArray(buf);
        } finally {
            buf.release();
        }
    }

    public static ProxyRequest decodeRequest(byte[] bytes) {
        ByteBuf buf = Unpooled.wrappedBuffer(bytes);
        try {
            ProxyRequest request = new ProxyRequest(
                readString(buf),
                readString(buf),
                readString(buf),
                readString(buf),
                readString(buf),
                buf.readInt(),
                readHeaders(buf),
                readBytes(buf)
            );
            expectEnd(buf);
            return request;
        } catch (IndexOutOfBoundsException e) {
            throw new ProtocolException("truncated request envelope", e);
        } finally {
            buf.release();
        }
    }

    public static byte[] encodeResponse(ProxyResponse response) {
        ByteBuf buf = Unpooled.buffer();
        try {
            buf.writeShort(response.status());
            writeHeaders(buf, response.headers());
            writeBytes(buf, response.body());
            return toArray(buf);
        } finally {
            buf.release();
        }
    }

    public static ProxyResponse decodeResponse(byte[] bytes) {
        ByteBuf buf = Unpooled.wrappedBuffer(bytes);
        try {
            ProxyResponse response = new ProxyResponse(buf.readUnsignedShort(), readHeaders(buf), readBytes(buf));
            expectEnd(buf);
            return response;
        } catch (IndexOutOfBoundsException e) {
            throw new ProtocolException("truncated response envelope", e);
        } finally {
            buf.release();
        }
    }

    private static void writeString(ByteBuf buf, String value) {
        writeBytes(buf, value == null ? new byte[0] : value.getBytes(StandardCharsets.UTF_8));
    }

    private static void writeBytes(ByteBuf buf, byte[] value) {
        buf.writeInt(value.length);
        buf.writeBytes(value);
    }

    private static void writeHeaders(ByteBuf buf, List<Header> headers) {
        buf.writeInt(headers.size());
        for (Header header : headers) {
            writeString(buf, header.name());
            writeString(buf, header.value());
        }
    }

    private static String readString(ByteBuf buf) {
        return new String(readBytes(buf), StandardCharsets.UTF_8);
    }

    private static byte[] readBytes(ByteBuf buf) {
        int length = buf.readInt();
        if (length < 0 || length > buf.readableBytes()) {
            throw new ProtocolException("field length " + length + " exceeds envelope");
        }
        byte[] out = new byte[length];
        buf.readBytes(out);
        return out;
    }

    private static List<Header> readHeaders(ByteBuf buf) {
        int count = buf.readInt();
        // every header needs at least two length fields
        if (count < 0 || (long) count * 8 > buf.readableBytes()) {
            throw new ProtocolException("header count " + count + " exceeds envelope");
        }
        List<Header> headers = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            headers.add(new Header(readString(buf), readString(buf)));
        }
        return headers;
    }

    private static void expectEnd(ByteBuf buf) {
        if (buf.isReadable()) {
            throw new ProtocolException(buf.readableBytes() + " trailing bytes after envelope");
        }
    }

    private static byte[] toArray(ByteBuf buf) {
        byte[] out = new byte[buf.readableBytes()];
        buf.readBytes(out);
        return out;
    }
}
