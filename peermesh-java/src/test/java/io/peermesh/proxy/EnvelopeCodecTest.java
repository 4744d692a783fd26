package io.peermesh.proxy;

import io.peermesh.error.ProtocolException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("EnvelopeCodec")
class EnvelopeCodecTest {

    private static ProxyRequest sampleRequest() {
        return new ProxyRequest(
            "POST",
            "/charges?currency=eur",
            "payment-service",
            "default",
            "10.0.0.5",
            8080,
            List.of(new Header("Content-Type", "application/json"), new Header("X-Tag", "a"), new Header("X-Tag", "b")),
            "{\"amount\":42}".getBytes(StandardCharsets.UTF_8)
        );
    }

    @Test
    @DisplayName("should preserve every request field including repeated headers")
    void shouldPreserveRequest() {
        ProxyRequest original = sampleRequest();

        ProxyRequest decoded = EnvelopeCodec.decodeRequest(EnvelopeCodec.encodeRequest(original));

        assertEquals(original.method(), decoded.method());
        assertEquals(original.uri(), decoded.uri());
        assertEquals(original.service(), decoded.service());
        assertEquals(original.namespace(), decoded.namespace());
        assertEquals(original.targetAddress(), decoded.targetAddress());
        assertEquals(original.targetPort(), decoded.targetPort());
        assertEquals(original.headers(), decoded.headers());
        assertArrayEquals(original.body(), decoded.body());
    }

    @Test
    @DisplayName("should preserve a response with binary body")
    void shouldPreserveResponse() {
        byte[] body = new byte[] { 0, (byte) 0xFF, 10, 13 };
        ProxyResponse decoded = EnvelopeCodec.decodeResponse(EnvelopeCodec.encodeResponse(
            new ProxyResponse(503, List.of(new Header("Retry-After", "1")), body)));

        assertEquals(503, decoded.status());
        assertEquals("1", decoded.header("retry-after").orElseThrow());
        assertArrayEquals(body, decoded.body());
    }

    @Test
    @DisplayName("should fit the largest accepted request into one frame")
    void shouldFitLargestRequestInFrame() {
        List<Header> headers = new ArrayList<>();
        for (int i = 0; i < HttpProxyInterceptor.MAX_HEADER_SIZE / 4; i++) {
            headers.add(new Header("h", ""));
        }
        headers.add(new Header("X-Large", "v".repeat(HttpProxyInterceptor.MAX_HEADER_SIZE)));
        ProxyRequest request = new ProxyRequest("POST", "/" + "u".repeat(HttpProxyInterceptor.MAX_INITIAL_LINE_LENGTH),
            "payment-service", "default", "10.0.0.5", 8080, headers, new byte[EnvelopeCodec.MAX_BODY_SIZE]);

        assertTrue(EnvelopeCodec.encodeRequest(request).length <= EnvelopeCodec.MAX_FRAME_SIZE);
    }

    @Test
    @DisplayName("should reject truncated envelopes")
    void shouldRejectTruncated() {
        byte[] encoded = EnvelopeCodec.encodeRequest(sampleRequest());

        for (int cut : new int[] { 0, 3, 10, encoded.length - 1 }) {
            byte[] truncated = Arrays.copyOf(encoded, cut);
            assertThrows(ProtocolException.class, () -> EnvelopeCodec.decodeRequest(truncated));
        }
    }

    @Test
    @DisplayName("should reject trailing bytes")
    void shouldRejectTrailingBytes() {
        byte[] encoded = EnvelopeCodec.encodeResponse(new ProxyResponse(200, List.of(), new byte[0]));
        byte[] padded = Arrays.copyOf(encoded, encoded.length + 1);

        assertThrows(ProtocolException.class, () -> EnvelopeCodec.decodeResponse(padded));
    }

    @Test
    @DisplayName("should reject absurd length fields")
    void shouldRejectAbsurdLengths() {
        byte[] bogus = new byte[] { 0, (byte) 200, 0x7F, (byte) 0xFF, (byte) 0xFF, (byte) 0xFF };

        assertThrows(ProtocolException.class, () -> EnvelopeCodec.decodeResponse(bogus));
    }

    @Test
    @DisplayName("should build mesh error responses")
    void shouldBuildMeshErrors() {
        ProxyResponse error = ProxyResponse.meshError(503, "CIRCUIT_OPEN", "circuit open for orders");

        assertEquals(503, error.status());
        assertEquals("CIRCUIT_OPEN", error.header(ProxyResponse.MESH_ERROR_HEADER).orElseThrow());
        assertEquals("circuit open for orders", error.bodyAsString());
    }
}
