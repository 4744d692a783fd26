package io.peermesh.discovery;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.peermesh.error.ProtocolException;

import java.io.IOException;

/**
 * JSON encoding of discovery frames. Unknown properties are ignored so peers running a
 * newer version can add fields.
 */
public final class DiscoveryCodec {

    public static final int MAX_FRAME_SIZE = 64 * 1024;

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private DiscoveryCodec() {}

    public static byte[] encodeQuery(DiscoveryQuery query) {
        return write(query);
    }

    public static DiscoveryQuery decodeQuery(byte[] bytes) {
        DiscoveryQuery query = read(bytes, DiscoveryQuery.class);
        if (query.service() == null || query.service().isBlank() || query.namespace() == null) {
            throw new ProtocolException("discovery query needs service and namespace");
        }
        return query;
    }

    public static byte[] encodeResponse(DiscoveryResponse response) {
        return write(response);
    }

    public static DiscoveryResponse decodeResponse(byte[] bytes) {
        DiscoveryResponse response = read(bytes, DiscoveryResponse.class);
        if (response.status() == null) {
            throw new ProtocolException("discovery response without status");
        }
        return response;
    }

    private static byte[] write(Object value) {
        try {
            return MAPPER.writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            throw new ProtocolException("cannot encode " + value.getClass().getSimpleName(), e);
        }
    }

    private static <T> T read(byte[] bytes, Class<T> type) {
        try {
            T value = MAPPER.readValue(bytes, type);
            if (value == null) {
                throw new ProtocolException("empty " + type.getSimpleName());
            }
            return value;
        } catch (IOException | IllegalArgumentException e) {
            throw new ProtocolException("malformed " + type.getSimpleName() + ": " + e.getMessage(), e);
        }
    }
}
