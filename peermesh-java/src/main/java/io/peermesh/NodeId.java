package io.peermesh;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.security.SecureRandom;
import java.util.HexFormat;
import java.util.Locale;
import java.util.Objects;

/**
 * Transport-level peer identity: the hex encoding of a node's public key.
 * Bound one-to-one with a {@link ClusterId} once a cluster is first reached.
 */
public record NodeId(String value) {

    private static final int KEY_BYTES = 32;
    private static final SecureRandom RANDOM = new SecureRandom();

    public NodeId {
        Objects.requireNonNull(value, "value");
        if (value.isBlank()) {
            throw new IllegalArgumentException("node id must not be blank");
        }
        value = value.toLowerCase(Locale.ROOT);
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static NodeId of(String value) {
        return new NodeId(value);
    }

    public static NodeId fromPublicKey(byte[] publicKey) {
        return new NodeId(HexFormat.of().formatHex(publicKey));
    }

    /**
     * Random identity, for transports that do not derive it from key material.
     */
    public static NodeId random() {
        byte[] key = new byte[KEY_BYTES];
        RANDOM.nextBytes(key);
        return fromPublicKey(key);
    }

    public String shortId() {
        return value.length() <= 10 ? value : value.substring(0, 10);
    }

    @JsonValue
    @Override
    public String value() {
        return value;
    }

    @Override
    public String toString() {
        return value;
    }
}
