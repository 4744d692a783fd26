package io.peermesh.network.transport;

/**
 * One-byte tag opening every stream, selecting the protocol spoken on it.
 */
public enum StreamKind {
    DISCOVERY((byte) 1),
    PROXY((byte) 2);

    private final byte code;

    StreamKind(byte code) {
        this.code = code;
    }

    public byte code() {
        return code;
    }

    /**
     * @return the kind for {@code code}, or {@code null} if unknown
     */
    public static StreamKind fromCode(byte code) {
        for (StreamKind kind : values()) {
            if (kind.code == code) {
                return kind;
            }
        }
        return null;
    }
}
