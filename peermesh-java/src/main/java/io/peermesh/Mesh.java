package io.peermesh;

/**
 * Mesh-wide constants shared by agents and proxies.
 */
public final class Mesh {

    /** Protocol identifier negotiated on every mesh connection. */
    public static final String MESH_ALPN = "peermesh/v1";

    public static final int DEFAULT_PROXY_PORT = 15001;

    public static final int DEFAULT_AGENT_PORT = 15002;

    public static final String DEFAULT_NAMESPACE = "default";

    public static final String DEFAULT_MESH_DOMAIN = "mesh";

    private Mesh() {}
}
