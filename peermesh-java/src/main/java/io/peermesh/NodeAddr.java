package io.peermesh;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * Address hints for reaching a {@link NodeId}: direct socket addresses plus an
 * optional home relay.
 */
public record NodeAddr(
    @JsonProperty("node_id") NodeId nodeId,
    @JsonProperty("relay_url") String relayUrl,
    @JsonProperty("direct_addresses") List<String> directAddresses
) {
    public NodeAddr {
        Objects.requireNonNull(nodeId, "nodeId");
        directAddresses = directAddresses == null ? List.of() : List.copyOf(directAddresses);
        if (relayUrl != null && relayUrl.isBlank()) {
            relayUrl = null;
        }
    }

    public static NodeAddr direct(NodeId nodeId, String... addresses) {
        return new NodeAddr(nodeId, null, List.of(addresses));
    }

    public static NodeAddr relayed(NodeId nodeId, String relayUrl) {
        return new NodeAddr(nodeId, relayUrl, List.of());
    }

    @JsonIgnore
    public boolean hasRelay() {
        return relayUrl != null;
    }

    @JsonIgnore
    public boolean hasDirect() {
        return !directAddresses.isEmpty();
    }

    /**
     * Same node with the relay hint stripped.
     */
    public NodeAddr directOnly() {
        return new NodeAddr(nodeId, null, directAddresses);
    }

    /**
     * Same node with the direct hints stripped.
     */
    public NodeAddr relayOnly() {
        return new NodeAddr(nodeId, relayUrl, List.of());
    }
}
