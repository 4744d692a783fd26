package io.peermesh;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * Everything known about a cluster. Replaced wholesale on refresh, never merged.
 */
public record ClusterInfo(
    @JsonProperty("id") ClusterId id,
    @JsonProperty("node_id") NodeId nodeId,
    @JsonProperty("relay_url") String relayUrl,
    @JsonProperty("direct_addresses") List<String> directAddresses,
    @JsonProperty("services") List<ServiceInfo> services
) {
    public ClusterInfo {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(nodeId, "nodeId");
        directAddresses = directAddresses == null ? List.of() : List.copyOf(directAddresses);
        services = services == null ? List.of() : List.copyOf(services);
    }

    public NodeAddr nodeAddr() {
        return new NodeAddr(nodeId, relayUrl, directAddresses);
    }

    public boolean hosts(String serviceName, String namespace) {
        return services.stream().anyMatch(s -> s.matches(serviceName, namespace));
    }
}
