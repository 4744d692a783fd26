package io.peermesh.discovery;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.peermesh.ClusterInfo;
import io.peermesh.ServiceEndpoint;

import java.util.List;
import java.util.Map;

/**
 * Answer to a {@link DiscoveryQuery}. A {@code NOT_FOUND} answer is a valid result,
 * not a failure of the exchange.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DiscoveryResponse(
    @JsonProperty("status") Status status,
    @JsonProperty("endpoints") List<ServiceEndpoint> endpoints,
    @JsonProperty("protocol") String protocol,
    @JsonProperty("metadata") Map<String, String> metadata,
    @JsonProperty("cluster") ClusterInfo cluster
) {
    public enum Status {
        FOUND,
        NOT_FOUND
    }

    public DiscoveryResponse {
        endpoints = endpoints == null ? List.of() : List.copyOf(endpoints);
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public static DiscoveryResponse found(LocalService service, ClusterInfo cluster) {
        return new DiscoveryResponse(Status.FOUND, service.endpoints(), service.info().protocol(),
            service.metadata(), cluster);
    }

    public static DiscoveryResponse notFound() {
        return new DiscoveryResponse(Status.NOT_FOUND, List.of(), null, Map.of(), null);
    }

    @JsonIgnore
    public boolean isFound() {
        return status == Status.FOUND;
    }
}
