package io.peermesh.discovery;

import io.peermesh.ServiceEndpoint;
import io.peermesh.ServiceInfo;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A service found in the local cluster together with its ready endpoints.
 */
public record LocalService(ServiceInfo info, List<ServiceEndpoint> endpoints, Map<String, String> metadata) {

    public LocalService {
        Objects.requireNonNull(info, "info");
        endpoints = endpoints == null ? List.of() : endpoints.stream().sorted(ServiceEndpoint.ORDER).toList();
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public LocalService(ServiceInfo info, List<ServiceEndpoint> endpoints) {
        this(info, endpoints, Map.of());
    }

    public boolean hasEndpoint(String address, int port) {
        return endpoints.stream().anyMatch(e -> e.address().equals(address) && e.port() == port);
    }
}
