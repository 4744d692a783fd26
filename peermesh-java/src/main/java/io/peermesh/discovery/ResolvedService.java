package io.peermesh.discovery;

import io.peermesh.CrossClusterRoute;
import io.peermesh.ServiceEndpoint;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Outcome of resolving a {@link CrossClusterRoute}. Endpoints are in address order.
 */
public record ResolvedService(
    CrossClusterRoute route,
    List<ServiceEndpoint> endpoints,
    String protocol,
    Map<String, String> metadata,
    Instant resolvedAt
) {
    public ResolvedService {
        endpoints = endpoints.stream().sorted(ServiceEndpoint.ORDER).toList();
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }
}
