package io.peermesh;

import java.util.Objects;

/**
 * Where an intercepted request is headed. Key for discovery caching and routing state.
 */
public record CrossClusterRoute(
    ClusterId targetCluster,
    String targetService,
    String targetNamespace,
    int targetPort
) {
    public CrossClusterRoute {
        Objects.requireNonNull(targetCluster, "targetCluster");
        Objects.requireNonNull(targetService, "targetService");
        Objects.requireNonNull(targetNamespace, "targetNamespace");
    }

    @Override
    public String toString() {
        return targetService + "." + targetNamespace + "@" + targetCluster + ":" + targetPort;
    }
}
