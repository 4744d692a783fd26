package io.peermesh.routing;

import io.peermesh.ServiceEndpoint;

import java.util.List;

/**
 * Picks one endpoint. Implementations are pure: the same candidates, metrics and
 * sequence number always give the same choice.
 */
public interface LoadBalancer {

    /**
     * @param candidates non-empty, in {@link ServiceEndpoint#ORDER}
     * @param metrics    live metrics of the route
     * @param sequence   per-route selection counter
     */
    ServiceEndpoint select(List<ServiceEndpoint> candidates, RouteMetrics metrics, long sequence);
}
