package io.peermesh.routing;

import io.peermesh.ServiceEndpoint;

import java.util.List;

public class RoundRobinBalancer implements LoadBalancer {

    @Override
    public ServiceEndpoint select(List<ServiceEndpoint> candidates, RouteMetrics metrics, long sequence) {
        return candidates.get((int) Math.floorMod(sequence, (long) candidates.size()));
    }
}
