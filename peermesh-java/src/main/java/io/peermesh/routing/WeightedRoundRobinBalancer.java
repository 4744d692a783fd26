package io.peermesh.routing;

import io.peermesh.ServiceEndpoint;

import java.util.List;

/**
 * Each endpoint gets as many slots per cycle as its weight. Weights below one count as one.
 */
public class WeightedRoundRobinBalancer implements LoadBalancer {

    @Override
    public ServiceEndpoint select(List<ServiceEndpoint> candidates, RouteMetrics metrics, long sequence) {
        long total = 0;
        for (ServiceEndpoint candidate : candidates) {
            total += candidate.effectiveWeight();
        }
        long slot = Math.floorMod(sequence, total);
        long cumulative = 0;
        for (ServiceEndpoint candidate : candidates) {
            cumulative += candidate.effectiveWeight();
            if (slot < cumulative) {
                return candidate;
            }
        }
        return candidates.get(candidates.size() - 1);
    }
}
