package io.peermesh.routing;

import io.peermesh.ServiceEndpoint;

import java.util.ArrayList;
import java.util.List;

/**
 * Fewest requests in flight wins; ties rotate with the sequence.
 */
public class LeastConnectionsBalancer implements LoadBalancer {

    @Override
    public ServiceEndpoint select(List<ServiceEndpoint> candidates, RouteMetrics metrics, long sequence) {
        int best = Integer.MAX_VALUE;
        List<ServiceEndpoint> tied = new ArrayList<>();
        for (ServiceEndpoint candidate : candidates) {
            int active = metrics.activeRequests(candidate);
            if (active < best) {
                best = active;
                tied.clear();
            }
            if (active == best) {
                tied.add(candidate);
            }
        }
        return tied.get((int) Math.floorMod(sequence, (long) tied.size()));
    }
}
