package io.peermesh.routing;

import io.peermesh.ServiceEndpoint;

import java.util.ArrayList;
import java.util.List;

/**
 * Lowest {@code (ewma(latency) + penalty * consecutiveFailures) * (active + 1)} wins.
 * The average only holds successful exchanges. Endpoints that were never tried score
 * zero so new instances get probed. Ties rotate with the sequence.
 */
public class EwmaLatencyBalancer implements LoadBalancer {

    static final double FAILURE_PENALTY_MILLIS = 1_000.0;

    @Override
    public ServiceEndpoint select(List<ServiceEndpoint> candidates, RouteMetrics metrics, long sequence) {
        double best = Double.MAX_VALUE;
        List<ServiceEndpoint> tied = new ArrayList<>();
        for (ServiceEndpoint candidate : candidates) {
            double score = score(candidate, metrics);
            if (score < best) {
                best = score;
                tied.clear();
            }
            if (score == best) {
                tied.add(candidate);
            }
        }
        return tied.get((int) Math.floorMod(sequence, (long) tied.size()));
    }

    static double score(ServiceEndpoint endpoint, RouteMetrics metrics) {
        EndpointMetrics.Snapshot snapshot = metrics.snapshot(endpoint);
        if (snapshot.samples() == 0 && snapshot.consecutiveFailures() == 0) {
            return 0.0;
        }
        double latency = snapshot.samples() == 0 ? FAILURE_PENALTY_MILLIS : snapshot.ewmaMillis();
        latency += FAILURE_PENALTY_MILLIS * snapshot.consecutiveFailures();
        return latency * (snapshot.active() + 1);
    }
}
