package io.peermesh.routing;

import io.peermesh.ServiceEndpoint;

import java.time.Duration;
import java.util.Collection;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Selection counter and per-endpoint metrics of one route.
 */
public final class RouteMetrics {

    private final double alpha;
    private final AtomicLong sequence = new AtomicLong();
    private final Map<ServiceEndpoint, EndpointMetrics> endpoints = new ConcurrentHashMap<>();

    public RouteMetrics(double alpha) {
        this.alpha = alpha;
    }

    long nextSequence() {
        return sequence.getAndIncrement();
    }

    public int activeRequests(ServiceEndpoint endpoint) {
        return snapshot(endpoint).active();
    }

    public EndpointMetrics.Snapshot snapshot(ServiceEndpoint endpoint) {
        EndpointMetrics metrics = endpoints.get(endpoint);
        return metrics == null ? EndpointMetrics.Snapshot.EMPTY : metrics.snapshot();
    }

    public Map<String, EndpointMetrics.Snapshot> snapshotAll() {
        Map<String, EndpointMetrics.Snapshot> result = new TreeMap<>();
        endpoints.forEach((endpoint, metrics) -> result.put(endpoint.toString(), metrics.snapshot()));
        return result;
    }

    public void recordStart(ServiceEndpoint endpoint) {
        endpoints.computeIfAbsent(endpoint, e -> new EndpointMetrics(alpha)).recordStart();
    }

    public void recordComplete(ServiceEndpoint endpoint, Duration latency, boolean success) {
        endpoints.computeIfAbsent(endpoint, e -> new EndpointMetrics(alpha)).recordComplete(latency, success);
    }

    /**
     * Drops the metrics of idle endpoints that are not in {@code live}.
     */
    public void retainOnly(Collection<ServiceEndpoint> live) {
        Set<ServiceEndpoint> keep = new HashSet<>(live);
        endpoints.entrySet().removeIf(e -> !keep.contains(e.getKey()) && e.getValue().isIdle());
    }

    public int trackedEndpoints() {
        return endpoints.size();
    }
}
