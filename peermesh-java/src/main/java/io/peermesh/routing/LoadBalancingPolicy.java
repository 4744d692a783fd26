package io.peermesh.routing;

import java.util.function.Supplier;

public enum LoadBalancingPolicy {
    ROUND_ROBIN(RoundRobinBalancer::new),
    LEAST_CONNECTIONS(LeastConnectionsBalancer::new),
    WEIGHTED_ROUND_ROBIN(WeightedRoundRobinBalancer::new),
    EWMA_LATENCY(EwmaLatencyBalancer::new);

    private final Supplier<LoadBalancer> factory;

    LoadBalancingPolicy(Supplier<LoadBalancer> factory) {
        this.factory = factory;
    }

    public LoadBalancer balancer() {
        return factory.get();
    }
}
