package io.peermesh.routing;

import io.peermesh.CrossClusterRoute;
import io.peermesh.ServiceEndpoint;
import io.peermesh.discovery.DiscoveryManager;
import io.peermesh.error.NoEndpointsException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maps destinations to routes and picks the endpoint for each request.
 *
 * <p>Candidates come fresh from the {@link DiscoveryManager} on every decision, so the
 * cache TTL bounds how stale a selection can be. The balancing policy is chosen per
 * service, falling back to the configured default.
 */
public class RouteTable {

    private static final Logger LOGGER = LoggerFactory.getLogger(RouteTable.class);

    private final DiscoveryManager discovery;
    private final DestinationClassifier classifier;
    private final Options options;
    private final Map<LoadBalancingPolicy, LoadBalancer> balancers = new EnumMap<>(LoadBalancingPolicy.class);
    private final Map<CrossClusterRoute, RouteMetrics> metrics = new ConcurrentHashMap<>();

    public RouteTable(DiscoveryManager discovery, DestinationClassifier classifier) {
        this(discovery, classifier, Options.defaults());
    }

    public RouteTable(DiscoveryManager discovery, DestinationClassifier classifier, Options options) {
        this.discovery = discovery;
        this.classifier = classifier;
        this.options = options;
        for (LoadBalancingPolicy policy : LoadBalancingPolicy.values()) {
            balancers.put(policy, policy.balancer());
        }
    }

    public CrossClusterRoute classify(Destination destination) {
        return classifier.classify(destination);
    }

    public CompletableFuture<ServiceEndpoint> select(CrossClusterRoute route) {
        return select(route, Set.of());
    }

    /**
     * Picks an endpoint for {@code route}, avoiding {@code excluded} while any other
     * candidate remains. Fails with {@link NoEndpointsException} if the service has none.
     */
    public CompletableFuture<ServiceEndpoint> select(CrossClusterRoute route, Set<ServiceEndpoint> excluded) {
        return discovery.resolveEndpoints(route).thenApply(endpoints -> choose(route, endpoints, excluded));
    }

    ServiceEndpoint choose(CrossClusterRoute route, List<ServiceEndpoint> endpoints, Set<ServiceEndpoint> excluded) {
        RouteMetrics routeMetrics = metrics(route);
        routeMetrics.retainOnly(endpoints);
        if (endpoints.isEmpty()) {
            throw new NoEndpointsException("no endpoints for " + route);
        }
        List<ServiceEndpoint> candidates = endpoints;
        if (!excluded.isEmpty()) {
            List<ServiceEndpoint> untried = endpoints.stream().filter(e -> !excluded.contains(e)).toList();
            if (!untried.isEmpty()) {
                candidates = untried;
            }
        }
        candidates = candidates.stream().sorted(ServiceEndpoint.ORDER).toList();
        LoadBalancingPolicy policy = policyFor(route);
        ServiceEndpoint chosen = balancers.get(policy).select(candidates, routeMetrics, routeMetrics.nextSequence());
        LOGGER.debug("Selected {} for {} ({})", chosen, route, policy);
        return chosen;
    }

    public LoadBalancingPolicy policyFor(CrossClusterRoute route) {
        return options.servicePolicies().getOrDefault(route.targetService(), options.defaultPolicy());
    }

    public void onRequestStart(CrossClusterRoute route, ServiceEndpoint endpoint) {
        metrics(route).recordStart(endpoint);
    }

    public void onRequestComplete(CrossClusterRoute route, ServiceEndpoint endpoint, Duration latency, boolean success) {
        metrics(route).recordComplete(endpoint, latency, success);
    }

    /**
     * Drops everything recorded for {@code route}, e.g. once its service is gone.
     */
    public void forget(CrossClusterRoute route) {
        metrics.remove(route);
    }

    public RouteMetrics metrics(CrossClusterRoute route) {
        return metrics.computeIfAbsent(route, r -> new RouteMetrics(options.ewmaAlpha()));
    }

    public Map<String, Map<String, EndpointMetrics.Snapshot>> metricsSnapshot() {
        Map<String, Map<String, EndpointMetrics.Snapshot>> result = new TreeMap<>();
        metrics.forEach((route, m) -> result.put(route.toString(), m.snapshotAll()));
        return result;
    }

    public record Options(
        LoadBalancingPolicy defaultPolicy,
        Map<String, LoadBalancingPolicy> servicePolicies,
        double ewmaAlpha
    ) {
        public static Options defaults() {
            return builder().build();
        }

        public static Builder builder() {
            return new Builder();
        }

        public static class Builder {
            private LoadBalancingPolicy defaultPolicy = LoadBalancingPolicy.ROUND_ROBIN;
            private final Map<String, LoadBalancingPolicy> servicePolicies = new HashMap<>();
            private double ewmaAlpha = 0.3;

            public Builder defaultPolicy(LoadBalancingPolicy policy) { this.defaultPolicy = policy; return this; }
            public Builder servicePolicy(String service, LoadBalancingPolicy policy) {
                this.servicePolicies.put(service, policy); return this;
            }
            public Builder ewmaAlpha(double alpha) { this.ewmaAlpha = alpha; return this; }

            public Options build() {
                if (ewmaAlpha <= 0 || ewmaAlpha > 1) {
                    throw new IllegalArgumentException("ewmaAlpha must be in (0, 1]");
                }
                return new Options(defaultPolicy, Map.copyOf(servicePolicies), ewmaAlpha);
            }
        }
    }
}
