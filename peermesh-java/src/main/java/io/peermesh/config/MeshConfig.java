package io.peermesh.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.peermesh.ClusterId;
import io.peermesh.CrossClusterRoute;
import io.peermesh.Mesh;
import io.peermesh.discovery.DiscoveryManager;
import io.peermesh.error.ConfigurationException;
import io.peermesh.network.ConnectionManager;
import io.peermesh.proxy.CircuitBreaker;
import io.peermesh.proxy.RetryPolicy;
import io.peermesh.proxy.TrafficRouter;
import io.peermesh.routing.LoadBalancingPolicy;
import io.peermesh.routing.RouteTable;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * File model of a mesh node's configuration. Every field has a default, so a file only
 * needs the values it changes.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class MeshConfig {

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .enable(SerializationFeature.INDENT_OUTPUT);

    @JsonProperty("cluster_id")
    public String clusterId = "default";

    @JsonProperty("agent")
    public Listener agent = new Listener(Mesh.DEFAULT_AGENT_PORT);

    @JsonProperty("proxy")
    public ProxySettings proxy = new ProxySettings();

    @JsonProperty("kubernetes")
    public Kubernetes kubernetes = new Kubernetes();

    @JsonProperty("discovery")
    public Discovery discovery = new Discovery();

    @JsonProperty("connection")
    public Connection connection = new Connection();

    @JsonProperty("cache")
    public Cache cache = new Cache();

    @JsonProperty("retry")
    public Retry retry = new Retry();

    @JsonProperty("circuit_breaker")
    public Breaker circuitBreaker = new Breaker();

    @JsonProperty("load_balancing")
    public LoadBalancing loadBalancing = new LoadBalancing();

    @JsonProperty("routes")
    public List<Route> routes = new ArrayList<>();

    public static MeshConfig defaults() {
        return new MeshConfig();
    }

    public static MeshConfig load(Path path) {
        MeshConfig config;
        try {
            config = MAPPER.readValue(path.toFile(), MeshConfig.class);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load mesh config from " + path + ": " + e.getMessage(), e);
        }
        if (config == null) {
            throw new ConfigurationException("Mesh config " + path + " is empty");
        }
        config.validate();
        return config;
    }

    public void save(Path path) {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            MAPPER.writeValue(path.toFile(), this);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to save mesh config to " + path + ": " + e.getMessage(), e);
        }
    }

    /**
     * @throws ConfigurationException naming the first invalid field
     */
    public void validate() {
        if (clusterId == null || clusterId.isBlank()) {
            throw new ConfigurationException("cluster_id must not be blank");
        }
        if (agent == null || proxy == null || kubernetes == null || discovery == null || connection == null
                || cache == null || retry == null || circuitBreaker == null || loadBalancing == null) {
            throw new ConfigurationException("config sections must not be null");
        }
        checkPort("agent.port", agent.port);
        checkPort("proxy.port", proxy.port);
        checkPositive("connection.connect_timeout_ms", connection.connectTimeoutMs);
        checkPositive("connection.resolve_attempts", connection.resolveAttempts);
        checkPositive("connection.idle_timeout_seconds", connection.idleTimeoutSeconds);
        checkPositive("connection.idle_sweep_seconds", connection.idleSweepSeconds);
        checkPositive("cache.ttl_seconds", cache.ttlSeconds);
        checkPositive("cache.query_timeout_ms", cache.queryTimeoutMs);
        checkPositive("discovery.local_interval_seconds", discovery.localIntervalSeconds);
        checkPositive("discovery.registration_interval_seconds", discovery.registrationIntervalSeconds);
        checkPositive("circuit_breaker.failure_threshold", circuitBreaker.failureThreshold);
        checkPositive("proxy.request_timeout_ms", proxy.requestTimeoutMs);
        if (retry.maxRetries < 0) {
            throw new ConfigurationException("retry.max_retries must not be negative");
        }
        if (loadBalancing.ewmaAlpha <= 0 || loadBalancing.ewmaAlpha > 1) {
            throw new ConfigurationException("load_balancing.ewma_alpha must be in (0, 1]");
        }
        policy("load_balancing.default_policy", loadBalancing.defaultPolicy);
        loadBalancing.services.forEach((service, policy) -> policy("load_balancing.services." + service, policy));
        for (Route route : routes) {
            if (route.host == null || route.cluster == null || route.service == null) {
                throw new ConfigurationException("routes entries need host, cluster and service");
            }
        }
    }

    public ClusterId clusterIdValue() {
        return ClusterId.of(clusterId);
    }

    public ConnectionManager.Options connectionOptions() {
        return ConnectionManager.Options.builder()
            .connectTimeout(Duration.ofMillis(connection.connectTimeoutMs))
            .resolveAttempts(connection.resolveAttempts)
            .resolveBackoff(Duration.ofMillis(connection.resolveBackoffMs))
            .resolveBackoffMax(Duration.ofMillis(connection.resolveBackoffMaxMs))
            .idleTimeout(Duration.ofSeconds(connection.idleTimeoutSeconds))
            .idleSweepInterval(Duration.ofSeconds(connection.idleSweepSeconds))
            .build();
    }

    public DiscoveryManager.Options discoveryOptions() {
        return DiscoveryManager.Options.builder()
            .cacheTtl(Duration.ofSeconds(cache.ttlSeconds))
            .queryTimeout(Duration.ofMillis(cache.queryTimeoutMs))
            .build();
    }

    public RouteTable.Options routeTableOptions() {
        RouteTable.Options.Builder builder = RouteTable.Options.builder()
            .defaultPolicy(policy("load_balancing.default_policy", loadBalancing.defaultPolicy))
            .ewmaAlpha(loadBalancing.ewmaAlpha);
        loadBalancing.services.forEach((service, policy) ->
            builder.servicePolicy(service, policy("load_balancing.services." + service, policy)));
        return builder.build();
    }

    public TrafficRouter.Options trafficRouterOptions() {
        return TrafficRouter.Options.builder()
            .requestTimeout(Duration.ofMillis(proxy.requestTimeoutMs))
            .retryPolicy(RetryPolicy.builder()
                .maxRetries(retry.maxRetries)
                .initialBackoff(Duration.ofMillis(retry.initialBackoffMs))
                .maxBackoff(Duration.ofMillis(retry.maxBackoffMs))
                .idempotentOnly(retry.idempotentOnly)
                .build())
            .circuitBreaker(CircuitBreaker.Options.builder()
                .failureThreshold(circuitBreaker.failureThreshold)
                .window(Duration.ofSeconds(circuitBreaker.windowSeconds))
                .cooldown(Duration.ofSeconds(circuitBreaker.cooldownSeconds))
                .build())
            .build();
    }

    /**
     * Static routes keyed by lower-cased host name.
     */
    public Map<String, CrossClusterRoute> staticRoutes() {
        Map<String, CrossClusterRoute> result = new LinkedHashMap<>();
        for (Route route : routes) {
            result.put(route.host.toLowerCase(Locale.ROOT), new CrossClusterRoute(
                ClusterId.of(route.cluster),
                route.service,
                route.namespace == null ? Mesh.DEFAULT_NAMESPACE : route.namespace,
                route.port
            ));
        }
        return result;
    }

    private static void checkPort(String field, int port) {
        if (port < 0 || port > 65535) {
            throw new ConfigurationException(field + " out of range: " + port);
        }
    }

    private static void checkPositive(String field, long value) {
        if (value <= 0) {
            throw new ConfigurationException(field + " must be positive, got " + value);
        }
    }

    private static LoadBalancingPolicy policy(String field, String value) {
        try {
            return LoadBalancingPolicy.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new ConfigurationException(field + " is not a load balancing policy: " + value, e);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Listener {
        @JsonProperty("bind_address")
        public String bindAddress = "127.0.0.1";

        @JsonProperty("port")
        public int port;

        public Listener() {
        }

        Listener(int port) {
            this.port = port;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ProxySettings extends Listener {
        @JsonProperty("mesh_domain")
        public String meshDomain = Mesh.DEFAULT_MESH_DOMAIN;

        @JsonProperty("default_namespace")
        public String defaultNamespace = Mesh.DEFAULT_NAMESPACE;

        @JsonProperty("request_timeout_ms")
        public long requestTimeoutMs = 30_000;

        public ProxySettings() {
            super(Mesh.DEFAULT_PROXY_PORT);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Kubernetes {
        /** {@code null} watches all namespaces. */
        @JsonProperty("namespace")
        public String namespace;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Discovery {
        @JsonProperty("enable_dns")
        public boolean enableDns = true;

        @JsonProperty("enable_mdns")
        public boolean enableMdns = false;

        @JsonProperty("endpoints")
        public List<String> endpoints = new ArrayList<>();

        @JsonProperty("local_interval_seconds")
        public long localIntervalSeconds = 30;

        @JsonProperty("registration_interval_seconds")
        public long registrationIntervalSeconds = 60;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Connection {
        @JsonProperty("connect_timeout_ms")
        public long connectTimeoutMs = 5_000;

        @JsonProperty("resolve_attempts")
        public int resolveAttempts = 3;

        @JsonProperty("resolve_backoff_ms")
        public long resolveBackoffMs = 100;

        @JsonProperty("resolve_backoff_max_ms")
        public long resolveBackoffMaxMs = 2_000;

        @JsonProperty("idle_timeout_seconds")
        public long idleTimeoutSeconds = 300;

        @JsonProperty("idle_sweep_seconds")
        public long idleSweepSeconds = 30;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Cache {
        @JsonProperty("ttl_seconds")
        public long ttlSeconds = 30;

        @JsonProperty("query_timeout_ms")
        public long queryTimeoutMs = 5_000;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Retry {
        @JsonProperty("max_retries")
        public int maxRetries = 2;

        @JsonProperty("initial_backoff_ms")
        public long initialBackoffMs = 50;

        @JsonProperty("max_backoff_ms")
        public long maxBackoffMs = 1_000;

        @JsonProperty("idempotent_only")
        public boolean idempotentOnly = true;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Breaker {
        @JsonProperty("failure_threshold")
        public int failureThreshold = 5;

        @JsonProperty("window_seconds")
        public long windowSeconds = 30;

        @JsonProperty("cooldown_seconds")
        public long cooldownSeconds = 10;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class LoadBalancing {
        @JsonProperty("default_policy")
        public String defaultPolicy = LoadBalancingPolicy.ROUND_ROBIN.name();

        @JsonProperty("services")
        public Map<String, String> services = new LinkedHashMap<>();

        @JsonProperty("ewma_alpha")
        public double ewmaAlpha = 0.3;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Route {
        @JsonProperty("host")
        public String host;

        @JsonProperty("cluster")
        public String cluster;

        @JsonProperty("service")
        public String service;

        @JsonProperty("namespace")
        public String namespace;

        @JsonProperty("port")
        public int port;
    }
}
