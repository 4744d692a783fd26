package io.peermesh.discovery;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.peermesh.ClusterId;
import io.peermesh.ClusterInfo;
import io.peermesh.CrossClusterRoute;
import io.peermesh.ServiceEndpoint;
import io.peermesh.ServiceInfo;
import io.peermesh.error.ErrorKind;
import io.peermesh.error.MeshException;
import io.peermesh.error.ProtocolException;
import io.peermesh.error.ServiceNotFoundException;
import io.peermesh.error.UnreachableException;
import io.peermesh.network.ConnectionManager;
import io.peermesh.network.transport.FramedStream;
import io.peermesh.network.transport.MeshConnection;
import io.peermesh.network.transport.MeshStream;
import io.peermesh.network.transport.StreamKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Resolves services in any cluster of the mesh and keeps the registry of known clusters.
 *
 * <p>The local cluster is answered straight from the {@link ClusterScanner}. Remote
 * clusters are asked over a discovery stream and their answers cached per
 * {@link CrossClusterRoute} for the configured TTL. Concurrent misses for one route
 * share a single query. Failed queries and {@code NOT_FOUND} answers are never cached.
 */
public class DiscoveryManager {

    private static final Logger LOGGER = LoggerFactory.getLogger(DiscoveryManager.class);

    private final ClusterId self;
    private final ClusterScanner scanner;
    private final ConnectionManager connections;
    private final Options options;
    private final Clock clock;

    private final Map<CrossClusterRoute, CacheEntry> cache = new ConcurrentHashMap<>();
    private final Map<CrossClusterRoute, CompletableFuture<ResolvedService>> inflight = new ConcurrentHashMap<>();
    private final Map<ClusterId, ClusterInfo> clusters = new ConcurrentHashMap<>();

    private final AtomicLong localResolutions = new AtomicLong();
    private final AtomicLong cacheHits = new AtomicLong();
    private final AtomicLong cacheMisses = new AtomicLong();
    private final AtomicLong remoteQueries = new AtomicLong();
    private final AtomicLong remoteFailures = new AtomicLong();
    private final AtomicLong notFound = new AtomicLong();
    private final AtomicLong queriesAnswered = new AtomicLong();

    public DiscoveryManager(ClusterId self, ClusterScanner scanner, ConnectionManager connections) {
        this(self, scanner, connections, Options.defaults(), Clock.systemUTC());
    }

    public DiscoveryManager(ClusterId self, ClusterScanner scanner, ConnectionManager connections,
                            Options options, Clock clock) {
        this.self = self;
        this.scanner = scanner;
        this.connections = connections;
        this.options = options;
        this.clock = clock;
    }

    public ClusterId getSelf() {
        return self;
    }

    public Options getOptions() {
        return options;
    }

    /**
     * Resolves {@code route} to its current endpoints.
     * Fails with {@link ServiceNotFoundException} if the target cluster does not have
     * the service, and with {@link UnreachableException} if it could not be asked.
     */
    public CompletableFuture<ResolvedService> resolve(CrossClusterRoute route) {
        if (route.targetCluster().equals(self)) {
            localResolutions.incrementAndGet();
            try {
                return CompletableFuture.completedFuture(resolveLocal(route));
            } catch (ServiceNotFoundException e) {
                notFound.incrementAndGet();
                return CompletableFuture.failedFuture(e);
            }
        }

        CacheEntry entry = cache.get(route);
        if (entry != null && entry.isFresh(clock.instant())) {
            cacheHits.incrementAndGet();
            return CompletableFuture.completedFuture(entry.service());
        }

        CompletableFuture<ResolvedService> flight = new CompletableFuture<>();
        CompletableFuture<ResolvedService> existing = inflight.putIfAbsent(route, flight);
        if (existing != null) {
            return existing.copy();
        }
        // a flight may have filled the cache between the check above and the claim
        CacheEntry refreshed = cache.get(route);
        if (refreshed != null && refreshed.isFresh(clock.instant())) {
            inflight.remove(route, flight);
            cacheHits.incrementAndGet();
            flight.complete(refreshed.service());
            return flight.copy();
        }
        cacheMisses.incrementAndGet();

        query(route).whenComplete((resolved, ex) -> {
            if (ex == null) {
                cache.put(route, new CacheEntry(resolved, clock.instant().plus(options.cacheTtl())));
            }
            inflight.remove(route, flight);
            if (ex != null) {
                flight.completeExceptionally(ex);
            } else {
                flight.complete(resolved);
            }
        });
        return flight.copy();
    }

    public CompletableFuture<List<ServiceEndpoint>> resolveEndpoints(CrossClusterRoute route) {
        return resolve(route).thenApply(ResolvedService::endpoints);
    }

    /**
     * Builds the answer to a peer's query from the local scan.
     */
    public DiscoveryResponse answerQuery(DiscoveryQuery query) {
        queriesAnswered.incrementAndGet();
        Optional<LocalService> service = findLocal(query.service(), query.namespace());
        if (service.isEmpty()) {
            LOGGER.debug("Peer asked for unknown service {}.{}", query.service(), query.namespace());
            return DiscoveryResponse.notFound();
        }
        return DiscoveryResponse.found(service.get(), clusters.get(self));
    }

    public List<ServiceInfo> discoverLocalServices(String namespace) {
        return scanner.listServices(namespace)
            .map(LocalService::info)
            .sorted(Comparator.comparing(ServiceInfo::namespace).thenComparing(ServiceInfo::name))
            .toList();
    }

    public Optional<LocalService> findLocal(String name, String namespace) {
        return scanner.listServices(namespace)
            .filter(s -> s.info().matches(name, namespace))
            .findFirst();
    }

    // Cluster registry

    /**
     * Records {@code info} and pins its node identity for connection verification.
     */
    public void registerCluster(ClusterInfo info) {
        if (!info.id().equals(self)) {
            connections.bindIdentity(info.id(), info.nodeId());
        }
        ClusterInfo previous = clusters.put(info.id(), info);
        if (!info.equals(previous)) {
            LOGGER.info("Registered cluster {} with {} services", info.id(), info.services().size());
        }
    }

    /**
     * Replaces the record of an already registered cluster.
     *
     * @return {@code false} if the cluster was not registered
     */
    public boolean updateCluster(ClusterInfo info) {
        if (!clusters.containsKey(info.id())) {
            return false;
        }
        registerCluster(info);
        return true;
    }

    public Optional<ClusterInfo> getClusterInfo(ClusterId clusterId) {
        return Optional.ofNullable(clusters.get(clusterId));
    }

    public List<ClusterInfo> listClusters() {
        List<ClusterInfo> result = new ArrayList<>(clusters.values());
        result.sort(Comparator.comparing(c -> c.id().value()));
        return result;
    }

    /**
     * First registered cluster, in id order, advertising the service.
     */
    public Optional<ClusterInfo> findService(String name, String namespace) {
        return listClusters().stream()
            .filter(c -> c.hosts(name, namespace))
            .findFirst();
    }

    public boolean removeCluster(ClusterId clusterId) {
        invalidateCluster(clusterId);
        return clusters.remove(clusterId) != null;
    }

    // Cache control

    public void invalidate(CrossClusterRoute route) {
        cache.remove(route);
    }

    public void invalidateCluster(ClusterId clusterId) {
        cache.keySet().removeIf(route -> route.targetCluster().equals(clusterId));
    }

    public List<CacheEntryStatus> cacheSnapshot() {
        Instant now = clock.instant();
        List<CacheEntryStatus> result = new ArrayList<>();
        cache.forEach((route, entry) -> {
            if (entry.isFresh(now)) {
                result.add(new CacheEntryStatus(
                    route.toString(),
                    entry.service().endpoints().stream().map(ServiceEndpoint::toString).toList(),
                    Duration.between(now, entry.expiresAt()).toMillis()
                ));
            }
        });
        result.sort(Comparator.comparing(CacheEntryStatus::route));
        return result;
    }

    public Stats getStats() {
        return new Stats(
            localResolutions.get(),
            cacheHits.get(),
            cacheMisses.get(),
            remoteQueries.get(),
            remoteFailures.get(),
            notFound.get(),
            queriesAnswered.get(),
            cache.size(),
            clusters.size()
        );
    }

    private ResolvedService resolveLocal(CrossClusterRoute route) {
        LocalService service = findLocal(route.targetService(), route.targetNamespace())
            .orElseThrow(() -> new ServiceNotFoundException(
                "service " + route.targetService() + "." + route.targetNamespace() + " not found in " + self));
        return new ResolvedService(route, service.endpoints(), service.info().protocol(),
            service.metadata(), clock.instant());
    }

    private CompletableFuture<ResolvedService> query(CrossClusterRoute route) {
        remoteQueries.incrementAndGet();
        AtomicReference<MeshStream> opened = new AtomicReference<>();
        DiscoveryQuery request = new DiscoveryQuery(route.targetService(), route.targetNamespace());

        return connections.getConnection(route.targetCluster())
            .thenCompose(connection -> connection.openStream().thenCompose(stream -> {
                opened.set(stream);
                return exchange(stream, request).thenApply(response -> accept(route, connection, response));
            }))
            .orTimeout(options.queryTimeout().toMillis(), TimeUnit.MILLISECONDS)
            .handle((resolved, ex) -> {
                if (ex == null) {
                    return resolved;
                }
                MeshStream stream = opened.get();
                if (stream != null && stream.isOpen()) {
                    stream.reset();
                }
                Throwable cause = MeshException.unwrap(ex);
                ErrorKind kind = MeshException.kindOf(cause);
                if (kind == ErrorKind.NOT_FOUND || kind == ErrorKind.IDENTITY_MISMATCH) {
                    throw (MeshException) cause;
                }
                remoteFailures.incrementAndGet();
                LOGGER.warn("Discovery of {} failed: {}", route, cause.getMessage());
                throw new UnreachableException("discovery of " + route + " failed: " + cause.getMessage(), cause);
            });
    }

    private CompletableFuture<DiscoveryResponse> exchange(MeshStream stream, DiscoveryQuery request) {
        FramedStream framed = new FramedStream(stream, DiscoveryCodec.MAX_FRAME_SIZE);
        return framed.writeKind(StreamKind.DISCOVERY)
            .thenCompose(v -> framed.writeFrame(DiscoveryCodec.encodeQuery(request)))
            .thenCompose(v -> stream.finish())
            .thenCompose(v -> framed.readFrame())
            .thenApply(bytes -> {
                if (bytes == null) {
                    throw new ProtocolException("peer closed the discovery stream without answering");
                }
                return DiscoveryCodec.decodeResponse(bytes);
            })
            .whenComplete((response, ex) -> framed.release());
    }

    private ResolvedService accept(CrossClusterRoute route, MeshConnection connection, DiscoveryResponse response) {
        if (!response.isFound()) {
            notFound.incrementAndGet();
            throw new ServiceNotFoundException(
                "service " + route.targetService() + "." + route.targetNamespace() + " not found in " + route.targetCluster());
        }
        ClusterInfo info = response.cluster();
        if (info != null) {
            if (info.id().equals(route.targetCluster()) && info.nodeId().equals(connection.getRemoteNodeId())) {
                clusters.put(info.id(), info);
            } else {
                LOGGER.warn("Ignoring cluster record {} / {} sent by {} for {}", info.id(), info.nodeId().shortId(),
                    connection.getRemoteNodeId().shortId(), route.targetCluster());
            }
        }
        LOGGER.debug("Resolved {} to {}", route, response.endpoints());
        return new ResolvedService(route, response.endpoints(), response.protocol(), response.metadata(), clock.instant());
    }

    private record CacheEntry(ResolvedService service, Instant expiresAt) {
        boolean isFresh(Instant now) {
            return now.isBefore(expiresAt);
        }
    }

    public record CacheEntryStatus(
        @JsonProperty("route") String route,
        @JsonProperty("endpoints") List<String> endpoints,
        @JsonProperty("expires_in_ms") long expiresInMs
    ) {}

    public record Stats(
        long localResolutions,
        long cacheHits,
        long cacheMisses,
        long remoteQueries,
        long remoteFailures,
        long notFound,
        long queriesAnswered,
        int cachedRoutes,
        int knownClusters
    ) {}

    public record Options(Duration cacheTtl, Duration queryTimeout) {

        public static Options defaults() {
            return builder().build();
        }

        public static Builder builder() {
            return new Builder();
        }

        public static class Builder {
            private Duration cacheTtl = Duration.ofSeconds(30);
            private Duration queryTimeout = Duration.ofSeconds(5);

            public Builder cacheTtl(Duration ttl) { this.cacheTtl = ttl; return this; }
            public Builder queryTimeout(Duration timeout) { this.queryTimeout = timeout; return this; }

            public Options build() {
                return new Options(cacheTtl, queryTimeout);
            }
        }
    }
}
