package io.peermesh.agent;

import io.peermesh.ClusterId;
import io.peermesh.ClusterInfo;
import io.peermesh.NodeAddr;
import io.peermesh.config.MeshConfig;
import io.peermesh.discovery.ClusterScanner;
import io.peermesh.discovery.DiscoveryManager;
import io.peermesh.discovery.DiscoveryServer;
import io.peermesh.discovery.QueryAuthorizer;
import io.peermesh.network.ConnectionManager;
import io.peermesh.network.transport.AddressDirectory;
import io.peermesh.network.transport.Endpoint;
import io.peermesh.proxy.TrafficRouter;
import io.peermesh.routing.DestinationClassifier;
import io.peermesh.routing.RouteTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * One cluster's participation in the mesh: the transport endpoint plus the connection,
 * discovery and routing components wired on top of it.
 */
public class MeshNode {

    private static final Logger LOGGER = LoggerFactory.getLogger(MeshNode.class);

    private final ClusterId clusterId;
    private final MeshConfig config;
    private final Endpoint endpoint;
    private final AddressDirectory directory;
    private final ExecutorService workers;
    private final ConnectionManager connections;
    private final DiscoveryManager discovery;
    private final DiscoveryServer server;
    private final RouteTable routes;
    private final TrafficRouter router;
    private volatile boolean running = false;

    public MeshNode(MeshConfig config, Endpoint endpoint, AddressDirectory directory, ClusterScanner scanner) {
        this(config, endpoint, directory, scanner, QueryAuthorizer.allowAll(), Clock.systemUTC());
    }

    public MeshNode(MeshConfig config, Endpoint endpoint, AddressDirectory directory, ClusterScanner scanner,
                    QueryAuthorizer authorizer, Clock clock) {
        config.validate();
        this.clusterId = config.clusterIdValue();
        this.config = config;
        this.endpoint = endpoint;
        this.directory = directory;

        AtomicInteger threadCount = new AtomicInteger();
        this.workers = Executors.newFixedThreadPool(Math.max(4, Runtime.getRuntime().availableProcessors()), r -> {
            Thread t = new Thread(r, "peermesh-worker-" + clusterId + "-" + threadCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });

        this.connections = new ConnectionManager(endpoint, directory, config.connectionOptions(), clock);
        this.discovery = new DiscoveryManager(clusterId, scanner, connections, config.discoveryOptions(), clock);
        this.server = new DiscoveryServer(endpoint, discovery, authorizer, workers);
        this.routes = new RouteTable(discovery,
            new DestinationClassifier(config.proxy.meshDomain, config.proxy.defaultNamespace, config.staticRoutes()),
            config.routeTableOptions());
        this.router = new TrafficRouter(routes, connections, config.trafficRouterOptions(), clock);
    }

    /**
     * Starts serving peers and publishes this cluster's address.
     */
    public CompletableFuture<Void> start() {
        if (running) {
            return CompletableFuture.completedFuture(null);
        }
        running = true;
        connections.start();
        server.start();
        LOGGER.info("Mesh node for cluster {} started as {}", clusterId, endpoint.getNodeId().shortId());
        return publish();
    }

    /**
     * Registers the local cluster record and publishes the endpoint's address hints.
     */
    public CompletableFuture<Void> publish() {
        discovery.registerCluster(localClusterInfo());
        NodeAddr addr = endpoint.getNodeAddr();
        return directory.publish(clusterId, addr);
    }

    public ClusterInfo localClusterInfo() {
        NodeAddr addr = endpoint.getNodeAddr();
        return new ClusterInfo(
            clusterId,
            addr.nodeId(),
            addr.relayUrl(),
            addr.directAddresses(),
            discovery.discoverLocalServices(config.kubernetes.namespace)
        );
    }

    public void stop() {
        if (!running) {
            return;
        }
        running = false;
        server.stop();
        router.shutdown();
        connections.shutdown();
        endpoint.close();
        workers.shutdownNow();
        LOGGER.info("Mesh node for cluster {} stopped", clusterId);
    }

    public boolean isRunning() {
        return running;
    }

    public ClusterId getClusterId() {
        return clusterId;
    }

    public MeshConfig getConfig() {
        return config;
    }

    public Endpoint getEndpoint() {
        return endpoint;
    }

    public ConnectionManager getConnectionManager() {
        return connections;
    }

    public DiscoveryManager getDiscoveryManager() {
        return discovery;
    }

    public DiscoveryServer getDiscoveryServer() {
        return server;
    }

    public RouteTable getRouteTable() {
        return routes;
    }

    public TrafficRouter getTrafficRouter() {
        return router;
    }
}
