package io.peermesh.agent;

import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.peermesh.ServiceInfo;
import io.peermesh.config.MeshConfig;
import io.peermesh.discovery.ClusterScanner;
import io.peermesh.discovery.DiscoveryManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Long-running side of a mesh node: keeps the local service view fresh, republishes the
 * node's address and serves the status endpoint.
 */
public class MeshAgent {

    private static final Logger LOGGER = LoggerFactory.getLogger(MeshAgent.class);

    private final MeshNode node;
    private final MeshConfig config;
    private final ClusterScanner scanner;
    private final ScheduledExecutorService scheduler;
    private final EventLoopGroup bossGroup;
    private final EventLoopGroup workerGroup;
    private final StatusServer statusServer;
    private volatile List<ServiceInfo> localServices = List.of();
    private volatile AutoCloseable watch;
    private volatile InetSocketAddress statusAddress;

    private final AtomicLong discoveryRounds = new AtomicLong();
    private final AtomicLong registrationRounds = new AtomicLong();
    private final AtomicLong failedRounds = new AtomicLong();

    public MeshAgent(MeshNode node, ClusterScanner scanner) {
        this.node = node;
        this.config = node.getConfig();
        this.scanner = scanner;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "peermesh-agent-" + node.getClusterId());
            t.setDaemon(true);
            return t;
        });
        this.bossGroup = new NioEventLoopGroup(1);
        this.workerGroup = new NioEventLoopGroup(1);
        this.statusServer = new StatusServer(config.agent.bindAddress, config.agent.port,
            bossGroup, workerGroup, this::getStatus);
    }

    public CompletableFuture<InetSocketAddress> start() {
        return node.start()
            .thenCompose(v -> {
                refreshLocalServices();
                watch = scanner.watchChanges(event -> {
                    LOGGER.debug("Local service {} {}", event.service().info().name(), event.type());
                    refreshLocalServices();
                });
                long discoveryInterval = config.discovery.localIntervalSeconds;
                long registrationInterval = config.discovery.registrationIntervalSeconds;
                scheduler.scheduleAtFixedRate(this::discoveryTick, discoveryInterval, discoveryInterval, TimeUnit.SECONDS);
                scheduler.scheduleAtFixedRate(this::registrationTick, registrationInterval, registrationInterval, TimeUnit.SECONDS);
                return statusServer.start();
            })
            .thenApply(bound -> {
                statusAddress = bound;
                LOGGER.info("Mesh agent for cluster {} running", node.getClusterId());
                return bound;
            });
    }

    public void stop() {
        scheduler.shutdownNow();
        AutoCloseable current = watch;
        if (current != null) {
            try {
                current.close();
            } catch (Exception e) {
                LOGGER.warn("Failed to stop watching local services", e);
            }
        }
        statusServer.stop().join();
        bossGroup.shutdownGracefully();
        workerGroup.shutdownGracefully();
        node.stop();
    }

    /**
     * Re-reads the local services. A changed set is registered right away.
     *
     * @return whether the set changed
     */
    public boolean refreshLocalServices() {
        discoveryRounds.incrementAndGet();
        List<ServiceInfo> current = node.getDiscoveryManager().discoverLocalServices(config.kubernetes.namespace);
        if (current.equals(localServices)) {
            return false;
        }
        LOGGER.info("Local services changed: {} -> {} services", localServices.size(), current.size());
        localServices = current;
        node.getDiscoveryManager().registerCluster(node.localClusterInfo());
        return true;
    }

    public CompletableFuture<Void> register() {
        registrationRounds.incrementAndGet();
        return node.publish().whenComplete((v, ex) -> {
            if (ex != null) {
                failedRounds.incrementAndGet();
                LOGGER.warn("Registration of cluster {} failed", node.getClusterId(), ex);
            } else {
                LOGGER.debug("Published address of cluster {}", node.getClusterId());
            }
        });
    }

    public ClusterStatus getStatus() {
        DiscoveryManager discovery = node.getDiscoveryManager();
        return new ClusterStatus(
            node.getClusterId().value(),
            node.getEndpoint().getNodeId().value(),
            node.getEndpoint().getNodeAddr(),
            localServices,
            discovery.listClusters().stream()
                .filter(c -> !c.id().equals(node.getClusterId()))
                .toList(),
            node.getConnectionManager().getStatus(),
            discovery.cacheSnapshot(),
            node.getTrafficRouter().getBreakerStatus()
        );
    }

    public InetSocketAddress getStatusAddress() {
        return statusAddress;
    }

    public long getDiscoveryRounds() {
        return discoveryRounds.get();
    }

    public long getRegistrationRounds() {
        return registrationRounds.get();
    }

    public long getFailedRounds() {
        return failedRounds.get();
    }

    private void discoveryTick() {
        try {
            refreshLocalServices();
        } catch (RuntimeException e) {
            failedRounds.incrementAndGet();
            LOGGER.warn("Local service discovery round failed", e);
        }
    }

    private void registrationTick() {
        try {
            register();
        } catch (RuntimeException e) {
            failedRounds.incrementAndGet();
            LOGGER.warn("Registration round failed", e);
        }
    }
}
