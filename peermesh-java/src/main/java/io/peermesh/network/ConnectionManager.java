package io.peermesh.network;

import io.peermesh.ClusterId;
import io.peermesh.NodeAddr;
import io.peermesh.NodeId;
import io.peermesh.error.ErrorKind;
import io.peermesh.error.IdentityMismatchException;
import io.peermesh.error.MeshException;
import io.peermesh.error.MeshTimeoutException;
import io.peermesh.error.UnreachableException;
import io.peermesh.network.transport.AddressDirectory;
import io.peermesh.network.transport.Endpoint;
import io.peermesh.network.transport.MeshConnection;
import io.peermesh.network.transport.PathQuality;
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
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Owns the one logical connection kept per remote cluster.
 *
 * <p>{@link #getConnection(ClusterId)} drives a record through
 * {@code IDLE -> RESOLVING -> CONNECTING -> RELAYED/DIRECT}. Concurrent callers for the
 * same cluster share a single establishment attempt. A direct dial that fails falls
 * back to the relay within the same attempt; a relayed connection whose transport
 * later finds a direct path is upgraded in place. Closed and idle-expired records are
 * re-established lazily on next demand.
 *
 * <p>Once a cluster has been reached, its {@link NodeId} is pinned. A peer presenting
 * any other identity fails with {@link IdentityMismatchException}, which is never
 * retried and is reported through {@link #setOnIdentityMismatch}.
 */
public class ConnectionManager {

    private static final Logger LOGGER = LoggerFactory.getLogger(ConnectionManager.class);

    private final Endpoint endpoint;
    private final AddressDirectory directory;
    private final Options options;
    private final Clock clock;
    private final Map<ClusterId, ConnectionRecord> records = new ConcurrentHashMap<>();
    private final Map<ClusterId, CompletableFuture<MeshConnection>> inflight = new ConcurrentHashMap<>();
    private final Map<ClusterId, NodeId> identities = new ConcurrentHashMap<>();
    private final ScheduledExecutorService scheduler;
    private volatile boolean running = false;

    private Consumer<IdentityMismatchEvent> onIdentityMismatch;
    private Consumer<StateChangeEvent> onStateChange;

    private final AtomicLong establishAttempts = new AtomicLong();
    private final AtomicLong directConnections = new AtomicLong();
    private final AtomicLong relayedConnections = new AtomicLong();
    private final AtomicLong relayFallbacks = new AtomicLong();
    private final AtomicLong pathUpgrades = new AtomicLong();
    private final AtomicLong identityMismatches = new AtomicLong();
    private final AtomicLong idleClosures = new AtomicLong();
    private final AtomicLong failures = new AtomicLong();

    public ConnectionManager(Endpoint endpoint, AddressDirectory directory) {
        this(endpoint, directory, Options.defaults(), Clock.systemUTC());
    }

    public ConnectionManager(Endpoint endpoint, AddressDirectory directory, Options options, Clock clock) {
        this.endpoint = endpoint;
        this.directory = directory;
        this.options = options;
        this.clock = clock;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "peermesh-connection-manager");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Starts the periodic idle sweep.
     */
    public void start() {
        if (running) {
            return;
        }
        running = true;
        long interval = options.idleSweepInterval().toMillis();
        scheduler.scheduleAtFixedRate(() -> {
            try {
                sweepIdleConnections();
            } catch (RuntimeException e) {
                LOGGER.error("Idle sweep failed", e);
            }
        }, interval, interval, TimeUnit.MILLISECONDS);
        LOGGER.info("Connection manager started for node {}", endpoint.getNodeId().shortId());
    }

    public void shutdown() {
        running = false;
        scheduler.shutdownNow();
        for (ConnectionRecord record : records.values()) {
            MeshConnection connection = record.connection();
            ConnectionState previous = record.transitionTo(ConnectionState.CLOSED, "shutdown");
            if (previous != null) {
                notifyStateChange(record.clusterId(), previous, ConnectionState.CLOSED, "shutdown");
            }
            if (connection != null) {
                connection.close();
            }
        }
        for (CompletableFuture<MeshConnection> flight : inflight.values()) {
            flight.completeExceptionally(new UnreachableException("connection manager shut down"));
        }
        LOGGER.info("Connection manager stopped");
    }

    public NodeId getLocalNodeId() {
        return endpoint.getNodeId();
    }

    /**
     * Returns the live connection to {@code clusterId}, establishing it if needed.
     * Callers arriving while an attempt is in flight share its outcome.
     */
    public CompletableFuture<MeshConnection> getConnection(ClusterId clusterId) {
        MeshConnection live = liveConnection(clusterId);
        if (live != null) {
            return CompletableFuture.completedFuture(live);
        }

        CompletableFuture<MeshConnection> flight = new CompletableFuture<>();
        CompletableFuture<MeshConnection> existing = inflight.putIfAbsent(clusterId, flight);
        if (existing != null) {
            return existing.copy();
        }

        // a flight may have finished between the first check and claiming the slot
        live = liveConnection(clusterId);
        if (live != null) {
            inflight.remove(clusterId, flight);
            flight.complete(live);
            return flight.copy();
        }

        establish(clusterId).whenComplete((connection, ex) -> {
            inflight.remove(clusterId, flight);
            if (ex != null) {
                flight.completeExceptionally(MeshException.unwrap(ex));
            } else {
                flight.complete(connection);
            }
        });
        return flight.copy();
    }

    /**
     * Pins the identity expected from {@code clusterId}.
     *
     * @throws IdentityMismatchException if a different identity is already pinned
     */
    public void bindIdentity(ClusterId clusterId, NodeId nodeId) {
        NodeId bound = identities.putIfAbsent(clusterId, nodeId);
        if (bound != null && !bound.equals(nodeId)) {
            throw new IdentityMismatchException(clusterId, bound, nodeId);
        }
    }

    public Optional<NodeId> getBoundIdentity(ClusterId clusterId) {
        return Optional.ofNullable(identities.get(clusterId));
    }

    public ConnectionState getState(ClusterId clusterId) {
        ConnectionRecord record = records.get(clusterId);
        return record == null ? ConnectionState.IDLE : record.state();
    }

    /**
     * Closes the connection to {@code clusterId}. The next {@link #getConnection} call
     * establishes a fresh one.
     */
    public void closeConnection(ClusterId clusterId, String reason) {
        ConnectionRecord record = records.get(clusterId);
        if (record == null) {
            return;
        }
        MeshConnection connection = record.connection();
        ConnectionState previous = record.transitionTo(ConnectionState.CLOSED, reason);
        if (previous != null) {
            LOGGER.info("Closed connection to cluster {}: {}", clusterId, reason);
            notifyStateChange(clusterId, previous, ConnectionState.CLOSED, reason);
        }
        if (connection != null) {
            connection.close();
        }
    }

    /**
     * Closes every usable connection left unused for longer than the idle timeout.
     *
     * @return number of connections closed
     */
    public int sweepIdleConnections() {
        Instant now = clock.instant();
        int closed = 0;
        for (ConnectionRecord record : records.values()) {
            ConnectionState before = record.state();
            MeshConnection connection = record.closeIfIdle(now, options.idleTimeout());
            if (connection == null) {
                continue;
            }
            closed++;
            idleClosures.incrementAndGet();
            LOGGER.info("Closing idle connection to cluster {}", record.clusterId());
            notifyStateChange(record.clusterId(), before, ConnectionState.CLOSED, "idle timeout");
            connection.close();
        }
        return closed;
    }

    public List<ConnectionStatus> getStatus() {
        List<ConnectionStatus> result = new ArrayList<>();
        for (ConnectionRecord record : records.values()) {
            result.add(record.toStatus());
        }
        result.sort(Comparator.comparing(ConnectionStatus::clusterId));
        return result;
    }

    public Stats getStats() {
        int live = 0;
        for (ConnectionRecord record : records.values()) {
            if (record.state().isUsable()) {
                live++;
            }
        }
        return new Stats(
            live,
            establishAttempts.get(),
            directConnections.get(),
            relayedConnections.get(),
            relayFallbacks.get(),
            pathUpgrades.get(),
            identityMismatches.get(),
            idleClosures.get(),
            failures.get()
        );
    }

    public void setOnIdentityMismatch(Consumer<IdentityMismatchEvent> handler) {
        this.onIdentityMismatch = handler;
    }

    public void setOnStateChange(Consumer<StateChangeEvent> handler) {
        this.onStateChange = handler;
    }

    private MeshConnection liveConnection(ClusterId clusterId) {
        ConnectionRecord record = records.get(clusterId);
        return record == null ? null : record.acquire(clock.instant());
    }

    private CompletableFuture<MeshConnection> establish(ClusterId clusterId) {
        establishAttempts.incrementAndGet();
        ConnectionRecord record = new ConnectionRecord(clusterId, clock.instant());
        records.put(clusterId, record);
        transition(record, ConnectionState.RESOLVING, "connection requested");

        return resolve(clusterId, 0)
            .thenCompose(addr -> {
                checkIdentity(clusterId, addr.nodeId());
                transition(record, ConnectionState.CONNECTING, "resolved " + addr.nodeId().shortId());
                return connect(clusterId, addr)
                    .thenApply(connection -> register(record, addr.nodeId(), connection));
            })
            .whenComplete((connection, ex) -> {
                if (ex != null) {
                    fail(record, MeshException.unwrap(ex));
                }
            });
    }

    private CompletableFuture<NodeAddr> resolve(ClusterId clusterId, int attempt) {
        return directory.resolve(clusterId).handle((found, ex) -> {
            if (ex == null && found.isPresent()) {
                return CompletableFuture.completedFuture(found.get());
            }
            int attempts = attempt + 1;
            if (attempts >= options.resolveAttempts()) {
                String detail = ex == null ? "no address record" : MeshException.unwrap(ex).getMessage();
                return CompletableFuture.<NodeAddr>failedFuture(new UnreachableException(
                    "cluster " + clusterId + " unresolvable after " + attempts + " attempts: " + detail, ex));
            }
            long delay = calculateBackoffDelay(attempt);
            LOGGER.debug("No address for cluster {} (attempt {}), retrying in {}ms", clusterId, attempts, delay);
            return delay(delay).thenCompose(v -> resolve(clusterId, attempts));
        }).thenCompose(f -> f);
    }

    private long calculateBackoffDelay(int attempt) {
        long delay = options.resolveBackoff().toMillis();
        for (int i = 0; i < attempt; i++) {
            delay = (long) (delay * options.resolveBackoffMultiplier());
        }
        return Math.min(delay, options.resolveBackoffMax().toMillis());
    }

    private CompletableFuture<Void> delay(long millis) {
        CompletableFuture<Void> done = new CompletableFuture<>();
        scheduler.schedule(() -> done.complete(null), millis, TimeUnit.MILLISECONDS);
        return done;
    }

    private CompletableFuture<MeshConnection> connect(ClusterId clusterId, NodeAddr addr) {
        if (!addr.hasDirect() && !addr.hasRelay()) {
            return CompletableFuture.failedFuture(
                new UnreachableException("address record for cluster " + clusterId + " carries no hints"));
        }
        if (!addr.hasDirect()) {
            return viaRelay(clusterId, addr, null);
        }
        return endpoint.connect(addr.directOnly(), options.connectTimeout()).handle((connection, ex) -> {
            if (ex == null) {
                return CompletableFuture.completedFuture(connection);
            }
            Throwable cause = MeshException.unwrap(ex);
            if (MeshException.kindOf(cause) == ErrorKind.IDENTITY_MISMATCH || !addr.hasRelay()) {
                return CompletableFuture.<MeshConnection>failedFuture(exhausted(clusterId, cause, null));
            }
            relayFallbacks.incrementAndGet();
            LOGGER.warn("Direct connect to cluster {} failed ({}), falling back to relay {}",
                clusterId, cause.getMessage(), addr.relayUrl());
            return viaRelay(clusterId, addr, cause);
        }).thenCompose(f -> f);
    }

    private CompletableFuture<MeshConnection> viaRelay(ClusterId clusterId, NodeAddr addr, Throwable directFailure) {
        return endpoint.connect(addr.relayOnly(), options.connectTimeout()).handle((connection, ex) -> {
            if (ex == null) {
                return CompletableFuture.completedFuture(connection);
            }
            return CompletableFuture.<MeshConnection>failedFuture(
                exhausted(clusterId, MeshException.unwrap(ex), directFailure));
        }).thenCompose(f -> f);
    }

    private MeshException exhausted(ClusterId clusterId, Throwable last, Throwable earlier) {
        MeshException error;
        if (last instanceof IdentityMismatchException mismatch) {
            error = new IdentityMismatchException(clusterId, mismatch.getExpected(), mismatch.getActual());
        } else if (MeshException.kindOf(last) == ErrorKind.TIMEOUT) {
            error = new MeshTimeoutException("connect to cluster " + clusterId + " timed out", last);
        } else {
            error = new UnreachableException("all paths to cluster " + clusterId + " failed", last);
        }
        if (earlier != null) {
            error.addSuppressed(earlier);
        }
        return error;
    }

    private void checkIdentity(ClusterId clusterId, NodeId presented) {
        NodeId bound = identities.get(clusterId);
        if (bound != null && !bound.equals(presented)) {
            throw new IdentityMismatchException(clusterId, bound, presented);
        }
    }

    private MeshConnection register(ConnectionRecord record, NodeId dialed, MeshConnection connection) {
        ClusterId clusterId = record.clusterId();
        NodeId presented = connection.getRemoteNodeId();
        try {
            if (!presented.equals(dialed)) {
                throw new IdentityMismatchException(clusterId, dialed, presented);
            }
            bindIdentity(clusterId, presented);
        } catch (IdentityMismatchException e) {
            connection.close();
            throw e;
        }

        record.attach(connection, clock.instant());
        PathQuality quality = connection.getPathQuality();
        if (quality == PathQuality.DIRECT) {
            directConnections.incrementAndGet();
        } else {
            relayedConnections.incrementAndGet();
        }
        transition(record, ConnectionState.of(quality), "connected via " + connection.getId());

        connection.setOnPathChange(next -> {
            if (next == PathQuality.DIRECT && transition(record, ConnectionState.DIRECT, "path upgraded")) {
                pathUpgrades.incrementAndGet();
                LOGGER.info("Connection to cluster {} upgraded to a direct path", clusterId);
            }
        });
        connection.setOnClose(v -> transition(record, ConnectionState.CLOSED, "closed by transport"));
        LOGGER.info("Connected to cluster {} (node {}, {})", clusterId, presented.shortId(), quality);
        return connection;
    }

    private void fail(ConnectionRecord record, Throwable cause) {
        ClusterId clusterId = record.clusterId();
        failures.incrementAndGet();
        transition(record, ConnectionState.CLOSED, cause.getMessage());
        if (cause instanceof IdentityMismatchException mismatch) {
            identityMismatches.incrementAndGet();
            LOGGER.error("ALERT: identity mismatch for cluster {}: expected {}, peer presented {}",
                clusterId, mismatch.getExpected(), mismatch.getActual());
            Consumer<IdentityMismatchEvent> handler = onIdentityMismatch;
            if (handler != null) {
                handler.accept(new IdentityMismatchEvent(
                    clusterId, mismatch.getExpected(), mismatch.getActual(), clock.instant()));
            }
        } else {
            LOGGER.warn("Could not connect to cluster {}: {}", clusterId, cause.getMessage());
        }
    }

    private boolean transition(ConnectionRecord record, ConnectionState next, String reason) {
        ConnectionState previous = record.transitionTo(next, reason);
        if (previous == null) {
            return false;
        }
        LOGGER.debug("Cluster {}: {} -> {} ({})", record.clusterId(), previous, next, reason);
        notifyStateChange(record.clusterId(), previous, next, reason);
        return true;
    }

    private void notifyStateChange(ClusterId clusterId, ConnectionState from, ConnectionState to, String reason) {
        Consumer<StateChangeEvent> handler = onStateChange;
        if (handler != null) {
            handler.accept(new StateChangeEvent(clusterId, from, to, reason, clock.instant()));
        }
    }

    public record IdentityMismatchEvent(
        ClusterId clusterId,
        NodeId expected,
        NodeId actual,
        Instant timestamp
    ) {}

    public record StateChangeEvent(
        ClusterId clusterId,
        ConnectionState from,
        ConnectionState to,
        String reason,
        Instant timestamp
    ) {}

    public record Stats(
        int liveConnections,
        long establishAttempts,
        long directConnections,
        long relayedConnections,
        long relayFallbacks,
        long pathUpgrades,
        long identityMismatches,
        long idleClosures,
        long failures
    ) {}

    public record Options(
        Duration connectTimeout,
        int resolveAttempts,
        Duration resolveBackoff,
        Duration resolveBackoffMax,
        double resolveBackoffMultiplier,
        Duration idleTimeout,
        Duration idleSweepInterval
    ) {
        public static Options defaults() {
            return builder().build();
        }

        public static Builder builder() {
            return new Builder();
        }

        public static class Builder {
            private Duration connectTimeout = Duration.ofSeconds(5);
            private int resolveAttempts = 3;
            private Duration resolveBackoff = Duration.ofMillis(100);
            private Duration resolveBackoffMax = Duration.ofSeconds(2);
            private double resolveBackoffMultiplier = 2.0;
            private Duration idleTimeout = Duration.ofMinutes(5);
            private Duration idleSweepInterval = Duration.ofSeconds(30);

            public Builder connectTimeout(Duration timeout) { this.connectTimeout = timeout; return this; }
            public Builder resolveAttempts(int attempts) { this.resolveAttempts = attempts; return this; }
            public Builder resolveBackoff(Duration backoff) { this.resolveBackoff = backoff; return this; }
            public Builder resolveBackoffMax(Duration max) { this.resolveBackoffMax = max; return this; }
            public Builder resolveBackoffMultiplier(double mult) { this.resolveBackoffMultiplier = mult; return this; }
            public Builder idleTimeout(Duration timeout) { this.idleTimeout = timeout; return this; }
            public Builder idleSweepInterval(Duration interval) { this.idleSweepInterval = interval; return this; }

            public Options build() {
                if (resolveAttempts < 1) {
                    throw new IllegalArgumentException("resolveAttempts must be at least 1");
                }
                return new Options(
                    connectTimeout, resolveAttempts, resolveBackoff, resolveBackoffMax,
                    resolveBackoffMultiplier, idleTimeout, idleSweepInterval
                );
            }
        }
    }
}
