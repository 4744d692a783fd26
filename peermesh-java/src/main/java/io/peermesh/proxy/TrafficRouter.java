package io.peermesh.proxy;

import io.peermesh.ClusterId;
import io.peermesh.CrossClusterRoute;
import io.peermesh.ServiceEndpoint;
import io.peermesh.error.CircuitOpenException;
import io.peermesh.error.ErrorKind;
import io.peermesh.error.MeshException;
import io.peermesh.error.ProtocolException;
import io.peermesh.network.ConnectionManager;
import io.peermesh.network.transport.FramedStream;
import io.peermesh.network.transport.MeshConnection;
import io.peermesh.network.transport.MeshStream;
import io.peermesh.network.transport.StreamKind;
import io.peermesh.routing.RouteTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Carries intercepted requests to their target cluster.
 *
 * <p>Per attempt: the circuit breaker of the (cluster, service) pair is consulted, the
 * {@link RouteTable} picks an endpoint, the {@link ConnectionManager} supplies the
 * connection and the request travels as one envelope on a fresh {@code PROXY} stream.
 * Transport failures of idempotent requests are retried with backoff on endpoints not
 * yet tried. Failures surface as {@link MeshException}s whose kind tells them apart.
 */
public class TrafficRouter {

    private static final Logger LOGGER = LoggerFactory.getLogger(TrafficRouter.class);

    private final RouteTable routes;
    private final ConnectionManager connections;
    private final Options options;
    private final Clock clock;
    private final Map<BreakerKey, CircuitBreaker> breakers = new ConcurrentHashMap<>();
    private final ScheduledExecutorService scheduler;

    private final AtomicLong requests = new AtomicLong();
    private final AtomicLong successes = new AtomicLong();
    private final AtomicLong failures = new AtomicLong();
    private final AtomicLong retries = new AtomicLong();
    private final AtomicLong circuitRejections = new AtomicLong();

    public TrafficRouter(RouteTable routes, ConnectionManager connections) {
        this(routes, connections, Options.defaults(), Clock.systemUTC());
    }

    public TrafficRouter(RouteTable routes, ConnectionManager connections, Options options, Clock clock) {
        this.routes = routes;
        this.connections = connections;
        this.options = options;
        this.clock = clock;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "peermesh-traffic-retry");
            t.setDaemon(true);
            return t;
        });
    }

    public CompletableFuture<ProxyResponse> handle(InterceptedRequest request) {
        requests.incrementAndGet();
        CrossClusterRoute route;
        try {
            route = routes.classify(request.destination());
        } catch (MeshException e) {
            failures.incrementAndGet();
            return CompletableFuture.failedFuture(e);
        }
        return attempt(request, route, 0, new HashSet<>()).whenComplete((response, ex) -> {
            if (ex == null) {
                successes.incrementAndGet();
            } else {
                failures.incrementAndGet();
            }
        });
    }

    public void shutdown() {
        scheduler.shutdownNow();
    }

    public CircuitBreaker breakerFor(ClusterId cluster, String service) {
        return breakers.computeIfAbsent(new BreakerKey(cluster, service),
            k -> new CircuitBreaker(options.circuitBreaker(), clock));
    }

    private void forget(CrossClusterRoute route, CircuitBreaker breaker) {
        if (breaker.getState() == CircuitBreaker.State.CLOSED
                && breakers.remove(new BreakerKey(route.targetCluster(), route.targetService()), breaker)) {
            LOGGER.debug("Dropped breaker of {}, service is gone", route);
        }
        routes.forget(route);
    }

    public Map<String, CircuitBreaker.Status> getBreakerStatus() {
        Map<String, CircuitBreaker.Status> result = new LinkedHashMap<>();
        breakers.entrySet().stream()
            .sorted(Comparator.comparing(e -> e.getKey().toString()))
            .forEach(e -> result.put(e.getKey().toString(), e.getValue().getStatus()));
        return result;
    }

    public Stats getStats() {
        return new Stats(requests.get(), successes.get(), failures.get(), retries.get(), circuitRejections.get());
    }

    private CompletableFuture<ProxyResponse> attempt(InterceptedRequest request, CrossClusterRoute route,
                                                     int retriesSoFar, Set<ServiceEndpoint> tried) {
        CircuitBreaker breaker = breakerFor(route.targetCluster(), route.targetService());
        if (!breaker.tryAcquire()) {
            circuitRejections.incrementAndGet();
            return CompletableFuture.failedFuture(new CircuitOpenException(
                "circuit open for " + route.targetService() + " in " + route.targetCluster()));
        }

        AtomicReference<ServiceEndpoint> selected = new AtomicReference<>();
        AtomicReference<MeshConnection> used = new AtomicReference<>();
        return routes.select(route, tried)
            .thenCompose(endpoint -> {
                selected.set(endpoint);
                return send(request, route, endpoint, used);
            })
            .handle((response, ex) -> {
                if (ex == null) {
                    breaker.recordSuccess();
                    return CompletableFuture.completedFuture(response);
                }
                Throwable cause = MeshException.unwrap(ex);
                ErrorKind kind = MeshException.kindOf(cause);
                if (kind.isTransportFailure()) {
                    breaker.recordFailure();
                } else {
                    breaker.recordIgnored();
                }
                if (kind == ErrorKind.NOT_FOUND) {
                    forget(route, breaker);
                }
                MeshConnection connection = used.get();
                if (kind == ErrorKind.CONNECTION_CLOSED && connection != null && !connection.isOpen()) {
                    connections.closeConnection(route.targetCluster(), "stream failed: " + cause.getMessage());
                }

                ServiceEndpoint endpoint = selected.get();
                if (!options.retryPolicy().shouldRetry(request.method(), cause, retriesSoFar)) {
                    return CompletableFuture.<ProxyResponse>failedFuture(
                        MeshException.wrap(cause, request.method() + " " + route));
                }
                if (endpoint != null) {
                    tried.add(endpoint);
                }
                retries.incrementAndGet();
                long delay = options.retryPolicy().backoffMillis(retriesSoFar);
                LOGGER.warn("{} {} via {} failed ({}), retry {} in {}ms", request.method(), route, endpoint,
                    kind, retriesSoFar + 1, delay);
                return delay(delay).thenCompose(v -> attempt(request, route, retriesSoFar + 1, tried));
            })
            .thenCompose(f -> f);
    }

    private CompletableFuture<ProxyResponse> send(InterceptedRequest request, CrossClusterRoute route,
                                                  ServiceEndpoint endpoint, AtomicReference<MeshConnection> used) {
        ProxyRequest envelope = new ProxyRequest(
            request.method(),
            request.uri(),
            route.targetService(),
            route.targetNamespace(),
            endpoint.address(),
            endpoint.port(),
            request.headers(),
            request.body()
        );
        long started = System.nanoTime();
        AtomicReference<MeshStream> opened = new AtomicReference<>();
        routes.onRequestStart(route, endpoint);

        return connections.getConnection(route.targetCluster())
            .thenCompose(connection -> {
                used.set(connection);
                return connection.openStream();
            })
            .thenCompose(stream -> {
                opened.set(stream);
                return exchange(stream, envelope);
            })
            .orTimeout(options.requestTimeout().toMillis(), TimeUnit.MILLISECONDS)
            .whenComplete((response, ex) -> {
                Duration latency = Duration.ofNanos(System.nanoTime() - started);
                routes.onRequestComplete(route, endpoint, latency, ex == null);
                MeshStream stream = opened.get();
                if (ex != null && stream != null && stream.isOpen()) {
                    stream.reset();
                }
                if (ex == null) {
                    LOGGER.debug("{} {} -> {} via {} in {}ms", request.method(), request.uri(),
                        response.status(), endpoint, latency.toMillis());
                }
            });
    }

    private CompletableFuture<ProxyResponse> exchange(MeshStream stream, ProxyRequest envelope) {
        FramedStream framed = new FramedStream(stream, EnvelopeCodec.MAX_FRAME_SIZE);
        return framed.writeKind(StreamKind.PROXY)
            .thenCompose(v -> framed.writeFrame(EnvelopeCodec.encodeRequest(envelope)))
            .thenCompose(v -> stream.finish())
            .thenCompose(v -> framed.readFrame())
            .thenApply(bytes -> {
                if (bytes == null) {
                    throw new ProtocolException("peer closed the proxy stream without a response");
                }
                return EnvelopeCodec.decodeResponse(bytes);
            })
            .whenComplete((response, ex) -> framed.release());
    }

    private CompletableFuture<Void> delay(long millis) {
        CompletableFuture<Void> done = new CompletableFuture<>();
        scheduler.schedule(() -> done.complete(null), millis, TimeUnit.MILLISECONDS);
        return done;
    }

    private record BreakerKey(ClusterId cluster, String service) {
        @Override
        public String toString() {
            return cluster + "/" + service;
        }
    }

    public record Stats(
        long requests,
        long successes,
        long failures,
        long retries,
        long circuitRejections
    ) {}

    public record Options(Duration requestTimeout, RetryPolicy retryPolicy, CircuitBreaker.Options circuitBreaker) {

        public static Options defaults() {
            return builder().build();
        }

        public static Builder builder() {
            return new Builder();
        }

        public static class Builder {
            private Duration requestTimeout = Duration.ofSeconds(30);
            private RetryPolicy retryPolicy = RetryPolicy.defaults();
            private CircuitBreaker.Options circuitBreaker = CircuitBreaker.Options.defaults();

            public Builder requestTimeout(Duration timeout) { this.requestTimeout = timeout; return this; }
            public Builder retryPolicy(RetryPolicy policy) { this.retryPolicy = policy; return this; }
            public Builder circuitBreaker(CircuitBreaker.Options breaker) { this.circuitBreaker = breaker; return this; }

            public Options build() {
                return new Options(requestTimeout, retryPolicy, circuitBreaker);
            }
        }
    }
}
