package io.peermesh.routing;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;

/**
 * Live counters for one endpoint of one route.
 */
public final class EndpointMetrics {

    private final double alpha;
    private int active;
    private long samples;
    private double ewmaMillis;
    private long successes;
    private long failures;
    private int consecutiveFailures;

    EndpointMetrics(double alpha) {
        this.alpha = alpha;
    }

    synchronized void recordStart() {
        active++;
    }

    synchronized void recordComplete(Duration latency, boolean success) {
        if (active > 0) {
            active--;
        }
        if (!success) {
            failures++;
            consecutiveFailures++;
            return;
        }
        // only successful exchanges feed the latency average
        double millis = latency.toNanos() / 1_000_000.0;
        ewmaMillis = samples == 0 ? millis : alpha * millis + (1 - alpha) * ewmaMillis;
        samples++;
        successes++;
        consecutiveFailures = 0;
    }

    synchronized boolean isIdle() {
        return active == 0;
    }

    synchronized Snapshot snapshot() {
        return new Snapshot(active, samples, ewmaMillis, successes, failures, consecutiveFailures);
    }

    public record Snapshot(
        @JsonProperty("active") int active,
        @JsonProperty("samples") long samples,
        @JsonProperty("ewma_ms") double ewmaMillis,
        @JsonProperty("successes") long successes,
        @JsonProperty("failures") long failures,
        @JsonProperty("consecutive_failures") int consecutiveFailures
    ) {
        static final Snapshot EMPTY = new Snapshot(0, 0, 0.0, 0, 0, 0);
    }
}
