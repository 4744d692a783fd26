package io.peermesh.proxy;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Fail-fast gate for one (cluster, service) pair.
 *
 * <p>{@code failureThreshold} failures within the rolling {@code window} open the
 * breaker. Once {@code cooldown} has passed, exactly one trial call is let through;
 * its outcome closes the breaker or opens it again.
 */
public class CircuitBreaker {

    public enum State {
        CLOSED,
        OPEN,
        HALF_OPEN
    }

    private final Options options;
    private final Clock clock;
    private final Deque<Instant> failures = new ArrayDeque<>();
    private State state = State.CLOSED;
    private Instant openedAt;
    private boolean trialInFlight;
    private long trips;
    private long rejected;

    public CircuitBreaker(Options options, Clock clock) {
        this.options = options;
        this.clock = clock;
    }

    /**
     * Asks to send one call. Every {@code true} answer must be followed by exactly one
     * of {@link #recordSuccess}, {@link #recordFailure} or {@link #recordIgnored}.
     */
    public synchronized boolean tryAcquire() {
        Instant now = clock.instant();
        switch (state) {
            case CLOSED:
                return true;
            case OPEN:
                if (Duration.between(openedAt, now).compareTo(options.cooldown()) < 0) {
                    rejected++;
                    return false;
                }
                state = State.HALF_OPEN;
                trialInFlight = true;
                return true;
            case HALF_OPEN:
            default:
                if (trialInFlight) {
                    rejected++;
                    return false;
                }
                trialInFlight = true;
                return true;
        }
    }

    public synchronized void recordSuccess() {
        if (state == State.HALF_OPEN) {
            state = State.CLOSED;
            trialInFlight = false;
            failures.clear();
        }
    }

    public synchronized void recordFailure() {
        Instant now = clock.instant();
        switch (state) {
            case CLOSED:
                failures.addLast(now);
                prune(now);
                if (failures.size() >= options.failureThreshold()) {
                    open(now);
                }
                break;
            case HALF_OPEN:
                open(now);
                break;
            case OPEN:
            default:
                break;
        }
    }

    /**
     * The call ended without saying anything about the target's health.
     */
    public synchronized void recordIgnored() {
        if (state == State.HALF_OPEN) {
            trialInFlight = false;
        }
    }

    public synchronized State getState() {
        return state;
    }

    public synchronized Status getStatus() {
        prune(clock.instant());
        return new Status(state, failures.size(), trips, rejected, openedAt == null ? 0 : openedAt.toEpochMilli());
    }

    public synchronized void reset() {
        state = State.CLOSED;
        failures.clear();
        trialInFlight = false;
        openedAt = null;
    }

    private void open(Instant now) {
        state = State.OPEN;
        openedAt = now;
        trialInFlight = false;
        failures.clear();
        trips++;
    }

    private void prune(Instant now) {
        Instant horizon = now.minus(options.window());
        while (!failures.isEmpty() && !failures.peekFirst().isAfter(horizon)) {
            failures.pollFirst();
        }
    }

    public record Status(
        @JsonProperty("state") State state,
        @JsonProperty("recent_failures") int recentFailures,
        @JsonProperty("trips") long trips,
        @JsonProperty("rejected") long rejected,
        @JsonProperty("opened_at_ms") long openedAtMs
    ) {}

    public record Options(int failureThreshold, Duration window, Duration cooldown) {

        public static Options defaults() {
            return builder().build();
        }

        public static Builder builder() {
            return new Builder();
        }

        public static class Builder {
            private int failureThreshold = 5;
            private Duration window = Duration.ofSeconds(30);
            private Duration cooldown = Duration.ofSeconds(10);

            public Builder failureThreshold(int threshold) { this.failureThreshold = threshold; return this; }
            public Builder window(Duration window) { this.window = window; return this; }
            public Builder cooldown(Duration cooldown) { this.cooldown = cooldown; return this; }

            public Options build() {
                if (failureThreshold < 1) {
                    throw new IllegalArgumentException("failureThreshold must be at least 1");
                }
                return new Options(failureThreshold, window, cooldown);
            }
        }
    }
}
