package io.peermesh.proxy;

import io.peermesh.error.MeshException;

import java.time.Duration;
import java.util.Locale;
import java.util.Set;

/**
 * When and how fast a failed data-plane request is tried again. Only transport-level
 * failures qualify; a response from the service, whatever its status, is final.
 */
public record RetryPolicy(
    int maxRetries,
    Duration initialBackoff,
    Duration maxBackoff,
    double backoffMultiplier,
    boolean idempotentOnly,
    Set<String> idempotentMethods
) {
    public static final Set<String> IDEMPOTENT_METHODS = Set.of("GET", "HEAD", "OPTIONS", "PUT", "DELETE", "TRACE");

    public static RetryPolicy defaults() {
        return builder().build();
    }

    public static RetryPolicy none() {
        return builder().maxRetries(0).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean allowsMethod(String method) {
        return !idempotentOnly || idempotentMethods.contains(method.toUpperCase(Locale.ROOT));
    }

    /**
     * @param retriesSoFar retries already made for this request
     */
    public boolean shouldRetry(String method, Throwable failure, int retriesSoFar) {
        return retriesSoFar < maxRetries
            && allowsMethod(method)
            && MeshException.kindOf(failure).isTransportFailure();
    }

    public long backoffMillis(int retriesSoFar) {
        long delay = initialBackoff.toMillis();
        for (int i = 0; i < retriesSoFar; i++) {
            delay = (long) (delay * backoffMultiplier);
        }
        return Math.min(delay, maxBackoff.toMillis());
    }

    public static class Builder {
        private int maxRetries = 2;
        private Duration initialBackoff = Duration.ofMillis(50);
        private Duration maxBackoff = Duration.ofSeconds(1);
        private double backoffMultiplier = 2.0;
        private boolean idempotentOnly = true;
        private Set<String> idempotentMethods = IDEMPOTENT_METHODS;

        public Builder maxRetries(int retries) { this.maxRetries = retries; return this; }
        public Builder initialBackoff(Duration backoff) { this.initialBackoff = backoff; return this; }
        public Builder maxBackoff(Duration backoff) { this.maxBackoff = backoff; return this; }
        public Builder backoffMultiplier(double mult) { this.backoffMultiplier = mult; return this; }
        public Builder idempotentOnly(boolean only) { this.idempotentOnly = only; return this; }
        public Builder idempotentMethods(Set<String> methods) { this.idempotentMethods = Set.copyOf(methods); return this; }

        public RetryPolicy build() {
            if (maxRetries < 0) {
                throw new IllegalArgumentException("maxRetries must not be negative");
            }
            return new RetryPolicy(maxRetries, initialBackoff, maxBackoff, backoffMultiplier,
                idempotentOnly, idempotentMethods);
        }
    }
}
