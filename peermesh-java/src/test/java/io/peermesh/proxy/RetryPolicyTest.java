package io.peermesh.proxy;

import io.peermesh.error.CircuitOpenException;
import io.peermesh.error.ConnectionClosedException;
import io.peermesh.error.MeshTimeoutException;
import io.peermesh.error.NoEndpointsException;
import io.peermesh.error.ServiceNotFoundException;
import io.peermesh.error.UnreachableException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.net.ConnectException;
import java.time.Duration;
import java.util.concurrent.CompletionException;
import java.util.concurrent.RejectedExecutionException;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RetryPolicy")
class RetryPolicyTest {

    private final RetryPolicy policy = RetryPolicy.defaults();

    @ParameterizedTest
    @ValueSource(strings = { "GET", "get", "HEAD", "PUT", "DELETE", "OPTIONS" })
    @DisplayName("should retry idempotent methods")
    void shouldRetryIdempotentMethods(String method) {
        assertTrue(policy.shouldRetry(method, new ConnectionClosedException("reset"), 0));
    }

    @ParameterizedTest
    @ValueSource(strings = { "POST", "PATCH" })
    @DisplayName("should not retry non-idempotent methods by default")
    void shouldNotRetryNonIdempotent(String method) {
        assertFalse(policy.shouldRetry(method, new ConnectionClosedException("reset"), 0));
    }

    @Test
    @DisplayName("should retry any method when configured to")
    void shouldRetryAnyMethodWhenAllowed() {
        RetryPolicy lenient = RetryPolicy.builder().idempotentOnly(false).build();

        assertTrue(lenient.shouldRetry("POST", new UnreachableException("down"), 0));
    }

    @Test
    @DisplayName("should only retry transport failures")
    void shouldOnlyRetryTransportFailures() {
        assertTrue(policy.shouldRetry("GET", new MeshTimeoutException("slow"), 0));
        assertTrue(policy.shouldRetry("GET", new CompletionException(new UnreachableException("down")), 0));
        assertFalse(policy.shouldRetry("GET", new ServiceNotFoundException("gone"), 0));
        assertFalse(policy.shouldRetry("GET", new NoEndpointsException("none"), 0));
        assertFalse(policy.shouldRetry("GET", new CircuitOpenException("open"), 0));
    }

    @Test
    @DisplayName("should not retry local faults")
    void shouldNotRetryLocalFaults() {
        assertFalse(policy.shouldRetry("GET", new NullPointerException(), 0));
        assertFalse(policy.shouldRetry("GET", new CompletionException(new RejectedExecutionException("pool shut down")), 0));
        assertFalse(policy.shouldRetry("GET", new IllegalArgumentException("bad header"), 0));
        assertTrue(policy.shouldRetry("GET", new CompletionException(new ConnectException("Connection refused")), 0));
    }

    @Test
    @DisplayName("should stop after the retry budget")
    void shouldStopAfterBudget() {
        assertTrue(policy.shouldRetry("GET", new ConnectionClosedException("reset"), 1));
        assertFalse(policy.shouldRetry("GET", new ConnectionClosedException("reset"), 2));
        assertFalse(RetryPolicy.none().shouldRetry("GET", new ConnectionClosedException("reset"), 0));
    }

    @Test
    @DisplayName("should back off exponentially up to the cap")
    void shouldBackOffExponentially() {
        RetryPolicy backoff = RetryPolicy.builder()
            .initialBackoff(Duration.ofMillis(100))
            .maxBackoff(Duration.ofMillis(500))
            .backoffMultiplier(2.0)
            .build();

        assertEquals(100, backoff.backoffMillis(0));
        assertEquals(200, backoff.backoffMillis(1));
        assertEquals(400, backoff.backoffMillis(2));
        assertEquals(500, backoff.backoffMillis(3));
    }
}
