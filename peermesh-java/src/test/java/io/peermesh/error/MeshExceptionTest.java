package io.peermesh.error;

import io.peermesh.ClusterId;
import io.peermesh.NodeId;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.ConnectException;
import java.nio.channels.ClosedChannelException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MeshException")
class MeshExceptionTest {

    @Test
    @DisplayName("should strip nested completion wrappers")
    void shouldUnwrapNestedWrappers() {
        NoEndpointsException root = new NoEndpointsException("no endpoints for orders");
        Throwable wrapped = new CompletionException(new ExecutionException(root));

        assertSame(root, MeshException.unwrap(wrapped));
        assertEquals(ErrorKind.NO_ENDPOINTS, MeshException.kindOf(wrapped));
    }

    @Test
    @DisplayName("should classify plain timeouts and I/O failures")
    void shouldClassifyForeignFailures() {
        assertEquals(ErrorKind.TIMEOUT, MeshException.kindOf(new CompletionException(new TimeoutException())));
        assertEquals(ErrorKind.UNREACHABLE, MeshException.kindOf(new ConnectException("Connection refused")));
        assertEquals(ErrorKind.UNREACHABLE, MeshException.kindOf(new CompletionException(new ClosedChannelException())));
    }

    @Test
    @DisplayName("should classify local faults as internal and never as transport failures")
    void shouldClassifyLocalFaultsAsInternal() {
        assertEquals(ErrorKind.INTERNAL, MeshException.kindOf(new NullPointerException()));
        assertEquals(ErrorKind.INTERNAL, MeshException.kindOf(new CompletionException(new RejectedExecutionException("pool shut down"))));
        assertEquals(ErrorKind.INTERNAL, MeshException.kindOf(new IllegalArgumentException("bad header")));
        assertFalse(ErrorKind.INTERNAL.isTransportFailure());
    }

    @Test
    @DisplayName("should keep mesh failures and wrap the rest")
    void shouldWrapForeignFailures() {
        CircuitOpenException open = new CircuitOpenException("open");
        assertSame(open, MeshException.wrap(new CompletionException(open), "ignored"));

        MeshException timeout = MeshException.wrap(new TimeoutException(), "query east");
        assertInstanceOf(MeshTimeoutException.class, timeout);
        assertEquals("query east: deadline exceeded", timeout.getMessage());

        MeshException io = MeshException.wrap(new IOException("reset"), "query east");
        assertInstanceOf(UnreachableException.class, io);
        assertEquals(ErrorKind.UNREACHABLE, io.getKind());
        assertEquals("query east: reset", io.getMessage());

        MeshException bug = MeshException.wrap(new IllegalStateException("boom"), "query east");
        assertInstanceOf(InternalMeshException.class, bug);
        assertEquals(ErrorKind.INTERNAL, bug.getKind());
    }

    @Test
    @DisplayName("should report both identities on a mismatch")
    void shouldDescribeIdentityMismatch() {
        NodeId expected = NodeId.random();
        NodeId actual = NodeId.random();
        IdentityMismatchException ex = new IdentityMismatchException(ClusterId.of("east"), expected, actual);

        assertEquals(ErrorKind.IDENTITY_MISMATCH, ex.getKind());
        assertEquals(ClusterId.of("east"), ex.getClusterId());
        assertEquals(expected, ex.getExpected());
        assertEquals(actual, ex.getActual());
        assertFalse(ErrorKind.IDENTITY_MISMATCH.isTransportFailure());
        assertTrue(ErrorKind.CONNECTION_CLOSED.isTransportFailure());
    }
}
