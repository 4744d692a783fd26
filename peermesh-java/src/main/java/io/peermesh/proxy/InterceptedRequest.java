package io.peermesh.proxy;

import io.peermesh.routing.Destination;

import java.util.List;
import java.util.Objects;

/**
 * A request captured by a {@link TrafficInterceptor}, before any routing decision.
 */
public record InterceptedRequest(
    String method,
    String uri,
    Destination destination,
    List<Header> headers,
    byte[] body
) {
    public InterceptedRequest {
        Objects.requireNonNull(method, "method");
        Objects.requireNonNull(destination, "destination");
        uri = uri == null || uri.isEmpty() ? "/" : uri;
        headers = headers == null ? List.of() : List.copyOf(headers);
        body = body == null ? new byte[0] : body;
    }
}
