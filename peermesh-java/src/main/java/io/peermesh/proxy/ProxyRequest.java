package io.peermesh.proxy;

import java.util.List;
import java.util.Objects;

/**
 * An application request as carried across the mesh, addressed to one endpoint of the
 * target service.
 */
public record ProxyRequest(
    String method,
    String uri,
    String service,
    String namespace,
    String targetAddress,
    int targetPort,
    List<Header> headers,
    byte[] body
) {
    public ProxyRequest {
        Objects.requireNonNull(method, "method");
        Objects.requireNonNull(uri, "uri");
        headers = headers == null ? List.of() : List.copyOf(headers);
        body = body == null ? new byte[0] : body;
    }
}
