package io.peermesh.proxy;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public record ProxyResponse(int status, List<Header> headers, byte[] body) {

    /** Names the failure kind on responses generated by the mesh itself. */
    public static final String MESH_ERROR_HEADER = "X-Mesh-Error";

    public ProxyResponse {
        headers = headers == null ? List.of() : List.copyOf(headers);
        body = body == null ? new byte[0] : body;
    }

    /**
     * Plain-text response produced by the mesh rather than the target service.
     */
    public static ProxyResponse meshError(int status, String kind, String message) {
        List<Header> headers = new ArrayList<>();
        headers.add(new Header(MESH_ERROR_HEADER, kind));
        headers.add(new Header("Content-Type", "text/plain; charset=utf-8"));
        return new ProxyResponse(status, headers, (message == null ? kind : message).getBytes(StandardCharsets.UTF_8));
    }

    public Optional<String> header(String name) {
        return headers.stream()
            .filter(h -> h.name().equalsIgnoreCase(name))
            .map(Header::value)
            .findFirst();
    }

    public String bodyAsString() {
        return new String(body, StandardCharsets.UTF_8);
    }
}
