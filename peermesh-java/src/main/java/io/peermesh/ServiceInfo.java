package io.peermesh;

import java.util.Objects;

/**
 * A service exposed by a cluster. Compared by value.
 */
public record ServiceInfo(String name, String namespace, int port, String protocol) {

    public ServiceInfo {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(namespace, "namespace");
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("port out of range: " + port);
        }
        protocol = protocol == null ? "TCP" : protocol;
    }

    public boolean matches(String serviceName, String serviceNamespace) {
        return name.equals(serviceName) && namespace.equals(serviceNamespace);
    }
}
