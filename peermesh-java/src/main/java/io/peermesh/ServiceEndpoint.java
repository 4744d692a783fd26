package io.peermesh;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.Comparator;
import java.util.Objects;

/**
 * One addressable instance backing a service.
 */
public record ServiceEndpoint(String address, int port, int weight) {

    public static final Comparator<ServiceEndpoint> ORDER =
        Comparator.comparing(ServiceEndpoint::address).thenComparingInt(ServiceEndpoint::port);

    public ServiceEndpoint {
        Objects.requireNonNull(address, "address");
        if (port <= 0 || port > 65535) {
            throw new IllegalArgumentException("port out of range: " + port);
        }
    }

    public static ServiceEndpoint of(String address, int port) {
        return new ServiceEndpoint(address, port, 1);
    }

    @JsonIgnore
    public int effectiveWeight() {
        return weight <= 0 ? 1 : weight;
    }

    @Override
    public String toString() {
        return address + ":" + port;
    }
}
