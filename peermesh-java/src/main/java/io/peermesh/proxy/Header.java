package io.peermesh.proxy;

import java.util.Objects;

/**
 * One HTTP header line. Order and repetition are preserved wherever headers travel.
 */
public record Header(String name, String value) {

    public Header {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(value, "value");
    }
}
