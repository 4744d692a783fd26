package io.peermesh.discovery;

import java.time.Instant;

public record ServiceChangeEvent(Type type, LocalService service, Instant timestamp) {

    public enum Type {
        ADDED,
        UPDATED,
        REMOVED
    }
}
