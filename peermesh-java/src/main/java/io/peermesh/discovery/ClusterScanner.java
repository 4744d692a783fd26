package io.peermesh.discovery;

import java.util.function.Consumer;
import java.util.stream.Stream;

/**
 * Source of the local cluster's services, typically backed by the Kubernetes API.
 *
 * <p>Results are snapshots: consumers never mutate them, and the scanner publishes a new
 * snapshot instead of changing an old one.
 */
public interface ClusterScanner {

    /**
     * @param namespace only services in this namespace, or {@code null} for all
     */
    Stream<LocalService> listServices(String namespace);

    /**
     * Subscribes to changes until the returned handle is closed.
     */
    AutoCloseable watchChanges(Consumer<ServiceChangeEvent> listener);
}
