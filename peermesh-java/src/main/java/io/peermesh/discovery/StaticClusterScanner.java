package io.peermesh.discovery;

import io.peermesh.ServiceInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.stream.Stream;

/**
 * Scanner over an in-memory service list. Every change swaps in a new immutable snapshot.
 */
public class StaticClusterScanner implements ClusterScanner {

    private static final Logger LOGGER = LoggerFactory.getLogger(StaticClusterScanner.class);

    private final Clock clock;
    private final List<Consumer<ServiceChangeEvent>> listeners = new CopyOnWriteArrayList<>();
    private volatile Map<String, LocalService> snapshot = Map.of();

    public StaticClusterScanner() {
        this(Clock.systemUTC());
    }

    public StaticClusterScanner(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Stream<LocalService> listServices(String namespace) {
        return snapshot.values().stream()
            .filter(s -> namespace == null || s.info().namespace().equals(namespace));
    }

    @Override
    public AutoCloseable watchChanges(Consumer<ServiceChangeEvent> listener) {
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    public void put(LocalService service) {
        LocalService previous;
        synchronized (this) {
            Map<String, LocalService> next = new LinkedHashMap<>(snapshot);
            previous = next.put(key(service.info()), service);
            snapshot = Map.copyOf(next);
        }
        if (!service.equals(previous)) {
            publish(previous == null ? ServiceChangeEvent.Type.ADDED : ServiceChangeEvent.Type.UPDATED, service);
        }
    }

    public boolean remove(String name, String namespace) {
        LocalService removed;
        synchronized (this) {
            Map<String, LocalService> next = new LinkedHashMap<>(snapshot);
            removed = next.remove(namespace + "/" + name);
            snapshot = Map.copyOf(next);
        }
        if (removed != null) {
            publish(ServiceChangeEvent.Type.REMOVED, removed);
        }
        return removed != null;
    }

    private void publish(ServiceChangeEvent.Type type, LocalService service) {
        ServiceChangeEvent event = new ServiceChangeEvent(type, service, clock.instant());
        for (Consumer<ServiceChangeEvent> listener : listeners) {
            try {
                listener.accept(event);
            } catch (RuntimeException e) {
                LOGGER.warn("Service change listener failed on {}", event, e);
            }
        }
    }

    private static String key(ServiceInfo info) {
        return info.namespace() + "/" + info.name();
    }
}
