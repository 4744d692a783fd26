package io.peermesh.routing;

import io.peermesh.ClusterId;
import io.peermesh.CrossClusterRoute;
import io.peermesh.Mesh;
import io.peermesh.error.UnroutableDestinationException;

import java.util.Locale;
import java.util.Map;

/**
 * Turns a {@link Destination} into a {@link CrossClusterRoute}.
 *
 * <p>In order: a static route configured for the host, an explicit cluster hint with a
 * host of the form {@code service[.namespace]}, and finally a mesh host name
 * {@code service.namespace.cluster.<mesh-domain>}.
 */
public class DestinationClassifier {

    public static final int DEFAULT_PORT = 80;

    private final String meshDomain;
    private final String defaultNamespace;
    private final Map<String, CrossClusterRoute> staticRoutes;

    public DestinationClassifier() {
        this(Mesh.DEFAULT_MESH_DOMAIN, Mesh.DEFAULT_NAMESPACE, Map.of());
    }

    public DestinationClassifier(String meshDomain, String defaultNamespace, Map<String, CrossClusterRoute> staticRoutes) {
        this.meshDomain = meshDomain.toLowerCase(Locale.ROOT);
        this.defaultNamespace = defaultNamespace;
        this.staticRoutes = Map.copyOf(staticRoutes);
    }

    public CrossClusterRoute classify(Destination destination) {
        if (destination.host() == null || destination.host().isBlank()) {
            throw new UnroutableDestinationException("request carries no destination host");
        }
        String host = destination.host().toLowerCase(Locale.ROOT);
        if (host.endsWith(".")) {
            host = host.substring(0, host.length() - 1);
        }

        CrossClusterRoute configured = staticRoutes.get(host);
        if (configured != null) {
            return destination.port() > 0 && configured.targetPort() == 0
                ? new CrossClusterRoute(configured.targetCluster(), configured.targetService(),
                    configured.targetNamespace(), destination.port())
                : configured;
        }

        int port = destination.port() > 0 ? destination.port() : DEFAULT_PORT;
        String hint = destination.clusterHint();
        if (hint != null && !hint.isBlank()) {
            String local = host.endsWith("." + meshDomain) ? host.substring(0, host.length() - meshDomain.length() - 1) : host;
            String[] labels = local.split("\\.");
            if (labels.length > 2 || labels[0].isEmpty()) {
                throw new UnroutableDestinationException("host " + destination.host() + " is not service[.namespace]");
            }
            String namespace = labels.length == 2 ? labels[1] : defaultNamespace;
            return new CrossClusterRoute(ClusterId.of(hint.trim()), labels[0], namespace, port);
        }

        if (!host.endsWith("." + meshDomain)) {
            throw new UnroutableDestinationException("host " + destination.host() + " is outside the ." + meshDomain + " domain");
        }
        String[] labels = host.substring(0, host.length() - meshDomain.length() - 1).split("\\.");
        if (labels.length != 3) {
            throw new UnroutableDestinationException(
                "host " + destination.host() + " is not service.namespace.cluster." + meshDomain);
        }
        for (String label : labels) {
            if (label.isEmpty()) {
                throw new UnroutableDestinationException("host " + destination.host() + " has an empty label");
            }
        }
        return new CrossClusterRoute(ClusterId.of(labels[2]), labels[0], labels[1], port);
    }
}
