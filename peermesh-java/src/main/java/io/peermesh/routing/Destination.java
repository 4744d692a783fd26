package io.peermesh.routing;

/**
 * Where intercepted traffic claims to be going, before classification.
 *
 * @param host        host name as addressed by the client, without port
 * @param port        destination port, or {@code 0} if the client gave none
 * @param clusterHint explicit target cluster supplied out of band, may be {@code null}
 */
public record Destination(String host, int port, String clusterHint) {

    /**
     * Parses a {@code Host} header value such as {@code api.shop.east.mesh:8080}.
     */
    public static Destination fromHostHeader(String hostHeader, String clusterHint) {
        if (hostHeader == null || hostHeader.isBlank()) {
            return new Destination(null, 0, clusterHint);
        }
        String value = hostHeader.trim();
        int colon = value.lastIndexOf(':');
        if (colon > 0 && colon < value.length() - 1 && value.indexOf(':') == colon) {
            try {
                return new Destination(value.substring(0, colon), Integer.parseInt(value.substring(colon + 1)), clusterHint);
            } catch (NumberFormatException e) {
                return new Destination(value, 0, clusterHint);
            }
        }
        return new Destination(value, 0, clusterHint);
    }
}
