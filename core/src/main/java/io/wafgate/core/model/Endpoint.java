package io.wafgate.core.model;

/**
 * One side of a TCP connection: a host (IP literal or name) and an optional
 * port.
 *
 * @param host the host, never {@code null} (empty when unknown)
 * @param port the port, or {@code null} when it could not be determined
 */
public record Endpoint(String host, Integer port) {

    private static final Endpoint UNKNOWN = new Endpoint("", null);

    public Endpoint {
        host = host != null ? host : "";
        if (port != null && (port <= 0 || port > 65535)) {
            port = null;
        }
    }

    /**
     * Creates an endpoint from a servlet-style host and port pair. Ports
     * outside {@code 1..65535} (servlet containers report {@code -1} or
     * {@code 0} when unknown) are treated as absent.
     */
    public static Endpoint of(String host, int port) {
        return new Endpoint(host, port);
    }

    /** Returns the endpoint used when nothing is known about the peer. */
    public static Endpoint unknown() {
        return UNKNOWN;
    }

    /** The port, or {@code 0} if absent. */
    public int portOrZero() {
        return port != null ? port : 0;
    }

    @Override
    public String toString() {
        if (port == null) {
            return host;
        }
        return host.indexOf(':') >= 0 ? "[" + host + "]:" + port : host + ":" + port;
    }
}
