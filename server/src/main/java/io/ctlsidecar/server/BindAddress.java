package io.ctlsidecar.server;

/**
 * host:port listen address.
 *
 * Accepted forms:
 *   "localhost:1331", "10.0.0.5:1331"   explicit host
 *   ":1331"                            all interfaces
 *   "[::1]:1331"                       IPv6 literal
 * Port 0 asks the OS for a free port.
 */
public record BindAddress(String host, int port) {
    static final String ALL_INTERFACES = "0.0.0.0";

    public BindAddress {
        if (host == null || host.isBlank()) throw new IllegalArgumentException("host must not be blank");
        if (port < 0 || port > 65535) throw new IllegalArgumentException("port out of range: " + port);
    }

    public static BindAddress parse(String addr) {
        if (addr == null || addr.isBlank()) {
            throw new IllegalArgumentException("bind address must not be empty");
        }
        int colon = addr.lastIndexOf(':');
        if (colon < 0) {
            throw new IllegalArgumentException("missing port in address " + addr);
        }
        String host = addr.substring(0, colon);
        String portStr = addr.substring(colon + 1);

        if (host.startsWith("[") && host.endsWith("]")) {
            host = host.substring(1, host.length() - 1);
        } else if (host.contains(":")) {
            throw new IllegalArgumentException("too many colons in address " + addr);
        }
        if (host.isEmpty()) {
            host = ALL_INTERFACES;
        }

        int port;
        try {
            port = Integer.parseInt(portStr);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid port in address " + addr, e);
        }
        return new BindAddress(host, port);
    }

    @Override
    public String toString() {
        return (host.contains(":") ? "[" + host + "]" : host) + ":" + port;
    }
}
