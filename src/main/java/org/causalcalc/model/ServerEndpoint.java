package org.causalcalc.model;

/** A calculator server the client can reach: menu id, process name and socket address. */
public record ServerEndpoint(int id, String name, String host, int port) {

    public ServerEndpoint {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("server name must not be blank");
        }
        if (host == null || host.isBlank()) {
            throw new IllegalArgumentException("host must not be blank for " + name);
        }
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("invalid port for " + name + ": " + port);
        }
    }

    /**
     * Parses {@code http://host:port}, {@code host:port} or {@code host}.
     *
     * @param id menu id
     * @param name server process name
     * @param hostPort address text
     * @param defaultPort used when no port is given
     */
    public static ServerEndpoint parse(int id, String name, String hostPort, int defaultPort) {
        if (hostPort == null) {
            throw new IllegalArgumentException("address must not be null for " + name);
        }
        String hp = hostPort.trim().replaceFirst("^https?://", "");
        if (hp.contains("/")) hp = hp.substring(0, hp.indexOf('/'));
        int i = hp.indexOf(':');
        if (i < 0) return new ServerEndpoint(id, name, hp, defaultPort);
        try {
            return new ServerEndpoint(id, name, hp.substring(0, i), Integer.parseInt(hp.substring(i + 1)));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid port in address " + hostPort, e);
        }
    }

    public String address() {
        return "http://" + host + ":" + port;
    }
}
