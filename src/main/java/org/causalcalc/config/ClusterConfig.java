package org.causalcalc.config;

import org.causalcalc.model.ServerEndpoint;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Properties;
import java.util.Set;

/**
 * Who takes part in the system and where the servers listen.
 * <p>
 * Read from system properties (defaults in brackets):
 * <ul>
 *   <li>{@code calc.roster} [Client,Server1,Server2,Server3]: every process id tracked by the clocks</li>
 *   <li>{@code calc.servers} [Server1=localhost:5001,...]: servers the client talks to</li>
 *   <li>{@code calc.client.id} [Client]: process id of the console client</li>
 *   <li>{@code SERVER_NAME} [Server1]: name of a server process; spaces are dropped for its id</li>
 * </ul>
 */
public final class ClusterConfig {

    public static final String ROSTER_PROPERTY = "calc.roster";
    public static final String SERVERS_PROPERTY = "calc.servers";
    public static final String CLIENT_ID_PROPERTY = "calc.client.id";
    public static final String SERVER_NAME_PROPERTY = "SERVER_NAME";

    public static final String DEFAULT_ROSTER = "Client,Server1,Server2,Server3";
    public static final String DEFAULT_SERVERS =
            "Server1=localhost:5001,Server2=localhost:5002,Server3=localhost:5003";
    public static final String DEFAULT_CLIENT_ID = "Client";
    public static final String DEFAULT_SERVER_NAME = "Server1";
    public static final int DEFAULT_PORT = 5001;

    private final List<String> roster;
    private final List<ServerEndpoint> servers;
    private final String clientId;
    private final String serverName;

    public ClusterConfig(List<String> roster, List<ServerEndpoint> servers, String clientId, String serverName) {
        this.roster = List.copyOf(roster);
        this.servers = List.copyOf(servers);
        this.clientId = clientId;
        this.serverName = serverName;
    }

    public static ClusterConfig fromSystemProperties() {
        return from(System.getProperties());
    }

    public static ClusterConfig from(Properties props) {
        List<String> roster = parseRoster(props.getProperty(ROSTER_PROPERTY, DEFAULT_ROSTER));
        List<ServerEndpoint> servers = parseServers(props.getProperty(SERVERS_PROPERTY, DEFAULT_SERVERS));
        String clientId = props.getProperty(CLIENT_ID_PROPERTY, DEFAULT_CLIENT_ID).trim();
        String serverName = props.getProperty(SERVER_NAME_PROPERTY, DEFAULT_SERVER_NAME).trim();
        return new ClusterConfig(roster, servers, clientId, serverName);
    }

    /**
     * Splits a comma-separated roster. Duplicates are kept so the clock constructor can reject them.
     */
    static List<String> parseRoster(String text) {
        List<String> out = new ArrayList<>();
        if (text == null) return out;
        for (String part : text.split(",")) {
            String id = part.trim();
            if (!id.isEmpty()) out.add(id);
        }
        return out;
    }

    /** Parses {@code Name=host:port,Name2=host:port}; menu ids follow list order starting at 1. */
    static List<ServerEndpoint> parseServers(String text) {
        List<ServerEndpoint> out = new ArrayList<>();
        if (text == null || text.isBlank()) return out;
        Set<String> seen = new LinkedHashSet<>();
        int id = 1;
        for (String part : text.split(",")) {
            String entry = part.trim();
            if (entry.isEmpty()) continue;
            int eq = entry.indexOf('=');
            if (eq <= 0) {
                throw new IllegalArgumentException("expected Name=host:port but got '" + entry + "'");
            }
            String name = entry.substring(0, eq).trim();
            if (!seen.add(name)) {
                throw new IllegalArgumentException("duplicate server name: " + name);
            }
            out.add(ServerEndpoint.parse(id++, name, entry.substring(eq + 1).trim(), DEFAULT_PORT));
        }
        return out;
    }

    /** Process id derived from a display name ("Server 1" becomes "Server1"). */
    public static String processIdOf(String name) {
        return name == null ? "" : name.replace(" ", "");
    }

    public List<String> roster() { return roster; }
    public List<ServerEndpoint> servers() { return servers; }
    public String clientId() { return clientId; }
    public String serverName() { return serverName; }
    public String serverProcessId() { return processIdOf(serverName); }
}
