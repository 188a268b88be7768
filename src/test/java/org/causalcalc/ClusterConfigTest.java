package org.causalcalc;

import org.causalcalc.config.ClusterConfig;
import org.causalcalc.model.ServerEndpoint;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class ClusterConfigTest {

    @Test
    void defaultsDescribeThreeLocalServers() {
        ClusterConfig c = ClusterConfig.from(new Properties());
        assertEquals(List.of("Client", "Server1", "Server2", "Server3"), c.roster());
        assertEquals(3, c.servers().size());
        assertEquals(new ServerEndpoint(2, "Server2", "localhost", 5002), c.servers().get(1));
        assertEquals("Client", c.clientId());
        assertEquals("Server1", c.serverProcessId());
    }

    @Test
    void readsOverrides() {
        Properties p = new Properties();
        p.setProperty(ClusterConfig.ROSTER_PROPERTY, " C , A ,B ");
        p.setProperty(ClusterConfig.SERVERS_PROPERTY, "A=http://10.0.0.1:7000/, B=hostb");
        p.setProperty(ClusterConfig.CLIENT_ID_PROPERTY, "C");
        p.setProperty(ClusterConfig.SERVER_NAME_PROPERTY, "Server 2");

        ClusterConfig c = ClusterConfig.from(p);
        assertEquals(List.of("C", "A", "B"), c.roster());
        assertEquals(new ServerEndpoint(1, "A", "10.0.0.1", 7000), c.servers().get(0));
        assertEquals(new ServerEndpoint(2, "B", "hostb", ClusterConfig.DEFAULT_PORT), c.servers().get(1));
        assertEquals("Server 2", c.serverName());
        assertEquals("Server2", c.serverProcessId());
    }

    @Test
    void rejectsMalformedServerList() {
        Properties dup = new Properties();
        dup.setProperty(ClusterConfig.SERVERS_PROPERTY, "A=h:1,A=h:2");
        assertThrows(IllegalArgumentException.class, () -> ClusterConfig.from(dup));

        Properties noName = new Properties();
        noName.setProperty(ClusterConfig.SERVERS_PROPERTY, "h:1");
        assertThrows(IllegalArgumentException.class, () -> ClusterConfig.from(noName));

        Properties badPort = new Properties();
        badPort.setProperty(ClusterConfig.SERVERS_PROPERTY, "A=h:abc");
        assertThrows(IllegalArgumentException.class, () -> ClusterConfig.from(badPort));
    }

    @Test
    void emptyServerListIsAllowed() {
        Properties p = new Properties();
        p.setProperty(ClusterConfig.SERVERS_PROPERTY, " ");
        assertTrue(ClusterConfig.from(p).servers().isEmpty());
    }

    @Test
    void processIdDropsSpaces() {
        assertEquals("Server1", ClusterConfig.processIdOf("Server 1"));
        assertEquals("", ClusterConfig.processIdOf(null));
    }
}
