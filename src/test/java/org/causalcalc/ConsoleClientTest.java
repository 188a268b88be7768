package org.causalcalc;

import org.causalcalc.client.CalculatorClient;
import org.causalcalc.client.ConsoleClient;
import org.causalcalc.http.DefaultHttpHandler;
import org.causalcalc.model.ServerEndpoint;
import org.causalcalc.server.CalculatorServer;
import org.causalcalc.server.CalculatorServiceImpl;
import org.causalcalc.util.InMemoryEventLog;
import org.causalcalc.util.SynchronizedVectorClock;
import org.junit.jupiter.api.Test;

import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ConsoleClientTest {

    private static final List<String> ROSTER = List.of("Client", "Server1");

    private static CalculatorClient client(List<ServerEndpoint> servers) {
        return new CalculatorClient(new SynchronizedVectorClock("Client", ROSTER),
                new InMemoryEventLog("Client"), servers, new DefaultHttpHandler());
    }

    private static String run(CalculatorClient client, String script) throws Exception {
        ByteArrayOutputStream buf = new ByteArrayOutputStream();
        PrintStream out = new PrintStream(buf, true, StandardCharsets.UTF_8);
        new ConsoleClient(client, new BufferedReader(new StringReader(script)), out).run();
        return buf.toString(StandardCharsets.UTF_8);
    }

    @Test
    void displayOptionsDoNotTouchTheClock() throws Exception {
        ServerEndpoint down = new ServerEndpoint(1, "Server1", "localhost", NetTestUtils.freePort());
        try (CalculatorClient client = client(List.of(down))) {
            String out = run(client, "4\n5\n0\n");

            assertTrue(out.contains("Initial Vector Clock: {Client:0, Server1:0}"), out);
            assertTrue(out.contains("VECTOR CLOCK STATE & ANALYSIS"));
            assertTrue(out.contains("Total Logical Events: 0"));
            assertTrue(out.contains("EVENT LOG WITH CAUSALITY INFORMATION"));
            assertTrue(out.contains("[CLIENT_START]"));
            assertTrue(out.trim().endsWith("Exiting..."));
            assertEquals(0, client.clock().valueOf("Client"));
        }
    }

    @Test
    void invalidInputIsReportedAndMenuContinues() throws Exception {
        ServerEndpoint down = new ServerEndpoint(1, "Server1", "localhost", NetTestUtils.freePort());
        try (CalculatorClient client = client(List.of(down))) {
            String out = run(client, "9\n1\nabc\n1\n10\n2\nx,y\n2\n1\n");

            assertTrue(out.contains("Invalid selection."));
            assertTrue(out.contains("Invalid number. Please enter a positive integer."));
            assertTrue(out.contains("No servers available! Please start at least one server."));
            assertTrue(out.contains("Invalid selection format."));
            assertTrue(out.contains("OFFLINE"));
            assertTrue(out.contains("None of the selected servers are available!"));
            // input ran out: treated as exit
            assertTrue(out.trim().endsWith("Exiting..."));
            assertEquals(0, client.clock().valueOf("Client"));
        }
    }

    @Test
    void autoCalculationAgainstLiveServer() throws Exception {
        CalculatorServer server = new CalculatorServer(new CalculatorServiceImpl("Server1",
                new SynchronizedVectorClock("Server1", ROSTER), new InMemoryEventLog("Server1")));
        server.start(0);
        try (CalculatorClient client = client(List.of(new ServerEndpoint(1, "Server1", "localhost", server.port())))) {
            NetTestUtils.waitForPortOpen("localhost", server.port(), 2_000);
            String out = run(client, "1\n10\n3\n5\n0\n");

            assertTrue(out.contains("Total Sum (1 to 10): 55"), out);
            assertTrue(out.contains("Verification: CORRECT!"));
            assertTrue(out.contains("Causality: → (Happened Before)"));
            assertTrue(out.contains("Server1 | HEALTHY"));
            assertTrue(out.contains("Relation to prev: "));
            assertTrue(out.contains("REQUEST_INIT"));
        } finally {
            server.close();
        }
    }

    @Test
    void parseSelection() {
        assertEquals(Set.of(1, 3), ConsoleClient.parseSelection("1, 3", 3));
        assertEquals(Set.of(), ConsoleClient.parseSelection("7", 3));
        assertEquals(Set.of(2), ConsoleClient.parseSelection("2,2,", 3));
        assertNull(ConsoleClient.parseSelection("1,x", 3));
        assertNull(ConsoleClient.parseSelection(null, 3));
    }
}
