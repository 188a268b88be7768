package org.causalcalc;

import org.causalcalc.client.CalculatorClient;
import org.causalcalc.http.DefaultHttpHandler;
import org.causalcalc.model.CalculationResult;
import org.causalcalc.model.CausalRelation;
import org.causalcalc.model.ClockEvent;
import org.causalcalc.model.EventTypes;
import org.causalcalc.model.PartialOutcome;
import org.causalcalc.model.ServerEndpoint;
import org.causalcalc.model.SumRange;
import org.causalcalc.model.dto.HealthReply;
import org.causalcalc.server.CalculatorServer;
import org.causalcalc.server.CalculatorServiceImpl;
import org.causalcalc.util.InMemoryEventLog;
import org.causalcalc.util.SynchronizedVectorClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class CalculatorClientTest {

    private static final List<String> ROSTER = List.of("Client", "Server1", "Server2");

    private final List<CalculatorServer> servers = new ArrayList<>();
    private ServerEndpoint s1;
    private ServerEndpoint s2;
    private ServerEndpoint down;

    private CalculatorServer startServer(String name) throws Exception {
        CalculatorServer server = new CalculatorServer(new CalculatorServiceImpl(name,
                new SynchronizedVectorClock(name, ROSTER), new InMemoryEventLog(name)));
        server.start(0);
        NetTestUtils.waitForPortOpen("localhost", server.port(), 2_000);
        servers.add(server);
        return server;
    }

    private static CalculatorClient newClient(List<ServerEndpoint> endpoints) {
        return new CalculatorClient(new SynchronizedVectorClock("Client", ROSTER),
                new InMemoryEventLog("Client"), endpoints, new DefaultHttpHandler());
    }

    @BeforeEach
    void setUp() throws Exception {
        s1 = new ServerEndpoint(1, "Server1", "localhost", startServer("Server1").port());
        s2 = new ServerEndpoint(2, "Server2", "localhost", startServer("Server2").port());
        down = new ServerEndpoint(3, "Server3", "localhost", NetTestUtils.freePort());
    }

    @AfterEach
    void tearDown() throws Exception {
        for (CalculatorServer s : servers) s.close();
    }

    @Test
    @DisplayName("sum over two servers is correct and clocks are merged")
    void calculateAcrossTwoServers() {
        try (CalculatorClient client = newClient(List.of(s1, s2))) {
            CalculationResult r = client.calculate(100, List.of(s1, s2), "test");

            assertEquals(5050L, r.totalSum());
            assertTrue(r.verified());
            assertEquals(2, r.successes());
            assertEquals(2, r.serversUsed());

            // init tick, one tick per merged reply, completion tick
            assertEquals("{Client:4, Server1:2, Server2:2}", r.finalClock().format());
            assertEquals(r.finalClock(), client.clock().snapshot());

            PartialOutcome first = r.outcomes().get(0);
            assertEquals(1, first.reply().rangeStart());
            assertEquals(50, first.reply().rangeEnd());
            assertEquals(1275L, first.reply().partialSum());
            assertEquals("{Client:1, Server1:0, Server2:0}", first.sent().format());
            assertEquals("{Client:1, Server1:2, Server2:0}", first.received().format());
            assertEquals(CausalRelation.BEFORE, first.relation());

            List<ClockEvent> events = client.eventLog().all();
            assertEquals(List.of(EventTypes.CLIENT_START, EventTypes.REQUEST_INIT, EventTypes.CALCULATION_COMPLETE),
                    events.stream().map(ClockEvent::eventType).toList());
            assertTrue(events.get(2).description().contains("result=5050"));
        }
    }

    @Test
    @DisplayName("server clocks see the client's send")
    void serverObservesClientClock() {
        try (CalculatorClient client = newClient(List.of(s1))) {
            client.calculate(10, List.of(s1), "test");
            assertEquals(1, servers.get(0).service().clock().valueOf("Client"));
            assertEquals(0, servers.get(1).service().clock().valueOf("Client"));
        }
    }

    @Test
    @DisplayName("a down server contributes nothing to the clock")
    void downServerLeavesClockAsIfNotAttempted() {
        try (CalculatorClient withDown = newClient(List.of(s1, down));
             CalculatorClient only = newClient(List.of(s1))) {

            CalculationResult r = withDown.calculate(10, List.of(s1, down), "test");
            assertEquals(1, r.successes());
            assertEquals(2, r.serversUsed());
            assertEquals(15L, r.totalSum());
            assertFalse(r.verified());
            assertEquals(0, withDown.clock().valueOf("Server3"));

            CalculationResult ref = only.calculate(5, List.of(s1), "test");
            assertEquals(ref.finalClock().valueOf("Client"), r.finalClock().valueOf("Client"));
            assertEquals("{Client:3, Server1:2, Server2:0}", r.finalClock().format());
        }
    }

    @Test
    void allServersDownStillCompletes() {
        try (CalculatorClient client = newClient(List.of(down))) {
            CalculationResult r = client.calculate(10, List.of(down), "test");
            assertTrue(r.outcomes().isEmpty());
            assertEquals(0L, r.totalSum());
            assertEquals(2, client.clock().valueOf("Client"));
        }
    }

    @Test
    void moreServersThanNumbers() {
        try (CalculatorClient client = newClient(List.of(s1, s2))) {
            CalculationResult r = client.calculate(1, List.of(s1, s2), "test");
            assertEquals(1, r.serversUsed());
            assertEquals(1L, r.totalSum());
            assertTrue(r.verified());
            assertEquals(0, servers.get(1).service().clock().valueOf("Server2"));
        }
    }

    @Test
    void rejectsInvalidArguments() {
        try (CalculatorClient client = newClient(List.of(s1))) {
            assertThrows(IllegalArgumentException.class, () -> client.calculate(0, List.of(s1), "x"));
            assertThrows(IllegalArgumentException.class, () -> client.calculate(5, List.of(), "x"));
            assertEquals(0, client.clock().valueOf("Client"));
        }
    }

    @Test
    void availabilityProbeDoesNotTouchClock() {
        try (CalculatorClient client = newClient(List.of(s1, s2, down))) {
            assertTrue(client.isAvailable(s1));
            assertFalse(client.isAvailable(down));
            assertEquals(List.of(s1, s2), client.availableServers());
            assertEquals(0, client.clock().valueOf("Client"));
        }
    }

    @Test
    void healthCheckAllTicksOnceAndReportsDownServers() {
        try (CalculatorClient client = newClient(List.of(s1, down))) {
            Map<ServerEndpoint, Optional<HealthReply>> replies = client.healthCheckAll();
            assertTrue(replies.get(s1).orElseThrow().healthy());
            assertTrue(replies.get(down).isEmpty());
            assertEquals(1, client.clock().valueOf("Client"));
            assertEquals(EventTypes.HEALTH_CHECK, client.eventLog().tail(1).get(0).eventType());
        }
    }

    @Test
    void closeLogsStop() {
        CalculatorClient client = newClient(List.of(s1));
        client.close();
        assertEquals(EventTypes.CLIENT_STOP, client.eventLog().tail(1).get(0).eventType());
        assertTrue(client.clientId().startsWith("Client-"));
    }

    @Test
    void divideWorkSplitsEvenlyWithRemainderFirst() {
        assertEquals(List.of(new SumRange(1, 34), new SumRange(35, 67), new SumRange(68, 100)),
                CalculatorClient.divideWork(100, 3));
        assertEquals(List.of(new SumRange(1, 1), new SumRange(2, 2)), CalculatorClient.divideWork(2, 5));
        assertEquals(List.of(new SumRange(1, 7)), CalculatorClient.divideWork(7, 1));
        assertThrows(IllegalArgumentException.class, () -> CalculatorClient.divideWork(0, 2));
        assertThrows(IllegalArgumentException.class, () -> CalculatorClient.divideWork(5, 0));
    }

    @Test
    void divideWorkCoversEveryNumberOnce() {
        for (int n = 1; n <= 40; n++) {
            for (int parts = 1; parts <= 6; parts++) {
                List<SumRange> ranges = CalculatorClient.divideWork(n, parts);
                int expectStart = 1;
                for (SumRange r : ranges) {
                    assertEquals(expectStart, r.start());
                    expectStart = r.end() + 1;
                }
                assertEquals(n + 1, expectStart);
            }
        }
    }
}
