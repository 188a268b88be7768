package org.causalcalc.client;

import org.causalcalc.config.ClusterConfig;
import org.causalcalc.model.CalculationResult;
import org.causalcalc.model.ClockEvent;
import org.causalcalc.model.ClockSnapshot;
import org.causalcalc.model.PartialOutcome;
import org.causalcalc.model.ServerEndpoint;
import org.causalcalc.model.TimelineEntry;
import org.causalcalc.model.dto.HealthReply;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Interactive menu around {@link CalculatorClient}.
 * <p>
 * Options: 1 auto (all available servers), 2 manual server selection, 3 health check,
 * 4 clock state and analysis, 5 event log with causality, 0 exit.
 * Display options only read the clock and the event log.
 * </p>
 */
public final class ConsoleClient {

    static final int RECENT_EVENTS = 3;
    static final int TIMELINE_EVENTS = 10;

    private static final DateTimeFormatter TIME =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSS").withZone(ZoneId.systemDefault());

    private final CalculatorClient client;
    private final BufferedReader in;
    private final PrintStream out;

    public ConsoleClient(CalculatorClient client, BufferedReader in, PrintStream out) {
        this.client = client;
        this.in = in;
        this.out = out;
    }

    /**
     * CLI entry point. Servers and roster come from {@code -Dcalc.servers=...} / {@code -Dcalc.roster=...}.
     */
    public static void main(String[] args) throws Exception {
        try (CalculatorClient client = CalculatorClient.fromConfig(ClusterConfig.fromSystemProperties())) {
            BufferedReader stdin = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
            new ConsoleClient(client, stdin, System.out).run();
        }
    }

    /** Runs the menu until "0" or end of input. */
    public void run() throws IOException {
        out.println("=== DISTRIBUTED CALCULATOR - VECTOR CLOCK CAUSALITY TRACKING ===");
        out.println("Client ID: " + client.clientId());
        out.println("Initial Vector Clock: " + client.clock().format());

        while (true) {
            printMenu();
            String choice = in.readLine();
            if (choice == null || "0".equals(choice.trim())) {
                out.println("Exiting...");
                return;
            }
            try {
                switch (choice.trim()) {
                    case "1" -> calculateAuto();
                    case "2" -> calculateManual();
                    case "3" -> checkHealth();
                    case "4" -> showClockAnalysis();
                    case "5" -> showEventLog();
                    default -> out.println("Invalid selection.");
                }
            } catch (RuntimeException e) {
                out.println("Unexpected Error: " + e.getMessage());
            }
        }
    }

    private void printMenu() {
        out.println();
        out.println("OPTIONS:");
        out.println("  1. Calculate with Auto Load Balancing (All Servers)");
        out.println("  2. Calculate with Manual Server Selection");
        out.println("  3. Check Server Health");
        out.println("  4. Show Vector Clock State & Analysis");
        out.println("  5. Show Event Log with Causality");
        out.println("  0. Exit");
        out.print("Select option: ");
        out.flush();
    }

    /* ------------------------------ 1 / 2 ------------------------------ */

    void calculateAuto() throws IOException {
        Integer n = readPositiveInt("Enter a number (n) to calculate sum from 1 to n: ");
        if (n == null) return;

        out.println("AUTO MODE - checking all servers | Current VC: " + client.clock().format());
        List<ServerEndpoint> available = client.availableServers();
        if (available.isEmpty()) {
            out.println("No servers available! Please start at least one server.");
            return;
        }
        printResult(client.calculate(n, available, "Auto mode"));
    }

    void calculateManual() throws IOException {
        out.println("MANUAL SERVER SELECTION MODE");
        List<ServerEndpoint> online = new ArrayList<>();
        for (ServerEndpoint s : client.servers()) {
            boolean up = client.isAvailable(s);
            if (up) online.add(s);
            out.println("   " + s.id() + ". " + s.name() + " (" + s.address() + ") - " + (up ? "ONLINE" : "OFFLINE"));
        }

        out.print("Select servers to use (comma-separated, e.g. 1,2 or 1,3): ");
        out.flush();
        String line = in.readLine();
        Set<Integer> ids = parseSelection(line, client.servers().size());
        if (ids == null) {
            out.println("Invalid selection format.");
            return;
        }
        if (ids.isEmpty()) {
            out.println("No valid servers selected.");
            return;
        }

        List<ServerEndpoint> chosen = new ArrayList<>();
        for (ServerEndpoint s : client.servers()) {
            if (!ids.contains(s.id())) continue;
            if (online.contains(s)) {
                chosen.add(s);
            } else {
                out.println("Warning: selected server is offline: " + s.name());
            }
        }
        if (chosen.isEmpty()) {
            out.println("None of the selected servers are available!");
            return;
        }

        Integer n = readPositiveInt("Enter a number (n): ");
        if (n == null) return;
        printResult(client.calculate(n, chosen, "Manual: " + joinIds(ids)));
    }

    /**
     * Parses "1,3" into menu ids within {@code 1..max}; out-of-range ids are skipped.
     * @return the ids, or {@code null} if the text is not a comma-separated list of integers
     */
    public static Set<Integer> parseSelection(String line, int max) {
        Set<Integer> ids = new LinkedHashSet<>();
        if (line == null) return null;
        for (String part : line.split(",")) {
            String t = part.trim();
            if (t.isEmpty()) continue;
            int id;
            try {
                id = Integer.parseInt(t);
            } catch (NumberFormatException e) {
                return null;
            }
            if (id >= 1 && id <= max) ids.add(id);
        }
        return ids;
    }

    private static String joinIds(Set<Integer> ids) {
        StringBuilder sb = new StringBuilder();
        for (Integer id : ids) {
            if (sb.length() > 0) sb.append(',');
            sb.append(id);
        }
        return sb.toString();
    }

    private Integer readPositiveInt(String prompt) throws IOException {
        out.print(prompt);
        out.flush();
        String line = in.readLine();
        try {
            int n = Integer.parseInt(line == null ? "" : line.trim());
            if (n >= 1) return n;
        } catch (NumberFormatException ignored) {
            // reported below
        }
        out.println("Invalid number. Please enter a positive integer.");
        return null;
    }

    private void printResult(CalculationResult r) {
        out.println("RESULTS WITH VECTOR CLOCK ANALYSIS");
        for (PartialOutcome o : r.outcomes()) {
            out.println(" * " + o.reply().serverName() + ":");
            out.println("   Range: [" + o.reply().rangeStart() + "-" + o.reply().rangeEnd() + "] | Sum: " + o.reply().partialSum());
            out.println("   Sent VC:     " + o.sent().format());
            out.println("   Received VC: " + o.received().format());
            out.println("   Causality: " + o.relation().label());
        }
        if (r.outcomes().isEmpty()) {
            out.println("All servers failed!");
            return;
        }
        out.println("FINAL RESULT");
        out.println("   Total Sum (1 to " + r.n() + "): " + r.totalSum());
        out.println("   Total Time: " + r.elapsedMs() + " ms");
        out.println("   Servers: " + r.successes() + "/" + r.serversUsed());
        out.println("   Request: " + r.requestId());
        out.println("   Final VC: " + r.finalClock().format());
        out.println(r.verified()
                ? "Verification: CORRECT!"
                : "Expected " + r.expectedSum() + ", got " + r.totalSum());
    }

    /* -------------------------------- 3 -------------------------------- */

    void checkHealth() {
        Map<ServerEndpoint, Optional<HealthReply>> replies = client.healthCheckAll();
        out.println("SERVER HEALTH CHECK | Current VC: " + client.clock().format());
        for (Map.Entry<ServerEndpoint, Optional<HealthReply>> e : replies.entrySet()) {
            String name = e.getKey().name();
            Optional<HealthReply> reply = e.getValue();
            if (reply.isEmpty()) {
                out.println("   " + name + " | DOWN");
            } else if (reply.get().healthy()) {
                out.println("   " + name + " | HEALTHY | Uptime: " + reply.get().uptimeSeconds() + "s");
            } else {
                out.println("   " + name + " | UNHEALTHY");
            }
        }
    }

    /* -------------------------------- 4 -------------------------------- */

    void showClockAnalysis() {
        ClockSnapshot now = client.clock().snapshot();
        out.println("VECTOR CLOCK STATE & ANALYSIS");
        out.println("Current Vector Clock State:");
        out.println("   " + now.format());
        out.println("Detailed Breakdown:");
        for (Map.Entry<String, Integer> e : now.asMap().entrySet()) {
            out.println(String.format("   %-15s: %3d events", e.getKey(), e.getValue()));
        }
        out.println("Total Events Logged: " + client.eventLog().size());
        out.println("Processes Tracked: " + now.size());
        out.println("Total Logical Events: " + now.total());

        if (client.eventLog().size() >= 2) {
            out.println("Recent Causality Analysis:");
            for (ClockEvent evt : client.eventLog().tail(RECENT_EVENTS)) {
                out.println("   [" + evt.eventType() + "] at " + TIME.format(evt.timestamp()) + " | VC: " + evt.clock().format());
            }
        }
    }

    /* -------------------------------- 5 -------------------------------- */

    void showEventLog() {
        out.println("EVENT LOG WITH CAUSALITY INFORMATION");
        if (client.eventLog().size() == 0) {
            out.println("   No events logged yet.");
            return;
        }
        out.println("Total Events: " + client.eventLog().size());
        out.println("Event Type Summary:");
        for (Map.Entry<String, Long> e : client.eventLog().summarizeByType().entrySet()) {
            out.println(String.format("   %-20s: %3d events", e.getKey(), e.getValue()));
        }

        out.println("Event Timeline (Last " + TIMELINE_EVENTS + " events):");
        for (TimelineEntry t : client.eventLog().timeline(TIMELINE_EVENTS)) {
            ClockEvent evt = t.event();
            out.println(t.position() + ". [" + evt.eventType() + "]");
            out.println("   Time: " + TIME.format(evt.timestamp()));
            out.println("   Process: " + evt.processId());
            out.println("   Vector Clock: " + evt.clock().format());
            out.println("   Description: " + evt.description());
            t.relationToPrevious().ifPresent(rel -> out.println("   Relation to prev: " + rel.label()));
        }
    }
}
