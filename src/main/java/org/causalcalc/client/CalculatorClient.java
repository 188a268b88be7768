package org.causalcalc.client;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import org.causalcalc.config.ClusterConfig;
import org.causalcalc.http.DefaultHttpHandler;
import org.causalcalc.interfaces.EventLog;
import org.causalcalc.interfaces.HttpHandler;
import org.causalcalc.interfaces.VectorClock;
import org.causalcalc.model.CalculationResult;
import org.causalcalc.model.CausalRelation;
import org.causalcalc.model.ClockSnapshot;
import org.causalcalc.model.EventTypes;
import org.causalcalc.model.PartialOutcome;
import org.causalcalc.model.ServerEndpoint;
import org.causalcalc.model.SumRange;
import org.causalcalc.model.dto.HealthReply;
import org.causalcalc.model.dto.PartialSumRequest;
import org.causalcalc.model.dto.SumReply;
import org.causalcalc.util.CausalityAnalyzer;
import org.causalcalc.util.InMemoryEventLog;
import org.causalcalc.util.SynchronizedVectorClock;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * CalculatorClient splits {@code 1..n} over the calculator servers and stamps every exchange
 * with its own vector clock.
 * <p>
 * <b>Notes:</b>
 * <ul>
 *   <li>Each request carries the client clock as it was right before sending; sending does not tick.</li>
 *   <li>Replies are merged one by one once they arrived. A server that failed contributes nothing,
 *       so the clock is exactly as if the request had never been attempted.</li>
 *   <li>Transport failures are reported per server and never abort the whole calculation.</li>
 * </ul>
 */
public final class CalculatorClient implements AutoCloseable {

    private static final Gson GSON = new Gson();

    static final int HEALTH_TIMEOUT_MS = 1_000;
    static final int HEALTH_CHECK_TIMEOUT_MS = 2_000;
    static final int SUM_TIMEOUT_MS = 10_000;

    private final String clientId;
    private final VectorClock clock;
    private final EventLog eventLog;
    private final List<ServerEndpoint> servers;
    private final HttpHandler http;
    private final ExecutorService pool;

    public CalculatorClient(VectorClock clock, EventLog eventLog, List<ServerEndpoint> servers, HttpHandler http) {
        this.clock = clock;
        this.eventLog = eventLog;
        this.servers = List.copyOf(servers);
        this.http = http;
        this.clientId = clock.processId() + "-" + UUID.randomUUID().toString().substring(0, 8);
        this.pool = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "calc-client-io");
            t.setDaemon(true);
            return t;
        });
        eventLog.append(EventTypes.CLIENT_START, "Client application started", clock.snapshot());
    }

    public static CalculatorClient fromConfig(ClusterConfig config) {
        String id = config.clientId();
        return new CalculatorClient(new SynchronizedVectorClock(id, config.roster()),
                new InMemoryEventLog(id), config.servers(), new DefaultHttpHandler());
    }

    /* ------------------------------ health ------------------------------ */

    /** Probes one server without touching the clock. */
    public boolean isAvailable(ServerEndpoint server) {
        return checkHealth(server, HEALTH_TIMEOUT_MS).map(HealthReply::healthy).orElse(false);
    }

    public List<ServerEndpoint> availableServers() {
        List<ServerEndpoint> out = new ArrayList<>();
        for (ServerEndpoint s : servers) {
            if (isAvailable(s)) out.add(s);
        }
        return out;
    }

    /**
     * Local event "checking all servers", then probes each one.
     * @return per server the reply, empty when the server is down
     */
    public Map<ServerEndpoint, Optional<HealthReply>> healthCheckAll() {
        ClockSnapshot now = clock.increment();
        eventLog.append(EventTypes.HEALTH_CHECK, "Checking all servers", now);
        Map<ServerEndpoint, Optional<HealthReply>> out = new LinkedHashMap<>();
        for (ServerEndpoint s : servers) {
            out.put(s, checkHealth(s, HEALTH_CHECK_TIMEOUT_MS));
        }
        return out;
    }

    Optional<HealthReply> checkHealth(ServerEndpoint server, int timeoutMs) {
        try {
            Map<String, String> extra = new LinkedHashMap<>();
            extra.put("X-Client-Id", clientId);
            String raw = exchange(server, "GET", "/health", extra, new byte[0], timeoutMs);
            if (http.statusCodeOf(raw) != HttpHandler.OK) return Optional.empty();
            return Optional.ofNullable(GSON.fromJson(http.bodyOf(raw), HealthReply.class));
        } catch (IOException | JsonParseException e) {
            return Optional.empty();
        }
    }

    /* --------------------------- calculation ---------------------------- */

    /**
     * Adds up {@code 1..n} across {@code targets}.
     *
     * @param n upper bound, at least 1
     * @param targets servers to use, at least one
     * @param mode free text recorded in the REQUEST_INIT event (e.g. "Auto mode")
     * @return the result; servers that failed are missing from {@link CalculationResult#outcomes()}
     */
    public CalculationResult calculate(int n, List<ServerEndpoint> targets, String mode) {
        if (n < 1) {
            throw new IllegalArgumentException("n must be a positive integer, was " + n);
        }
        if (targets == null || targets.isEmpty()) {
            throw new IllegalArgumentException("no servers to calculate with");
        }

        ClockSnapshot init = clock.increment();
        eventLog.append(EventTypes.REQUEST_INIT, "Initiating calculation for n=" + n + " (" + mode + ")", init);
        String requestId = UUID.randomUUID().toString().substring(0, 8);
        long t0 = System.nanoTime();

        // with fewer numbers than servers the surplus servers get no range
        List<SumRange> ranges = divideWork(n, targets.size());
        List<CompletableFuture<Optional<PartialOutcome>>> pending = new ArrayList<>();
        for (int i = 0; i < ranges.size(); i++) {
            ServerEndpoint server = targets.get(i);
            SumRange range = ranges.get(i);
            ClockSnapshot sent = clock.snapshot();
            System.out.println("[Client] " + server.name() + " <- [" + range.start() + "-" + range.end() + "] "
                    + range.count() + " nums | VC " + sent.format());
            pending.add(CompletableFuture.supplyAsync(() -> requestPartialSum(server, range, requestId, sent), pool));
        }

        List<PartialOutcome> arrived = new ArrayList<>();
        for (CompletableFuture<Optional<PartialOutcome>> f : pending) {
            f.join().ifPresent(arrived::add);
        }
        arrived.sort(Comparator.comparingInt(o -> o.reply().rangeStart()));

        long total = 0L;
        for (PartialOutcome o : arrived) {
            total += o.reply().partialSum();
            clock.merge(o.received());
            System.out.println("[VectorClock] " + o.server().name() + " sent " + o.sent().format()
                    + " received " + o.received().format() + " " + o.relation().label());
        }

        ClockSnapshot done = clock.increment();
        eventLog.append(EventTypes.CALCULATION_COMPLETE,
                "Completed calculation for n=" + n + ", result=" + total, done);
        long elapsedMs = (System.nanoTime() - t0) / 1_000_000L;
        return new CalculationResult(n, requestId, total, ranges.size(), arrived, elapsedMs, done);
    }

    /**
     * Sends one range. The clock is only read here; merging happens in the caller once all replies are in.
     */
    Optional<PartialOutcome> requestPartialSum(ServerEndpoint server, SumRange range, String requestId, ClockSnapshot sent) {
        try {
            byte[] body = GSON.toJson(PartialSumRequest.of(range.start(), range.end(), requestId, sent))
                    .getBytes(StandardCharsets.UTF_8);
            Map<String, String> extra = new LinkedHashMap<>();
            extra.put("Content-Type", "application/json; charset=utf-8");
            extra.put("X-Client-Id", clientId);
            String raw = exchange(server, "POST", "/sum", extra, body, SUM_TIMEOUT_MS);

            int status = http.statusCodeOf(raw);
            if (status != HttpHandler.OK) {
                System.out.println("[Client] " + server.name() + ": " + status + " " + http.reason(status)
                        + " " + http.bodyOf(raw));
                return Optional.empty();
            }
            SumReply reply = GSON.fromJson(http.bodyOf(raw), SumReply.class);
            if (reply == null) {
                System.out.println("[Client] " + server.name() + ": empty reply");
                return Optional.empty();
            }
            ClockSnapshot received = reply.clock();
            CausalRelation relation = CausalityAnalyzer.relation(sent, received);
            return Optional.of(new PartialOutcome(server, reply, sent, received, relation));
        } catch (IOException | JsonParseException | IllegalArgumentException e) {
            System.out.println("[Client] " + server.name() + ": " + e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Splits {@code 1..n} into {@code parts} consecutive ranges; the first {@code n % parts} get one extra number.
     * When there are more parts than numbers only {@code n} ranges come back.
     */
    public static List<SumRange> divideWork(int n, int parts) {
        if (n < 1 || parts < 1) {
            throw new IllegalArgumentException("n and parts must be positive (n=" + n + ", parts=" + parts + ")");
        }
        int per = n / parts;
        int remainder = n % parts;
        List<SumRange> ranges = new ArrayList<>();
        int start = 1;
        for (int i = 0; i < parts; i++) {
            int size = per + (i < remainder ? 1 : 0);
            if (size == 0) break;
            int end = start + size - 1;
            ranges.add(new SumRange(start, end));
            start = end + 1;
        }
        return ranges;
    }

    /* ----------------------------- wire ---------------------------------- */

    private String exchange(ServerEndpoint server, String method, String path,
                            Map<String, String> extra, byte[] body, int timeoutMs) throws IOException {
        extra.put("Connection", "close");
        String req = http.buildRequest(method, path, server.host(), server.port(), extra, body.length);
        try (Socket socket = new Socket()) {
            socket.connect(new InetSocketAddress(server.host(), server.port()), timeoutMs);
            socket.setSoTimeout(timeoutMs);
            OutputStream out = socket.getOutputStream();
            InputStream in = socket.getInputStream();
            http.send(out, req, body);
            return http.readRawResponse(in);
        }
    }

    /* ---------------------------- accessors ------------------------------ */

    public String clientId() { return clientId; }
    public VectorClock clock() { return clock; }
    public EventLog eventLog() { return eventLog; }
    public List<ServerEndpoint> servers() { return servers; }

    /** Records the stop event and releases the request threads. */
    @Override
    public void close() {
        eventLog.append(EventTypes.CLIENT_STOP, "Client application stopped", clock.snapshot());
        pool.shutdownNow();
    }
}
