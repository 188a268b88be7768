package org.causalcalc.server;

import org.causalcalc.interfaces.CalculatorService;
import org.causalcalc.interfaces.EventLog;
import org.causalcalc.interfaces.VectorClock;
import org.causalcalc.model.CausalRelation;
import org.causalcalc.model.ClockSnapshot;
import org.causalcalc.model.EventTypes;
import org.causalcalc.model.dto.HealthReply;
import org.causalcalc.model.dto.PartialSumRequest;
import org.causalcalc.model.dto.SumReply;
import org.causalcalc.util.CausalityAnalyzer;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.concurrent.atomic.AtomicInteger;

public class CalculatorServiceImpl implements CalculatorService {

    static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSS");

    private final String serverName;
    private final VectorClock clock;
    private final EventLog eventLog;
    private final Instant startedAt;

    // requests served so far (partial sums only)
    private final AtomicInteger requestCount = new AtomicInteger();

    public CalculatorServiceImpl(String serverName, VectorClock clock, EventLog eventLog) {
        this.serverName = serverName;
        this.clock = clock;
        this.eventLog = eventLog;
        this.startedAt = Instant.now();

        eventLog.append(EventTypes.SERVER_START, "Server initialization", clock.snapshot());
        System.out.println("[Server] " + serverName + " started, initial clock " + clock.format());
    }

    @Override
    public SumReply partialSum(PartialSumRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("missing request body");
        }
        if (request.start() < 1 || request.end() < request.start()) {
            throw new IllegalArgumentException("invalid range [" + request.start() + "-" + request.end() + "]");
        }
        ClockSnapshot received = request.clock();
        int n = requestCount.incrementAndGet();

        ClockSnapshot before = clock.snapshot();
        ClockSnapshot after = clock.merge(received);
        eventLog.append(EventTypes.REQUEST_RECEIVED,
                "Partial sum request [" + request.start() + "-" + request.end() + "] from RequestID: " + request.requestId(),
                after);
        CausalRelation relation = CausalityAnalyzer.relation(before, received);

        System.out.println("[VectorClock] " + serverName + " partial sum request #" + n
                + " id=" + request.requestId() + " range=[" + request.start() + "-" + request.end() + "]");
        System.out.println("          Received VC:   " + received.format());
        System.out.println("          Before Update: " + before.format());
        System.out.println("          After Update:  " + after.format());
        System.out.println("          Causality:     " + describe(relation));

        long partialSum = rangeSum(request.start(), request.end());

        ClockSnapshot done = clock.increment();
        eventLog.append(EventTypes.CALCULATION_COMPLETE,
                "Calculated sum [" + request.start() + "-" + request.end() + "] = " + partialSum, done);

        System.out.println("[Server] " + serverName + " sum [" + request.start() + "-" + request.end() + "] = "
                + partialSum + " | VC " + done.format() + " | events logged: " + eventLog.size());

        return new SumReply(partialSum, serverName, LocalDateTime.now().format(TIMESTAMP),
                request.start(), request.end(), request.requestId(), done.asMap());
    }

    @Override
    public HealthReply health(String clientId) {
        ClockSnapshot now = clock.increment();
        eventLog.append(EventTypes.HEALTH_CHECK, "Health check from " + clientId, now);
        long uptime = Duration.between(startedAt, Instant.now()).getSeconds();
        System.out.println("[Server] health check from " + clientId + " | VC " + now.format()
                + " | uptime " + uptime + "s | requests " + requestCount.get());
        return new HealthReply(true, serverName, uptime, requestCount.get());
    }

    /**
     * How the server's state before the merge relates to the received clock.
     */
    static String describe(CausalRelation beforeVsReceived) {
        return switch (beforeVsReceived) {
            case BEFORE -> "CAUSALLY AFTER (received event happened after local state)";
            case AFTER -> "CAUSALLY BEFORE (local state is ahead of received event)";
            case CONCURRENT -> "CONCURRENT (events happened independently)";
        };
    }

    /** Sum of the integers in {@code [start, end]}, closed form. */
    static long rangeSum(int start, int end) {
        // widen before adding 1: end may be Integer.MAX_VALUE
        long toEnd = (long) end * ((long) end + 1) / 2;
        long toStartMinus1 = ((long) start - 1) * start / 2;
        return toEnd - toStartMinus1;
    }

    @Override public String serverName() { return serverName; }
    @Override public VectorClock clock() { return clock; }
    @Override public EventLog eventLog() { return eventLog; }
    public int requestCount() { return requestCount.get(); }
}
