package org.causalcalc.model.dto;

import org.causalcalc.model.ClockSnapshot;

import java.util.Map;

/** Reply of {@code POST /sum}; {@code vectorClock} is the server's clock after handling the request. */
public record SumReply(long partialSum,
                       String serverName,
                       String timestamp,
                       int rangeStart,
                       int rangeEnd,
                       String requestId,
                       Map<String, Integer> vectorClock) {

    public ClockSnapshot clock() {
        return ClockSnapshot.of(vectorClock);
    }
}
