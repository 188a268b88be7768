package org.causalcalc.model.dto;

import org.causalcalc.model.ClockSnapshot;

import java.util.Map;

/**
 * Body of {@code POST /sum}: the range to add up plus the sender's vector clock at send time.
 */
public record PartialSumRequest(int start, int end, String requestId, Map<String, Integer> vectorClock) {

    public static PartialSumRequest of(int start, int end, String requestId, ClockSnapshot clock) {
        return new PartialSumRequest(start, end, requestId, clock.asMap());
    }

    /** Carried clock; an absent clock is read as empty. */
    public ClockSnapshot clock() {
        return ClockSnapshot.of(vectorClock);
    }
}
