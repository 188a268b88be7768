package org.causalcalc.interfaces;

import org.causalcalc.model.dto.HealthReply;
import org.causalcalc.model.dto.PartialSumRequest;
import org.causalcalc.model.dto.SumReply;

/**
 * Work a calculator server does for its clients. Every call is a clock event of the server process.
 */
public interface CalculatorService {

    /**
     * Merges the request clock, adds up {@code [start, end]} and replies with the server clock.
     * @throws IllegalArgumentException if the range or the carried clock is invalid
     */
    SumReply partialSum(PartialSumRequest request);

    /** Local event: ticks the clock and reports uptime. */
    HealthReply health(String clientId);

    String serverName();

    /** The single clock this server process owns. */
    VectorClock clock();

    EventLog eventLog();
}
