package org.causalcalc.model;

import java.util.List;

/** Outcome of one distributed {@code 1..n} sum. */
public record CalculationResult(int n,
                                String requestId,
                                long totalSum,
                                int serversUsed,
                                List<PartialOutcome> outcomes,
                                long elapsedMs,
                                ClockSnapshot finalClock) {

    public CalculationResult {
        outcomes = List.copyOf(outcomes);
    }

    public long expectedSum() {
        return (long) n * ((long) n + 1) / 2;
    }

    /** True when every range came back and the parts add up to {@code n(n+1)/2}. */
    public boolean verified() {
        return outcomes.size() == serversUsed && totalSum == expectedSum();
    }

    public int successes() {
        return outcomes.size();
    }
}
