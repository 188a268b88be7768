package org.causalcalc.model;

import java.time.Instant;
import java.util.Objects;

/**
 * One stamped event of a process: who, what kind, the clock at stamping time and a description.
 * The wall-clock timestamp is informational only; ordering comes from {@code clock}.
 */
public record ClockEvent(String eventId,
                         String processId,
                         String eventType,
                         ClockSnapshot clock,
                         Instant timestamp,
                         String description) {

    public ClockEvent {
        Objects.requireNonNull(eventId, "eventId");
        Objects.requireNonNull(processId, "processId");
        Objects.requireNonNull(eventType, "eventType");
        Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(timestamp, "timestamp");
        description = (description == null) ? "" : description;
    }

    /** Clock rendered as {@code [A:1, B:0]}. */
    public String causalityInfo() {
        String f = clock.format();
        return "[" + f.substring(1, f.length() - 1) + "]";
    }
}
