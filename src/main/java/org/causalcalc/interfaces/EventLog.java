package org.causalcalc.interfaces;

import org.causalcalc.model.ClockEvent;
import org.causalcalc.model.ClockSnapshot;
import org.causalcalc.model.TimelineEntry;

import java.util.List;
import java.util.Map;

/**
 * Append-only history of the events a process stamped.
 * Usage:
 *  - After stamping:      log.append("REQUEST_RECEIVED", "...", clock.snapshot());
 *  - For display:         log.tail(10), log.summarizeByType(), log.timeline(10)
 */
public interface EventLog {

    /** Id of the process whose events are recorded here. */
    String processId();

    /** Records a new event at the end of the log and returns it. */
    ClockEvent append(String eventType, String description, ClockSnapshot clock);

    /** Last {@code n} events in insertion order (fewer if the log is shorter). */
    List<ClockEvent> tail(int n);

    /** Every recorded event in insertion order. */
    List<ClockEvent> all();

    /** Number of events per event type. */
    Map<String, Long> summarizeByType();

    /** {@link #tail(int)} with each event's causal relation to its predecessor in the window. */
    List<TimelineEntry> timeline(int n);

    int size();
}
