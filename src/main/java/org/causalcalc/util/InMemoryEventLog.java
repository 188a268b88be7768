package org.causalcalc.util;

import org.causalcalc.interfaces.EventLog;
import org.causalcalc.model.CausalRelation;
import org.causalcalc.model.ClockEvent;
import org.causalcalc.model.ClockSnapshot;
import org.causalcalc.model.TimelineEntry;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Unbounded, insertion-ordered event log of one process.
 * <p>
 * Appends from concurrent request threads of the owning process are serialized on a
 * private monitor, so log order matches the order in which appends were issued.
 * </p>
 */
public final class InMemoryEventLog implements EventLog {

    private final Object mon = new Object();
    private final String processId;
    private final List<ClockEvent> events = new ArrayList<>();

    public InMemoryEventLog(String processId) {
        if (processId == null || processId.isBlank()) {
            throw new IllegalArgumentException("process id must not be blank");
        }
        this.processId = processId;
    }

    @Override
    public String processId() {
        return processId;
    }

    @Override
    public ClockEvent append(String eventType, String description, ClockSnapshot clock) {
        if (eventType == null || eventType.isBlank()) {
            throw new IllegalArgumentException("event type must not be blank");
        }
        ClockSnapshot stamped = clock == null ? ClockSnapshot.empty() : clock;
        synchronized (mon) {
            // stamped under the monitor so timestamps never run backwards in log order
            ClockEvent evt = new ClockEvent(newEventId(), processId, eventType, stamped, Instant.now(), description);
            events.add(evt);
            return evt;
        }
    }

    @Override
    public List<ClockEvent> tail(int n) {
        if (n <= 0) return Collections.emptyList();
        synchronized (mon) {
            int from = Math.max(0, events.size() - n);
            return List.copyOf(events.subList(from, events.size()));
        }
    }

    @Override
    public List<ClockEvent> all() {
        synchronized (mon) {
            return List.copyOf(events);
        }
    }

    @Override
    public Map<String, Long> summarizeByType() {
        Map<String, Long> counts = new LinkedHashMap<>();
        for (ClockEvent e : all()) {
            counts.merge(e.eventType(), 1L, Long::sum);
        }
        return counts;
    }

    @Override
    public List<TimelineEntry> timeline(int n) {
        List<ClockEvent> window = tail(n);
        List<TimelineEntry> out = new ArrayList<>(window.size());
        for (int i = 0; i < window.size(); i++) {
            ClockEvent cur = window.get(i);
            Optional<CausalRelation> rel = (i == 0)
                    ? Optional.empty()
                    : Optional.of(CausalityAnalyzer.relation(window.get(i - 1).clock(), cur.clock()));
            out.add(new TimelineEntry(i + 1, cur, rel));
        }
        return out;
    }

    @Override
    public int size() {
        synchronized (mon) {
            return events.size();
        }
    }

    private static String newEventId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }
}
