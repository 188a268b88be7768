package org.causalcalc.util;

import org.causalcalc.interfaces.VectorClock;
import org.causalcalc.model.ClockConfigurationException;
import org.causalcalc.model.ClockSnapshot;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Thread-safe vector clock guarded by a private monitor.
 * <p>
 * <b>Notes:</b>
 * <ul>
 *   <li>The roster (key set) is fixed at construction; merges never add ids.</li>
 *   <li>Every operation, including the compare-set-increment of {@link #merge(ClockSnapshot)},
 *       runs inside one critical section, so concurrent callers see some total order of calls.</li>
 *   <li>Each instance has its own monitor; clocks of different processes never block each other.</li>
 * </ul>
 */
public final class SynchronizedVectorClock implements VectorClock {

    /** Monitor serializing all reads and writes of {@code state}. */
    private final Object mon = new Object();

    private final String processId;

    // process id -> counter, guarded by mon
    private final Map<String, Integer> state;

    /**
     * Creates a clock with every counter at zero.
     *
     * @param processId owning process; must appear in {@code roster}
     * @param roster every participating process id, no duplicates
     * @throws ClockConfigurationException if the roster is invalid
     */
    public SynchronizedVectorClock(String processId, List<String> roster) {
        this(processId, zeroed(roster));
    }

    /**
     * Creates a clock starting from the given counters.
     *
     * @param processId owning process; must be a key of {@code initial}
     * @param initial roster with starting counters (non-negative)
     * @throws ClockConfigurationException if the owner is missing or a counter is invalid
     */
    public SynchronizedVectorClock(String processId, Map<String, Integer> initial) {
        if (processId == null || processId.isBlank()) {
            throw new ClockConfigurationException("process id must not be blank");
        }
        if (initial == null || initial.isEmpty()) {
            throw new ClockConfigurationException("roster must not be empty");
        }
        Map<String, Integer> copy = new HashMap<>();
        for (Map.Entry<String, Integer> e : initial.entrySet()) {
            String id = e.getKey();
            Integer value = e.getValue();
            if (id == null || id.isBlank()) {
                throw new ClockConfigurationException("roster contains a blank process id");
            }
            if (value == null || value < 0) {
                throw new ClockConfigurationException("counter for " + id + " must be >= 0, was " + value);
            }
            copy.put(id, value);
        }
        if (!copy.containsKey(processId)) {
            throw new ClockConfigurationException("process " + processId + " is not part of the roster " + copy.keySet());
        }
        this.processId = processId;
        this.state = copy;
    }

    private static Map<String, Integer> zeroed(List<String> roster) {
        if (roster == null || roster.isEmpty()) {
            throw new ClockConfigurationException("roster must not be empty");
        }
        Map<String, Integer> m = new LinkedHashMap<>();
        for (String id : roster) {
            if (id == null || id.isBlank()) {
                throw new ClockConfigurationException("roster contains a blank process id");
            }
            if (m.put(id, 0) != null) {
                throw new ClockConfigurationException("duplicate process id in roster: " + id);
            }
        }
        return m;
    }

    @Override
    public String processId() {
        return processId;
    }

    /**
     * Advances the owner's counter by exactly one.
     *
     * @return the clock right after the tick
     */
    @Override
    public ClockSnapshot increment() {
        synchronized (mon) {
            state.merge(processId, 1, Integer::sum);
            return ClockSnapshot.of(state);
        }
    }

    /**
     * Receive rule: {@code local[k] = max(local[k], received[k])} for every tracked k,
     * then {@code local[self] += 1}. Ids the roster does not know are dropped.
     *
     * @param received clock attached to the incoming message (may be null or empty)
     * @return the clock right after the merge
     */
    @Override
    public ClockSnapshot merge(ClockSnapshot received) {
        synchronized (mon) {
            if (received != null) {
                for (Map.Entry<String, Integer> e : received.asMap().entrySet()) {
                    state.computeIfPresent(e.getKey(), (k, local) -> Math.max(local, e.getValue()));
                }
            }
            state.merge(processId, 1, Integer::sum);
            return ClockSnapshot.of(state);
        }
    }

    @Override
    public ClockSnapshot snapshot() {
        synchronized (mon) {
            return ClockSnapshot.of(state);
        }
    }

    @Override
    public int valueOf(String id) {
        synchronized (mon) {
            Integer v = state.get(id);
            return v == null ? 0 : v;
        }
    }

    @Override
    public String toString() {
        return "VectorClock{" + "processId=" + processId + ", clock=" + format() + '}';
    }
}
