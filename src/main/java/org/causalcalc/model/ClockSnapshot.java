package org.causalcalc.model;

import java.util.Collections;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Immutable view of a vector clock at one point in time.
 * <p>
 * Keys are process ids, values are non-negative event counters. Keys are kept in
 * lexicographic order so {@link #format()} is stable no matter how the state was built.
 * </p>
 */
public final class ClockSnapshot {

    private static final ClockSnapshot EMPTY = new ClockSnapshot(new TreeMap<>());

    private final SortedMap<String, Integer> counters;

    private ClockSnapshot(SortedMap<String, Integer> counters) {
        this.counters = Collections.unmodifiableSortedMap(counters);
    }

    /**
     * Copies the given mapping into a new snapshot.
     *
     * @param counters process id to counter; values must be non-negative
     * @return the snapshot
     * @throws IllegalArgumentException on null keys, null values or negative counters
     */
    public static ClockSnapshot of(Map<String, Integer> counters) {
        if (counters == null || counters.isEmpty()) return EMPTY;
        TreeMap<String, Integer> copy = new TreeMap<>();
        for (Map.Entry<String, Integer> e : counters.entrySet()) {
            String id = e.getKey();
            Integer value = e.getValue();
            if (id == null) {
                throw new IllegalArgumentException("null process id in clock");
            }
            if (value == null || value < 0) {
                throw new IllegalArgumentException("invalid counter for " + id + ": " + value);
            }
            copy.put(id, value);
        }
        return new ClockSnapshot(copy);
    }

    public static ClockSnapshot empty() {
        return EMPTY;
    }

    /** Counter for {@code processId}, or 0 when the id is not part of this snapshot. */
    public int valueOf(String processId) {
        if (processId == null) return 0;
        Integer v = counters.get(processId);
        return v == null ? 0 : v;
    }

    public boolean contains(String processId) {
        return processId != null && counters.containsKey(processId);
    }

    /** Read-only, lexicographically ordered mapping. */
    public Map<String, Integer> asMap() {
        return counters;
    }

    public int size() {
        return counters.size();
    }

    public boolean isEmpty() {
        return counters.isEmpty();
    }

    /** Sum of all counters (total logical events seen). */
    public long total() {
        long sum = 0L;
        for (int v : counters.values()) sum += v;
        return sum;
    }

    /** Renders {@code {A:1, B:0}} with keys in lexicographic order. */
    public String format() {
        StringBuilder sb = new StringBuilder("{");
        boolean first = true;
        for (Map.Entry<String, Integer> e : counters.entrySet()) {
            if (!first) sb.append(", ");
            sb.append(e.getKey()).append(':').append(e.getValue());
            first = false;
        }
        return sb.append('}').toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ClockSnapshot)) return false;
        return counters.equals(((ClockSnapshot) o).counters);
    }

    @Override
    public int hashCode() {
        return counters.hashCode();
    }

    @Override
    public String toString() {
        return format();
    }
}
