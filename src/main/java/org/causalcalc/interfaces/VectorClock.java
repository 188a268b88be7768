package org.causalcalc.interfaces;

import org.causalcalc.model.ClockSnapshot;

/**
 * A contract for vector logical clocks owned by a single process.
 * Provides thread-safe operations for local ticks and for merging clocks
 * carried by received messages.
 */
public interface VectorClock {

    /**
     * Id of the process that owns this clock.
     */
    String processId();

    /**
     * Increments the owner's counter for a local event.
     * @return the clock right after the increment
     */
    ClockSnapshot increment();

    /**
     * Updates the clock when receiving a message from another process:
     * component-wise max over the tracked ids, then one local tick.
     * @param received the clock the sender attached to the message
     * @return the clock right after the merge
     */
    ClockSnapshot merge(ClockSnapshot received);

    /**
     * Returns an immutable copy of the current clock.
     */
    ClockSnapshot snapshot();

    /**
     * Counter for {@code processId}, 0 if that id is not tracked.
     */
    int valueOf(String processId);

    /**
     * Deterministic rendering, keys in lexicographic order.
     */
    default String format() {
        return snapshot().format();
    }
}
