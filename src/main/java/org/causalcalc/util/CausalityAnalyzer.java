package org.causalcalc.util;

import org.causalcalc.model.CausalRelation;
import org.causalcalc.model.ClockSnapshot;

import java.util.Map;

/**
 * Pure functions classifying two clock snapshots.
 * <p>
 * Only process ids present in <em>both</em> snapshots are compared; an id missing on one
 * side is left out of the comparison rather than read as zero. With no common id,
 * neither side precedes the other and the pair is concurrent.
 * </p>
 */
public final class CausalityAnalyzer {

    private CausalityAnalyzer() {}

    /**
     * True iff every common counter of {@code a} is {@code <=} the one of {@code b}
     * and at least one is strictly smaller.
     */
    public static boolean happenedBefore(ClockSnapshot a, ClockSnapshot b) {
        if (a == null || b == null) return false;
        boolean anyLess = false;
        for (Map.Entry<String, Integer> e : a.asMap().entrySet()) {
            if (!b.contains(e.getKey())) continue;
            int mine = e.getValue();
            int theirs = b.valueOf(e.getKey());
            if (mine > theirs) return false;
            if (mine < theirs) anyLess = true;
        }
        return anyLess;
    }

    /** {@code b} happened before {@code a}. */
    public static boolean happenedAfter(ClockSnapshot a, ClockSnapshot b) {
        return happenedBefore(b, a);
    }

    /** Neither snapshot happened before the other. Identical snapshots are concurrent. */
    public static boolean isConcurrentWith(ClockSnapshot a, ClockSnapshot b) {
        return !happenedBefore(a, b) && !happenedBefore(b, a);
    }

    /**
     * Three-way signal: -1 if {@code a} happened before {@code b}, +1 if after, 0 if concurrent.
     * This is not a total order; 0 does not mean equal.
     */
    public static int compare(ClockSnapshot a, ClockSnapshot b) {
        if (happenedBefore(a, b)) return -1;
        if (happenedBefore(b, a)) return 1;
        return 0;
    }

    public static CausalRelation relation(ClockSnapshot a, ClockSnapshot b) {
        return CausalRelation.fromSignum(compare(a, b));
    }
}
