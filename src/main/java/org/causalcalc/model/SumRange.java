package org.causalcalc.model;

/** Inclusive integer range {@code [start, end]} assigned to one server. */
public record SumRange(int start, int end) {

    public SumRange {
        if (start < 1 || end < start) {
            throw new IllegalArgumentException("invalid range [" + start + "-" + end + "]");
        }
    }

    public int count() {
        return end - start + 1;
    }
}
