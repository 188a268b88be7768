package org.causalcalc.model;

/** Verdict of comparing a first snapshot against a second one. */
public enum CausalRelation {

    BEFORE(-1, "→", "Happened Before"),
    AFTER(1, "←", "Happened After"),
    CONCURRENT(0, "||", "Concurrent");

    private final int signum;
    private final String symbol;
    private final String description;

    CausalRelation(int signum, String symbol, String description) {
        this.signum = signum;
        this.symbol = symbol;
        this.description = description;
    }

    /** -1 before, +1 after, 0 concurrent. */
    public int signum() {
        return signum;
    }

    public String symbol() {
        return symbol;
    }

    public String description() {
        return description;
    }

    /** e.g. {@code → (Happened Before)} */
    public String label() {
        return symbol + " (" + description + ")";
    }

    public static CausalRelation fromSignum(int signum) {
        if (signum < 0) return BEFORE;
        if (signum > 0) return AFTER;
        return CONCURRENT;
    }
}
