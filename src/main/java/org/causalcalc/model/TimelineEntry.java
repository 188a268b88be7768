package org.causalcalc.model;

import java.util.Optional;

/**
 * An event inside a displayed window, annotated with how the previous event of the
 * window relates to it. The first event of a window has no predecessor.
 */
public record TimelineEntry(int position, ClockEvent event, Optional<CausalRelation> relationToPrevious) {

    public TimelineEntry {
        relationToPrevious = (relationToPrevious == null) ? Optional.empty() : relationToPrevious;
    }
}
