package com.dimensio.domain.extraction.model.value;

import java.util.List;

/**
 * Candidate concrete intervals for a time expression, earliest first.
 * Recurring expressions yield several candidates; anchored ones yield one.
 */
public record TimeValue(List<TimeInterval> candidates) implements ResolvedValue {

    public TimeValue {
        candidates = List.copyOf(candidates);
    }

    @Override
    public String type() {
        return "interval";
    }

    public TimeInterval first() {
        return candidates.get(0);
    }
}
