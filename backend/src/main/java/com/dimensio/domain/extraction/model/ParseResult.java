package com.dimensio.domain.extraction.model;

import java.util.List;

/**
 * Output of one parse: resolved spans ordered by start offset, plus engine stats.
 */
public record ParseResult(
        List<ResolvedSpan> spans,
        ParseStats stats
) {
    public boolean isEmpty() {
        return spans.isEmpty();
    }
}
