package com.dimensio.interfaces.api.dto;

import com.dimensio.domain.extraction.model.ParseResult;
import com.dimensio.domain.extraction.model.ParseStats;
import com.dimensio.domain.extraction.model.ResolvedSpan;
import com.dimensio.domain.extraction.model.value.ResolvedValue;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ParseResponse(
        List<SpanEntry> spans,
        StatsEntry stats
) {
    public record SpanEntry(int start, int end, String dim, String body, ResolvedValue value, boolean latent) {}

    public record StatsEntry(int passes, long matcherInvocations, int poolSize, boolean fixpointReached,
                             boolean budgetExhausted, long latencyMs) {}

    public static ParseResponse from(ParseResult result) {
        return new ParseResponse(
                result.spans().stream().map(ParseResponse::toEntry).toList(),
                toStats(result.stats()));
    }

    private static SpanEntry toEntry(ResolvedSpan span) {
        return new SpanEntry(span.start(), span.end(), span.dimension().name(), span.body(), span.value(), span.latent());
    }

    private static StatsEntry toStats(ParseStats stats) {
        if (stats == null) return null;
        return new StatsEntry(stats.passes(), stats.matcherInvocations(), stats.poolSize(),
                stats.fixpointReached(), stats.budgetExhausted(), stats.latencyMs());
    }
}
