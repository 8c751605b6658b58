package com.dimensio.domain.extraction.model;

public record ParseStats(
        int passes,
        long matcherInvocations,
        int poolSize,
        int selectedCount,
        boolean fixpointReached,
        boolean budgetExhausted,
        long latencyMs
) {}
