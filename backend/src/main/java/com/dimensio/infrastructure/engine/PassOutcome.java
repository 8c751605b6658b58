package com.dimensio.infrastructure.engine;

/**
 * Result of running passes over one document.
 *
 * @param pool            final token pool
 * @param passes          number of passes whose results were merged
 * @param invocations     matcher invocations performed, including a discarded pass
 * @param fixpointReached true if the last pass added no token
 * @param budgetExhausted true if a pass or invocation budget cut the parse short
 */
public record PassOutcome(
        TokenPool pool,
        int passes,
        long invocations,
        boolean fixpointReached,
        boolean budgetExhausted
) {}
