package com.dimensio.domain.extraction.rule;

import com.dimensio.domain.extraction.model.DimensionPayload;
import com.dimensio.domain.extraction.model.Token;

import java.util.List;
import java.util.Optional;

/**
 * Turns the tokens matched by a rule's pattern, in pattern order, into the
 * payload of a new token. Returning empty declines the match.
 * Implementations must be pure.
 */
@FunctionalInterface
public interface Production {

    Optional<? extends DimensionPayload> produce(List<Token> tokens);
}
