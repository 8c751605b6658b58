package com.dimensio.domain.extraction.model;

/**
 * Dimension-specific data carried by a token. Implementations are immutable
 * value types; equality is what the token pool uses to collapse duplicates.
 */
public interface DimensionPayload {

    Dimension<?> dimension();
}
