package com.dimensio.domain.extraction.model;

/**
 * Identity of a token in the pool. Two tokens with the same key are duplicates.
 */
public record TokenKey(Span span, Dimension<?> dimension, DimensionPayload payload) {}
