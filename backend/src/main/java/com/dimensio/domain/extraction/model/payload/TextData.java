package com.dimensio.domain.extraction.model.payload;

import com.dimensio.domain.extraction.model.Dimension;
import com.dimensio.domain.extraction.model.DimensionPayload;

/**
 * Verbatim value of a purely textual dimension (phone number, email, URL).
 */
public record TextData(Dimension<TextData> dimension, String value) implements DimensionPayload {}
