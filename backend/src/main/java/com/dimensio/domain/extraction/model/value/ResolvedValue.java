package com.dimensio.domain.extraction.model.value;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Caller-facing value of a resolved span. Shape is dimension-specific.
 */
public interface ResolvedValue {

    /** Short type tag serialized with the value ("value", "interval", ...). */
    @JsonProperty("type")
    String type();
}
