package com.dimensio.domain.extraction.model.value;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Number with an optional unit and product.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record UnitValue(double value, String unit, String product) implements ResolvedValue {

    public UnitValue(double value, String unit) {
        this(value, unit, null);
    }

    @Override
    public String type() {
        return "value";
    }
}
