package com.dimensio.domain.extraction.model.value;

public record OrdinalValue(long value) implements ResolvedValue {

    @Override
    public String type() {
        return "value";
    }
}
