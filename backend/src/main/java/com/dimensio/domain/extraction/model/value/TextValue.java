package com.dimensio.domain.extraction.model.value;

public record TextValue(String value) implements ResolvedValue {

    @Override
    public String type() {
        return "value";
    }
}
