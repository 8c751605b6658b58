package com.dimensio.domain.extraction.model.value;

public record NumberValue(double value) implements ResolvedValue {

    @Override
    public String type() {
        return "value";
    }
}
