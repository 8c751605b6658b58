package com.dimensio.domain.extraction.model.value;

/**
 * @param value             amount in {@code unit}
 * @param unit              singular lower-case unit name ("hour")
 * @param normalizedSeconds the whole duration in seconds
 */
public record DurationValue(double value, String unit, double normalizedSeconds) implements ResolvedValue {

    @Override
    public String type() {
        return "value";
    }
}
