package com.dimensio.domain.extraction.model.payload;

import com.dimensio.domain.extraction.model.Dimension;
import com.dimensio.domain.extraction.model.DimensionPayload;
import com.dimensio.domain.extraction.model.Dimensions;

/**
 * Temperature; unit is null for a bare degree value.
 */
public record TemperatureData(double value, String unit) implements DimensionPayload {

    public TemperatureData withUnit(String unit) {
        return new TemperatureData(value, unit);
    }

    @Override
    public Dimension<TemperatureData> dimension() {
        return Dimensions.TEMPERATURE;
    }
}
