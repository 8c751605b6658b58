package com.dimensio.domain.extraction.model.payload;

import com.dimensio.domain.extraction.model.Dimension;
import com.dimensio.domain.extraction.model.DimensionPayload;
import com.dimensio.domain.extraction.model.Dimensions;

/**
 * Distance with a canonical unit name.
 */
public record DistanceData(double value, String unit) implements DimensionPayload {

    public DistanceData withUnit(String unit) {
        return new DistanceData(value, unit);
    }

    @Override
    public Dimension<DistanceData> dimension() {
        return Dimensions.DISTANCE;
    }
}
