package com.dimensio.domain.extraction.model.payload;

import com.dimensio.domain.extraction.model.Dimension;
import com.dimensio.domain.extraction.model.DimensionPayload;
import com.dimensio.domain.extraction.model.Dimensions;

/**
 * Volume with a canonical unit name.
 */
public record VolumeData(double value, String unit) implements DimensionPayload {

    public VolumeData withUnit(String unit) {
        return new VolumeData(value, unit);
    }

    @Override
    public Dimension<VolumeData> dimension() {
        return Dimensions.VOLUME;
    }
}
