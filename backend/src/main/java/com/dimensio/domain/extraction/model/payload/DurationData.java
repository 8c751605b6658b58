package com.dimensio.domain.extraction.model.payload;

import com.dimensio.domain.extraction.model.Dimension;
import com.dimensio.domain.extraction.model.DimensionPayload;
import com.dimensio.domain.extraction.model.Dimensions;

import java.time.temporal.ChronoUnit;

public record DurationData(double value, ChronoUnit grain) implements DimensionPayload {

    @Override
    public Dimension<DurationData> dimension() {
        return Dimensions.DURATION;
    }
}
