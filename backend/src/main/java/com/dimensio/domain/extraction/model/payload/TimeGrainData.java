package com.dimensio.domain.extraction.model.payload;

import com.dimensio.domain.extraction.model.Dimension;
import com.dimensio.domain.extraction.model.DimensionPayload;
import com.dimensio.domain.extraction.model.Dimensions;

import java.time.temporal.ChronoUnit;

/**
 * A unit of time named in text ("hours", "week").
 */
public record TimeGrainData(ChronoUnit grain) implements DimensionPayload {

    @Override
    public Dimension<TimeGrainData> dimension() {
        return Dimensions.TIME_GRAIN;
    }
}
