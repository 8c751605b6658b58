package com.dimensio.domain.extraction.model.payload;

import com.dimensio.domain.extraction.model.Dimension;
import com.dimensio.domain.extraction.model.DimensionPayload;
import com.dimensio.domain.extraction.model.Dimensions;

public record OrdinalData(long value) implements DimensionPayload {

    @Override
    public Dimension<OrdinalData> dimension() {
        return Dimensions.ORDINAL;
    }
}
