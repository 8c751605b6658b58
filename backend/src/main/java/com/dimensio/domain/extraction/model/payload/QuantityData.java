package com.dimensio.domain.extraction.model.payload;

import com.dimensio.domain.extraction.model.Dimension;
import com.dimensio.domain.extraction.model.DimensionPayload;
import com.dimensio.domain.extraction.model.Dimensions;

/**
 * Amount of something measured in a unit ("3 cups of sugar").
 *
 * @param product what is measured, or null
 */
public record QuantityData(double value, String unit, String product) implements DimensionPayload {

    public QuantityData withProduct(String product) {
        return new QuantityData(value, unit, product);
    }

    @Override
    public Dimension<QuantityData> dimension() {
        return Dimensions.QUANTITY;
    }
}
