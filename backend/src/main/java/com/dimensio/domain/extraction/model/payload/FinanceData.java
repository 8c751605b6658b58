package com.dimensio.domain.extraction.model.payload;

import com.dimensio.domain.extraction.model.Dimension;
import com.dimensio.domain.extraction.model.DimensionPayload;
import com.dimensio.domain.extraction.model.Dimensions;

/**
 * Amount of money.
 *
 * @param currency ISO 4217 code, or "cent" for unqualified cents
 */
public record FinanceData(double value, String currency) implements DimensionPayload {

    @Override
    public Dimension<FinanceData> dimension() {
        return Dimensions.FINANCE;
    }
}
