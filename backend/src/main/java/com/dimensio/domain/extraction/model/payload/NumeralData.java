package com.dimensio.domain.extraction.model.payload;

import com.dimensio.domain.extraction.model.Dimension;
import com.dimensio.domain.extraction.model.DimensionPayload;
import com.dimensio.domain.extraction.model.Dimensions;

/**
 * A number.
 *
 * @param value        numeric value
 * @param grain        power of ten the word names ("hundred" = 2), or null
 * @param multipliable true if the number may multiply a preceding one ("two hundred")
 */
public record NumeralData(double value, Integer grain, boolean multipliable) implements DimensionPayload {

    public static NumeralData of(double value) {
        return new NumeralData(value, null, false);
    }

    public NumeralData withGrain(int grain) {
        return new NumeralData(value, grain, multipliable);
    }

    public NumeralData withMultipliable() {
        return new NumeralData(value, grain, true);
    }

    public int grainOrZero() {
        return grain == null ? 0 : grain;
    }

    public boolean hasGrain() {
        return grain != null;
    }

    public boolean isInteger() {
        return value == Math.rint(value) && !Double.isInfinite(value);
    }

    @Override
    public Dimension<NumeralData> dimension() {
        return Dimensions.NUMERAL;
    }
}
