package com.dimensio.domain.extraction.model;

import com.dimensio.domain.extraction.model.payload.DistanceData;
import com.dimensio.domain.extraction.model.payload.DurationData;
import com.dimensio.domain.extraction.model.payload.FinanceData;
import com.dimensio.domain.extraction.model.payload.NumeralData;
import com.dimensio.domain.extraction.model.payload.OrdinalData;
import com.dimensio.domain.extraction.model.payload.QuantityData;
import com.dimensio.domain.extraction.model.payload.TemperatureData;
import com.dimensio.domain.extraction.model.payload.TextData;
import com.dimensio.domain.extraction.model.payload.TextMatch;
import com.dimensio.domain.extraction.model.payload.TimeData;
import com.dimensio.domain.extraction.model.payload.TimeGrainData;
import com.dimensio.domain.extraction.model.payload.VolumeData;

import java.util.List;

/**
 * Built-in dimensions. Declaration order follows the dependency graph.
 */
public final class Dimensions {

    /** Raw text captures handed to productions; never pooled, never output. */
    public static final Dimension<TextMatch> REGEX_MATCH = Dimension.internal("regex-match", TextMatch.class);

    public static final Dimension<NumeralData> NUMERAL = Dimension.of("numeral", NumeralData.class);
    public static final Dimension<OrdinalData> ORDINAL = Dimension.of("ordinal", OrdinalData.class, NUMERAL);
    public static final Dimension<TimeGrainData> TIME_GRAIN = Dimension.internal("time-grain", TimeGrainData.class);
    public static final Dimension<DurationData> DURATION = Dimension.of("duration", DurationData.class, NUMERAL, TIME_GRAIN);
    public static final Dimension<TimeData> TIME = Dimension.of("time", TimeData.class, NUMERAL, ORDINAL, DURATION, TIME_GRAIN);
    public static final Dimension<TemperatureData> TEMPERATURE = Dimension.of("temperature", TemperatureData.class, NUMERAL);
    public static final Dimension<DistanceData> DISTANCE = Dimension.of("distance", DistanceData.class, NUMERAL);
    public static final Dimension<VolumeData> VOLUME = Dimension.of("volume", VolumeData.class, NUMERAL);
    public static final Dimension<QuantityData> QUANTITY = Dimension.of("quantity", QuantityData.class, NUMERAL);
    public static final Dimension<FinanceData> FINANCE = Dimension.of("amount-of-money", FinanceData.class, NUMERAL);
    public static final Dimension<TextData> PHONE_NUMBER = Dimension.of("phone-number", TextData.class);
    public static final Dimension<TextData> EMAIL = Dimension.of("email", TextData.class);
    public static final Dimension<TextData> URL = Dimension.of("url", TextData.class);

    private static final List<Dimension<?>> BUILT_IN = List.of(
            NUMERAL, ORDINAL, TIME_GRAIN, DURATION, TIME, TEMPERATURE, DISTANCE,
            VOLUME, QUANTITY, FINANCE, PHONE_NUMBER, EMAIL, URL
    );

    private Dimensions() {
    }

    /**
     * Every built-in dimension a rule book may contribute rules for.
     */
    public static List<Dimension<?>> builtIn() {
        return BUILT_IN;
    }
}
