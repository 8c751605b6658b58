package com.dimensio.infrastructure.engine.resolve;

import com.dimensio.domain.extraction.model.Dimension;
import com.dimensio.domain.extraction.model.Dimensions;
import com.dimensio.domain.extraction.model.ResolutionContext;
import com.dimensio.domain.extraction.model.payload.DurationData;
import com.dimensio.domain.extraction.model.value.DurationValue;
import com.dimensio.domain.extraction.model.value.ResolvedValue;
import org.springframework.stereotype.Component;

import java.time.temporal.ChronoUnit;
import java.util.Locale;

@Component
public class DurationValueResolver implements ValueResolver<DurationData> {

    @Override
    public Dimension<DurationData> dimension() {
        return Dimensions.DURATION;
    }

    @Override
    public ResolvedValue resolve(DurationData payload, ResolutionContext context) {
        double seconds = payload.value() * payload.grain().getDuration().getSeconds();
        return new DurationValue(payload.value(), unitName(payload.grain()), seconds);
    }

    /** Singular lower-case unit name, the same vocabulary time grains use ("hour"). */
    static String unitName(ChronoUnit unit) {
        String name = unit.name().toLowerCase(Locale.ROOT);
        return name.endsWith("s") ? name.substring(0, name.length() - 1) : name;
    }
}
