package com.dimensio.infrastructure.engine.resolve;

import com.dimensio.domain.extraction.model.Dimensions;
import com.dimensio.domain.extraction.model.payload.DistanceData;
import com.dimensio.domain.extraction.model.payload.FinanceData;
import com.dimensio.domain.extraction.model.payload.NumeralData;
import com.dimensio.domain.extraction.model.payload.OrdinalData;
import com.dimensio.domain.extraction.model.payload.QuantityData;
import com.dimensio.domain.extraction.model.payload.TemperatureData;
import com.dimensio.domain.extraction.model.payload.TextData;
import com.dimensio.domain.extraction.model.payload.VolumeData;
import com.dimensio.domain.extraction.model.value.NumberValue;
import com.dimensio.domain.extraction.model.value.OrdinalValue;
import com.dimensio.domain.extraction.model.value.TextValue;
import com.dimensio.domain.extraction.model.value.UnitValue;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Resolvers whose conversion is a direct copy of the payload.
 */
@Configuration
public class ValueResolverConfig {

    @Bean
    public ValueResolver<NumeralData> numeralResolver() {
        return ValueResolver.of(Dimensions.NUMERAL, (nd, ctx) -> new NumberValue(nd.value()));
    }

    @Bean
    public ValueResolver<OrdinalData> ordinalResolver() {
        return ValueResolver.of(Dimensions.ORDINAL, (od, ctx) -> new OrdinalValue(od.value()));
    }

    @Bean
    public ValueResolver<TemperatureData> temperatureResolver() {
        return ValueResolver.of(Dimensions.TEMPERATURE, (td, ctx) -> new UnitValue(td.value(), td.unit()));
    }

    @Bean
    public ValueResolver<DistanceData> distanceResolver() {
        return ValueResolver.of(Dimensions.DISTANCE, (dd, ctx) -> new UnitValue(dd.value(), dd.unit()));
    }

    @Bean
    public ValueResolver<VolumeData> volumeResolver() {
        return ValueResolver.of(Dimensions.VOLUME, (vd, ctx) -> new UnitValue(vd.value(), vd.unit()));
    }

    @Bean
    public ValueResolver<QuantityData> quantityResolver() {
        return ValueResolver.of(Dimensions.QUANTITY, (qd, ctx) -> new UnitValue(qd.value(), qd.unit(), qd.product()));
    }

    @Bean
    public ValueResolver<FinanceData> financeResolver() {
        return ValueResolver.of(Dimensions.FINANCE, (fd, ctx) -> new UnitValue(fd.value(), fd.currency()));
    }

    @Bean
    public ValueResolver<TextData> phoneNumberResolver() {
        return ValueResolver.of(Dimensions.PHONE_NUMBER, (td, ctx) -> new TextValue(td.value()));
    }

    @Bean
    public ValueResolver<TextData> emailResolver() {
        return ValueResolver.of(Dimensions.EMAIL, (td, ctx) -> new TextValue(td.value()));
    }

    @Bean
    public ValueResolver<TextData> urlResolver() {
        return ValueResolver.of(Dimensions.URL, (td, ctx) -> new TextValue(td.value()));
    }
}
