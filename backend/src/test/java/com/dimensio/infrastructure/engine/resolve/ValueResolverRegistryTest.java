package com.dimensio.infrastructure.engine.resolve;

import com.dimensio.domain.extraction.model.Dimensions;
import com.dimensio.domain.extraction.model.Provenance;
import com.dimensio.domain.extraction.model.ResolutionContext;
import com.dimensio.domain.extraction.model.Span;
import com.dimensio.domain.extraction.model.Token;
import com.dimensio.domain.extraction.model.payload.DurationData;
import com.dimensio.domain.extraction.model.payload.NumeralData;
import com.dimensio.domain.extraction.model.payload.TimeData.RelativeTime;
import com.dimensio.domain.extraction.model.value.DurationValue;
import com.dimensio.domain.extraction.model.value.NumberValue;
import com.dimensio.domain.extraction.model.value.TextValue;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ValueResolverRegistryTest {

    private static final ResolutionContext CONTEXT =
            new ResolutionContext("en", Instant.EPOCH, ZoneOffset.UTC, Set.of());

    private static List<ValueResolver<?>> allResolvers() {
        ValueResolverConfig config = new ValueResolverConfig();
        List<ValueResolver<?>> resolvers = new ArrayList<>(List.of(
                config.numeralResolver(), config.ordinalResolver(), config.temperatureResolver(),
                config.distanceResolver(), config.volumeResolver(), config.quantityResolver(),
                config.financeResolver(), config.phoneNumberResolver(), config.emailResolver(),
                config.urlResolver()));
        resolvers.add(new DurationValueResolver());
        resolvers.add(new TimeValueResolver(2));
        return resolvers;
    }

    @Test
    @DisplayName("resolves a token with the resolver of its dimension")
    void resolve() {
        ValueResolverRegistry registry = new ValueResolverRegistry(allResolvers());
        Token token = new Token(new Span(0, 2), NumeralData.of(42), false, new Provenance("r", 0, 1));

        assertThat(registry.resolve(token, CONTEXT)).isEqualTo(new NumberValue(42));
    }

    @Test
    @DisplayName("a time that cannot be anchored is not resolvable")
    void resolvable() {
        ValueResolverRegistry registry = new ValueResolverRegistry(allResolvers());
        Provenance provenance = new Provenance("r", 0, 1);
        Token farFuture = new Token(new Span(0, 5),
                new RelativeTime(Long.MAX_VALUE, ChronoUnit.DAYS, ChronoUnit.DAYS), false, provenance);
        Token tomorrow = new Token(new Span(0, 5),
                new RelativeTime(1, ChronoUnit.DAYS, ChronoUnit.DAYS), false, provenance);
        Token number = new Token(new Span(0, 2), NumeralData.of(42), false, provenance);

        assertThat(registry.resolvable(farFuture, CONTEXT)).isFalse();
        assertThat(registry.resolvable(tomorrow, CONTEXT)).isTrue();
        assertThat(registry.resolvable(number, CONTEXT)).isTrue();
    }

    @Test
    @DisplayName("every public dimension needs a resolver")
    void missingResolver() {
        List<ValueResolver<?>> resolvers = allResolvers();
        resolvers.removeIf(r -> r.dimension().equals(Dimensions.URL));

        assertThatThrownBy(() -> new ValueResolverRegistry(resolvers))
                .isInstanceOf(UnhandledDimensionException.class)
                .hasMessageContaining("url");
    }

    @Test
    @DisplayName("two resolvers for one dimension are rejected")
    void duplicateResolver() {
        List<ValueResolver<?>> resolvers = allResolvers();
        resolvers.add(ValueResolver.of(Dimensions.EMAIL, (td, ctx) -> new TextValue(td.value())));

        assertThatThrownBy(() -> new ValueResolverRegistry(resolvers))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("email");
    }

    @Test
    @DisplayName("durations are normalized to seconds")
    void duration() {
        DurationValue value = (DurationValue) new DurationValueResolver()
                .resolve(new DurationData(1.5, ChronoUnit.HOURS), CONTEXT);

        assertThat(value).isEqualTo(new DurationValue(1.5, "hour", 5400));
    }
}
