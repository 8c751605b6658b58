package com.dimensio.application.extraction;

import com.dimensio.application.extraction.exception.TextTooLongException;
import com.dimensio.application.extraction.exception.UnknownDimensionException;
import com.dimensio.application.extraction.exception.UnsupportedLocaleException;
import com.dimensio.domain.extraction.model.Dimensions;
import com.dimensio.domain.extraction.model.ParseResult;
import com.dimensio.domain.extraction.model.ParseStats;
import com.dimensio.domain.extraction.model.ResolutionContext;
import com.dimensio.infrastructure.pipeline.ExtractionPipeline;
import com.dimensio.infrastructure.rules.RuleSetRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ExtractionAppServiceTest {

    private static final Instant NOW = Instant.parse("2024-02-05T10:30:00Z");
    private static final ParseResult EMPTY = new ParseResult(List.of(),
            new ParseStats(1, 0, 0, 0, true, false, 0));

    @Mock
    private ExtractionPipeline extractionPipeline;

    @Mock
    private RuleSetRegistry ruleSetRegistry;

    private ExtractionAppService service;

    @BeforeEach
    void setUp() {
        service = new ExtractionAppService(extractionPipeline, ruleSetRegistry, Clock.fixed(NOW, ZoneOffset.UTC));
        ReflectionTestUtils.setField(service, "maxTextLength", 20);
        ReflectionTestUtils.setField(service, "defaultZone", "Europe/Oslo");
        lenient().when(ruleSetRegistry.resolveLocale(anyString())).thenReturn(Optional.empty());
        lenient().when(ruleSetRegistry.resolveLocale("en_US")).thenReturn(Optional.of("en"));
        lenient().when(extractionPipeline.execute(anyString(), any())).thenReturn(EMPTY);
    }

    @Test
    @DisplayName("text over the length limit is rejected before parsing")
    void textTooLong() {
        assertThatThrownBy(() -> service.parse("x".repeat(21), "en_US", null, null, null))
                .isInstanceOf(TextTooLongException.class);
        verifyNoInteractions(extractionPipeline);
    }

    @Test
    @DisplayName("unknown locales are rejected")
    void unsupportedLocale() {
        assertThatThrownBy(() -> service.parse("five", "fr", null, null, null))
                .isInstanceOf(UnsupportedLocaleException.class)
                .hasMessageContaining("fr");
    }

    @Test
    @DisplayName("unknown and internal dimension names are rejected")
    void unknownDimension() {
        when(ruleSetRegistry.dimension("weather")).thenReturn(Optional.empty());
        when(ruleSetRegistry.dimension("time-grain")).thenReturn(Optional.of(Dimensions.TIME_GRAIN));

        assertThatThrownBy(() -> service.parse("five", "en_US", null, null, List.of("weather")))
                .isInstanceOf(UnknownDimensionException.class);
        assertThatThrownBy(() -> service.parse("five", "en_US", null, null, List.of("time-grain")))
                .isInstanceOf(UnknownDimensionException.class);
    }

    @Test
    @DisplayName("without reference time or zone, now and the default zone are used")
    void defaults() {
        service.parse("five", "en_US", null, null, null);

        ResolutionContext context = capturedContext();
        assertThat(context.locale()).isEqualTo("en");
        assertThat(context.referenceInstant()).isEqualTo(NOW);
        assertThat(context.zone()).isEqualTo(ZoneId.of("Europe/Oslo"));
        assertThat(context.dimensions()).isEmpty();
    }

    @Test
    @DisplayName("the reference time's offset is the zone when none is given")
    void zoneFromReferenceTime() {
        OffsetDateTime reference = OffsetDateTime.parse("2024-03-01T08:00:00+05:00");

        service.parse("five", "en_US", reference, " ", null);

        ResolutionContext context = capturedContext();
        assertThat(context.referenceInstant()).isEqualTo(reference.toInstant());
        assertThat(context.zone()).isEqualTo(ZoneOffset.ofHours(5));
    }

    @Test
    @DisplayName("an explicit zone wins")
    void explicitZone() {
        when(ruleSetRegistry.dimension("numeral")).thenReturn(Optional.of(Dimensions.NUMERAL));

        service.parse("five", "en_US", OffsetDateTime.parse("2024-03-01T08:00:00+05:00"), "America/New_York",
                List.of("numeral"));

        ResolutionContext context = capturedContext();
        assertThat(context.zone()).isEqualTo(ZoneId.of("America/New_York"));
        assertThat(context.dimensions()).containsExactly(Dimensions.NUMERAL);
    }

    @Test
    @DisplayName("an unknown zone is an invalid argument")
    void badZone() {
        assertThatThrownBy(() -> service.parse("five", "en_US", null, "Mars/Olympus", null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Mars/Olympus");
    }

    @Test
    @DisplayName("supported locales list public dimension names, sorted")
    void supportedLocales() {
        when(ruleSetRegistry.locales()).thenReturn(Set.of("nl", "en"));
        when(ruleSetRegistry.dimensions("en")).thenReturn(new LinkedHashSet<>(List.of(Dimensions.TIME, Dimensions.NUMERAL)));
        when(ruleSetRegistry.dimensions("nl")).thenReturn(Set.of(Dimensions.NUMERAL));

        Map<String, Set<String>> locales = service.supportedLocales();

        assertThat(locales.keySet()).containsExactly("en", "nl");
        assertThat(locales.get("en")).containsExactly("numeral", "time");
    }

    private ResolutionContext capturedContext() {
        ArgumentCaptor<ResolutionContext> captor = ArgumentCaptor.forClass(ResolutionContext.class);
        verify(extractionPipeline).execute(eq("five"), captor.capture());
        return captor.getValue();
    }
}
