package com.dimensio.application.extraction;

import com.dimensio.application.extraction.exception.TextTooLongException;
import com.dimensio.application.extraction.exception.UnknownDimensionException;
import com.dimensio.application.extraction.exception.UnsupportedLocaleException;
import com.dimensio.domain.extraction.model.Dimension;
import com.dimensio.domain.extraction.model.ParseResult;
import com.dimensio.domain.extraction.model.ResolutionContext;
import com.dimensio.infrastructure.pipeline.ExtractionPipeline;
import com.dimensio.infrastructure.rules.RuleSetRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

@Slf4j
@Service
@RequiredArgsConstructor
public class ExtractionAppService {

    private final ExtractionPipeline extractionPipeline;
    private final RuleSetRegistry ruleSetRegistry;
    private final Clock clock;

    @Value("${extraction.max-text-length:10000}")
    private int maxTextLength;

    @Value("${engine.default-zone:UTC}")
    private String defaultZone;

    /**
     * Parses text for one locale.
     *
     * @param referenceTime anchor for relative expressions; now when null
     * @param zone          IANA zone; the reference time's offset, then the default zone, when blank
     * @param dims          dimension names; all when null or empty
     */
    public ParseResult parse(String text, String locale, OffsetDateTime referenceTime, String zone, List<String> dims) {
        if (text.length() > maxTextLength) {
            throw new TextTooLongException(maxTextLength);
        }
        String ruleLocale = ruleSetRegistry.resolveLocale(locale)
                .orElseThrow(() -> new UnsupportedLocaleException(locale));
        log.debug("[Extraction] Locale '{}' served by rules '{}'", locale, ruleLocale);

        Instant reference = referenceTime != null ? referenceTime.toInstant() : clock.instant();
        ResolutionContext context = new ResolutionContext(ruleLocale, reference,
                resolveZone(zone, referenceTime), resolveDimensions(dims));

        return extractionPipeline.execute(text, context);
    }

    /**
     * Loaded locales and the public dimensions each one has rules for.
     */
    public Map<String, Set<String>> supportedLocales() {
        Map<String, Set<String>> locales = new LinkedHashMap<>();
        for (String locale : new TreeSet<>(ruleSetRegistry.locales())) {
            Set<String> names = new TreeSet<>();
            ruleSetRegistry.dimensions(locale).forEach(d -> names.add(d.name()));
            locales.put(locale, names);
        }
        return locales;
    }

    public int getMaxTextLength() {
        return maxTextLength;
    }

    private Set<Dimension<?>> resolveDimensions(List<String> dims) {
        Set<Dimension<?>> dimensions = new LinkedHashSet<>();
        if (dims == null) {
            return dimensions;
        }
        for (String name : dims) {
            Dimension<?> dimension = ruleSetRegistry.dimension(name)
                    .filter(d -> !d.isInternal())
                    .orElseThrow(() -> new UnknownDimensionException(name));
            dimensions.add(dimension);
        }
        return dimensions;
    }

    private ZoneId resolveZone(String zone, OffsetDateTime referenceTime) {
        if (zone == null || zone.isBlank()) {
            return referenceTime != null ? referenceTime.getOffset() : ZoneId.of(defaultZone);
        }
        try {
            return ZoneId.of(zone.trim());
        } catch (DateTimeException e) {
            throw new IllegalArgumentException("Unknown time zone: " + zone, e);
        }
    }
}
