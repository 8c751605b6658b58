package com.dimensio.domain.extraction.model;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Objects;
import java.util.Set;

/**
 * Per-parse, read-only bundle used to select output dimensions and to anchor
 * relative values.
 *
 * @param locale           rule-set locale the parse runs with
 * @param referenceInstant instant relative expressions are anchored to
 * @param zone             zone relative expressions are evaluated in
 * @param dimensions       requested dimensions; empty means every public dimension
 */
public record ResolutionContext(String locale, Instant referenceInstant, ZoneId zone, Set<Dimension<?>> dimensions) {

    public ResolutionContext {
        Objects.requireNonNull(locale, "locale");
        Objects.requireNonNull(referenceInstant, "referenceInstant");
        Objects.requireNonNull(zone, "zone");
        dimensions = dimensions == null ? Set.of() : Set.copyOf(dimensions);
    }

    public ZonedDateTime referenceTime() {
        return referenceInstant.atZone(zone);
    }

    /**
     * True if the caller asked for exactly one dimension.
     */
    public boolean singleDimension() {
        return dimensions.size() == 1;
    }

    public boolean wants(Dimension<?> dimension) {
        return dimensions.isEmpty() ? !dimension.isInternal() : dimensions.contains(dimension);
    }
}
