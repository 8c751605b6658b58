package com.dimensio.domain.extraction.model.value;

import java.time.OffsetDateTime;

/**
 * Concrete half-open interval {@code [start, end)} in the parse's zone.
 *
 * @param grain lower-case unit the expression was precise to ("day", "hour")
 */
public record TimeInterval(OffsetDateTime start, OffsetDateTime end, String grain) {}
