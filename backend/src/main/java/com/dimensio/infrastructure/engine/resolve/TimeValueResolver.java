package com.dimensio.infrastructure.engine.resolve;

import com.dimensio.domain.extraction.model.Dimension;
import com.dimensio.domain.extraction.model.Dimensions;
import com.dimensio.domain.extraction.model.ResolutionContext;
import com.dimensio.domain.extraction.model.payload.TimeData;
import com.dimensio.domain.extraction.model.payload.TimeData.InstantTime;
import com.dimensio.domain.extraction.model.payload.TimeData.IntervalTime;
import com.dimensio.domain.extraction.model.payload.TimeData.RecurringTime;
import com.dimensio.domain.extraction.model.payload.TimeData.RelativeTime;
import com.dimensio.domain.extraction.model.value.ResolvedValue;
import com.dimensio.domain.extraction.model.value.TimeInterval;
import com.dimensio.domain.extraction.model.value.TimeValue;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.DateTimeException;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.List;

/**
 * Anchors time payloads to the reference instant of the parse.
 * <ul>
 *   <li>instant: the named local date-time in the parse's zone, one grain long</li>
 *   <li>relative: reference shifted by the amount, truncated to the grain</li>
 *   <li>recurring: the next {@code engine.time.max-candidates} occurrences not yet over</li>
 *   <li>interval: from the start of each "from" candidate to the end of the
 *       first "to" candidate ending after it</li>
 * </ul>
 * A payload that falls outside the supported date range has no candidates.
 */
@Slf4j
@Component
public class TimeValueResolver implements ValueResolver<TimeData> {

    /** Recurring patterns are searched this many days ahead. */
    private static final int SEARCH_HORIZON_DAYS = 366 * 8;

    private final int maxCandidates;

    public TimeValueResolver(@Value("${engine.time.max-candidates:2}") int maxCandidates) {
        this.maxCandidates = Math.max(1, maxCandidates);
    }

    @Override
    public Dimension<TimeData> dimension() {
        return Dimensions.TIME;
    }

    @Override
    public ResolvedValue resolve(TimeData payload, ResolutionContext context) {
        return new TimeValue(candidates(payload, context.referenceTime()).stream()
                .map(TimeValueResolver::toInterval)
                .toList());
    }

    @Override
    public boolean resolvable(TimeData payload, ResolutionContext context) {
        return !candidates(payload, context.referenceTime()).isEmpty();
    }

    List<Occurrence> candidates(TimeData payload, ZonedDateTime reference) {
        try {
            return anchor(payload, reference);
        } catch (DateTimeException | ArithmeticException e) {
            log.debug("[TimeResolver] {} out of range: {}", payload, e.getMessage());
            return List.of();
        }
    }

    private List<Occurrence> anchor(TimeData payload, ZonedDateTime reference) {
        if (payload instanceof InstantTime instant) {
            ZonedDateTime start = instant.value().atZone(reference.getZone());
            return List.of(new Occurrence(start, start.plus(1, instant.grain()), instant.grain()));
        } else if (payload instanceof RelativeTime relative) {
            ZonedDateTime start = truncate(reference.plus(relative.amount(), relative.unit()), relative.grain());
            return List.of(new Occurrence(start, start.plus(1, relative.grain()), relative.grain()));
        } else if (payload instanceof RecurringTime recurring) {
            return occurrences(recurring, reference);
        } else if (payload instanceof IntervalTime interval) {
            return intervals(interval, reference);
        }
        throw new UnhandledDimensionException("Unhandled time payload: " + payload);
    }

    private List<Occurrence> occurrences(RecurringTime recurring, ZonedDateTime reference) {
        List<Occurrence> found = new ArrayList<>();
        LocalDate day = reference.toLocalDate();
        for (int i = 0; i < SEARCH_HORIZON_DAYS && found.size() < maxCandidates; i++, day = day.plusDays(1)) {
            if (!matchesDay(recurring, day)) {
                continue;
            }
            ZonedDateTime start = recurring.hour() == null
                    ? day.atStartOfDay(reference.getZone())
                    : day.atTime(recurring.hour(), recurring.minute() == null ? 0 : recurring.minute())
                            .atZone(reference.getZone());
            ZonedDateTime end = start.plus(1, recurring.grain());
            if (end.isAfter(reference)) {
                found.add(new Occurrence(start, end, recurring.grain()));
            }
        }
        return found;
    }

    private List<Occurrence> intervals(IntervalTime interval, ZonedDateTime reference) {
        List<Occurrence> from = anchor(interval.from(), reference);
        List<Occurrence> to = anchor(interval.to(), reference);
        List<Occurrence> found = new ArrayList<>();
        for (Occurrence start : from) {
            to.stream()
                    .filter(end -> end.end().isAfter(start.start()))
                    .findFirst()
                    .ifPresent(end -> found.add(new Occurrence(start.start(), end.end(), start.grain())));
        }
        return found;
    }

    private static boolean matchesDay(RecurringTime recurring, LocalDate day) {
        return (recurring.dayOfWeek() == null || day.getDayOfWeek() == recurring.dayOfWeek())
                && (recurring.month() == null || day.getMonthValue() == recurring.month())
                && (recurring.dayOfMonth() == null || day.getDayOfMonth() == recurring.dayOfMonth());
    }

    static ZonedDateTime truncate(ZonedDateTime time, ChronoUnit grain) {
        return switch (grain) {
            case NANOS, MICROS, MILLIS, SECONDS, MINUTES, HOURS, DAYS -> time.truncatedTo(grain);
            case WEEKS -> time.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY)).truncatedTo(ChronoUnit.DAYS);
            case MONTHS -> time.withDayOfMonth(1).truncatedTo(ChronoUnit.DAYS);
            case YEARS -> time.withDayOfYear(1).truncatedTo(ChronoUnit.DAYS);
            default -> throw new UnhandledDimensionException("Unsupported time grain: " + grain);
        };
    }

    private static TimeInterval toInterval(Occurrence occurrence) {
        return new TimeInterval(occurrence.start().toOffsetDateTime(), occurrence.end().toOffsetDateTime(),
                DurationValueResolver.unitName(occurrence.grain()));
    }

    record Occurrence(ZonedDateTime start, ZonedDateTime end, ChronoUnit grain) {}
}
