package com.dimensio.infrastructure.engine.resolve;

import com.dimensio.domain.extraction.model.ResolutionContext;
import com.dimensio.domain.extraction.model.payload.TimeData.InstantTime;
import com.dimensio.domain.extraction.model.payload.TimeData.IntervalTime;
import com.dimensio.domain.extraction.model.payload.TimeData.RecurringTime;
import com.dimensio.domain.extraction.model.payload.TimeData.RelativeTime;
import com.dimensio.domain.extraction.model.value.TimeInterval;
import com.dimensio.domain.extraction.model.value.TimeValue;
import com.dimensio.infrastructure.engine.resolve.TimeValueResolver.Occurrence;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class TimeValueResolverTest {

    /** A Monday. */
    private static final ZonedDateTime REFERENCE = ZonedDateTime.of(2024, 2, 5, 10, 30, 0, 0, ZoneOffset.UTC);

    private final TimeValueResolver resolver = new TimeValueResolver(2);

    @Nested
    @DisplayName("Anchored expressions")
    class Anchored {

        @Test
        @DisplayName("relative days are truncated to the start of the day")
        void tomorrow() {
            List<Occurrence> found = resolver.candidates(new RelativeTime(1, ChronoUnit.DAYS, ChronoUnit.DAYS), REFERENCE);

            assertThat(found).containsExactly(new Occurrence(at(2024, 2, 6, 0, 0), at(2024, 2, 7, 0, 0), ChronoUnit.DAYS));
        }

        @Test
        @DisplayName("relative hours keep the clock time to the second")
        void inThreeHours() {
            List<Occurrence> found = resolver.candidates(new RelativeTime(3, ChronoUnit.HOURS, ChronoUnit.SECONDS), REFERENCE);

            assertThat(found).singleElement()
                    .satisfies(o -> assertThat(o.start()).isEqualTo(at(2024, 2, 5, 13, 30)));
        }

        @Test
        @DisplayName("instants are read in the parse's zone")
        void instant() {
            ZonedDateTime oslo = REFERENCE.withZoneSameInstant(ZoneId.of("Europe/Oslo"));

            List<Occurrence> found = resolver.candidates(
                    new InstantTime(LocalDateTime.of(2024, 2, 4, 0, 0), ChronoUnit.DAYS), oslo);

            assertThat(found).singleElement().satisfies(o -> {
                assertThat(o.start().toOffsetDateTime())
                        .isEqualTo(OffsetDateTime.of(2024, 2, 4, 0, 0, 0, 0, ZoneOffset.ofHours(1)));
                assertThat(o.end().toLocalDate()).isEqualTo(o.start().toLocalDate().plusDays(1));
            });
        }
    }

    @Nested
    @DisplayName("Recurring expressions")
    class Recurring {

        @Test
        @DisplayName("today counts while it has not ended")
        void weekdayIncludesToday() {
            List<Occurrence> found = resolver.candidates(RecurringTime.weekday(DayOfWeek.MONDAY), REFERENCE);

            assertThat(found).extracting(Occurrence::start)
                    .containsExactly(at(2024, 2, 5, 0, 0), at(2024, 2, 12, 0, 0));
        }

        @Test
        @DisplayName("a time of day already over moves to the next day")
        void timeOfDay() {
            List<Occurrence> found = resolver.candidates(RecurringTime.timeOfDay(9, null), REFERENCE);

            assertThat(found).extracting(Occurrence::start)
                    .containsExactly(at(2024, 2, 6, 9, 0), at(2024, 2, 7, 9, 0));
            assertThat(found).allSatisfy(o -> assertThat(o.grain()).isEqualTo(ChronoUnit.HOURS));
        }

        @Test
        @DisplayName("month and day search across years")
        void monthDay() {
            List<Occurrence> found = resolver.candidates(RecurringTime.monthDay(3, 5), REFERENCE);

            assertThat(found).extracting(Occurrence::start)
                    .containsExactly(at(2024, 3, 5, 0, 0), at(2025, 3, 5, 0, 0));
        }

        @Test
        @DisplayName("the candidate count is configurable")
        void candidateLimit() {
            TimeValueResolver single = new TimeValueResolver(1);

            assertThat(single.candidates(RecurringTime.weekday(DayOfWeek.FRIDAY), REFERENCE)).hasSize(1);
        }
    }

    @Test
    @DisplayName("an interval ends with the end of its upper bound")
    void interval() {
        IntervalTime threeToFive = new IntervalTime(RecurringTime.timeOfDay(15, null), RecurringTime.timeOfDay(17, null));

        List<Occurrence> found = resolver.candidates(threeToFive, REFERENCE);

        assertThat(found).first().satisfies(o -> {
            assertThat(o.start()).isEqualTo(at(2024, 2, 5, 15, 0));
            assertThat(o.end()).isEqualTo(at(2024, 2, 5, 18, 0));
        });
    }

    @Test
    @DisplayName("an interval whose upper bound ends before it starts has no candidates")
    void invertedInterval() {
        IntervalTime tomorrowToYesterday = new IntervalTime(
                new RelativeTime(1, ChronoUnit.DAYS, ChronoUnit.DAYS),
                new RelativeTime(-1, ChronoUnit.DAYS, ChronoUnit.DAYS));
        ResolutionContext context = new ResolutionContext("en", REFERENCE.toInstant(), ZoneOffset.UTC, Set.of());

        assertThat(resolver.candidates(tomorrowToYesterday, REFERENCE)).isEmpty();
        assertThat(resolver.resolvable(tomorrowToYesterday, context)).isFalse();
    }

    @Test
    @DisplayName("shifts beyond the supported years have no candidates")
    void outOfRange() {
        assertThat(resolver.candidates(new RelativeTime(999_999_999_999L, ChronoUnit.YEARS, ChronoUnit.DAYS), REFERENCE))
                .isEmpty();
        assertThat(resolver.candidates(new RelativeTime(-999_999_999_999L, ChronoUnit.YEARS, ChronoUnit.DAYS), REFERENCE))
                .isEmpty();
        assertThat(resolver.candidates(new RelativeTime(Long.MAX_VALUE, ChronoUnit.DAYS, ChronoUnit.DAYS), REFERENCE))
                .isEmpty();
    }

    @Test
    @DisplayName("weeks truncate to the preceding Monday")
    void truncateWeeks() {
        ZonedDateTime wednesday = at(2024, 2, 7, 13, 45);

        assertThat(TimeValueResolver.truncate(wednesday, ChronoUnit.WEEKS)).isEqualTo(at(2024, 2, 5, 0, 0));
        assertThat(TimeValueResolver.truncate(wednesday, ChronoUnit.MONTHS)).isEqualTo(at(2024, 2, 1, 0, 0));
    }

    @Test
    @DisplayName("resolved values carry the singular grain name")
    void resolve() {
        ResolutionContext context = new ResolutionContext("en", REFERENCE.toInstant(), ZoneOffset.UTC, Set.of());

        TimeValue value = (TimeValue) resolver.resolve(new RelativeTime(-1, ChronoUnit.DAYS, ChronoUnit.DAYS), context);

        TimeInterval yesterday = value.first();
        assertThat(yesterday.grain()).isEqualTo("day");
        assertThat(yesterday.start()).isEqualTo(OffsetDateTime.of(2024, 2, 4, 0, 0, 0, 0, ZoneOffset.UTC));
        assertThat(value.type()).isEqualTo("interval");
    }

    private static ZonedDateTime at(int year, int month, int day, int hour, int minute) {
        return ZonedDateTime.of(year, month, day, hour, minute, 0, 0, ZoneOffset.UTC);
    }
}
