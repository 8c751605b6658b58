package com.dimensio.domain.extraction.model.payload;

import com.dimensio.domain.extraction.model.Dimension;
import com.dimensio.domain.extraction.model.DimensionPayload;
import com.dimensio.domain.extraction.model.Dimensions;

import java.time.DayOfWeek;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Objects;
import java.util.Optional;

/**
 * Time expression before it is anchored to a reference instant.
 */
public sealed interface TimeData extends DimensionPayload
        permits TimeData.InstantTime, TimeData.RelativeTime, TimeData.RecurringTime, TimeData.IntervalTime {

    @Override
    default Dimension<TimeData> dimension() {
        return Dimensions.TIME;
    }

    /** Finest unit the expression names. */
    ChronoUnit grain();

    /**
     * Absolute local date-time, interpreted in the parse's zone ("2024-02-04").
     */
    record InstantTime(LocalDateTime value, ChronoUnit grain) implements TimeData {

        public InstantTime {
            Objects.requireNonNull(value, "value");
            Objects.requireNonNull(grain, "grain");
        }
    }

    /**
     * Reference instant shifted by {@code amount} {@code unit}s, then truncated
     * to {@code grain} ("tomorrow", "in 3 hours", "2 days ago").
     */
    record RelativeTime(long amount, ChronoUnit unit, ChronoUnit grain) implements TimeData {

        public RelativeTime {
            Objects.requireNonNull(unit, "unit");
            Objects.requireNonNull(grain, "grain");
        }
    }

    /**
     * Pattern matched by many concrete times ("monday", "3pm", "march 5").
     * Null fields are unconstrained.
     */
    record RecurringTime(
            DayOfWeek dayOfWeek,
            Integer month,
            Integer dayOfMonth,
            Integer hour,
            Integer minute,
            ChronoUnit grain
    ) implements TimeData {

        public RecurringTime {
            Objects.requireNonNull(grain, "grain");
        }

        public static RecurringTime weekday(DayOfWeek dayOfWeek) {
            return new RecurringTime(dayOfWeek, null, null, null, null, ChronoUnit.DAYS);
        }

        public static RecurringTime monthDay(int month, int dayOfMonth) {
            return new RecurringTime(null, month, dayOfMonth, null, null, ChronoUnit.DAYS);
        }

        public static RecurringTime timeOfDay(int hour, Integer minute) {
            return new RecurringTime(null, null, null, hour, minute,
                    minute == null ? ChronoUnit.HOURS : ChronoUnit.MINUTES);
        }

        public boolean isTimeOfDay() {
            return hour != null && dayOfWeek == null && month == null && dayOfMonth == null;
        }

        public boolean isDayPattern() {
            return hour == null && (dayOfWeek != null || dayOfMonth != null);
        }

        /**
         * Both constraints at once, or empty when they constrain the same field.
         */
        public Optional<RecurringTime> intersect(RecurringTime other) {
            if ((dayOfWeek != null && other.dayOfWeek != null)
                    || (month != null && other.month != null)
                    || (dayOfMonth != null && other.dayOfMonth != null)
                    || (hour != null && other.hour != null)) {
                return Optional.empty();
            }
            ChronoUnit finer = grain.compareTo(other.grain) <= 0 ? grain : other.grain;
            return Optional.of(new RecurringTime(
                    dayOfWeek != null ? dayOfWeek : other.dayOfWeek,
                    month != null ? month : other.month,
                    dayOfMonth != null ? dayOfMonth : other.dayOfMonth,
                    hour != null ? hour : other.hour,
                    minute != null ? minute : other.minute,
                    finer));
        }
    }

    /**
     * Closed interval between two time expressions ("from 3pm to 5pm").
     */
    record IntervalTime(TimeData from, TimeData to) implements TimeData {

        public IntervalTime {
            Objects.requireNonNull(from, "from");
            Objects.requireNonNull(to, "to");
        }

        @Override
        public ChronoUnit grain() {
            return from.grain();
        }
    }
}
