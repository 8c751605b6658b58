package com.dimensio.infrastructure.rules.en;

import com.dimensio.domain.extraction.model.Token;
import com.dimensio.domain.extraction.model.payload.DurationData;
import com.dimensio.domain.extraction.model.payload.NumeralData;
import com.dimensio.domain.extraction.model.payload.TimeData;
import com.dimensio.domain.extraction.model.payload.TimeData.InstantTime;
import com.dimensio.domain.extraction.model.payload.TimeData.IntervalTime;
import com.dimensio.domain.extraction.model.payload.TimeData.RecurringTime;
import com.dimensio.domain.extraction.model.payload.TimeData.RelativeTime;
import com.dimensio.domain.extraction.model.payload.TimeGrainData;
import com.dimensio.domain.extraction.rule.Rule;
import com.dimensio.infrastructure.rules.NumeralHelpers;

import java.time.DateTimeException;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.Month;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.dimensio.domain.extraction.model.Dimensions.DURATION;
import static com.dimensio.domain.extraction.model.Dimensions.ORDINAL;
import static com.dimensio.domain.extraction.model.Dimensions.TIME;
import static com.dimensio.domain.extraction.model.Dimensions.TIME_GRAIN;
import static com.dimensio.domain.extraction.rule.Patterns.dimension;
import static com.dimensio.domain.extraction.rule.Patterns.literals;
import static com.dimensio.domain.extraction.rule.Patterns.numberWith;
import static com.dimensio.domain.extraction.rule.Patterns.regex;

/**
 * Time grains, durations and times. Times are left unanchored; the time
 * resolver places them relative to the reference instant.
 */
final class EnglishTimeRules {

    /** Ten thousand years. */
    static final long MAX_SHIFT_SECONDS = ChronoUnit.YEARS.getDuration().getSeconds() * 10_000;

    static final Map<String, Double> WEEKDAYS = Map.ofEntries(
            Map.entry("monday", 1d), Map.entry("mon", 1d),
            Map.entry("tuesday", 2d), Map.entry("tues", 2d), Map.entry("tue", 2d),
            Map.entry("wednesday", 3d), Map.entry("wed", 3d),
            Map.entry("thursday", 4d), Map.entry("thurs", 4d), Map.entry("thu", 4d),
            Map.entry("friday", 5d), Map.entry("fri", 5d),
            Map.entry("saturday", 6d), Map.entry("sat", 6d),
            Map.entry("sunday", 7d), Map.entry("sun", 7d)
    );

    static final Map<String, Double> MONTHS = Map.ofEntries(
            Map.entry("january", 1d), Map.entry("jan", 1d), Map.entry("february", 2d), Map.entry("feb", 2d),
            Map.entry("march", 3d), Map.entry("mar", 3d), Map.entry("april", 4d), Map.entry("apr", 4d),
            Map.entry("may", 5d), Map.entry("june", 6d), Map.entry("jun", 6d), Map.entry("july", 7d),
            Map.entry("jul", 7d), Map.entry("august", 8d), Map.entry("aug", 8d), Map.entry("september", 9d),
            Map.entry("sept", 9d), Map.entry("sep", 9d), Map.entry("october", 10d), Map.entry("oct", 10d),
            Map.entry("november", 11d), Map.entry("nov", 11d), Map.entry("december", 12d), Map.entry("dec", 12d)
    );

    static final List<Rule> GRAINS = List.of(
            Rule.named("second (grain)").pattern(regex("sec(ond)?s?")).produce(tokens -> grain(ChronoUnit.SECONDS)),
            Rule.named("minute (grain)").pattern(regex("min(ute)?s?")).produce(tokens -> grain(ChronoUnit.MINUTES)),
            Rule.named("hour (grain)").pattern(regex("h(ou)?rs?")).produce(tokens -> grain(ChronoUnit.HOURS)),
            Rule.named("day (grain)").pattern(regex("days?")).produce(tokens -> grain(ChronoUnit.DAYS)),
            Rule.named("week (grain)").pattern(regex("weeks?")).produce(tokens -> grain(ChronoUnit.WEEKS)),
            Rule.named("month (grain)").pattern(regex("months?")).produce(tokens -> grain(ChronoUnit.MONTHS)),
            Rule.named("year (grain)").pattern(regex("years?")).produce(tokens -> grain(ChronoUnit.YEARS))
    );

    static final List<Rule> DURATIONS = List.of(
            Rule.named("<integer> <unit-of-duration>")
                    .pattern(numberWith(nd -> nd.value() >= 0), dimension(TIME_GRAIN))
                    .produce(tokens -> Optional.of(new DurationData(
                            NumeralHelpers.value(tokens.get(0)), tokens.get(1).payload(TIME_GRAIN).grain()))),
            Rule.named("a <unit-of-duration>")
                    .pattern(regex("an?"), dimension(TIME_GRAIN))
                    .produce(tokens -> Optional.of(new DurationData(1, tokens.get(1).payload(TIME_GRAIN).grain()))),
            Rule.named("half an hour")
                    .pattern(regex("(1/2|half) an? hour"))
                    .produce(tokens -> Optional.of(new DurationData(30, ChronoUnit.MINUTES)))
    );

    static final List<Rule> TIMES = List.of(
            Rule.named("now")
                    .pattern(regex("(just|right) now|now|immediately"))
                    .produce(tokens -> Optional.of(new RelativeTime(0, ChronoUnit.SECONDS, ChronoUnit.SECONDS))),
            Rule.named("today")
                    .pattern(regex("todays?|(at )?this time"))
                    .produce(tokens -> Optional.of(new RelativeTime(0, ChronoUnit.DAYS, ChronoUnit.DAYS))),
            Rule.named("tomorrow")
                    .pattern(regex("(tmrw?|tomm?or?rows?)"))
                    .produce(tokens -> Optional.of(new RelativeTime(1, ChronoUnit.DAYS, ChronoUnit.DAYS))),
            Rule.named("yesterday")
                    .pattern(regex("yesterdays?"))
                    .produce(tokens -> Optional.of(new RelativeTime(-1, ChronoUnit.DAYS, ChronoUnit.DAYS))),
            Rule.named("named-day")
                    .pattern(literals(WEEKDAYS))
                    .produce(tokens -> Optional.of(RecurringTime.weekday(
                            DayOfWeek.of((int) NumeralHelpers.literalValue(tokens.get(0)))))),
            Rule.named("noon")
                    .pattern(regex("noon|midday"))
                    .produce(tokens -> Optional.of(RecurringTime.timeOfDay(12, null))),
            Rule.named("midnight")
                    .pattern(regex("midnight"))
                    .produce(tokens -> Optional.of(RecurringTime.timeOfDay(0, null))),
            Rule.named("hh:mm")
                    .pattern(regex("((?:[01]?\\d)|(?:2[0-3])):([0-5]\\d)"))
                    .produce(tokens -> Optional.of(RecurringTime.timeOfDay(
                            Integer.parseInt(NumeralHelpers.group(tokens.get(0), 0)),
                            Integer.parseInt(NumeralHelpers.group(tokens.get(0), 1))))),
            Rule.named("<integer> am|pm")
                    .pattern(numberWith(nd -> nd.isInteger() && nd.value() >= 1 && nd.value() <= 12),
                            regex("([ap])\\.?m\\.?"))
                    .produce(tokens -> Optional.of(RecurringTime.timeOfDay(
                            clockHour((int) NumeralHelpers.value(tokens.get(0)), NumeralHelpers.group(tokens.get(1), 0)),
                            null))),
            Rule.named("<time-of-day> am|pm")
                    .pattern(dimension(TIME, EnglishTimeRules::isTwelveHourClock), regex("([ap])\\.?m\\.?"))
                    .produce(tokens -> {
                        RecurringTime time = (RecurringTime) tokens.get(0).payload(TIME);
                        return Optional.of(RecurringTime.timeOfDay(
                                clockHour(time.hour(), NumeralHelpers.group(tokens.get(1), 0)), time.minute()));
                    }),
            Rule.named("at <time-of-day>")
                    .pattern(regex("at|@"), dimension(TIME, EnglishTimeRules::isTimeOfDay))
                    .produce(tokens -> Optional.of(tokens.get(1).payload(TIME))),
            Rule.named("at <integer>")
                    .pattern(regex("at|@"), numberWith(nd -> nd.isInteger() && nd.value() >= 0 && nd.value() < 24))
                    .produce(tokens -> Optional.of(RecurringTime.timeOfDay((int) NumeralHelpers.value(tokens.get(1)), null))),
            Rule.named("on <day>")
                    .pattern(regex("on"), dimension(TIME, EnglishTimeRules::isDay))
                    .produce(tokens -> Optional.of(tokens.get(1).payload(TIME))),
            Rule.named("<day> <time-of-day>")
                    .pattern(dimension(TIME, EnglishTimeRules::isDay), dimension(TIME, EnglishTimeRules::isTimeOfDay))
                    .produce(tokens -> intersect(tokens.get(0), tokens.get(1))),
            Rule.named("<time-of-day> on <day>")
                    .pattern(dimension(TIME, EnglishTimeRules::isTimeOfDay), regex("on"), dimension(TIME, EnglishTimeRules::isDay))
                    .produce(tokens -> intersect(tokens.get(0), tokens.get(2))),
            Rule.named("<named-month> <day-of-month> (ordinal)")
                    .pattern(literals(MONTHS), dimension(ORDINAL, od -> od.value() >= 1 && od.value() <= 31))
                    .produce(tokens -> monthDay(tokens.get(0), tokens.get(1).payload(ORDINAL).value())),
            Rule.named("<named-month> <day-of-month> (non ordinal)")
                    .pattern(literals(MONTHS), numberWith(nd -> nd.isInteger() && nd.value() >= 1 && nd.value() <= 31))
                    .produce(tokens -> monthDay(tokens.get(0), (long) NumeralHelpers.value(tokens.get(1)))),
            Rule.named("<day-of-month> (ordinal) <named-month>")
                    .pattern(dimension(ORDINAL, od -> od.value() >= 1 && od.value() <= 31), literals(MONTHS))
                    .produce(tokens -> monthDay(tokens.get(1), tokens.get(0).payload(ORDINAL).value())),
            Rule.named("<day-of-month> (ordinal) of <named-month>")
                    .pattern(dimension(ORDINAL, od -> od.value() >= 1 && od.value() <= 31), regex("of"), literals(MONTHS))
                    .produce(tokens -> monthDay(tokens.get(2), tokens.get(0).payload(ORDINAL).value())),
            Rule.named("yyyy-mm-dd")
                    .pattern(regex("(\\d{4})-(\\d{1,2})-(\\d{1,2})"))
                    .produce(tokens -> date(tokens.get(0), 0, 1, 2)),
            Rule.named("mm/dd/yyyy")
                    .pattern(regex("(\\d{1,2})/(\\d{1,2})/(\\d{4})"))
                    .produce(tokens -> date(tokens.get(0), 2, 0, 1)),
            Rule.named("in <duration>")
                    .pattern(regex("in|within"), dimension(DURATION))
                    .produce(tokens -> shift(tokens.get(1).payload(DURATION), 1)),
            Rule.named("<duration> from now")
                    .pattern(dimension(DURATION), regex("from now|later|hence"))
                    .produce(tokens -> shift(tokens.get(0).payload(DURATION), 1)),
            Rule.named("<duration> ago")
                    .pattern(dimension(DURATION), regex("ago"))
                    .produce(tokens -> shift(tokens.get(0).payload(DURATION), -1)),
            Rule.named("this|next|last <grain>")
                    .pattern(regex("(this|current|next|coming|last|past|previous)"),
                            dimension(TIME_GRAIN, tg -> tg.grain().compareTo(ChronoUnit.MINUTES) >= 0))
                    .produce(tokens -> {
                        ChronoUnit grain = tokens.get(1).payload(TIME_GRAIN).grain();
                        return Optional.of(new RelativeTime(direction(NumeralHelpers.group(tokens.get(0), 0)), grain, grain));
                    }),
            Rule.named("from <time> to <time>")
                    .pattern(regex("from"), dimension(TIME, EnglishTimeRules::isPoint),
                            regex("to|till|until|through|-"), dimension(TIME, EnglishTimeRules::isPoint))
                    .produce(tokens -> Optional.of(new IntervalTime(
                            tokens.get(1).payload(TIME), tokens.get(3).payload(TIME)))),
            Rule.named("<time> - <time>")
                    .pattern(dimension(TIME, EnglishTimeRules::isPoint),
                            regex("to|till|until|through|-"), dimension(TIME, EnglishTimeRules::isPoint))
                    .produce(tokens -> Optional.of(new IntervalTime(
                            tokens.get(0).payload(TIME), tokens.get(2).payload(TIME))))
    );

    private EnglishTimeRules() {
    }

    private static Optional<TimeGrainData> grain(ChronoUnit unit) {
        return Optional.of(new TimeGrainData(unit));
    }

    private static boolean isTimeOfDay(TimeData time) {
        return time instanceof RecurringTime recurring && recurring.isTimeOfDay();
    }

    private static boolean isTwelveHourClock(TimeData time) {
        return isTimeOfDay(time) && ((RecurringTime) time).hour() >= 1 && ((RecurringTime) time).hour() <= 12;
    }

    private static boolean isDay(TimeData time) {
        return time instanceof RecurringTime recurring && recurring.isDayPattern();
    }

    private static boolean isPoint(TimeData time) {
        return !(time instanceof IntervalTime);
    }

    static int clockHour(int hour, String meridiem) {
        boolean pm = meridiem.startsWith("p");
        if (pm && hour < 12) {
            return hour + 12;
        }
        return !pm && hour == 12 ? 0 : hour;
    }

    private static Optional<RecurringTime> intersect(Token day, Token timeOfDay) {
        RecurringTime first = (RecurringTime) day.payload(TIME);
        return first.intersect((RecurringTime) timeOfDay.payload(TIME));
    }

    private static Optional<RecurringTime> monthDay(Token monthToken, long day) {
        int month = (int) NumeralHelpers.literalValue(monthToken);
        if (day > Month.of(month).maxLength()) {
            return Optional.empty();
        }
        return Optional.of(RecurringTime.monthDay(month, (int) day));
    }

    private static Optional<InstantTime> date(Token capture, int yearGroup, int monthGroup, int dayGroup) {
        try {
            LocalDate date = LocalDate.of(
                    Integer.parseInt(NumeralHelpers.group(capture, yearGroup)),
                    Integer.parseInt(NumeralHelpers.group(capture, monthGroup)),
                    Integer.parseInt(NumeralHelpers.group(capture, dayGroup)));
            return Optional.of(new InstantTime(date.atStartOfDay(), ChronoUnit.DAYS));
        } catch (DateTimeException e) {
            return Optional.empty();
        }
    }

    /**
     * Reference shifted by the duration. Day and larger units are kept whole;
     * shorter shifts keep second precision. Shifts past {@link #MAX_SHIFT_SECONDS}
     * do not produce a time.
     */
    static Optional<RelativeTime> shift(DurationData duration, int sign) {
        ChronoUnit unit = duration.grain();
        if (Math.abs(duration.value() * unit.getDuration().getSeconds()) > MAX_SHIFT_SECONDS) {
            return Optional.empty();
        }
        ChronoUnit grain = unit.compareTo(ChronoUnit.DAYS) >= 0 ? ChronoUnit.DAYS : ChronoUnit.SECONDS;
        NumeralData amount = NumeralData.of(duration.value());
        if (amount.isInteger()) {
            return Optional.of(new RelativeTime(sign * (long) duration.value(), unit, grain));
        }
        long seconds = Math.round(duration.value() * unit.getDuration().getSeconds());
        return Optional.of(new RelativeTime(sign * seconds, ChronoUnit.SECONDS, grain));
    }

    private static long direction(String word) {
        return switch (word) {
            case "next", "coming" -> 1;
            case "last", "past", "previous" -> -1;
            default -> 0;
        };
    }
}
