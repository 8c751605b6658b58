package com.dimensio.infrastructure.rules.en;

import com.dimensio.domain.extraction.rule.Rule;
import com.dimensio.infrastructure.rules.NumeralHelpers;
import com.dimensio.infrastructure.rules.NumeralRules;

import java.util.List;
import java.util.Map;

import static com.dimensio.domain.extraction.rule.Patterns.literals;
import static com.dimensio.domain.extraction.rule.Patterns.numberBetween;
import static com.dimensio.domain.extraction.rule.Patterns.oneOf;

final class EnglishNumeralRules {

    static final Map<String, Double> ZERO_NINETEEN = Map.ofEntries(
            Map.entry("none", 0d), Map.entry("zilch", 0d), Map.entry("naught", 0d), Map.entry("nought", 0d),
            Map.entry("nil", 0d), Map.entry("zero", 0d),
            Map.entry("one", 1d), Map.entry("two", 2d), Map.entry("three", 3d), Map.entry("four", 4d),
            Map.entry("five", 5d), Map.entry("six", 6d), Map.entry("seven", 7d), Map.entry("eight", 8d),
            Map.entry("nine", 9d), Map.entry("ten", 10d), Map.entry("eleven", 11d), Map.entry("twelve", 12d),
            Map.entry("thirteen", 13d), Map.entry("fourteen", 14d), Map.entry("fifteen", 15d),
            Map.entry("sixteen", 16d), Map.entry("seventeen", 17d), Map.entry("eighteen", 18d),
            Map.entry("nineteen", 19d)
    );

    static final Map<String, Double> TENS = Map.of(
            "twenty", 20d, "thirty", 30d, "forty", 40d, "fourty", 40d, "fifty", 50d,
            "sixty", 60d, "seventy", 70d, "eighty", 80d, "ninety", 90d
    );

    static final List<Rule> RULES = List.of(
            Rule.named("integer (0..19)")
                    .pattern(literals(ZERO_NINETEEN))
                    .produce(tokens -> NumeralHelpers.integer((long) NumeralHelpers.literalValue(tokens.get(0)))),
            Rule.named("integer (20..90)")
                    .pattern(literals(TENS))
                    .produce(tokens -> NumeralHelpers.integer((long) NumeralHelpers.literalValue(tokens.get(0)))),
            Rule.named("integer 21..99")
                    .pattern(oneOf(20, 30, 40, 50, 60, 70, 80, 90), numberBetween(1, 10))
                    .produce(tokens -> NumeralRules.sum(tokens, 0, 1)),
            NumeralRules.grouped("integer with thousands separator ,", "(\\d{1,3}(,\\d\\d\\d){1,5})", ',', '.'),
            NumeralRules.decimalNumber("(\\d*\\.\\d+)", true),
            NumeralRules.grouped("decimal with thousands separator", "(\\d+(,\\d\\d\\d)+\\.\\d+)", ',', '.'),
            NumeralRules.powersOfTen("(hundreds?|thousands?|millions?|billions?)", Map.of(
                    "hundred", 2, "hundreds", 2,
                    "thousand", 3, "thousands", 3,
                    "million", 6, "millions", 6,
                    "billion", 9, "billions", 9)),
            NumeralRules.constant("couple", "(a )?(couple|pair)( of)?", 2, null, false),
            NumeralRules.constant("few", "(a )?few", 3, null, false),
            NumeralRules.constant("dozen", "dozens?", 12, 1, true),
            NumeralRules.multiply(),
            NumeralRules.intersect(true),
            NumeralRules.intersectWithAnd("and"),
            NumeralRules.numberDotNumber("dot|point"),
            NumeralRules.suffixesKmg(),
            NumeralRules.negative("-|minus|negative")
    );

    private EnglishNumeralRules() {
    }
}
