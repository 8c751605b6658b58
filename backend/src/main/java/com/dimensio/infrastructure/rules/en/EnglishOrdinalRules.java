package com.dimensio.infrastructure.rules.en;

import com.dimensio.domain.extraction.model.payload.OrdinalData;
import com.dimensio.domain.extraction.rule.Rule;
import com.dimensio.infrastructure.rules.NumeralHelpers;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.dimensio.domain.extraction.model.Dimensions.ORDINAL;
import static com.dimensio.domain.extraction.rule.Patterns.dimension;
import static com.dimensio.domain.extraction.rule.Patterns.literals;
import static com.dimensio.domain.extraction.rule.Patterns.oneOf;
import static com.dimensio.domain.extraction.rule.Patterns.regex;

final class EnglishOrdinalRules {

    static final Map<String, Double> ORDINALS = Map.ofEntries(
            Map.entry("first", 1d), Map.entry("second", 2d), Map.entry("third", 3d), Map.entry("fourth", 4d),
            Map.entry("fifth", 5d), Map.entry("sixth", 6d), Map.entry("seventh", 7d), Map.entry("eighth", 8d),
            Map.entry("ninth", 9d), Map.entry("tenth", 10d), Map.entry("eleventh", 11d), Map.entry("twelfth", 12d),
            Map.entry("thirteenth", 13d), Map.entry("fourteenth", 14d), Map.entry("fifteenth", 15d),
            Map.entry("sixteenth", 16d), Map.entry("seventeenth", 17d), Map.entry("eighteenth", 18d),
            Map.entry("nineteenth", 19d), Map.entry("twentieth", 20d), Map.entry("thirtieth", 30d),
            Map.entry("fortieth", 40d), Map.entry("fiftieth", 50d), Map.entry("sixtieth", 60d),
            Map.entry("seventieth", 70d), Map.entry("eightieth", 80d), Map.entry("ninetieth", 90d)
    );

    static final List<Rule> RULES = List.of(
            Rule.named("ordinals (first..ninetieth)")
                    .pattern(literals(ORDINALS))
                    .produce(tokens -> Optional.of(new OrdinalData((long) NumeralHelpers.literalValue(tokens.get(0))))),
            Rule.named("ordinal (digits)")
                    .pattern(regex("0*(\\d+) ?(st|nd|rd|th)"))
                    .produce(tokens -> NumeralHelpers.parseInt(NumeralHelpers.group(tokens.get(0), 0))
                            .map(OrdinalData::new)),
            Rule.named("ordinals (composite, e.g. eighty-seven)")
                    .pattern(oneOf(20, 30, 40, 50, 60, 70, 80, 90), dimension(ORDINAL, od -> od.value() >= 1 && od.value() <= 9))
                    .produce(tokens -> Optional.of(new OrdinalData(
                            (long) NumeralHelpers.value(tokens.get(0)) + tokens.get(1).payload(ORDINAL).value())))
    );

    private EnglishOrdinalRules() {
    }
}
