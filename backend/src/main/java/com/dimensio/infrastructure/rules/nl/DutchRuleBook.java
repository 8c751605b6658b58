package com.dimensio.infrastructure.rules.nl;

import com.dimensio.domain.extraction.model.Dimension;
import com.dimensio.domain.extraction.rule.Rule;
import com.dimensio.infrastructure.rules.LocaleRuleBook;
import com.dimensio.infrastructure.rules.NumeralHelpers;
import com.dimensio.infrastructure.rules.NumeralRules;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.dimensio.domain.extraction.model.Dimensions.NUMERAL;
import static com.dimensio.domain.extraction.rule.Patterns.numberBetween;
import static com.dimensio.domain.extraction.rule.Patterns.oneOf;
import static com.dimensio.domain.extraction.rule.Patterns.regex;

/**
 * Dutch numerals.
 */
@Component
public class DutchRuleBook implements LocaleRuleBook {

    static final Map<String, Long> ZERO_NINETEEN = Map.ofEntries(
            Map.entry("niks", 0L), Map.entry("nul", 0L), Map.entry("geen", 0L),
            Map.entry("één", 1L), Map.entry("een", 1L),
            Map.entry("twee", 2L), Map.entry("drie", 3L), Map.entry("vier", 4L), Map.entry("vijf", 5L),
            Map.entry("zes", 6L), Map.entry("zeven", 7L), Map.entry("acht", 8L), Map.entry("negen", 9L),
            Map.entry("tien", 10L), Map.entry("elf", 11L), Map.entry("twaalf", 12L), Map.entry("dertien", 13L),
            Map.entry("veertien", 14L), Map.entry("vijftien", 15L), Map.entry("zestien", 16L),
            Map.entry("zeventien", 17L), Map.entry("achttien", 18L), Map.entry("achtien", 18L),
            Map.entry("negentien", 19L)
    );

    static final Map<String, Long> TENS = Map.of(
            "twintig", 20L, "dertig", 30L, "veertig", 40L, "vijftig", 50L,
            "zestig", 60L, "zeventig", 70L, "tachtig", 80L, "negentig", 90L
    );

    private static final String TENS_WORDS = "twintig|dertig|veertig|vijftig|zestig|zeventig|tachtig|negentig";

    private static final List<Rule> NUMERALS = List.of(
            NumeralRules.constant("couple", "(een )?paar", 2, null, false),
            NumeralRules.decimalNumber("(\\d*,\\d+)", false),
            NumeralRules.grouped("decimal with thousands separator", "(\\d+(\\.\\d\\d\\d)+,\\d+)", '.', ','),
            NumeralRules.constant("dozen", "dozijn", 12, 1, false),
            NumeralRules.constant("few", "meerdere", 3, null, false),
            NumeralRules.wordTable("integer (0..19)",
                    "(geen|nul|niks|een|één|twee|drie|vier|vijftien|vijf|zestien|zes|zeventien|zeven"
                            + "|achttien|achtien|acht|negentien|negen|tien|elf|twaalf|dertien|veertien)",
                    ZERO_NINETEEN),
            NumeralRules.wordTable("integer (20..90)", "(" + TENS_WORDS + ")", TENS),
            Rule.named("integer ([2-9][1-9])")
                    .pattern(regex("(een|twee|drie|vier|vijf|zes|zeven|acht|negen)(?:e|ë)n(" + TENS_WORDS + ")"))
                    .produce(tokens -> {
                        Long unit = ZERO_NINETEEN.get(NumeralHelpers.group(tokens.get(0), 0));
                        Long ten = TENS.get(NumeralHelpers.group(tokens.get(0), 1));
                        return unit == null || ten == null ? Optional.empty() : NumeralHelpers.integer(unit + ten);
                    }),
            NumeralRules.intersect(false),
            NumeralRules.multiply(),
            Rule.named("numbers en")
                    .pattern(numberBetween(1, 10), regex("en"), oneOf(20, 30, 40, 50, 60, 70, 80, 90))
                    .produce(tokens -> NumeralRules.sum(tokens, 0, 2)),
            NumeralRules.negative("-|min|minus|negatief"),
            NumeralRules.suffixesKmg(),
            NumeralRules.powersOfTen("(honderd|duizend|miljoen)", Map.of("honderd", 2, "duizend", 3, "miljoen", 6)),
            NumeralRules.constant("ten", "tien", 10, 1, false)
    );

    @Override
    public String locale() {
        return "nl";
    }

    @Override
    public Map<Dimension<?>, List<Rule>> rules() {
        return Map.of(NUMERAL, NUMERALS);
    }
}
