package com.dimensio.infrastructure.rules.nb;

import com.dimensio.domain.extraction.model.Dimension;
import com.dimensio.domain.extraction.rule.Rule;
import com.dimensio.infrastructure.rules.LocaleRuleBook;
import com.dimensio.infrastructure.rules.NumeralRules;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

import static com.dimensio.domain.extraction.model.Dimensions.NUMERAL;
import static com.dimensio.domain.extraction.rule.Patterns.numberBetween;
import static com.dimensio.domain.extraction.rule.Patterns.oneOf;

/**
 * Norwegian Bokmål numerals.
 */
@Component
public class NorwegianRuleBook implements LocaleRuleBook {

    static final Map<String, Long> ZERO_NINETEEN = Map.ofEntries(
            Map.entry("null", 0L), Map.entry("ingen", 0L), Map.entry("intet", 0L),
            Map.entry("en", 1L), Map.entry("ett", 1L), Map.entry("én", 1L),
            Map.entry("to", 2L), Map.entry("tre", 3L), Map.entry("fire", 4L), Map.entry("fem", 5L),
            Map.entry("seks", 6L), Map.entry("sju", 7L), Map.entry("syv", 7L), Map.entry("åtte", 8L),
            Map.entry("ni", 9L), Map.entry("ti", 10L), Map.entry("elleve", 11L), Map.entry("tolv", 12L),
            Map.entry("tretten", 13L), Map.entry("fjorten", 14L), Map.entry("femten", 15L),
            Map.entry("seksten", 16L), Map.entry("søtten", 17L), Map.entry("sytten", 17L),
            Map.entry("atten", 18L), Map.entry("nitten", 19L)
    );

    static final Map<String, Long> TENS = Map.of(
            "tyve", 20L, "tjue", 20L, "tredve", 30L, "førti", 40L, "femti", 50L,
            "seksti", 60L, "sytti", 70L, "åtti", 80L, "nitti", 90L
    );

    private static final List<Rule> NUMERALS = List.of(
            NumeralRules.constant("a pair", "et par", 2, 1, false),
            NumeralRules.decimalNumber("(\\d*,\\d+)", false),
            NumeralRules.grouped("decimal with thousands separator", "(\\d+(\\.\\d\\d\\d)+,\\d+)", '.', ','),
            NumeralRules.constant("dozen", "dusin", 12, 1, true),
            NumeralRules.constant("few", "(noen )?få", 3, null, false),
            NumeralRules.wordTable("integer (0..19)",
                    "(intet|ingen|null|en|ett|én|to|tretten|tre|fire|femten|fem|seksten|seks|syv|sju|åtte"
                            + "|nitten|ni|ti|elleve|tolv|fjorten|sytten|søtten|atten)",
                    ZERO_NINETEEN),
            NumeralRules.wordTable("integer (20..90)", "(tyve|tjue|tredve|førti|femti|seksti|sytti|åtti|nitti)", TENS),
            Rule.named("integer 21..99")
                    .pattern(oneOf(20, 30, 40, 50, 60, 70, 80, 90), numberBetween(1, 10))
                    .produce(tokens -> NumeralRules.sum(tokens, 0, 1)),
            NumeralRules.grouped("integer with thousands separator .", "(\\d{1,3}(\\.\\d\\d\\d){1,5})", '.', ','),
            NumeralRules.intersect(true),
            NumeralRules.intersectWithAnd("og"),
            NumeralRules.multiply(),
            NumeralRules.numberDotNumber("komma"),
            NumeralRules.negative("-|minus|negativ"),
            NumeralRules.suffixesKmg(),
            NumeralRules.powersOfTen("(hundre(de?)?|tusen?|million(er)?)", Map.of(
                    "hundre", 2, "hundred", 2, "hundrede", 2,
                    "tuse", 3, "tusen", 3,
                    "million", 6, "millioner", 6)),
            NumeralRules.constant("single", "enkelt", 1, 1, false)
    );

    @Override
    public String locale() {
        return "nb";
    }

    @Override
    public Map<Dimension<?>, List<Rule>> rules() {
        return Map.of(NUMERAL, NUMERALS);
    }
}
