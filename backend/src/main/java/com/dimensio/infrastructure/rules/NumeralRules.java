package com.dimensio.infrastructure.rules;

import com.dimensio.domain.extraction.model.Token;
import com.dimensio.domain.extraction.model.payload.NumeralData;
import com.dimensio.domain.extraction.rule.Rule;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.dimensio.domain.extraction.model.Dimensions.NUMERAL;
import static com.dimensio.domain.extraction.rule.Patterns.dimension;
import static com.dimensio.domain.extraction.rule.Patterns.numberWith;
import static com.dimensio.domain.extraction.rule.Patterns.regex;

/**
 * Numeral rules every locale declares the same way, up to its words.
 */
public final class NumeralRules {

    private NumeralRules() {
    }

    /** Word from {@code forms} (matched by {@code expression}, group 1) to its integer. */
    public static Rule wordTable(String name, String expression, Map<String, Long> forms) {
        return Rule.named(name)
                .pattern(regex(expression))
                .produce(tokens -> Optional.ofNullable(forms.get(NumeralHelpers.group(tokens.get(0), 0)))
                        .flatMap(NumeralHelpers::integer));
    }

    /** Fixed value for a word such as "dozen", optionally with a grain and multipliable. */
    public static Rule constant(String name, String expression, long value, Integer grain, boolean multipliable) {
        NumeralData data = new NumeralData(value, grain, multipliable);
        return Rule.named(name)
                .pattern(regex(expression))
                .produce(tokens -> Optional.of(data));
    }

    /**
     * Powers of ten: each form maps to its exponent, e.g. "hundred" → 2.
     * The result carries the exponent as grain and is multipliable.
     */
    public static Rule powersOfTen(String expression, Map<String, Integer> exponents) {
        return Rule.named("powers of tens")
                .pattern(regex(expression))
                .produce(tokens -> Optional.ofNullable(exponents.get(NumeralHelpers.group(tokens.get(0), 0)))
                        .map(g -> new NumeralData(Math.pow(10, g), g, true)));
    }

    public static Rule multiply() {
        return Rule.named("compose by multiplication")
                .pattern(dimension(NUMERAL), numberWith(NumeralData::multipliable))
                .produce(tokens -> NumeralHelpers.multiply(tokens.get(0), tokens.get(1)));
    }

    /**
     * "two hundred three". With {@code nonMultipliableOnly}, the right-hand
     * number may not itself be a multiplier ("hundred thousand" multiplies).
     */
    public static Rule intersect(boolean nonMultipliableOnly) {
        return Rule.named("intersect")
                .pattern(numberWith(nd -> nd.grainOrZero() > 1),
                        numberWith(nd -> !nonMultipliableOnly || !nd.multipliable()))
                .produce(tokens -> NumeralHelpers.intersect(tokens.get(0), tokens.get(1)));
    }

    /** "hundred and three", {@code conjunction} being the local "and". */
    public static Rule intersectWithAnd(String conjunction) {
        return Rule.named("intersect (with and)")
                .pattern(numberWith(nd -> nd.grainOrZero() > 1),
                        regex(conjunction),
                        numberWith(nd -> !nd.multipliable()))
                .produce(tokens -> NumeralHelpers.intersect(tokens.get(0), tokens.get(2)));
    }

    public static Rule suffixesKmg() {
        return Rule.named("numbers suffixes (K, M, G)")
                .pattern(dimension(NUMERAL), regex("([kmg])(?=[\\W\\$€]|$)"))
                .produce(tokens -> {
                    double scale = NumeralHelpers.suffixScale(NumeralHelpers.group(tokens.get(1), 0));
                    return scale == 0 ? Optional.empty() : NumeralHelpers.decimal(NumeralHelpers.value(tokens.get(0)) * scale);
                });
    }

    public static Rule negative(String prefixes) {
        return Rule.named("numbers prefix with -, negative or minus")
                .pattern(regex(prefixes), dimension(NUMERAL, nd -> nd.value() >= 0))
                .produce(tokens -> NumeralHelpers.decimal(-NumeralHelpers.value(tokens.get(1))));
    }

    /** "one point five", {@code separator} being the local decimal word. */
    public static Rule numberDotNumber(String separator) {
        return Rule.named("number dot number")
                .pattern(dimension(NUMERAL), regex(separator), numberWith(nd -> !nd.hasGrain()))
                .produce(tokens -> NumeralHelpers.decimal(NumeralHelpers.value(tokens.get(0))
                        + NumeralHelpers.decimalsToDouble(NumeralHelpers.value(tokens.get(2)))));
    }

    /** Digits with a decimal mark, e.g. "1.5" or ",5". */
    public static Rule decimalNumber(String expression, boolean dotDecimal) {
        return Rule.named("decimal number")
                .pattern(regex(expression))
                .produce(tokens -> NumeralHelpers.parseDecimal(dotDecimal, NumeralHelpers.group(tokens.get(0), 0)));
    }

    /** Digits grouped by {@code thousands}, with an optional {@code decimal} part. */
    public static Rule grouped(String name, String expression, char thousands, char decimal) {
        return Rule.named(name)
                .pattern(regex(expression))
                .produce(tokens -> NumeralHelpers.parseGrouped(NumeralHelpers.group(tokens.get(0), 0), thousands, decimal));
    }

    public static Optional<NumeralData> sum(List<Token> tokens, int left, int right) {
        return NumeralHelpers.decimal(NumeralHelpers.value(tokens.get(left)) + NumeralHelpers.value(tokens.get(right)));
    }
}
