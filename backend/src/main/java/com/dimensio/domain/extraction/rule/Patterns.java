package com.dimensio.domain.extraction.rule;

import com.dimensio.domain.extraction.model.Dimension;
import com.dimensio.domain.extraction.model.DimensionPayload;
import com.dimensio.domain.extraction.model.Dimensions;
import com.dimensio.domain.extraction.model.payload.NumeralData;
import com.dimensio.domain.extraction.rule.PatternItem.LiteralSetItem;
import com.dimensio.domain.extraction.rule.PatternItem.NumericRangeItem;
import com.dimensio.domain.extraction.rule.PatternItem.PredicateItem;
import com.dimensio.domain.extraction.rule.PatternItem.RegexItem;

import java.util.Arrays;
import java.util.Map;
import java.util.function.Predicate;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Factories for pattern items, meant to be statically imported by rule books.
 */
public final class Patterns {

    private static final int REGEX_FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;

    /** A match may not end between two letters or two digits. */
    private static final String END_BOUNDARY = "(?!(?<=\\p{L})\\p{L})(?!(?<=\\p{Nd})\\p{Nd})";

    private Patterns() {
    }

    /**
     * Case-insensitive regex item. The match is not allowed to end inside a
     * word or a number, so alternatives like {@code min|minus} backtrack to
     * the one that completes the word.
     *
     * @throws RuleConfigurationException if the expression does not compile
     */
    public static RegexItem regex(String expression) {
        try {
            // compiled alone first: wrapping could balance stray parentheses
            Pattern.compile(expression, REGEX_FLAGS);
            return new RegexItem(Pattern.compile("(?:" + expression + ")" + END_BOUNDARY, REGEX_FLAGS));
        } catch (PatternSyntaxException e) {
            throw new RuleConfigurationException("Invalid regex '" + expression + "': " + e.getDescription(), e);
        }
    }

    public static LiteralSetItem literals(Map<String, Double> forms) {
        return new LiteralSetItem(forms);
    }

    public static <P extends DimensionPayload> PredicateItem<P> dimension(Dimension<P> dimension) {
        return new PredicateItem<>(dimension, payload -> true);
    }

    public static <P extends DimensionPayload> PredicateItem<P> dimension(Dimension<P> dimension, Predicate<P> predicate) {
        return new PredicateItem<>(dimension, predicate);
    }

    public static PredicateItem<NumeralData> numberWith(Predicate<NumeralData> predicate) {
        return new PredicateItem<>(Dimensions.NUMERAL, predicate);
    }

    /** Numerals with {@code low <= value < high}. */
    public static NumericRangeItem numberBetween(double low, double high) {
        return new NumericRangeItem(low, high);
    }

    public static PredicateItem<NumeralData> oneOf(double... values) {
        double[] accepted = values.clone();
        return numberWith(nd -> Arrays.stream(accepted).anyMatch(v -> v == nd.value()));
    }
}
