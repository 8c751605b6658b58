package com.dimensio.domain.extraction.rule;

import com.dimensio.domain.extraction.model.Dimension;
import com.dimensio.domain.extraction.model.DimensionPayload;
import com.dimensio.domain.extraction.model.Dimensions;
import com.dimensio.domain.extraction.model.Token;
import com.dimensio.domain.extraction.model.payload.NumeralData;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * One atomic matcher in a rule's pattern. Text items consume a slice of the
 * document; token items consume one token already in the pool.
 */
public sealed interface PatternItem
        permits PatternItem.RegexItem, PatternItem.LiteralSetItem, PatternItem.PredicateItem, PatternItem.NumericRangeItem {

    /** True if this item matches raw text rather than pooled tokens. */
    boolean matchesText();

    /**
     * Regular expression anchored at the attempted offset, case-insensitive.
     */
    record RegexItem(Pattern pattern) implements PatternItem {

        public RegexItem {
            Objects.requireNonNull(pattern, "pattern");
        }

        @Override
        public boolean matchesText() {
            return true;
        }

        @Override
        public String toString() {
            return "regex(" + pattern.pattern() + ")";
        }
    }

    /**
     * Enumeration of accepted literal forms, each mapped to a value. The
     * longest form present at the offset wins.
     *
     * @param forms lower-case literal → value, longest literal first
     */
    record LiteralSetItem(Map<String, Double> forms) implements PatternItem {

        public LiteralSetItem {
            List<String> literals = new ArrayList<>(forms.keySet());
            literals.sort(Comparator.comparingInt(String::length).reversed().thenComparing(Comparator.naturalOrder()));
            Map<String, Double> sorted = new LinkedHashMap<>();
            for (String literal : literals) {
                sorted.put(literal.toLowerCase(Locale.ROOT), forms.get(literal));
            }
            forms = Collections.unmodifiableMap(sorted);
        }

        @Override
        public boolean matchesText() {
            return true;
        }
    }

    /**
     * Any pooled token of {@code dimension} whose payload satisfies {@code predicate}.
     */
    record PredicateItem<P extends DimensionPayload>(Dimension<P> dimension, Predicate<P> predicate)
            implements PatternItem {

        public PredicateItem {
            Objects.requireNonNull(dimension, "dimension");
            Objects.requireNonNull(predicate, "predicate");
        }

        public boolean accepts(Token token) {
            return token.payloadAs(dimension).map(predicate::test).orElse(false);
        }

        @Override
        public boolean matchesText() {
            return false;
        }

        @Override
        public String toString() {
            return "dimension(" + dimension.name() + ")";
        }
    }

    /**
     * Numeral tokens with {@code low <= value < high}.
     */
    record NumericRangeItem(double low, double high) implements PatternItem {

        public boolean accepts(Token token) {
            return token.payloadAs(Dimensions.NUMERAL)
                    .map(NumeralData::value)
                    .map(v -> v >= low && v < high)
                    .orElse(false);
        }

        @Override
        public boolean matchesText() {
            return false;
        }
    }

    /**
     * Rejects items that can never match. Called when a rule set is loaded.
     */
    static void validate(PatternItem item, String ruleName) {
        if (item instanceof LiteralSetItem literals) {
            if (literals.forms().isEmpty() || literals.forms().containsKey("")) {
                throw new RuleConfigurationException("Rule '" + ruleName + "' has an empty literal set or literal");
            }
        } else if (item instanceof NumericRangeItem range) {
            if (!(range.low() < range.high())) {
                throw new RuleConfigurationException("Rule '" + ruleName + "' has an empty numeric range ["
                        + range.low() + ", " + range.high() + ")");
            }
        } else if (item instanceof RegexItem regex) {
            if (regex.pattern().matcher("").matches()) {
                throw new RuleConfigurationException("Rule '" + ruleName + "' has a regex matching the empty string: "
                        + regex.pattern().pattern());
            }
        } else if (!(item instanceof PredicateItem<?>)) {
            throw new IllegalStateException("Unhandled pattern item: " + item);
        }
    }

    static List<PatternItem> requireItems(List<PatternItem> items, String ruleName) {
        if (items == null || items.isEmpty()) {
            throw new RuleConfigurationException("Rule '" + ruleName + "' has an empty pattern");
        }
        if (items.stream().anyMatch(Objects::isNull)) {
            throw new RuleConfigurationException("Rule '" + ruleName + "' has a null pattern item");
        }
        return List.copyOf(items);
    }
}
