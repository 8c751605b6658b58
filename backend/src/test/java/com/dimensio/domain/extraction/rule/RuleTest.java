package com.dimensio.domain.extraction.rule;

import com.dimensio.domain.extraction.model.payload.NumeralData;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.dimensio.domain.extraction.model.Dimensions.NUMERAL;
import static com.dimensio.domain.extraction.rule.Patterns.dimension;
import static com.dimensio.domain.extraction.rule.Patterns.literals;
import static com.dimensio.domain.extraction.rule.Patterns.numberBetween;
import static com.dimensio.domain.extraction.rule.Patterns.regex;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RuleTest {

    private static final Production ONE = tokens -> Optional.of(NumeralData.of(1));

    @Nested
    @DisplayName("Malformed rules are rejected at load time")
    class Validation {

        @Test
        @DisplayName("empty pattern")
        void emptyPattern() {
            assertThatThrownBy(() -> new Rule("empty", List.of(), ONE, false))
                    .isInstanceOf(RuleConfigurationException.class)
                    .hasMessageContaining("empty pattern");
        }

        @Test
        @DisplayName("regex syntax error")
        void badRegex() {
            assertThatThrownBy(() -> regex("(unclosed"))
                    .isInstanceOf(RuleConfigurationException.class)
                    .hasMessageContaining("(unclosed");
        }

        @Test
        @DisplayName("stray parenthesis is not hidden by wrapping")
        void strayParenthesis() {
            assertThatThrownBy(() -> regex("a)("))
                    .isInstanceOf(RuleConfigurationException.class);
        }

        @Test
        @DisplayName("regex matching the empty string")
        void emptyMatchingRegex() {
            assertThatThrownBy(() -> Rule.named("optional").pattern(regex("a?")).produce(ONE))
                    .isInstanceOf(RuleConfigurationException.class)
                    .hasMessageContaining("empty string");
        }

        @Test
        @DisplayName("empty literal set")
        void emptyLiteralSet() {
            assertThatThrownBy(() -> Rule.named("nothing").pattern(literals(Map.of())).produce(ONE))
                    .isInstanceOf(RuleConfigurationException.class);
        }

        @Test
        @DisplayName("inverted numeric range")
        void invertedRange() {
            assertThatThrownBy(() -> Rule.named("range").pattern(numberBetween(10, 1)).produce(ONE))
                    .isInstanceOf(RuleConfigurationException.class)
                    .hasMessageContaining("empty numeric range");
        }

        @Test
        @DisplayName("missing production")
        void missingProduction() {
            assertThatThrownBy(() -> new Rule("no production", List.of(regex("a")), null, false))
                    .isInstanceOf(RuleConfigurationException.class);
        }
    }

    @Test
    @DisplayName("builder keeps item order and latent flag")
    void builder() {
        Rule rule = Rule.named("latent pair")
                .pattern(dimension(NUMERAL), regex("x"))
                .latent()
                .produce(ONE);

        assertThat(rule.items()).hasSize(2);
        assertThat(rule.first()).isInstanceOf(PatternItem.PredicateItem.class);
        assertThat(rule.latent()).isTrue();
        assertThat(rule.textOnly()).isFalse();
    }

    @Test
    @DisplayName("rules made only of text items are text-only")
    void textOnly() {
        Rule rule = Rule.named("words").pattern(regex("a"), literals(Map.of("b", 1d))).produce(ONE);

        assertThat(rule.textOnly()).isTrue();
    }

    @Test
    @DisplayName("literal sets are tried longest first, lower-cased")
    void literalOrder() {
        PatternItem.LiteralSetItem item = literals(Map.of("Six", 6d, "Sixteen", 16d));

        assertThat(item.forms().keySet()).containsExactly("sixteen", "six");
    }
}
