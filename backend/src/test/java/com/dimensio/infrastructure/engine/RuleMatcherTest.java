package com.dimensio.infrastructure.engine;

import com.dimensio.domain.extraction.model.Provenance;
import com.dimensio.domain.extraction.model.Span;
import com.dimensio.domain.extraction.model.Token;
import com.dimensio.domain.extraction.model.payload.NumeralData;
import com.dimensio.domain.extraction.rule.Rule;
import com.dimensio.infrastructure.engine.TokenPool.PoolSnapshot;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static com.dimensio.domain.extraction.model.Dimensions.NUMERAL;
import static com.dimensio.domain.extraction.rule.Patterns.dimension;
import static com.dimensio.domain.extraction.rule.Patterns.numberWith;
import static com.dimensio.domain.extraction.rule.Patterns.regex;
import static org.assertj.core.api.Assertions.assertThat;

class RuleMatcherTest {

    private static final Rule NEGATIVE = Rule.named("negative")
            .pattern(regex("-"), dimension(NUMERAL))
            .produce(tokens -> Optional.of(NumeralData.of(-tokens.get(1).payload(NUMERAL).value())));

    private static final Rule SUM = Rule.named("sum")
            .pattern(dimension(NUMERAL), dimension(NUMERAL))
            .produce(tokens -> Optional.of(NumeralData.of(
                    tokens.get(0).payload(NUMERAL).value() + tokens.get(1).payload(NUMERAL).value())));

    private RuleMatcher matcher;

    @BeforeEach
    void setUp() {
        matcher = new RuleMatcher();
    }

    @Test
    @DisplayName("a regex item followed by a missing token matches nothing and raises nothing")
    void dashWithoutNumeral() {
        List<Token> produced = matcher.match(NEGATIVE, 0, 0, new Document("-"), PoolSnapshot.empty(), 1);

        assertThat(produced).isEmpty();
    }

    @Test
    @DisplayName("items may be separated by spaces, tabs or hyphens only")
    void adjacency() {
        Document spaced = new Document("- \t5");
        Document punctuated = new Document("-,5");

        assertThat(matcher.match(NEGATIVE, 0, 0, spaced, poolOf(numeral(3, 4, 5)), 1))
                .extracting(Token::span)
                .containsExactly(new Span(0, 4));
        assertThat(matcher.match(NEGATIVE, 0, 0, punctuated, poolOf(numeral(2, 3, 5)), 1)).isEmpty();
    }

    @Test
    @DisplayName("the first item starts exactly at the offset")
    void firstItemAnchored() {
        Document document = new Document(" 20 1");
        PoolSnapshot pool = poolOf(numeral(1, 3, 20), numeral(4, 5, 1));

        assertThat(matcher.match(SUM, 0, 0, document, pool, 2)).isEmpty();
        assertThat(matcher.match(SUM, 0, 1, document, pool, 2))
                .extracting(t -> t.payload(NUMERAL).value())
                .containsExactly(21d);
    }

    @Test
    @DisplayName("every route is explored when several tokens start at the same offset")
    void allRoutes() {
        Document document = new Document("20 1");
        PoolSnapshot pool = poolOf(numeral(0, 2, 20), numeral(0, 2, 2), numeral(3, 4, 1));

        List<Token> produced = matcher.match(SUM, 4, 0, document, pool, 2);

        assertThat(produced).extracting(t -> t.payload(NUMERAL).value()).containsExactly(21d, 3d);
        assertThat(produced).allSatisfy(t -> {
            assertThat(t.span()).isEqualTo(new Span(0, 4));
            assertThat(t.provenance()).isEqualTo(new Provenance("sum", 4, 2));
        });
    }

    @Test
    @DisplayName("a failing production is a guard failure, not an error")
    void failingProduction() {
        Rule failing = Rule.named("failing")
                .pattern(numberWith(nd -> true))
                .produce(tokens -> {
                    throw new ArithmeticException("boom");
                });

        assertThat(matcher.match(failing, 0, 0, new Document("7"), poolOf(numeral(0, 1, 7)), 2)).isEmpty();
    }

    @Test
    @DisplayName("latent rules produce latent tokens")
    void latentRule() {
        Rule latent = Rule.named("latent").pattern(regex("\\d")).latent()
                .produce(tokens -> Optional.of(NumeralData.of(1)));

        assertThat(matcher.match(latent, 0, 0, new Document("1"), PoolSnapshot.empty(), 1))
                .singleElement()
                .satisfies(t -> assertThat(t.latent()).isTrue());
    }

    private static Token numeral(int start, int end, double value) {
        return new Token(new Span(start, end), NumeralData.of(value), false, new Provenance("seed", 0, 1));
    }

    private static PoolSnapshot poolOf(Token... tokens) {
        TokenPool pool = new TokenPool();
        for (Token token : tokens) {
            pool.add(token);
        }
        return pool.snapshot();
    }
}
