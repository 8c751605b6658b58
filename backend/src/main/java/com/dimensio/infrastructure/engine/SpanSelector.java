package com.dimensio.infrastructure.engine;

import com.dimensio.domain.extraction.model.ResolutionContext;
import com.dimensio.domain.extraction.model.Token;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * Picks the output tokens from a pool.
 * <p>
 * Only requested dimensions are considered. A latent token survives only if
 * no non-latent candidate overlaps it. Candidates are then taken strongest
 * first (longer span, earlier start, configured tie-break, stable payload
 * order) and a candidate is dropped when an already accepted one
 * <ul>
 *   <li>strictly contains it, whatever the dimensions, or</li>
 *   <li>overlaps it and has the same dimension, or the request is restricted
 *       to a single dimension.</li>
 * </ul>
 * Overlapping candidates of different dimensions therefore both survive
 * unless the caller asked for one dimension only.
 * </p>
 */
@Slf4j
@Component
public class SpanSelector {

    private static final Comparator<Token> OUTPUT_ORDER = Comparator
            .comparingInt(Token::start)
            .thenComparingInt(Token::end)
            .thenComparing(t -> t.dimension().name());

    private final Comparator<Token> strength;

    public SpanSelector(@Value("${engine.tie-break:RULE_DECLARATION_ORDER}") TieBreak tieBreak) {
        this.strength = Comparator
                .comparingInt((Token t) -> -t.span().length())
                .thenComparingInt(Token::start)
                .thenComparing(tieBreakOrder(tieBreak))
                .thenComparing(t -> t.dimension().name())
                .thenComparing(t -> t.payload().toString());
    }

    public List<Token> select(Collection<Token> pool, ResolutionContext context) {
        List<Token> requested = pool.stream()
                .filter(t -> context.wants(t.dimension()))
                .toList();

        List<Token> firm = requested.stream().filter(t -> !t.latent()).toList();
        List<Token> candidates = new ArrayList<>(firm);
        for (Token latent : requested) {
            if (latent.latent() && firm.stream().noneMatch(t -> t.span().overlaps(latent.span()))) {
                candidates.add(latent);
            }
        }
        candidates.sort(strength);

        List<Token> accepted = new ArrayList<>();
        for (Token candidate : candidates) {
            if (accepted.stream().noneMatch(winner -> beats(winner, candidate, context.singleDimension()))) {
                accepted.add(candidate);
            }
        }
        accepted.sort(OUTPUT_ORDER);

        log.debug("[Selector] {} of {} requested tokens selected", accepted.size(), requested.size());
        return accepted;
    }

    private static boolean beats(Token winner, Token candidate, boolean singleDimension) {
        if (!winner.span().overlaps(candidate.span())) {
            return false;
        }
        if (winner.span().strictlyContains(candidate.span())) {
            return true;
        }
        return singleDimension || winner.dimension().equals(candidate.dimension());
    }

    private static Comparator<Token> tieBreakOrder(TieBreak tieBreak) {
        Comparator<Token> declaration = Comparator.comparingInt(t -> t.provenance().ruleIndex());
        return switch (tieBreak) {
            case RULE_DECLARATION_ORDER -> declaration;
            case COMPOSITION_DEPTH -> Comparator.<Token>comparingInt(t -> -t.provenance().pass()).thenComparing(declaration);
        };
    }
}
