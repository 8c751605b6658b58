package com.dimensio.infrastructure.engine;

import com.dimensio.domain.extraction.model.DimensionPayload;
import com.dimensio.domain.extraction.model.Provenance;
import com.dimensio.domain.extraction.model.Span;
import com.dimensio.domain.extraction.model.Token;
import com.dimensio.domain.extraction.rule.PatternItem;
import com.dimensio.domain.extraction.rule.PatternItem.LiteralSetItem;
import com.dimensio.domain.extraction.rule.PatternItem.NumericRangeItem;
import com.dimensio.domain.extraction.rule.PatternItem.PredicateItem;
import com.dimensio.domain.extraction.rule.PatternItem.RegexItem;
import com.dimensio.domain.extraction.rule.Rule;
import com.dimensio.infrastructure.engine.TokenPool.PoolSnapshot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Attempts one rule at one start offset.
 * <p>
 * Items are satisfied in order, each starting where the previous one ended.
 * Between two items only adjacency separators may be skipped; the first item
 * starts exactly at the offset. Every alternative route is explored, since
 * several tokens may start at the same offset. Each complete route invokes the
 * production once; a declined production leaves no trace.
 * </p>
 * Stateless and pure: reads the document and a pool snapshot, returns new tokens.
 */
@Slf4j
@Component
public class RuleMatcher {

    /**
     * @param rule      rule to attempt
     * @param ruleIndex declaration index of the rule in its rule set
     * @param offset    start offset of the first item
     * @param document  document being parsed
     * @param pool      pool snapshot taken before the current pass
     * @param pass      1-based pass number, recorded as provenance
     * @return produced tokens, possibly empty, in route order
     */
    public List<Token> match(Rule rule, int ruleIndex, int offset, Document document, PoolSnapshot pool, int pass) {
        List<MatchCandidate> candidates = new ArrayList<>();
        extend(rule, 0, offset, document, pool, pass, new ArrayList<>(), candidates);
        if (candidates.isEmpty()) {
            return List.of();
        }

        List<Token> produced = new ArrayList<>(candidates.size());
        Provenance provenance = new Provenance(rule.name(), ruleIndex, pass);
        for (MatchCandidate candidate : candidates) {
            produce(rule, candidate).ifPresent(payload ->
                    produced.add(new Token(candidate.span(), payload, rule.latent(), provenance)));
        }
        return produced;
    }

    private void extend(Rule rule, int itemIndex, int position, Document document, PoolSnapshot pool, int pass,
                        List<Token> route, List<MatchCandidate> candidates) {
        if (itemIndex == rule.items().size()) {
            candidates.add(new MatchCandidate(rule.items(), List.copyOf(route)));
            return;
        }

        PatternItem item = rule.items().get(itemIndex);
        int lastStart = itemIndex == 0 ? position : document.skipSeparators(position);
        for (int start = position; start <= lastStart; start++) {
            for (Token token : matchItem(item, start, document, pool, pass)) {
                route.add(token);
                extend(rule, itemIndex + 1, token.end(), document, pool, pass, route, candidates);
                route.remove(route.size() - 1);
            }
        }
    }

    private List<Token> matchItem(PatternItem item, int start, Document document, PoolSnapshot pool, int pass) {
        if (item instanceof RegexItem regex) {
            return document.matchRegex(regex, start)
                    .map(capture -> List.of(captureToken(capture, pass)))
                    .orElse(List.of());
        } else if (item instanceof LiteralSetItem literals) {
            return document.matchLiteral(literals, start)
                    .map(capture -> List.of(captureToken(capture, pass)))
                    .orElse(List.of());
        } else if (item instanceof PredicateItem<?> predicate) {
            return pool.startingAt(start).stream().filter(predicate::accepts).toList();
        } else if (item instanceof NumericRangeItem range) {
            return pool.startingAt(start).stream().filter(range::accepts).toList();
        }
        throw new IllegalStateException("Unhandled pattern item: " + item);
    }

    private Optional<? extends DimensionPayload> produce(Rule rule, MatchCandidate candidate) {
        try {
            return rule.production().produce(candidate.tokens());
        } catch (RuntimeException e) {
            log.debug("[Matcher] Production of rule '{}' failed on {}, treating as no match",
                    rule.name(), candidate.span(), e);
            return Optional.empty();
        }
    }

    private static Token captureToken(Document.TextCapture capture, int pass) {
        return new Token(capture.span(), capture.match(), false, Provenance.capture(pass));
    }

    /**
     * One complete route through a rule's items: item i matched token i.
     */
    record MatchCandidate(List<PatternItem> items, List<Token> tokens) {

        Span span() {
            return new Span(tokens.get(0).start(), tokens.get(tokens.size() - 1).end());
        }
    }
}
