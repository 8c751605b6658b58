package com.dimensio.infrastructure.pipeline;

import com.dimensio.domain.extraction.model.ParseResult;
import com.dimensio.domain.extraction.model.ParseStats;
import com.dimensio.domain.extraction.model.ResolutionContext;
import com.dimensio.domain.extraction.model.ResolvedSpan;
import com.dimensio.domain.extraction.model.Token;
import com.dimensio.domain.extraction.rule.RuleSet;
import com.dimensio.infrastructure.engine.Document;
import com.dimensio.infrastructure.engine.PassDriver;
import com.dimensio.infrastructure.engine.PassOutcome;
import com.dimensio.infrastructure.engine.SpanSelector;
import com.dimensio.infrastructure.engine.resolve.ValueResolverRegistry;
import com.dimensio.infrastructure.preprocessing.TextNormalizer;
import com.dimensio.infrastructure.rules.RuleSetRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Orchestrates one parse:
 * <p>
 * normalize → rule set for (locale, dimensions) → passes to fixpoint → select → resolve
 * </p>
 * Tokens without a value in the parse's context never reach selection.
 * Spans index the caller's text; the normalizer never moves characters.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ExtractionPipeline {

    private final TextNormalizer textNormalizer;
    private final RuleSetRegistry ruleSetRegistry;
    private final PassDriver passDriver;
    private final SpanSelector spanSelector;
    private final ValueResolverRegistry valueResolverRegistry;

    public ParseResult execute(String text, ResolutionContext context) {
        long started = System.nanoTime();

        // 1. Preprocess
        Document document = new Document(textNormalizer.normalize(text));

        // 2. Discover tokens
        RuleSet ruleSet = ruleSetRegistry.ruleSet(context.locale(), context.dimensions());
        PassOutcome outcome = passDriver.run(ruleSet, document);

        // 3. Select and resolve
        List<Token> candidates = outcome.pool().tokens().stream()
                .filter(token -> valueResolverRegistry.resolvable(token, context))
                .toList();
        List<Token> selected = spanSelector.select(candidates, context);
        List<ResolvedSpan> spans = selected.stream()
                .map(token -> new ResolvedSpan(
                        token.start(),
                        token.end(),
                        token.dimension(),
                        text.substring(token.start(), token.end()),
                        valueResolverRegistry.resolve(token, context),
                        token.latent()))
                .toList();

        long latencyMs = (System.nanoTime() - started) / 1_000_000;
        ParseStats stats = new ParseStats(outcome.passes(), outcome.invocations(), outcome.pool().size(),
                spans.size(), outcome.fixpointReached(), outcome.budgetExhausted(), latencyMs);

        log.info("[Pipeline] locale={}, chars={}, rules={}, passes={}, pool={}, selected={}, fixpoint={}, exhausted={}, {}ms",
                context.locale(), text.length(), ruleSet.size(), stats.passes(), stats.poolSize(),
                stats.selectedCount(), stats.fixpointReached(), stats.budgetExhausted(), latencyMs);

        return new ParseResult(spans, stats);
    }
}
