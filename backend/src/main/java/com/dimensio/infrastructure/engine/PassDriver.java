package com.dimensio.infrastructure.engine;

import com.dimensio.domain.extraction.model.Token;
import com.dimensio.domain.extraction.rule.Rule;
import com.dimensio.domain.extraction.rule.RuleSet;
import com.dimensio.infrastructure.engine.TokenPool.PoolSnapshot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Runs passes of every rule over a document until nothing new is found.
 * <p>
 * All attempts of a pass read the snapshot taken before it, and their tokens
 * are merged once the pass is over, in rule declaration order. The final pool
 * therefore does not depend on the order attempts run in, which lets a pass
 * fan out over the engine executor.
 * </p>
 * Stops at the first pass that adds nothing, after as many passes as there
 * are rules, after {@code engine.max-passes}, or when
 * {@code engine.max-invocations} runs out. An exhausted invocation budget
 * discards the pass in flight and returns the pool of the last complete pass.
 */
@Slf4j
@Component
public class PassDriver {

    private final RuleMatcher matcher;
    private final Executor executor;
    private final int maxPasses;
    private final long maxInvocations;
    private final int parallelism;

    public PassDriver(RuleMatcher matcher,
                      @Qualifier("engineExecutor") Executor executor,
                      @Value("${engine.max-passes:0}") int maxPasses,
                      @Value("${engine.max-invocations:0}") long maxInvocations,
                      @Value("${engine.parallelism:1}") int parallelism) {
        this.matcher = matcher;
        this.executor = executor;
        this.maxPasses = maxPasses;
        this.maxInvocations = maxInvocations;
        this.parallelism = parallelism;
    }

    public PassOutcome run(RuleSet ruleSet, Document document) {
        TokenPool pool = new TokenPool();
        Budget budget = new Budget(maxInvocations);

        int bound = Math.max(1, ruleSet.size());
        boolean passCapped = maxPasses > 0 && maxPasses < bound;
        if (passCapped) {
            bound = maxPasses;
        }

        int completed = 0;
        boolean fixpoint = false;
        for (int pass = 1; pass <= bound; pass++) {
            PoolSnapshot snapshot = pool.snapshot();
            List<List<Token>> results = runPass(ruleSet, document, snapshot, pass, budget);

            if (budget.exhausted()) {
                log.warn("[PassDriver] Invocation budget of {} exhausted in pass {}, returning {} tokens from pass {}",
                        maxInvocations, pass, pool.size(), completed);
                return new PassOutcome(pool, completed, budget.used(), false, true);
            }

            int added = 0;
            for (List<Token> produced : results) {
                for (Token token : produced) {
                    if (pool.add(token)) {
                        added++;
                    }
                }
            }
            completed = pass;
            log.debug("[PassDriver] Pass {} added {} tokens (pool={})", pass, added, pool.size());

            if (added == 0) {
                fixpoint = true;
                break;
            }
        }

        boolean exhausted = !fixpoint && passCapped;
        if (exhausted) {
            log.warn("[PassDriver] Pass budget of {} reached before fixpoint, returning {} tokens", maxPasses, pool.size());
        }
        return new PassOutcome(pool, completed, budget.used(), fixpoint, exhausted);
    }

    /**
     * Tokens produced by each rule in declaration order; the list for a rule
     * skipped in this pass is empty.
     */
    private List<List<Token>> runPass(RuleSet ruleSet, Document document, PoolSnapshot snapshot, int pass,
                                      Budget budget) {
        List<Rule> rules = ruleSet.rules();
        if (parallelism <= 1) {
            List<List<Token>> results = new ArrayList<>(rules.size());
            for (int i = 0; i < rules.size(); i++) {
                results.add(attempt(rules.get(i), i, document, snapshot, pass, budget));
            }
            return results;
        }

        List<CompletableFuture<List<Token>>> futures = new ArrayList<>(rules.size());
        for (int i = 0; i < rules.size(); i++) {
            Rule rule = rules.get(i);
            int ruleIndex = i;
            futures.add(CompletableFuture.supplyAsync(
                    () -> attempt(rule, ruleIndex, document, snapshot, pass, budget), executor));
        }
        return futures.stream().map(CompletableFuture::join).toList();
    }

    private List<Token> attempt(Rule rule, int ruleIndex, Document document, PoolSnapshot snapshot, int pass,
                                Budget budget) {
        // Text-only rules cannot see tokens, so a second attempt would only repeat the first.
        if (pass > 1 && rule.textOnly()) {
            return List.of();
        }

        List<Token> produced = new ArrayList<>();
        if (rule.first().matchesText()) {
            for (int offset = 0; offset < document.length(); offset++) {
                if (!budget.tryAcquire()) {
                    return List.of();
                }
                produced.addAll(matcher.match(rule, ruleIndex, offset, document, snapshot, pass));
            }
        } else {
            for (int offset : snapshot.starts()) {
                if (!budget.tryAcquire()) {
                    return List.of();
                }
                produced.addAll(matcher.match(rule, ruleIndex, offset, document, snapshot, pass));
            }
        }
        return produced;
    }

    /**
     * Matcher invocation budget shared by the tasks of one parse. Zero means unlimited.
     */
    private static final class Budget {

        private final long limit;
        private final AtomicLong used = new AtomicLong();
        private final AtomicBoolean exhausted = new AtomicBoolean();

        private Budget(long limit) {
            this.limit = limit;
        }

        boolean tryAcquire() {
            if (exhausted.get()) {
                return false;
            }
            if (limit > 0 && used.incrementAndGet() > limit) {
                exhausted.set(true);
                return false;
            }
            if (limit <= 0) {
                used.incrementAndGet();
            }
            return true;
        }

        boolean exhausted() {
            return exhausted.get();
        }

        long used() {
            return Math.min(used.get(), limit > 0 ? limit : Long.MAX_VALUE);
        }
    }
}
