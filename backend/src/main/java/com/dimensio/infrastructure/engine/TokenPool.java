package com.dimensio.infrastructure.engine;

import com.dimensio.domain.extraction.model.Token;
import com.dimensio.domain.extraction.model.TokenKey;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * Every token discovered so far for one document, indexed by start offset.
 * The pool only grows. Adding a token whose (span, dimension, payload) is
 * already present leaves the size unchanged; a non-latent duplicate replaces
 * a latent one.
 * <p>
 * Not thread-safe: the pass driver mutates it only between passes, while
 * matcher tasks read a {@link #snapshot()}.
 * </p>
 */
public final class TokenPool {

    private final Map<TokenKey, Token> tokens = new LinkedHashMap<>();
    private final NavigableMap<Integer, List<Token>> byStart = new TreeMap<>();

    /**
     * @return true if the pool grew
     */
    public boolean add(Token token) {
        TokenKey key = token.key();
        Token existing = tokens.get(key);
        if (existing == null) {
            tokens.put(key, token);
            byStart.computeIfAbsent(token.start(), s -> new ArrayList<>()).add(token);
            return true;
        }
        if (existing.latent() && !token.latent()) {
            tokens.put(key, token);
            List<Token> atStart = byStart.get(token.start());
            atStart.set(atStart.indexOf(existing), token);
        }
        return false;
    }

    public int size() {
        return tokens.size();
    }

    public boolean isEmpty() {
        return tokens.isEmpty();
    }

    public boolean contains(TokenKey key) {
        return tokens.containsKey(key);
    }

    /** Tokens in insertion order. */
    public List<Token> tokens() {
        return List.copyOf(tokens.values());
    }

    public PoolSnapshot snapshot() {
        NavigableMap<Integer, List<Token>> copy = new TreeMap<>();
        byStart.forEach((start, list) -> copy.put(start, List.copyOf(list)));
        return new PoolSnapshot(Collections.unmodifiableNavigableMap(copy), tokens.size());
    }

    /**
     * Read-only view of the pool as it was before a pass.
     */
    public record PoolSnapshot(NavigableMap<Integer, List<Token>> byStart, int size) {

        public static PoolSnapshot empty() {
            return new PoolSnapshot(Collections.emptyNavigableMap(), 0);
        }

        public List<Token> startingAt(int offset) {
            return byStart.getOrDefault(offset, List.of());
        }

        public Iterable<Integer> starts() {
            return byStart.keySet();
        }
    }
}
