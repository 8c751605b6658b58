package com.dimensio.infrastructure.engine;

import com.dimensio.domain.extraction.model.Provenance;
import com.dimensio.domain.extraction.model.Span;
import com.dimensio.domain.extraction.model.Token;
import com.dimensio.domain.extraction.model.payload.NumeralData;
import com.dimensio.domain.extraction.model.payload.TemperatureData;
import com.dimensio.infrastructure.engine.TokenPool.PoolSnapshot;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TokenPoolTest {

    private TokenPool pool;

    @BeforeEach
    void setUp() {
        pool = new TokenPool();
    }

    @Test
    @DisplayName("inserting the same (span, dimension, payload) twice keeps one token")
    void idempotentInsertion() {
        Token first = numeral(0, 2, 12, "a", 1);
        Token duplicate = numeral(0, 2, 12, "b", 2);

        assertThat(pool.add(first)).isTrue();
        assertThat(pool.add(duplicate)).isFalse();
        assertThat(pool.size()).isEqualTo(1);
        assertThat(pool.tokens()).containsExactly(first);
    }

    @Test
    @DisplayName("same span with another payload or dimension is a new token")
    void distinctIdentity() {
        pool.add(numeral(0, 2, 12, "a", 1));
        pool.add(numeral(0, 2, 13, "a", 1));
        pool.add(new Token(new Span(0, 2), new TemperatureData(12, null), false, new Provenance("t", 1, 1)));

        assertThat(pool.size()).isEqualTo(3);
    }

    @Test
    @DisplayName("a non-latent duplicate replaces a latent one without growing the pool")
    void firmReplacesLatent() {
        Token latent = new Token(new Span(0, 2), new TemperatureData(12, null), true, new Provenance("latent", 0, 1));
        Token firm = new Token(new Span(0, 2), new TemperatureData(12, null), false, new Provenance("firm", 1, 2));

        pool.add(latent);
        assertThat(pool.add(firm)).isFalse();

        assertThat(pool.size()).isEqualTo(1);
        assertThat(pool.tokens().get(0).latent()).isFalse();
        assertThat(pool.snapshot().startingAt(0)).containsExactly(firm);
    }

    @Test
    @DisplayName("snapshot is not affected by later insertions")
    void snapshotIsolation() {
        pool.add(numeral(0, 1, 1, "a", 1));
        PoolSnapshot snapshot = pool.snapshot();

        pool.add(numeral(2, 3, 2, "a", 2));

        assertThat(snapshot.size()).isEqualTo(1);
        assertThat(snapshot.startingAt(2)).isEmpty();
        assertThat(snapshot.starts()).containsExactly(0);
        assertThat(pool.snapshot().starts()).containsExactly(0, 2);
    }

    private static Token numeral(int start, int end, double value, String rule, int pass) {
        return new Token(new Span(start, end), NumeralData.of(value), false, new Provenance(rule, 0, pass));
    }
}
