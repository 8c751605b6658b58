package com.dimensio.infrastructure.preprocessing;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TextNormalizerTest {

    private TextNormalizer normalizer;

    @BeforeEach
    void setUp() {
        normalizer = new TextNormalizer();
    }

    @Test
    @DisplayName("null and empty input pass through")
    void nullAndEmpty() {
        assertThat(normalizer.normalize(null)).isNull();
        assertThat(normalizer.normalize("")).isEmpty();
    }

    @Test
    @DisplayName("invisible characters become spaces in place")
    void invisibleCharacters() {
        String input = "twenty\u200Bone\uFEFF";

        String normalized = normalizer.normalize(input);

        assertThat(normalized).isEqualTo("twenty one ");
        assertThat(normalized).hasSameSizeAs(input);
    }

    @Test
    @DisplayName("no-break and typographic spaces become plain spaces")
    void unicodeSpaces() {
        assertThat(normalizer.normalize("5\u00A0km\u2009now")).isEqualTo("5 km now");
    }

    @Test
    @DisplayName("line breaks and tabs are kept")
    void whitespaceKept() {
        String input = "line one\r\nline\ttwo";

        assertThat(normalizer.normalize(input)).isEqualTo(input);
    }

    @Test
    @DisplayName("control characters are rejected")
    void controlCharacters() {
        assertThatThrownBy(() -> normalizer.normalize("five\u0007"))
                .isInstanceOf(MalformedInputTextException.class)
                .hasMessageContaining("control");
    }

    @Test
    @DisplayName("unpaired surrogates are rejected with their offset")
    void unpairedSurrogate() {
        assertThatThrownBy(() -> normalizer.normalize("ab\uD800c"))
                .isInstanceOf(MalformedInputTextException.class)
                .hasMessageContaining("offset 2");
        assertThat(normalizer.normalize("ok \uD83D\uDE00")).isEqualTo("ok \uD83D\uDE00");
    }
}
