package com.dimensio.domain.extraction.model;

import java.util.Objects;
import java.util.Optional;

/**
 * Immutable unit of discovered meaning: a span of the document, a payload of
 * a fixed dimension, and the rule that produced it.
 *
 * @param span       covered region of the document
 * @param payload    dimension-specific data
 * @param latent     true if produced by a low-confidence rule
 * @param provenance producing rule and pass
 */
public record Token(Span span, DimensionPayload payload, boolean latent, Provenance provenance) {

    public Token {
        Objects.requireNonNull(span, "span");
        Objects.requireNonNull(payload, "payload");
        Objects.requireNonNull(provenance, "provenance");
        Objects.requireNonNull(payload.dimension(), "payload dimension");
    }

    public Dimension<?> dimension() {
        return payload.dimension();
    }

    public int start() {
        return span.start();
    }

    public int end() {
        return span.end();
    }

    public TokenKey key() {
        return new TokenKey(span, dimension(), payload);
    }

    public boolean is(Dimension<?> dimension) {
        return dimension().equals(dimension);
    }

    public <P extends DimensionPayload> Optional<P> payloadAs(Dimension<P> dimension) {
        return dimension.accepts(payload) ? Optional.of(dimension.payloadType().cast(payload)) : Optional.empty();
    }

    /**
     * Payload cast to the given dimension's type.
     *
     * @throws IllegalStateException if the token belongs to another dimension
     */
    public <P extends DimensionPayload> P payload(Dimension<P> dimension) {
        return dimension.cast(payload);
    }
}
