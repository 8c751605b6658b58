package com.dimensio.infrastructure.engine.resolve;

import com.dimensio.domain.extraction.model.Dimension;
import com.dimensio.domain.extraction.model.DimensionPayload;
import com.dimensio.domain.extraction.model.ResolutionContext;
import com.dimensio.domain.extraction.model.value.ResolvedValue;

import java.util.function.BiFunction;

/**
 * Converts the payload of one dimension into its caller-facing value.
 * Must be pure.
 */
public interface ValueResolver<P extends DimensionPayload> {

    Dimension<P> dimension();

    ResolvedValue resolve(P payload, ResolutionContext context);

    /**
     * False when the payload has no value in this context. Such tokens are
     * dropped before selection.
     */
    default boolean resolvable(P payload, ResolutionContext context) {
        return true;
    }

    static <P extends DimensionPayload> ValueResolver<P> of(Dimension<P> dimension,
                                                            BiFunction<P, ResolutionContext, ResolvedValue> function) {
        return new ValueResolver<>() {
            @Override
            public Dimension<P> dimension() {
                return dimension;
            }

            @Override
            public ResolvedValue resolve(P payload, ResolutionContext context) {
                return function.apply(payload, context);
            }
        };
    }
}
