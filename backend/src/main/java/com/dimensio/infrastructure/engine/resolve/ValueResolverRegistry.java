package com.dimensio.infrastructure.engine.resolve;

import com.dimensio.domain.extraction.model.Dimension;
import com.dimensio.domain.extraction.model.DimensionPayload;
import com.dimensio.domain.extraction.model.Dimensions;
import com.dimensio.domain.extraction.model.ResolutionContext;
import com.dimensio.domain.extraction.model.Token;
import com.dimensio.domain.extraction.model.value.ResolvedValue;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Value resolvers by dimension. Every public built-in dimension must have one.
 */
@Slf4j
@Component
public class ValueResolverRegistry {

    private final Map<Dimension<?>, ValueResolver<?>> resolvers = new HashMap<>();

    public ValueResolverRegistry(List<ValueResolver<?>> resolvers) {
        for (ValueResolver<?> resolver : resolvers) {
            ValueResolver<?> previous = this.resolvers.put(resolver.dimension(), resolver);
            if (previous != null) {
                throw new IllegalStateException("Two value resolvers registered for dimension " + resolver.dimension());
            }
        }
        for (Dimension<?> dimension : Dimensions.builtIn()) {
            if (!dimension.isInternal() && !this.resolvers.containsKey(dimension)) {
                throw new UnhandledDimensionException("No value resolver for dimension " + dimension);
            }
        }
        log.info("[Resolvers] {} value resolvers registered", this.resolvers.size());
    }

    public Set<Dimension<?>> dimensions() {
        return Set.copyOf(resolvers.keySet());
    }

    public ResolvedValue resolve(Token token, ResolutionContext context) {
        ValueResolver<?> resolver = resolvers.get(token.dimension());
        if (resolver == null) {
            throw new UnhandledDimensionException("No value resolver for dimension " + token.dimension());
        }
        return apply(resolver, token.payload(), context);
    }

    /**
     * Whether the token has a value in this context. Dimensions without a
     * resolver are internal and always pass.
     */
    public boolean resolvable(Token token, ResolutionContext context) {
        ValueResolver<?> resolver = resolvers.get(token.dimension());
        return resolver == null || test(resolver, token.payload(), context);
    }

    private static <P extends DimensionPayload> boolean test(ValueResolver<P> resolver,
                                                             DimensionPayload payload,
                                                             ResolutionContext context) {
        return resolver.resolvable(resolver.dimension().cast(payload), context);
    }

    private static <P extends DimensionPayload> ResolvedValue apply(ValueResolver<P> resolver,
                                                                    DimensionPayload payload,
                                                                    ResolutionContext context) {
        return resolver.resolve(resolver.dimension().cast(payload), context);
    }
}
