package com.dimensio.domain.extraction.model;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Typed key for a semantic category of extracted value.
 * <p>
 * A dimension names its payload type and the dimensions whose tokens its
 * rules compose from. Requesting a dimension pulls the rules of its
 * dependencies into the rule set; their tokens stay internal unless they were
 * requested too. Internal dimensions are never part of the default output.
 * </p>
 * Equality is by name, so a dimension can be declared once and referenced
 * from any rule book.
 */
public final class Dimension<P extends DimensionPayload> {

    private final String name;
    private final Class<P> payloadType;
    private final List<Dimension<?>> dependencies;
    private final boolean internal;

    private Dimension(String name, Class<P> payloadType, List<Dimension<?>> dependencies, boolean internal) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Dimension name is required");
        }
        this.name = name;
        this.payloadType = Objects.requireNonNull(payloadType, "payloadType");
        this.dependencies = List.copyOf(dependencies);
        this.internal = internal;
    }

    public static <P extends DimensionPayload> Dimension<P> of(String name, Class<P> payloadType,
                                                              Dimension<?>... dependencies) {
        return new Dimension<>(name, payloadType, List.of(dependencies), false);
    }

    public static <P extends DimensionPayload> Dimension<P> internal(String name, Class<P> payloadType,
                                                                    Dimension<?>... dependencies) {
        return new Dimension<>(name, payloadType, List.of(dependencies), true);
    }

    public String name() {
        return name;
    }

    public Class<P> payloadType() {
        return payloadType;
    }

    public List<Dimension<?>> dependencies() {
        return dependencies;
    }

    public boolean isInternal() {
        return internal;
    }

    public boolean accepts(DimensionPayload payload) {
        return payload != null && equals(payload.dimension()) && payloadType.isInstance(payload);
    }

    public P cast(DimensionPayload payload) {
        if (!accepts(payload)) {
            throw new IllegalStateException("Payload " + payload + " does not belong to dimension " + name);
        }
        return payloadType.cast(payload);
    }

    /**
     * This dimension followed by its transitive dependencies, breadth first.
     */
    public Set<Dimension<?>> closure() {
        Set<Dimension<?>> seen = new LinkedHashSet<>();
        Deque<Dimension<?>> queue = new ArrayDeque<>();
        queue.add(this);
        while (!queue.isEmpty()) {
            Dimension<?> next = queue.poll();
            if (seen.add(next)) {
                queue.addAll(next.dependencies);
            }
        }
        return Collections.unmodifiableSet(seen);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Dimension<?> other)) return false;
        return name.equals(other.name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public String toString() {
        return name;
    }
}
