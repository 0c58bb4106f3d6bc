package com.codeprism.core.model;

import java.util.Objects;

/**
 * Directed relation: {@code source} depends on {@code target}.
 *
 * @param source qualified name of the referencing entity
 * @param target qualified name of the referenced entity
 * @param kind edge origin
 */
public record DependencyEdge(
    String source,
    String target,
    EdgeKind kind
) {
    public DependencyEdge {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(target, "target must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        if (source.equals(target)) {
            throw new IllegalArgumentException("self-edge on " + source);
        }
    }
}
