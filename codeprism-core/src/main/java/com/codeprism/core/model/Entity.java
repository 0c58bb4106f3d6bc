package com.codeprism.core.model;

import com.codeprism.core.parser.Statement;

import java.util.List;
import java.util.Objects;

/**
 * A named code unit: function, method or class.
 *
 * <p>Created once per parse and never modified. Methods are identified by
 * {@link #qualifiedName()} ({@code Class.method}) because bare method names
 * repeat across classes.
 *
 * @param name declared name
 * @param kind entity kind
 * @param owner owning class name for methods, null otherwise
 * @param parameters parameter names in declaration order; a method's {@code self}/{@code cls} receiver is omitted
 * @param startLine 1-indexed line of the {@code def}/{@code class} keyword
 * @param endLine 1-indexed last line of the body
 * @param documented true if the body opens with a docstring
 * @param baseClasses base class expressions as written (classes only)
 * @param decorators decorator expressions without the {@code @} (e.g., "staticmethod")
 * @param definition parsed definition statement
 */
public record Entity(
    String name,
    EntityKind kind,
    String owner,
    List<String> parameters,
    int startLine,
    int endLine,
    boolean documented,
    List<String> baseClasses,
    List<String> decorators,
    Statement definition
) {
    public Entity {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(definition, "definition must not be null");
        if (kind == EntityKind.METHOD && owner == null) {
            throw new IllegalArgumentException("method " + name + " must have an owning class");
        }
        if (kind != EntityKind.METHOD && owner != null) {
            throw new IllegalArgumentException(kind.label() + " " + name + " cannot have an owning class");
        }
        if (endLine < startLine) {
            throw new IllegalArgumentException("endLine " + endLine + " precedes startLine " + startLine);
        }
        parameters = parameters != null ? List.copyOf(parameters) : List.of();
        baseClasses = baseClasses != null ? List.copyOf(baseClasses) : List.of();
        decorators = decorators != null ? List.copyOf(decorators) : List.of();
    }

    /**
     * @return {@code Owner.name} for methods, the bare name otherwise
     */
    public String qualifiedName() {
        return owner != null ? owner + "." + name : name;
    }

    /**
     * @return number of lines spanned by the definition, inclusive
     */
    public int lineCount() {
        return endLine - startLine + 1;
    }

    public boolean isCallable() {
        return kind.isCallable();
    }

    /**
     * Dunder names such as {@code __init__} are excluded from naming statistics.
     *
     * @return true if the name starts and ends with a double underscore
     */
    public boolean isDunder() {
        return name.length() > 4 && name.startsWith("__") && name.endsWith("__");
    }
}
