package com.codeprism.core.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Parsed form of one source unit: the token stream and the statement tree built over it.
 *
 * @param source the text that was parsed
 * @param tokens full token stream, ending with {@link TokenType#ENDMARKER}
 * @param statements top-level statements in source order
 */
public record SourceTree(
    String source,
    List<Token> tokens,
    List<Statement> statements
) {
    public SourceTree {
        Objects.requireNonNull(source, "source must not be null");
        tokens = tokens != null ? List.copyOf(tokens) : List.of();
        statements = statements != null ? List.copyOf(statements) : List.of();
    }

    /**
     * Flattens the tree into a depth-first list of statements.
     *
     * @return every statement in source order
     */
    public List<Statement> allStatements() {
        List<Statement> result = new ArrayList<>();
        for (Statement statement : statements) {
            statement.walk(result::add);
        }
        return result;
    }
}
