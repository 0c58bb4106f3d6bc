package com.codeprism.core.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * A node of the statement tree.
 *
 * <p>For compound statements {@code tokens} holds the header up to (not including)
 * the block colon and {@code body} holds the block. For simple statements
 * {@code tokens} holds the whole statement without the terminating newline or
 * semicolon, and {@code body} is empty.
 *
 * @param kind statement kind
 * @param tokens header or statement tokens, starting with the keyword (after {@code async})
 * @param body nested block, empty for simple statements
 * @param decorators decorator lines preceding a {@code def} or {@code class}
 * @param startLine 1-indexed line of the first header token
 * @param endLine 1-indexed line of the last token of the statement, body included
 */
public record Statement(
    StatementKind kind,
    List<Token> tokens,
    List<Statement> body,
    List<Statement> decorators,
    int startLine,
    int endLine
) {
    public Statement {
        Objects.requireNonNull(kind, "kind must not be null");
        tokens = tokens != null ? List.copyOf(tokens) : List.of();
        body = body != null ? List.copyOf(body) : List.of();
        decorators = decorators != null ? List.copyOf(decorators) : List.of();
    }

    /**
     * Returns the name declared by a {@code def} or {@code class} header.
     *
     * @return declared name, or null for other kinds
     */
    public String declaredName() {
        if (kind != StatementKind.DEF && kind != StatementKind.CLASS) {
            return null;
        }
        return tokens.get(1).text();
    }

    /**
     * A block starts with a docstring when its first statement is a lone string
     * expression that is neither an f-string nor a bytes literal.
     *
     * @return true if the body opens with a documentation string
     */
    public boolean hasDocstring() {
        if (body.isEmpty()) {
            return false;
        }
        Statement first = body.get(0);
        if (first.kind != StatementKind.SIMPLE || first.tokens.isEmpty()) {
            return false;
        }
        for (Token token : first.tokens) {
            if (token.type() != TokenType.STRING || hasPrefix(token.text(), 'f') || hasPrefix(token.text(), 'b')) {
                return false;
            }
        }
        return true;
    }

    /**
     * Visits this statement and every statement nested in its body, depth first,
     * in source order. Decorators are not visited.
     *
     * @param visitor callback for each statement
     */
    public void walk(Consumer<Statement> visitor) {
        visitor.accept(this);
        for (Statement child : body) {
            child.walk(visitor);
        }
    }

    /**
     * Collects the tokens of this statement, its decorators and its whole body in source order.
     *
     * @return all tokens covered by this statement
     */
    public List<Token> allTokens() {
        List<Token> result = new ArrayList<>();
        for (Statement decorator : decorators) {
            result.addAll(decorator.tokens);
        }
        result.addAll(tokens);
        for (Statement child : body) {
            result.addAll(child.allTokens());
        }
        return result;
    }

    // Checks the prefix letters before the opening quote, in either case
    private static boolean hasPrefix(String text, char prefix) {
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '"' || c == '\'') {
                return false;
            }
            if (Character.toLowerCase(c) == prefix) {
                return true;
            }
        }
        return false;
    }
}
