package com.codeprism.core.parser;

import java.util.Objects;

/**
 * A single lexical token.
 *
 * @param type token category
 * @param text exact source text (empty for synthetic INDENT/DEDENT/ENDMARKER tokens)
 * @param line 1-indexed line where the token starts
 * @param column 1-indexed column where the token starts
 * @param endLine 1-indexed line where the token ends (differs from {@code line} for multi-line strings)
 */
public record Token(
    TokenType type,
    String text,
    int line,
    int column,
    int endLine
) {
    public Token {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(text, "text must not be null");
    }

    public boolean isName() {
        return type == TokenType.NAME;
    }

    public boolean isName(String name) {
        return type == TokenType.NAME && text.equals(name);
    }

    public boolean isOp(String op) {
        return type == TokenType.OP && text.equals(op);
    }

    @Override
    public String toString() {
        return type + "('" + text + "')@" + line + ":" + column;
    }
}
