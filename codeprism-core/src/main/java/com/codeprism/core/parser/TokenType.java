package com.codeprism.core.parser;

/**
 * Lexical categories of {@link Token}. Keywords are reported as {@link #NAME}.
 */
public enum TokenType {
    /** Identifier or keyword */
    NAME,

    /** Integer, float, imaginary or based literal */
    NUMBER,

    /** String or bytes literal, including prefix and quotes */
    STRING,

    /** Operator or delimiter */
    OP,

    /** End of a logical line */
    NEWLINE,

    /** Indentation level increased */
    INDENT,

    /** Indentation level decreased */
    DEDENT,

    /** End of input */
    ENDMARKER
}
