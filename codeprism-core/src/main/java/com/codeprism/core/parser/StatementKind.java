package com.codeprism.core.parser;

/**
 * Kinds of Python statements distinguished by the parser.
 *
 * <p>Clause keywords of a compound statement ({@code elif}, {@code else},
 * {@code except}, {@code finally}) are sibling statements of their opener,
 * mirroring how they appear in the token stream. {@code async def/for/with}
 * map to their synchronous kinds.
 */
public enum StatementKind {
    IF(true),
    ELIF(true),
    ELSE(true),
    FOR(true),
    WHILE(true),
    TRY(true),
    EXCEPT(true),
    FINALLY(true),
    WITH(true),
    MATCH(true),
    CASE(true),
    DEF(true),
    CLASS(true),
    /** {@code return} statement */
    RETURN(false),
    /** statement starting with {@code yield} */
    YIELD(false),
    /** {@code import} or {@code from ... import} */
    IMPORT(false),
    /** decorator line preceding a {@code def} or {@code class} */
    DECORATOR(false),
    /** any other simple statement */
    SIMPLE(false);

    private final boolean compound;

    StatementKind(boolean compound) {
        this.compound = compound;
    }

    /**
     * @return true if statements of this kind own an indented block
     */
    public boolean isCompound() {
        return compound;
    }

    /**
     * Control blocks add one nesting level to the statements inside them.
     *
     * @return true for branch, loop, exception and context-manager blocks
     */
    public boolean isControlBlock() {
        return compound && this != DEF && this != CLASS && this != MATCH;
    }
}
