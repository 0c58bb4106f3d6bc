package com.codeprism.core.parser.antlr;

import org.antlr.v4.runtime.Parser;
import org.antlr.v4.runtime.TokenStream;

/**
 * Base class for the Python parser with the lookahead checks used by
 * {@code match} statement patterns.
 */
public abstract class Python3ParserBase extends Parser {

    protected Python3ParserBase(TokenStream input) {
        super(input);
    }

    /**
     * A number is a whole literal pattern only when it does not start a complex literal.
     */
    protected boolean cannotBePlusMinus() {
        int next = _input.LA(1);
        return next != Python3Parser.ADD && next != Python3Parser.MINUS;
    }

    /**
     * A name is a capture target only when no attribute access, class pattern or keyword follows.
     */
    protected boolean cannotBeDotLpEq() {
        int next = _input.LA(1);
        return next != Python3Parser.DOT && next != Python3Parser.OPEN_PAREN && next != Python3Parser.ASSIGN;
    }
}
