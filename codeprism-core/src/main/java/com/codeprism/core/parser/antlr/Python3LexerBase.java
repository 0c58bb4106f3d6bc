package com.codeprism.core.parser.antlr;

import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.CommonToken;
import org.antlr.v4.runtime.Lexer;
import org.antlr.v4.runtime.Token;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Base class for the Python lexer.
 *
 * <p>Turns line breaks into the token structure Python's grammar expects:
 * one NEWLINE per logical line, INDENT and DEDENT around blocks, nothing for
 * blank lines, comment lines or breaks inside brackets. At end of input the
 * last logical line is closed and every open block is dedented.
 *
 * <p>Inconsistent dedents and nesting beyond the limits Python itself enforces
 * are reported to the lexer's error listeners.
 */
public abstract class Python3LexerBase extends Lexer {

    /** Python rejects a block nested deeper than this. */
    public static final int MAX_INDENT_LEVELS = 100;

    /** Python rejects brackets nested deeper than this. */
    public static final int MAX_OPEN_BRACKETS = 200;

    private static final int TAB_SIZE = 8;

    private final Deque<Token> pending = new ArrayDeque<>();
    private final Deque<Integer> indents = new ArrayDeque<>();
    private int opened;
    private boolean endOfInputSeen;
    private Token lastEmitted;

    protected Python3LexerBase(CharStream input) {
        super(input);
    }

    @Override
    public void emit(Token token) {
        super.emit(token);
        pending.offer(token);
        if (token.getType() != Token.EOF) {
            lastEmitted = token;
        }
    }

    @Override
    public Token nextToken() {
        Token next = super.nextToken();
        if (next.getType() == EOF && !endOfInputSeen) {
            endOfInputSeen = true;
            // The closing tokens go before EOF
            pending.removeIf(token -> token.getType() == EOF);
            closeOpenBlocks();
            pending.offer(next);
        }
        return pending.isEmpty() ? next : pending.poll();
    }

    @Override
    public void reset() {
        super.reset();
        pending.clear();
        indents.clear();
        opened = 0;
        endOfInputSeen = false;
        lastEmitted = null;
    }

    protected boolean atStartOfInput() {
        return getCharPositionInLine() == 0 && getLine() == 1;
    }

    protected void openBrace() {
        opened++;
        if (opened > MAX_OPEN_BRACKETS) {
            reportError("too many nested parentheses");
        }
    }

    protected void closeBrace() {
        if (opened > 0) {
            opened--;
        }
    }

    protected void onNewLine() {
        String text = getText();
        String lineBreak = text.replaceAll("[^\r\n\f]+", "");
        String spaces = text.replaceAll("[\r\n\f]+", "");
        int next = _input.LA(1);

        // Blank lines, comment-only lines and breaks inside brackets carry no structure
        if (opened > 0 || next == EOF || next == '\r' || next == '\n' || next == '\f' || next == '#') {
            skip();
            return;
        }

        int indent = indentationOf(spaces);
        if (lastEmitted == null && indent == 0) {
            // No logical line precedes this one
            skip();
            return;
        }

        CommonToken newLine = syntheticToken(Python3Lexer.NEWLINE, lineBreak);
        newLine.setLine(_tokenStartLine);
        newLine.setCharPositionInLine(_tokenStartCharPositionInLine);
        emit(newLine);
        int previous = indents.isEmpty() ? 0 : indents.peek();
        if (indent == previous) {
            skip();
        } else if (indent > previous) {
            if (indents.size() >= MAX_INDENT_LEVELS) {
                reportError("too many levels of indentation");
            }
            indents.push(indent);
            emit(syntheticToken(Python3Lexer.INDENT, spaces));
        } else {
            while (!indents.isEmpty() && indents.peek() > indent) {
                indents.pop();
                emit(syntheticToken(Python3Lexer.DEDENT, ""));
            }
            int restored = indents.isEmpty() ? 0 : indents.peek();
            if (restored != indent) {
                reportError("unindent does not match any outer indentation level");
            }
        }
    }

    private void closeOpenBlocks() {
        if (lastEmitted != null && lastEmitted.getType() != Python3Lexer.NEWLINE) {
            emit(syntheticToken(Python3Lexer.NEWLINE, ""));
        }
        while (!indents.isEmpty()) {
            indents.pop();
            emit(syntheticToken(Python3Lexer.DEDENT, ""));
        }
    }

    static int indentationOf(String spaces) {
        int count = 0;
        for (char ch : spaces.toCharArray()) {
            if (ch == '\t') {
                count += TAB_SIZE - (count % TAB_SIZE);
            } else {
                count++;
            }
        }
        return count;
    }

    private CommonToken syntheticToken(int type, String text) {
        int stop = getCharIndex() - 1;
        int start = text.isEmpty() ? stop : stop - text.length() + 1;
        CommonToken token = new CommonToken(_tokenFactorySourcePair, type, DEFAULT_TOKEN_CHANNEL, start, stop);
        token.setText(text);
        return token;
    }

    private void reportError(String message) {
        getErrorListenerDispatch().syntaxError(this, null, getLine(), getCharPositionInLine(), message, null);
    }
}
