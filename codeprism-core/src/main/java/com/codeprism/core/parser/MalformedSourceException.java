package com.codeprism.core.parser;

import com.codeprism.core.AnalysisException;

/**
 * Thrown when the input cannot be parsed at all.
 *
 * <p>Fatal for the run: no report is produced for a source unit that raises it.
 * The location is the one a Python parser would report, so the message can be
 * surfaced to the user verbatim.
 */
public class MalformedSourceException extends AnalysisException {

    private final int line;
    private final int column;
    private final String reason;

    public MalformedSourceException(String reason, int line, int column) {
        super("line " + line + ", column " + column + ": " + reason);
        this.reason = reason;
        this.line = line;
        this.column = column;
    }

    /**
     * @return 1-indexed line of the error
     */
    public int getLine() {
        return line;
    }

    /**
     * @return 1-indexed column of the error
     */
    public int getColumn() {
        return column;
    }

    /**
     * @return the parser message without location prefix
     */
    public String getReason() {
        return reason;
    }
}
