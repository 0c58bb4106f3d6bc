package com.codeprism.core.analyzer;

import com.codeprism.core.AnalysisException;

/**
 * Thrown when a function body uses a construct the complexity analyzer cannot score.
 *
 * <p>Never escapes the analyzer: the affected entity falls back to baseline
 * complexity and the message is recorded as a report warning.
 */
public class UnsupportedConstructException extends AnalysisException {

    private final int line;

    public UnsupportedConstructException(String message, int line) {
        super(message);
        this.line = line;
    }

    /**
     * @return 1-indexed line of the offending construct
     */
    public int getLine() {
        return line;
    }
}
