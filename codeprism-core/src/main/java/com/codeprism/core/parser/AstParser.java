package com.codeprism.core.parser;

/**
 * Common interface for source parsers.
 *
 * <p>Parsers turn source text into a {@link SourceTree} that every analysis stage
 * consumes, so the text is tokenized and parsed exactly once per run.
 *
 * <p><b>Usage Example:</b></p>
 * <pre>{@code
 * AstParser parser = new PythonParser();
 * SourceTree tree = parser.parseString(source);
 * }</pre>
 *
 * @see PythonParser
 */
public interface AstParser {

    /**
     * Parses a string of source code.
     *
     * @param sourceCode source code to parse
     * @return parsed tree
     * @throws MalformedSourceException if the text cannot be parsed
     */
    SourceTree parseString(String sourceCode);

    /**
     * Gets the language this parser supports.
     *
     * @return language identifier (e.g., "python")
     */
    String getLanguage();
}
