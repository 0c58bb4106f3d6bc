package com.codeprism.cli;

import com.codeprism.core.parser.MalformedSourceException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reading and error reporting shared by the commands that take source files.
 */
final class SourceFiles {

    private static final char BYTE_ORDER_MARK = '\uFEFF';
    private static final String PYTHON_EXTENSION = ".py";

    private SourceFiles() {
    }

    /**
     * Reads a UTF-8 source file, dropping a leading byte order mark.
     *
     * @param file source file
     * @return file text
     * @throws IOException if the file cannot be read or is not valid UTF-8
     */
    static String read(Path file) throws IOException {
        String source = Files.readString(file, StandardCharsets.UTF_8);
        if (!source.isEmpty() && source.charAt(0) == BYTE_ORDER_MARK) {
            return source.substring(1);
        }
        return source;
    }

    /**
     * @param file source file
     * @param e parse failure
     * @return {@code file:line:column: reason}
     */
    static String describe(Path file, MalformedSourceException e) {
        return file + ":" + e.getLine() + ":" + e.getColumn() + ": " + e.getReason();
    }

    /**
     * @param file source file
     * @return file name without a {@code .py} extension
     */
    static String stem(Path file) {
        String name = file.getFileName().toString();
        return name.endsWith(PYTHON_EXTENSION) && name.length() > PYTHON_EXTENSION.length()
            ? name.substring(0, name.length() - PYTHON_EXTENSION.length())
            : name;
    }
}
