package com.codeprism.core.generator;

import java.util.Objects;

/**
 * One generated document and the diagram type it renders.
 *
 * @param type diagram type, which also fixes the file name stem
 * @param content document content
 * @param fileExtension file extension without leading dot
 */
public record GeneratedDiagram(
    DiagramType type,
    String content,
    String fileExtension
) {
    public GeneratedDiagram {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(content, "content must not be null");
        Objects.requireNonNull(fileExtension, "fileExtension must not be null");
    }

    /**
     * @return file name stem (e.g., "class-diagram")
     */
    public String name() {
        return type.fileStem();
    }

    public String fileName() {
        return name() + "." + fileExtension;
    }
}
