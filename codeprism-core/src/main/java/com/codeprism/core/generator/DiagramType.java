package com.codeprism.core.generator;

import java.util.Locale;

/**
 * Types of documents that can be generated from a report.
 */
public enum DiagramType {
    /** Classes with their methods and class-to-class dependencies */
    CLASS_DIAGRAM,

    /** Classes as groups of methods, free functions, and references between them */
    ARCHITECTURE,

    /** Call paths between functions and methods */
    COMPONENT_FLOW,

    /** Human-readable summary of metrics, complexity, quality and patterns */
    SUMMARY;

    /**
     * @return file name stem (e.g., "class-diagram")
     */
    public String fileStem() {
        return name().toLowerCase(Locale.ROOT).replace('_', '-');
    }
}
