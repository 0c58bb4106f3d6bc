package com.codeprism.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kinds of named code units extracted from a source file.
 */
public enum EntityKind {
    /** Top-level function */
    FUNCTION("function"),
    /** Function defined directly in a class body */
    METHOD("method"),
    /** Top-level class */
    CLASS("class");

    private final String label;

    EntityKind(String label) {
        this.label = label;
    }

    /**
     * @return lowercase label used in reports
     */
    @JsonValue
    public String label() {
        return label;
    }

    /**
     * @return true for functions and methods
     */
    public boolean isCallable() {
        return this != CLASS;
    }
}
