package com.codeprism.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.regex.Pattern;

/**
 * Identifier naming conventions recognised by the quality scorer.
 */
public enum NamingConvention {
    SNAKE_CASE("snake_case", Pattern.compile("_*[a-z][a-z0-9]*(_[a-z0-9]+)*_*")),
    CAMEL_CASE("camelCase", Pattern.compile("_*[a-z][a-z0-9]*([A-Z][a-z0-9]*)+")),
    PASCAL_CASE("PascalCase", Pattern.compile("_*[A-Z][a-z0-9]+([A-Z][a-z0-9]*)*")),
    /** No convention is dominant, or there was nothing to classify */
    MIXED("mixed", null);

    private final String label;
    private final Pattern pattern;

    NamingConvention(String label, Pattern pattern) {
        this.label = label;
        this.pattern = pattern;
    }

    @JsonValue
    public String label() {
        return label;
    }

    /**
     * Classifies an identifier. Conventions are checked in declaration order, so a
     * single lowercase word counts as snake_case.
     *
     * @param identifier name to classify
     * @return matching convention, or {@link #MIXED} if none matches
     */
    public static NamingConvention classify(String identifier) {
        for (NamingConvention convention : values()) {
            if (convention.pattern != null && convention.pattern.matcher(identifier).matches()) {
                return convention;
            }
        }
        return MIXED;
    }
}
