package com.codeprism.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Complexity of one function or method.
 *
 * @param cyclomatic decision points plus one, never below 1
 * @param cognitive nesting-weighted score
 * @param lines lines spanned by the definition
 * @param degraded true if the body could not be scored and baseline values were used
 */
@JsonPropertyOrder({"cyclomatic", "cognitive", "lines"})
public record ComplexityScore(
    @JsonProperty("cyclomatic") int cyclomatic,
    @JsonProperty("cognitive") double cognitive,
    @JsonProperty("lines") int lines,
    @JsonIgnore boolean degraded
) {
    public ComplexityScore {
        if (cyclomatic < 1) {
            throw new IllegalArgumentException("cyclomatic must be at least 1, got " + cyclomatic);
        }
        if (cognitive < 0) {
            throw new IllegalArgumentException("cognitive must not be negative, got " + cognitive);
        }
    }
}
