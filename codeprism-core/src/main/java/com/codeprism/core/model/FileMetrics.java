package com.codeprism.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * File-level counts.
 *
 * @param totalLines number of lines in the source text
 * @param nonEmptyLines lines containing at least one non-whitespace character
 * @param characterCount number of Unicode code points
 * @param importCount import statements at any depth
 * @param classCount top-level classes
 * @param functionCount top-level functions plus methods
 */
@JsonPropertyOrder({"total_lines", "non_empty_lines", "character_count", "import_count", "class_count", "function_count"})
public record FileMetrics(
    @JsonProperty("total_lines") int totalLines,
    @JsonProperty("non_empty_lines") int nonEmptyLines,
    @JsonProperty("character_count") int characterCount,
    @JsonProperty("import_count") int importCount,
    @JsonProperty("class_count") int classCount,
    @JsonProperty("function_count") int functionCount
) {
    public FileMetrics {
        if (totalLines < 0 || nonEmptyLines < 0 || characterCount < 0
                || importCount < 0 || classCount < 0 || functionCount < 0) {
            throw new IllegalArgumentException("metrics must not be negative");
        }
        if (nonEmptyLines > totalLines) {
            throw new IllegalArgumentException("nonEmptyLines exceeds totalLines");
        }
    }
}
