package com.codeprism.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * Complexity rolled up over the methods of one class.
 *
 * @param methods methods in declaration order
 * @param totalCyclomatic sum of method cyclomatic scores (0 without methods)
 * @param totalCognitive sum of method cognitive scores
 * @param lines class span minus the spans of its methods
 */
@JsonPropertyOrder({"methods", "total_cyclomatic", "total_cognitive", "lines"})
public record ClassComplexity(
    @JsonProperty("methods") List<MethodSummary> methods,
    @JsonProperty("total_cyclomatic") int totalCyclomatic,
    @JsonProperty("total_cognitive") double totalCognitive,
    @JsonProperty("lines") int lines
) {
    public ClassComplexity {
        methods = methods != null ? List.copyOf(methods) : List.of();
    }
}
