package com.codeprism.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Complexity block of a report.
 *
 * @param functions score per function/method, keyed by qualified name, in inventory order
 * @param classes rollup per class, in inventory order
 * @param overall file totals
 */
@JsonPropertyOrder({"functions", "classes", "overall"})
public record ComplexityReport(
    @JsonProperty("functions") Map<String, ComplexityScore> functions,
    @JsonProperty("classes") Map<String, ClassComplexity> classes,
    @JsonProperty("overall") OverallComplexity overall
) {
    public ComplexityReport {
        Objects.requireNonNull(overall, "overall must not be null");
        functions = functions != null ? Collections.unmodifiableMap(new LinkedHashMap<>(functions)) : Map.of();
        classes = classes != null ? Collections.unmodifiableMap(new LinkedHashMap<>(classes)) : Map.of();
    }
}
