package com.codeprism.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * File-level complexity totals.
 *
 * @param totalCyclomatic sum over functions and methods
 * @param totalCognitive sum over functions and methods
 * @param averageCyclomatic total divided by function+method count, 0 when there are none
 * @param averageCognitive total divided by function+method count, 0 when there are none
 * @param complexityDensity total cyclomatic divided by non-empty lines, 0 for an empty file
 */
@JsonPropertyOrder({"total_cyclomatic", "total_cognitive", "average_cyclomatic", "average_cognitive",
    "complexity_density"})
public record OverallComplexity(
    @JsonProperty("total_cyclomatic") int totalCyclomatic,
    @JsonProperty("total_cognitive") double totalCognitive,
    @JsonProperty("average_cyclomatic") double averageCyclomatic,
    @JsonProperty("average_cognitive") double averageCognitive,
    @JsonProperty("complexity_density") double complexityDensity
) {}
