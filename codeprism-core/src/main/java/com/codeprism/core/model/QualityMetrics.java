package com.codeprism.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * Code quality block of a report.
 *
 * @param docstringCoverage documented functions+methods over functions+methods, in [0,1]
 * @param namingConsistency share of identifiers following the dominant convention, in [0,1]
 * @param averageFunctionLength mean lines per function/method
 * @param complexityRatio total cyclomatic complexity per function/method
 * @param overallQuality weighted blend of the normalized signals, in [0,1]
 * @param dominantNamingConvention most frequent convention
 */
@JsonPropertyOrder({"docstring_coverage", "naming_consistency", "average_function_length", "complexity_ratio",
    "overall_quality", "dominant_naming_convention"})
public record QualityMetrics(
    @JsonProperty("docstring_coverage") double docstringCoverage,
    @JsonProperty("naming_consistency") double namingConsistency,
    @JsonProperty("average_function_length") double averageFunctionLength,
    @JsonProperty("complexity_ratio") double complexityRatio,
    @JsonProperty("overall_quality") double overallQuality,
    @JsonProperty("dominant_naming_convention") NamingConvention dominantNamingConvention
) {
    public QualityMetrics {
        Objects.requireNonNull(dominantNamingConvention, "dominantNamingConvention must not be null");
        requireUnit("docstringCoverage", docstringCoverage);
        requireUnit("namingConsistency", namingConsistency);
        requireUnit("overallQuality", overallQuality);
        if (averageFunctionLength < 0 || complexityRatio < 0) {
            throw new IllegalArgumentException("averageFunctionLength and complexityRatio must not be negative");
        }
    }

    private static void requireUnit(String field, double value) {
        // Small tolerance for floating point sums of weights
        if (value < 0 || value > 1 + 1e-9) {
            throw new IllegalArgumentException(field + " must be in [0,1], got " + value);
        }
    }
}
