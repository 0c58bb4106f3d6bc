package com.codeprism.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Root configuration for CodePrism runs.
 *
 * <p>Loaded from {@code codeprism.yaml}. Every section and every value is optional;
 * anything left out takes its default.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * complexity:
 *   cognitive_multiplier: 1.5
 *   nesting_increment: 0.5
 *   max_nesting_depth: 25
 *
 * quality:
 *   docstring_weight: 0.3
 *   naming_weight: 0.2
 *   length_weight: 0.2
 *   complexity_weight: 0.3
 *   complexity_cutoff: 5.0
 *   function_length_cutoff: 30.0
 *
 * output:
 *   directory: "./codeprism-output"
 *   diagrams: true
 *   summary: true
 * }</pre>
 *
 * @param complexity complexity scoring constants
 * @param quality quality weights and cutoffs
 * @param output output settings used by the CLI
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AnalyzerConfig(
    @JsonProperty("complexity") ComplexitySettings complexity,
    @JsonProperty("quality") QualitySettings quality,
    @JsonProperty("output") OutputSettings output
) {
    public AnalyzerConfig {
        complexity = complexity != null ? complexity : ComplexitySettings.defaults();
        quality = quality != null ? quality : QualitySettings.defaults();
        output = output != null ? output : OutputSettings.defaults();
    }

    /**
     * Creates the default configuration.
     *
     * @return default configuration
     */
    public static AnalyzerConfig defaults() {
        return new AnalyzerConfig(ComplexitySettings.defaults(), QualitySettings.defaults(), OutputSettings.defaults());
    }

    /**
     * Complexity scoring constants.
     *
     * <p>Cognitive complexity of a function is
     * {@code cognitiveMultiplier * (1 + sum(1 + nestingIncrement * depth))} over its
     * decision points. With no nesting this equals {@code cognitiveMultiplier * cyclomatic}.
     *
     * @param cognitiveMultiplier flat multiplier applied to the cognitive sum
     * @param nestingIncrement extra weight per enclosing block
     * @param maxNestingDepth deeper bodies are not scored and fall back to baseline values
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ComplexitySettings(
        @JsonProperty("cognitive_multiplier") Double cognitiveMultiplier,
        @JsonProperty("nesting_increment") Double nestingIncrement,
        @JsonProperty("max_nesting_depth") Integer maxNestingDepth
    ) {
        public static final double DEFAULT_COGNITIVE_MULTIPLIER = 1.5;
        public static final double DEFAULT_NESTING_INCREMENT = 0.5;
        public static final int DEFAULT_MAX_NESTING_DEPTH = 25;

        public ComplexitySettings {
            cognitiveMultiplier = cognitiveMultiplier != null ? cognitiveMultiplier : DEFAULT_COGNITIVE_MULTIPLIER;
            nestingIncrement = nestingIncrement != null ? nestingIncrement : DEFAULT_NESTING_INCREMENT;
            maxNestingDepth = maxNestingDepth != null ? maxNestingDepth : DEFAULT_MAX_NESTING_DEPTH;
            if (cognitiveMultiplier <= 0) {
                throw new IllegalArgumentException("cognitive_multiplier must be positive, got " + cognitiveMultiplier);
            }
            if (nestingIncrement < 0) {
                throw new IllegalArgumentException("nesting_increment must not be negative, got " + nestingIncrement);
            }
            if (maxNestingDepth < 1) {
                throw new IllegalArgumentException("max_nesting_depth must be at least 1, got " + maxNestingDepth);
            }
        }

        public static ComplexitySettings defaults() {
            return new ComplexitySettings(null, null, null);
        }
    }

    /**
     * Quality weights and normalization cutoffs.
     *
     * <p>Weights must be non-negative and add up to 1 so that the overall score stays in [0,1].
     *
     * @param docstringWeight weight of docstring coverage
     * @param namingWeight weight of naming consistency
     * @param lengthWeight weight of the function length score
     * @param complexityWeight weight of the complexity score
     * @param complexityCutoff complexity ratio above which the complexity score drops
     * @param functionLengthCutoff average function length above which the length score drops
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record QualitySettings(
        @JsonProperty("docstring_weight") Double docstringWeight,
        @JsonProperty("naming_weight") Double namingWeight,
        @JsonProperty("length_weight") Double lengthWeight,
        @JsonProperty("complexity_weight") Double complexityWeight,
        @JsonProperty("complexity_cutoff") Double complexityCutoff,
        @JsonProperty("function_length_cutoff") Double functionLengthCutoff
    ) {
        private static final double WEIGHT_TOLERANCE = 1e-6;

        public QualitySettings {
            docstringWeight = docstringWeight != null ? docstringWeight : 0.3;
            namingWeight = namingWeight != null ? namingWeight : 0.2;
            lengthWeight = lengthWeight != null ? lengthWeight : 0.2;
            complexityWeight = complexityWeight != null ? complexityWeight : 0.3;
            complexityCutoff = complexityCutoff != null ? complexityCutoff : 5.0;
            functionLengthCutoff = functionLengthCutoff != null ? functionLengthCutoff : 30.0;

            if (docstringWeight < 0 || namingWeight < 0 || lengthWeight < 0 || complexityWeight < 0) {
                throw new IllegalArgumentException("quality weights must not be negative");
            }
            double sum = docstringWeight + namingWeight + lengthWeight + complexityWeight;
            if (Math.abs(sum - 1.0) > WEIGHT_TOLERANCE) {
                throw new IllegalArgumentException("quality weights must add up to 1, got " + sum);
            }
            if (complexityCutoff <= 0 || functionLengthCutoff <= 0) {
                throw new IllegalArgumentException("quality cutoffs must be positive");
            }
        }

        public static QualitySettings defaults() {
            return new QualitySettings(null, null, null, null, null, null);
        }
    }

    /**
     * Output settings.
     *
     * @param directory output directory path
     * @param diagrams whether to write Mermaid diagrams
     * @param summary whether to write the Markdown summary
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record OutputSettings(
        @JsonProperty("directory") String directory,
        @JsonProperty("diagrams") Boolean diagrams,
        @JsonProperty("summary") Boolean summary
    ) {
        public OutputSettings {
            directory = directory != null ? directory : "./codeprism-output";
            diagrams = diagrams != null ? diagrams : true;
            summary = summary != null ? summary : true;
        }

        public static OutputSettings defaults() {
            return new OutputSettings(null, null, null);
        }
    }
}
