package com.codeprism.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Complete, immutable result of analyzing one source unit.
 *
 * <p>The JSON field names and nesting form the contract with downstream consumers.
 * {@code warnings} lists entities whose complexity was degraded and is not part of
 * the serialized contract.
 *
 * @param metrics file-level counts
 * @param complexity per-function, per-class and overall complexity
 * @param dependencies dependency view per entity, keyed by qualified name
 * @param algorithms detected pattern flags
 * @param dataFlow entry points, exit points and data paths
 * @param codeQuality quality signals and composite score
 * @param warnings non-fatal analysis warnings
 */
@JsonPropertyOrder({"metrics", "complexity", "dependencies", "algorithms", "data_flow", "code_quality"})
public record AnalysisReport(
    @JsonProperty("metrics") FileMetrics metrics,
    @JsonProperty("complexity") ComplexityReport complexity,
    @JsonProperty("dependencies") Map<String, DependencyEntry> dependencies,
    @JsonProperty("algorithms") PatternFlags algorithms,
    @JsonProperty("data_flow") DataFlowSummary dataFlow,
    @JsonProperty("code_quality") QualityMetrics codeQuality,
    @JsonIgnore List<String> warnings
) {
    public AnalysisReport {
        Objects.requireNonNull(metrics, "metrics must not be null");
        Objects.requireNonNull(complexity, "complexity must not be null");
        Objects.requireNonNull(algorithms, "algorithms must not be null");
        Objects.requireNonNull(dataFlow, "dataFlow must not be null");
        Objects.requireNonNull(codeQuality, "codeQuality must not be null");
        dependencies = dependencies != null
            ? Collections.unmodifiableMap(new LinkedHashMap<>(dependencies))
            : Map.of();
        warnings = warnings != null ? List.copyOf(warnings) : List.of();
    }
}
