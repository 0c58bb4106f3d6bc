package com.codeprism.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * Data-flow block of a report.
 *
 * @param entryPoints parameters of every function/method
 * @param exitPoints return labels of functions/methods that return or yield
 * @param dataPaths call edges between functions/methods
 */
@JsonPropertyOrder({"entry_points", "exit_points", "data_paths"})
public record DataFlowSummary(
    @JsonProperty("entry_points") List<EntryPoint> entryPoints,
    @JsonProperty("exit_points") List<ExitPoint> exitPoints,
    @JsonProperty("data_paths") List<DataPath> dataPaths
) {
    public DataFlowSummary {
        entryPoints = entryPoints != null ? List.copyOf(entryPoints) : List.of();
        exitPoints = exitPoints != null ? List.copyOf(exitPoints) : List.of();
        dataPaths = dataPaths != null ? List.copyOf(dataPaths) : List.of();
    }
}
