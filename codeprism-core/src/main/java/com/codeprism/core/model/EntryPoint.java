package com.codeprism.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Objects;

/**
 * Declared inputs of a function or method.
 *
 * @param function qualified name
 * @param parameters parameter names
 */
@JsonPropertyOrder({"function", "parameters"})
public record EntryPoint(
    @JsonProperty("function") String function,
    @JsonProperty("parameters") List<String> parameters
) {
    public EntryPoint {
        Objects.requireNonNull(function, "function must not be null");
        parameters = parameters != null ? List.copyOf(parameters) : List.of();
    }
}
