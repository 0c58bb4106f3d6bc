package com.codeprism.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Objects;

/**
 * Syntactic return labels of a function or method.
 *
 * @param function qualified name
 * @param returns one label per return/yield statement, in source order
 */
@JsonPropertyOrder({"function", "returns"})
public record ExitPoint(
    @JsonProperty("function") String function,
    @JsonProperty("returns") List<String> returns
) {
    public ExitPoint {
        Objects.requireNonNull(function, "function must not be null");
        returns = returns != null ? List.copyOf(returns) : List.of();
    }
}
