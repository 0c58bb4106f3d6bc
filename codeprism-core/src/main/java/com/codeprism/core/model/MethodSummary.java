package com.codeprism.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Objects;

/**
 * Method entry in a class complexity block.
 *
 * @param name bare method name
 * @param args parameter names without the receiver
 * @param lineCount lines spanned by the method
 */
@JsonPropertyOrder({"name", "args", "line_count"})
public record MethodSummary(
    @JsonProperty("name") String name,
    @JsonProperty("args") List<String> args,
    @JsonProperty("line_count") int lineCount
) {
    public MethodSummary {
        Objects.requireNonNull(name, "name must not be null");
        args = args != null ? List.copyOf(args) : List.of();
    }
}
