package com.codeprism.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * Call edge between two functions or methods.
 *
 * @param from calling function
 * @param to called function
 */
@JsonPropertyOrder({"from", "to"})
public record DataPath(
    @JsonProperty("from") String from,
    @JsonProperty("to") String to
) {
    public DataPath {
        Objects.requireNonNull(from, "from must not be null");
        Objects.requireNonNull(to, "to must not be null");
    }
}
