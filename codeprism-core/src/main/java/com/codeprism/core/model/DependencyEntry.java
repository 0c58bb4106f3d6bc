package com.codeprism.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Objects;

/**
 * Dependency view of one entity.
 *
 * @param type entity kind
 * @param dependsOn entities this one references, in inventory order
 * @param dependedBy entities referencing this one, in inventory order
 */
@JsonPropertyOrder({"type", "depends_on", "depended_by"})
public record DependencyEntry(
    @JsonProperty("type") EntityKind type,
    @JsonProperty("depends_on") List<String> dependsOn,
    @JsonProperty("depended_by") List<String> dependedBy
) {
    public DependencyEntry {
        Objects.requireNonNull(type, "type must not be null");
        dependsOn = dependsOn != null ? List.copyOf(dependsOn) : List.of();
        dependedBy = dependedBy != null ? List.copyOf(dependedBy) : List.of();
    }
}
