package com.codeprism.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Boolean pattern flags grouped by category.
 *
 * <p>Serialized as a plain nested object, e.g.
 * {@code {"neural_network": {"layers": true, ...}, ...}}.
 *
 * @param categories category to (flag to value), in registration order
 */
public record PatternFlags(
    @JsonValue Map<String, Map<String, Boolean>> categories
) {
    public PatternFlags {
        Map<String, Map<String, Boolean>> copy = new LinkedHashMap<>();
        if (categories != null) {
            categories.forEach((category, flags) ->
                copy.put(category, Collections.unmodifiableMap(new LinkedHashMap<>(flags))));
        }
        categories = Collections.unmodifiableMap(copy);
    }

    /**
     * @param category category name
     * @param flag flag name
     * @return flag value, false if the flag is not defined
     */
    public boolean isSet(String category, String flag) {
        return categories.getOrDefault(category, Map.of()).getOrDefault(flag, false);
    }

    /**
     * @param category category name
     * @return true if any flag in the category is set
     */
    public boolean anySet(String category) {
        return categories.getOrDefault(category, Map.of()).containsValue(true);
    }
}
