package com.codeprism.core.analyzer.pattern;

import java.util.Objects;
import java.util.function.Predicate;

/**
 * One named boolean heuristic.
 *
 * @param category group the flag is reported under (e.g., "attention_mechanism")
 * @param flag flag name within the category (e.g., "multi_head")
 * @param description one-line explanation shown by {@code codeprism list probes}
 * @param predicate evidence test, must be free of side effects
 */
public record PatternProbe(
    String category,
    String flag,
    String description,
    Predicate<PatternContext> predicate
) {
    public PatternProbe {
        Objects.requireNonNull(category, "category must not be null");
        Objects.requireNonNull(flag, "flag must not be null");
        Objects.requireNonNull(predicate, "predicate must not be null");
        description = description != null ? description : "";
    }

    /**
     * @return {@code category.flag}
     */
    public String key() {
        return category + "." + flag;
    }

    /**
     * @param context source unit under analysis
     * @return true if evidence was found
     */
    public boolean test(PatternContext context) {
        return predicate.test(context);
    }
}
