package com.codeprism.core.analyzer.pattern;

import com.codeprism.core.model.EntityInventory;
import com.codeprism.core.model.PatternFlags;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Evaluates a probe registry against a source unit.
 */
public class PatternDetector {

    private static final Logger log = LoggerFactory.getLogger(PatternDetector.class);

    private final PatternRegistry registry;

    public PatternDetector() {
        this(PatternRegistry.builtins());
    }

    public PatternDetector(PatternRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
    }

    public PatternFlags detect(EntityInventory inventory) {
        PatternFlags flags = registry.evaluate(PatternContext.of(inventory));
        log.debug("Evaluated {} pattern probes", registry.probes().size());
        return flags;
    }

    public PatternRegistry registry() {
        return registry;
    }
}
