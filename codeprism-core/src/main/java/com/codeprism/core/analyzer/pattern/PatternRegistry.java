package com.codeprism.core.analyzer.pattern;

import com.codeprism.core.model.PatternFlags;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable, ordered table of pattern probes.
 *
 * <p>Adding a probe returns a new registry and leaves the existing probes
 * untouched. Flags are reported in registration order, grouped by category in
 * the order categories first appear.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * PatternRegistry registry = PatternRegistry.builtins()
 *     .with(new PatternProbe("io", "file_access", "opens files", ctx -> ctx.hasName(Set.of("open"))));
 * }</pre>
 */
public final class PatternRegistry {

    private final List<PatternProbe> probes;

    private PatternRegistry(List<PatternProbe> probes) {
        this.probes = List.copyOf(probes);
    }

    /**
     * @return registry with the built-in probes
     */
    public static PatternRegistry builtins() {
        return new PatternRegistry(BuiltinProbes.all());
    }

    /**
     * @return registry without probes
     */
    public static PatternRegistry empty() {
        return new PatternRegistry(List.of());
    }

    /**
     * @param probe probe to add
     * @return new registry with the probe appended
     * @throws IllegalArgumentException if a probe with the same category and flag exists
     */
    public PatternRegistry with(PatternProbe probe) {
        for (PatternProbe existing : probes) {
            if (existing.key().equals(probe.key())) {
                throw new IllegalArgumentException("Probe already registered: " + probe.key());
            }
        }
        List<PatternProbe> extended = new ArrayList<>(probes);
        extended.add(probe);
        return new PatternRegistry(extended);
    }

    public List<PatternProbe> probes() {
        return probes;
    }

    /**
     * Runs every probe once.
     *
     * @param context source unit under analysis
     * @return flags grouped by category
     */
    public PatternFlags evaluate(PatternContext context) {
        Map<String, Map<String, Boolean>> categories = new LinkedHashMap<>();
        for (PatternProbe probe : probes) {
            categories.computeIfAbsent(probe.category(), k -> new LinkedHashMap<>())
                .put(probe.flag(), probe.test(context));
        }
        return new PatternFlags(categories);
    }
}
