package com.codeprism.core.analyzer;

import com.codeprism.core.config.AnalyzerConfig.QualitySettings;
import com.codeprism.core.model.ComplexityReport;
import com.codeprism.core.model.ComplexityScore;
import com.codeprism.core.model.Entity;
import com.codeprism.core.model.EntityInventory;
import com.codeprism.core.model.NamingConvention;
import com.codeprism.core.model.QualityMetrics;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Blends four signals into one quality score.
 *
 * <p><b>Signals:</b></p>
 * <ul>
 *   <li>docstring coverage: documented functions+methods / functions+methods</li>
 *   <li>naming consistency: share of function and method names (dunders excluded)
 *       following the dominant convention; ties go to the convention seen first</li>
 *   <li>length score: 1 up to the length cutoff, then {@code cutoff / average}</li>
 *   <li>complexity score: 1 up to the complexity cutoff, then {@code cutoff / ratio}</li>
 * </ul>
 *
 * <p>The overall score is the weighted sum with the configured weights. It never
 * decreases when coverage or consistency rise, and never increases when the
 * average length or complexity ratio rise.
 */
public class QualityScorer {

    private final QualitySettings settings;

    public QualityScorer() {
        this(QualitySettings.defaults());
    }

    public QualityScorer(QualitySettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
    }

    /**
     * @param inventory extracted entities
     * @param complexity complexity block of the same inventory
     * @return quality block
     */
    public QualityMetrics score(EntityInventory inventory, ComplexityReport complexity) {
        List<Entity> callables = inventory.callables();
        int count = callables.size();

        long documented = callables.stream().filter(Entity::documented).count();
        double docstringCoverage = count == 0 ? 0 : (double) documented / count;

        Naming naming = naming(callables);

        int totalLines = 0;
        int totalCyclomatic = 0;
        for (ComplexityScore score : complexity.functions().values()) {
            totalLines += score.lines();
            totalCyclomatic += score.cyclomatic();
        }
        double averageLength = count == 0 ? 0 : (double) totalLines / count;
        double complexityRatio = count == 0 ? 0 : (double) totalCyclomatic / count;

        double overall = overall(docstringCoverage, naming.consistency(), averageLength, complexityRatio);

        return new QualityMetrics(
            docstringCoverage,
            naming.consistency(),
            averageLength,
            complexityRatio,
            overall,
            naming.dominant()
        );
    }

    /**
     * Weighted blend of already computed signals.
     *
     * @param docstringCoverage in [0,1]
     * @param namingConsistency in [0,1]
     * @param averageLength mean lines per function
     * @param complexityRatio mean cyclomatic complexity per function
     * @return overall score in [0,1]
     */
    public double overall(double docstringCoverage, double namingConsistency,
                          double averageLength, double complexityRatio) {
        double lengthScore = belowCutoff(averageLength, settings.functionLengthCutoff());
        double complexityScore = belowCutoff(complexityRatio, settings.complexityCutoff());
        double blended = settings.docstringWeight() * docstringCoverage
            + settings.namingWeight() * namingConsistency
            + settings.lengthWeight() * lengthScore
            + settings.complexityWeight() * complexityScore;
        return Math.min(1.0, Math.max(0.0, blended));
    }

    private static double belowCutoff(double value, double cutoff) {
        return value <= cutoff ? 1.0 : cutoff / value;
    }

    private static Naming naming(List<Entity> callables) {
        Map<NamingConvention, Integer> counts = new LinkedHashMap<>();
        int identifiers = 0;
        for (Entity callable : callables) {
            if (callable.isDunder()) {
                continue;
            }
            identifiers++;
            NamingConvention convention = NamingConvention.classify(callable.name());
            if (convention != NamingConvention.MIXED) {
                counts.merge(convention, 1, Integer::sum);
            }
        }

        NamingConvention dominant = NamingConvention.MIXED;
        int best = 0;
        for (Map.Entry<NamingConvention, Integer> entry : counts.entrySet()) {
            // strictly greater keeps the first-seen convention on ties
            if (entry.getValue() > best) {
                dominant = entry.getKey();
                best = entry.getValue();
            }
        }
        double consistency = identifiers == 0 ? 0 : (double) best / identifiers;
        return new Naming(dominant, consistency);
    }

    private record Naming(NamingConvention dominant, double consistency) {}
}
