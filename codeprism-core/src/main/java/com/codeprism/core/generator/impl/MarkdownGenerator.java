package com.codeprism.core.generator.impl;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.codeprism.core.generator.DiagramGenerator;
import com.codeprism.core.generator.DiagramType;
import com.codeprism.core.generator.GeneratedDiagram;
import com.codeprism.core.generator.GeneratorConfig;
import com.codeprism.core.model.AnalysisReport;
import com.codeprism.core.model.ClassComplexity;
import com.codeprism.core.model.ComplexityScore;
import com.codeprism.core.model.EntryPoint;
import com.codeprism.core.model.ExitPoint;
import com.codeprism.core.model.FileMetrics;
import com.codeprism.core.model.OverallComplexity;
import com.codeprism.core.model.QualityMetrics;

/**
 * Generates a human-readable Markdown summary of an analysis report.
 *
 * <p>The summary is table-driven and covers file metrics, per-function and
 * per-class complexity, code quality, detected patterns, data flow and any
 * analysis warnings. Decimal values are printed with two fractional digits in
 * {@link Locale#ROOT}, so output does not depend on the host locale.
 *
 * <p>Table cells are escaped ({@code |} and line breaks), everything else is
 * emitted as-is.
 */
public class MarkdownGenerator implements DiagramGenerator {

    private static final Logger log = LoggerFactory.getLogger(MarkdownGenerator.class);

    // Markdown formatting constants
    private static final String H1 = "# ";
    private static final String H2 = "## ";
    private static final String H3 = "### ";
    private static final String CODE = "`";
    private static final String PIPE = "|";
    private static final String NEWLINE = "\n";
    private static final String DOUBLE_NEWLINE = "\n\n";
    private static final String SPACE = " ";
    private static final String BULLET = "- ";

    // Section headers
    private static final String SUMMARY_TITLE = "Analysis Summary: ";
    private static final String METRICS_SECTION = "File Metrics";
    private static final String COMPLEXITY_SECTION = "Complexity";
    private static final String FUNCTIONS_SECTION = "Functions and Methods";
    private static final String CLASSES_SECTION = "Classes";
    private static final String QUALITY_SECTION = "Code Quality";
    private static final String PATTERNS_SECTION = "Detected Patterns";
    private static final String DATA_FLOW_SECTION = "Data Flow";
    private static final String WARNINGS_SECTION = "Warnings";

    // Table headers
    private static final String METRIC = "Metric";
    private static final String VALUE = "Value";
    private static final String NAME = "Name";
    private static final String CYCLOMATIC = "Cyclomatic";
    private static final String COGNITIVE = "Cognitive";
    private static final String LINES = "Lines";
    private static final String METHODS = "Methods";
    private static final String FUNCTION = "Function";
    private static final String PARAMETERS = "Parameters";
    private static final String RETURNS = "Returns";

    // Empty states
    private static final String NO_FOUND = "No %s found.";
    private static final String NO_FUNCTIONS = "functions or methods";
    private static final String NO_CLASSES = "classes";
    private static final String NO_PATTERNS = "patterns";
    private static final String DASH_VALUE = "-";
    private static final String DECIMAL_FORMAT = "%.2f";

    @Override
    public String getId() {
        return "markdown";
    }

    @Override
    public String getDisplayName() {
        return "Markdown Summary Generator";
    }

    @Override
    public String getFileExtension() {
        return "md";
    }

    @Override
    public Set<DiagramType> getSupportedDiagramTypes() {
        return Set.of(DiagramType.SUMMARY);
    }

    @Override
    public GeneratedDiagram generate(AnalysisReport report, DiagramType type, GeneratorConfig config) {
        Objects.requireNonNull(report, "report must not be null");
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(config, "config must not be null");

        if (!getSupportedDiagramTypes().contains(type)) {
            throw new IllegalArgumentException("Unsupported diagram type: " + type);
        }

        log.debug("Generating Markdown summary for: {}", config.title());

        StringBuilder sb = new StringBuilder();
        appendHeader(sb, 1, SUMMARY_TITLE + config.title());
        appendMetrics(sb, report.metrics());
        appendComplexity(sb, report);
        appendQuality(sb, report.codeQuality());
        appendPatterns(sb, report);
        appendDataFlow(sb, report);
        appendWarnings(sb, report.warnings());

        log.debug("Generated Markdown summary for: {}", config.title());
        return new GeneratedDiagram(type, sb.toString(), getFileExtension());
    }

    private void appendMetrics(StringBuilder sb, FileMetrics metrics) {
        appendHeader(sb, 2, METRICS_SECTION);
        appendTableRow(sb, METRIC, VALUE);
        appendTableDivider(sb, 2);
        appendTableRow(sb, "Total lines", String.valueOf(metrics.totalLines()));
        appendTableRow(sb, "Non-empty lines", String.valueOf(metrics.nonEmptyLines()));
        appendTableRow(sb, "Characters", String.valueOf(metrics.characterCount()));
        appendTableRow(sb, "Imports", String.valueOf(metrics.importCount()));
        appendTableRow(sb, "Classes", String.valueOf(metrics.classCount()));
        appendTableRow(sb, "Functions", String.valueOf(metrics.functionCount()));
        sb.append(NEWLINE);
    }

    private void appendComplexity(StringBuilder sb, AnalysisReport report) {
        appendHeader(sb, 2, COMPLEXITY_SECTION);

        OverallComplexity overall = report.complexity().overall();
        appendTableRow(sb, METRIC, VALUE);
        appendTableDivider(sb, 2);
        appendTableRow(sb, "Total cyclomatic", String.valueOf(overall.totalCyclomatic()));
        appendTableRow(sb, "Total cognitive", decimal(overall.totalCognitive()));
        appendTableRow(sb, "Average cyclomatic", decimal(overall.averageCyclomatic()));
        appendTableRow(sb, "Average cognitive", decimal(overall.averageCognitive()));
        appendTableRow(sb, "Complexity density", decimal(overall.complexityDensity()));
        sb.append(NEWLINE);

        appendHeader(sb, 3, FUNCTIONS_SECTION);
        Map<String, ComplexityScore> functions = report.complexity().functions();
        if (functions.isEmpty()) {
            sb.append(String.format(NO_FOUND, NO_FUNCTIONS)).append(DOUBLE_NEWLINE);
        } else {
            appendTableRow(sb, NAME, CYCLOMATIC, COGNITIVE, LINES);
            appendTableDivider(sb, 4);
            functions.forEach((name, score) -> appendTableRow(sb,
                code(name),
                String.valueOf(score.cyclomatic()),
                decimal(score.cognitive()),
                String.valueOf(score.lines())));
            sb.append(NEWLINE);
        }

        appendHeader(sb, 3, CLASSES_SECTION);
        Map<String, ClassComplexity> classes = report.complexity().classes();
        if (classes.isEmpty()) {
            sb.append(String.format(NO_FOUND, NO_CLASSES)).append(DOUBLE_NEWLINE);
        } else {
            appendTableRow(sb, NAME, METHODS, CYCLOMATIC, COGNITIVE, LINES);
            appendTableDivider(sb, 5);
            classes.forEach((name, cls) -> appendTableRow(sb,
                code(name),
                String.valueOf(cls.methods().size()),
                String.valueOf(cls.totalCyclomatic()),
                decimal(cls.totalCognitive()),
                String.valueOf(cls.lines())));
            sb.append(NEWLINE);
        }
    }

    private void appendQuality(StringBuilder sb, QualityMetrics quality) {
        appendHeader(sb, 2, QUALITY_SECTION);
        appendTableRow(sb, METRIC, VALUE);
        appendTableDivider(sb, 2);
        appendTableRow(sb, "Docstring coverage", decimal(quality.docstringCoverage()));
        appendTableRow(sb, "Naming consistency", decimal(quality.namingConsistency()));
        appendTableRow(sb, "Dominant naming convention", quality.dominantNamingConvention().label());
        appendTableRow(sb, "Average function length", decimal(quality.averageFunctionLength()));
        appendTableRow(sb, "Complexity ratio", decimal(quality.complexityRatio()));
        appendTableRow(sb, "Overall quality", decimal(quality.overallQuality()));
        sb.append(NEWLINE);
    }

    private void appendPatterns(StringBuilder sb, AnalysisReport report) {
        appendHeader(sb, 2, PATTERNS_SECTION);

        boolean any = false;
        for (Map.Entry<String, Map<String, Boolean>> category : report.algorithms().categories().entrySet()) {
            List<String> set = new ArrayList<>();
            category.getValue().forEach((flag, value) -> {
                if (value) {
                    set.add(code(flag));
                }
            });
            if (!set.isEmpty()) {
                sb.append(BULLET).append(category.getKey()).append(": ")
                    .append(String.join(", ", set)).append(NEWLINE);
                any = true;
            }
        }
        sb.append(any ? NEWLINE : String.format(NO_FOUND, NO_PATTERNS) + DOUBLE_NEWLINE);
    }

    private void appendDataFlow(StringBuilder sb, AnalysisReport report) {
        appendHeader(sb, 2, DATA_FLOW_SECTION);

        List<EntryPoint> entries = report.dataFlow().entryPoints();
        if (entries.isEmpty()) {
            sb.append(String.format(NO_FOUND, NO_FUNCTIONS)).append(DOUBLE_NEWLINE);
            return;
        }

        Map<String, List<String>> returnsByFunction = new HashMap<>();
        for (ExitPoint exit : report.dataFlow().exitPoints()) {
            returnsByFunction.put(exit.function(), exit.returns());
        }

        appendTableRow(sb, FUNCTION, PARAMETERS, RETURNS);
        appendTableDivider(sb, 3);
        for (EntryPoint entry : entries) {
            List<String> returns = returnsByFunction.getOrDefault(entry.function(), List.of());
            appendTableRow(sb,
                code(entry.function()),
                joinOrDash(entry.parameters()),
                joinOrDash(returns));
        }
        sb.append(NEWLINE);
        sb.append("Data paths: ").append(report.dataFlow().dataPaths().size()).append(DOUBLE_NEWLINE);
    }

    private void appendWarnings(StringBuilder sb, List<String> warnings) {
        if (warnings.isEmpty()) {
            return;
        }
        appendHeader(sb, 2, WARNINGS_SECTION);
        for (String warning : warnings) {
            sb.append(BULLET).append(warning).append(NEWLINE);
        }
        sb.append(NEWLINE);
    }

    private void appendHeader(StringBuilder sb, int level, String title) {
        String prefix = switch (level) {
            case 1 -> H1;
            case 2 -> H2;
            case 3 -> H3;
            default -> "";
        };
        sb.append(prefix).append(title).append(DOUBLE_NEWLINE);
    }

    private String joinOrDash(List<String> values) {
        if (values.isEmpty()) {
            return DASH_VALUE;
        }
        return escapeMarkdown(String.join(", ", values));
    }

    private String decimal(double value) {
        return String.format(Locale.ROOT, DECIMAL_FORMAT, value);
    }

    private String code(String text) {
        return CODE + escapeMarkdown(text) + CODE;
    }

    /**
     * Escapes markdown special characters.
     */
    private String escapeMarkdown(String text) {
        if (text == null) {
            return "";
        }
        return text.replace("|", "\\|").replace("\n", " ");
    }

    private void appendTableRow(StringBuilder sb, String... columns) {
        sb.append(PIPE);
        for (String col : columns) {
            sb.append(SPACE).append(col).append(SPACE).append(PIPE);
        }
        sb.append(NEWLINE);
    }

    private void appendTableDivider(StringBuilder sb, int columnCount) {
        sb.append(PIPE);
        for (int i = 0; i < columnCount; i++) {
            sb.append("--------|");
        }
        sb.append(NEWLINE);
    }
}
