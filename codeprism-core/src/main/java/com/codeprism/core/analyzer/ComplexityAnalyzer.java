package com.codeprism.core.analyzer;

import com.codeprism.core.config.AnalyzerConfig.ComplexitySettings;
import com.codeprism.core.model.ClassComplexity;
import com.codeprism.core.model.ComplexityReport;
import com.codeprism.core.model.ComplexityScore;
import com.codeprism.core.model.Entity;
import com.codeprism.core.model.EntityInventory;
import com.codeprism.core.model.FileMetrics;
import com.codeprism.core.model.MethodSummary;
import com.codeprism.core.model.OverallComplexity;
import com.codeprism.core.parser.Statement;
import com.codeprism.core.parser.StatementKind;
import com.codeprism.core.parser.Token;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Scores cyclomatic and cognitive complexity of every function and method.
 *
 * <p><b>Decision points</b> (each adds 1 to cyclomatic complexity):
 * {@code if}, {@code elif}, conditional expressions, comprehension {@code if} and
 * {@code for}, {@code for}, {@code while}, each {@code and}/{@code or}, each
 * {@code except} clause and each {@code case} clause.
 *
 * <p><b>Cognitive complexity</b> weights each decision point by its nesting depth:
 * <pre>
 * cognitive = multiplier * (1 + sum(1 + nestingIncrement * depth))
 * </pre>
 * where depth counts the control blocks and nested definitions enclosing the
 * decision point inside the function. Flat code scores {@code multiplier * cyclomatic}.
 *
 * <p>A body nested deeper than the configured limit is scored at baseline
 * ({@code 1} and {@code multiplier}) and reported as a warning.
 */
public class ComplexityAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(ComplexityAnalyzer.class);

    private static final Set<StatementKind> BRANCH_STATEMENTS = Set.of(
        StatementKind.IF, StatementKind.ELIF, StatementKind.FOR, StatementKind.WHILE,
        StatementKind.EXCEPT, StatementKind.CASE
    );

    private static final Set<String> EXPRESSION_DECISIONS = Set.of("if", "for", "and", "or");

    private final ComplexitySettings settings;

    public ComplexityAnalyzer() {
        this(ComplexitySettings.defaults());
    }

    public ComplexityAnalyzer(ComplexitySettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
    }

    /**
     * Result of one complexity pass.
     *
     * @param report per-function, per-class and overall complexity
     * @param warnings one message per degraded entity
     */
    public record Result(ComplexityReport report, List<String> warnings) {
        public Result {
            Objects.requireNonNull(report, "report must not be null");
            warnings = warnings != null ? List.copyOf(warnings) : List.of();
        }
    }

    /**
     * Scores every function and method of the inventory.
     *
     * @param inventory extracted entities
     * @param metrics file metrics, for the complexity density
     * @return complexity block and warnings for degraded entities
     */
    public Result analyze(EntityInventory inventory, FileMetrics metrics) {
        List<String> warnings = new ArrayList<>();
        Map<String, ComplexityScore> functions = new LinkedHashMap<>();

        for (Entity entity : inventory.callables()) {
            functions.put(entity.qualifiedName(), score(entity, warnings));
        }

        Map<String, ClassComplexity> classes = new LinkedHashMap<>();
        for (Entity cls : inventory.classes()) {
            classes.put(cls.name(), rollUp(cls, inventory.methodsOf(cls.name()), functions));
        }

        int totalCyclomatic = 0;
        double totalCognitive = 0;
        for (ComplexityScore score : functions.values()) {
            totalCyclomatic += score.cyclomatic();
            totalCognitive += score.cognitive();
        }
        int count = functions.size();
        OverallComplexity overall = new OverallComplexity(
            totalCyclomatic,
            totalCognitive,
            count == 0 ? 0 : (double) totalCyclomatic / count,
            count == 0 ? 0 : totalCognitive / count,
            metrics.nonEmptyLines() == 0 ? 0 : (double) totalCyclomatic / metrics.nonEmptyLines()
        );

        log.debug("Scored {} functions, total cyclomatic {}", count, totalCyclomatic);
        return new Result(new ComplexityReport(functions, classes, overall), warnings);
    }

    private ComplexityScore score(Entity entity, List<String> warnings) {
        try {
            return measure(entity);
        } catch (UnsupportedConstructException e) {
            String warning = entity.qualifiedName() + " (line " + e.getLine() + "): " + e.getMessage();
            log.warn("Complexity of {} degraded to baseline: {}", entity.qualifiedName(), e.getMessage());
            warnings.add(warning);
            return new ComplexityScore(1, settings.cognitiveMultiplier(), entity.lineCount(), true);
        }
    }

    private ComplexityScore measure(Entity entity) {
        Tally tally = new Tally();
        visit(entity.definition().body(), 0, tally);
        double cognitive = settings.cognitiveMultiplier() * (1 + tally.weighted);
        return new ComplexityScore(1 + tally.decisions, cognitive, entity.lineCount(), false);
    }

    private void visit(List<Statement> block, int depth, Tally tally) {
        if (depth > settings.maxNestingDepth()) {
            int line = block.isEmpty() ? 0 : block.get(0).startLine();
            throw new UnsupportedConstructException(
                "nesting depth exceeds " + settings.maxNestingDepth(), line);
        }
        for (Statement statement : block) {
            countDecisions(statement, depth, tally);
            if (statement.kind().isCompound()) {
                visit(statement.body(), depth + nestingOf(statement.kind()), tally);
            }
        }
    }

    private void countDecisions(Statement statement, int depth, Tally tally) {
        List<Token> tokens = statement.tokens();

        int from = 0;
        if (statement.kind().isCompound()) {
            from = 1;
            if (BRANCH_STATEMENTS.contains(statement.kind())) {
                tally.add(depth, settings.nestingIncrement());
            }
        }
        for (int i = from; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            if (token.isName() && EXPRESSION_DECISIONS.contains(token.text())) {
                tally.add(depth, settings.nestingIncrement());
            }
        }
    }

    private static int nestingOf(StatementKind kind) {
        if (kind.isControlBlock() || kind == StatementKind.DEF || kind == StatementKind.CLASS) {
            return 1;
        }
        return 0;
    }

    private static ClassComplexity rollUp(Entity cls, List<Entity> methods, Map<String, ComplexityScore> scores) {
        List<MethodSummary> summaries = new ArrayList<>();
        int totalCyclomatic = 0;
        double totalCognitive = 0;
        int methodLines = 0;
        for (Entity method : methods) {
            ComplexityScore score = scores.get(method.qualifiedName());
            summaries.add(new MethodSummary(method.name(), method.parameters(), method.lineCount()));
            totalCyclomatic += score.cyclomatic();
            totalCognitive += score.cognitive();
            methodLines += method.lineCount();
        }
        return new ClassComplexity(summaries, totalCyclomatic, totalCognitive, cls.lineCount() - methodLines);
    }

    private static final class Tally {
        private int decisions;
        private double weighted;

        private void add(int depth, double nestingIncrement) {
            decisions++;
            weighted += 1 + nestingIncrement * depth;
        }
    }
}
