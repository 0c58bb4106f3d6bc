package com.codeprism.core.analyzer;

import com.codeprism.core.config.AnalyzerConfig.ComplexitySettings;
import com.codeprism.core.model.ClassComplexity;
import com.codeprism.core.model.ComplexityScore;
import com.codeprism.core.model.EntityInventory;
import com.codeprism.core.model.MethodSummary;
import com.codeprism.core.model.OverallComplexity;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Tests for {@link ComplexityAnalyzer}.
 */
class ComplexityAnalyzerTest extends AnalyzerTestBase {

    private final MetricsCollector metricsCollector = new MetricsCollector();

    private ComplexityAnalyzer.Result analyze(ComplexityAnalyzer analyzer, EntityInventory inventory) {
        return analyzer.analyze(inventory, metricsCollector.collect(inventory));
    }

    @Test
    void analyze_straightLineFunction_scoresBaseline() {
        // Given
        EntityInventory inventory = inventory("def f(x):\n    y = x * 2\n    return y\n");

        // When
        ComplexityScore score = analyze(new ComplexityAnalyzer(), inventory).report().functions().get("f");

        // Then
        assertThat(score.cyclomatic()).isEqualTo(1);
        assertThat(score.cognitive()).isEqualTo(1.5);
        assertThat(score.lines()).isEqualTo(3);
        assertThat(score.degraded()).isFalse();
    }

    @Test
    void analyze_nestedBranches_weightsByDepth() {
        // Given
        String source = """
            def f(x):
                if x > 0 and x < 10:
                    for i in range(x):
                        if i % 2:
                            print(i)
                return x
            """;

        // When
        ComplexityScore score = analyze(new ComplexityAnalyzer(), inventory(source)).report().functions().get("f");

        // Then
        // if(0) + and(0) + for(1) + if(2): 1 + 1 + 1.5 + 2
        assertThat(score.cyclomatic()).isEqualTo(5);
        assertThat(score.cognitive()).isCloseTo(1.5 * (1 + 5.5), within(1e-9));
    }

    @Test
    void analyze_flatDecisions_cognitiveEqualsMultiplierTimesCyclomatic() {
        // Given
        String source = """
            def classify(value):
                if value < 0:
                    return "negative"
                elif value == 0:
                    return "zero"
                try:
                    check(value)
                except ValueError:
                    return "invalid"
                except TypeError:
                    return "wrong type"
                return "positive" if value else "unknown"
            """;

        // When
        ComplexityScore score = analyze(new ComplexityAnalyzer(), inventory(source))
            .report().functions().get("classify");

        // Then
        // if, elif, two excepts and a conditional expression
        assertThat(score.cyclomatic()).isEqualTo(6);
        assertThat(score.cognitive()).isCloseTo(1.5 * 6, within(1e-9));
    }

    @Test
    void analyze_matchStatement_countsEachCase() {
        // Given
        String source = """
            def route(command):
                match command:
                    case "go":
                        return 1
                    case "stop":
                        return 2
                    case _:
                        return 0
            """;

        // When
        ComplexityScore score = analyze(new ComplexityAnalyzer(), inventory(source))
            .report().functions().get("route");

        // Then
        assertThat(score.cyclomatic()).isEqualTo(4);
    }

    @Test
    void analyze_comprehensionWithFilter_countsForAndIf() {
        // When
        ComplexityScore score = analyze(new ComplexityAnalyzer(),
            inventory("def evens(xs):\n    return [x for x in xs if x % 2 == 0]\n")).report().functions().get("evens");

        // Then
        assertThat(score.cyclomatic()).isEqualTo(3);
    }

    @Test
    void analyze_customSettings_changeCognitiveWeights() {
        // Given
        String source = """
            def f(xs):
                for x in xs:
                    if x:
                        pass
            """;
        ComplexityAnalyzer analyzer = new ComplexityAnalyzer(new ComplexitySettings(2.0, 1.0, null));

        // When
        ComplexityScore score = analyze(analyzer, inventory(source)).report().functions().get("f");

        // Then
        // for(0) + if(1): 1 + 2
        assertThat(score.cyclomatic()).isEqualTo(3);
        assertThat(score.cognitive()).isCloseTo(2.0 * (1 + 3), within(1e-9));
    }

    @Test
    void analyze_bodyBeyondLimit_degradesToBaselineWithWarning() {
        // Given
        String source = """
            def ok(x):
                return x

            def broken(x):
                if x:
                    if x:
                        y = x
                return y
            """;
        ComplexityAnalyzer analyzer = new ComplexityAnalyzer(new ComplexitySettings(null, null, 1));

        // When
        ComplexityAnalyzer.Result result = analyze(analyzer, inventory(source));

        // Then
        ComplexityScore broken = result.report().functions().get("broken");
        assertThat(broken.cyclomatic()).isEqualTo(1);
        assertThat(broken.cognitive()).isEqualTo(1.5);
        assertThat(broken.lines()).isEqualTo(5);
        assertThat(broken.degraded()).isTrue();
        assertThat(result.report().functions().get("ok").degraded()).isFalse();
        assertThat(result.warnings()).containsExactly("broken (line 7): nesting depth exceeds 1");
    }

    @Test
    void analyze_nestingBeyondLimit_degradesToBaseline() {
        // Given
        String source = """
            def deep(a):
                if a:
                    if a:
                        if a:
                            return a
            """;
        ComplexityAnalyzer analyzer = new ComplexityAnalyzer(new ComplexitySettings(null, null, 2));

        // When
        ComplexityAnalyzer.Result result = analyze(analyzer, inventory(source));

        // Then
        assertThat(result.report().functions().get("deep").degraded()).isTrue();
        assertThat(result.warnings()).containsExactly("deep (line 5): nesting depth exceeds 2");
    }

    @Test
    void analyze_transformerFixture_scoresEveryCallable() {
        // When
        ComplexityAnalyzer.Result result = analyze(new ComplexityAnalyzer(), transformer());

        // Then
        assertThat(result.warnings()).isEmpty();
        assertThat(result.report().functions()).hasSize(9);
        assertThat(result.report().functions().get("MultiHeadAttention.call").cyclomatic()).isEqualTo(2);
        assertThat(result.report().functions().get("Encoder.__init__").cyclomatic()).isEqualTo(2);
        assertThat(result.report().functions().get("Encoder.call").cyclomatic()).isEqualTo(2);
        assertThat(result.report().functions().get("get_angles").cyclomatic()).isEqualTo(1);
        assertThat(result.report().functions().get("positional_encoding").lines()).isEqualTo(11);
    }

    @Test
    void analyze_transformerFixture_rollsUpClasses() {
        // When
        ClassComplexity attention = analyze(new ComplexityAnalyzer(), transformer())
            .report().classes().get("MultiHeadAttention");

        // Then
        assertThat(attention.methods()).extracting(MethodSummary::name)
            .containsExactly("__init__", "split_heads", "call");
        assertThat(attention.methods().get(1).args()).containsExactly("x", "batch_size");
        assertThat(attention.methods().get(1).lineCount()).isEqualTo(5);
        assertThat(attention.totalCyclomatic()).isEqualTo(4);
        assertThat(attention.totalCognitive()).isCloseTo(6.0, within(1e-9));
        assertThat(attention.lines()).isEqualTo(4);
    }

    @Test
    void analyze_transformerFixture_computesOverallTotals() {
        // When
        OverallComplexity overall = analyze(new ComplexityAnalyzer(), transformer()).report().overall();

        // Then
        assertThat(overall.totalCyclomatic()).isEqualTo(12);
        assertThat(overall.totalCognitive()).isCloseTo(18.0, within(1e-9));
        assertThat(overall.averageCyclomatic()).isCloseTo(12.0 / 9, within(1e-9));
        assertThat(overall.averageCognitive()).isCloseTo(2.0, within(1e-9));
        assertThat(overall.complexityDensity()).isCloseTo(12.0 / 72, within(1e-9));
    }

    @Test
    void analyze_classWithoutMethods_hasZeroTotals() {
        // When
        ClassComplexity empty = analyze(new ComplexityAnalyzer(), inventory("class Empty:\n    x = 1\n"))
            .report().classes().get("Empty");

        // Then
        assertThat(empty.methods()).isEmpty();
        assertThat(empty.totalCyclomatic()).isZero();
        assertThat(empty.lines()).isEqualTo(2);
    }

    @Test
    void analyze_emptySource_hasZeroAverages() {
        // When
        OverallComplexity overall = analyze(new ComplexityAnalyzer(), inventory("")).report().overall();

        // Then
        assertThat(overall.totalCyclomatic()).isZero();
        assertThat(overall.averageCyclomatic()).isZero();
        assertThat(overall.complexityDensity()).isZero();
    }
}
