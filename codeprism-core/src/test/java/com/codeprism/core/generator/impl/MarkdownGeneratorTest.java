package com.codeprism.core.generator.impl;

import com.codeprism.core.analyzer.AnalysisEngine;
import com.codeprism.core.analyzer.AnalyzerTestBase;
import com.codeprism.core.generator.DiagramType;
import com.codeprism.core.generator.GeneratedDiagram;
import com.codeprism.core.generator.GeneratorConfig;
import com.codeprism.core.model.AnalysisReport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link MarkdownGenerator}.
 */
class MarkdownGeneratorTest extends AnalyzerTestBase {

    private MarkdownGenerator generator;
    private GeneratorConfig config;

    @BeforeEach
    void setUp() {
        generator = new MarkdownGenerator();
        config = GeneratorConfig.titled("transformer.py");
    }

    private String summarize(String source) {
        AnalysisReport report = new AnalysisEngine().analyze(source);
        return generator.generate(report, DiagramType.SUMMARY, config).content();
    }

    @Test
    void getId_returnsMarkdown() {
        assertThat(generator.getId()).isEqualTo("markdown");
        assertThat(generator.getSupportedDiagramTypes()).containsExactly(DiagramType.SUMMARY);
    }

    @Test
    void generate_transformerFixture_writesMetricsAndComplexityTables() {
        // When
        GeneratedDiagram summary = generator.generate(
            new AnalysisEngine().analyze(loadFixture(TRANSFORMER_FIXTURE)), DiagramType.SUMMARY, config);

        // Then
        assertThat(summary.fileName()).isEqualTo("summary.md");
        assertThat(summary.content())
            .startsWith("# Analysis Summary: transformer.py\n\n## File Metrics\n\n| Metric | Value |\n|--------|--------|\n")
            .contains("| Total lines | 119 |\n")
            .contains("| Non-empty lines | 72 |\n")
            .contains("| Classes | 3 |\n")
            .contains("| Total cyclomatic | 12 |\n")
            .contains("| `MultiHeadAttention.call` | 2 | 3.00 | 20 |\n")
            .contains("| `MultiHeadAttention` | 3 | 4 | 6.00 | 4 |\n");
    }

    @Test
    void generate_transformerFixture_writesQualityAndPatterns() {
        // When
        String content = summarize(loadFixture(TRANSFORMER_FIXTURE));

        // Then
        assertThat(content)
            .contains("| Docstring coverage | 0.22 |\n")
            .contains("| Dominant naming convention | snake_case |\n")
            .contains("| Overall quality | 0.77 |\n")
            .contains("- attention_mechanism: `self_attention`, `multi_head`, `scaled_dot_product`, "
                + "`query_key_value`, `softmax_attention`, `masking`\n")
            .doesNotContain("- optimization:")
            .doesNotContain("## Warnings");
    }

    @Test
    void generate_transformerFixture_matchesReturnsToTheirFunction() {
        // When
        String content = summarize(loadFixture(TRANSFORMER_FIXTURE));

        // Then
        assertThat(content)
            .contains("| `get_angles` | pos, i, d_model | pos |\n")
            .contains("| `MultiHeadAttention.__init__` | d_model, num_heads | - |\n")
            .contains("| `MultiHeadAttention.call` | v, k, q, mask | self.dense |\n")
            .contains("Data paths: 3\n");
    }

    @Test
    void generate_noEntities_writesEmptyStates() {
        // When
        String content = summarize("x = 1\n");

        // Then
        assertThat(content)
            .contains("### Functions and Methods\n\nNo functions or methods found.\n")
            .contains("### Classes\n\nNo classes found.\n")
            .contains("## Detected Patterns\n\nNo patterns found.\n");
    }

    @Test
    void generate_degradedFunction_listsWarnings() {
        // Given
        StringBuilder source = new StringBuilder("def odd(x):\n");
        for (int level = 1; level <= 26; level++) {
            source.append("    ".repeat(level)).append("if x:\n");
        }
        source.append("    ".repeat(27)).append("return x\n");

        // When
        String content = summarize(source.toString());

        // Then
        assertThat(content).contains("## Warnings\n\n- odd (line 28): nesting depth exceeds 25\n");
    }

    @Test
    void generate_unsupportedType_throws() {
        // Given
        AnalysisReport report = new AnalysisEngine().analyze("");

        // Then
        assertThatThrownBy(() -> generator.generate(report, DiagramType.CLASS_DIAGRAM, config))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
