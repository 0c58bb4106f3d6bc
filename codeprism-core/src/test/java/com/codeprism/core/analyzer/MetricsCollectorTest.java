package com.codeprism.core.analyzer;

import com.codeprism.core.model.FileMetrics;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link MetricsCollector}.
 */
class MetricsCollectorTest extends AnalyzerTestBase {

    private final MetricsCollector collector = new MetricsCollector();

    @Test
    void collect_transformerFixture_countsLinesAndEntities() {
        // When
        FileMetrics metrics = collector.collect(transformer());

        // Then
        assertThat(metrics.totalLines()).isEqualTo(119);
        assertThat(metrics.nonEmptyLines()).isEqualTo(72);
        assertThat(metrics.importCount()).isEqualTo(1);
        assertThat(metrics.classCount()).isEqualTo(3);
        assertThat(metrics.functionCount()).isEqualTo(9);
    }

    @Test
    void collect_whitespaceOnlyLines_areNotCountedAsNonEmpty() {
        // When
        FileMetrics metrics = collector.collect(inventory("import os\n   \n\t\nfrom sys import path\n"));

        // Then
        assertThat(metrics.totalLines()).isEqualTo(4);
        assertThat(metrics.nonEmptyLines()).isEqualTo(2);
        assertThat(metrics.importCount()).isEqualTo(2);
    }

    @Test
    void collect_nonAsciiText_countsCodePoints() {
        // When
        FileMetrics metrics = collector.collect(inventory("s = \"😀\"\n"));

        // Then
        assertThat(metrics.characterCount()).isEqualTo(8);
    }

    @Test
    void collect_emptySource_isAllZero() {
        // When
        FileMetrics metrics = collector.collect(inventory(""));

        // Then
        assertThat(metrics.totalLines()).isZero();
        assertThat(metrics.characterCount()).isZero();
        assertThat(metrics.functionCount()).isZero();
    }
}
