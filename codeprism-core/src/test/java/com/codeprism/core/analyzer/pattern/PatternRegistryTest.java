package com.codeprism.core.analyzer.pattern;

import com.codeprism.core.analyzer.AnalyzerTestBase;
import com.codeprism.core.model.PatternFlags;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link PatternRegistry}.
 */
class PatternRegistryTest extends AnalyzerTestBase {

    @Test
    void builtins_registerFiveCategoriesInOrder() {
        // When
        PatternFlags flags = PatternRegistry.builtins().evaluate(PatternContext.of(inventory("")));

        // Then
        assertThat(flags.categories().keySet()).containsExactly(
            "neural_network", "optimization", "attention_mechanism", "linear_algebra", "design_patterns");
        assertThat(flags.categories().get("attention_mechanism").keySet()).containsExactly(
            "self_attention", "multi_head", "scaled_dot_product", "query_key_value", "softmax_attention", "masking");
    }

    @Test
    void builtins_emptySource_setsNoFlag() {
        // When
        PatternFlags flags = PatternRegistry.builtins().evaluate(PatternContext.of(inventory("")));

        // Then
        flags.categories().values().forEach(category -> assertThat(category).doesNotContainValue(true));
    }

    @Test
    void with_newProbe_returnsExtendedCopy() {
        // Given
        PatternRegistry builtins = PatternRegistry.builtins();
        PatternProbe fileAccess = new PatternProbe("io", "file_access", "opens files",
            ctx -> ctx.hasName(Set.of("open")));

        // When
        PatternRegistry extended = builtins.with(fileAccess);

        // Then
        assertThat(extended.probes()).hasSize(builtins.probes().size() + 1);
        assertThat(builtins.probes()).doesNotContain(fileAccess);
        assertThat(extended.probes()).last().isEqualTo(fileAccess);
    }

    @Test
    void with_customProbe_isReportedUnderItsCategory() {
        // Given
        PatternRegistry registry = PatternRegistry.empty()
            .with(new PatternProbe("io", "file_access", "opens files", ctx -> ctx.hasName(Set.of("open"))));

        // When
        PatternFlags flags = registry.evaluate(PatternContext.of(inventory("with open(path) as f:\n    pass\n")));

        // Then
        assertThat(flags.isSet("io", "file_access")).isTrue();
        assertThat(flags.categories()).containsOnlyKeys("io");
    }

    @Test
    void with_duplicateKey_throws() {
        // Given
        PatternProbe duplicate = new PatternProbe("neural_network", "layers", "again", ctx -> true);

        // Then
        assertThatThrownBy(() -> PatternRegistry.builtins().with(duplicate))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("neural_network.layers");
    }

    @Test
    void isSet_unknownFlag_returnsFalse() {
        // When
        PatternFlags flags = PatternRegistry.empty().evaluate(PatternContext.of(inventory("")));

        // Then
        assertThat(flags.isSet("missing", "flag")).isFalse();
        assertThat(flags.anySet("missing")).isFalse();
    }
}
