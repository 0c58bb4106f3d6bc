package com.codeprism.core.renderer;

import org.junit.jupiter.api.Test;

import java.nio.file.Paths;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link RenderContext}.
 */
class RenderContextTest {

    @Test
    void constructor_withNullOutputDirectory_throwsException() {
        assertThatThrownBy(() -> new RenderContext(null, Map.of()))
            .isInstanceOf(NullPointerException.class)
            .hasMessageContaining("outputDirectory must not be null");
    }

    @Test
    void constructor_withNullSettings_setsEmptyMap() {
        assertThat(new RenderContext("/output", null).settings()).isEmpty();
    }

    @Test
    void constructor_copiesSettings() {
        // Given
        Map<String, String> settings = new HashMap<>();
        settings.put(RenderContext.CONSOLE_COLORS, "false");
        RenderContext context = new RenderContext("/output", settings);

        // When
        settings.put(RenderContext.CONSOLE_COLORS, "true");

        // Then
        assertThat(context.flag(RenderContext.CONSOLE_COLORS, true)).isFalse();
    }

    @Test
    void flag_absentKey_usesDefault() {
        RenderContext context = new RenderContext("/output", Map.of());

        assertThat(context.flag(RenderContext.CONSOLE_SHOW_HEADERS, true)).isTrue();
        assertThat(context.flag(RenderContext.CONSOLE_SHOW_HEADERS, false)).isFalse();
    }

    @Test
    void flag_nonBooleanValue_isFalse() {
        RenderContext context = new RenderContext("/output", Map.of(RenderContext.CONSOLE_COLORS, "yes"));

        assertThat(context.flag(RenderContext.CONSOLE_COLORS, true)).isFalse();
    }

    @Test
    void plainConsole_disablesHeadersAndColors() {
        // When
        RenderContext context = RenderContext.plainConsole();

        // Then
        assertThat(context.flag(RenderContext.CONSOLE_SHOW_HEADERS, true)).isFalse();
        assertThat(context.flag(RenderContext.CONSOLE_COLORS, true)).isFalse();
    }

    @Test
    void outputPath_isNormalized() {
        assertThat(new RenderContext("./out/../reports", Map.of()).outputPath()).isEqualTo(Paths.get("reports"));
    }
}
