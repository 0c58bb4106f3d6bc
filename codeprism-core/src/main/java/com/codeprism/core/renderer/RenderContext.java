package com.codeprism.core.renderer;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import java.util.Objects;

/**
 * Where and how a renderer writes one batch of analysis output.
 *
 * <p>Console settings use the {@code console.*} keys below; unknown keys are
 * carried through untouched so custom renderers can define their own.
 *
 * @param outputDirectory directory that file paths are resolved against
 * @param settings renderer settings as strings
 */
public record RenderContext(
    String outputDirectory,
    Map<String, String> settings
) {
    public static final String CONSOLE_COLORS = "console.colors";
    public static final String CONSOLE_SHOW_HEADERS = "console.showHeaders";
    public static final String CONSOLE_SEPARATOR = "console.separator";

    public RenderContext {
        Objects.requireNonNull(outputDirectory, "outputDirectory must not be null");
        settings = settings != null ? Map.copyOf(settings) : Map.of();
    }

    /**
     * Context for printing a single report to standard output with nothing
     * around it, so the output can be piped.
     *
     * @return plain console context
     */
    public static RenderContext plainConsole() {
        return new RenderContext(".", Map.of(CONSOLE_SHOW_HEADERS, "false", CONSOLE_COLORS, "false"));
    }

    /**
     * @return output directory as a normalized path
     */
    public Path outputPath() {
        return Paths.get(outputDirectory).normalize();
    }

    public String getSettingOrDefault(String key, String defaultValue) {
        return settings.getOrDefault(key, defaultValue);
    }

    /**
     * @param key setting key
     * @param defaultValue value when the key is absent
     * @return {@code true} only for a case-insensitive {@code "true"}
     */
    public boolean flag(String key, boolean defaultValue) {
        String value = settings.get(key);
        return value == null ? defaultValue : Boolean.parseBoolean(value);
    }
}
