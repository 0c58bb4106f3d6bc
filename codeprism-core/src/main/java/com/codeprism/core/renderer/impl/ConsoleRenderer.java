package com.codeprism.core.renderer.impl;

import com.codeprism.core.renderer.GeneratedFile;
import com.codeprism.core.renderer.GeneratedOutput;
import com.codeprism.core.renderer.OutputRenderer;
import com.codeprism.core.renderer.RenderContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;


/**
 * Renderer that prints generated files to standard output with optional ANSI colors.
 *
 * <p><b>Configuration Settings:</b>
 * <ul>
 *   <li>{@code console.colors} - Enable/disable ANSI colors ("true"/"false", default: "true")</li>
 *   <li>{@code console.separator} - Separator between files (default: "---")</li>
 *   <li>{@code console.showHeaders} - Show file headers ("true"/"false", default: "true")</li>
 * </ul>
 *
 * <p>With a single file and headers disabled only the file content is printed,
 * which keeps {@code analyze --stdout} output pipeable into JSON tools.
 */
public class ConsoleRenderer implements OutputRenderer {

    private static final Logger logger = LoggerFactory.getLogger(ConsoleRenderer.class);

    private static final String DEFAULT_SEPARATOR = "---";
    private static final int LINE_WIDTH = 80;

    @Override
    public String getId() {
        return "console";
    }

    @Override
    public void render(GeneratedOutput output, RenderContext context) {
        boolean useColors = context.flag(RenderContext.CONSOLE_COLORS, true);
        String separator = context.getSettingOrDefault(RenderContext.CONSOLE_SEPARATOR, DEFAULT_SEPARATOR);
        boolean showHeaders = context.flag(RenderContext.CONSOLE_SHOW_HEADERS, true);

        logger.debug("Rendering {} files to console (colors: {}, headers: {})",
            output.files().size(), useColors, showHeaders);

        if (!showHeaders && output.isSingleFile()) {
            System.out.print(output.files().get(0).content());
            return;
        }

        Palette palette = useColors ? Palette.ANSI : Palette.PLAIN;
        String rule = palette.meta() + fillLine(separator) + palette.reset() + "\n";
        StringBuilder sb = new StringBuilder();

        if (showHeaders) {
            sb.append(palette.title()).append("Generated ").append(output.files().size()).append(" file(s)")
                .append(palette.reset()).append("\n\n");
        }

        int total = output.files().size();
        for (int i = 0; i < total; i++) {
            GeneratedFile file = output.files().get(i);
            sb.append(rule);
            if (showHeaders) {
                appendFileHeader(sb, file, i + 1, total, palette);
            }
            sb.append(file.content()).append("\n");
        }
        if (total > 0) {
            sb.append(rule);
        }
        System.out.print(sb);
        System.out.flush();
    }

    private void appendFileHeader(StringBuilder sb, GeneratedFile file, int index, int total, Palette palette) {
        sb.append(palette.path()).append("File ").append(index).append('/').append(total).append(": ")
            .append(file.relativePath()).append(palette.reset()).append("\n");
        if (file.hasContentType()) {
            sb.append(palette.meta()).append("Type: ").append(file.contentType()).append(palette.reset()).append("\n");
        }
        sb.append(palette.meta()).append("Size: ").append(file.sizeInBytes()).append(" bytes")
            .append(palette.reset()).append("\n\n");
    }

    private static String fillLine(String separator) {
        int repeatCount = Math.max(1, LINE_WIDTH / Math.max(1, separator.length()));
        return separator.repeat(repeatCount);
    }

    /**
     * Escape sequences for the parts of the listing; all empty when colors are off.
     */
    private record Palette(String title, String path, String meta, String reset) {
        static final Palette ANSI = new Palette("\u001B[1m\u001B[32m", "\u001B[1m\u001B[36m", "\u001B[33m", "\u001B[0m");
        static final Palette PLAIN = new Palette("", "", "", "");
    }
}
