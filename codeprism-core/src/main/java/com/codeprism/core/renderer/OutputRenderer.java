package com.codeprism.core.renderer;

/**
 * Writes generated files to an output destination.
 *
 * <p>Renderers are discovered via {@link java.util.ServiceLoader}. Register
 * implementations in
 * {@code META-INF/services/com.codeprism.core.renderer.OutputRenderer}.
 *
 * @see GeneratedOutput
 * @see RenderContext
 */
public interface OutputRenderer {

    /**
     * Returns unique identifier for this renderer.
     *
     * <p>Used for selecting the renderer from the command line. Lowercase
     * (e.g., "filesystem", "console").
     *
     * @return unique renderer identifier
     */
    String getId();

    /**
     * Renders the generated output to the target destination.
     *
     * @param output the generated files to render
     * @param context rendering context with output directory and settings
     * @throws IllegalStateException if the output cannot be written
     */
    void render(GeneratedOutput output, RenderContext context);
}
