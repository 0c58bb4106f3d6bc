package com.codeprism.core.generator;

import com.codeprism.core.model.AnalysisReport;

import java.util.Set;

/**
 * Interface for generators that turn an analysis report into documents.
 *
 * <p>Generators convert an {@link AnalysisReport} into a specific text format
 * (Mermaid diagrams, Markdown summaries). Each generator supports one or more
 * {@link DiagramType}s.
 *
 * <p>Generators are discovered via Java Service Provider Interface (SPI).
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.codeprism.core.generator.DiagramGenerator}
 *
 * @see DiagramType
 * @see GeneratorConfig
 * @see GeneratedDiagram
 */
public interface DiagramGenerator {

    /**
     * Returns unique identifier for this generator.
     *
     * @return lowercase generator identifier (e.g., "mermaid")
     */
    String getId();

    /**
     * Returns human-readable display name for this generator.
     *
     * @return display name
     */
    String getDisplayName();

    /**
     * Returns file extension for generated documents.
     *
     * @return file extension without leading dot
     */
    String getFileExtension();

    /**
     * Returns set of diagram types this generator can produce.
     *
     * @return supported diagram types
     */
    Set<DiagramType> getSupportedDiagramTypes();

    /**
     * Generates a document from the report.
     *
     * <p>If the report holds no data for the requested type, a meaningful
     * placeholder is generated instead of an empty document.
     *
     * @param report the analysis report to visualize
     * @param type the diagram type to generate
     * @param config configuration settings for generation
     * @return generated document content
     * @throws IllegalArgumentException if diagram type is not supported
     */
    GeneratedDiagram generate(AnalysisReport report, DiagramType type, GeneratorConfig config);
}
