package com.codeprism.core.generator;

/**
 * Presentation options for one generated document.
 *
 * @param title subject shown in document headings, usually the analyzed file name
 * @param includeMethods whether diagrams list methods inside classes
 * @param maxNodes maximum number of class or function nodes per diagram; non-positive means no limit
 */
public record GeneratorConfig(
    String title,
    boolean includeMethods,
    int maxNodes
) {
    private static final String UNTITLED = "source";

    public GeneratorConfig {
        if (title == null || title.isBlank()) {
            title = UNTITLED;
        }
        if (maxNodes <= 0) {
            maxNodes = Integer.MAX_VALUE;
        }
    }

    /**
     * @param title document subject
     * @return config listing methods, without a node limit
     */
    public static GeneratorConfig titled(String title) {
        return new GeneratorConfig(title, true, Integer.MAX_VALUE);
    }

    public GeneratorConfig withoutMethods() {
        return new GeneratorConfig(title, false, maxNodes);
    }

    public GeneratorConfig withMaxNodes(int limit) {
        return new GeneratorConfig(title, includeMethods, limit);
    }
}
