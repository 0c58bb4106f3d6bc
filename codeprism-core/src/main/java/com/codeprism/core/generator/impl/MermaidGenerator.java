package com.codeprism.core.generator.impl;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.codeprism.core.generator.DiagramGenerator;
import com.codeprism.core.generator.DiagramType;
import com.codeprism.core.generator.GeneratedDiagram;
import com.codeprism.core.generator.GeneratorConfig;
import com.codeprism.core.model.AnalysisReport;
import com.codeprism.core.model.ClassComplexity;
import com.codeprism.core.model.DataPath;
import com.codeprism.core.model.DependencyEntry;
import com.codeprism.core.model.EntityKind;
import com.codeprism.core.model.MethodSummary;

/**
 * Generates Mermaid diagram definitions from analysis reports.
 *
 * <p>Output is Markdown with an embedded {@code ```mermaid} code block, suitable
 * for rendering in GitHub, GitLab and the Mermaid Live Editor.
 *
 * <h2>Supported Diagram Types</h2>
 * <ul>
 *   <li><b>Class Diagram:</b> classes with their methods, and which classes use which</li>
 *   <li><b>Architecture:</b> one subgraph per class holding its methods, free functions
 *       as standalone nodes, and the reference edges between them</li>
 *   <li><b>Component Flow:</b> call paths between functions and methods</li>
 * </ul>
 *
 * <p>Output depends only on the report, so identical reports produce identical diagrams.
 *
 * @see <a href="https://mermaid.js.org/">Mermaid Documentation</a>
 */
public class MermaidGenerator implements DiagramGenerator {

    private static final Logger log = LoggerFactory.getLogger(MermaidGenerator.class);

    // Generator identification
    private static final String GENERATOR_ID = "mermaid";
    private static final String GENERATOR_DISPLAY_NAME = "Mermaid Diagram Generator";
    private static final String FILE_EXTENSION = "md";

    // Markdown formatting
    private static final String MARKDOWN_HEADER_PREFIX = "# ";
    private static final String MARKDOWN_NEWLINE = "\n";
    private static final String CODE_BLOCK_START = "```mermaid\n";
    private static final String CODE_BLOCK_END = "```\n";

    // Mermaid diagram types
    private static final String CLASS_DIAGRAM = "classDiagram\n";
    private static final String GRAPH_TB = "graph TB\n";
    private static final String FLOWCHART_LR = "flowchart LR\n";

    private static final String ID_SANITIZATION_PATTERN = "[^a-zA-Z0-9_]";
    // Node ids are namespaced by entity kind so Encoder.call and Encoder_call stay apart
    private static final String CLASS_GROUP_PREFIX = "cls_";
    private static final String METHOD_NODE_PREFIX = "mth_";
    private static final String FUNCTION_NODE_PREFIX = "fn_";

    // Placeholder nodes for empty graphs
    private static final String NO_CLASSES_NODE = "  class NoClasses\n  note \"No classes found\"\n";
    private static final String NO_ENTITIES_NODE = "  A[No functions or classes found]\n";
    private static final String NO_DATA_PATHS_NODE = "  A[No data paths found]\n";

    @Override
    public String getId() {
        return GENERATOR_ID;
    }

    @Override
    public String getDisplayName() {
        return GENERATOR_DISPLAY_NAME;
    }

    @Override
    public String getFileExtension() {
        return FILE_EXTENSION;
    }

    @Override
    public Set<DiagramType> getSupportedDiagramTypes() {
        return Set.of(
            DiagramType.CLASS_DIAGRAM,
            DiagramType.ARCHITECTURE,
            DiagramType.COMPONENT_FLOW
        );
    }

    @Override
    public GeneratedDiagram generate(AnalysisReport report, DiagramType type, GeneratorConfig config) {
        Objects.requireNonNull(report, "report must not be null");
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(config, "config must not be null");

        if (!getSupportedDiagramTypes().contains(type)) {
            throw new IllegalArgumentException("Unsupported diagram type: " + type);
        }

        log.debug("Generating Mermaid diagram for type: {}", type);

        String content = switch (type) {
            case CLASS_DIAGRAM -> generateClassDiagram(report, config);
            case ARCHITECTURE -> generateArchitecture(report, config);
            case COMPONENT_FLOW -> generateComponentFlow(report, config);
            default -> throw new IllegalArgumentException("Unsupported diagram type: " + type);
        };

        log.debug("Generated Mermaid diagram: {}", type.fileStem());
        return new GeneratedDiagram(type, content, getFileExtension());
    }

    /**
     * Generates a class diagram.
     *
     * <p>A class uses another when the class itself or any of its methods
     * depends on the other class.
     */
    private String generateClassDiagram(AnalysisReport report, GeneratorConfig config) {
        StringBuilder sb = new StringBuilder();
        appendDiagramHeader(sb, "Class Diagram: " + config.title(), CLASS_DIAGRAM);

        Map<String, ClassComplexity> classes = report.complexity().classes();
        if (classes.isEmpty()) {
            sb.append(NO_CLASSES_NODE);
        } else {
            Set<String> drawn = new LinkedHashSet<>();
            classes.entrySet().stream().limit(config.maxNodes()).forEach(entry -> {
                drawn.add(entry.getKey());
                appendClass(sb, entry.getKey(), entry.getValue(), config.includeMethods());
            });
            for (String cls : drawn) {
                for (String used : usedClasses(report, cls)) {
                    if (!drawn.contains(used)) {
                        continue;
                    }
                    sb.append("  ").append(sanitizeId(cls)).append(" --> ")
                        .append(sanitizeId(used)).append(" : uses\n");
                }
            }
        }

        appendDiagramFooter(sb);
        return sb.toString();
    }

    private void appendClass(StringBuilder sb, String name, ClassComplexity cls, boolean includeMethods) {
        sb.append("  class ").append(sanitizeId(name)).append(" {\n");
        if (includeMethods) {
            for (MethodSummary method : cls.methods()) {
                sb.append("    +").append(method.name()).append("(")
                    .append(String.join(", ", method.args())).append(")\n");
            }
        }
        sb.append("  }\n");
    }

    private Set<String> usedClasses(AnalysisReport report, String cls) {
        Map<String, DependencyEntry> dependencies = report.dependencies();
        Set<String> used = new LinkedHashSet<>();
        for (String source : dependencies.keySet()) {
            if (!source.equals(cls) && !source.startsWith(cls + ".")) {
                continue;
            }
            for (String target : dependencies.get(source).dependsOn()) {
                DependencyEntry entry = dependencies.get(target);
                if (entry != null && entry.type() == EntityKind.CLASS && !target.equals(cls)) {
                    used.add(target);
                }
            }
        }
        return used;
    }

    /**
     * Generates the architecture graph: one subgraph per class with its methods,
     * free functions as nodes, and reference edges. Ownership edges are implied
     * by the subgraphs and left out.
     */
    private String generateArchitecture(AnalysisReport report, GeneratorConfig config) {
        StringBuilder sb = new StringBuilder();
        appendDiagramHeader(sb, "Architecture: " + config.title(), GRAPH_TB);

        Map<String, DependencyEntry> dependencies = report.dependencies();
        if (dependencies.isEmpty()) {
            sb.append(NO_ENTITIES_NODE);
            appendDiagramFooter(sb);
            return sb.toString();
        }

        int nodes = 0;
        for (Map.Entry<String, ClassComplexity> cls : report.complexity().classes().entrySet()) {
            if (nodes++ >= config.maxNodes()) {
                break;
            }
            sb.append("  subgraph ").append(CLASS_GROUP_PREFIX).append(sanitizeId(cls.getKey()))
                .append("[\"").append(escape(cls.getKey())).append("\"]\n");
            if (config.includeMethods()) {
                for (MethodSummary method : cls.getValue().methods()) {
                    String qualified = cls.getKey() + "." + method.name();
                    sb.append("    ").append(METHOD_NODE_PREFIX).append(sanitizeId(qualified))
                        .append("[\"").append(escape(method.name())).append("()\"]\n");
                }
            }
            sb.append("  end\n");
        }
        for (Map.Entry<String, DependencyEntry> entry : dependencies.entrySet()) {
            if (entry.getValue().type() == EntityKind.FUNCTION && nodes++ < config.maxNodes()) {
                sb.append("  ").append(FUNCTION_NODE_PREFIX).append(sanitizeId(entry.getKey()))
                    .append("[\"").append(escape(entry.getKey())).append("()\"]\n");
            }
        }

        for (Map.Entry<String, DependencyEntry> entry : dependencies.entrySet()) {
            String source = entry.getKey();
            for (String target : entry.getValue().dependsOn()) {
                if (isOwnership(source, target)) {
                    continue;
                }
                sb.append("  ").append(nodeId(report, source)).append(" --> ")
                    .append(nodeId(report, target)).append(MARKDOWN_NEWLINE);
            }
        }

        appendDiagramFooter(sb);
        return sb.toString();
    }

    private boolean isOwnership(String source, String target) {
        return target.startsWith(source + ".") || source.startsWith(target + ".");
    }

    private String nodeId(AnalysisReport report, String name) {
        DependencyEntry entry = report.dependencies().get(name);
        if (entry != null && entry.type() == EntityKind.CLASS) {
            return CLASS_GROUP_PREFIX + sanitizeId(name);
        }
        if (entry != null && entry.type() == EntityKind.METHOD) {
            return METHOD_NODE_PREFIX + sanitizeId(name);
        }
        return FUNCTION_NODE_PREFIX + sanitizeId(name);
    }

    /**
     * Generates the component flow from the report's data paths.
     */
    private String generateComponentFlow(AnalysisReport report, GeneratorConfig config) {
        StringBuilder sb = new StringBuilder();
        appendDiagramHeader(sb, "Component Flow: " + config.title(), FLOWCHART_LR);

        List<DataPath> paths = report.dataFlow().dataPaths();
        if (paths.isEmpty()) {
            sb.append(NO_DATA_PATHS_NODE);
        } else {
            Set<String> declared = new LinkedHashSet<>();
            for (DataPath path : paths) {
                declared.add(path.from());
                declared.add(path.to());
            }
            declared.stream().limit(config.maxNodes()).forEach(name ->
                sb.append("  ").append(nodeId(report, name)).append("[\"").append(escape(name)).append("\"]\n"));
            for (DataPath path : paths) {
                sb.append("  ").append(nodeId(report, path.from())).append(" --> ")
                    .append(nodeId(report, path.to())).append(MARKDOWN_NEWLINE);
            }
        }

        appendDiagramFooter(sb);
        return sb.toString();
    }

    /**
     * Appends diagram header with title and Mermaid code block.
     *
     * @param sb the string builder
     * @param title the diagram title
     * @param diagramType the Mermaid diagram type keyword line
     */
    private void appendDiagramHeader(StringBuilder sb, String title, String diagramType) {
        sb.append(MARKDOWN_HEADER_PREFIX).append(title).append(MARKDOWN_NEWLINE.repeat(2));
        sb.append(CODE_BLOCK_START);
        sb.append(diagramType);
    }

    private void appendDiagramFooter(StringBuilder sb) {
        sb.append(CODE_BLOCK_END);
    }

    /**
     * Replaces every character that is not a letter, digit or underscore, so that
     * qualified names such as {@code Encoder.call} become valid node IDs.
     *
     * @param id the identifier to sanitize (may be null)
     * @return sanitized identifier, or "unknown" if input is null
     */
    private String sanitizeId(String id) {
        if (id == null) {
            return "unknown";
        }
        return id.replaceAll(ID_SANITIZATION_PATTERN, "_");
    }

    /**
     * Replaces double quotes with single quotes and newlines with spaces.
     *
     * @param text the text to escape (may be null)
     * @return escaped text, or empty string if input is null
     */
    private String escape(String text) {
        if (text == null) {
            return "";
        }
        return text.replace("\"", "'").replace("\n", " ");
    }
}
