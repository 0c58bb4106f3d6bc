package com.codeprism.cli;

import com.codeprism.CodePrismCLI;
import com.codeprism.core.analyzer.AnalysisEngine;
import com.codeprism.core.config.AnalyzerConfig;
import com.codeprism.core.config.ConfigLoader;
import com.codeprism.core.generator.DiagramGenerator;
import com.codeprism.core.generator.DiagramType;
import com.codeprism.core.generator.GeneratedDiagram;
import com.codeprism.core.generator.GeneratorConfig;
import com.codeprism.core.model.AnalysisReport;
import com.codeprism.core.parser.MalformedSourceException;
import com.codeprism.core.renderer.GeneratedFile;
import com.codeprism.core.renderer.GeneratedOutput;
import com.codeprism.core.renderer.OutputRenderer;
import com.codeprism.core.renderer.RenderContext;
import com.codeprism.core.report.ReportWriter;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.ServiceLoader;
import java.util.Set;
import java.util.concurrent.Callable;

/**
 * Command to analyze Python source files and write one report per file.
 *
 * <p>For every input file the pipeline is:
 * <ol>
 *   <li>Read the file and run the analysis engine</li>
 *   <li>Serialize the report to {@code analysis_result.json}</li>
 *   <li>Generate diagrams and the Markdown summary via SPI generators</li>
 *   <li>Render everything under {@code <output>/<file-stem>/}</li>
 * </ol>
 *
 * <p>Files are independent: a file that fails to parse is reported as
 * {@code file:line:column: message}, nothing is written for it, and the
 * remaining files are still analyzed. The exit code is 1 if any file failed.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * codeprism analyze model.py utils.py -o build/analysis
 * codeprism analyze --stdout model.py | jq .code_quality
 * }</pre>
 */
@Command(
    name = "analyze",
    description = "Analyze Python source files and write reports",
    mixinStandardHelpOptions = true
)
public class AnalyzeCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(AnalyzeCommand.class);

    private static final String MERMAID_GENERATOR = "mermaid";
    private static final String MARKDOWN_GENERATOR = "markdown";

    @ParentCommand
    private CodePrismCLI parent;

    @Parameters(arity = "1..*", paramLabel = "FILE", description = "Python source files to analyze")
    private List<Path> files;

    @Option(
        names = {"-o", "--output"},
        description = "Output directory (overrides config)"
    )
    private Path outputDir;

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: codeprism.yaml)"
    )
    private Path configPath = Paths.get(ConfigLoader.DEFAULT_FILE_NAME);

    @Option(
        names = {"--no-diagrams"},
        description = "Skip Mermaid diagrams and the Markdown summary"
    )
    private boolean noDiagrams;

    @Option(
        names = {"--stdout"},
        description = "Print the JSON report to standard output instead of writing files"
    )
    private boolean toStdout;

    @Override
    public Integer call() {
        AnalyzerConfig config;
        try {
            config = ConfigLoader.load(configPath);
        } catch (IllegalArgumentException e) {
            log.error("Invalid configuration", e);
            System.err.println("✗ " + e.getMessage());
            return 1;
        }

        AnalysisEngine engine = new AnalysisEngine(config);
        List<DiagramGenerator> generators = noDiagrams || toStdout
            ? List.of()
            : selectGenerators(config.output());
        String outputDirectory = outputDir != null ? outputDir.toString() : config.output().directory();

        int failed = 0;
        Set<String> usedStems = new HashSet<>();
        for (Path file : files) {
            if (!analyzeFile(file, engine, generators, outputDirectory, usedStems)) {
                failed++;
            }
        }

        if (failed > 0) {
            log.error("{} of {} file(s) failed", failed, files.size());
            return 1;
        }
        return 0;
    }

    private boolean analyzeFile(Path file, AnalysisEngine engine, List<DiagramGenerator> generators,
                                String outputDirectory, Set<String> usedStems) {
        log.debug("Analyzing: {}", file);

        AnalysisReport report;
        try {
            report = engine.analyze(SourceFiles.read(file));
        } catch (MalformedSourceException e) {
            System.err.println(SourceFiles.describe(file, e));
            log.debug("Parse failure in {}", file, e);
            return false;
        } catch (IOException e) {
            System.err.println(file + ": cannot read file: " + e.getMessage());
            log.debug("Read failure for {}", file, e);
            return false;
        }

        String json = ReportWriter.toJson(report);
        if (toStdout) {
            renderer("console").render(
                new GeneratedOutput(List.of(GeneratedFile.json(ReportWriter.REPORT_FILE_NAME, json))),
                RenderContext.plainConsole());
            return true;
        }

        String stem = uniqueStem(SourceFiles.stem(file), usedStems);
        List<GeneratedFile> outputs = new ArrayList<>();
        outputs.add(GeneratedFile.json(stem + "/" + ReportWriter.REPORT_FILE_NAME, json));
        GeneratorConfig generatorConfig = GeneratorConfig.titled(file.getFileName().toString());
        for (DiagramGenerator generator : generators) {
            for (DiagramType type : DiagramType.values()) {
                if (!generator.getSupportedDiagramTypes().contains(type)) {
                    continue;
                }
                GeneratedDiagram diagram = generator.generate(report, type, generatorConfig);
                outputs.add(GeneratedFile.markdown(stem + "/" + diagram.fileName(), diagram.content()));
            }
        }

        try {
            renderer("filesystem").render(new GeneratedOutput(outputs), new RenderContext(outputDirectory, Map.of()));
        } catch (IllegalStateException e) {
            log.error("Failed to write output for {}", file, e);
            System.err.println(file + ": " + e.getMessage());
            return false;
        }

        if (!isQuiet()) {
            System.out.printf(Locale.ROOT, "✓ %s: %d classes, %d functions, quality %.2f -> %s%n",
                file, report.metrics().classCount(), report.metrics().functionCount(),
                report.codeQuality().overallQuality(), Paths.get(outputDirectory, stem));
        }
        return true;
    }

    /**
     * Discovers generators via SPI, keeping those the output settings enable.
     */
    private List<DiagramGenerator> selectGenerators(AnalyzerConfig.OutputSettings output) {
        log.debug("Discovering diagram generators via ServiceLoader");
        List<DiagramGenerator> generators = new ArrayList<>();
        for (DiagramGenerator generator : ServiceLoader.load(DiagramGenerator.class)) {
            boolean enabled = switch (generator.getId()) {
                case MERMAID_GENERATOR -> output.diagrams();
                case MARKDOWN_GENERATOR -> output.summary();
                default -> true;
            };
            if (enabled) {
                generators.add(generator);
            }
        }
        generators.sort((a, b) -> a.getId().compareTo(b.getId()));
        log.debug("Using {} diagram generators", generators.size());
        return generators;
    }

    private OutputRenderer renderer(String id) {
        for (OutputRenderer renderer : ServiceLoader.load(OutputRenderer.class)) {
            if (id.equals(renderer.getId())) {
                return renderer;
            }
        }
        throw new IllegalStateException("Output renderer not found: " + id);
    }

    private String uniqueStem(String stem, Set<String> usedStems) {
        String candidate = stem;
        int suffix = 2;
        while (!usedStems.add(candidate)) {
            candidate = stem + "-" + suffix++;
        }
        return candidate;
    }

    private boolean isQuiet() {
        return parent != null && parent.isQuiet();
    }
}
