package com.codeprism.core.analyzer;

import com.codeprism.core.analyzer.dependency.DependencyGraph;
import com.codeprism.core.analyzer.dependency.DependencyGraphBuilder;
import com.codeprism.core.analyzer.pattern.PatternDetector;
import com.codeprism.core.analyzer.pattern.PatternRegistry;
import com.codeprism.core.config.AnalyzerConfig;
import com.codeprism.core.model.AnalysisReport;
import com.codeprism.core.model.DataFlowSummary;
import com.codeprism.core.model.EntityInventory;
import com.codeprism.core.model.FileMetrics;
import com.codeprism.core.model.PatternFlags;
import com.codeprism.core.model.QualityMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Runs the full analysis pipeline for one source text.
 *
 * <p>Stages run strictly in order, each reading the previous stages' immutable
 * output: entity extraction, metrics, complexity, dependencies, patterns,
 * data flow, quality and assembly. The engine holds only configuration, so one
 * instance can serve any number of runs from any thread.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * AnalysisEngine engine = new AnalysisEngine(ConfigLoader.load(Paths.get("codeprism.yaml")));
 * AnalysisReport report = engine.analyze(Files.readString(Paths.get("model.py")));
 * }</pre>
 */
public class AnalysisEngine {

    private static final Logger log = LoggerFactory.getLogger(AnalysisEngine.class);

    private final EntityExtractor extractor;
    private final MetricsCollector metricsCollector;
    private final ComplexityAnalyzer complexityAnalyzer;
    private final DependencyGraphBuilder graphBuilder;
    private final PatternDetector patternDetector;
    private final DataFlowSummarizer dataFlowSummarizer;
    private final QualityScorer qualityScorer;
    private final ReportAssembler assembler;

    public AnalysisEngine() {
        this(AnalyzerConfig.defaults());
    }

    public AnalysisEngine(AnalyzerConfig config) {
        this(config, PatternRegistry.builtins());
    }

    public AnalysisEngine(AnalyzerConfig config, PatternRegistry registry) {
        Objects.requireNonNull(config, "config must not be null");
        this.extractor = new EntityExtractor();
        this.metricsCollector = new MetricsCollector();
        this.complexityAnalyzer = new ComplexityAnalyzer(config.complexity());
        this.graphBuilder = new DependencyGraphBuilder();
        this.patternDetector = new PatternDetector(registry);
        this.dataFlowSummarizer = new DataFlowSummarizer();
        this.qualityScorer = new QualityScorer(config.quality());
        this.assembler = new ReportAssembler();
    }

    /**
     * Analyzes one normalized source text.
     *
     * @param source source text
     * @return the complete report
     * @throws com.codeprism.core.parser.MalformedSourceException if the text cannot be parsed;
     *         no report is produced in that case
     */
    public AnalysisReport analyze(String source) {
        Objects.requireNonNull(source, "source must not be null");

        EntityInventory inventory = extractor.extract(source);
        FileMetrics metrics = metricsCollector.collect(inventory);
        ComplexityAnalyzer.Result complexity = complexityAnalyzer.analyze(inventory, metrics);
        DependencyGraph graph = graphBuilder.build(inventory);
        PatternFlags patterns = patternDetector.detect(inventory);
        DataFlowSummary dataFlow = dataFlowSummarizer.summarize(inventory, graph);
        QualityMetrics quality = qualityScorer.score(inventory, complexity.report());

        log.debug("Analysis complete: {} classes, {} functions, {} warnings",
            metrics.classCount(), metrics.functionCount(), complexity.warnings().size());

        return assembler.assemble(
            metrics,
            complexity.report(),
            graph.toEntries(inventory),
            patterns,
            dataFlow,
            quality,
            complexity.warnings()
        );
    }

    /**
     * @return probes this engine evaluates
     */
    public PatternRegistry patternRegistry() {
        return patternDetector.registry();
    }
}
