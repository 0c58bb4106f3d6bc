package com.codeprism.core.analyzer;

import com.codeprism.core.model.AnalysisReport;
import com.codeprism.core.model.ComplexityReport;
import com.codeprism.core.model.DataFlowSummary;
import com.codeprism.core.model.DependencyEntry;
import com.codeprism.core.model.FileMetrics;
import com.codeprism.core.model.PatternFlags;
import com.codeprism.core.model.QualityMetrics;

import java.util.List;
import java.util.Map;

/**
 * Merges the stage outputs into one immutable report. Computes nothing.
 */
public class ReportAssembler {

    public AnalysisReport assemble(FileMetrics metrics,
                                   ComplexityReport complexity,
                                   Map<String, DependencyEntry> dependencies,
                                   PatternFlags algorithms,
                                   DataFlowSummary dataFlow,
                                   QualityMetrics codeQuality,
                                   List<String> warnings) {
        return new AnalysisReport(metrics, complexity, dependencies, algorithms, dataFlow, codeQuality, warnings);
    }
}
