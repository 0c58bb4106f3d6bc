package com.codeprism.core.report;

import com.codeprism.core.model.AnalysisReport;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;

/**
 * Serializes reports to JSON.
 *
 * <p>Field names and nesting follow the report contract. Output uses two-space
 * indentation and {@code \n} line breaks on every platform, so identical reports
 * serialize to identical bytes.
 */
public final class ReportWriter {

    /** File name downstream consumers expect. */
    public static final String REPORT_FILE_NAME = "analysis_result.json";

    private static final ObjectMapper JSON_MAPPER = new ObjectMapper();
    private static final ObjectWriter WRITER = JSON_MAPPER.writer(
        new DefaultPrettyPrinter().withObjectIndenter(new DefaultIndenter("  ", "\n")));

    private ReportWriter() {
    }

    /**
     * @param report report to serialize
     * @return pretty-printed JSON ending with a newline
     */
    public static String toJson(AnalysisReport report) {
        try {
            return WRITER.writeValueAsString(report) + "\n";
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize analysis report", e);
        }
    }
}
