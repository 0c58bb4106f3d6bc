package com.codeprism.core.analyzer;

import com.codeprism.core.model.EntityInventory;
import com.codeprism.core.model.FileMetrics;

/**
 * Computes the file-level counts of a report.
 */
public class MetricsCollector {

    /**
     * @param inventory extracted inventory, including the source text
     * @return line, character and entity counts
     */
    public FileMetrics collect(EntityInventory inventory) {
        String source = inventory.tree().source();
        int totalLines = (int) source.lines().count();
        int nonEmptyLines = (int) source.lines().filter(line -> !line.isBlank()).count();

        return new FileMetrics(
            totalLines,
            nonEmptyLines,
            source.codePointCount(0, source.length()),
            inventory.importCount(),
            inventory.classes().size(),
            inventory.callables().size()
        );
    }
}
