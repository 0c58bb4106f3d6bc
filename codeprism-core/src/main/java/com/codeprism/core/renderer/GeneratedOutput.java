package com.codeprism.core.renderer;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Files produced for one analyzed source unit, written as a batch.
 *
 * @param files generated files, in write order; relative paths are unique
 */
public record GeneratedOutput(
    List<GeneratedFile> files
) {
    public GeneratedOutput {
        Objects.requireNonNull(files, "files must not be null");
        files = List.copyOf(files);
        Set<String> paths = new HashSet<>();
        for (GeneratedFile file : files) {
            if (!paths.add(file.relativePath())) {
                throw new IllegalArgumentException("Duplicate output path: " + file.relativePath());
            }
        }
    }

    /**
     * @return combined UTF-8 size of all file contents
     */
    public long totalBytes() {
        return files.stream().mapToLong(GeneratedFile::sizeInBytes).sum();
    }

    /**
     * @return whether the batch is a single file, as when a report goes to stdout
     */
    public boolean isSingleFile() {
        return files.size() == 1;
    }
}
