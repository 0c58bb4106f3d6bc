package com.codeprism.core.renderer.impl;

import com.codeprism.core.renderer.GeneratedFile;
import com.codeprism.core.renderer.GeneratedOutput;
import com.codeprism.core.renderer.OutputRenderer;
import com.codeprism.core.renderer.RenderContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Renderer that writes generated files to the filesystem.
 *
 * <p>Creates the directory structure automatically and preserves relative paths.
 * Each file is first written to a temporary sibling and then moved over the
 * target, so readers see either the previous file or the complete new one.
 * Where the file system cannot move atomically, a plain replacing move is used.
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * RenderContext context = new RenderContext("./codeprism-output", Map.of());
 *
 * GeneratedOutput output = new GeneratedOutput(List.of(
 *     new GeneratedFile("transformer/analysis_result.json", json, "application/json")
 * ));
 *
 * new FileSystemRenderer().render(output, context);
 * // Creates: ./codeprism-output/transformer/analysis_result.json
 * }</pre>
 */
public class FileSystemRenderer implements OutputRenderer {

    private static final Logger logger = LoggerFactory.getLogger(FileSystemRenderer.class);

    private static final String TEMP_SUFFIX = ".tmp";

    @Override
    public String getId() {
        return "filesystem";
    }

    @Override
    public void render(GeneratedOutput output, RenderContext context) {
        Path outputDir = context.outputPath();
        logger.debug("Rendering {} files to filesystem at: {}", output.files().size(), outputDir);

        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to create output directory: " + outputDir, e);
        }

        for (GeneratedFile file : output.files()) {
            writeFile(outputDir, file);
        }

        logger.info("Wrote {} file(s), {} bytes, to {}", output.files().size(), output.totalBytes(), outputDir);
    }

    /**
     * Writes a single file through a temporary sibling.
     *
     * @param outputDir base output directory
     * @param file file to write
     */
    private void writeFile(Path outputDir, GeneratedFile file) {
        Path targetPath = outputDir.resolve(file.relativePath()).normalize();
        if (!targetPath.startsWith(outputDir)) {
            throw new IllegalStateException("File escapes output directory: " + file.relativePath());
        }
        logger.debug("Writing file: {}", targetPath);

        Path tempPath = null;
        try {
            Path parentDir = targetPath.getParent();
            if (parentDir != null) {
                Files.createDirectories(parentDir);
            }
            tempPath = Files.createTempFile(parentDir != null ? parentDir : outputDir,
                "." + targetPath.getFileName(), TEMP_SUFFIX);
            Files.writeString(tempPath, file.content(), StandardCharsets.UTF_8);
            move(tempPath, targetPath);
            logger.debug("Wrote file: {} ({} bytes)", file.relativePath(), file.sizeInBytes());
        } catch (IOException e) {
            deleteQuietly(tempPath);
            throw new IllegalStateException("Failed to write file: " + file.relativePath(), e);
        }
    }

    private void move(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            logger.debug("Atomic move not supported for {}, falling back to replace", target);
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private void deleteQuietly(Path path) {
        if (path == null) {
            return;
        }
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            logger.warn("Could not delete temporary file {}: {}", path, e.getMessage());
        }
    }
}
