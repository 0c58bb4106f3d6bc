package com.codeprism.core.renderer;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * One output file, addressed relative to the render target.
 *
 * @param relativePath relative path for the file (e.g., "transformer/analysis_result.json")
 * @param content file content
 * @param contentType MIME type, may be null
 */
public record GeneratedFile(
    String relativePath,
    String content,
    String contentType
) {
    public static final String JSON = "application/json";
    public static final String MARKDOWN = "text/markdown";

    public GeneratedFile {
        Objects.requireNonNull(relativePath, "relativePath must not be null");
        Objects.requireNonNull(content, "content must not be null");
        if (relativePath.isBlank()) {
            throw new IllegalArgumentException("relativePath must not be blank");
        }
    }

    public static GeneratedFile json(String relativePath, String content) {
        return new GeneratedFile(relativePath, content, JSON);
    }

    public static GeneratedFile markdown(String relativePath, String content) {
        return new GeneratedFile(relativePath, content, MARKDOWN);
    }

    /**
     * @return content length in UTF-8 bytes
     */
    public int sizeInBytes() {
        return content.getBytes(StandardCharsets.UTF_8).length;
    }

    public boolean hasContentType() {
        return contentType != null && !contentType.isEmpty();
    }
}
