package dev.whitespace.tagger.document;

import java.nio.file.Path;
import java.util.Objects;

/**
 * A file to check, addressed relative to the workspace it was found in.
 */
public record SourceFile(Path root, String relativePath) {

    public SourceFile {
        Objects.requireNonNull(root, "root");
        if (relativePath == null || relativePath.isBlank()) {
            throw new IllegalArgumentException("relativePath must not be blank");
        }
        relativePath = relativePath.replace('\\', '/');
    }

    public Path path() {
        return root.resolve(relativePath);
    }
}
