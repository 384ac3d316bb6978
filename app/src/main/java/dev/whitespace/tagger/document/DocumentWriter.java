package dev.whitespace.tagger.document;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;

/**
 * Writes corrected documents back into the workspace. The Git index is not touched.
 */
public class DocumentWriter {

    /**
     * @param root         workspace root
     * @param relativePath file path relative to {@code root}
     * @param lines        lines including their terminators, as produced by {@link DocumentReader}
     */
    public void write(Path root, String relativePath, List<String> lines) {
        if (root == null || relativePath == null || lines == null) {
            throw new IllegalArgumentException("root, relativePath and lines must be provided");
        }
        Path target = root.resolve(relativePath);
        try {
            Path parent = target.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(target, String.join("", lines), StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to write corrected document: " + target, ex);
        }
    }
}
