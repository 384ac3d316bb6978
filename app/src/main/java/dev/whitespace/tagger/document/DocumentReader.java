package dev.whitespace.tagger.document;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Reads a source file as UTF-8 lines. Each line keeps its terminator so that writing the lines back
 * reproduces the file byte for byte.
 */
public class DocumentReader {

    public List<String> read(Path file) {
        Objects.requireNonNull(file, "file");
        try {
            return splitLines(Files.readString(file, StandardCharsets.UTF_8));
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read document: " + file, ex);
        }
    }

    static List<String> splitLines(String content) {
        List<String> lines = new ArrayList<>();
        int lineStart = 0;
        int index = 0;
        while (index < content.length()) {
            char ch = content.charAt(index++);
            if (ch == '\r' && index < content.length() && content.charAt(index) == '\n') {
                index++;
            } else if (ch != '\n' && ch != '\r') {
                continue;
            }
            lines.add(content.substring(lineStart, index));
            lineStart = index;
        }
        if (lineStart < content.length()) {
            lines.add(content.substring(lineStart));
        }
        return lines;
    }
}
