package dev.whitespace.tagger.config;

import dev.whitespace.tagger.document.LineRange;
import dev.whitespace.tagger.tagging.IndentationStyle;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Immutable runtime configuration assembled from CLI arguments, environment values and defaults.
 *
 * @param mode             detect or correct
 * @param indentationStyle indentation convention the files are checked against
 * @param lineRange        lines that correct mode may rewrite
 * @param changedOnly      whether to check the changed files of the Git work tree instead of {@code paths}
 * @param extensions       file extensions considered when scanning directories and work trees
 * @param logFormat        console log format
 * @param paths            files or directories to check
 */
public record Config(
        Mode mode,
        IndentationStyle indentationStyle,
        LineRange lineRange,
        boolean changedOnly,
        Set<String> extensions,
        LogFormat logFormat,
        List<Path> paths
) {

    public Config {
        Objects.requireNonNull(mode, "mode");
        Objects.requireNonNull(indentationStyle, "indentationStyle");
        lineRange = lineRange == null ? LineRange.all() : lineRange;
        Objects.requireNonNull(logFormat, "logFormat");
        extensions = extensions == null ? Set.of() : extensions.stream()
                .map(Config::normalizeExtension)
                .filter(value -> !value.isBlank())
                .collect(Collectors.toCollection(LinkedHashSet::new));
        if (extensions.isEmpty()) {
            throw new IllegalArgumentException("At least one file extension must be configured");
        }
        extensions = Set.copyOf(extensions);
        paths = paths == null ? List.of() : List.copyOf(paths);
        if (changedOnly && paths.size() > 1) {
            throw new IllegalArgumentException("--changed accepts at most one work tree path");
        }
    }

    static String normalizeExtension(String raw) {
        String normalized = raw.trim();
        if (normalized.startsWith(".")) {
            normalized = normalized.substring(1);
        }
        return normalized.toLowerCase(Locale.ROOT);
    }
}
