package dev.whitespace.tagger.document;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Expands the paths given on the command line into source files. Files are taken as they are; directories
 * are walked for files with a configured extension, skipping {@code .git}.
 */
public class SourceFileFinder {

    public List<SourceFile> find(List<Path> paths, Set<String> extensions) {
        Objects.requireNonNull(paths, "paths");
        Objects.requireNonNull(extensions, "extensions");
        List<SourceFile> files = new ArrayList<>();
        for (Path path : paths) {
            if (Files.isDirectory(path)) {
                files.addAll(walk(path, extensions));
            } else if (Files.isRegularFile(path)) {
                Path parent = path.toAbsolutePath().getParent();
                files.add(new SourceFile(parent, path.getFileName().toString()));
            } else {
                throw new UncheckedIOException(new IOException("No such file or directory: " + path));
            }
        }
        return files;
    }

    private List<SourceFile> walk(Path directory, Set<String> extensions) {
        try (Stream<Path> stream = Files.walk(directory)) {
            return stream
                    .filter(Files::isRegularFile)
                    .map(directory::relativize)
                    .filter(relative -> !isInsideGitDirectory(relative))
                    .filter(relative -> hasExtension(relative, extensions))
                    .map(relative -> new SourceFile(directory, relative.toString()))
                    .sorted((left, right) -> left.relativePath().compareTo(right.relativePath()))
                    .collect(Collectors.toList());
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to scan directory: " + directory, ex);
        }
    }

    private static boolean isInsideGitDirectory(Path relative) {
        for (Path element : relative) {
            if (element.toString().equals(".git")) {
                return true;
            }
        }
        return false;
    }

    private static boolean hasExtension(Path relative, Set<String> extensions) {
        String name = relative.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 && extensions.contains(name.substring(dot + 1).toLowerCase(Locale.ROOT));
    }
}
