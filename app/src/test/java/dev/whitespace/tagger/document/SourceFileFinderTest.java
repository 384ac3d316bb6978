package dev.whitespace.tagger.document;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SourceFileFinderTest {

    @TempDir
    Path tempDir;

    private final SourceFileFinder finder = new SourceFileFinder();

    @Test
    void walksDirectoriesForMatchingExtensions() throws Exception {
        Files.createDirectories(tempDir.resolve("Sources/App"));
        Files.createDirectories(tempDir.resolve(".git/objects"));
        Files.writeString(tempDir.resolve("Sources/App/View.swift"), "");
        Files.writeString(tempDir.resolve("Sources/App/Model.SWIFT"), "");
        Files.writeString(tempDir.resolve("Sources/README.md"), "");
        Files.writeString(tempDir.resolve(".git/objects/stale.swift"), "");

        List<SourceFile> files = finder.find(List.of(tempDir), Set.of("swift"));

        assertThat(files).extracting(SourceFile::relativePath)
                .containsExactly("Sources/App/Model.SWIFT", "Sources/App/View.swift");
        assertThat(files).allSatisfy(file -> assertThat(file.root()).isEqualTo(tempDir));
    }

    @Test
    void explicitFilesAreTakenRegardlessOfExtension() throws Exception {
        Path file = Files.writeString(tempDir.resolve("notes.txt"), "");

        List<SourceFile> files = finder.find(List.of(file), Set.of("swift"));

        assertThat(files).singleElement().satisfies(source -> {
            assertThat(source.relativePath()).isEqualTo("notes.txt");
            assertThat(source.path()).isEqualTo(file.toAbsolutePath());
        });
    }

    @Test
    void missingPathFails() {
        assertThatThrownBy(() -> finder.find(List.of(tempDir.resolve("absent")), Set.of("swift")))
                .isInstanceOf(UncheckedIOException.class)
                .hasMessageContaining("absent");
    }
}
